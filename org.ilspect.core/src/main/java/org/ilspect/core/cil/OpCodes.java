/*
 * Copyright (c) 2002 - 2024 IBM Corporation.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *
 * Contributors:
 *     IBM Corporation - initial API and implementation
 */
package org.ilspect.core.cil;

import static org.ilspect.core.cil.FlowControl.BRANCH;
import static org.ilspect.core.cil.FlowControl.BREAK;
import static org.ilspect.core.cil.FlowControl.CALL;
import static org.ilspect.core.cil.FlowControl.COND_BRANCH;
import static org.ilspect.core.cil.FlowControl.META;
import static org.ilspect.core.cil.FlowControl.NEXT;
import static org.ilspect.core.cil.FlowControl.RETURN;
import static org.ilspect.core.cil.FlowControl.THROW;
import static org.ilspect.core.cil.OperandType.INLINE_BR_TARGET;
import static org.ilspect.core.cil.OperandType.INLINE_FIELD;
import static org.ilspect.core.cil.OperandType.INLINE_I;
import static org.ilspect.core.cil.OperandType.INLINE_I8;
import static org.ilspect.core.cil.OperandType.INLINE_METHOD;
import static org.ilspect.core.cil.OperandType.INLINE_NONE;
import static org.ilspect.core.cil.OperandType.INLINE_R;
import static org.ilspect.core.cil.OperandType.INLINE_STRING;
import static org.ilspect.core.cil.OperandType.INLINE_SWITCH;
import static org.ilspect.core.cil.OperandType.INLINE_TOK;
import static org.ilspect.core.cil.OperandType.INLINE_TYPE;
import static org.ilspect.core.cil.OperandType.INLINE_VAR;
import static org.ilspect.core.cil.OperandType.SHORT_INLINE_BR_TARGET;
import static org.ilspect.core.cil.OperandType.SHORT_INLINE_I;
import static org.ilspect.core.cil.OperandType.SHORT_INLINE_R;
import static org.ilspect.core.cil.OperandType.SHORT_INLINE_VAR;

import com.ibm.wala.util.collections.HashMapFactory;
import java.util.Collections;
import java.util.Map;

/** The instruction set. */
public final class OpCodes {

  private static final Map<String, OpCode> byName = HashMapFactory.make();

  private OpCodes() {}

  private static OpCode op(String name, int value, FlowControl flow, OperandType operand) {
    OpCode code = new OpCode(name, value, flow, operand);
    byName.put(name, code);
    return code;
  }

  public static final OpCode NOP = op("nop", 0x00, NEXT, INLINE_NONE);
  public static final OpCode BREAK_ = op("break", 0x01, BREAK, INLINE_NONE);
  public static final OpCode LDARG_0 = op("ldarg.0", 0x02, NEXT, INLINE_NONE);
  public static final OpCode LDARG_1 = op("ldarg.1", 0x03, NEXT, INLINE_NONE);
  public static final OpCode LDARG_2 = op("ldarg.2", 0x04, NEXT, INLINE_NONE);
  public static final OpCode LDARG_3 = op("ldarg.3", 0x05, NEXT, INLINE_NONE);
  public static final OpCode LDLOC_0 = op("ldloc.0", 0x06, NEXT, INLINE_NONE);
  public static final OpCode LDLOC_1 = op("ldloc.1", 0x07, NEXT, INLINE_NONE);
  public static final OpCode LDLOC_2 = op("ldloc.2", 0x08, NEXT, INLINE_NONE);
  public static final OpCode LDLOC_3 = op("ldloc.3", 0x09, NEXT, INLINE_NONE);
  public static final OpCode STLOC_0 = op("stloc.0", 0x0a, NEXT, INLINE_NONE);
  public static final OpCode STLOC_1 = op("stloc.1", 0x0b, NEXT, INLINE_NONE);
  public static final OpCode STLOC_2 = op("stloc.2", 0x0c, NEXT, INLINE_NONE);
  public static final OpCode STLOC_3 = op("stloc.3", 0x0d, NEXT, INLINE_NONE);
  public static final OpCode LDARG_S = op("ldarg.s", 0x0e, NEXT, SHORT_INLINE_VAR);
  public static final OpCode LDARGA_S = op("ldarga.s", 0x0f, NEXT, SHORT_INLINE_VAR);
  public static final OpCode STARG_S = op("starg.s", 0x10, NEXT, SHORT_INLINE_VAR);
  public static final OpCode LDLOC_S = op("ldloc.s", 0x11, NEXT, SHORT_INLINE_VAR);
  public static final OpCode LDLOCA_S = op("ldloca.s", 0x12, NEXT, SHORT_INLINE_VAR);
  public static final OpCode STLOC_S = op("stloc.s", 0x13, NEXT, SHORT_INLINE_VAR);
  public static final OpCode LDNULL = op("ldnull", 0x14, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_M1 = op("ldc.i4.m1", 0x15, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_0 = op("ldc.i4.0", 0x16, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_1 = op("ldc.i4.1", 0x17, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_2 = op("ldc.i4.2", 0x18, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_3 = op("ldc.i4.3", 0x19, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_4 = op("ldc.i4.4", 0x1a, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_5 = op("ldc.i4.5", 0x1b, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_6 = op("ldc.i4.6", 0x1c, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_7 = op("ldc.i4.7", 0x1d, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_8 = op("ldc.i4.8", 0x1e, NEXT, INLINE_NONE);
  public static final OpCode LDC_I4_S = op("ldc.i4.s", 0x1f, NEXT, SHORT_INLINE_I);
  public static final OpCode LDC_I4 = op("ldc.i4", 0x20, NEXT, INLINE_I);
  public static final OpCode LDC_I8 = op("ldc.i8", 0x21, NEXT, INLINE_I8);
  public static final OpCode LDC_R4 = op("ldc.r4", 0x22, NEXT, SHORT_INLINE_R);
  public static final OpCode LDC_R8 = op("ldc.r8", 0x23, NEXT, INLINE_R);
  public static final OpCode DUP = op("dup", 0x25, NEXT, INLINE_NONE);
  public static final OpCode POP = op("pop", 0x26, NEXT, INLINE_NONE);
  public static final OpCode JMP = op("jmp", 0x27, CALL, INLINE_METHOD);
  public static final OpCode CALL_ = op("call", 0x28, CALL, INLINE_METHOD);
  public static final OpCode RET = op("ret", 0x2a, RETURN, INLINE_NONE);
  public static final OpCode BR_S = op("br.s", 0x2b, BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BRFALSE_S = op("brfalse.s", 0x2c, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BRTRUE_S = op("brtrue.s", 0x2d, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BEQ_S = op("beq.s", 0x2e, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BGE_S = op("bge.s", 0x2f, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BGT_S = op("bgt.s", 0x30, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BLE_S = op("ble.s", 0x31, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BLT_S = op("blt.s", 0x32, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BNE_UN_S = op("bne.un.s", 0x33, COND_BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode BR = op("br", 0x38, BRANCH, INLINE_BR_TARGET);
  public static final OpCode BRFALSE = op("brfalse", 0x39, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BRTRUE = op("brtrue", 0x3a, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BEQ = op("beq", 0x3b, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BGE = op("bge", 0x3c, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BGT = op("bgt", 0x3d, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BLE = op("ble", 0x3e, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BLT = op("blt", 0x3f, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode BNE_UN = op("bne.un", 0x40, COND_BRANCH, INLINE_BR_TARGET);
  public static final OpCode SWITCH = op("switch", 0x45, COND_BRANCH, INLINE_SWITCH);
  public static final OpCode LDIND_I4 = op("ldind.i4", 0x4a, NEXT, INLINE_NONE);
  public static final OpCode LDIND_REF = op("ldind.ref", 0x50, NEXT, INLINE_NONE);
  public static final OpCode STIND_I4 = op("stind.i4", 0x54, NEXT, INLINE_NONE);
  public static final OpCode ADD = op("add", 0x58, NEXT, INLINE_NONE);
  public static final OpCode SUB = op("sub", 0x59, NEXT, INLINE_NONE);
  public static final OpCode MUL = op("mul", 0x5a, NEXT, INLINE_NONE);
  public static final OpCode DIV = op("div", 0x5b, NEXT, INLINE_NONE);
  public static final OpCode REM = op("rem", 0x5d, NEXT, INLINE_NONE);
  public static final OpCode AND = op("and", 0x5f, NEXT, INLINE_NONE);
  public static final OpCode OR = op("or", 0x60, NEXT, INLINE_NONE);
  public static final OpCode XOR = op("xor", 0x61, NEXT, INLINE_NONE);
  public static final OpCode SHL = op("shl", 0x62, NEXT, INLINE_NONE);
  public static final OpCode SHR = op("shr", 0x63, NEXT, INLINE_NONE);
  public static final OpCode NEG = op("neg", 0x65, NEXT, INLINE_NONE);
  public static final OpCode NOT = op("not", 0x66, NEXT, INLINE_NONE);
  public static final OpCode CONV_I4 = op("conv.i4", 0x69, NEXT, INLINE_NONE);
  public static final OpCode CONV_I8 = op("conv.i8", 0x6a, NEXT, INLINE_NONE);
  public static final OpCode CALLVIRT = op("callvirt", 0x6f, CALL, INLINE_METHOD);
  public static final OpCode LDOBJ = op("ldobj", 0x71, NEXT, INLINE_TYPE);
  public static final OpCode LDSTR = op("ldstr", 0x72, NEXT, INLINE_STRING);
  public static final OpCode NEWOBJ = op("newobj", 0x73, CALL, INLINE_METHOD);
  public static final OpCode CASTCLASS = op("castclass", 0x74, NEXT, INLINE_TYPE);
  public static final OpCode ISINST = op("isinst", 0x75, NEXT, INLINE_TYPE);
  public static final OpCode UNBOX = op("unbox", 0x79, NEXT, INLINE_TYPE);
  public static final OpCode THROW_ = op("throw", 0x7a, THROW, INLINE_NONE);
  public static final OpCode LDFLD = op("ldfld", 0x7b, NEXT, INLINE_FIELD);
  public static final OpCode LDFLDA = op("ldflda", 0x7c, NEXT, INLINE_FIELD);
  public static final OpCode STFLD = op("stfld", 0x7d, NEXT, INLINE_FIELD);
  public static final OpCode LDSFLD = op("ldsfld", 0x7e, NEXT, INLINE_FIELD);
  public static final OpCode STSFLD = op("stsfld", 0x80, NEXT, INLINE_FIELD);
  public static final OpCode BOX = op("box", 0x8c, NEXT, INLINE_TYPE);
  public static final OpCode NEWARR = op("newarr", 0x8d, NEXT, INLINE_TYPE);
  public static final OpCode LDLEN = op("ldlen", 0x8e, NEXT, INLINE_NONE);
  public static final OpCode LDELEMA = op("ldelema", 0x8f, NEXT, INLINE_TYPE);
  public static final OpCode LDELEM_I4 = op("ldelem.i4", 0x94, NEXT, INLINE_NONE);
  public static final OpCode LDELEM_REF = op("ldelem.ref", 0x9a, NEXT, INLINE_NONE);
  public static final OpCode STELEM_I4 = op("stelem.i4", 0x9e, NEXT, INLINE_NONE);
  public static final OpCode STELEM_REF = op("stelem.ref", 0xa2, NEXT, INLINE_NONE);
  public static final OpCode UNBOX_ANY = op("unbox.any", 0xa5, NEXT, INLINE_TYPE);
  public static final OpCode LDTOKEN = op("ldtoken", 0xd0, NEXT, INLINE_TOK);
  public static final OpCode ADD_OVF = op("add.ovf", 0xd6, NEXT, INLINE_NONE);
  public static final OpCode MUL_OVF = op("mul.ovf", 0xd8, NEXT, INLINE_NONE);
  public static final OpCode SUB_OVF = op("sub.ovf", 0xda, NEXT, INLINE_NONE);
  public static final OpCode ENDFINALLY = op("endfinally", 0xdc, RETURN, INLINE_NONE);
  public static final OpCode LEAVE = op("leave", 0xdd, BRANCH, INLINE_BR_TARGET);
  public static final OpCode LEAVE_S = op("leave.s", 0xde, BRANCH, SHORT_INLINE_BR_TARGET);
  public static final OpCode CEQ = op("ceq", 0xfe01, NEXT, INLINE_NONE);
  public static final OpCode CGT = op("cgt", 0xfe02, NEXT, INLINE_NONE);
  public static final OpCode CLT = op("clt", 0xfe04, NEXT, INLINE_NONE);
  public static final OpCode LDFTN = op("ldftn", 0xfe06, NEXT, INLINE_METHOD);
  public static final OpCode LDARG = op("ldarg", 0xfe09, NEXT, INLINE_VAR);
  public static final OpCode LDLOC = op("ldloc", 0xfe0c, NEXT, INLINE_VAR);
  public static final OpCode STLOC = op("stloc", 0xfe0e, NEXT, INLINE_VAR);
  public static final OpCode ENDFILTER = op("endfilter", 0xfe11, RETURN, INLINE_NONE);
  public static final OpCode VOLATILE = op("volatile.", 0xfe13, META, INLINE_NONE);
  public static final OpCode TAIL = op("tail.", 0xfe14, META, INLINE_NONE);
  public static final OpCode INITOBJ = op("initobj", 0xfe15, NEXT, INLINE_TYPE);
  public static final OpCode CONSTRAINED = op("constrained.", 0xfe16, META, INLINE_TYPE);
  public static final OpCode RETHROW = op("rethrow", 0xfe1a, THROW, INLINE_NONE);
  public static final OpCode SIZEOF = op("sizeof", 0xfe1c, NEXT, INLINE_TYPE);

  public static OpCode lookup(String name) {
    return byName.get(name);
  }

  public static Map<String, OpCode> all() {
    return Collections.unmodifiableMap(byName);
  }
}
