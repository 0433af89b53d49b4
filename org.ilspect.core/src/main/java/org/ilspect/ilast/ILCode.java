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
package org.ilspect.ilast;

import java.util.Locale;

/**
 * Opcodes of the IL AST. The first group mirrors the instruction set, the second group holds the
 * pseudo opcodes introduced by later transforms.
 */
public enum ILCode {
  NOP,
  POP,
  DUP,
  LDARG,
  LDARGA,
  STARG,
  LDLOC,
  LDLOCA,
  STLOC,
  LDNULL,
  LDC_I4,
  LDC_I8,
  LDC_R4,
  LDC_R8,
  LDSTR,
  LDTOKEN,
  LDFTN,
  LDFLD,
  LDFLDA,
  STFLD,
  LDSFLD,
  STSFLD,
  LDOBJ,
  LDIND,
  STIND,
  CALL,
  CALLI,
  CALLVIRT,
  NEWOBJ,
  NEWARR,
  LDLEN,
  LDELEM,
  LDELEMA,
  STELEM,
  BOX,
  UNBOX,
  UNBOX_ANY,
  CASTCLASS,
  ISINST,
  INITOBJ,
  SIZEOF,
  ADD,
  SUB,
  MUL,
  DIV,
  REM,
  ADD_OVF,
  SUB_OVF,
  MUL_OVF,
  AND,
  OR,
  XOR,
  SHL,
  SHR,
  NEG,
  NOT,
  CEQ,
  CGT,
  CLT,
  CONV_I4,
  CONV_I8,
  BR,
  BRTRUE,
  SWITCH,
  LEAVE,
  ENDFINALLY,
  ENDFILTER,
  RET,
  THROW,
  RETHROW,

  // prefixes
  VOLATILE,
  TAIL,
  CONSTRAINED,
  READONLY,
  UNALIGNED,
  NO,

  // pseudo opcodes
  LOGIC_NOT("LogicNot"),
  LOGIC_AND("LogicAnd"),
  LOGIC_OR("LogicOr"),
  NULL_COALESCING("NullCoalescing"),
  TERNARY_OP("TernaryOp"),
  LOOP_OR_SWITCH_BREAK("LoopOrSwitchBreak"),
  LOOP_CONTINUE("LoopContinue"),
  LDC_DECIMAL("Ldc_Decimal"),
  YIELD_BREAK("YieldBreak"),
  YIELD_RETURN("YieldReturn"),
  DEFAULT_VALUE("DefaultValue"),
  INIT_ARRAY("InitArray"),
  INIT_OBJECT("InitObject"),
  INIT_COLLECTION("InitCollection"),
  CALL_GETTER("CallGetter"),
  CALLVIRT_GETTER("CallvirtGetter"),
  CALL_SETTER("CallSetter"),
  CALLVIRT_SETTER("CallvirtSetter"),
  ADDRESS_OF("AddressOf"),
  VALUE_OF("ValueOf"),
  NULLABLE_OF("NullableOf"),
  COMPOUND_ASSIGNMENT("CompoundAssignment"),
  POST_INCREMENT("PostIncrement"),
  AWAIT("Await"),
  WRAP("Wrap");

  private final String name;

  ILCode() {
    this.name = name().toLowerCase(Locale.ROOT).replace('_', '.');
  }

  ILCode(String name) {
    this.name = name;
  }

  /** the textual name, e.g. {@code ldc.i4} or {@code CallGetter} */
  public String getName() {
    return name;
  }

  public boolean isPrefix() {
    switch (this) {
      case VOLATILE:
      case TAIL:
      case CONSTRAINED:
      case READONLY:
      case UNALIGNED:
      case NO:
        return true;
      default:
        return false;
    }
  }

  public boolean isConditionalControlFlow() {
    return this == BRTRUE || this == SWITCH;
  }

  public boolean isUnconditionalControlFlow() {
    switch (this) {
      case BR:
      case LEAVE:
      case RET:
      case ENDFINALLY:
      case THROW:
      case RETHROW:
      case LOOP_CONTINUE:
      case LOOP_OR_SWITCH_BREAK:
      case YIELD_BREAK:
        return true;
      default:
        return false;
    }
  }

  /** whether the code invokes a method, directly or through a property accessor */
  public boolean isCall() {
    switch (this) {
      case CALL:
      case CALLI:
      case CALLVIRT:
      case CALL_GETTER:
      case CALLVIRT_GETTER:
      case CALL_SETTER:
      case CALLVIRT_SETTER:
        return true;
      default:
        return false;
    }
  }
}
