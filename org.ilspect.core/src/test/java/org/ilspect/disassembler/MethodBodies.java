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
package org.ilspect.disassembler;

import java.util.Collections;
import org.ilspect.core.cil.ExceptionHandler;
import org.ilspect.core.cil.ExceptionHandlerType;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.LocalVariable;
import org.ilspect.core.cil.MethodBody;
import org.ilspect.core.cil.OpCodes;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.metadata.TypeReference;

/** Small hand-assembled method bodies shared by the disassembler tests. */
final class MethodBodies {

  static final TypeReference PROGRAM = TypeReference.make("Test", "Program");

  private MethodBodies() {}

  static MethodDefinition method(String name, MethodBody body) {
    MethodDefinition m =
        new MethodDefinition(
            PROGRAM, name, TypeReference.system("Void"), true, Collections.emptyList());
    m.setBody(body);
    return m;
  }

  /**
   * <pre>
   * int i = 0;
   * while (i &lt; 5) i++;
   * </pre>
   *
   * with the condition laid out after the body.
   */
  static MethodBody whileLoop() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction cond = new Instruction(OpCodes.LDLOC_0);
    Instruction body = new Instruction(OpCodes.LDLOC_0);
    MethodBody b = new MethodBody();
    b.getVariables().add(new LocalVariable(0, "i", TypeReference.systemValueType("Int32")));
    b.add(
        new Instruction(OpCodes.LDC_I4_0),
        new Instruction(OpCodes.STLOC_0),
        new Instruction(OpCodes.BR_S, cond),
        body,
        new Instruction(OpCodes.LDC_I4_1),
        new Instruction(OpCodes.ADD),
        new Instruction(OpCodes.STLOC_0),
        cond,
        new Instruction(OpCodes.LDC_I4_5),
        new Instruction(OpCodes.BLT_S, body),
        ret);
    b.updateInstructionOffsets();
    return b;
  }

  /**
   * <pre>
   * try { } catch (Exception) { }
   * </pre>
   */
  static MethodBody tryCatch() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction pop = new Instruction(OpCodes.POP);
    MethodBody b = new MethodBody();
    b.add(
        new Instruction(OpCodes.NOP),
        new Instruction(OpCodes.LEAVE_S, ret),
        pop,
        new Instruction(OpCodes.LEAVE_S, ret),
        ret);
    b.updateInstructionOffsets();
    ExceptionHandler eh =
        new ExceptionHandler(ExceptionHandlerType.CATCH)
            .tryRange(b.getInstructions().get(0), pop)
            .handlerRange(pop, ret);
    eh.setCatchType(TypeReference.system("Exception"));
    b.getExceptionHandlers().add(eh);
    return b;
  }

  /** A handler table whose handler overlaps the protected range. */
  static MethodBody overlappingHandler() {
    MethodBody b = tryCatch();
    ExceptionHandler eh = b.getExceptionHandlers().get(0);
    eh.handlerRange(b.getInstructions().get(1), b.getInstructions().get(4));
    return b;
  }

  /** A loop inside a protected region, followed by a finally handler. */
  static MethodBody loopInTryFinally() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction head = new Instruction(OpCodes.NOP);
    Instruction endFinally = new Instruction(OpCodes.ENDFINALLY);
    Instruction finallyStart = new Instruction(OpCodes.NOP);
    MethodBody b = new MethodBody();
    b.add(
        head,
        new Instruction(OpCodes.LDC_I4_1),
        new Instruction(OpCodes.BRTRUE_S, head),
        new Instruction(OpCodes.LEAVE_S, ret),
        finallyStart,
        endFinally,
        ret);
    b.updateInstructionOffsets();
    b.getExceptionHandlers()
        .add(
            new ExceptionHandler(ExceptionHandlerType.FINALLY)
                .tryRange(head, finallyStart)
                .handlerRange(finallyStart, ret));
    return b;
  }

  /**
   * <pre>
   * try { } catch when (true) { }
   * </pre>
   */
  static MethodBody tryFilter() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction filterStart = new Instruction(OpCodes.POP);
    Instruction handlerStart = new Instruction(OpCodes.POP);
    MethodBody b = new MethodBody();
    b.add(
        new Instruction(OpCodes.NOP),
        new Instruction(OpCodes.LEAVE_S, ret),
        filterStart,
        new Instruction(OpCodes.LDC_I4_1),
        new Instruction(OpCodes.ENDFILTER),
        handlerStart,
        new Instruction(OpCodes.LEAVE_S, ret),
        ret);
    b.updateInstructionOffsets();
    ExceptionHandler eh =
        new ExceptionHandler(ExceptionHandlerType.FILTER)
            .tryRange(b.getInstructions().get(0), filterStart)
            .handlerRange(handlerStart, ret);
    eh.setFilterStart(filterStart);
    b.getExceptionHandlers().add(eh);
    return b;
  }

  /** A protected region with a fault handler. */
  static MethodBody tryFault() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction faultStart = new Instruction(OpCodes.NOP);
    MethodBody b = new MethodBody();
    b.add(
        new Instruction(OpCodes.NOP),
        new Instruction(OpCodes.LEAVE_S, ret),
        faultStart,
        new Instruction(OpCodes.ENDFINALLY),
        ret);
    b.updateInstructionOffsets();
    b.getExceptionHandlers()
        .add(
            new ExceptionHandler(ExceptionHandlerType.FAULT)
                .tryRange(b.getInstructions().get(0), faultStart)
                .handlerRange(faultStart, ret));
    return b;
  }

  /**
   * <pre>
   * try { } catch (ArgumentException) { } catch (Exception) { }
   * </pre>
   */
  static MethodBody tryTwoCatches() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction first = new Instruction(OpCodes.POP);
    Instruction second = new Instruction(OpCodes.POP);
    MethodBody b = new MethodBody();
    b.add(
        new Instruction(OpCodes.NOP),
        new Instruction(OpCodes.LEAVE_S, ret),
        first,
        new Instruction(OpCodes.LEAVE_S, ret),
        second,
        new Instruction(OpCodes.LEAVE_S, ret),
        ret);
    b.updateInstructionOffsets();
    Instruction tryStart = b.getInstructions().get(0);
    ExceptionHandler argument =
        new ExceptionHandler(ExceptionHandlerType.CATCH)
            .tryRange(tryStart, first)
            .handlerRange(first, second);
    argument.setCatchType(TypeReference.system("ArgumentException"));
    ExceptionHandler any =
        new ExceptionHandler(ExceptionHandlerType.CATCH)
            .tryRange(tryStart, first)
            .handlerRange(second, ret);
    any.setCatchType(TypeReference.system("Exception"));
    b.getExceptionHandlers().add(argument);
    b.getExceptionHandlers().add(any);
    return b;
  }

  /**
   * <pre>
   * int i = 0;
   * for (;;) { switch (i) { case 0: i = 1; continue; case 1: return; } return; }
   * </pre>
   */
  static MethodBody switchLoop() {
    Instruction ret = new Instruction(OpCodes.RET);
    Instruction head = new Instruction(OpCodes.LDLOC_0);
    Instruction caseZero = new Instruction(OpCodes.LDC_I4_1);
    MethodBody b = new MethodBody();
    b.getVariables().add(new LocalVariable(0, "i", TypeReference.systemValueType("Int32")));
    b.add(
        new Instruction(OpCodes.LDC_I4_0),
        new Instruction(OpCodes.STLOC_0),
        head,
        new Instruction(OpCodes.SWITCH, new Instruction[] {caseZero, ret}),
        new Instruction(OpCodes.BR_S, ret),
        caseZero,
        new Instruction(OpCodes.STLOC_0),
        new Instruction(OpCodes.BR_S, head),
        ret);
    b.updateInstructionOffsets();
    return b;
  }

  /** A {@code switch} whose second target is missing. */
  static MethodBody switchWithMissingTarget() {
    Instruction ret = new Instruction(OpCodes.RET);
    MethodBody b = new MethodBody();
    b.add(
        new Instruction(OpCodes.LDC_I4_0),
        new Instruction(OpCodes.SWITCH, new Instruction[] {ret, null}),
        ret);
    b.updateInstructionOffsets();
    return b;
  }
}
