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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One instruction of a method body. Branch operands are the target {@link Instruction}s (an array
 * of them for {@code switch}), so offsets can be recomputed after editing the stream.
 */
public class Instruction {

  private int offset;

  private OpCode opCode;

  private Object operand;

  public Instruction(OpCode opCode) {
    this(opCode, null);
  }

  public Instruction(OpCode opCode, Object operand) {
    this.opCode = opCode;
    this.operand = operand;
  }

  public int getOffset() {
    return offset;
  }

  public void setOffset(int offset) {
    this.offset = offset;
  }

  public OpCode getOpCode() {
    return opCode;
  }

  public void setOpCode(OpCode opCode) {
    this.opCode = opCode;
  }

  public Object getOperand() {
    return operand;
  }

  public void setOperand(Object operand) {
    this.operand = operand;
  }

  public FlowControl getFlowControl() {
    return opCode.getFlowControl();
  }

  /** encoded size in bytes */
  public int getSize() {
    int size = opCode.getSize();
    OperandType ot = opCode.getOperandType();
    size += ot.getSize();
    if (ot == OperandType.INLINE_SWITCH && operand instanceof Instruction[]) {
      size += 4 * ((Instruction[]) operand).length;
    }
    return size;
  }

  /**
   * the instructions this one may transfer control to, other than falling through; missing
   * {@code switch} targets are skipped
   */
  public List<Instruction> getBranchTargets() {
    if (operand instanceof Instruction) {
      return Collections.singletonList((Instruction) operand);
    } else if (operand instanceof Instruction[]) {
      List<Instruction> targets = new ArrayList<>();
      for (Instruction target : (Instruction[]) operand) {
        if (target != null) {
          targets.add(target);
        }
      }
      return targets;
    } else {
      return Collections.emptyList();
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(String.format("IL_%04x: %s", offset, opCode.getName()));
    if (operand instanceof Instruction) {
      sb.append(String.format(" IL_%04x", ((Instruction) operand).getOffset()));
    } else if (operand instanceof Instruction[]) {
      sb.append(" (");
      Instruction[] targets = (Instruction[]) operand;
      for (int i = 0; i < targets.length; i++) {
        if (i > 0) sb.append(", ");
        sb.append(targets[i] == null ? "null" : String.format("IL_%04x", targets[i].getOffset()));
      }
      sb.append(')');
    } else if (operand != null) {
      sb.append(' ').append(operand);
    }
    return sb.toString();
  }
}
