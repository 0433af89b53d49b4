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

public final class OpCode {

  private final String name;

  private final int value;

  private final FlowControl flowControl;

  private final OperandType operandType;

  OpCode(String name, int value, FlowControl flowControl, OperandType operandType) {
    this.name = name;
    this.value = value;
    this.flowControl = flowControl;
    this.operandType = operandType;
  }

  public String getName() {
    return name;
  }

  public int getValue() {
    return value;
  }

  /** encoded size of the opcode itself; two-byte opcodes carry the 0xFE prefix */
  public int getSize() {
    return value > 0xff ? 2 : 1;
  }

  public FlowControl getFlowControl() {
    return flowControl;
  }

  public OperandType getOperandType() {
    return operandType;
  }

  @Override
  public String toString() {
    return name;
  }
}
