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
import java.util.Arrays;
import java.util.List;

/** The flat instruction stream of a method together with its handler table and locals. */
public class MethodBody {

  private final List<Instruction> instructions = new ArrayList<>();

  private final List<ExceptionHandler> exceptionHandlers = new ArrayList<>();

  private final List<LocalVariable> variables = new ArrayList<>();

  private int maxStack = 8;

  private boolean initLocals = true;

  public List<Instruction> getInstructions() {
    return instructions;
  }

  public List<ExceptionHandler> getExceptionHandlers() {
    return exceptionHandlers;
  }

  public List<LocalVariable> getVariables() {
    return variables;
  }

  public boolean hasVariables() {
    return !variables.isEmpty();
  }

  public int getMaxStack() {
    return maxStack;
  }

  public void setMaxStack(int maxStack) {
    this.maxStack = maxStack;
  }

  public boolean isInitLocals() {
    return initLocals;
  }

  public void setInitLocals(boolean initLocals) {
    this.initLocals = initLocals;
  }

  public MethodBody add(Instruction... insts) {
    instructions.addAll(Arrays.asList(insts));
    return this;
  }

  /** Recomputes every instruction offset from the encoded sizes. */
  public void updateInstructionOffsets() {
    int offset = 0;
    for (Instruction inst : instructions) {
      inst.setOffset(offset);
      offset += inst.getSize();
    }
  }

  /** total size of the encoded instruction stream */
  public int getCodeSize() {
    if (instructions.isEmpty()) {
      return 0;
    }
    Instruction last = instructions.get(instructions.size() - 1);
    return last.getOffset() + last.getSize();
  }
}
