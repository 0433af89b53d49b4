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

import org.ilspect.core.metadata.TypeReference;

/**
 * One entry of a method's exception handler table. Region ends are exclusive; a null end denotes
 * the end of the method body.
 */
public class ExceptionHandler {

  private final ExceptionHandlerType handlerType;

  private Instruction tryStart;

  private Instruction tryEnd;

  private Instruction filterStart;

  private Instruction handlerStart;

  private Instruction handlerEnd;

  private TypeReference catchType;

  public ExceptionHandler(ExceptionHandlerType handlerType) {
    this.handlerType = handlerType;
  }

  public ExceptionHandlerType getHandlerType() {
    return handlerType;
  }

  public Instruction getTryStart() {
    return tryStart;
  }

  public void setTryStart(Instruction tryStart) {
    this.tryStart = tryStart;
  }

  public Instruction getTryEnd() {
    return tryEnd;
  }

  public void setTryEnd(Instruction tryEnd) {
    this.tryEnd = tryEnd;
  }

  public Instruction getFilterStart() {
    return filterStart;
  }

  public void setFilterStart(Instruction filterStart) {
    this.filterStart = filterStart;
  }

  public Instruction getHandlerStart() {
    return handlerStart;
  }

  public void setHandlerStart(Instruction handlerStart) {
    this.handlerStart = handlerStart;
  }

  public Instruction getHandlerEnd() {
    return handlerEnd;
  }

  public void setHandlerEnd(Instruction handlerEnd) {
    this.handlerEnd = handlerEnd;
  }

  public TypeReference getCatchType() {
    return catchType;
  }

  public void setCatchType(TypeReference catchType) {
    this.catchType = catchType;
  }

  /** convenience for building a handler table */
  public ExceptionHandler tryRange(Instruction start, Instruction end) {
    this.tryStart = start;
    this.tryEnd = end;
    return this;
  }

  public ExceptionHandler handlerRange(Instruction start, Instruction end) {
    this.handlerStart = start;
    this.handlerEnd = end;
    return this;
  }

  @Override
  public String toString() {
    return handlerType
        + " try "
        + offsetOf(tryStart)
        + "-"
        + offsetOf(tryEnd)
        + " handler "
        + offsetOf(handlerStart)
        + "-"
        + offsetOf(handlerEnd);
  }

  private static String offsetOf(Instruction i) {
    return i == null ? "end" : String.format("IL_%04x", i.getOffset());
  }
}
