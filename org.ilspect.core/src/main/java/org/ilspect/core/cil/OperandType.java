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

public enum OperandType {
  INLINE_NONE(0),
  SHORT_INLINE_BR_TARGET(1),
  SHORT_INLINE_I(1),
  SHORT_INLINE_VAR(1),
  INLINE_VAR(2),
  INLINE_I(4),
  SHORT_INLINE_R(4),
  INLINE_BR_TARGET(4),
  INLINE_FIELD(4),
  INLINE_METHOD(4),
  INLINE_SIG(4),
  INLINE_STRING(4),
  INLINE_TOK(4),
  INLINE_TYPE(4),
  INLINE_I8(8),
  INLINE_R(8),
  /** 4 bytes of count followed by 4 bytes per target */
  INLINE_SWITCH(4);

  private final int size;

  OperandType(int size) {
    this.size = size;
  }

  public int getSize() {
    return size;
  }

  public boolean isBranchTarget() {
    return this == SHORT_INLINE_BR_TARGET || this == INLINE_BR_TARGET;
  }
}
