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

public final class ILExpressionPrefix {

  private final ILCode code;

  private final Object operand;

  public ILExpressionPrefix(ILCode code) {
    this(code, null);
  }

  public ILExpressionPrefix(ILCode code, Object operand) {
    if (!code.isPrefix()) {
      throw new IllegalArgumentException(code + " is not a prefix");
    }
    this.code = code;
    this.operand = operand;
  }

  public ILCode getCode() {
    return code;
  }

  public Object getOperand() {
    return operand;
  }
}
