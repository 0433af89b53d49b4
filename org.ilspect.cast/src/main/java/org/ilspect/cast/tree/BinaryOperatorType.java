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
package org.ilspect.cast.tree;

public enum BinaryOperatorType {
  BITWISE_AND("&", Precedence.BITWISE_AND),
  BITWISE_OR("|", Precedence.BITWISE_OR),
  CONDITIONAL_AND("&&", Precedence.CONDITIONAL_AND),
  CONDITIONAL_OR("||", Precedence.CONDITIONAL_OR),
  EXCLUSIVE_OR("^", Precedence.EXCLUSIVE_OR),
  GREATER_THAN(">", Precedence.RELATIONAL_AND_TYPE_TESTING),
  GREATER_THAN_OR_EQUAL(">=", Precedence.RELATIONAL_AND_TYPE_TESTING),
  EQUALITY("==", Precedence.EQUALITY),
  INEQUALITY("!=", Precedence.EQUALITY),
  LESS_THAN("<", Precedence.RELATIONAL_AND_TYPE_TESTING),
  LESS_THAN_OR_EQUAL("<=", Precedence.RELATIONAL_AND_TYPE_TESTING),
  ADD("+", Precedence.ADDITIVE),
  SUBTRACT("-", Precedence.ADDITIVE),
  MULTIPLY("*", Precedence.MULTIPLICATIVE),
  DIVIDE("/", Precedence.MULTIPLICATIVE),
  MODULUS("%", Precedence.MULTIPLICATIVE),
  SHIFT_LEFT("<<", Precedence.SHIFT),
  SHIFT_RIGHT(">>", Precedence.SHIFT),
  NULL_COALESCING("??", Precedence.NULL_COALESCING);

  private final String symbol;

  private final int precedence;

  BinaryOperatorType(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getPrecedence() {
    return precedence;
  }

  /** {@code ??} groups to the right, everything else to the left */
  public boolean isRightAssociative() {
    return this == NULL_COALESCING;
  }
}
