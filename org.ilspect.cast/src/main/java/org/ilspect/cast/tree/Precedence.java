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

/** Operator precedence levels, tightest binding highest. */
public final class Precedence {

  private Precedence() {}

  public static final int PRIMARY = 15;
  public static final int UNARY = 14;
  public static final int MULTIPLICATIVE = 13;
  public static final int ADDITIVE = 12;
  public static final int SHIFT = 11;
  public static final int RELATIONAL_AND_TYPE_TESTING = 10;
  public static final int EQUALITY = 9;
  public static final int BITWISE_AND = 8;
  public static final int EXCLUSIVE_OR = 7;
  public static final int BITWISE_OR = 6;
  public static final int CONDITIONAL_AND = 5;
  public static final int CONDITIONAL_OR = 4;
  public static final int NULL_COALESCING = 3;
  public static final int CONDITIONAL = 2;
  public static final int ASSIGNMENT = 1;
}
