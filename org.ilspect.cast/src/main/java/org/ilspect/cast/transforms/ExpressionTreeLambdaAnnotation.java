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
package org.ilspect.cast.transforms;

/** Marks a lambda that was rebuilt from expression tree factory calls. */
public final class ExpressionTreeLambdaAnnotation {

  public static final ExpressionTreeLambdaAnnotation INSTANCE =
      new ExpressionTreeLambdaAnnotation();

  private ExpressionTreeLambdaAnnotation() {}

  @Override
  public String toString() {
    return "expression tree lambda";
  }
}
