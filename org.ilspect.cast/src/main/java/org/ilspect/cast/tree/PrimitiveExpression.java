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

import java.util.Collections;
import java.util.List;

/**
 * A literal: a boxed number, {@link Boolean}, {@link Character} or {@link String}. The null literal
 * is a {@link NullReferenceExpression}.
 */
public class PrimitiveExpression extends Expression {

  private final Object value;

  public PrimitiveExpression(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("use NullReferenceExpression for null");
    }
    this.value = value;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public List<AstNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitPrimitiveExpression(this);
  }

  @Override
  public PrimitiveExpression clone() {
    return copyAnnotations(this, new PrimitiveExpression(value));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return false;
  }
}
