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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@code { a, b }}, as an array, collection or object initializer */
public class ArrayInitializerExpression extends Expression {

  private final NodeList<Expression> elements = new NodeList<>(this, Expression.class);

  public ArrayInitializerExpression() {
    this(Collections.<Expression>emptyList());
  }

  public ArrayInitializerExpression(List<? extends Expression> elements) {
    this.elements.addAll(elements);
  }

  public NodeList<Expression> getElements() {
    return elements;
  }

  @Override
  public List<AstNode> getChildren() {
    return new ArrayList<>(elements);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitArrayInitializerExpression(this);
  }

  @Override
  public ArrayInitializerExpression clone() {
    ArrayInitializerExpression copy = new ArrayInitializerExpression();
    elements.cloneInto(copy.elements);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return elements.replace(old, replacement);
  }
}
