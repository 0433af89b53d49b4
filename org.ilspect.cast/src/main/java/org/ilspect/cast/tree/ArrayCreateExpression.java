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
import java.util.List;

/**
 * {@code new Type[arguments][]... { initializer }}. A null element type prints as an implicitly
 * typed array, {@code new[] { ... }}. Additional array specifiers hold ranks.
 */
public class ArrayCreateExpression extends Expression {

  private AstType type;

  private final NodeList<Expression> arguments = new NodeList<>(this, Expression.class);

  private final List<Integer> additionalArraySpecifiers = new ArrayList<>(1);

  private ArrayInitializerExpression initializer;

  public ArrayCreateExpression(AstType type) {
    setType(type);
  }

  /** element type, or null */
  public AstType getType() {
    return type;
  }

  public void setType(AstType type) {
    orphan(this.type);
    this.type = adopt(type);
  }

  public NodeList<Expression> getArguments() {
    return arguments;
  }

  public List<Integer> getAdditionalArraySpecifiers() {
    return additionalArraySpecifiers;
  }

  /** the initializer, or null */
  public ArrayInitializerExpression getInitializer() {
    return initializer;
  }

  public void setInitializer(ArrayInitializerExpression initializer) {
    orphan(this.initializer);
    this.initializer = adopt(initializer);
  }

  @Override
  public List<AstNode> getChildren() {
    List<AstNode> result = children(type);
    result.addAll(new ArrayList<>(arguments));
    result.addAll(children(initializer));
    return result;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitArrayCreateExpression(this);
  }

  @Override
  public ArrayCreateExpression clone() {
    ArrayCreateExpression copy = new ArrayCreateExpression(cloneOrNull(type, AstType.class));
    arguments.cloneInto(copy.arguments);
    copy.additionalArraySpecifiers.addAll(additionalArraySpecifiers);
    copy.setInitializer(cloneOrNull(initializer, ArrayInitializerExpression.class));
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == type) {
      setType((AstType) replacement);
      return true;
    }
    if (old == initializer) {
      setInitializer((ArrayInitializerExpression) replacement);
      return true;
    }
    return arguments.replace(old, replacement);
  }
}
