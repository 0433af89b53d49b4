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

import java.util.List;

/** {@code Name = expression} inside an object or anonymous type initializer */
public class NamedExpression extends Expression {

  private String name;

  private Expression expression;

  public NamedExpression(String name, Expression expression) {
    this.name = name;
    setExpression(expression);
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Expression getExpression() {
    return expression;
  }

  public void setExpression(Expression expression) {
    orphan(this.expression);
    this.expression = adopt(expression);
  }

  @Override
  public List<AstNode> getChildren() {
    return children(expression);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitNamedExpression(this);
  }

  @Override
  public NamedExpression clone() {
    return copyAnnotations(
        this, new NamedExpression(name, cloneOrNull(expression, Expression.class)));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == expression) {
      setExpression((Expression) replacement);
      return true;
    }
    return false;
  }
}
