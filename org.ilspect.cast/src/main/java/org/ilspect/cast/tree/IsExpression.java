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

/** {@code expression is Type} */
public class IsExpression extends Expression {

  private Expression expression;

  private AstType type;

  public IsExpression(Expression expression, AstType type) {
    setExpression(expression);
    setType(type);
  }

  public Expression getExpression() {
    return expression;
  }

  public void setExpression(Expression expression) {
    orphan(this.expression);
    this.expression = adopt(expression);
  }

  public AstType getType() {
    return type;
  }

  public void setType(AstType type) {
    orphan(this.type);
    this.type = adopt(type);
  }

  @Override
  public List<AstNode> getChildren() {
    return children(expression, type);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitIsExpression(this);
  }

  @Override
  public IsExpression clone() {
    return copyAnnotations(
        this,
        new IsExpression(
            cloneOrNull(expression, Expression.class), cloneOrNull(type, AstType.class)));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == expression) {
      setExpression((Expression) replacement);
      return true;
    }
    if (old == type) {
      setType((AstType) replacement);
      return true;
    }
    return false;
  }
}
