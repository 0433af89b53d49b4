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

/** {@code (Type)expression} */
public class CastExpression extends Expression {

  private AstType type;

  private Expression expression;

  public CastExpression(AstType type, Expression expression) {
    setType(type);
    setExpression(expression);
  }

  public AstType getType() {
    return type;
  }

  public void setType(AstType type) {
    orphan(this.type);
    this.type = adopt(type);
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
    return children(type, expression);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCastExpression(this);
  }

  @Override
  public CastExpression clone() {
    return copyAnnotations(
        this,
        new CastExpression(
            cloneOrNull(type, AstType.class), cloneOrNull(expression, Expression.class)));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == type) {
      setType((AstType) replacement);
      return true;
    }
    if (old == expression) {
      setExpression((Expression) replacement);
      return true;
    }
    return false;
  }
}
