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

/** {@code return expression;} where the expression may be absent */
public class ReturnStatement extends Statement {

  private Expression expression;

  public ReturnStatement(Expression expression) {
    setExpression(expression);
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
    return visitor.visitReturnStatement(this);
  }

  @Override
  public ReturnStatement clone() {
    return copyAnnotations(this, new ReturnStatement(cloneOrNull(expression, Expression.class)));
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
