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

/** {@code condition ? trueExpression : falseExpression} */
public class ConditionalExpression extends Expression {

  private Expression condition;

  private Expression trueExpression;

  private Expression falseExpression;

  public ConditionalExpression(
      Expression condition, Expression trueExpression, Expression falseExpression) {
    setCondition(condition);
    setTrueExpression(trueExpression);
    setFalseExpression(falseExpression);
  }

  public Expression getCondition() {
    return condition;
  }

  public void setCondition(Expression condition) {
    orphan(this.condition);
    this.condition = adopt(condition);
  }

  public Expression getTrueExpression() {
    return trueExpression;
  }

  public void setTrueExpression(Expression trueExpression) {
    orphan(this.trueExpression);
    this.trueExpression = adopt(trueExpression);
  }

  public Expression getFalseExpression() {
    return falseExpression;
  }

  public void setFalseExpression(Expression falseExpression) {
    orphan(this.falseExpression);
    this.falseExpression = adopt(falseExpression);
  }

  @Override
  public List<AstNode> getChildren() {
    return children(condition, trueExpression, falseExpression);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitConditionalExpression(this);
  }

  @Override
  public ConditionalExpression clone() {
    return copyAnnotations(
        this,
        new ConditionalExpression(
            cloneOrNull(condition, Expression.class),
            cloneOrNull(trueExpression, Expression.class),
            cloneOrNull(falseExpression, Expression.class)));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == condition) {
      setCondition((Expression) replacement);
    } else if (old == trueExpression) {
      setTrueExpression((Expression) replacement);
    } else if (old == falseExpression) {
      setFalseExpression((Expression) replacement);
    } else {
      return false;
    }
    return true;
  }
}
