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

public class BinaryOperatorExpression extends Expression {

  private Expression left;

  private final BinaryOperatorType operator;

  private Expression right;

  public BinaryOperatorExpression(Expression left, BinaryOperatorType operator, Expression right) {
    this.operator = operator;
    setLeft(left);
    setRight(right);
  }

  public Expression getLeft() {
    return left;
  }

  public void setLeft(Expression left) {
    orphan(this.left);
    this.left = adopt(left);
  }

  public BinaryOperatorType getOperator() {
    return operator;
  }

  public Expression getRight() {
    return right;
  }

  public void setRight(Expression right) {
    orphan(this.right);
    this.right = adopt(right);
  }

  @Override
  public List<AstNode> getChildren() {
    return children(left, right);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitBinaryOperatorExpression(this);
  }

  @Override
  public BinaryOperatorExpression clone() {
    return copyAnnotations(
        this,
        new BinaryOperatorExpression(
            cloneOrNull(left, Expression.class), operator, cloneOrNull(right, Expression.class)));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == left) {
      setLeft((Expression) replacement);
      return true;
    }
    if (old == right) {
      setRight((Expression) replacement);
      return true;
    }
    return false;
  }
}
