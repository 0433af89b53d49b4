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
package org.ilspect.ilast;

public class ILCondition extends ILNode {

  private ILExpression condition;

  /** taken when the condition holds */
  private ILBlock trueBlock;

  /** the fall-through path, may be null */
  private ILBlock falseBlock;

  public ILCondition(ILExpression condition, ILBlock trueBlock, ILBlock falseBlock) {
    this.condition = condition;
    this.trueBlock = trueBlock;
    this.falseBlock = falseBlock;
  }

  public ILExpression getCondition() {
    return condition;
  }

  public void setCondition(ILExpression condition) {
    this.condition = condition;
  }

  public ILBlock getTrueBlock() {
    return trueBlock;
  }

  public void setTrueBlock(ILBlock trueBlock) {
    this.trueBlock = trueBlock;
  }

  public ILBlock getFalseBlock() {
    return falseBlock;
  }

  public void setFalseBlock(ILBlock falseBlock) {
    this.falseBlock = falseBlock;
  }

  @Override
  int getSlotCount() {
    return 3;
  }

  @Override
  ILNode getSlot(int i) {
    switch (i) {
      case 0:
        return condition;
      case 1:
        return trueBlock;
      case 2:
        return falseBlock;
      default:
        throw new IndexOutOfBoundsException(String.valueOf(i));
    }
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitCondition(this);
  }
}
