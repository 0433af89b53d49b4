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

/** A loop; without a condition it runs until left by a branch. */
public class ILWhileLoop extends ILNode {

  private ILExpression condition;

  private ILBlock bodyBlock;

  public ILWhileLoop(ILExpression condition, ILBlock bodyBlock) {
    this.condition = condition;
    this.bodyBlock = bodyBlock;
  }

  public ILExpression getCondition() {
    return condition;
  }

  public void setCondition(ILExpression condition) {
    this.condition = condition;
  }

  public ILBlock getBodyBlock() {
    return bodyBlock;
  }

  public void setBodyBlock(ILBlock bodyBlock) {
    this.bodyBlock = bodyBlock;
  }

  @Override
  int getSlotCount() {
    return 2;
  }

  @Override
  ILNode getSlot(int i) {
    return i == 0 ? condition : bodyBlock;
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitWhileLoop(this);
  }
}
