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

import java.util.ArrayList;
import java.util.List;

/** Pins the initialized variables for the duration of the body. */
public class ILFixedStatement extends ILNode {

  private final List<ILExpression> initializers = new ArrayList<>();

  private ILBlock bodyBlock;

  public ILFixedStatement(List<ILExpression> initializers, ILBlock bodyBlock) {
    this.initializers.addAll(initializers);
    this.bodyBlock = bodyBlock;
  }

  public List<ILExpression> getInitializers() {
    return initializers;
  }

  public ILBlock getBodyBlock() {
    return bodyBlock;
  }

  public void setBodyBlock(ILBlock bodyBlock) {
    this.bodyBlock = bodyBlock;
  }

  @Override
  int getSlotCount() {
    return initializers.size() + 1;
  }

  @Override
  ILNode getSlot(int i) {
    return i < initializers.size() ? initializers.get(i) : bodyBlock;
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitFixedStatement(this);
  }
}
