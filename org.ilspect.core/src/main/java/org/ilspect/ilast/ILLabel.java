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

/** A jump target. Branches refer to labels by identity. */
public class ILLabel extends ILNode {

  private final String name;

  public ILLabel(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean isSafeToAddToEndBinSpans() {
    return true;
  }

  @Override
  int getSlotCount() {
    return 0;
  }

  @Override
  ILNode getSlot(int i) {
    throw new IndexOutOfBoundsException(String.valueOf(i));
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitLabel(this);
  }
}
