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

/** A block whose optional entry goto comes logically before the body. */
public class ILBlock extends ILBlockBase {

  private ILExpression entryGoto;

  public ILBlock(ILNode... body) {
    super(body);
  }

  public ILBlock(List<ILNode> body) {
    super(body);
  }

  public ILBlock() {
    super(new ArrayList<>());
  }

  public ILExpression getEntryGoto() {
    return entryGoto;
  }

  public void setEntryGoto(ILExpression entryGoto) {
    this.entryGoto = entryGoto;
  }

  @Override
  int getSlotCount() {
    return getBody().size() + 1;
  }

  @Override
  ILNode getSlot(int i) {
    return i == 0 ? entryGoto : getBody().get(i - 1);
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitBlock(this);
  }
}
