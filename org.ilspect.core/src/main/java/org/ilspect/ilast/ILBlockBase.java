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
import java.util.Arrays;
import java.util.List;
import org.ilspect.core.debug.BinSpan;

/** A statement sequence. Its closing brace has its own spans. */
public abstract class ILBlockBase extends ILNode {

  private final List<ILNode> body;

  private final List<BinSpan> endBinSpans = new ArrayList<>(1);

  ILBlockBase(List<ILNode> body) {
    this.body = body;
  }

  ILBlockBase(ILNode... body) {
    this(new ArrayList<>(Arrays.asList(body)));
  }

  /** the mutable statement list */
  public List<ILNode> getBody() {
    return body;
  }

  @Override
  public List<BinSpan> getEndBinSpans() {
    return endBinSpans;
  }

  @Override
  public boolean isSafeToAddToEndBinSpans() {
    return true;
  }

  @Override
  int getSlotCount() {
    return body.size();
  }

  @Override
  ILNode getSlot(int i) {
    return body.get(i);
  }
}
