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
import org.ilspect.core.debug.BinSpan;

public class ILSwitch extends ILNode {

  public static class CaseBlock extends ILBlock {

    /** matched values; null for the default case */
    private List<Integer> values;

    public CaseBlock(List<Integer> values, List<ILNode> body) {
      super(body);
      this.values = values;
    }

    public List<Integer> getValues() {
      return values;
    }

    public void setValues(List<Integer> values) {
      this.values = values;
    }

    public boolean isDefault() {
      return values == null;
    }

    @Override
    public <R> R accept(ILNodeVisitor<R> visitor) {
      return visitor.visitCaseBlock(this);
    }
  }

  private ILExpression condition;

  private final List<CaseBlock> caseBlocks = new ArrayList<>();

  private final List<BinSpan> endBinSpans = new ArrayList<>(1);

  public ILSwitch(ILExpression condition) {
    this.condition = condition;
  }

  public ILExpression getCondition() {
    return condition;
  }

  public void setCondition(ILExpression condition) {
    this.condition = condition;
  }

  public List<CaseBlock> getCaseBlocks() {
    return caseBlocks;
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
    return caseBlocks.size() + 1;
  }

  @Override
  ILNode getSlot(int i) {
    return i == 0 ? condition : caseBlocks.get(i - 1);
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitSwitch(this);
  }
}
