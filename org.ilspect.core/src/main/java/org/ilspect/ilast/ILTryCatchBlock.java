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
import org.ilspect.core.metadata.TypeReference;

/**
 * A protected region with its handlers. A region owns either catch clauses, a fault block, or a
 * filter, and may additionally own one finally block.
 */
public class ILTryCatchBlock extends ILNode {

  /** A catch clause. A null exception type denotes a catch-all. */
  public static class CatchBlock extends ILBlock {

    private TypeReference exceptionType;

    private ILVariable exceptionVariable;

    private final List<BinSpan> stlocBinSpans = new ArrayList<>(1);

    public CatchBlock() {}

    /**
     * @param calculateBinSpans if set, a leading {@code pop} of the exception object is removed
     *     and its spans become the spans of the implicit exception variable store
     */
    public CatchBlock(boolean calculateBinSpans, List<ILNode> body) {
      super(body);
      if (calculateBinSpans && !body.isEmpty() && body.get(0).match(ILCode.POP)) {
        body.remove(0).addSelfAndChildrenRecursiveBinSpans(stlocBinSpans);
      }
    }

    public boolean isFilter() {
      return false;
    }

    public TypeReference getExceptionType() {
      return exceptionType;
    }

    public void setExceptionType(TypeReference exceptionType) {
      this.exceptionType = exceptionType;
    }

    public ILVariable getExceptionVariable() {
      return exceptionVariable;
    }

    public void setExceptionVariable(ILVariable exceptionVariable) {
      this.exceptionVariable = exceptionVariable;
    }

    public List<BinSpan> getStlocBinSpans() {
      return stlocBinSpans;
    }

    @Override
    public List<BinSpan> getAllBinSpans() {
      List<BinSpan> result = new ArrayList<>(getBinSpans());
      result.addAll(getEndBinSpans());
      result.addAll(stlocBinSpans);
      return result;
    }

    @Override
    public <R> R accept(ILNodeVisitor<R> visitor) {
      return visitor.visitCatchBlock(this);
    }
  }

  /** The filter expression block; the handler it guards is kept alongside. */
  public static class FilterILBlock extends CatchBlock {

    private CatchBlock handlerBlock;

    public FilterILBlock() {}

    public FilterILBlock(boolean calculateBinSpans, List<ILNode> body) {
      super(calculateBinSpans, body);
    }

    @Override
    public boolean isFilter() {
      return true;
    }

    public CatchBlock getHandlerBlock() {
      return handlerBlock;
    }

    public void setHandlerBlock(CatchBlock handlerBlock) {
      this.handlerBlock = handlerBlock;
    }
  }

  private ILBlock tryBlock;

  private final List<CatchBlock> catchBlocks = new ArrayList<>();

  private ILBlock finallyBlock;

  private ILBlock faultBlock;

  private FilterILBlock filterBlock;

  public ILTryCatchBlock() {}

  public ILTryCatchBlock(ILBlock tryBlock) {
    this.tryBlock = tryBlock;
  }

  public ILBlock getTryBlock() {
    return tryBlock;
  }

  public void setTryBlock(ILBlock tryBlock) {
    this.tryBlock = tryBlock;
  }

  public List<CatchBlock> getCatchBlocks() {
    return catchBlocks;
  }

  public ILBlock getFinallyBlock() {
    return finallyBlock;
  }

  public void setFinallyBlock(ILBlock finallyBlock) {
    this.finallyBlock = finallyBlock;
  }

  public ILBlock getFaultBlock() {
    return faultBlock;
  }

  public void setFaultBlock(ILBlock faultBlock) {
    this.faultBlock = faultBlock;
  }

  public FilterILBlock getFilterBlock() {
    return filterBlock;
  }

  public void setFilterBlock(FilterILBlock filterBlock) {
    this.filterBlock = filterBlock;
  }

  /**
   * Checks the handler combination: catch clauses, a fault block and a filter exclude each other;
   * a finally block may accompany any of them.
   */
  public boolean isWellFormed() {
    int kinds = 0;
    if (!catchBlocks.isEmpty()) kinds++;
    if (faultBlock != null) kinds++;
    if (filterBlock != null) kinds++;
    return tryBlock != null && (kinds == 1 || (kinds == 0 && finallyBlock != null));
  }

  // slots: try, catches..., fault, finally, filter, filter handler
  @Override
  int getSlotCount() {
    return catchBlocks.size() + 5;
  }

  @Override
  ILNode getSlot(int i) {
    if (i == 0) {
      return tryBlock;
    }
    int n = catchBlocks.size();
    if (i <= n) {
      return catchBlocks.get(i - 1);
    }
    switch (i - n) {
      case 1:
        return faultBlock;
      case 2:
        return finallyBlock;
      case 3:
        return filterBlock;
      case 4:
        return filterBlock == null ? null : filterBlock.getHandlerBlock();
      default:
        throw new IndexOutOfBoundsException(String.valueOf(i));
    }
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitTryCatchBlock(this);
  }
}
