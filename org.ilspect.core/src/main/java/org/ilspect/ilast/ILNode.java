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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import org.ilspect.core.debug.BinSpan;
import org.ilspect.core.debug.MethodDebugInfoBuilder;
import org.ilspect.core.output.DecompilerOutput;
import org.ilspect.core.output.StringBuilderDecompilerOutput;

/**
 * Base of the IL AST. The set of variants is closed: constructors are package-private and {@link
 * ILNodeVisitor} has one method per variant.
 *
 * <p>Every node carries the {@link BinSpan}s of the instructions it was built from. Variants with
 * closing syntax keep a separate list of end spans; for all others {@link #getEndBinSpans()} is
 * the same list as {@link #getBinSpans()}.
 *
 * <p>Children are enumerated through numbered slots. A slot may be empty (an optional block that
 * is absent), in which case it is skipped.
 */
public abstract class ILNode implements Iterable<ILNode> {

  private final List<BinSpan> binSpans = new ArrayList<>(1);

  ILNode() {}

  public List<BinSpan> getBinSpans() {
    return binSpans;
  }

  public List<BinSpan> getEndBinSpans() {
    return binSpans;
  }

  public final boolean hasEndBinSpans() {
    return getEndBinSpans() != binSpans;
  }

  /** whether spans of removed neighbours may be appended to {@link #getEndBinSpans()} */
  public boolean isSafeToAddToEndBinSpans() {
    return false;
  }

  /** the spans owned by this node alone, without those of its children */
  public List<BinSpan> getAllBinSpans() {
    if (!hasEndBinSpans()) {
      return Collections.unmodifiableList(binSpans);
    }
    List<BinSpan> result = new ArrayList<>(binSpans);
    result.addAll(getEndBinSpans());
    return result;
  }

  public abstract <R> R accept(ILNodeVisitor<R> visitor);

  /** number of child slots, some of which may be empty */
  abstract int getSlotCount();

  /** the child in slot {@code i}, or null if the slot is empty */
  abstract ILNode getSlot(int i);

  /** Position of an enumeration over the children of one node. */
  public static final class ChildCursor {
    private int index;

    public void reset() {
      index = 0;
    }
  }

  /** the next non-empty child after the cursor, or null when there are no more */
  public final ILNode getNext(ChildCursor cursor) {
    int n = getSlotCount();
    while (cursor.index < n) {
      ILNode child = getSlot(cursor.index++);
      if (child != null) {
        return child;
      }
    }
    return null;
  }

  @Override
  public Iterator<ILNode> iterator() {
    return new Iterator<ILNode>() {
      private final ChildCursor cursor = new ChildCursor();

      private ILNode next = getNext(cursor);

      @Override
      public boolean hasNext() {
        return next != null;
      }

      @Override
      public ILNode next() {
        if (next == null) {
          throw new NoSuchElementException();
        }
        ILNode result = next;
        next = getNext(cursor);
        return result;
      }
    };
  }

  public List<ILNode> getChildren() {
    List<ILNode> result = new ArrayList<>();
    for (ILNode child : this) {
      result.add(child);
    }
    return result;
  }

  public List<ILNode> getSelfAndChildrenRecursive() {
    return getSelfAndChildrenRecursive(ILNode.class, null);
  }

  public <T extends ILNode> List<T> getSelfAndChildrenRecursive(Class<T> type) {
    return getSelfAndChildrenRecursive(type, null);
  }

  /** pre-order: this node before its children, children in slot order */
  public <T extends ILNode> List<T> getSelfAndChildrenRecursive(
      Class<T> type, Predicate<? super T> predicate) {
    List<T> result = new ArrayList<>();
    accumulateSelfAndChildrenRecursive(result, type, predicate);
    return result;
  }

  private <T extends ILNode> void accumulateSelfAndChildrenRecursive(
      List<T> list, Class<T> type, Predicate<? super T> predicate) {
    if (type.isInstance(this)) {
      T t = type.cast(this);
      if (predicate == null || predicate.test(t)) {
        list.add(t);
      }
    }
    ChildCursor cursor = new ChildCursor();
    for (ILNode child = getNext(cursor); child != null; child = getNext(cursor)) {
      child.accumulateSelfAndChildrenRecursive(list, type, predicate);
    }
  }

  /** Appends the spans of this node and of all its descendants, in pre-order, to {@code list}. */
  public void addSelfAndChildrenRecursiveBinSpans(List<BinSpan> list) {
    list.addAll(getAllBinSpans());
    ChildCursor cursor = new ChildCursor();
    for (ILNode child = getNext(cursor); child != null; child = getNext(cursor)) {
      child.addSelfAndChildrenRecursiveBinSpans(list);
    }
  }

  public List<BinSpan> getSelfAndChildrenRecursiveBinSpans() {
    List<BinSpan> list = new ArrayList<>();
    addSelfAndChildrenRecursiveBinSpans(list);
    return list;
  }

  public List<BinSpan> getSelfAndChildrenRecursiveBinSpansOrderAndJoin() {
    return BinSpan.orderAndCompact(getSelfAndChildrenRecursiveBinSpans());
  }

  public boolean match(ILCode code) {
    return false;
  }

  /**
   * Writes the textual IL AST form of this node. {@code builder} receives a source statement for
   * every written span; it may be null.
   */
  public void writeTo(DecompilerOutput output, MethodDebugInfoBuilder builder) {
    accept(new ILAstWriter(output, builder));
  }

  @Override
  public String toString() {
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    writeTo(output, null);
    return output.getText().trim().replace("\n", "; ");
  }
}
