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

import java.util.List;
import org.ilspect.core.debug.BinSpan;

/**
 * Moves the spans of nodes that a transform removes from a block onto a surviving neighbour, so
 * that the tree as a whole keeps covering the same instructions.
 *
 * <p>The methods taking a {@code body} and an index must be called before the node is removed
 * from that body. In the {@code newBody} variants, {@code newBody} holds the nodes already kept
 * while the block is being rebuilt, so its last element is the surviving predecessor.
 */
public final class BinSpanMerger {

  private BinSpanMerger() {}

  /**
   * A removed {@code nop} goes to a preceding call or, failing that, in front of a following
   * {@code leave}; anything else is handled next-first.
   */
  public static void nopMergeBinSpans(
      ILBlockBase block, List<ILNode> newBody, int instrIndexToRemove) {
    List<ILNode> body = block.getBody();
    ILNode prevNode = newBody.isEmpty() ? null : newBody.get(newBody.size() - 1);
    ILNode nextNode =
        instrIndexToRemove + 1 < body.size() ? body.get(instrIndexToRemove + 1) : null;

    ILNode node = null;
    if (prevNode instanceof ILExpression) {
      ILExpression prev = (ILExpression) prevNode;
      if (prev.getPrefixes() == null && prev.getCode().isCall()) {
        node = prev;
      }
    }
    if (nextNode instanceof ILExpression) {
      ILExpression next = (ILExpression) nextNode;
      if (next.getPrefixes() == null && next.match(ILCode.LEAVE)) {
        node = next;
      }
    }

    ILNode removed = body.get(instrIndexToRemove);
    if (node != null && node == prevNode) {
      addBinSpansTryPreviousFirst(removed, prevNode, nextNode, block);
    } else {
      addBinSpansTryNextFirst(removed, prevNode, nextNode, block);
    }
  }

  public static void labelMergeBinSpans(
      ILBlockBase block, List<ILNode> newBody, int instrIndexToRemove) {
    List<ILNode> body = block.getBody();
    ILNode prevNode = newBody.isEmpty() ? null : newBody.get(newBody.size() - 1);
    ILNode nextNode =
        instrIndexToRemove + 1 < body.size() ? body.get(instrIndexToRemove + 1) : null;
    addBinSpansTryNextFirst(body.get(instrIndexToRemove), prevNode, nextNode, block);
  }

  public static void addBinSpansTryPreviousFirst(
      List<ILNode> newBody, List<ILNode> body, int removedIndex, ILBlockBase block) {
    ILNode prev = newBody.isEmpty() ? null : newBody.get(newBody.size() - 1);
    ILNode next = removedIndex + 1 < body.size() ? body.get(removedIndex + 1) : null;
    addBinSpansTryPreviousFirst(body.get(removedIndex), prev, next, block);
  }

  public static void addBinSpansTryNextFirst(
      List<ILNode> newBody, List<ILNode> body, int removedIndex, ILBlockBase block) {
    ILNode prev = newBody.isEmpty() ? null : newBody.get(newBody.size() - 1);
    ILNode next = removedIndex + 1 < body.size() ? body.get(removedIndex + 1) : null;
    addBinSpansTryNextFirst(body.get(removedIndex), prev, next, block);
  }

  public static void addBinSpansTryPreviousFirst(
      ILNode removed, ILNode prev, ILNode next, ILBlockBase block) {
    if (removed == null) {
      return;
    }
    removed.addSelfAndChildrenRecursiveBinSpans(previousFirstTarget(prev, next, block));
  }

  public static void addBinSpansTryNextFirst(
      ILNode removed, ILNode prev, ILNode next, ILBlockBase block) {
    if (removed == null) {
      return;
    }
    removed.addSelfAndChildrenRecursiveBinSpans(nextFirstTarget(prev, next, block));
  }

  public static void addBinSpansTryPreviousFirst(
      ILNode prev, ILNode next, ILBlockBase block, Iterable<BinSpan> binSpans) {
    addAll(previousFirstTarget(prev, next, block), binSpans);
  }

  public static void addBinSpansTryNextFirst(
      ILNode prev, ILNode next, ILBlockBase block, Iterable<BinSpan> binSpans) {
    addAll(nextFirstTarget(prev, next, block), binSpans);
  }

  private static List<BinSpan> previousFirstTarget(ILNode prev, ILNode next, ILBlockBase block) {
    if (prev != null && prev.isSafeToAddToEndBinSpans()) {
      return prev.getEndBinSpans();
    } else if (next != null) {
      return next.getBinSpans();
    } else if (prev != null) {
      return block.getEndBinSpans();
    } else {
      return block.getBinSpans();
    }
  }

  private static List<BinSpan> nextFirstTarget(ILNode prev, ILNode next, ILBlockBase block) {
    if (next != null) {
      return next.getBinSpans();
    } else if (prev != null) {
      return prev.isSafeToAddToEndBinSpans() ? prev.getEndBinSpans() : block.getEndBinSpans();
    } else {
      return block.getBinSpans();
    }
  }

  public static void addBinSpans(ILBlockBase block, List<ILNode> body, int removedIndex) {
    addBinSpans(block, body, removedIndex, 1);
  }

  /**
   * Gives the spans of {@code body[removedIndex .. removedIndex + numRemoved)} to the neighbour
   * that best represents them: an adjacent expression, then an adjacent label, then whatever
   * neighbour exists, following before preceding. Each removed node contributes its own spans.
   */
  public static void addBinSpans(
      ILBlockBase block, List<ILNode> body, int removedIndex, int numRemoved) {
    ILNode prev = removedIndex - 1 >= 0 ? body.get(removedIndex - 1) : null;
    ILNode next =
        removedIndex + numRemoved < body.size() ? body.get(removedIndex + numRemoved) : null;
    ILNode node = pickAttachmentPoint(prev, next);
    for (int i = 0; i < numRemoved; i++) {
      addBinSpansToInstruction(node, prev, next, block, body.get(removedIndex + i));
    }
  }

  public static void addBinSpans(
      ILBlockBase block, List<ILNode> body, int removedIndex, Iterable<BinSpan> binSpans) {
    ILNode prev = removedIndex - 1 >= 0 ? body.get(removedIndex - 1) : null;
    ILNode next = removedIndex + 1 < body.size() ? body.get(removedIndex + 1) : null;
    addBinSpansToInstruction(pickAttachmentPoint(prev, next), prev, next, block, binSpans);
  }

  private static ILNode pickAttachmentPoint(ILNode prev, ILNode next) {
    if (next instanceof ILExpression) {
      return next;
    } else if (prev instanceof ILExpression) {
      return prev;
    } else if (next instanceof ILLabel) {
      return next;
    } else if (prev instanceof ILLabel) {
      return prev;
    } else {
      return next != null ? next : prev;
    }
  }

  public static void addBinSpansToInstruction(
      ILNode nodeToAddTo, ILNode prev, ILNode next, ILBlockBase block, ILNode removed) {
    assert nodeToAddTo == null
        || nodeToAddTo == prev
        || nodeToAddTo == next
        || nodeToAddTo == block;
    if (nodeToAddTo != null) {
      if (nodeToAddTo == prev && prev.isSafeToAddToEndBinSpans()) {
        removed.addSelfAndChildrenRecursiveBinSpans(prev.getEndBinSpans());
        return;
      } else if (nodeToAddTo == next) {
        removed.addSelfAndChildrenRecursiveBinSpans(next.getBinSpans());
        return;
      }
    }
    addBinSpansTryNextFirst(removed, prev, next, block);
  }

  public static void addBinSpansToInstruction(
      ILNode nodeToAddTo, ILNode prev, ILNode next, ILBlockBase block, Iterable<BinSpan> binSpans) {
    assert nodeToAddTo == null
        || nodeToAddTo == prev
        || nodeToAddTo == next
        || nodeToAddTo == block;
    if (nodeToAddTo != null) {
      if (nodeToAddTo == prev && prev.isSafeToAddToEndBinSpans()) {
        addAll(prev.getEndBinSpans(), binSpans);
        return;
      } else if (nodeToAddTo == next) {
        addAll(next.getBinSpans(), binSpans);
        return;
      }
    }
    addBinSpansTryNextFirst(prev, next, block, binSpans);
  }

  private static void addAll(List<BinSpan> target, Iterable<BinSpan> spans) {
    for (BinSpan s : spans) {
      target.add(s);
    }
  }
}
