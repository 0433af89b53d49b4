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
import java.util.Collections;
import java.util.List;
import org.ilspect.core.debug.BinSpan;
import org.ilspect.core.metadata.TypeReference;
import org.junit.Assert;
import org.junit.Test;

public class ILNodeTest {

  @Test(expected = IllegalArgumentException.class)
  public void testExpressionOperandIsRejected() {
    new ILExpression(ILCode.POP, new ILExpression(ILCode.LDNULL, null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSetExpressionOperandIsRejected() {
    ILExpression e = new ILExpression(ILCode.LDC_I4, 1);
    e.setOperand(new ILExpression(ILCode.LDNULL, null));
  }

  @Test
  public void testTryCatchChildOrder() {
    ILBlock tryBlock = new ILBlock();
    ILTryCatchBlock.CatchBlock catch1 = new ILTryCatchBlock.CatchBlock();
    ILTryCatchBlock.CatchBlock catch2 = new ILTryCatchBlock.CatchBlock();
    ILBlock finallyBlock = new ILBlock();
    ILTryCatchBlock tryCatch = new ILTryCatchBlock(tryBlock);
    tryCatch.getCatchBlocks().add(catch1);
    tryCatch.getCatchBlocks().add(catch2);
    tryCatch.setFinallyBlock(finallyBlock);

    Assert.assertEquals(
        Arrays.<ILNode>asList(tryBlock, catch1, catch2, finallyBlock), tryCatch.getChildren());
    Assert.assertTrue(tryCatch.isWellFormed());

    tryCatch.setFaultBlock(new ILBlock());
    Assert.assertFalse(tryCatch.isWellFormed());
  }

  @Test
  public void testSelfAndChildrenRecursiveIsPreOrder() {
    ILExpression one = new ILExpression(ILCode.LDC_I4, 1);
    ILExpression two = new ILExpression(ILCode.LDC_I4, 2);
    ILExpression add = new ILExpression(ILCode.ADD, null, one, two);
    ILExpression ret = new ILExpression(ILCode.RET, null, add);
    ILLabel label = new ILLabel("L");
    ILBlock block = new ILBlock(label, ret);

    Assert.assertEquals(
        Arrays.<ILNode>asList(block, label, ret, add, one, two),
        block.getSelfAndChildrenRecursive());
    Assert.assertEquals(
        Arrays.asList(ret, add, one, two), block.getSelfAndChildrenRecursive(ILExpression.class));
    Assert.assertEquals(
        Arrays.asList(one, two),
        block.getSelfAndChildrenRecursive(ILExpression.class, e -> e.match(ILCode.LDC_I4)));
  }

  @Test
  public void testRecursiveSpansIncludeEndSpans() {
    ILExpression ret = new ILExpression(ILCode.RET, null);
    ret.getBinSpans().add(BinSpan.fromBounds(4, 5));
    ILBlock block = new ILBlock(ret);
    block.getBinSpans().add(BinSpan.fromBounds(0, 1));
    block.getEndBinSpans().add(BinSpan.fromBounds(5, 6));

    Assert.assertTrue(block.hasEndBinSpans());
    Assert.assertFalse(ret.hasEndBinSpans());
    Assert.assertEquals(
        Arrays.asList(BinSpan.fromBounds(0, 1), BinSpan.fromBounds(5, 6), BinSpan.fromBounds(4, 5)),
        block.getSelfAndChildrenRecursiveBinSpans());
    Assert.assertEquals(
        Arrays.asList(BinSpan.fromBounds(0, 1), BinSpan.fromBounds(4, 6)),
        block.getSelfAndChildrenRecursiveBinSpansOrderAndJoin());
  }

  @Test
  public void testCatchBlockTakesOverLeadingPop() {
    ILExpression pop = new ILExpression(ILCode.POP, null);
    pop.getBinSpans().add(BinSpan.fromBounds(10, 11));
    ILExpression leave = new ILExpression(ILCode.LEAVE, new ILLabel("end"));
    leave.getBinSpans().add(BinSpan.fromBounds(11, 13));
    List<ILNode> body = new ArrayList<>(Arrays.<ILNode>asList(pop, leave));

    ILTryCatchBlock.CatchBlock block = new ILTryCatchBlock.CatchBlock(true, body);

    Assert.assertEquals(Collections.<ILNode>singletonList(leave), block.getBody());
    Assert.assertEquals(
        Collections.singletonList(BinSpan.fromBounds(10, 11)), block.getStlocBinSpans());
    Assert.assertEquals(
        Arrays.asList(BinSpan.fromBounds(10, 11), BinSpan.fromBounds(11, 13)), sortedSpans(block));
  }

  @Test
  public void testCatchBlockKeepsPopWithoutSpanCalculation() {
    ILExpression pop = new ILExpression(ILCode.POP, null);
    List<ILNode> body = new ArrayList<>(Collections.<ILNode>singletonList(pop));
    ILTryCatchBlock.CatchBlock block = new ILTryCatchBlock.CatchBlock(false, body);
    Assert.assertEquals(1, block.getBody().size());
    Assert.assertTrue(block.getStlocBinSpans().isEmpty());
  }

  private static List<BinSpan> sortedSpans(ILNode node) {
    List<BinSpan> spans = node.getSelfAndChildrenRecursiveBinSpans();
    Collections.sort(spans);
    return spans;
  }

  @Test
  public void testBranchTargets() {
    ILLabel a = new ILLabel("a");
    ILLabel b = new ILLabel("b");
    ILExpression sw =
        new ILExpression(ILCode.SWITCH, new ILLabel[] {a, b}, new ILExpression(ILCode.LDC_I4, 0));
    Assert.assertTrue(sw.isBranch());
    Assert.assertEquals(Arrays.asList(a, b), sw.getBranchTargets());
    Assert.assertFalse(new ILExpression(ILCode.NOP, null).isBranch());
  }

  @Test
  public void testVariableIdentity() {
    ILVariable v = new ILVariable("x");
    Assert.assertSame(v.getId(), v.getId());
    Assert.assertNotSame(v.getId(), new ILVariable("x").getId());
    v.setType(TypeReference.system("Int32"));
    Assert.assertFalse(v.isPinned());
    Assert.assertFalse(v.isParameter());
  }
}
