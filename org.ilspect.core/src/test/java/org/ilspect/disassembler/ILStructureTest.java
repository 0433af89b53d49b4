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
package org.ilspect.disassembler;

import java.util.List;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.MethodBody;
import org.ilspect.core.cil.OpCodes;
import org.junit.Assert;
import org.junit.Test;

public class ILStructureTest {

  @Test
  public void testLoopWithConditionAtTheEnd() throws InvalidStructureException {
    MethodBody body = MethodBodies.whileLoop();
    ILStructure root = new ILStructure(body);

    Assert.assertEquals(ILStructureType.ROOT, root.getType());
    Assert.assertEquals(0, root.getStartOffset());
    Assert.assertEquals(body.getCodeSize(), root.getEndOffset());
    Assert.assertEquals(1, root.getChildren().size());

    ILStructure loop = root.getChildren().get(0);
    Assert.assertEquals(ILStructureType.LOOP, loop.getType());
    Assert.assertEquals(0x04, loop.getStartOffset());
    Assert.assertEquals(0x0C, loop.getEndOffset());
    Assert.assertEquals(0x08, loop.getLoopEntryPoint().getOffset());
    Assert.assertSame(loop, root.getInnermost(0x06));
    Assert.assertSame(root, root.getInnermost(0x0C));
  }

  @Test
  public void testTryAndHandlerAreSiblings() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.tryCatch());
    List<ILStructure> children = root.getChildren();
    Assert.assertEquals(2, children.size());
    Assert.assertEquals(ILStructureType.TRY, children.get(0).getType());
    Assert.assertEquals(0, children.get(0).getStartOffset());
    Assert.assertEquals(3, children.get(0).getEndOffset());
    Assert.assertEquals(ILStructureType.HANDLER, children.get(1).getType());
    Assert.assertEquals(3, children.get(1).getStartOffset());
    Assert.assertEquals(6, children.get(1).getEndOffset());
    Assert.assertEquals(1, root.getDepth());
  }

  @Test
  public void testLoopNestsInsideTry() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.loopInTryFinally());
    Assert.assertEquals(2, root.getDepth());
    ILStructure tryBlock = root.getChildren().get(0);
    Assert.assertEquals(ILStructureType.TRY, tryBlock.getType());
    Assert.assertEquals(1, tryBlock.getChildren().size());
    ILStructure loop = tryBlock.getChildren().get(0);
    Assert.assertEquals(ILStructureType.LOOP, loop.getType());
    Assert.assertEquals(0, loop.getStartOffset());
    Assert.assertEquals(4, loop.getEndOffset());
    Assert.assertEquals(0, loop.getLoopEntryPoint().getOffset());
  }

  @Test
  public void testChildrenAreOrderedAndNested() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.loopInTryFinally());
    assertWellNested(root);
  }

  private static void assertWellNested(ILStructure s) {
    int previousEnd = s.getStartOffset();
    for (ILStructure child : s.getChildren()) {
      Assert.assertTrue(child.getStartOffset() >= previousEnd);
      Assert.assertTrue(child.getEndOffset() <= s.getEndOffset());
      previousEnd = child.getEndOffset();
      assertWellNested(child);
    }
  }

  @Test
  public void testFilterRegionRunsUpToItsHandler() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.tryFilter());
    List<ILStructure> children = root.getChildren();
    Assert.assertEquals(3, children.size());
    Assert.assertEquals(ILStructureType.TRY, children.get(0).getType());
    Assert.assertEquals(ILStructureType.FILTER, children.get(1).getType());
    Assert.assertEquals(3, children.get(1).getStartOffset());
    Assert.assertEquals(7, children.get(1).getEndOffset());
    Assert.assertEquals(ILStructureType.HANDLER, children.get(2).getType());
    Assert.assertEquals(7, children.get(2).getStartOffset());
    Assert.assertEquals(0x0A, children.get(2).getEndOffset());
    assertWellNested(root);
  }

  @Test
  public void testHandlersSharingTryRangeGetOneTry() throws InvalidStructureException {
    MethodBody body = MethodBodies.tryTwoCatches();
    ILStructure root = new ILStructure(body);
    List<ILStructure> children = root.getChildren();
    Assert.assertEquals(3, children.size());
    Assert.assertEquals(ILStructureType.TRY, children.get(0).getType());
    Assert.assertSame(body.getExceptionHandlers().get(0), children.get(0).getExceptionHandler());
    Assert.assertEquals(ILStructureType.HANDLER, children.get(1).getType());
    Assert.assertEquals(ILStructureType.HANDLER, children.get(2).getType());
    Assert.assertSame(body.getExceptionHandlers().get(1), children.get(2).getExceptionHandler());
  }

  @Test
  public void testLoopThroughSwitch() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.switchLoop());
    Assert.assertEquals(1, root.getChildren().size());
    ILStructure loop = root.getChildren().get(0);
    Assert.assertEquals(ILStructureType.LOOP, loop.getType());
    Assert.assertEquals(2, loop.getStartOffset());
    Assert.assertEquals(0x16, loop.getEndOffset());
    Assert.assertEquals(2, loop.getLoopEntryPoint().getOffset());
  }

  @Test
  public void testMissingSwitchTargetIsIgnored() throws InvalidStructureException {
    ILStructure root = new ILStructure(MethodBodies.switchWithMissingTarget());
    Assert.assertTrue(root.getChildren().isEmpty());
  }

  @Test(expected = InvalidStructureException.class)
  public void testFilterWithoutFilterStartIsRejected() throws InvalidStructureException {
    MethodBody body = MethodBodies.tryFilter();
    body.getExceptionHandlers().get(0).setFilterStart(null);
    new ILStructure(body);
  }

  @Test(expected = InvalidStructureException.class)
  public void testOverlappingHandlerIsRejected() throws InvalidStructureException {
    new ILStructure(MethodBodies.overlappingHandler());
  }

  @Test(expected = InvalidStructureException.class)
  public void testHandlerNotOnInstructionBoundaryIsRejected() throws InvalidStructureException {
    MethodBody body = MethodBodies.tryCatch();
    // the leave.s at IL_0001 is two bytes long
    Instruction bogus = new Instruction(OpCodes.NOP);
    bogus.setOffset(2);
    body.getExceptionHandlers().get(0).tryRange(body.getInstructions().get(0), bogus);
    new ILStructure(body);
  }

  @Test
  public void testNestedLoopSharingHeaderIsDropped() {
    ILStructure outer = new ILStructure(ILStructureType.LOOP, 0, 10, (Instruction) null);
    ILStructure inner = new ILStructure(ILStructureType.LOOP, 0, 5, (Instruction) null);
    Assert.assertFalse(outer.addNestedStructure(inner));
    ILStructure later = new ILStructure(ILStructureType.LOOP, 2, 5, (Instruction) null);
    Assert.assertTrue(outer.addNestedStructure(later));
    Assert.assertEquals(1, outer.getChildren().size());
  }
}
