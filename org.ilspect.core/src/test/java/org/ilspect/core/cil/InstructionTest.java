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
package org.ilspect.core.cil;

import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class InstructionTest {

  @Test
  public void testSwitchTargetsSkipMissingEntries() {
    Instruction ret = new Instruction(OpCodes.RET);
    ret.setOffset(0x0E);
    Instruction sw = new Instruction(OpCodes.SWITCH, new Instruction[] {null, ret, null});
    sw.setOffset(1);

    List<Instruction> targets = sw.getBranchTargets();
    Assert.assertEquals(1, targets.size());
    Assert.assertSame(ret, targets.get(0));
    Assert.assertEquals("IL_0001: switch (null, IL_000e, null)", sw.toString());
  }

  @Test
  public void testSwitchSizeCountsEveryEntry() {
    Instruction sw = new Instruction(OpCodes.SWITCH, new Instruction[] {null, null});
    Assert.assertEquals(1 + 4 + 8, sw.getSize());
  }

  @Test
  public void testOtherInstructionsHaveNoBranchTargets() {
    Assert.assertTrue(new Instruction(OpCodes.NOP).getBranchTargets().isEmpty());
    Instruction target = new Instruction(OpCodes.RET);
    Assert.assertEquals(1, new Instruction(OpCodes.BR_S, target).getBranchTargets().size());
  }
}
