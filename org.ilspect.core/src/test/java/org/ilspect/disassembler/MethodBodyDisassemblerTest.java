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

import com.ibm.wala.util.CancelException;
import com.ibm.wala.util.NullProgressMonitor;
import java.util.List;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.MethodBody;
import org.ilspect.core.debug.MethodDebugInfoBuilder;
import org.ilspect.core.debug.SourceStatement;
import org.ilspect.core.metadata.InMemoryModule;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.output.StringBuilderDecompilerOutput;
import org.junit.Assert;
import org.junit.Test;

public class MethodBodyDisassemblerTest {

  /** Reports cancellation for the first {@code n} polls only. */
  private static class CancelingMonitor extends NullProgressMonitor {
    private int remaining;

    CancelingMonitor(int n) {
      this.remaining = n;
    }

    @Override
    public boolean isCanceled() {
      if (remaining > 0) {
        remaining--;
        return true;
      }
      return false;
    }
  }

  private static String disassemble(
      MethodDefinition method, DisassemblerOptions options, MethodDebugInfoBuilder builder)
      throws CancelException {
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    new MethodBodyDisassembler(output, options).disassemble(method, builder, null);
    return output.getText();
  }

  private static void assertEachInstructionMappedOnce(
      MethodBody body, MethodDebugInfoBuilder builder) {
    List<SourceStatement> statements = builder.create();
    Assert.assertEquals(body.getInstructions().size(), statements.size());
    int expectedStart = 0;
    for (SourceStatement s : statements) {
      Assert.assertEquals(expectedStart, s.getBinSpan().getStart());
      Assert.assertFalse(s.getBinSpan().isEmpty());
      expectedStart = s.getBinSpan().getEnd();
    }
    Assert.assertEquals(body.getCodeSize(), expectedStart);
    for (Instruction inst : body.getInstructions()) {
      Assert.assertEquals(1, builder.getStatementsAt(inst.getOffset()).size());
    }
  }

  @Test
  public void testLoopIsIndented() throws CancelException {
    MethodDefinition method = MethodBodies.method("Count", MethodBodies.whileLoop());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + ".locals init (\n"
            + "\t[0] System.Int32 i\n"
            + ")\n"
            + "\n"
            + "IL_0000: ldc.i4.0\n"
            + "IL_0001: stloc.0\n"
            + "IL_0002: br.s IL_0008\n"
            + "// loop start (head: IL_0008)\n"
            + "\tIL_0004: ldloc.0\n"
            + "\tIL_0005: ldc.i4.1\n"
            + "\tIL_0006: add\n"
            + "\tIL_0007: stloc.0\n"
            + "\n"
            + "\tIL_0008: ldloc.0\n"
            + "\tIL_0009: ldc.i4.5\n"
            + "\tIL_000A: blt.s IL_0004\n"
            + "// end loop\n"
            + "\n"
            + "IL_000C: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testTextSpansPointAtInstructions() throws CancelException {
    MethodDefinition method = MethodBodies.method("Count", MethodBodies.whileLoop());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    for (SourceStatement s : builder.getStatements()) {
      String line = text.substring(s.getTextSpan().getStart(), s.getTextSpan().getEnd());
      Assert.assertTrue(
          line, line.startsWith(DisassemblerHelpers.offsetToString(s.getBinSpan().getStart())));
    }
  }

  @Test
  public void testTryCatch() throws CancelException {
    MethodDefinition method = MethodBodies.method("Guarded", MethodBodies.tryCatch());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + ".try\n"
            + "{\n"
            + "\tIL_0000: nop\n"
            + "\tIL_0001: leave.s IL_0006\n"
            + "} // end .try\n"
            + "catch System.Exception\n"
            + "{\n"
            + "\tIL_0003: pop\n"
            + "\tIL_0004: leave.s IL_0006\n"
            + "} // end handler\n"
            + "\n"
            + "IL_0006: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testLoopInsideTryFinally() throws CancelException {
    MethodDefinition method = MethodBodies.method("Spin", MethodBodies.loopInTryFinally());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + ".try\n"
            + "{\n"
            + "\t// loop start (head: IL_0000)\n"
            + "\t\tIL_0000: nop\n"
            + "\t\tIL_0001: ldc.i4.1\n"
            + "\t\tIL_0002: brtrue.s IL_0000\n"
            + "\t// end loop\n"
            + "\tIL_0004: leave.s IL_0008\n"
            + "} // end .try\n"
            + "finally\n"
            + "{\n"
            + "\tIL_0006: nop\n"
            + "\tIL_0007: endfinally\n"
            + "} // end handler\n"
            + "\n"
            + "IL_0008: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testTryFilter() throws CancelException {
    MethodDefinition method = MethodBodies.method("Filtered", MethodBodies.tryFilter());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + ".try\n"
            + "{\n"
            + "\tIL_0000: nop\n"
            + "\tIL_0001: leave.s IL_000A\n"
            + "} // end .try\n"
            + "filter\n"
            + "{\n"
            + "\tIL_0003: pop\n"
            + "\tIL_0004: ldc.i4.1\n"
            + "\tIL_0005: endfilter\n"
            + "} // end filter\n"
            + "catch\n"
            + "{\n"
            + "\tIL_0007: pop\n"
            + "\tIL_0008: leave.s IL_000A\n"
            + "} // end handler\n"
            + "\n"
            + "IL_000A: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testTryFault() throws CancelException {
    MethodDefinition method = MethodBodies.method("Faulted", MethodBodies.tryFault());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + ".try\n"
            + "{\n"
            + "\tIL_0000: nop\n"
            + "\tIL_0001: leave.s IL_0005\n"
            + "} // end .try\n"
            + "fault\n"
            + "{\n"
            + "\tIL_0003: nop\n"
            + "\tIL_0004: endfinally\n"
            + "} // end handler\n"
            + "\n"
            + "IL_0005: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testHandlersSharingTryRangeShareOneTryBlock() throws CancelException {
    MethodDefinition method = MethodBodies.method("Guarded", MethodBodies.tryTwoCatches());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + ".try\n"
            + "{\n"
            + "\tIL_0000: nop\n"
            + "\tIL_0001: leave.s IL_0009\n"
            + "} // end .try\n"
            + "catch System.ArgumentException\n"
            + "{\n"
            + "\tIL_0003: pop\n"
            + "\tIL_0004: leave.s IL_0009\n"
            + "} // end handler\n"
            + "catch System.Exception\n"
            + "{\n"
            + "\tIL_0006: pop\n"
            + "\tIL_0007: leave.s IL_0009\n"
            + "} // end handler\n"
            + "\n"
            + "IL_0009: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testSwitchInsideLoop() throws CancelException {
    MethodDefinition method = MethodBodies.method("Dispatch", MethodBodies.switchLoop());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text = disassemble(method, new DisassemblerOptions(), builder);
    Assert.assertEquals(
        ".maxstack 8\n"
            + ".locals init (\n"
            + "\t[0] System.Int32 i\n"
            + ")\n"
            + "\n"
            + "IL_0000: ldc.i4.0\n"
            + "IL_0001: stloc.0\n"
            + "// loop start (head: IL_0002)\n"
            + "\tIL_0002: ldloc.0\n"
            + "\tIL_0003: switch (IL_0012, IL_0016)\n"
            + "\n"
            + "\tIL_0010: br.s IL_0016\n"
            + "\n"
            + "\tIL_0012: ldc.i4.1\n"
            + "\tIL_0013: stloc.0\n"
            + "\tIL_0014: br.s IL_0002\n"
            + "// end loop\n"
            + "\n"
            + "IL_0016: ret\n",
        text);
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testSwitchWithMissingTarget() throws CancelException {
    MethodDefinition method =
        MethodBodies.method("Dispatch", MethodBodies.switchWithMissingTarget());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    boolean structured =
        new MethodBodyDisassembler(output, new DisassemblerOptions())
            .disassemble(method, builder, null);
    Assert.assertTrue(structured);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + "IL_0000: ldc.i4.0\n"
            + "IL_0001: switch (IL_000E, null)\n"
            + "\n"
            + "IL_000E: ret\n",
        output.getText());
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testFilterWithoutFilterStartFallsBackToFlatListing() throws CancelException {
    MethodBody body = MethodBodies.tryFilter();
    body.getExceptionHandlers().get(0).setFilterStart(null);
    MethodDefinition method = MethodBodies.method("Filtered", body);
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    boolean structured =
        new MethodBodyDisassembler(output, new DisassemblerOptions())
            .disassemble(method, builder, null);

    Assert.assertFalse(structured);
    String text = output.getText();
    Assert.assertTrue(text, text.contains("// Structuring failed: missing filter start"));
    Assert.assertTrue(
        text,
        text.endsWith(
            "IL_000A: ret\n" + "\n" + ".try IL_0000-IL_0003 filter handler IL_0007-IL_000A\n"));
    assertEachInstructionMappedOnce(body, builder);
  }

  @Test
  public void testFlatListingOfFilterHandler() throws CancelException {
    MethodDefinition method = MethodBodies.method("Filtered", MethodBodies.tryFilter());
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    new MethodBodyDisassembler(output, false, new DisassemblerOptions())
        .disassemble(method, null, null);
    Assert.assertTrue(
        output.getText(),
        output
            .getText()
            .endsWith(".try IL_0000-IL_0003 filter IL_0003 handler IL_0007-IL_000A\n"));
  }

  @Test
  public void testMalformedHandlersFallBackToFlatListing() throws CancelException {
    MethodDefinition method = MethodBodies.method("Broken", MethodBodies.overlappingHandler());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    boolean structured =
        new MethodBodyDisassembler(output, new DisassemblerOptions())
            .disassemble(method, builder, null);

    Assert.assertFalse(structured);
    String text = output.getText();
    Assert.assertTrue(text, text.contains("// Structuring failed: "));
    Assert.assertFalse(text, text.contains("{"));
    Assert.assertTrue(
        text,
        text.endsWith(
            "IL_0006: ret\n"
                + "\n"
                + ".try IL_0000-IL_0003 catch System.Exception handler IL_0001-IL_0006\n"));
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testTooDeepNestingFallsBack() throws CancelException {
    MethodDefinition method = MethodBodies.method("Spin", MethodBodies.loopInTryFinally());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    String text =
        disassemble(method, new DisassemblerOptions().setMaxStructureDepth(1), builder);
    Assert.assertTrue(text, text.contains("// Structuring failed: nesting depth 2 exceeds 1"));
    Assert.assertFalse(text, text.contains("// loop start"));
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test
  public void testFlatListingWhenStructureDetectionIsOff() throws CancelException {
    MethodDefinition method = MethodBodies.method("Guarded", MethodBodies.tryCatch());
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    boolean structured =
        new MethodBodyDisassembler(output, false, new DisassemblerOptions())
            .disassemble(method, null, null);
    Assert.assertFalse(structured);
    Assert.assertEquals(
        ".maxstack 8\n"
            + "\n"
            + "IL_0000: nop\n"
            + "IL_0001: leave.s IL_0006\n"
            + "IL_0003: pop\n"
            + "IL_0004: leave.s IL_0006\n"
            + "IL_0006: ret\n"
            + "\n"
            + ".try IL_0000-IL_0003 catch System.Exception handler IL_0003-IL_0006\n",
        output.getText());
  }

  @Test
  public void testEntryPointAndCodeSize() throws CancelException {
    MethodDefinition method = MethodBodies.method("Main", MethodBodies.tryCatch());
    InMemoryModule module = new InMemoryModule("test.exe");
    module.setEntryPoint(method);
    String text =
        disassemble(
            method, new DisassemblerOptions().setModule(module).setShowCodeSizeComment(true), null);
    Assert.assertTrue(
        text, text.startsWith("// Code Size: 7 (0x7) bytes\n.maxstack 8\n.entrypoint\n"));
  }

  @Test
  public void testCancelDuringStructuringFallsBack() throws CancelException {
    MethodDefinition method = MethodBodies.method("Count", MethodBodies.whileLoop());
    MethodDebugInfoBuilder builder = new MethodDebugInfoBuilder(method);
    StringBuilderDecompilerOutput output = new StringBuilderDecompilerOutput();
    boolean structured =
        new MethodBodyDisassembler(output, new DisassemblerOptions())
            .disassemble(method, builder, new CancelingMonitor(1));
    Assert.assertFalse(structured);
    Assert.assertTrue(output.getText().contains("// Structuring canceled"));
    assertEachInstructionMappedOnce(method.getBody(), builder);
  }

  @Test(expected = CancelException.class)
  public void testCancelDuringListingPropagates() throws CancelException {
    MethodDefinition method = MethodBodies.method("Count", MethodBodies.whileLoop());
    new MethodBodyDisassembler(new StringBuilderDecompilerOutput(), new DisassemblerOptions())
        .disassemble(method, null, new CancelingMonitor(Integer.MAX_VALUE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMethodWithoutBody() throws CancelException {
    MethodDefinition method = MethodBodies.method("Abstract", null);
    disassemble(method, new DisassemblerOptions(), null);
  }

  @Test
  public void testDefaultsComeFromProperties() {
    DisassemblerOptions options = DisassemblerOptions.getDefault();
    Assert.assertTrue(options.isDetectControlStructure());
    Assert.assertEquals(500, options.getMaxStructureDepth());
    Assert.assertNull(options.getModule());
  }
}
