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
import com.ibm.wala.util.MonitorUtil;
import com.ibm.wala.util.MonitorUtil.IProgressMonitor;
import com.ibm.wala.util.collections.HashSetFactory;
import java.util.List;
import java.util.Set;
import org.ilspect.core.cil.ExceptionHandler;
import org.ilspect.core.cil.FlowControl;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.LocalVariable;
import org.ilspect.core.cil.MethodBody;
import org.ilspect.core.debug.BinSpan;
import org.ilspect.core.debug.MethodDebugInfoBuilder;
import org.ilspect.core.debug.SourceStatement;
import org.ilspect.core.debug.TextSpan;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.output.DecompilerOutput;
import org.ilspect.core.util.InsufficientStackException;
import org.ilspect.core.util.StackGuard;

/**
 * Disassembles a method body, optionally indenting loops and exception regions.
 *
 * <p>Structuring is best effort. When the handler table does not nest, when the nesting is deeper
 * than {@link DisassemblerOptions#getMaxStructureDepth()}, or when the monitor cancels while the
 * structure is computed, the method is written as a flat listing preceded by a comment saying why.
 */
public class MethodBodyDisassembler {

  private static final boolean DEBUG = false;

  private final DecompilerOutput output;

  private final boolean detectControlStructure;

  private final DisassemblerOptions options;

  public MethodBodyDisassembler(
      DecompilerOutput output, boolean detectControlStructure, DisassemblerOptions options) {
    if (output == null) {
      throw new IllegalArgumentException("output is null");
    }
    this.output = output;
    this.detectControlStructure = detectControlStructure;
    this.options = options == null ? new DisassemblerOptions() : options;
  }

  public MethodBodyDisassembler(DecompilerOutput output, DisassemblerOptions options) {
    this(output, options.isDetectControlStructure(), options);
  }

  /**
   * @param builder receives one source statement per written instruction; may be null
   * @param monitor polled for cancellation; may be null
   * @return true if the body was written with its control structure
   * @throws CancelException if the monitor cancels while the flat listing is written
   */
  public boolean disassemble(
      MethodDefinition method, MethodDebugInfoBuilder builder, IProgressMonitor monitor)
      throws CancelException {
    MethodBody body = method.getBody();
    if (body == null) {
      throw new IllegalArgumentException(method + " has no body");
    }
    writeHeader(method, body);

    if (detectControlStructure && !body.getInstructions().isEmpty()) {
      ILStructure root = null;
      try {
        root = new ILStructure(body, monitor);
        if (root.getDepth() > options.getMaxStructureDepth()) {
          throw new InsufficientStackException(
              "nesting depth " + root.getDepth() + " exceeds " + options.getMaxStructureDepth());
        }
      } catch (InvalidStructureException | InsufficientStackException e) {
        if (DEBUG) {
          System.err.println("structuring failed for " + method + ": " + e.getMessage());
        }
        output.writeLine("// Structuring failed: " + e.getMessage());
        root = null;
      } catch (CancelException e) {
        output.writeLine("// Structuring canceled: " + e.getMessage());
        root = null;
      }
      if (root != null) {
        Set<Integer> branchTargets = getBranchTargets(body.getInstructions());
        StructureWriter writer =
            new StructureWriter(body, branchTargets, builder, options.getMaxStructureDepth());
        writer.writeStructureBody(root);
        assert writer.index == body.getInstructions().size() : "not all instructions written";
        return true;
      }
    }

    writeFlat(body, builder, monitor);
    return false;
  }

  private void writeHeader(MethodDefinition method, MethodBody body) {
    int codeSize = body.getCodeSize();
    if (options.isShowCodeSizeComment()) {
      output.writeLine(
          String.format(
              "// Code Size: %d (0x%X) %s", codeSize, codeSize, codeSize == 1 ? "byte" : "bytes"));
    }
    output.writeLine(".maxstack " + body.getMaxStack());
    if (options.getModule() != null && options.getModule().isEntryPoint(method)) {
      output.writeLine(".entrypoint");
    }

    if (body.hasVariables()) {
      output.write(".locals ");
      if (body.isInitLocals()) {
        output.write("init ");
      }
      output.write("(");
      output.writeLine();
      output.indent();
      List<LocalVariable> variables = body.getVariables();
      for (int i = 0; i < variables.size(); i++) {
        LocalVariable v = variables.get(i);
        output.write("[" + v.getIndex() + "] ");
        output.write(v.getType() == null ? "?" : v.getType().getFullName());
        if (v.getName() != null && !v.getName().isEmpty()) {
          output.write(" " + DisassemblerHelpers.escape(v.getName()));
        }
        if (i + 1 < variables.size()) {
          output.write(",");
        }
        output.writeLine();
      }
      output.unindent();
      output.write(")");
      output.writeLine();
    }
    output.writeLine();
  }

  private void writeFlat(MethodBody body, MethodDebugInfoBuilder builder, IProgressMonitor monitor)
      throws CancelException {
    List<Instruction> instructions = body.getInstructions();
    int codeSize = body.getCodeSize();
    for (int i = 0; i < instructions.size(); i++) {
      if (monitor != null) {
        MonitorUtil.throwExceptionIfCanceled(monitor);
      }
      Instruction inst = instructions.get(i);
      int startLocation = DisassemblerHelpers.writeTo(inst, output);
      if (builder != null) {
        Instruction next = i + 1 < instructions.size() ? instructions.get(i + 1) : null;
        builder.add(
            new SourceStatement(
                BinSpan.fromBounds(inst.getOffset(), next == null ? codeSize : next.getOffset()),
                TextSpan.fromBounds(startLocation, output.getNextPosition())));
      }
      output.writeLine();
    }
    if (!body.getExceptionHandlers().isEmpty()) {
      output.writeLine();
      for (ExceptionHandler eh : body.getExceptionHandlers()) {
        DisassemblerHelpers.writeTo(eh, output, codeSize);
        output.writeLine();
      }
    }
  }

  static Set<Integer> getBranchTargets(Iterable<Instruction> instructions) {
    Set<Integer> branchTargets = HashSetFactory.make();
    for (Instruction inst : instructions) {
      for (Instruction target : inst.getBranchTargets()) {
        branchTargets.add(target.getOffset());
      }
    }
    return branchTargets;
  }

  private void writeStructureHeader(ILStructure s) {
    switch (s.getType()) {
      case LOOP:
        output.write("// loop start");
        if (s.getLoopEntryPoint() != null) {
          output.write(" (head: ");
          DisassemblerHelpers.writeOffsetReference(output, s.getLoopEntryPoint());
          output.write(")");
        }
        output.writeLine();
        break;
      case TRY:
        output.writeLine(".try");
        output.writeLine("{");
        break;
      case HANDLER:
        ExceptionHandler eh = s.getExceptionHandler();
        switch (eh.getHandlerType()) {
          case CATCH:
          case FILTER:
            output.write("catch");
            if (eh.getCatchType() != null) {
              output.write(" " + eh.getCatchType().getFullName());
            }
            output.writeLine();
            break;
          case FINALLY:
            output.writeLine("finally");
            break;
          case FAULT:
            output.writeLine("fault");
            break;
          default:
            output.writeLine(eh.getHandlerType().toString());
        }
        output.writeLine("{");
        break;
      case FILTER:
        output.writeLine("filter");
        output.writeLine("{");
        break;
      default:
        throw new IllegalStateException("unexpected nested structure " + s);
    }
    output.indent();
  }

  private void writeStructureFooter(ILStructure s) {
    output.unindent();
    switch (s.getType()) {
      case LOOP:
        output.writeLine("// end loop");
        break;
      case TRY:
        output.writeLine("} // end .try");
        break;
      case HANDLER:
        output.writeLine("} // end handler");
        break;
      case FILTER:
        output.writeLine("} // end filter");
        break;
      default:
        throw new IllegalStateException("unexpected nested structure " + s);
    }
  }

  /** State of one structured walk over the instruction list. */
  private final class StructureWriter {

    private final List<Instruction> instructions;

    private final Set<Integer> branchTargets;

    private final MethodDebugInfoBuilder builder;

    private final int codeSize;

    private final StackGuard guard;

    private int index;

    StructureWriter(
        MethodBody body,
        Set<Integer> branchTargets,
        MethodDebugInfoBuilder builder,
        int maxDepth) {
      this.instructions = body.getInstructions();
      this.codeSize = body.getCodeSize();
      this.branchTargets = branchTargets;
      this.builder = builder;
      this.guard = new StackGuard(maxDepth + 1);
    }

    void writeStructureBody(ILStructure s) {
      guard.enter();
      try {
        boolean isFirstInstructionInStructure = true;
        boolean prevInstructionWasBranch = false;
        int childIndex = 0;
        List<ILStructure> children = s.getChildren();
        while (index < instructions.size()) {
          Instruction inst = instructions.get(index);
          int offset = inst.getOffset();
          if (offset >= s.getEndOffset()) {
            break;
          }
          if (childIndex < children.size() && children.get(childIndex).contains(offset)) {
            ILStructure child = children.get(childIndex++);
            writeStructureHeader(child);
            writeStructureBody(child);
            writeStructureFooter(child);
          } else {
            if (!isFirstInstructionInStructure
                && (prevInstructionWasBranch || branchTargets.contains(offset))) {
              // blank line after branches and in front of branch targets
              output.writeLine();
            }
            int startLocation = DisassemblerHelpers.writeTo(inst, output);
            if (builder != null) {
              Instruction next =
                  index + 1 < instructions.size() ? instructions.get(index + 1) : null;
              builder.add(
                  new SourceStatement(
                      BinSpan.fromBounds(offset, next == null ? codeSize : next.getOffset()),
                      TextSpan.fromBounds(startLocation, output.getNextPosition())));
            }
            output.writeLine();

            FlowControl flow = inst.getFlowControl();
            prevInstructionWasBranch =
                flow == FlowControl.BRANCH
                    || flow == FlowControl.COND_BRANCH
                    || flow == FlowControl.RETURN
                    || flow == FlowControl.THROW;
            index++;
          }
          isFirstInstructionInStructure = false;
        }
      } finally {
        guard.exit();
      }
    }
  }
}
