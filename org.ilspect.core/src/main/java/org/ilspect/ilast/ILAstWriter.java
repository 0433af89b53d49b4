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
import java.util.List;
import org.ilspect.core.debug.BinSpan;
import org.ilspect.core.debug.MethodDebugInfoBuilder;
import org.ilspect.core.debug.SourceStatement;
import org.ilspect.core.debug.TextSpan;
import org.ilspect.core.metadata.FieldReference;
import org.ilspect.core.metadata.MethodReference;
import org.ilspect.core.metadata.TypeReference;
import org.ilspect.core.output.DecompilerOutput;
import org.ilspect.disassembler.DisassemblerHelpers;

/**
 * Writes the textual form of an IL AST. Every statement-level node reports its spans to the debug
 * info builder together with the text range it was written to; nested expressions are written
 * without a builder so that their spans are attributed to the enclosing statement.
 */
public class ILAstWriter implements ILNodeVisitor<Void> {

  private final DecompilerOutput output;

  private final MethodDebugInfoBuilder builder;

  public ILAstWriter(DecompilerOutput output, MethodDebugInfoBuilder builder) {
    this.output = output;
    this.builder = builder;
  }

  private void write(ILNode node, MethodDebugInfoBuilder b) {
    node.accept(b == builder ? this : new ILAstWriter(output, b));
  }

  private void updateDebugInfo(int startLoc, int endLoc, Iterable<BinSpan> spans) {
    if (builder == null) {
      return;
    }
    for (BinSpan span : BinSpan.orderAndCompact(spans)) {
      builder.add(new SourceStatement(span, TextSpan.fromBounds(startLoc, endLoc)));
    }
  }

  private static boolean writesNewLine(ILNode node) {
    return !(node instanceof ILExpression || node instanceof ILLabel);
  }

  private void writeHiddenStart(ILNode node, List<BinSpan> extraBinSpans) {
    int location = output.getNextPosition();
    output.write("{");
    List<BinSpan> spans = new ArrayList<>(node.getBinSpans());
    if (extraBinSpans != null) {
      spans.addAll(extraBinSpans);
    }
    updateDebugInfo(location, output.getNextPosition(), spans);
    output.writeLine();
    output.indent();
  }

  private void writeHiddenEnd(ILNode node) {
    output.unindent();
    int location = output.getNextPosition();
    output.write("}");
    updateDebugInfo(location, output.getNextPosition(), node.getEndBinSpans());
    output.writeLine();
  }

  private void writeBlock(ILBlockBase block, List<BinSpan> extraBinSpans) {
    writeHiddenStart(block, extraBinSpans);
    for (ILNode child : block) {
      child.accept(this);
      if (!writesNewLine(child)) {
        output.writeLine();
      }
    }
    writeHiddenEnd(block);
  }

  @Override
  public Void visitBlock(ILBlock block) {
    writeBlock(block, null);
    return null;
  }

  @Override
  public Void visitBasicBlock(ILBasicBlock block) {
    writeBlock(block, null);
    return null;
  }

  @Override
  public Void visitLabel(ILLabel label) {
    int location = output.getNextPosition();
    output.write(label.getName());
    output.write(":");
    updateDebugInfo(location, output.getNextPosition(), label.getBinSpans());
    return null;
  }

  private void writeType(TypeReference type) {
    output.write(type.getName());
  }

  private void writeTypes(ILExpression expr) {
    TypeReference inferred = expr.getInferredType();
    TypeReference expected = expr.getExpectedType();
    if (inferred != null) {
      output.write(":");
      writeType(inferred);
      if (expected != null && !expected.getFullName().equals(inferred.getFullName())) {
        output.write("[exp:");
        writeType(expected);
        output.write("]");
      }
    } else if (expected != null) {
      output.write("[exp:");
      writeType(expected);
      output.write("]");
    }
  }

  @Override
  public Void visitExpression(ILExpression expr) {
    int startLoc = output.getNextPosition();
    Object operand = expr.getOperand();
    if (operand instanceof ILVariable && ((ILVariable) operand).isGeneratedByDecompiler()) {
      ILVariable v = (ILVariable) operand;
      if (expr.getCode() == ILCode.STLOC && expr.getInferredType() == null) {
        output.write(v.getName());
        output.write(" = ");
        write(expr.getArguments().get(0), null);
        updateDebugInfo(
            startLoc, output.getNextPosition(), expr.getSelfAndChildrenRecursiveBinSpans());
        return null;
      } else if (expr.getCode() == ILCode.LDLOC) {
        output.write(v.getName());
        if (expr.getInferredType() != null) {
          writeTypes(expr);
        }
        updateDebugInfo(
            startLoc, output.getNextPosition(), expr.getSelfAndChildrenRecursiveBinSpans());
        return null;
      }
    }

    if (expr.getPrefixes() != null) {
      for (ILExpressionPrefix prefix : expr.getPrefixes()) {
        output.write(prefix.getCode().getName() + ". ");
      }
    }
    output.write(expr.getCode().getName());
    writeTypes(expr);
    output.write("(");
    boolean first = true;
    if (operand != null) {
      if (operand instanceof ILLabel) {
        output.write(((ILLabel) operand).getName());
      } else if (operand instanceof ILLabel[]) {
        ILLabel[] labels = (ILLabel[]) operand;
        for (int i = 0; i < labels.length; i++) {
          if (i > 0) {
            output.write(", ");
          }
          output.write(labels[i].getName());
        }
      } else if (operand instanceof MethodReference) {
        MethodReference method = (MethodReference) operand;
        writeType(method.getDeclaringType());
        output.write("::");
        output.write(method.getName());
      } else if (operand instanceof FieldReference) {
        FieldReference field = (FieldReference) operand;
        writeType(field.getDeclaringType());
        output.write("::");
        output.write(field.getName());
      } else if (operand instanceof ILVariable) {
        output.write(((ILVariable) operand).getName());
      } else {
        DisassemblerHelpers.writeOperand(output, operand);
      }
      first = false;
    }
    for (ILExpression arg : expr.getArguments()) {
      if (!first) {
        output.write(", ");
      }
      write(arg, null);
      first = false;
    }
    output.write(")");
    updateDebugInfo(startLoc, output.getNextPosition(), expr.getSelfAndChildrenRecursiveBinSpans());
    return null;
  }

  @Override
  public Void visitTryCatchBlock(ILTryCatchBlock tryCatch) {
    output.write(".try ");
    writeBlock(tryCatch.getTryBlock(), tryCatch.getBinSpans());
    for (ILTryCatchBlock.CatchBlock block : tryCatch.getCatchBlocks()) {
      block.accept(this);
    }
    if (tryCatch.getFaultBlock() != null) {
      output.write("fault ");
      tryCatch.getFaultBlock().accept(this);
    }
    if (tryCatch.getFinallyBlock() != null) {
      output.write("finally ");
      tryCatch.getFinallyBlock().accept(this);
    }
    if (tryCatch.getFilterBlock() != null) {
      output.write("filter ");
      tryCatch.getFilterBlock().accept(this);
    }
    return null;
  }

  @Override
  public Void visitCatchBlock(ILTryCatchBlock.CatchBlock catchBlock) {
    int startLoc = output.getNextPosition();
    ILVariable v = catchBlock.getExceptionVariable();
    if (catchBlock.isFilter()) {
      output.write("filter");
      if (v != null) {
        output.write(" " + v.getName());
      }
    } else if (catchBlock.getExceptionType() != null) {
      output.write("catch ");
      output.write(catchBlock.getExceptionType().getFullName());
      if (v != null) {
        output.write(" " + v.getName());
      }
    } else {
      output.write("handler");
      if (v != null) {
        output.write(" " + v.getName());
      }
    }
    updateDebugInfo(startLoc, output.getNextPosition(), catchBlock.getStlocBinSpans());
    output.write(" ");
    writeBlock(catchBlock, null);
    if (catchBlock instanceof ILTryCatchBlock.FilterILBlock) {
      ILTryCatchBlock.CatchBlock handler =
          ((ILTryCatchBlock.FilterILBlock) catchBlock).getHandlerBlock();
      if (handler != null) {
        handler.accept(this);
      }
    }
    return null;
  }

  private void writeHeaderSpans(int startLoc, ILNode node, List<? extends ILNode> headerNodes) {
    List<BinSpan> spans = new ArrayList<>(node.getBinSpans());
    for (ILNode n : headerNodes) {
      if (n != null) {
        n.addSelfAndChildrenRecursiveBinSpans(spans);
      }
    }
    updateDebugInfo(startLoc, output.getNextPosition(), spans);
  }

  @Override
  public Void visitWhileLoop(ILWhileLoop loop) {
    int startLoc = output.getNextPosition();
    output.write("loop (");
    if (loop.getCondition() != null) {
      write(loop.getCondition(), null);
    }
    output.write(")");
    writeHeaderSpans(startLoc, loop, Collections.singletonList(loop.getCondition()));
    output.write(" ");
    loop.getBodyBlock().accept(this);
    return null;
  }

  @Override
  public Void visitCondition(ILCondition condition) {
    int startLoc = output.getNextPosition();
    output.write("if (");
    write(condition.getCondition(), null);
    output.write(")");
    writeHeaderSpans(
        startLoc, condition, Collections.singletonList(condition.getCondition()));
    output.write(" ");
    condition.getTrueBlock().accept(this);
    if (condition.getFalseBlock() != null) {
      output.write("else ");
      condition.getFalseBlock().accept(this);
    }
    return null;
  }

  @Override
  public Void visitSwitch(ILSwitch switchNode) {
    int startLoc = output.getNextPosition();
    output.write("switch (");
    write(switchNode.getCondition(), null);
    output.write(")");
    writeHeaderSpans(
        startLoc, switchNode, Collections.singletonList(switchNode.getCondition()));
    output.write(" ");
    writeHiddenStart(switchNode, null);
    for (ILSwitch.CaseBlock caseBlock : switchNode.getCaseBlocks()) {
      caseBlock.accept(this);
    }
    writeHiddenEnd(switchNode);
    return null;
  }

  @Override
  public Void visitCaseBlock(ILSwitch.CaseBlock caseBlock) {
    if (caseBlock.getValues() != null) {
      for (int value : caseBlock.getValues()) {
        output.writeLine("case " + value + ":");
      }
    } else {
      output.writeLine("default:");
    }
    output.indent();
    writeBlock(caseBlock, null);
    output.unindent();
    return null;
  }

  @Override
  public Void visitFixedStatement(ILFixedStatement fixedStatement) {
    int startLoc = output.getNextPosition();
    output.write("fixed (");
    List<ILExpression> inits = fixedStatement.getInitializers();
    for (int i = 0; i < inits.size(); i++) {
      if (i > 0) {
        output.write(", ");
      }
      write(inits.get(i), null);
    }
    output.write(")");
    writeHeaderSpans(startLoc, fixedStatement, inits);
    output.write(" ");
    fixedStatement.getBodyBlock().accept(this);
    return null;
  }
}
