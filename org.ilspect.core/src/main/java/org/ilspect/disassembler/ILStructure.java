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
import com.ibm.wala.util.collections.HashMapFactory;
import com.ibm.wala.util.collections.HashSetFactory;
import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.GraphInverter;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import org.ilspect.core.cil.ExceptionHandler;
import org.ilspect.core.cil.ExceptionHandlerType;
import org.ilspect.core.cil.Instruction;
import org.ilspect.core.cil.MethodBody;

/**
 * One nesting level of a method body: the body itself, a loop, a protected region, a handler or a
 * filter. Children are sorted by offset, do not overlap, and lie within the parent's range.
 *
 * <p>Exception regions come from the handler table and must nest; a table that does not is
 * rejected with an {@link InvalidStructureException}. Loops are natural loops of the instruction
 * flow graph; a loop that has several entry points or that would cut across another structure is
 * left out.
 */
public class ILStructure {

  private static final boolean DEBUG = false;

  private final ILStructureType type;

  private final int startOffset;

  /** exclusive */
  private final int endOffset;

  private final ExceptionHandler exceptionHandler;

  private final Instruction loopEntryPoint;

  private final List<ILStructure> children = new ArrayList<>();

  public ILStructure(MethodBody body) throws InvalidStructureException {
    this(ILStructureType.ROOT, 0, body.getCodeSize(), null, null);
    try {
      build(body, null);
    } catch (CancelException e) {
      throw new IllegalStateException("no monitor, cannot be canceled", e);
    }
  }

  public ILStructure(MethodBody body, IProgressMonitor monitor)
      throws InvalidStructureException, CancelException {
    this(ILStructureType.ROOT, 0, body.getCodeSize(), null, null);
    build(body, monitor);
  }

  ILStructure(ILStructureType type, int startOffset, int endOffset, ExceptionHandler handler) {
    this(type, startOffset, endOffset, handler, null);
  }

  ILStructure(ILStructureType type, int startOffset, int endOffset, Instruction loopEntryPoint) {
    this(type, startOffset, endOffset, null, loopEntryPoint);
  }

  private ILStructure(
      ILStructureType type,
      int startOffset,
      int endOffset,
      ExceptionHandler handler,
      Instruction loopEntryPoint) {
    this.type = type;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.exceptionHandler = handler;
    this.loopEntryPoint = loopEntryPoint;
  }

  public ILStructureType getType() {
    return type;
  }

  public int getStartOffset() {
    return startOffset;
  }

  public int getEndOffset() {
    return endOffset;
  }

  public ExceptionHandler getExceptionHandler() {
    return exceptionHandler;
  }

  /** for loops, the instruction control enters the loop through, if known */
  public Instruction getLoopEntryPoint() {
    return loopEntryPoint;
  }

  public List<ILStructure> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public boolean contains(int offset) {
    return startOffset <= offset && offset < endOffset;
  }

  /** the innermost structure containing {@code offset}, or this structure */
  public ILStructure getInnermost(int offset) {
    for (ILStructure child : children) {
      if (child.contains(offset)) {
        return child.getInnermost(offset);
      }
    }
    return this;
  }

  /** nesting depth below this structure; 0 for a structure without children */
  public int getDepth() {
    int depth = 0;
    for (ILStructure child : children) {
      depth = Math.max(depth, child.getDepth() + 1);
    }
    return depth;
  }

  private static void checkCanceled(IProgressMonitor monitor) throws CancelException {
    if (monitor != null) {
      MonitorUtil.throwExceptionIfCanceled(monitor);
    }
  }

  private void build(MethodBody body, IProgressMonitor monitor)
      throws InvalidStructureException, CancelException {
    int codeSize = body.getCodeSize();
    Set<Integer> boundaries = HashSetFactory.make();
    for (Instruction inst : body.getInstructions()) {
      boundaries.add(inst.getOffset());
    }
    boundaries.add(codeSize);

    List<ExceptionHandler> handlers = body.getExceptionHandlers();
    for (int i = 0; i < handlers.size(); i++) {
      checkCanceled(monitor);
      ExceptionHandler eh = handlers.get(i);
      int tryStart = startOf(eh.getTryStart(), "try start", eh);
      int tryEnd = endOf(eh.getTryEnd(), codeSize);
      int handlerStart = startOf(eh.getHandlerStart(), "handler start", eh);
      int handlerEnd = endOf(eh.getHandlerEnd(), codeSize);

      if (!isSameTryRange(handlers, i, tryStart, tryEnd, codeSize)) {
        addExceptionStructure(
            new ILStructure(ILStructureType.TRY, tryStart, tryEnd, eh), boundaries, codeSize);
      }
      if (eh.getHandlerType() == ExceptionHandlerType.FILTER) {
        int filterStart = startOf(eh.getFilterStart(), "filter start", eh);
        addExceptionStructure(
            new ILStructure(ILStructureType.FILTER, filterStart, handlerStart, eh),
            boundaries,
            codeSize);
      }
      addExceptionStructure(
          new ILStructure(ILStructureType.HANDLER, handlerStart, handlerEnd, eh),
          boundaries,
          codeSize);
    }

    for (ILStructure loop : findLoops(body, monitor)) {
      checkCanceled(monitor);
      if (!addNestedStructure(loop) && DEBUG) {
        System.err.println("dropped loop " + loop);
      }
    }

    sortChildren();
  }

  private static int startOf(Instruction inst, String what, ExceptionHandler eh)
      throws InvalidStructureException {
    if (inst == null) {
      throw new InvalidStructureException("missing " + what + " in " + eh);
    }
    return inst.getOffset();
  }

  private static int endOf(Instruction inst, int codeSize) {
    return inst == null ? codeSize : inst.getOffset();
  }

  private static boolean isSameTryRange(
      List<ExceptionHandler> handlers, int i, int tryStart, int tryEnd, int codeSize) {
    for (int j = 0; j < i; j++) {
      ExceptionHandler old = handlers.get(j);
      if (old.getTryStart() != null
          && old.getTryStart().getOffset() == tryStart
          && endOf(old.getTryEnd(), codeSize) == tryEnd) {
        return true;
      }
    }
    return false;
  }

  private void addExceptionStructure(ILStructure s, Set<Integer> boundaries, int codeSize)
      throws InvalidStructureException {
    if (s.startOffset >= s.endOffset || s.endOffset > codeSize) {
      throw new InvalidStructureException("bad range for " + s);
    }
    if (!boundaries.contains(s.startOffset) || !boundaries.contains(s.endOffset)) {
      throw new InvalidStructureException(s + " does not start and end on instructions");
    }
    if (!addNestedStructure(s)) {
      throw new InvalidStructureException(s + " overlaps another region");
    }
  }

  /**
   * Inserts {@code s} at the right depth of this tree, adopting the existing structures it
   * contains.
   *
   * @return false if {@code s} would partially overlap an existing structure, or if it is a loop
   *     sharing its header with the enclosing loop
   */
  boolean addNestedStructure(ILStructure s) {
    if (this.type == ILStructureType.LOOP
        && s.type == ILStructureType.LOOP
        && s.startOffset == this.startOffset) {
      return false;
    }
    assert startOffset <= s.startOffset && s.endOffset <= endOffset;
    for (ILStructure child : children) {
      if (child.startOffset <= s.startOffset && s.endOffset <= child.endOffset) {
        return child.addNestedStructure(s);
      } else if (!(child.endOffset <= s.startOffset || s.endOffset <= child.startOffset)) {
        if (!(s.startOffset <= child.startOffset && child.endOffset <= s.endOffset)) {
          return false;
        }
      }
    }
    for (Iterator<ILStructure> it = children.iterator(); it.hasNext(); ) {
      ILStructure child = it.next();
      if (s.startOffset <= child.startOffset && child.endOffset <= s.endOffset) {
        it.remove();
        s.children.add(child);
      }
    }
    children.add(s);
    return true;
  }

  private void sortChildren() {
    children.sort(Comparator.comparingInt(ILStructure::getStartOffset));
    for (ILStructure child : children) {
      child.sortChildren();
    }
  }

  /**
   * Natural loops of the instruction flow graph, largest first. Back edges are found from the DFS
   * discover and finish times; a loop is the set of instructions that reach a latch from the
   * header without crossing a back edge. The loop's range runs from its first instruction to the
   * end of its last one, so a header laid out after the body is entered by a jump.
   */
  private static List<ILStructure> findLoops(MethodBody body, IProgressMonitor monitor)
      throws CancelException {
    List<Instruction> insts = body.getInstructions();
    if (insts.isEmpty()) {
      return Collections.emptyList();
    }

    SlowSparseNumberedGraph<Instruction> cfg = SlowSparseNumberedGraph.make();
    insts.forEach(cfg::addNode);
    for (int i = 0; i < insts.size(); i++) {
      Instruction inst = insts.get(i);
      if (!inst.getFlowControl().isUnconditionalTransfer() && i + 1 < insts.size()) {
        cfg.addEdge(inst, insts.get(i + 1));
      }
      for (Instruction target : inst.getBranchTargets()) {
        if (cfg.containsNode(target)) {
          cfg.addEdge(inst, target);
        }
      }
    }

    List<Instruction> roots = new ArrayList<>();
    roots.add(insts.get(0));
    for (ExceptionHandler eh : body.getExceptionHandlers()) {
      if (eh.getHandlerStart() != null && cfg.containsNode(eh.getHandlerStart())) {
        roots.add(eh.getHandlerStart());
      }
      if (eh.getFilterStart() != null && cfg.containsNode(eh.getFilterStart())) {
        roots.add(eh.getFilterStart());
      }
    }

    Map<Instruction, Integer> startTimes = HashMapFactory.make();
    int time = 0;
    Iterator<Instruction> discover = DFS.iterateDiscoverTime(cfg, roots.iterator());
    while (discover.hasNext()) {
      startTimes.put(discover.next(), time++);
    }
    Map<Instruction, Integer> finishTimes = HashMapFactory.make();
    time = 0;
    for (Iterator<Instruction> it = DFS.iterateFinishTime(cfg, roots.iterator()); it.hasNext(); ) {
      finishTimes.put(it.next(), time++);
    }

    BiPredicate<Instruction, Instruction> isBackEdge =
        (pred, succ) ->
            startTimes.containsKey(pred)
                && startTimes.containsKey(succ)
                && startTimes.get(pred) >= startTimes.get(succ)
                && finishTimes.get(pred) <= finishTimes.get(succ);

    SlowSparseNumberedGraph<Instruction> cfgNoBack = SlowSparseNumberedGraph.make();
    insts.forEach(cfgNoBack::addNode);
    Map<Instruction, Set<Instruction>> latches = HashMapFactory.make();
    for (Instruction inst : insts) {
      for (Iterator<Instruction> ss = cfg.getSuccNodes(inst); ss.hasNext(); ) {
        Instruction succ = ss.next();
        if (isBackEdge.test(inst, succ)) {
          latches.computeIfAbsent(succ, k -> HashSetFactory.make()).add(inst);
        } else {
          cfgNoBack.addEdge(inst, succ);
        }
      }
    }
    if (DEBUG) {
      System.err.println("loop headers: " + latches.keySet());
    }

    Graph<Instruction> inverted = GraphInverter.invert(cfgNoBack);
    List<ILStructure> loops = new ArrayList<>();
    for (Map.Entry<Instruction, Set<Instruction>> e : latches.entrySet()) {
      checkCanceled(monitor);
      Instruction header = e.getKey();
      Set<Instruction> forward = DFS.getReachableNodes(cfgNoBack, Collections.singleton(header));
      Set<Instruction> loop = HashSetFactory.make(forward);
      loop.retainAll(DFS.getReachableNodes(inverted, e.getValue()));
      loop.add(header);

      int loopStart = header.getOffset();
      int loopEnd = loopStart;
      for (Instruction inst : loop) {
        loopStart = Math.min(loopStart, inst.getOffset());
        loopEnd = Math.max(loopEnd, inst.getOffset() + inst.getSize());
      }

      boolean[] multipleEntryPoints = new boolean[1];
      Instruction entryPoint =
          findEntryPoint(insts, loopStart, loopEnd, multipleEntryPoints);
      if (multipleEntryPoints[0]) {
        if (DEBUG) {
          System.err.println("multiple entry points for loop at " + header);
        }
        continue;
      }
      if (DEBUG) {
        System.err.println("loop: " + header + " .. " + loopEnd);
      }
      loops.add(new ILStructure(ILStructureType.LOOP, loopStart, loopEnd, entryPoint));
    }

    loops.sort(
        Comparator.comparingInt((ILStructure s) -> s.startOffset - s.endOffset)
            .thenComparingInt(s -> s.startOffset));
    return loops;
  }

  /**
   * The instruction control enters the range {@code [loopStart, loopEnd)} through: the first one
   * when it is reached by falling through or starts the method, otherwise the target of a branch
   * from outside. Sets {@code multiple[0]} when control enters at more than one instruction.
   */
  private static Instruction findEntryPoint(
      List<Instruction> insts, int loopStart, int loopEnd, boolean[] multiple) {
    Instruction entryPoint = null;
    for (int i = 0; i < insts.size(); i++) {
      if (insts.get(i).getOffset() == loopStart) {
        if (i == 0 || !insts.get(i - 1).getFlowControl().isUnconditionalTransfer()) {
          entryPoint = insts.get(i);
        }
        break;
      }
    }
    for (Instruction inst : insts) {
      if (inst.getOffset() >= loopStart && inst.getOffset() < loopEnd) {
        continue;
      }
      for (Instruction target : inst.getBranchTargets()) {
        if (loopStart <= target.getOffset() && target.getOffset() < loopEnd) {
          if (entryPoint == null) {
            entryPoint = target;
          } else if (target != entryPoint) {
            multiple[0] = true;
          }
        }
      }
    }
    return entryPoint;
  }

  @Override
  public String toString() {
    return type
        + " "
        + DisassemblerHelpers.offsetToString(startOffset)
        + "-"
        + DisassemblerHelpers.offsetToString(endOffset);
  }
}
