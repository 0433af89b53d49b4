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
package org.ilspect.core.debug;

import java.util.ArrayList;
import java.util.List;

/**
 * A range {@code [start, start + length)} of offsets into the original instruction stream.
 *
 * <p>Lists of spans attached to decompiled nodes are kept unordered while transforms run; {@link
 * #orderAndCompact(Iterable)} normalizes them right before debug information is emitted.
 */
public final class BinSpan implements Comparable<BinSpan> {

  private final int start;

  private final int length;

  public BinSpan(int start, int length) {
    if (start < 0 || length < 0) {
      throw new IllegalArgumentException("bad span " + start + "+" + length);
    }
    this.start = start;
    this.length = length;
  }

  public static BinSpan fromBounds(int start, int end) {
    return new BinSpan(start, end - start);
  }

  public int getStart() {
    return start;
  }

  public int getLength() {
    return length;
  }

  /** exclusive */
  public int getEnd() {
    return start + length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  public boolean contains(int offset) {
    return offset >= start && offset < getEnd();
  }

  /**
   * Sorts the spans by start offset and merges every pair that overlaps or touches. Empty spans
   * are dropped. The input is not modified.
   */
  public static List<BinSpan> orderAndCompact(Iterable<BinSpan> spans) {
    List<BinSpan> sorted = new ArrayList<>();
    for (BinSpan s : spans) {
      if (!s.isEmpty()) {
        sorted.add(s);
      }
    }
    sorted.sort(null);

    List<BinSpan> result = new ArrayList<>(sorted.size());
    BinSpan current = null;
    for (BinSpan s : sorted) {
      if (current == null) {
        current = s;
      } else if (s.start <= current.getEnd()) {
        current = fromBounds(current.start, Math.max(current.getEnd(), s.getEnd()));
      } else {
        result.add(current);
        current = s;
      }
    }
    if (current != null) {
      result.add(current);
    }
    return result;
  }

  @Override
  public int compareTo(BinSpan o) {
    int c = Integer.compare(start, o.start);
    return c != 0 ? c : Integer.compare(length, o.length);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BinSpan)) {
      return false;
    }
    BinSpan other = (BinSpan) obj;
    return start == other.start && length == other.length;
  }

  @Override
  public int hashCode() {
    return start * 31 + length;
  }

  @Override
  public String toString() {
    return String.format("[%04X-%04X)", start, getEnd());
  }
}
