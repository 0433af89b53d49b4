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
package org.ilspect.core.util;

/**
 * Depth counter for recursive descents over untrusted input. Every {@link #enter()} must be paired
 * with an {@link #exit()} in a {@code finally} block.
 */
public final class StackGuard {

  private final int maxDepth;

  private int depth;

  public StackGuard(int maxDepth) {
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  public void enter() {
    if (depth >= maxDepth) {
      throw new InsufficientStackException("recursion deeper than " + maxDepth);
    }
    depth++;
  }

  public void exit() {
    assert depth > 0;
    depth--;
  }

  public int getDepth() {
    return depth;
  }

  public int getMaxDepth() {
    return maxDepth;
  }
}
