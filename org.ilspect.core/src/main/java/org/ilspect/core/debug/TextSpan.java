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

/** A range of character positions in the emitted text. */
public final class TextSpan {

  private final int start;

  private final int length;

  public TextSpan(int start, int length) {
    this.start = start;
    this.length = length;
  }

  public static TextSpan fromBounds(int start, int end) {
    return new TextSpan(start, end - start);
  }

  public int getStart() {
    return start;
  }

  public int getLength() {
    return length;
  }

  public int getEnd() {
    return start + length;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TextSpan)) {
      return false;
    }
    TextSpan other = (TextSpan) obj;
    return start == other.start && length == other.length;
  }

  @Override
  public int hashCode() {
    return start * 31 + length;
  }

  @Override
  public String toString() {
    return "(" + start + "," + getEnd() + ")";
  }
}
