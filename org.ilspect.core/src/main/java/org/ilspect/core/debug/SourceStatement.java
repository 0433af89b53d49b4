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

import java.util.Objects;

/** Maps a range of instruction offsets to the text emitted for it. */
public final class SourceStatement {

  private final BinSpan binSpan;

  private final TextSpan textSpan;

  public SourceStatement(BinSpan binSpan, TextSpan textSpan) {
    this.binSpan = Objects.requireNonNull(binSpan);
    this.textSpan = Objects.requireNonNull(textSpan);
  }

  public BinSpan getBinSpan() {
    return binSpan;
  }

  public TextSpan getTextSpan() {
    return textSpan;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceStatement)) {
      return false;
    }
    SourceStatement other = (SourceStatement) obj;
    return binSpan.equals(other.binSpan) && textSpan.equals(other.textSpan);
  }

  @Override
  public int hashCode() {
    return binSpan.hashCode() * 31 + textSpan.hashCode();
  }

  @Override
  public String toString() {
    return binSpan + " -> " + textSpan;
  }
}
