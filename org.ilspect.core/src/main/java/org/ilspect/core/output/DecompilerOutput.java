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
package org.ilspect.core.output;

/** Sink for emitted text. Positions are character offsets from the start of the output. */
public interface DecompilerOutput {

  void write(String text);

  void writeLine();

  default void writeLine(String text) {
    write(text);
    writeLine();
  }

  void indent();

  void unindent();

  /** the position at which the next non-indentation character will be written */
  int getNextPosition();
}
