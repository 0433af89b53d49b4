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

public class StringBuilderDecompilerOutput implements DecompilerOutput {

  private final StringBuilder text = new StringBuilder();

  private final String indentString;

  private int indent;

  private boolean needsIndent;

  public StringBuilderDecompilerOutput() {
    this("\t");
  }

  public StringBuilderDecompilerOutput(String indentString) {
    this.indentString = indentString;
  }

  private void writeIndent() {
    if (needsIndent) {
      needsIndent = false;
      for (int i = 0; i < indent; i++) {
        text.append(indentString);
      }
    }
  }

  @Override
  public void write(String s) {
    writeIndent();
    text.append(s);
  }

  @Override
  public void writeLine() {
    text.append('\n');
    needsIndent = true;
  }

  @Override
  public void indent() {
    indent++;
  }

  @Override
  public void unindent() {
    assert indent > 0 : "unbalanced indentation";
    indent--;
  }

  @Override
  public int getNextPosition() {
    return text.length() + (needsIndent ? indent * indentString.length() : 0);
  }

  public String getText() {
    return text.toString();
  }

  @Override
  public String toString() {
    return text.toString();
  }
}
