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
import java.util.Collections;
import java.util.List;
import org.ilspect.core.metadata.MethodReference;

/** Collects the source statements produced while one method is written out. */
public class MethodDebugInfoBuilder {

  private final MethodReference method;

  private final List<SourceStatement> statements = new ArrayList<>();

  public MethodDebugInfoBuilder(MethodReference method) {
    this.method = method;
  }

  public MethodReference getMethod() {
    return method;
  }

  public void add(SourceStatement statement) {
    statements.add(statement);
  }

  public List<SourceStatement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  /** the statements whose binary span contains {@code offset}, in emission order */
  public List<SourceStatement> getStatementsAt(int offset) {
    List<SourceStatement> result = new ArrayList<>();
    for (SourceStatement s : statements) {
      if (s.getBinSpan().contains(offset)) {
        result.add(s);
      }
    }
    return result;
  }

  /** the recorded statements ordered by binary offset */
  public List<SourceStatement> create() {
    List<SourceStatement> result = new ArrayList<>(statements);
    result.sort((a, b) -> a.getBinSpan().compareTo(b.getBinSpan()));
    return result;
  }
}
