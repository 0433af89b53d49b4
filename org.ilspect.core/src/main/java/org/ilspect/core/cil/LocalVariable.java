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
package org.ilspect.core.cil;

import org.ilspect.core.metadata.TypeReference;

public class LocalVariable {

  private final int index;

  private final String name;

  private final TypeReference type;

  public LocalVariable(int index, String name, TypeReference type) {
    this.index = index;
    this.name = name;
    this.type = type;
  }

  public int getIndex() {
    return index;
  }

  /** the debug name, or null when the symbols do not provide one */
  public String getName() {
    return name;
  }

  public TypeReference getType() {
    return type;
  }

  public boolean isPinned() {
    return type != null && type.getKind() == TypeReference.Kind.PINNED;
  }

  @Override
  public String toString() {
    return name != null ? name : "V_" + index;
  }
}
