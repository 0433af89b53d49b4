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
package org.ilspect.core.metadata;

public class ParameterDefinition {

  private final String name;

  private final TypeReference type;

  public ParameterDefinition(String name, TypeReference type) {
    this.name = name;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public TypeReference getType() {
    return type;
  }

  @Override
  public String toString() {
    return type + " " + name;
  }
}
