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
package org.ilspect.ilast;

import org.ilspect.core.cil.LocalVariable;
import org.ilspect.core.metadata.ParameterDefinition;
import org.ilspect.core.metadata.TypeReference;

public class ILVariable {

  private String name;

  private boolean generatedByDecompiler;

  private boolean generatedByDecompilerButCanBeRenamed;

  private TypeReference type;

  private LocalVariable originalVariable;

  private ParameterDefinition originalParameter;

  private Object id;

  public ILVariable(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public boolean isGeneratedByDecompiler() {
    return generatedByDecompiler;
  }

  public void setGeneratedByDecompiler(boolean generatedByDecompiler) {
    this.generatedByDecompiler = generatedByDecompiler;
  }

  public boolean isGeneratedByDecompilerButCanBeRenamed() {
    return generatedByDecompilerButCanBeRenamed;
  }

  public void setGeneratedByDecompilerButCanBeRenamed(boolean value) {
    this.generatedByDecompilerButCanBeRenamed = value;
  }

  public TypeReference getType() {
    return type;
  }

  public void setType(TypeReference type) {
    this.type = type;
  }

  public LocalVariable getOriginalVariable() {
    return originalVariable;
  }

  public void setOriginalVariable(LocalVariable originalVariable) {
    this.originalVariable = originalVariable;
  }

  public ParameterDefinition getOriginalParameter() {
    return originalParameter;
  }

  public void setOriginalParameter(ParameterDefinition originalParameter) {
    this.originalParameter = originalParameter;
  }

  /**
   * A token that is identical for this variable only. Later passes use it as a key where variables
   * are compared by reference.
   */
  public synchronized Object getId() {
    if (id == null) {
      id = new Object();
    }
    return id;
  }

  public boolean isPinned() {
    return originalVariable != null && originalVariable.isPinned();
  }

  public boolean isParameter() {
    return originalParameter != null;
  }

  @Override
  public String toString() {
    return name;
  }
}
