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
package org.ilspect.cast;

import com.ibm.wala.util.CancelException;
import com.ibm.wala.util.MonitorUtil;
import com.ibm.wala.util.MonitorUtil.IProgressMonitor;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.metadata.ModuleDefinition;
import org.ilspect.core.metadata.TypeDefinition;

/**
 * What is being decompiled right now, plus the settings and the progress monitor. A context is
 * used by one thread at a time.
 */
public class DecompilerContext {

  private final ModuleDefinition currentModule;

  private final DecompilerSettings settings;

  private TypeDefinition currentType;

  private MethodDefinition currentMethod;

  private IProgressMonitor monitor;

  public DecompilerContext(ModuleDefinition currentModule) {
    this(currentModule, DecompilerSettings.getDefault());
  }

  public DecompilerContext(ModuleDefinition currentModule, DecompilerSettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("null settings");
    }
    this.currentModule = currentModule;
    this.settings = settings;
  }

  public ModuleDefinition getCurrentModule() {
    return currentModule;
  }

  public DecompilerSettings getSettings() {
    return settings;
  }

  public TypeDefinition getCurrentType() {
    return currentType;
  }

  public DecompilerContext setCurrentType(TypeDefinition currentType) {
    this.currentType = currentType;
    return this;
  }

  public MethodDefinition getCurrentMethod() {
    return currentMethod;
  }

  public DecompilerContext setCurrentMethod(MethodDefinition currentMethod) {
    this.currentMethod = currentMethod;
    return this;
  }

  public IProgressMonitor getMonitor() {
    return monitor;
  }

  public DecompilerContext setMonitor(IProgressMonitor monitor) {
    this.monitor = monitor;
    return this;
  }

  /**
   * The module to resolve references in: that of the current method, else that of the current
   * type, else the current module. May be null.
   */
  public ModuleDefinition getModule() {
    if (currentMethod != null && currentMethod.getModule() != null) {
      return currentMethod.getModule();
    }
    if (currentType != null && currentType.getModule() != null) {
      return currentType.getModule();
    }
    return currentModule;
  }

  public void throwIfCanceled() throws CancelException {
    MonitorUtil.throwExceptionIfCanceled(monitor);
  }
}
