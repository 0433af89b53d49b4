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
package org.ilspect.disassembler;

import java.util.Properties;
import org.ilspect.core.metadata.ModuleDefinition;
import org.ilspect.core.util.IlspectProperties;

public class DisassemblerOptions {

  private ModuleDefinition module;

  private boolean detectControlStructure = true;

  private boolean showCodeSizeComment;

  private int maxStructureDepth = 500;

  public static DisassemblerOptions fromProperties(Properties p) {
    DisassemblerOptions options = new DisassemblerOptions();
    options.detectControlStructure =
        IlspectProperties.getBoolean(
            p, IlspectProperties.DETECT_CONTROL_STRUCTURE, options.detectControlStructure);
    options.maxStructureDepth =
        IlspectProperties.getInt(
            p, IlspectProperties.MAX_STRUCTURE_DEPTH, options.maxStructureDepth);
    return options;
  }

  public static DisassemblerOptions getDefault() {
    return fromProperties(IlspectProperties.getProperties());
  }

  /** the module used to recognize the entry point; may be null */
  public ModuleDefinition getModule() {
    return module;
  }

  public DisassemblerOptions setModule(ModuleDefinition module) {
    this.module = module;
    return this;
  }

  public boolean isDetectControlStructure() {
    return detectControlStructure;
  }

  public DisassemblerOptions setDetectControlStructure(boolean detectControlStructure) {
    this.detectControlStructure = detectControlStructure;
    return this;
  }

  public boolean isShowCodeSizeComment() {
    return showCodeSizeComment;
  }

  public DisassemblerOptions setShowCodeSizeComment(boolean showCodeSizeComment) {
    this.showCodeSizeComment = showCodeSizeComment;
    return this;
  }

  public int getMaxStructureDepth() {
    return maxStructureDepth;
  }

  public DisassemblerOptions setMaxStructureDepth(int maxStructureDepth) {
    this.maxStructureDepth = maxStructureDepth;
    return this;
  }
}
