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

import com.ibm.wala.util.WalaException;

/** The exception handler table of a method cannot be arranged into properly nested regions. */
public class InvalidStructureException extends WalaException {

  private static final long serialVersionUID = 6210978354187216403L;

  public InvalidStructureException(String message) {
    super(message);
  }
}
