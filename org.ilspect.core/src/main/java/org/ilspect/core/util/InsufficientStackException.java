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
package org.ilspect.core.util;

import com.ibm.wala.util.WalaRuntimeException;

/** Thrown when a recursive walk would exceed its configured depth. */
public class InsufficientStackException extends WalaRuntimeException {

  private static final long serialVersionUID = -2947612038847231905L;

  public InsufficientStackException(String message) {
    super(message);
  }
}
