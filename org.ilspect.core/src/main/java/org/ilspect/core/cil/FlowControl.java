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

public enum FlowControl {
  NEXT,
  BRANCH,
  COND_BRANCH,
  CALL,
  RETURN,
  THROW,
  BREAK,
  META,
  PHI;

  /** whether control never falls through to the following instruction */
  public boolean isUnconditionalTransfer() {
    return this == BRANCH || this == RETURN || this == THROW;
  }
}
