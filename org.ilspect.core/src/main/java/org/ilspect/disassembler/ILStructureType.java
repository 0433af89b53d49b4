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

public enum ILStructureType {
  /** the whole method body */
  ROOT,
  /** a natural loop, recovered from a back edge */
  LOOP,
  /** a protected region */
  TRY,
  /** a catch, finally or fault handler */
  HANDLER,
  /** the filter expression of a filtered handler */
  FILTER
}
