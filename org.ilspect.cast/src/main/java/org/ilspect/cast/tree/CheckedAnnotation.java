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
package org.ilspect.cast.tree;

/**
 * Marks an arithmetic or conversion node as evaluated in a checked or unchecked context. Unchecked
 * is the default context, so only {@link #CHECKED} shows up in printed output.
 */
public enum CheckedAnnotation {
  CHECKED,
  UNCHECKED;

  public static CheckedAnnotation of(boolean isChecked) {
    return isChecked ? CHECKED : UNCHECKED;
  }
}
