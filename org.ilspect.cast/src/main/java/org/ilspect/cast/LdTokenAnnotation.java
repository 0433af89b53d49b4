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

/**
 * Marks the {@code fieldof(...)}/{@code methodof(...)} pseudo-call that stands for an {@code
 * ldtoken} of a member.
 */
public final class LdTokenAnnotation {

  public static final LdTokenAnnotation INSTANCE = new LdTokenAnnotation();

  private LdTokenAnnotation() {}

  @Override
  public String toString() {
    return "ldtoken";
  }
}
