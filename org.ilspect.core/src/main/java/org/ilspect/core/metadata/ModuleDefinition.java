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

/**
 * The metadata provider seam. Resolution is in-memory and synchronous; a null result means the
 * reference cannot be resolved in this module or the modules it can see.
 */
public interface ModuleDefinition {

  String getName();

  TypeDefinition resolve(TypeReference type);

  MethodDefinition resolve(MethodReference method);

  /** the entry point method, or null for libraries */
  MethodDefinition getEntryPoint();

  default boolean isEntryPoint(MethodReference method) {
    MethodDefinition entry = getEntryPoint();
    return entry != null && entry.hasSameSignature(method);
  }
}
