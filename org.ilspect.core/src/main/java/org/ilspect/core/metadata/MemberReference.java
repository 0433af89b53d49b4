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

/** Common view of field, method and property references. */
public interface MemberReference {

  TypeReference getDeclaringType();

  String getName();

  default String getFullName() {
    return getDeclaringType().getFullName() + "::" + getName();
  }
}
