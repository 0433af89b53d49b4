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

import java.util.Objects;

public class FieldReference implements MemberReference {

  private final TypeReference declaringType;

  private final String name;

  private final TypeReference fieldType;

  public FieldReference(TypeReference declaringType, String name, TypeReference fieldType) {
    this.declaringType = Objects.requireNonNull(declaringType);
    this.name = Objects.requireNonNull(name);
    this.fieldType = fieldType;
  }

  @Override
  public TypeReference getDeclaringType() {
    return declaringType;
  }

  @Override
  public String getName() {
    return name;
  }

  public TypeReference getFieldType() {
    return fieldType;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FieldReference)) {
      return false;
    }
    FieldReference other = (FieldReference) obj;
    return declaringType.equals(other.declaringType) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return declaringType.hashCode() * 31 + name.hashCode();
  }

  @Override
  public String toString() {
    return fieldType + " " + getFullName();
  }
}
