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

import java.util.Collections;
import java.util.List;

public class PropertyDefinition implements MemberReference {

  private final TypeReference declaringType;

  private final String name;

  private final TypeReference propertyType;

  private MethodDefinition getMethod;

  private MethodDefinition setMethod;

  public PropertyDefinition(TypeReference declaringType, String name, TypeReference propertyType) {
    this.declaringType = declaringType;
    this.name = name;
    this.propertyType = propertyType;
  }

  @Override
  public TypeReference getDeclaringType() {
    return declaringType;
  }

  @Override
  public String getName() {
    return name;
  }

  public TypeReference getPropertyType() {
    return propertyType;
  }

  public MethodDefinition getGetMethod() {
    return getMethod;
  }

  public void setGetMethod(MethodDefinition getMethod) {
    this.getMethod = getMethod;
  }

  public MethodDefinition getSetMethod() {
    return setMethod;
  }

  public void setSetMethod(MethodDefinition setMethod) {
    this.setMethod = setMethod;
  }

  /** index parameters, taken from the getter (or the setter minus its value parameter) */
  public List<ParameterDefinition> getParameters() {
    if (getMethod != null) {
      return getMethod.getParameters();
    }
    if (setMethod != null && !setMethod.getParameters().isEmpty()) {
      List<ParameterDefinition> ps = setMethod.getParameters();
      return ps.subList(0, ps.size() - 1);
    }
    return Collections.emptyList();
  }

  public boolean isIndexer() {
    return !getParameters().isEmpty();
  }

  @Override
  public String toString() {
    return propertyType + " " + getFullName();
  }
}
