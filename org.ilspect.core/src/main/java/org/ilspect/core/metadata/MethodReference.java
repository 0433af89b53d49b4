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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A method as referenced from code: declaring type, name and signature. A reference with generic
 * arguments denotes an instantiated generic method (a MethodSpec row in metadata).
 */
public class MethodReference implements MemberReference {

  private final TypeReference declaringType;

  private final String name;

  private final TypeReference returnType;

  private final List<ParameterDefinition> parameters;

  private final boolean hasThis;

  private final List<TypeReference> genericArguments;

  public MethodReference(
      TypeReference declaringType,
      String name,
      TypeReference returnType,
      boolean hasThis,
      List<ParameterDefinition> parameters) {
    this(declaringType, name, returnType, hasThis, parameters, Collections.emptyList());
  }

  protected MethodReference(
      TypeReference declaringType,
      String name,
      TypeReference returnType,
      boolean hasThis,
      List<ParameterDefinition> parameters,
      List<TypeReference> genericArguments) {
    this.declaringType = Objects.requireNonNull(declaringType);
    this.name = Objects.requireNonNull(name);
    this.returnType = returnType;
    this.hasThis = hasThis;
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    this.genericArguments = Collections.unmodifiableList(new ArrayList<>(genericArguments));
  }

  /** this method instantiated with the given generic method arguments */
  public MethodReference makeGenericInstance(List<TypeReference> arguments) {
    return new MethodReference(declaringType, name, returnType, hasThis, parameters, arguments);
  }

  @Override
  public TypeReference getDeclaringType() {
    return declaringType;
  }

  @Override
  public String getName() {
    return name;
  }

  public TypeReference getReturnType() {
    return returnType;
  }

  public boolean hasThis() {
    return hasThis;
  }

  /** declared parameters, without the implicit {@code this} */
  public List<ParameterDefinition> getParameters() {
    return parameters;
  }

  public boolean isGenericInstance() {
    return !genericArguments.isEmpty();
  }

  public List<TypeReference> getGenericArguments() {
    return genericArguments;
  }

  public boolean isConstructor() {
    return ".ctor".equals(name) || ".cctor".equals(name);
  }

  /** compares declaring type, name and parameter types */
  public boolean hasSameSignature(MethodReference other) {
    if (!declaringType.getGenericTypeOrSelf().equals(other.declaringType.getGenericTypeOrSelf())
        || !name.equals(other.name)
        || parameters.size() != other.parameters.size()) {
      return false;
    }
    for (int i = 0; i < parameters.size(); i++) {
      if (!Objects.equals(parameters.get(i).getType(), other.parameters.get(i).getType())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MethodReference)) {
      return false;
    }
    MethodReference other = (MethodReference) obj;
    return hasSameSignature(other)
        && declaringType.equals(other.declaringType)
        && genericArguments.equals(other.genericArguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(declaringType, name, parameters.size(), genericArguments);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(returnType).append(' ').append(getFullName());
    if (!genericArguments.isEmpty()) {
      sb.append('<');
      for (int i = 0; i < genericArguments.size(); i++) {
        if (i > 0) sb.append(',');
        sb.append(genericArguments.get(i));
      }
      sb.append('>');
    }
    sb.append('(');
    for (int i = 0; i < parameters.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(parameters.get(i).getType());
    }
    return sb.append(')').toString();
  }
}
