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

import com.ibm.wala.util.collections.HashMapFactory;
import java.util.Map;

/** A module whose types are registered programmatically. */
public class InMemoryModule implements ModuleDefinition {

  private final String name;

  private final Map<TypeReference, TypeDefinition> types = HashMapFactory.make();

  private MethodDefinition entryPoint;

  public InMemoryModule(String name) {
    this.name = name;
  }

  public TypeDefinition addType(TypeDefinition type) {
    types.put(type.getReference(), type);
    type.setModule(this);
    return type;
  }

  public TypeDefinition defineType(TypeReference type) {
    TypeDefinition existing = types.get(type);
    return existing != null ? existing : addType(new TypeDefinition(type));
  }

  public void setEntryPoint(MethodDefinition entryPoint) {
    this.entryPoint = entryPoint;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public TypeDefinition resolve(TypeReference type) {
    if (type == null) {
      return null;
    }
    return types.get(type.getGenericTypeOrSelf());
  }

  @Override
  public MethodDefinition resolve(MethodReference method) {
    if (method instanceof MethodDefinition && !method.isGenericInstance()) {
      return (MethodDefinition) method;
    }
    TypeDefinition type = resolve(method.getDeclaringType());
    if (type == null) {
      return null;
    }
    for (MethodDefinition m : type.getMethods()) {
      if (m.hasSameSignature(method)) {
        return m;
      }
    }
    return null;
  }

  @Override
  public MethodDefinition getEntryPoint() {
    return entryPoint;
  }

  @Override
  public String toString() {
    return "module " + name;
  }
}
