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

/** A type resolved to its definition: its members and the attributes the decompiler consults. */
public class TypeDefinition {

  private final TypeReference reference;

  private final List<MethodDefinition> methods = new ArrayList<>();

  private final List<PropertyDefinition> properties = new ArrayList<>();

  private final List<FieldReference> fields = new ArrayList<>();

  private final List<String> genericParameters = new ArrayList<>();

  private TypeReference baseType;

  private String defaultMemberName;

  private ModuleDefinition module;

  public TypeDefinition(TypeReference reference) {
    this.reference = reference;
  }

  public TypeReference getReference() {
    return reference;
  }

  public String getName() {
    return reference.getName();
  }

  public String getFullName() {
    return reference.getFullName();
  }

  /** the module this definition was added to, or null */
  public ModuleDefinition getModule() {
    return module;
  }

  void setModule(ModuleDefinition module) {
    this.module = module;
  }

  public TypeReference getBaseType() {
    return baseType;
  }

  public void setBaseType(TypeReference baseType) {
    this.baseType = baseType;
  }

  /** the member named by a {@code DefaultMemberAttribute}, or null */
  public String getDefaultMemberName() {
    return defaultMemberName;
  }

  public void setDefaultMemberName(String defaultMemberName) {
    this.defaultMemberName = defaultMemberName;
  }

  public MethodDefinition addMethod(MethodDefinition m) {
    m.setDeclaringTypeDefinition(this);
    methods.add(m);
    return m;
  }

  public PropertyDefinition addProperty(PropertyDefinition p) {
    properties.add(p);
    return p;
  }

  public FieldReference addField(FieldReference f) {
    fields.add(f);
    return f;
  }

  public void addGenericParameter(String name) {
    genericParameters.add(name);
  }

  public List<MethodDefinition> getMethods() {
    return Collections.unmodifiableList(methods);
  }

  public List<PropertyDefinition> getProperties() {
    return Collections.unmodifiableList(properties);
  }

  public List<FieldReference> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public List<String> getGenericParameters() {
    return Collections.unmodifiableList(genericParameters);
  }

  public PropertyDefinition findProperty(String name) {
    for (PropertyDefinition p : properties) {
      if (p.getName().equals(name)) {
        return p;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "type " + getFullName();
  }
}
