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

import java.util.List;
import org.ilspect.core.cil.MethodBody;

/** A method resolved to its definition, optionally with a body. */
public class MethodDefinition extends MethodReference {

  private final boolean isStatic;

  private final boolean isSpecialName;

  private MethodBody body;

  private TypeDefinition declaringTypeDefinition;

  public MethodDefinition(
      TypeReference declaringType,
      String name,
      TypeReference returnType,
      boolean isStatic,
      List<ParameterDefinition> parameters) {
    this(declaringType, name, returnType, isStatic, isSpecialName(name), parameters);
  }

  public MethodDefinition(
      TypeReference declaringType,
      String name,
      TypeReference returnType,
      boolean isStatic,
      boolean isSpecialName,
      List<ParameterDefinition> parameters) {
    super(declaringType, name, returnType, !isStatic, parameters);
    this.isStatic = isStatic;
    this.isSpecialName = isSpecialName;
  }

  private static boolean isSpecialName(String name) {
    return name.startsWith("get_")
        || name.startsWith("set_")
        || name.startsWith("op_")
        || name.equals(".ctor")
        || name.equals(".cctor");
  }

  public boolean isStatic() {
    return isStatic;
  }

  public boolean isSpecialName() {
    return isSpecialName;
  }

  public boolean isGetter() {
    return isSpecialName && getName().startsWith("get_");
  }

  public boolean isSetter() {
    return isSpecialName && getName().startsWith("set_");
  }

  /** the definition this method was added to, or null */
  public TypeDefinition getDeclaringTypeDefinition() {
    return declaringTypeDefinition;
  }

  void setDeclaringTypeDefinition(TypeDefinition declaringTypeDefinition) {
    this.declaringTypeDefinition = declaringTypeDefinition;
  }

  /** the module of the declaring definition, or null */
  public ModuleDefinition getModule() {
    return declaringTypeDefinition == null ? null : declaringTypeDefinition.getModule();
  }

  public MethodBody getBody() {
    return body;
  }

  public boolean hasBody() {
    return body != null;
  }

  public void setBody(MethodBody body) {
    this.body = body;
  }
}
