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

import java.util.ArrayList;
import java.util.List;

/** A type name with optional type arguments, e.g. {@code List<int>}. */
public class SimpleType extends AstType {

  private String identifier;

  private final NodeList<AstType> typeArguments = new NodeList<>(this, AstType.class);

  public SimpleType(String identifier) {
    this.identifier = identifier;
  }

  public SimpleType(String identifier, List<AstType> typeArguments) {
    this(identifier);
    this.typeArguments.addAll(typeArguments);
  }

  public String getIdentifier() {
    return identifier;
  }

  public void setIdentifier(String identifier) {
    this.identifier = identifier;
  }

  public NodeList<AstType> getTypeArguments() {
    return typeArguments;
  }

  @Override
  public List<AstNode> getChildren() {
    return new ArrayList<>(typeArguments);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitSimpleType(this);
  }

  @Override
  public SimpleType clone() {
    SimpleType copy = new SimpleType(identifier);
    typeArguments.cloneInto(copy.typeArguments);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return typeArguments.replace(old, replacement);
  }
}
