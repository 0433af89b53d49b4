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

import java.util.List;

/** A lambda parameter; the type is optional. */
public class ParameterDeclaration extends AstNode {

  private AstType type;

  private String name;

  public ParameterDeclaration(AstType type, String name) {
    setType(type);
    this.name = name;
  }

  public AstType getType() {
    return type;
  }

  public void setType(AstType type) {
    orphan(this.type);
    this.type = adopt(type);
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public List<AstNode> getChildren() {
    return children(type);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitParameterDeclaration(this);
  }

  @Override
  public ParameterDeclaration clone() {
    return copyAnnotations(this, new ParameterDeclaration(cloneOrNull(type, AstType.class), name));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == type) {
      setType((AstType) replacement);
      return true;
    }
    return false;
  }
}
