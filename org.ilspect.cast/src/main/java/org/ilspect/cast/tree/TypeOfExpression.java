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

/** {@code typeof(Type)} */
public class TypeOfExpression extends Expression {

  private AstType type;

  public TypeOfExpression(AstType type) {
    setType(type);
  }

  public AstType getType() {
    return type;
  }

  public void setType(AstType type) {
    orphan(this.type);
    this.type = adopt(type);
  }

  @Override
  public List<AstNode> getChildren() {
    return children(type);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitTypeOfExpression(this);
  }

  @Override
  public TypeOfExpression clone() {
    return copyAnnotations(this, new TypeOfExpression(cloneOrNull(type, AstType.class)));
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
