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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Base class of type syntax. */
public abstract class AstType extends AstNode {

  /** Placeholder for a type that cannot be represented. It is shared and never attached. */
  public static final AstType NULL = new NullAstType();

  @Override
  public abstract AstType clone();

  /** Returns the array type with this type as element type; the receiver may be reused. */
  public AstType makeArrayType(int rank) {
    ComposedType c = new ComposedType(this);
    c.getArraySpecifiers().add(rank);
    return c;
  }

  /** Returns the pointer type to this type; the receiver may be reused. */
  public AstType makePointerType() {
    ComposedType c = new ComposedType(this);
    c.setPointerRank(1);
    return c;
  }

  public TypeReferenceExpression toTypeReference() {
    return new TypeReferenceExpression(this);
  }

  public InvocationExpression invoke(String methodName, Expression... arguments) {
    return new InvocationExpression(
        new TypeReferenceExpression(this).member(methodName), Arrays.asList(arguments));
  }

  private static final class NullAstType extends AstType {

    @Override
    public boolean isNull() {
      return true;
    }

    @Override
    public List<AstNode> getChildren() {
      return Collections.emptyList();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
      return visitor.visitNullType(this);
    }

    @Override
    public AstType clone() {
      return this;
    }

    @Override
    public void addAnnotation(Object annotation) {
      // shared, so annotations are dropped
    }

    @Override
    boolean replaceChild(AstNode old, AstNode replacement) {
      return false;
    }

    @Override
    public AstType makeArrayType(int rank) {
      return this;
    }

    @Override
    public AstType makePointerType() {
      return this;
    }
  }
}
