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

/**
 * A base type with a nullable specifier, pointer stars and array specifiers, printed in that
 * order. Array specifiers hold ranks; {@code int[][,]} is an array of {@code int[,]}.
 */
public class ComposedType extends AstType {

  private AstType baseType;

  private boolean hasNullableSpecifier;

  private int pointerRank;

  private final List<Integer> arraySpecifiers = new ArrayList<>(1);

  public ComposedType(AstType baseType) {
    setBaseType(baseType);
  }

  public AstType getBaseType() {
    return baseType;
  }

  public void setBaseType(AstType baseType) {
    orphan(this.baseType);
    this.baseType = adopt(baseType);
  }

  public boolean hasNullableSpecifier() {
    return hasNullableSpecifier;
  }

  public void setHasNullableSpecifier(boolean hasNullableSpecifier) {
    this.hasNullableSpecifier = hasNullableSpecifier;
  }

  public int getPointerRank() {
    return pointerRank;
  }

  public void setPointerRank(int pointerRank) {
    this.pointerRank = pointerRank;
  }

  public List<Integer> getArraySpecifiers() {
    return arraySpecifiers;
  }

  @Override
  public AstType makeArrayType(int rank) {
    arraySpecifiers.add(0, rank);
    return this;
  }

  @Override
  public AstType makePointerType() {
    if (!arraySpecifiers.isEmpty()) {
      return super.makePointerType();
    }
    pointerRank++;
    return this;
  }

  @Override
  public List<AstNode> getChildren() {
    return children(baseType);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitComposedType(this);
  }

  @Override
  public ComposedType clone() {
    ComposedType copy = new ComposedType(cloneOrNull(baseType, AstType.class));
    copy.hasNullableSpecifier = hasNullableSpecifier;
    copy.pointerRank = pointerRank;
    copy.arraySpecifiers.addAll(arraySpecifiers);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == baseType) {
      setBaseType((AstType) replacement);
      return true;
    }
    return false;
  }
}
