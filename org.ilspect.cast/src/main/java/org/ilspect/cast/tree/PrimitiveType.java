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

import java.util.Collections;
import java.util.List;

/** A keyword type such as {@code int} or {@code string}. */
public class PrimitiveType extends AstType {

  private final String keyword;

  public PrimitiveType(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }

  @Override
  public List<AstNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitPrimitiveType(this);
  }

  @Override
  public PrimitiveType clone() {
    return copyAnnotations(this, new PrimitiveType(keyword));
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return false;
  }
}
