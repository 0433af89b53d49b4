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

public class NullReferenceExpression extends Expression {

  @Override
  public List<AstNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitNullReferenceExpression(this);
  }

  @Override
  public NullReferenceExpression clone() {
    return copyAnnotations(this, new NullReferenceExpression());
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return false;
  }
}
