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
 * {@code new { a, Name = b }}. Initializers are plain expressions, whose property names are
 * inferred, or {@link NamedExpression}s.
 */
public class AnonymousTypeCreateExpression extends Expression {

  private final NodeList<Expression> initializers = new NodeList<>(this, Expression.class);

  public NodeList<Expression> getInitializers() {
    return initializers;
  }

  @Override
  public List<AstNode> getChildren() {
    return new ArrayList<>(initializers);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitAnonymousTypeCreateExpression(this);
  }

  @Override
  public AnonymousTypeCreateExpression clone() {
    AnonymousTypeCreateExpression copy = new AnonymousTypeCreateExpression();
    initializers.cloneInto(copy.initializers);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return initializers.replace(old, replacement);
  }
}
