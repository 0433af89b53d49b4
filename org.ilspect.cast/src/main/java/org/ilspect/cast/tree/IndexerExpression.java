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

/** {@code target[arguments]} */
public class IndexerExpression extends Expression {

  private Expression target;

  private final NodeList<Expression> arguments = new NodeList<>(this, Expression.class);

  public IndexerExpression(Expression target, List<? extends Expression> arguments) {
    setTarget(target);
    this.arguments.addAll(arguments);
  }

  public Expression getTarget() {
    return target;
  }

  public void setTarget(Expression target) {
    orphan(this.target);
    this.target = adopt(target);
  }

  public NodeList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public List<AstNode> getChildren() {
    List<AstNode> result = children(target);
    result.addAll(new ArrayList<>(arguments));
    return result;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitIndexerExpression(this);
  }

  @Override
  public IndexerExpression clone() {
    IndexerExpression copy =
        new IndexerExpression(cloneOrNull(target, Expression.class), new ArrayList<>());
    arguments.cloneInto(copy.arguments);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == target) {
      setTarget((Expression) replacement);
      return true;
    }
    return arguments.replace(old, replacement);
  }
}
