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
import java.util.Arrays;
import java.util.List;

public class BlockStatement extends Statement {

  private final NodeList<Statement> statements = new NodeList<>(this, Statement.class);

  public BlockStatement(Statement... statements) {
    this.statements.addAll(Arrays.asList(statements));
  }

  public NodeList<Statement> getStatements() {
    return statements;
  }

  @Override
  public List<AstNode> getChildren() {
    return new ArrayList<>(statements);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitBlockStatement(this);
  }

  @Override
  public BlockStatement clone() {
    BlockStatement copy = new BlockStatement();
    statements.cloneInto(copy.statements);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    return statements.replace(old, replacement);
  }
}
