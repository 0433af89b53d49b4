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

/** {@code (parameters) => body}; the body is an expression or a block. */
public class LambdaExpression extends Expression {

  private final NodeList<ParameterDeclaration> parameters =
      new NodeList<>(this, ParameterDeclaration.class);

  private AstNode body;

  public NodeList<ParameterDeclaration> getParameters() {
    return parameters;
  }

  public AstNode getBody() {
    return body;
  }

  public void setBody(AstNode body) {
    if (body != null && !(body instanceof Expression) && !(body instanceof BlockStatement)) {
      throw new IllegalArgumentException("bad lambda body " + body.getClass().getSimpleName());
    }
    orphan(this.body);
    this.body = adopt(body);
  }

  @Override
  public List<AstNode> getChildren() {
    List<AstNode> result = new ArrayList<AstNode>(parameters);
    result.addAll(children(body));
    return result;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitLambdaExpression(this);
  }

  @Override
  public LambdaExpression clone() {
    LambdaExpression copy = new LambdaExpression();
    parameters.cloneInto(copy.parameters);
    copy.setBody(cloneOrNull(body, AstNode.class));
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == body) {
      setBody(replacement);
      return true;
    }
    return parameters.replace(old, replacement);
  }
}
