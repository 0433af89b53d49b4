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

/** {@code target.Member<TypeArgs>} */
public class MemberReferenceExpression extends Expression {

  private Expression target;

  private String memberName;

  private final NodeList<AstType> typeArguments = new NodeList<>(this, AstType.class);

  public MemberReferenceExpression(Expression target, String memberName) {
    setTarget(target);
    this.memberName = memberName;
  }

  public MemberReferenceExpression(
      Expression target, String memberName, List<AstType> typeArguments) {
    this(target, memberName);
    this.typeArguments.addAll(typeArguments);
  }

  public Expression getTarget() {
    return target;
  }

  public void setTarget(Expression target) {
    orphan(this.target);
    this.target = adopt(target);
  }

  public String getMemberName() {
    return memberName;
  }

  public void setMemberName(String memberName) {
    this.memberName = memberName;
  }

  public NodeList<AstType> getTypeArguments() {
    return typeArguments;
  }

  @Override
  public List<AstNode> getChildren() {
    List<AstNode> result = children(target);
    result.addAll(new ArrayList<>(typeArguments));
    return result;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitMemberReferenceExpression(this);
  }

  @Override
  public MemberReferenceExpression clone() {
    MemberReferenceExpression copy =
        new MemberReferenceExpression(cloneOrNull(target, Expression.class), memberName);
    typeArguments.cloneInto(copy.typeArguments);
    return copyAnnotations(this, copy);
  }

  @Override
  boolean replaceChild(AstNode old, AstNode replacement) {
    if (old == target) {
      setTarget((Expression) replacement);
      return true;
    }
    return typeArguments.replace(old, replacement);
  }
}
