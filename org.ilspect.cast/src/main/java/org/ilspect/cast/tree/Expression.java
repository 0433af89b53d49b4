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

/** Base class of expressions, with a few builder helpers. */
public abstract class Expression extends AstNode {

  @Override
  public abstract Expression clone();

  public MemberReferenceExpression member(String memberName) {
    return new MemberReferenceExpression(this, memberName);
  }

  public InvocationExpression invoke(String methodName, Expression... arguments) {
    return new InvocationExpression(member(methodName), Arrays.asList(arguments));
  }

  public InvocationExpression invoke(Expression... arguments) {
    return new InvocationExpression(this, Arrays.asList(arguments));
  }

  public CastExpression castTo(AstType type) {
    return new CastExpression(type, this);
  }
}
