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

/** Visitor over the syntax tree. */
public interface AstVisitor<R> {

  R visitIdentifierExpression(IdentifierExpression e);

  R visitPrimitiveExpression(PrimitiveExpression e);

  R visitNullReferenceExpression(NullReferenceExpression e);

  R visitMemberReferenceExpression(MemberReferenceExpression e);

  R visitInvocationExpression(InvocationExpression e);

  R visitIndexerExpression(IndexerExpression e);

  R visitBinaryOperatorExpression(BinaryOperatorExpression e);

  R visitUnaryOperatorExpression(UnaryOperatorExpression e);

  R visitConditionalExpression(ConditionalExpression e);

  R visitCastExpression(CastExpression e);

  R visitAsExpression(AsExpression e);

  R visitIsExpression(IsExpression e);

  R visitTypeOfExpression(TypeOfExpression e);

  R visitTypeReferenceExpression(TypeReferenceExpression e);

  R visitLambdaExpression(LambdaExpression e);

  R visitParameterDeclaration(ParameterDeclaration p);

  R visitObjectCreateExpression(ObjectCreateExpression e);

  R visitAnonymousTypeCreateExpression(AnonymousTypeCreateExpression e);

  R visitArrayCreateExpression(ArrayCreateExpression e);

  R visitArrayInitializerExpression(ArrayInitializerExpression e);

  R visitNamedExpression(NamedExpression e);

  R visitSimpleType(SimpleType t);

  R visitMemberType(MemberType t);

  R visitPrimitiveType(PrimitiveType t);

  R visitComposedType(ComposedType t);

  R visitNullType(AstType t);

  R visitExpressionStatement(ExpressionStatement s);

  R visitReturnStatement(ReturnStatement s);

  R visitBlockStatement(BlockStatement s);
}
