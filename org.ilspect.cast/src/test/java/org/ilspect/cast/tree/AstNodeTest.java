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

import org.junit.Assert;
import org.junit.Test;

public class AstNodeTest {

  @Test
  public void testReplaceWith() {
    IdentifierExpression a = new IdentifierExpression("a");
    BinaryOperatorExpression add =
        new BinaryOperatorExpression(a, BinaryOperatorType.ADD, new PrimitiveExpression(1));
    ExpressionStatement stmt = new ExpressionStatement(add);

    IdentifierExpression b = new IdentifierExpression("b");
    a.replaceWith(b);
    Assert.assertSame(b, add.getLeft());
    Assert.assertSame(add, b.getParent());
    Assert.assertNull(a.getParent());

    add.replaceWith(new IdentifierExpression("c"));
    Assert.assertEquals("c;\n", stmt.toString());
  }

  @Test(expected = IllegalStateException.class)
  public void testReplaceRoot() {
    new IdentifierExpression("a").replaceWith(new IdentifierExpression("b"));
  }

  @Test
  public void testAddingAttachedNodeMovesIt() {
    IdentifierExpression x = new IdentifierExpression("x");
    InvocationExpression first = new IdentifierExpression("f").invoke(x);
    InvocationExpression second = new IdentifierExpression("g").invoke();
    second.getArguments().add(x);
    Assert.assertTrue(first.getArguments().isEmpty());
    Assert.assertSame(second, x.getParent());
    Assert.assertEquals("g(x)", second.toString());
  }

  @Test
  public void testMoveTo() {
    ArrayInitializerExpression from = new ArrayInitializerExpression();
    from.getElements().add(new PrimitiveExpression(1));
    from.getElements().add(new PrimitiveExpression(2));
    AnonymousTypeCreateExpression to = new AnonymousTypeCreateExpression();
    from.getElements().moveTo(to.getInitializers());
    Assert.assertTrue(from.getElements().isEmpty());
    Assert.assertEquals(2, to.getInitializers().size());
    Assert.assertSame(to, to.getInitializers().get(0).getParent());
  }

  @Test
  public void testDetach() {
    IdentifierExpression target = new IdentifierExpression("list");
    MemberReferenceExpression count = target.member("Count");
    Assert.assertSame(target, target.detach());
    Assert.assertNull(target.getParent());
    Assert.assertNull(count.getTarget());
  }

  @Test
  public void testCloneIsDeepAndKeepsAnnotations() {
    Object marker = new Object();
    IdentifierExpression x = AstNode.annotate(new IdentifierExpression("x"), marker);
    InvocationExpression call = new IdentifierExpression("f").invoke(x);
    ExpressionStatement stmt = new ExpressionStatement(call);

    InvocationExpression copy = call.clone();
    Assert.assertNull(copy.getParent());
    Assert.assertNotSame(x, copy.getArguments().get(0));
    Assert.assertSame(marker, copy.getArguments().get(0).getAnnotation(Object.class));
    Assert.assertSame(copy, copy.getArguments().get(0).getParent());
    Assert.assertEquals("f(x)", copy.toString());
    Assert.assertSame(stmt, call.getParent());
  }

  @Test
  public void testAnnotations() {
    IdentifierExpression x = new IdentifierExpression("x");
    x.addAnnotation("first");
    x.addAnnotation(CheckedAnnotation.CHECKED);
    x.addAnnotation("second");
    Assert.assertEquals("first", x.getAnnotation(String.class));
    Assert.assertEquals(2, x.getAnnotations(String.class).size());
    x.removeAnnotations(String.class);
    Assert.assertNull(x.getAnnotation(String.class));
    Assert.assertEquals(1, x.getAllAnnotations().size());
    Assert.assertSame(x, AstNode.annotate(x, null));
  }

  @Test
  public void testNullType() {
    Assert.assertTrue(AstType.NULL.isNull());
    Assert.assertSame(AstType.NULL, AstType.NULL.clone());
    Assert.assertSame(AstType.NULL, AstType.NULL.makeArrayType(1));
    Assert.assertSame(AstType.NULL, AstType.NULL.makePointerType());
    AstNode.annotate(AstType.NULL, "ignored");
    Assert.assertNull(AstType.NULL.getAnnotation(String.class));

    // never attached to a parent
    CastExpression cast = new CastExpression(AstType.NULL, new IdentifierExpression("x"));
    Assert.assertNull(AstType.NULL.getParent());
    Assert.assertEquals(1, cast.getChildren().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLambdaBodyMustBeExpressionOrBlock() {
    new LambdaExpression().setBody(new ReturnStatement(null));
  }

  @Test
  public void testDescendants() {
    BinaryOperatorExpression e =
        new BinaryOperatorExpression(
            new IdentifierExpression("a"),
            BinaryOperatorType.MULTIPLY,
            new UnaryOperatorExpression(UnaryOperatorType.MINUS, new IdentifierExpression("b")));
    Assert.assertEquals(4, e.getDescendantsAndSelf().size());
    Assert.assertSame(e, e.getDescendantsAndSelf().get(0));
  }
}
