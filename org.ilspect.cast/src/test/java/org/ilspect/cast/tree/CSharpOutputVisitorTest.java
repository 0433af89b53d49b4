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

import static org.ilspect.cast.tree.BinaryOperatorType.ADD;
import static org.ilspect.cast.tree.BinaryOperatorType.CONDITIONAL_AND;
import static org.ilspect.cast.tree.BinaryOperatorType.MULTIPLY;
import static org.ilspect.cast.tree.BinaryOperatorType.NULL_COALESCING;
import static org.ilspect.cast.tree.BinaryOperatorType.SUBTRACT;

import java.math.BigDecimal;
import java.util.Arrays;
import org.junit.Assert;
import org.junit.Test;

public class CSharpOutputVisitorTest {

  private static Expression id(String name) {
    return new IdentifierExpression(name);
  }

  private static Expression lit(Object value) {
    return new PrimitiveExpression(value);
  }

  private static Expression binary(Expression left, BinaryOperatorType op, Expression right) {
    return new BinaryOperatorExpression(left, op, right);
  }

  private static AstType type(String keyword) {
    return new PrimitiveType(keyword);
  }

  private static String text(AstNode node) {
    return CSharpOutputVisitor.toText(node);
  }

  @Test
  public void testPrecedence() {
    Assert.assertEquals(
        "a + b * c", text(binary(id("a"), ADD, binary(id("b"), MULTIPLY, id("c")))));
    Assert.assertEquals(
        "(a + b) * c", text(binary(binary(id("a"), ADD, id("b")), MULTIPLY, id("c"))));
    Assert.assertEquals(
        "a - b - c", text(binary(binary(id("a"), SUBTRACT, id("b")), SUBTRACT, id("c"))));
    Assert.assertEquals(
        "a - (b - c)", text(binary(id("a"), SUBTRACT, binary(id("b"), SUBTRACT, id("c")))));
    Assert.assertEquals(
        "a ?? b ?? c",
        text(binary(id("a"), NULL_COALESCING, binary(id("b"), NULL_COALESCING, id("c")))));
    Assert.assertEquals(
        "(a ?? b) ?? c",
        text(binary(binary(id("a"), NULL_COALESCING, id("b")), NULL_COALESCING, id("c"))));
  }

  @Test
  public void testUnaryAndConditional() {
    Assert.assertEquals(
        "-(-x)",
        text(
            new UnaryOperatorExpression(
                UnaryOperatorType.MINUS,
                new UnaryOperatorExpression(UnaryOperatorType.MINUS, id("x")))));
    Assert.assertEquals(
        "-(-1)", text(new UnaryOperatorExpression(UnaryOperatorType.MINUS, lit(-1))));
    Assert.assertEquals(
        "!(a && b)",
        text(
            new UnaryOperatorExpression(
                UnaryOperatorType.NOT, binary(id("a"), CONDITIONAL_AND, id("b")))));
    Assert.assertEquals(
        "(a ? b : c) ? d : e",
        text(
            new ConditionalExpression(
                new ConditionalExpression(id("a"), id("b"), id("c")), id("d"), id("e"))));
    Assert.assertEquals(
        "a ? b : c ? d : e",
        text(
            new ConditionalExpression(
                id("a"), id("b"), new ConditionalExpression(id("c"), id("d"), id("e")))));
    Assert.assertEquals("(-1).ToString()", text(lit(-1).invoke("ToString")));
  }

  @Test
  public void testLiterals() {
    Assert.assertEquals("\"a\\\"b\\n\"", text(lit("a\"b\n")));
    Assert.assertEquals("'\\''", text(lit('\'')));
    Assert.assertEquals("5L", text(lit(5L)));
    Assert.assertEquals("1.5f", text(lit(1.5f)));
    Assert.assertEquals("2.5", text(lit(2.5)));
    Assert.assertEquals("1.10m", text(lit(new BigDecimal("1.10"))));
    Assert.assertEquals("double.NaN", text(lit(Double.NaN)));
    Assert.assertEquals("float.NegativeInfinity", text(lit(Float.NEGATIVE_INFINITY)));
    Assert.assertEquals("true", text(lit(true)));
    Assert.assertEquals("null", text(new NullReferenceExpression()));
  }

  @Test
  public void testTypes() {
    Assert.assertEquals(
        "Dictionary<string, int>",
        text(new SimpleType("Dictionary", Arrays.asList(type("string"), type("int")))));
    Assert.assertEquals(
        "Dictionary<,>",
        text(
            new SimpleType(
                "Dictionary", Arrays.<AstType>asList(new SimpleType(""), new SimpleType("")))));
    Assert.assertEquals("int[][,]", text(type("int").makeArrayType(2).makeArrayType(1)));
    Assert.assertEquals("byte**", text(type("byte").makePointerType().makePointerType()));
    ComposedType nullable = new ComposedType(type("int"));
    nullable.setHasNullableSpecifier(true);
    Assert.assertEquals("int?", text(nullable));
    Assert.assertEquals("System.Text", text(new MemberType(new SimpleType("System"), "Text")));
    Assert.assertEquals("?", text(AstType.NULL));
  }

  @Test
  public void testTypeExpressions() {
    Assert.assertEquals("(int)x", text(new CastExpression(type("int"), id("x"))));
    Assert.assertEquals(
        "(int)(a + b)", text(new CastExpression(type("int"), binary(id("a"), ADD, id("b")))));
    Assert.assertEquals("x as string", text(new AsExpression(id("x"), type("string"))));
    Assert.assertEquals("x is string", text(new IsExpression(id("x"), type("string"))));
    Assert.assertEquals("typeof(int)", text(new TypeOfExpression(type("int"))));
    Assert.assertEquals("Math.PI", text(new SimpleType("Math").toTypeReference().member("PI")));
  }

  @Test
  public void testChecked() {
    Expression add = binary(id("a"), ADD, id("b"));
    add.addAnnotation(CheckedAnnotation.CHECKED);
    Assert.assertEquals("checked(a + b) * c", text(binary(add, MULTIPLY, id("c"))));
    Expression sub = binary(id("a"), SUBTRACT, id("b"));
    sub.addAnnotation(CheckedAnnotation.UNCHECKED);
    Assert.assertEquals("a - b", text(sub));
    CastExpression cast = new CastExpression(type("int"), id("x"));
    cast.addAnnotation(CheckedAnnotation.of(true));
    Assert.assertEquals("checked((int)x)", text(cast));
  }

  @Test
  public void testLambdas() {
    LambdaExpression noParameters = new LambdaExpression();
    noParameters.setBody(binary(lit(2), ADD, lit(3)));
    Assert.assertEquals("() => 2 + 3", text(noParameters));

    LambdaExpression single = new LambdaExpression();
    single.getParameters().add(new ParameterDeclaration(null, "x"));
    single.setBody(id("x").member("Length"));
    Assert.assertEquals("x => x.Length", text(single));

    LambdaExpression typed = new LambdaExpression();
    typed.getParameters().add(new ParameterDeclaration(type("int"), "x"));
    typed.getParameters().add(new ParameterDeclaration(type("int"), "y"));
    typed.setBody(new BlockStatement(new ReturnStatement(binary(id("x"), ADD, id("y")))));
    Assert.assertEquals("(int x, int y) => {\n\treturn x + y;\n}", text(typed));

    Assert.assertEquals("f(x => x.Length)", text(id("f").invoke(single.clone())));
  }

  @Test
  public void testCreation() {
    ObjectCreateExpression point = new ObjectCreateExpression(new SimpleType("Point"));
    Assert.assertEquals("new Point()", text(point));
    point.getArguments().add(lit(1));
    Assert.assertEquals("new Point(1)", text(point));
    point.getArguments().clear();
    point.setInitializer(
        new ArrayInitializerExpression(Arrays.asList(new NamedExpression("X", lit(1)))));
    Assert.assertEquals("new Point { X = 1 }", text(point));

    AnonymousTypeCreateExpression anonymous = new AnonymousTypeCreateExpression();
    Assert.assertEquals("new { }", text(anonymous));
    anonymous.getInitializers().add(id("a"));
    anonymous.getInitializers().add(new NamedExpression("B", lit(2)));
    Assert.assertEquals("new { a, B = 2 }", text(anonymous));

    ArrayCreateExpression bounds = new ArrayCreateExpression(type("int"));
    bounds.getArguments().add(lit(3));
    bounds.getAdditionalArraySpecifiers().add(2);
    Assert.assertEquals("new int[3][,]", text(bounds));

    ArrayCreateExpression implicit = new ArrayCreateExpression(null);
    implicit.getAdditionalArraySpecifiers().add(1);
    implicit.setInitializer(new ArrayInitializerExpression(Arrays.asList(lit(1), lit(2))));
    Assert.assertEquals("new[] { 1, 2 }", text(implicit));
  }

  @Test
  public void testMembersAndStatements() {
    MemberReferenceExpression empty =
        new SimpleType("Enumerable").toTypeReference().member("Empty");
    empty.getTypeArguments().add(type("int"));
    Assert.assertEquals("Enumerable.Empty<int>()", text(empty.invoke()));
    Assert.assertEquals(
        "a[1, 2]", text(new IndexerExpression(id("a"), Arrays.asList(lit(1), lit(2)))));
    Assert.assertEquals("(a + b).c", text(binary(id("a"), ADD, id("b")).member("c")));

    BlockStatement block =
        new BlockStatement(new ExpressionStatement(id("f").invoke()), new ReturnStatement(null));
    Assert.assertEquals("{\n\tf();\n\treturn;\n}", text(block));
  }
}
