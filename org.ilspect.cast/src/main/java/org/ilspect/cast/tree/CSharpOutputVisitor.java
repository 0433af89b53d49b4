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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

/**
 * Prints a syntax tree as C# source. Expressions get parentheses only where operator precedence
 * requires them.
 */
public class CSharpOutputVisitor implements AstVisitor<Void> {

  private final PrintWriter out;

  private final int indent;

  public CSharpOutputVisitor(PrintWriter out) {
    this(out, 0);
  }

  private CSharpOutputVisitor(PrintWriter out, int indent) {
    this.out = out;
    this.indent = indent;
  }

  public static String toText(AstNode node) {
    StringWriter text = new StringWriter();
    try (PrintWriter pw = new PrintWriter(text)) {
      node.accept(new CSharpOutputVisitor(pw));
    }
    return text.toString();
  }

  private void indent() {
    for (int i = 0; i < indent; i++) {
      out.print('\t');
    }
  }

  static int precedence(Expression e) {
    if (isChecked(e)) {
      return Precedence.PRIMARY;
    }
    if (e instanceof BinaryOperatorExpression) {
      return ((BinaryOperatorExpression) e).getOperator().getPrecedence();
    }
    if (e instanceof UnaryOperatorExpression || e instanceof CastExpression) {
      return Precedence.UNARY;
    }
    if (e instanceof AsExpression || e instanceof IsExpression) {
      return Precedence.RELATIONAL_AND_TYPE_TESTING;
    }
    if (e instanceof ConditionalExpression) {
      return Precedence.CONDITIONAL;
    }
    if (e instanceof LambdaExpression || e instanceof NamedExpression) {
      return Precedence.ASSIGNMENT;
    }
    if (e instanceof PrimitiveExpression && isNegative(((PrimitiveExpression) e).getValue())) {
      return Precedence.UNARY;
    }
    return Precedence.PRIMARY;
  }

  private static boolean isChecked(Expression e) {
    return (e instanceof BinaryOperatorExpression
            || e instanceof UnaryOperatorExpression
            || e instanceof CastExpression)
        && e.getAnnotation(CheckedAnnotation.class) == CheckedAnnotation.CHECKED;
  }

  private static boolean isNegative(Object value) {
    if (value instanceof Number && !(value instanceof BigDecimal)) {
      return ((Number) value).doubleValue() < 0;
    }
    return value instanceof BigDecimal && ((BigDecimal) value).signum() < 0;
  }

  private void print(Expression e, int minPrecedence) {
    boolean parens = precedence(e) < minPrecedence;
    if (parens) {
      out.print('(');
    }
    e.accept(this);
    if (parens) {
      out.print(')');
    }
  }

  private void printList(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        out.print(", ");
      }
      AstNode n = nodes.get(i);
      if (n instanceof Expression) {
        print((Expression) n, Precedence.ASSIGNMENT);
      } else {
        n.accept(this);
      }
    }
  }

  private void printTypeArguments(List<AstType> typeArguments) {
    if (typeArguments.isEmpty()) {
      return;
    }
    boolean unbound = true;
    for (AstType t : typeArguments) {
      if (!(t instanceof SimpleType) || !((SimpleType) t).getIdentifier().isEmpty()) {
        unbound = false;
      }
    }
    out.print('<');
    if (unbound) {
      for (int i = 1; i < typeArguments.size(); i++) {
        out.print(',');
      }
    } else {
      printList(typeArguments);
    }
    out.print('>');
  }

  private void printType(AstType type) {
    if (type == null) {
      out.print("?");
    } else {
      type.accept(this);
    }
  }

  private boolean beginChecked(Expression e) {
    if (isChecked(e)) {
      out.print("checked(");
      return true;
    }
    return false;
  }

  private void endChecked(boolean checked) {
    if (checked) {
      out.print(')');
    }
  }

  @Override
  public Void visitIdentifierExpression(IdentifierExpression e) {
    out.print(e.getIdentifier());
    return null;
  }

  @Override
  public Void visitPrimitiveExpression(PrimitiveExpression e) {
    out.print(formatLiteral(e.getValue()));
    return null;
  }

  static String formatLiteral(Object v) {
    if (v instanceof String) {
      return '"' + escape((String) v, '"') + '"';
    } else if (v instanceof Character) {
      return "'" + escape(String.valueOf(v), '\'') + "'";
    } else if (v instanceof Long) {
      return v + "L";
    } else if (v instanceof Float) {
      float f = (Float) v;
      if (Float.isNaN(f)) {
        return "float.NaN";
      } else if (Float.isInfinite(f)) {
        return f > 0 ? "float.PositiveInfinity" : "float.NegativeInfinity";
      }
      return v + "f";
    } else if (v instanceof Double) {
      double d = (Double) v;
      if (Double.isNaN(d)) {
        return "double.NaN";
      } else if (Double.isInfinite(d)) {
        return d > 0 ? "double.PositiveInfinity" : "double.NegativeInfinity";
      }
      return v.toString();
    } else if (v instanceof BigDecimal) {
      return ((BigDecimal) v).toPlainString() + "m";
    }
    return String.valueOf(v);
  }

  private static String escape(String s, char quote) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\0':
          sb.append("\\0");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (Character.isISOControl(c)) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  @Override
  public Void visitNullReferenceExpression(NullReferenceExpression e) {
    out.print("null");
    return null;
  }

  @Override
  public Void visitMemberReferenceExpression(MemberReferenceExpression e) {
    print(e.getTarget(), Precedence.PRIMARY);
    out.print('.');
    out.print(e.getMemberName());
    printTypeArguments(e.getTypeArguments());
    return null;
  }

  @Override
  public Void visitInvocationExpression(InvocationExpression e) {
    print(e.getTarget(), Precedence.PRIMARY);
    out.print('(');
    printList(e.getArguments());
    out.print(')');
    return null;
  }

  @Override
  public Void visitIndexerExpression(IndexerExpression e) {
    print(e.getTarget(), Precedence.PRIMARY);
    out.print('[');
    printList(e.getArguments());
    out.print(']');
    return null;
  }

  @Override
  public Void visitBinaryOperatorExpression(BinaryOperatorExpression e) {
    boolean checked = beginChecked(e);
    BinaryOperatorType op = e.getOperator();
    int p = op.getPrecedence();
    print(e.getLeft(), op.isRightAssociative() ? p + 1 : p);
    out.print(' ');
    out.print(op.getSymbol());
    out.print(' ');
    print(e.getRight(), op.isRightAssociative() ? p : p + 1);
    endChecked(checked);
    return null;
  }

  @Override
  public Void visitUnaryOperatorExpression(UnaryOperatorExpression e) {
    boolean checked = beginChecked(e);
    out.print(e.getOperator().getSymbol());
    Expression operand = e.getExpression();
    boolean sameSign =
        (operand instanceof UnaryOperatorExpression
                && ((UnaryOperatorExpression) operand).getOperator() == e.getOperator())
            || (e.getOperator() == UnaryOperatorType.MINUS
                && operand instanceof PrimitiveExpression
                && isNegative(((PrimitiveExpression) operand).getValue()));
    print(operand, sameSign ? Precedence.PRIMARY : Precedence.UNARY);
    endChecked(checked);
    return null;
  }

  @Override
  public Void visitConditionalExpression(ConditionalExpression e) {
    print(e.getCondition(), Precedence.CONDITIONAL + 1);
    out.print(" ? ");
    print(e.getTrueExpression(), Precedence.CONDITIONAL);
    out.print(" : ");
    print(e.getFalseExpression(), Precedence.CONDITIONAL);
    return null;
  }

  @Override
  public Void visitCastExpression(CastExpression e) {
    boolean checked = beginChecked(e);
    out.print('(');
    printType(e.getType());
    out.print(')');
    print(e.getExpression(), Precedence.UNARY);
    endChecked(checked);
    return null;
  }

  @Override
  public Void visitAsExpression(AsExpression e) {
    print(e.getExpression(), Precedence.RELATIONAL_AND_TYPE_TESTING);
    out.print(" as ");
    printType(e.getType());
    return null;
  }

  @Override
  public Void visitIsExpression(IsExpression e) {
    print(e.getExpression(), Precedence.RELATIONAL_AND_TYPE_TESTING);
    out.print(" is ");
    printType(e.getType());
    return null;
  }

  @Override
  public Void visitTypeOfExpression(TypeOfExpression e) {
    out.print("typeof(");
    printType(e.getType());
    out.print(')');
    return null;
  }

  @Override
  public Void visitTypeReferenceExpression(TypeReferenceExpression e) {
    printType(e.getType());
    return null;
  }

  @Override
  public Void visitLambdaExpression(LambdaExpression e) {
    List<ParameterDeclaration> ps = e.getParameters();
    if (ps.size() == 1 && (ps.get(0).getType() == null || ps.get(0).getType().isNull())) {
      out.print(ps.get(0).getName());
    } else {
      out.print('(');
      printList(ps);
      out.print(')');
    }
    out.print(" => ");
    AstNode body = e.getBody();
    if (body instanceof Expression) {
      print((Expression) body, Precedence.ASSIGNMENT);
    } else if (body != null) {
      body.accept(this);
    }
    return null;
  }

  @Override
  public Void visitParameterDeclaration(ParameterDeclaration p) {
    if (p.getType() != null && !p.getType().isNull()) {
      p.getType().accept(this);
      out.print(' ');
    }
    out.print(p.getName());
    return null;
  }

  @Override
  public Void visitObjectCreateExpression(ObjectCreateExpression e) {
    out.print("new ");
    printType(e.getType());
    if (!e.getArguments().isEmpty() || e.getInitializer() == null) {
      out.print('(');
      printList(e.getArguments());
      out.print(')');
    }
    if (e.getInitializer() != null) {
      out.print(' ');
      e.getInitializer().accept(this);
    }
    return null;
  }

  @Override
  public Void visitAnonymousTypeCreateExpression(AnonymousTypeCreateExpression e) {
    out.print("new ");
    printBraces(e.getInitializers());
    return null;
  }

  private void printBraces(List<Expression> elements) {
    if (elements.isEmpty()) {
      out.print("{ }");
      return;
    }
    out.print("{ ");
    printList(elements);
    out.print(" }");
  }

  @Override
  public Void visitArrayCreateExpression(ArrayCreateExpression e) {
    out.print("new");
    if (e.getType() != null) {
      out.print(' ');
      e.getType().accept(this);
    }
    if (!e.getArguments().isEmpty()) {
      out.print('[');
      printList(e.getArguments());
      out.print(']');
    }
    for (int rank : e.getAdditionalArraySpecifiers()) {
      printArraySpecifier(rank);
    }
    if (e.getInitializer() != null) {
      out.print(' ');
      e.getInitializer().accept(this);
    }
    return null;
  }

  private void printArraySpecifier(int rank) {
    out.print('[');
    for (int i = 1; i < rank; i++) {
      out.print(',');
    }
    out.print(']');
  }

  @Override
  public Void visitArrayInitializerExpression(ArrayInitializerExpression e) {
    printBraces(e.getElements());
    return null;
  }

  @Override
  public Void visitNamedExpression(NamedExpression e) {
    out.print(e.getName());
    out.print(" = ");
    print(e.getExpression(), Precedence.ASSIGNMENT);
    return null;
  }

  @Override
  public Void visitSimpleType(SimpleType t) {
    out.print(t.getIdentifier());
    printTypeArguments(t.getTypeArguments());
    return null;
  }

  @Override
  public Void visitMemberType(MemberType t) {
    printType(t.getTarget());
    out.print('.');
    out.print(t.getMemberName());
    printTypeArguments(t.getTypeArguments());
    return null;
  }

  @Override
  public Void visitPrimitiveType(PrimitiveType t) {
    out.print(t.getKeyword());
    return null;
  }

  @Override
  public Void visitComposedType(ComposedType t) {
    printType(t.getBaseType());
    if (t.hasNullableSpecifier()) {
      out.print('?');
    }
    for (int i = 0; i < t.getPointerRank(); i++) {
      out.print('*');
    }
    for (int rank : t.getArraySpecifiers()) {
      printArraySpecifier(rank);
    }
    return null;
  }

  @Override
  public Void visitNullType(AstType t) {
    out.print('?');
    return null;
  }

  @Override
  public Void visitExpressionStatement(ExpressionStatement s) {
    indent();
    s.getExpression().accept(this);
    out.print(";\n");
    return null;
  }

  @Override
  public Void visitReturnStatement(ReturnStatement s) {
    indent();
    out.print("return");
    if (s.getExpression() != null) {
      out.print(' ');
      s.getExpression().accept(this);
    }
    out.print(";\n");
    return null;
  }

  @Override
  public Void visitBlockStatement(BlockStatement s) {
    out.print("{\n");
    CSharpOutputVisitor inner = new CSharpOutputVisitor(out, indent + 1);
    for (Statement st : s.getStatements()) {
      st.accept(inner);
    }
    indent();
    out.print('}');
    return null;
  }
}
