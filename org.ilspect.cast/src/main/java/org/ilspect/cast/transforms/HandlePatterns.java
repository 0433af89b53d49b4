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
package org.ilspect.cast.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ilspect.cast.LdTokenAnnotation;
import org.ilspect.cast.tree.ArrayCreateExpression;
import org.ilspect.cast.tree.AstNode;
import org.ilspect.cast.tree.AstType;
import org.ilspect.cast.tree.CSharpOutputVisitor;
import org.ilspect.cast.tree.CastExpression;
import org.ilspect.cast.tree.Expression;
import org.ilspect.cast.tree.InvocationExpression;
import org.ilspect.cast.tree.MemberReferenceExpression;
import org.ilspect.cast.tree.PrimitiveExpression;
import org.ilspect.cast.tree.TypeOfExpression;
import org.ilspect.cast.tree.TypeReferenceExpression;
import org.ilspect.core.metadata.TypeReference;

/**
 * Recognizers for the reflection idioms compilers emit when building expression trees. Each
 * matcher returns null when the expression does not have the expected shape.
 */
final class HandlePatterns {

  static final String EXPRESSION = "System.Linq.Expressions.Expression";
  static final String ELEMENT_INIT = "System.Linq.Expressions.ElementInit";
  static final String MEMBER_BINDING = "System.Linq.Expressions.MemberBinding";
  static final String FIELD_INFO = "System.Reflection.FieldInfo";
  static final String METHOD_BASE = "System.Reflection.MethodBase";
  static final String METHOD_INFO = "System.Reflection.MethodInfo";
  static final String CONSTRUCTOR_INFO = "System.Reflection.ConstructorInfo";
  static final String SYSTEM_TYPE = "System.Type";

  private HandlePatterns() {}

  /** A matched member handle: the ldtoken argument and, if given, the declaring type syntax. */
  static final class HandleMatch {

    private final AstNode member;

    private final AstType declaringType;

    HandleMatch(AstNode member, AstType declaringType) {
      this.member = member;
      this.declaringType = declaringType;
    }

    /** the member annotation of the ldtoken argument, or null */
    <T> T getMember(Class<T> type) {
      return member.getAnnotation(type);
    }

    /** the {@code T} of a trailing {@code typeof(T).TypeHandle} argument, or null */
    AstType getDeclaringType() {
      return declaringType;
    }
  }

  /** {@code FieldInfo.GetFieldFromHandle(fieldof(f).FieldHandle[, typeof(T).TypeHandle])} */
  static HandleMatch matchFieldFromHandle(Expression e) {
    return matchHandleCall(e, FIELD_INFO, "GetFieldFromHandle", "FieldHandle");
  }

  /** {@code (MethodInfo)MethodBase.GetMethodFromHandle(methodof(m).MethodHandle[, ...])} */
  static HandleMatch matchMethodFromHandle(Expression e) {
    return matchCastHandleCall(e, METHOD_INFO);
  }

  /** {@code (ConstructorInfo)MethodBase.GetMethodFromHandle(methodof(c).MethodHandle[, ...])} */
  static HandleMatch matchConstructorFromHandle(Expression e) {
    return matchCastHandleCall(e, CONSTRUCTOR_INFO);
  }

  private static HandleMatch matchCastHandleCall(Expression e, String castType) {
    if (!(e instanceof CastExpression)) {
      return null;
    }
    CastExpression cast = (CastExpression) e;
    if (cast.getType() == null || !isType(cast.getType(), castType)) {
      return null;
    }
    return matchHandleCall(
        cast.getExpression(), METHOD_BASE, "GetMethodFromHandle", "MethodHandle");
  }

  private static HandleMatch matchHandleCall(
      Expression e, String helperType, String helperName, String handleName) {
    if (!(e instanceof InvocationExpression)) {
      return null;
    }
    InvocationExpression call = (InvocationExpression) e;
    List<Expression> args = call.getArguments();
    if (!isStaticMember(call.getTarget(), helperType, helperName)
        || args.isEmpty()
        || args.size() > 2) {
      return null;
    }
    Expression member = matchLdTokenHandle(args.get(0), handleName);
    if (member == null) {
      return null;
    }
    AstType declaringType = null;
    if (args.size() == 2) {
      declaringType = matchTypeHandle(args.get(1));
      if (declaringType == null) {
        return null;
      }
    }
    return new HandleMatch(member, declaringType);
  }

  /** {@code Type.Member}, where the type is given by its full name */
  static boolean isStaticMember(Expression target, String typeName, String memberName) {
    if (!(target instanceof MemberReferenceExpression)) {
      return false;
    }
    MemberReferenceExpression mre = (MemberReferenceExpression) target;
    return mre.getMemberName().equals(memberName)
        && mre.getTypeArguments().isEmpty()
        && isTypeReference(mre.getTarget(), typeName);
  }

  static boolean isTypeReference(Expression e, String typeName) {
    return e instanceof TypeReferenceExpression
        && ((TypeReferenceExpression) e).getType() != null
        && isType(((TypeReferenceExpression) e).getType(), typeName);
  }

  /** {@code ldtoken(x).HandleName}, returning {@code x} */
  private static Expression matchLdTokenHandle(Expression e, String handleName) {
    if (!(e instanceof MemberReferenceExpression)) {
      return null;
    }
    MemberReferenceExpression mre = (MemberReferenceExpression) e;
    if (!mre.getMemberName().equals(handleName)) {
      return null;
    }
    return matchLdToken(mre.getTarget());
  }

  /** the argument of an ldtoken pseudo-call */
  static Expression matchLdToken(Expression e) {
    if (e instanceof InvocationExpression
        && e.getAnnotation(LdTokenAnnotation.class) != null
        && ((InvocationExpression) e).getArguments().size() == 1) {
      return ((InvocationExpression) e).getArguments().get(0);
    }
    return null;
  }

  /** {@code typeof(T).TypeHandle}, returning {@code T} */
  private static AstType matchTypeHandle(Expression e) {
    if (e instanceof MemberReferenceExpression
        && ((MemberReferenceExpression) e).getMemberName().equals("TypeHandle")
        && ((MemberReferenceExpression) e).getTarget() instanceof TypeOfExpression) {
      return ((TypeOfExpression) ((MemberReferenceExpression) e).getTarget()).getType();
    }
    return null;
  }

  /** {@code typeof(T)} or {@code Type.GetTypeFromHandle(typeof(T).TypeHandle)}, returning T */
  static AstType matchTypeOf(Expression e) {
    if (e instanceof TypeOfExpression) {
      return ((TypeOfExpression) e).getType();
    }
    if (e instanceof InvocationExpression) {
      InvocationExpression call = (InvocationExpression) e;
      if (isStaticMember(call.getTarget(), SYSTEM_TYPE, "GetTypeFromHandle")
          && call.getArguments().size() == 1) {
        return matchTypeHandle(call.getArguments().get(0));
      }
    }
    return null;
  }

  /**
   * The elements of {@code new T[0]} or {@code new T[] { ... }} where {@code T} is {@code
   * elementType}; null for anything else.
   */
  static List<Expression> matchArrayInitialization(Expression e, String elementType) {
    if (!(e instanceof ArrayCreateExpression)) {
      return null;
    }
    ArrayCreateExpression ace = (ArrayCreateExpression) e;
    if (ace.getType() == null || !isType(ace.getType(), elementType)) {
      return null;
    }
    if (isEmptyArray(ace)) {
      return Collections.emptyList();
    }
    if (ace.getArguments().isEmpty()
        && ace.getAdditionalArraySpecifiers().size() == 1
        && ace.getAdditionalArraySpecifiers().get(0) == 1
        && ace.getInitializer() != null) {
      return new ArrayList<>(ace.getInitializer().getElements());
    }
    return null;
  }

  /** {@code new T[0]} for any {@code T} */
  static boolean isEmptyArray(Expression e) {
    if (!(e instanceof ArrayCreateExpression)) {
      return false;
    }
    ArrayCreateExpression ace = (ArrayCreateExpression) e;
    return ace.getInitializer() == null
        && ace.getAdditionalArraySpecifiers().isEmpty()
        && ace.getArguments().size() == 1
        && isZero(ace.getArguments().get(0));
  }

  private static boolean isZero(Expression e) {
    if (!(e instanceof PrimitiveExpression)) {
      return false;
    }
    Object v = ((PrimitiveExpression) e).getValue();
    return (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte)
        && ((Number) v).longValue() == 0;
  }

  static boolean isBooleanLiteral(Expression e) {
    return e instanceof PrimitiveExpression
        && ((PrimitiveExpression) e).getValue() instanceof Boolean;
  }

  /**
   * Whether {@code type} denotes the type with the given full name. Types converted from metadata
   * are compared by their {@link TypeReference} annotation; others by their printed name, either
   * fully qualified or simple.
   */
  static boolean isType(AstType type, String fullName) {
    TypeReference tr = type.getAnnotation(TypeReference.class);
    if (tr != null) {
      return tr.getFullName().equals(fullName);
    }
    String text = CSharpOutputVisitor.toText(type);
    return fullName.equals(text) || fullName.endsWith("." + text);
  }
}
