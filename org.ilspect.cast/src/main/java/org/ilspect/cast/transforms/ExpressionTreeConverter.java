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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.ilspect.cast.AstBuilder;
import org.ilspect.cast.ConvertTypeOptions;
import org.ilspect.cast.DecompilerContext;
import org.ilspect.cast.transforms.HandlePatterns.HandleMatch;
import org.ilspect.cast.tree.AnonymousTypeCreateExpression;
import org.ilspect.cast.tree.ArrayCreateExpression;
import org.ilspect.cast.tree.ArrayInitializerExpression;
import org.ilspect.cast.tree.AsExpression;
import org.ilspect.cast.tree.AstNode;
import org.ilspect.cast.tree.AstType;
import org.ilspect.cast.tree.BinaryOperatorExpression;
import org.ilspect.cast.tree.BinaryOperatorType;
import org.ilspect.cast.tree.CastExpression;
import org.ilspect.cast.tree.CheckedAnnotation;
import org.ilspect.cast.tree.ConditionalExpression;
import org.ilspect.cast.tree.Expression;
import org.ilspect.cast.tree.IdentifierExpression;
import org.ilspect.cast.tree.IndexerExpression;
import org.ilspect.cast.tree.InvocationExpression;
import org.ilspect.cast.tree.IsExpression;
import org.ilspect.cast.tree.LambdaExpression;
import org.ilspect.cast.tree.MemberReferenceExpression;
import org.ilspect.cast.tree.NamedExpression;
import org.ilspect.cast.tree.NullReferenceExpression;
import org.ilspect.cast.tree.ObjectCreateExpression;
import org.ilspect.cast.tree.ParameterDeclaration;
import org.ilspect.cast.tree.TypeReferenceExpression;
import org.ilspect.cast.tree.UnaryOperatorExpression;
import org.ilspect.cast.tree.UnaryOperatorType;
import org.ilspect.core.metadata.FieldReference;
import org.ilspect.core.metadata.MemberReference;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.metadata.MethodReference;
import org.ilspect.core.metadata.ModuleDefinition;
import org.ilspect.core.metadata.ParameterDefinition;
import org.ilspect.core.metadata.PropertyDefinition;
import org.ilspect.core.metadata.TypeReference;
import org.ilspect.core.util.InsufficientStackException;
import org.ilspect.core.util.StackGuard;
import org.ilspect.ilast.ILVariable;

/**
 * Turns the {@code System.Linq.Expressions.Expression} factory calls a compiler emits for an
 * expression tree lambda back into the lambda it was compiled from:
 *
 * <pre>
 *   Expression.Lambda(Expression.Add(Expression.Constant(2), Expression.Constant(3)),
 *       new ParameterExpression[0])
 * </pre>
 *
 * becomes {@code () => 2 + 3}.
 *
 * <p>Every conversion step either succeeds or declines with {@link Optional#empty()}; one declined
 * step declines the whole conversion and the input tree is left untouched. A converter instance
 * handles one call to {@link #tryConvert} and is not shared.
 */
public final class ExpressionTreeConverter {

  private static final boolean DEBUG = false;

  private final DecompilerContext context;

  private final StringBuilder sb;

  /** lambdas being converted, innermost first */
  private final Deque<LambdaExpression> activeLambdas = new ArrayDeque<>();

  private final StackGuard guard;

  private MemberReference arrayLengthMember;

  private boolean arrayLengthMemberComputed;

  private ExpressionTreeConverter(DecompilerContext context, StringBuilder sb) {
    this.context = context;
    this.sb = sb;
    this.guard = new StackGuard(context.getSettings().getMaxExpressionDepth());
  }

  /** Whether {@code expr} is a two-argument call to {@code Expression.Lambda}. */
  public static boolean couldBeExpressionTree(InvocationExpression expr, StringBuilder sb) {
    if (expr != null && expr.getArguments().size() == 2) {
      MethodReference mr = expr.getAnnotation(MethodReference.class);
      return mr != null && mr.getName().equals("Lambda") && isExpressionType(mr, sb);
    }
    return false;
  }

  private static boolean isExpressionType(MethodReference mr, StringBuilder sb) {
    TypeReference t = mr.getDeclaringType().getGenericTypeOrSelf();
    if (t.isNested()) {
      return false;
    }
    sb.setLength(0);
    sb.append(t.getNamespace()).append('.').append(t.getName());
    return HandlePatterns.EXPRESSION.contentEquals(sb);
  }

  /**
   * Converts an expression tree construction to native syntax. The result carries an {@link
   * ExpressionTreeLambdaAnnotation}; {@code expr} itself is not modified.
   *
   * @param sb scratch buffer, overwritten freely
   * @return the converted expression, or empty when some part is not supported or nests deeper
   *     than the configured expression depth
   */
  public static Optional<Expression> tryConvert(
      DecompilerContext context, Expression expr, StringBuilder sb) {
    Optional<Expression> converted;
    try {
      converted = new ExpressionTreeConverter(context, sb).convert(expr);
    } catch (InsufficientStackException e) {
      if (DEBUG) {
        System.err.println("expression tree too deep: " + e.getMessage());
      }
      return Optional.empty();
    }
    converted.ifPresent(c -> c.addAnnotation(ExpressionTreeLambdaAnnotation.INSTANCE));
    return converted;
  }

  private Optional<Expression> convert(Expression expr) {
    guard.enter();
    try {
      return dispatch(expr);
    } finally {
      guard.exit();
    }
  }

  private Optional<Expression> dispatch(Expression expr) {
    if (expr instanceof InvocationExpression) {
      InvocationExpression invocation = (InvocationExpression) expr;
      MethodReference mr = invocation.getAnnotation(MethodReference.class);
      if (mr != null && isExpressionType(mr, sb)) {
        switch (mr.getName()) {
          case "Add":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.ADD, CheckedAnnotation.UNCHECKED);
          case "AddChecked":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.ADD, CheckedAnnotation.CHECKED);
          case "And":
            return convertBinaryOperator(invocation, BinaryOperatorType.BITWISE_AND, null);
          case "AndAlso":
            return convertBinaryOperator(invocation, BinaryOperatorType.CONDITIONAL_AND, null);
          case "ArrayAccess":
          case "ArrayIndex":
            return convertArrayIndex(invocation);
          case "ArrayLength":
            return convertArrayLength(invocation);
          case "Call":
            return convertCall(invocation);
          case "Coalesce":
            return convertBinaryOperator(invocation, BinaryOperatorType.NULL_COALESCING, null);
          case "Condition":
            return convertCondition(invocation);
          case "Constant":
            if (invocation.getArguments().size() >= 1) {
              return Optional.of(invocation.getArguments().get(0).clone());
            }
            return notSupported(expr);
          case "Convert":
            return convertCast(invocation, false);
          case "ConvertChecked":
            return convertCast(invocation, true);
          case "Divide":
            return convertBinaryOperator(invocation, BinaryOperatorType.DIVIDE, null);
          case "Equal":
            return convertBinaryOperator(invocation, BinaryOperatorType.EQUALITY, null);
          case "ExclusiveOr":
            return convertBinaryOperator(invocation, BinaryOperatorType.EXCLUSIVE_OR, null);
          case "Field":
            return convertField(invocation);
          case "GreaterThan":
            return convertBinaryOperator(invocation, BinaryOperatorType.GREATER_THAN, null);
          case "GreaterThanOrEqual":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.GREATER_THAN_OR_EQUAL, null);
          case "Invoke":
            return convertInvoke(invocation);
          case "Lambda":
            return convertLambda(invocation);
          case "LeftShift":
            return convertBinaryOperator(invocation, BinaryOperatorType.SHIFT_LEFT, null);
          case "LessThan":
            return convertBinaryOperator(invocation, BinaryOperatorType.LESS_THAN, null);
          case "LessThanOrEqual":
            return convertBinaryOperator(invocation, BinaryOperatorType.LESS_THAN_OR_EQUAL, null);
          case "ListInit":
            return convertListInit(invocation);
          case "MemberInit":
            return convertMemberInit(invocation);
          case "Modulo":
            return convertBinaryOperator(invocation, BinaryOperatorType.MODULUS, null);
          case "Multiply":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.MULTIPLY, CheckedAnnotation.UNCHECKED);
          case "MultiplyChecked":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.MULTIPLY, CheckedAnnotation.CHECKED);
          case "Negate":
            return convertUnaryOperator(
                invocation, UnaryOperatorType.MINUS, CheckedAnnotation.UNCHECKED);
          case "NegateChecked":
            return convertUnaryOperator(
                invocation, UnaryOperatorType.MINUS, CheckedAnnotation.CHECKED);
          case "New":
            return convertNewObject(invocation);
          case "NewArrayBounds":
            return convertNewArrayBounds(invocation);
          case "NewArrayInit":
            return convertNewArrayInit(invocation);
          case "Not":
            return convertUnaryOperator(invocation, UnaryOperatorType.NOT, null);
          case "NotEqual":
            return convertBinaryOperator(invocation, BinaryOperatorType.INEQUALITY, null);
          case "OnesComplement":
            return convertUnaryOperator(invocation, UnaryOperatorType.BIT_NOT, null);
          case "Or":
            return convertBinaryOperator(invocation, BinaryOperatorType.BITWISE_OR, null);
          case "OrElse":
            return convertBinaryOperator(invocation, BinaryOperatorType.CONDITIONAL_OR, null);
          case "Property":
            return convertProperty(invocation);
          case "Quote":
            if (invocation.getArguments().size() == 1) {
              return convert(invocation.getArguments().get(0));
            }
            return notSupported(invocation);
          case "RightShift":
            return convertBinaryOperator(invocation, BinaryOperatorType.SHIFT_RIGHT, null);
          case "Subtract":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.SUBTRACT, CheckedAnnotation.UNCHECKED);
          case "SubtractChecked":
            return convertBinaryOperator(
                invocation, BinaryOperatorType.SUBTRACT, CheckedAnnotation.CHECKED);
          case "TypeAs":
            return convertTypeAs(invocation);
          case "TypeIs":
            return convertTypeIs(invocation);
          case "AddAssign":
          case "AddAssignChecked":
          case "AndAssign":
          case "Assign":
          case "DivideAssign":
          case "ExclusiveOrAssign":
          case "LeftShiftAssign":
          case "ModuloAssign":
          case "MultiplyAssign":
          case "MultiplyAssignChecked":
          case "OrAssign":
          case "RightShiftAssign":
          case "SubtractAssign":
          case "SubtractAssignChecked":
            // assignments cannot occur in an expression lambda
            return notSupported(invocation);
          default:
            break;
        }
      }
    } else if (expr instanceof IdentifierExpression) {
      ILVariable v = expr.getAnnotation(ILVariable.class);
      if (v != null) {
        for (LambdaExpression lambda : activeLambdas) {
          for (ParameterDeclaration p : lambda.getParameters()) {
            if (p.getAnnotation(ILVariable.class) == v) {
              return Optional.of(AstNode.annotate(new IdentifierExpression(p.getName()), v));
            }
          }
        }
      }
    }
    return notSupported(expr);
  }

  private static Optional<Expression> notSupported(Expression expr) {
    if (DEBUG) {
      System.err.println("expression tree conversion failed: '" + expr + "' is not supported");
    }
    return Optional.empty();
  }

  private AstType convertType(TypeReference type) {
    return AstBuilder.convertType(
        type,
        sb,
        EnumSet.noneOf(ConvertTypeOptions.class),
        context.getSettings().getMaxConvertTypeDepth());
  }

  private MethodDefinition resolve(MethodReference method) {
    if (method instanceof MethodDefinition) {
      return (MethodDefinition) method;
    }
    ModuleDefinition module = context.getModule();
    return module == null ? null : module.resolve(method);
  }

  // lambdas

  private Optional<Expression> convertLambda(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Expression body = args.get(0);
    if (!(args.get(1) instanceof ArrayCreateExpression)) {
      return notSupported(invocation);
    }
    LambdaExpression lambda = new LambdaExpression();
    ParameterDeclarationAnnotation annotation =
        body.getAnnotation(ParameterDeclarationAnnotation.class);
    if (annotation != null) {
      lambda.getParameters().addAll(annotation.getParameters());
    } else if (!HandlePatterns.isEmptyArray(args.get(1))) {
      return Optional.empty();
    }
    Optional<Expression> convertedBody;
    activeLambdas.push(lambda);
    try {
      convertedBody = convert(body);
    } finally {
      activeLambdas.pop();
    }
    if (!convertedBody.isPresent()) {
      return Optional.empty();
    }
    lambda.setBody(convertedBody.get());
    return Optional.of(lambda);
  }

  // members

  private Optional<Expression> convertField(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Expression fieldInfo = args.get(1);
    HandleMatch m = HandlePatterns.matchFieldFromHandle(fieldInfo);
    if (m == null && fieldInfo instanceof CastExpression) {
      m = HandlePatterns.matchFieldFromHandle(((CastExpression) fieldInfo).getExpression());
    }
    if (m == null) {
      return notSupported(invocation);
    }
    FieldReference fr = m.getMember(FieldReference.class);
    if (fr == null) {
      return Optional.empty();
    }
    Optional<Expression> target = convertTarget(args.get(0), m, fr.getDeclaringType());
    if (!target.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(AstNode.annotate(target.get().member(fr.getName()), fr));
  }

  private Optional<Expression> convertProperty(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Expression methodInfo = args.get(1);
    HandleMatch m = HandlePatterns.matchMethodFromHandle(methodInfo);
    if (m == null && methodInfo instanceof CastExpression) {
      m = HandlePatterns.matchMethodFromHandle(((CastExpression) methodInfo).getExpression());
    }
    if (m == null) {
      return notSupported(invocation);
    }
    MethodReference mr = m.getMember(MethodReference.class);
    if (mr == null) {
      return Optional.empty();
    }
    Optional<Expression> target = convertTarget(args.get(0), m, mr.getDeclaringType());
    if (!target.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(AstNode.annotate(target.get().member(getPropertyName(mr)), mr));
  }

  /** converts the instance a member is accessed on; null stands for a static access */
  private Optional<Expression> convertTarget(
      Expression target, HandleMatch m, TypeReference declaringType) {
    if (target == null || target instanceof NullReferenceExpression) {
      return Optional.of(staticTarget(m, declaringType));
    }
    return convert(target);
  }

  private Expression staticTarget(HandleMatch m, TypeReference declaringType) {
    if (m.getDeclaringType() != null) {
      return new TypeReferenceExpression(m.getDeclaringType().clone());
    }
    return new TypeReferenceExpression(convertType(declaringType));
  }

  private static String getPropertyName(MethodReference accessor) {
    String name = accessor.getName();
    if (name.startsWith("get_") || name.startsWith("set_")) {
      name = name.substring(4);
    }
    return name;
  }

  // calls

  private Optional<Expression> convertCall(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() < 2) {
      return notSupported(invocation);
    }
    Expression target;
    int firstArgument;
    HandleMatch m = HandlePatterns.matchMethodFromHandle(args.get(0));
    if (m != null) {
      target = null;
      firstArgument = 1;
    } else {
      m = HandlePatterns.matchMethodFromHandle(args.get(1));
      if (m == null) {
        return notSupported(invocation);
      }
      target = args.get(0);
      firstArgument = 2;
    }
    MethodReference mr = m.getMember(MethodReference.class);
    if (mr == null) {
      return Optional.empty();
    }
    Optional<Expression> convertedTarget = convertTarget(target, m, mr.getDeclaringType());
    if (!convertedTarget.isPresent()) {
      return Optional.empty();
    }
    MemberReferenceExpression mre = convertedTarget.get().member(mr.getName());
    for (TypeReference typeArgument : mr.getGenericArguments()) {
      mre.getTypeArguments().add(convertType(typeArgument));
    }

    List<Expression> arguments = null;
    if (args.size() == firstArgument + 1) {
      arguments = convertExpressionsArray(args.get(firstArgument)).orElse(null);
    }
    if (arguments == null) {
      arguments = new ArrayList<>();
      for (Expression argument : args.subList(firstArgument, args.size())) {
        if (argument instanceof NullReferenceExpression) {
          arguments.add(staticTarget(m, mr.getDeclaringType()));
        } else {
          Optional<Expression> converted = convert(argument);
          if (!converted.isPresent()) {
            return Optional.empty();
          }
          arguments.add(converted.get());
        }
      }
    }

    MethodDefinition md = resolve(mr);
    if (md != null) {
      if (md.isGetter()) {
        PropertyDefinition indexer = AstBuilder.getIndexer(md);
        if (indexer != null) {
          return Optional.of(
              AstNode.annotate(new IndexerExpression(mre.getTarget(), arguments), indexer));
        }
      }
    } else if (mr.getName().equals("get_Item")) {
      return Optional.of(AstNode.annotate(new IndexerExpression(mre.getTarget(), arguments), mr));
    }
    return Optional.of(AstNode.annotate(new InvocationExpression(mre, arguments), mr));
  }

  private Optional<Expression> convertInvoke(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<Expression> target = convert(args.get(0));
    Optional<List<Expression>> arguments = convertExpressionsArray(args.get(1));
    if (target.isPresent() && arguments.isPresent()) {
      return Optional.of(new InvocationExpression(target.get(), arguments.get()));
    }
    return Optional.empty();
  }

  // operators

  /** @param checkedContext null when the operator has no checked form */
  private Optional<Expression> convertBinaryOperator(
      InvocationExpression invocation, BinaryOperatorType op, CheckedAnnotation checkedContext) {
    List<Expression> args = invocation.getArguments();
    if (args.size() < 2) {
      return notSupported(invocation);
    }
    Optional<Expression> left = convert(args.get(0));
    if (!left.isPresent()) {
      return Optional.empty();
    }
    Optional<Expression> right = convert(args.get(1));
    if (!right.isPresent()) {
      return Optional.empty();
    }
    BinaryOperatorExpression boe = new BinaryOperatorExpression(left.get(), op, right.get());
    if (checkedContext != null) {
      boe.addAnnotation(checkedContext);
    }
    switch (args.size()) {
      case 2:
        return Optional.of(boe);
      case 3:
        return withOperatorMethod(boe, args.get(2));
      case 4:
        // liftToNull, then the operator method or null
        if (!HandlePatterns.isBooleanLiteral(args.get(2))) {
          return Optional.empty();
        }
        if (args.get(3) instanceof NullReferenceExpression) {
          return Optional.of(boe);
        }
        return withOperatorMethod(boe, args.get(3));
      default:
        return notSupported(invocation);
    }
  }

  private static Optional<Expression> withOperatorMethod(Expression e, Expression methodInfo) {
    HandleMatch m = HandlePatterns.matchMethodFromHandle(methodInfo);
    if (m == null) {
      return Optional.empty();
    }
    return Optional.of(AstNode.annotate(e, m.getMember(MethodReference.class)));
  }

  private Optional<Expression> convertUnaryOperator(
      InvocationExpression invocation, UnaryOperatorType op, CheckedAnnotation checkedContext) {
    List<Expression> args = invocation.getArguments();
    if (args.isEmpty()) {
      return notSupported(invocation);
    }
    Optional<Expression> operand = convert(args.get(0));
    if (!operand.isPresent()) {
      return Optional.empty();
    }
    UnaryOperatorExpression uoe = new UnaryOperatorExpression(op, operand.get());
    if (checkedContext != null) {
      uoe.addAnnotation(checkedContext);
    }
    switch (args.size()) {
      case 1:
        return Optional.of(uoe);
      case 2:
        return withOperatorMethod(uoe, args.get(1));
      default:
        return notSupported(invocation);
    }
  }

  private Optional<Expression> convertCondition(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 3) {
      return notSupported(invocation);
    }
    Optional<Expression> condition = convert(args.get(0));
    Optional<Expression> trueExpr = convert(args.get(1));
    Optional<Expression> falseExpr = convert(args.get(2));
    if (condition.isPresent() && trueExpr.isPresent() && falseExpr.isPresent()) {
      return Optional.of(
          new ConditionalExpression(condition.get(), trueExpr.get(), falseExpr.get()));
    }
    return Optional.empty();
  }

  // object creation

  private Optional<Expression> convertNewObject(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.isEmpty() || args.size() > 3) {
      return notSupported(invocation);
    }
    HandleMatch m = HandlePatterns.matchConstructorFromHandle(args.get(0));
    if (m == null) {
      return notSupported(invocation);
    }
    MethodReference ctor = m.getMember(MethodReference.class);
    if (ctor == null) {
      return Optional.empty();
    }
    AstType typeNode;
    TypeReference type;
    if (m.getDeclaringType() != null) {
      typeNode = m.getDeclaringType().clone();
      type = typeNode.getAnnotation(TypeReference.class);
    } else {
      typeNode = convertType(ctor.getDeclaringType());
      type = ctor.getDeclaringType();
    }
    if (typeNode.isNull()) {
      return Optional.empty();
    }
    ObjectCreateExpression oce = new ObjectCreateExpression(typeNode);
    if (args.size() >= 2) {
      Optional<List<Expression>> arguments = convertExpressionsArray(args.get(1));
      if (!arguments.isPresent()) {
        return Optional.empty();
      }
      oce.getArguments().addAll(arguments.get());
    }
    if (args.size() >= 3 && type != null && type.isAnonymousType()) {
      MethodDefinition resolved = resolve(ctor);
      if (resolved == null) {
        return Optional.empty();
      }
      List<ParameterDefinition> parameters = resolved.getParameters();
      if (parameters.size() != oce.getArguments().size()) {
        return Optional.empty();
      }
      AnonymousTypeCreateExpression atce = new AnonymousTypeCreateExpression();
      List<Expression> arguments = new ArrayList<>(oce.getArguments());
      if (AstBuilder.canInferAnonymousTypePropertyNamesFromArguments(arguments, parameters)) {
        oce.getArguments().moveTo(atce.getInitializers());
      } else {
        for (int i = 0; i < parameters.size(); i++) {
          ParameterDefinition p = parameters.get(i);
          atce.getInitializers()
              .add(AstNode.annotate(new NamedExpression(p.getName(), arguments.get(i)), p));
        }
      }
      return Optional.of(atce);
    }
    return Optional.of(oce);
  }

  private Optional<Expression> convertListInit(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<Expression> created = convert(args.get(0));
    if (!created.isPresent() || !(created.get() instanceof ObjectCreateExpression)) {
      return Optional.empty();
    }
    Optional<ArrayInitializerExpression> initializer = convertElementInit(args.get(1));
    if (!initializer.isPresent()) {
      return Optional.empty();
    }
    ObjectCreateExpression oce = (ObjectCreateExpression) created.get();
    oce.setInitializer(initializer.get());
    return Optional.of(oce);
  }

  /**
   * {@code new Expression[] { ... }}, or {@code new ElementInit[] { Expression.ElementInit(m, args)
   * }}
   */
  private Optional<ArrayInitializerExpression> convertElementInit(Expression elementsArray) {
    Optional<List<Expression>> elements = convertExpressionsArray(elementsArray);
    if (elements.isPresent()) {
      return Optional.of(new ArrayInitializerExpression(elements.get()));
    }
    List<Expression> inits =
        HandlePatterns.matchArrayInitialization(elementsArray, HandlePatterns.ELEMENT_INIT);
    if (inits == null) {
      return Optional.empty();
    }
    ArrayInitializerExpression result = new ArrayInitializerExpression();
    for (Expression init : inits) {
      if (!(init instanceof InvocationExpression)) {
        return Optional.empty();
      }
      InvocationExpression call = (InvocationExpression) init;
      if (!HandlePatterns.isStaticMember(call.getTarget(), HandlePatterns.EXPRESSION, "ElementInit")
          || call.getArguments().size() != 2) {
        return Optional.empty();
      }
      Optional<List<Expression>> arguments = convertExpressionsArray(call.getArguments().get(1));
      if (!arguments.isPresent()) {
        return Optional.empty();
      }
      result.getElements().add(new ArrayInitializerExpression(arguments.get()));
    }
    return Optional.of(result);
  }

  private Optional<Expression> convertMemberInit(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<Expression> created = convert(args.get(0));
    if (!created.isPresent() || !(created.get() instanceof ObjectCreateExpression)) {
      return Optional.empty();
    }
    Optional<ArrayInitializerExpression> bindings = convertMemberBindings(args.get(1));
    if (!bindings.isPresent()) {
      return Optional.empty();
    }
    ObjectCreateExpression oce = (ObjectCreateExpression) created.get();
    oce.setInitializer(bindings.get());
    return Optional.of(oce);
  }

  /** an array of {@code Expression.Bind}, {@code MemberBind} or {@code ListBind} calls */
  private Optional<ArrayInitializerExpression> convertMemberBindings(Expression elementsArray) {
    List<Expression> bindings =
        HandlePatterns.matchArrayInitialization(elementsArray, HandlePatterns.MEMBER_BINDING);
    if (bindings == null) {
      return Optional.empty();
    }
    ArrayInitializerExpression result = new ArrayInitializerExpression();
    for (Expression binding : bindings) {
      if (!(binding instanceof InvocationExpression)) {
        return Optional.empty();
      }
      InvocationExpression call = (InvocationExpression) binding;
      if (call.getArguments().size() != 2
          || !(call.getTarget() instanceof MemberReferenceExpression)) {
        return Optional.empty();
      }
      MemberReferenceExpression factory = (MemberReferenceExpression) call.getTarget();
      if (!HandlePatterns.isTypeReference(factory.getTarget(), HandlePatterns.EXPRESSION)) {
        return Optional.empty();
      }
      HandleMatch m = HandlePatterns.matchMethodFromHandle(call.getArguments().get(0));
      MethodReference setter = m == null ? null : m.getMember(MethodReference.class);
      if (setter == null) {
        return Optional.empty();
      }
      Expression value = call.getArguments().get(1);
      Optional<? extends Expression> converted;
      switch (factory.getMemberName()) {
        case "Bind":
          converted = convert(value);
          break;
        case "MemberBind":
          converted = convertMemberBindings(value);
          break;
        case "ListBind":
          converted = convertElementInit(value);
          break;
        default:
          return Optional.empty();
      }
      if (!converted.isPresent()) {
        return Optional.empty();
      }
      NamedExpression named = new NamedExpression(getPropertyName(setter), converted.get());
      result.getElements().add(AstNode.annotate(named, setter));
    }
    return Optional.of(result);
  }

  // types

  private Optional<Expression> convertCast(InvocationExpression invocation, boolean isChecked) {
    List<Expression> args = invocation.getArguments();
    if (args.size() < 2) {
      return Optional.empty();
    }
    Optional<Expression> converted = convert(args.get(0));
    Optional<AstType> type = convertTypeReference(args.get(1));
    if (!converted.isPresent() || !type.isPresent()) {
      return Optional.empty();
    }
    CastExpression cast = converted.get().castTo(type.get());
    cast.addAnnotation(CheckedAnnotation.of(isChecked));
    switch (args.size()) {
      case 2:
        return Optional.of(cast);
      case 3:
        return withOperatorMethod(cast, args.get(2));
      default:
        return Optional.empty();
    }
  }

  private static Optional<AstType> convertTypeReference(Expression typeOf) {
    AstType type = HandlePatterns.matchTypeOf(typeOf);
    return type == null ? Optional.empty() : Optional.of(type.clone());
  }

  private Optional<Expression> convertTypeAs(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return Optional.empty();
    }
    Optional<Expression> converted = convert(args.get(0));
    Optional<AstType> type = convertTypeReference(args.get(1));
    if (converted.isPresent() && type.isPresent()) {
      return Optional.of(new AsExpression(converted.get(), type.get()));
    }
    return Optional.empty();
  }

  private Optional<Expression> convertTypeIs(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return Optional.empty();
    }
    Optional<Expression> converted = convert(args.get(0));
    Optional<AstType> type = convertTypeReference(args.get(1));
    if (converted.isPresent() && type.isPresent()) {
      return Optional.of(new IsExpression(converted.get(), type.get()));
    }
    return Optional.empty();
  }

  // arrays

  /** converts the elements of {@code new Expression[0]} or {@code new Expression[] { ... }} */
  private Optional<List<Expression>> convertExpressionsArray(Expression array) {
    List<Expression> elements =
        HandlePatterns.matchArrayInitialization(array, HandlePatterns.EXPRESSION);
    if (elements == null) {
      return Optional.empty();
    }
    List<Expression> result = new ArrayList<>(elements.size());
    for (Expression e : elements) {
      Optional<Expression> converted = convert(e);
      if (!converted.isPresent()) {
        return Optional.empty();
      }
      result.add(converted.get());
    }
    return Optional.of(result);
  }

  private Optional<Expression> convertArrayIndex(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<Expression> target = convert(args.get(0));
    if (!target.isPresent()) {
      return Optional.empty();
    }
    Expression index = args.get(1);
    Optional<Expression> single = convert(index);
    if (single.isPresent()) {
      return Optional.of(
          new IndexerExpression(target.get(), Collections.singletonList(single.get())));
    }
    Optional<List<Expression>> indexes = convertExpressionsArray(index);
    if (indexes.isPresent()) {
      return Optional.of(new IndexerExpression(target.get(), indexes.get()));
    }
    return Optional.empty();
  }

  private Optional<Expression> convertArrayLength(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 1) {
      return notSupported(invocation);
    }
    Optional<Expression> target = convert(args.get(0));
    if (!target.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(AstNode.annotate(target.get().member("Length"), getArrayLengthMember()));
  }

  /**
   * {@code System.Array::Length}, or the {@code get_Length} reference when the property cannot be
   * found; null without a module. Computed once per converter.
   */
  private MemberReference getArrayLengthMember() {
    if (arrayLengthMemberComputed) {
      return arrayLengthMember;
    }
    arrayLengthMemberComputed = true;
    ModuleDefinition module = context.getModule();
    if (module == null) {
      return null;
    }
    MethodReference getter =
        new MethodReference(
            TypeReference.system("Array"),
            "get_Length",
            TypeReference.systemValueType("Int32"),
            true,
            Collections.<ParameterDefinition>emptyList());
    arrayLengthMember = getter;
    MethodDefinition md = module.resolve(getter);
    if (md == null || md.getDeclaringTypeDefinition() == null) {
      return arrayLengthMember;
    }
    PropertyDefinition property = md.getDeclaringTypeDefinition().findProperty("Length");
    if (property != null) {
      arrayLengthMember = property;
    }
    return arrayLengthMember;
  }

  private Optional<Expression> convertNewArrayInit(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<AstType> elementType = convertTypeReference(args.get(0));
    Optional<List<Expression>> elements = convertExpressionsArray(args.get(1));
    if (!elementType.isPresent() || !elements.isPresent()) {
      return Optional.empty();
    }
    ArrayCreateExpression ace = new ArrayCreateExpression(implicitIfAnonymous(elementType.get()));
    ace.getAdditionalArraySpecifiers().add(1);
    ace.setInitializer(new ArrayInitializerExpression(elements.get()));
    return Optional.of(ace);
  }

  private Optional<Expression> convertNewArrayBounds(InvocationExpression invocation) {
    List<Expression> args = invocation.getArguments();
    if (args.size() != 2) {
      return notSupported(invocation);
    }
    Optional<AstType> elementType = convertTypeReference(args.get(0));
    Optional<List<Expression>> bounds = convertExpressionsArray(args.get(1));
    if (!elementType.isPresent() || !bounds.isPresent()) {
      return Optional.empty();
    }
    ArrayCreateExpression ace = new ArrayCreateExpression(implicitIfAnonymous(elementType.get()));
    ace.getArguments().addAll(bounds.get());
    return Optional.of(ace);
  }

  /** anonymous types have no name to write, so such arrays are implicitly typed */
  private static AstType implicitIfAnonymous(AstType type) {
    for (AstNode n : type.getDescendantsAndSelf()) {
      TypeReference tr = n.getAnnotation(TypeReference.class);
      if (tr != null && tr.isAnonymousType()) {
        return null;
      }
    }
    return type;
  }
}
