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
package org.ilspect.cast;

import com.ibm.wala.util.CancelException;
import com.ibm.wala.util.collections.HashMapFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.ilspect.cast.transforms.ExpressionTreeTransform;
import org.ilspect.cast.tree.AstNode;
import org.ilspect.cast.tree.AstType;
import org.ilspect.cast.tree.ComposedType;
import org.ilspect.cast.tree.Expression;
import org.ilspect.cast.tree.IdentifierExpression;
import org.ilspect.cast.tree.InvocationExpression;
import org.ilspect.cast.tree.MemberReferenceExpression;
import org.ilspect.cast.tree.MemberType;
import org.ilspect.cast.tree.PrimitiveType;
import org.ilspect.cast.tree.SimpleType;
import org.ilspect.cast.tree.TypeOfExpression;
import org.ilspect.cast.tree.TypeReferenceExpression;
import org.ilspect.core.metadata.FieldReference;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.metadata.MethodReference;
import org.ilspect.core.metadata.ParameterDefinition;
import org.ilspect.core.metadata.PropertyDefinition;
import org.ilspect.core.metadata.TypeDefinition;
import org.ilspect.core.metadata.TypeReference;
import org.ilspect.core.util.IlspectProperties;

/**
 * Builds C# syntax from metadata and runs the rewriting passes over the result.
 *
 * <p>The static helpers convert metadata types to type syntax. An instance holds the pass
 * pipeline for one {@link DecompilerContext}; passes run in the order they were added.
 */
public class AstBuilder {

  private static final boolean DEBUG = false;

  /** default nesting depth at which a type signature becomes {@link AstType#NULL} */
  public static final int MAX_CONVERTTYPE_DEPTH = 50;

  private static final Map<String, String> KEYWORDS = HashMapFactory.make();

  static {
    KEYWORDS.put("SByte", "sbyte");
    KEYWORDS.put("Int16", "short");
    KEYWORDS.put("Int32", "int");
    KEYWORDS.put("Int64", "long");
    KEYWORDS.put("Byte", "byte");
    KEYWORDS.put("UInt16", "ushort");
    KEYWORDS.put("UInt32", "uint");
    KEYWORDS.put("UInt64", "ulong");
    KEYWORDS.put("String", "string");
    KEYWORDS.put("Single", "float");
    KEYWORDS.put("Double", "double");
    KEYWORDS.put("Decimal", "decimal");
    KEYWORDS.put("Char", "char");
    KEYWORDS.put("Boolean", "bool");
    KEYWORDS.put("Void", "void");
    KEYWORDS.put("Object", "object");
  }

  private final DecompilerContext context;

  private final List<AstTransform> transforms = new LinkedList<>();

  public AstBuilder(DecompilerContext context) {
    this.context = context;
    if (context.getSettings().isExpressionTrees()) {
      transforms.add(new ExpressionTreeTransform(context));
    }
  }

  public DecompilerContext getContext() {
    return context;
  }

  public void addTransform(AstTransform transform, boolean prepend) {
    if (prepend) transforms.add(0, transform);
    else transforms.add(transform);
  }

  public List<AstTransform> getTransforms() {
    return Collections.unmodifiableList(transforms);
  }

  /**
   * Runs every pass over {@code root}, checking for cancellation between passes.
   *
   * @return the root after the last pass
   */
  public AstNode runTransforms(AstNode root) throws CancelException {
    for (AstTransform t : transforms) {
      context.throwIfCanceled();
      if (DEBUG) {
        System.err.println("running " + t.getClass().getSimpleName());
      }
      root = t.run(root);
    }
    return root;
  }

  /** {@link #convertType(TypeReference, StringBuilder)} with this builder's depth limit */
  public AstType convertType(TypeReference type) {
    return convertType(
        type,
        new StringBuilder(),
        EnumSet.noneOf(ConvertTypeOptions.class),
        context.getSettings().getMaxConvertTypeDepth());
  }

  public static AstType convertType(TypeReference type, StringBuilder sb) {
    return convertType(type, sb, EnumSet.noneOf(ConvertTypeOptions.class), defaultMaxDepth());
  }

  /**
   * Converts a type signature to C# type syntax. Named types are annotated with their {@link
   * TypeReference}.
   *
   * @param sb scratch buffer, shared with the caller and overwritten freely
   * @return the type syntax, or {@link AstType#NULL} when the signature is null or nests deeper
   *     than {@code maxDepth}
   */
  public static AstType convertType(
      TypeReference type, StringBuilder sb, Set<ConvertTypeOptions> options, int maxDepth) {
    AstType result = convert(type, sb, options, 1, maxDepth);
    if (DEBUG && result.isNull()) {
      System.err.println("cannot represent type " + type);
    }
    return result;
  }

  static int defaultMaxDepth() {
    return IlspectProperties.getInt(
        IlspectProperties.getProperties(),
        IlspectProperties.MAX_CONVERT_TYPE_DEPTH,
        MAX_CONVERTTYPE_DEPTH);
  }

  private static AstType convert(
      TypeReference type, StringBuilder sb, Set<ConvertTypeOptions> options, int depth, int max) {
    if (type == null || depth > max) {
      return AstType.NULL;
    }
    switch (type.getKind()) {
      case PINNED:
        return convert(type.getElementType(), sb, options, depth + 1, max);
      case BY_REF:
      case POINTER:
        return convert(type.getElementType(), sb, options, depth + 1, max).makePointerType();
      case ARRAY:
        return convert(type.getElementType(), sb, options, depth + 1, max)
            .makeArrayType(type.getRank());
      case GENERIC_INSTANCE:
        {
          TypeReference open = type.getElementType();
          List<AstType> args = new ArrayList<>();
          for (TypeReference a : type.getGenericArguments()) {
            AstType arg = convert(a, sb, options, depth + 1, max);
            if (arg.isNull()) {
              return AstType.NULL;
            }
            args.add(arg);
          }
          if (open.isSystemType("Nullable`1") && args.size() == 1) {
            ComposedType nullable = new ComposedType(args.get(0));
            nullable.setHasNullableSpecifier(true);
            return nullable;
          }
          AstType baseType = convert(open, sb, options, depth + 1, max);
          if (baseType.isNull()) {
            return AstType.NULL;
          }
          applyTypeArgumentsTo(baseType, args);
          return baseType;
        }
      case GENERIC_PARAMETER:
        return AstNode.annotate(new SimpleType(type.getName()), type);
      case CLASS:
      case VALUE_TYPE:
      default:
        return convertNamedType(type, sb, options, depth, max);
    }
  }

  private static AstType convertNamedType(
      TypeReference type, StringBuilder sb, Set<ConvertTypeOptions> options, int depth, int max) {
    String name = cleanName(type.getName());
    if (type.isNested()) {
      if (options.contains(ConvertTypeOptions.DO_NOT_INCLUDE_ENCLOSING_TYPE)) {
        return AstNode.annotate(new SimpleType(name), type);
      }
      AstType outer = convert(type.getDeclaringType(), sb, options, depth + 1, max);
      if (outer.isNull()) {
        return AstType.NULL;
      }
      return AstNode.annotate(new MemberType(outer, name), type);
    }
    if (TypeReference.SYSTEM.equals(type.getNamespace())
        && !options.contains(ConvertTypeOptions.DO_NOT_USE_PRIMITIVE_TYPE_NAMES)) {
      String keyword = KEYWORDS.get(type.getName());
      if (keyword != null) {
        return AstNode.annotate(new PrimitiveType(keyword), type);
      }
    }
    if (options.contains(ConvertTypeOptions.INCLUDE_NAMESPACE) && !type.getNamespace().isEmpty()) {
      AstType ns = null;
      for (String part : type.getNamespace().split("\\.")) {
        ns = ns == null ? new SimpleType(part) : new MemberType(ns, part);
      }
      return AstNode.annotate(new MemberType(ns, name), type);
    }
    return AstNode.annotate(new SimpleType(name), type);
  }

  /** {@code List`1} becomes {@code List} */
  static String cleanName(String name) {
    int tick = name.lastIndexOf('`');
    return tick > 0 ? name.substring(0, tick) : name;
  }

  /** the generic arity encoded in a metadata name, 0 if there is none */
  static int arity(String name) {
    int tick = name.lastIndexOf('`');
    if (tick < 0) {
      return 0;
    }
    try {
      return Integer.parseInt(name.substring(tick + 1));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  /**
   * Distributes the type arguments of an instantiated nested type: each level takes as many
   * arguments, from the end, as its own name declares; the rest go to the enclosing type.
   */
  static void applyTypeArgumentsTo(AstType baseType, List<AstType> typeArguments) {
    if (baseType instanceof SimpleType) {
      SimpleType st = (SimpleType) baseType;
      TypeReference type = st.getAnnotation(TypeReference.class);
      if (type != null) {
        int count = Math.min(arity(type.getName()), typeArguments.size());
        st.getTypeArguments()
            .addAll(typeArguments.subList(typeArguments.size() - count, typeArguments.size()));
      } else {
        st.getTypeArguments().addAll(typeArguments);
      }
    } else if (baseType instanceof MemberType) {
      MemberType mt = (MemberType) baseType;
      TypeReference type = mt.getAnnotation(TypeReference.class);
      if (type != null) {
        int count = Math.min(arity(type.getName()), typeArguments.size());
        int split = typeArguments.size() - count;
        List<AstType> own = new ArrayList<>(typeArguments.subList(split, typeArguments.size()));
        List<AstType> rest = new ArrayList<>(typeArguments.subList(0, split));
        mt.getTypeArguments().addAll(own);
        if (!rest.isEmpty()) {
          applyTypeArgumentsTo(mt.getTarget(), rest);
        }
      } else {
        mt.getTypeArguments().addAll(typeArguments);
      }
    }
  }

  /** {@code typeof(T)}, with empty type arguments for open generic types: {@code typeof(List<>)} */
  public static TypeOfExpression createTypeOfExpression(TypeReference type, StringBuilder sb) {
    AstType t = convertType(type, sb);
    addTypeArgumentsForUnboundGenerics(t);
    return new TypeOfExpression(t);
  }

  private static void addTypeArgumentsForUnboundGenerics(AstType type) {
    TypeReference tr = type.getAnnotation(TypeReference.class);
    if (type instanceof MemberType) {
      MemberType mt = (MemberType) type;
      addTypeArgumentsForUnboundGenerics(mt.getTarget());
      if (tr != null && mt.getTypeArguments().isEmpty()) {
        for (int i = arity(tr.getName()); i > 0; i--) {
          mt.getTypeArguments().add(new SimpleType(""));
        }
      }
    } else if (type instanceof SimpleType) {
      SimpleType st = (SimpleType) type;
      if (tr != null
          && tr.getKind() != TypeReference.Kind.GENERIC_PARAMETER
          && st.getTypeArguments().isEmpty()) {
        for (int i = arity(tr.getName()); i > 0; i--) {
          st.getTypeArguments().add(new SimpleType(""));
        }
      }
    }
  }

  /**
   * The expression an {@code ldtoken} instruction decompiles to: {@code typeof(T).TypeHandle} for
   * types, {@code fieldof(T.f).FieldHandle} and {@code methodof(T.M(P)).MethodHandle} for members.
   * The pseudo-call carries a {@link LdTokenAnnotation}; its argument carries the member.
   */
  public static MemberReferenceExpression createLdToken(Object operand, StringBuilder sb) {
    if (operand instanceof TypeReference) {
      return createTypeOfExpression((TypeReference) operand, sb).member("TypeHandle");
    }
    Expression entity;
    String loadName;
    String handleName;
    if (operand instanceof FieldReference) {
      FieldReference f = (FieldReference) operand;
      loadName = "fieldof";
      handleName = "FieldHandle";
      entity =
          AstNode.annotate(
              new TypeReferenceExpression(convertType(f.getDeclaringType(), sb))
                  .member(f.getName()),
              f);
    } else if (operand instanceof MethodReference) {
      MethodReference m = (MethodReference) operand;
      loadName = "methodof";
      handleName = "MethodHandle";
      List<Expression> parameterTypes = new ArrayList<>();
      for (ParameterDefinition p : m.getParameters()) {
        parameterTypes.add(new TypeReferenceExpression(convertType(p.getType(), sb)));
      }
      entity =
          AstNode.annotate(
              convertType(m.getDeclaringType(), sb)
                  .invoke(m.getName(), parameterTypes.toArray(new Expression[0])),
              m);
    } else {
      throw new IllegalArgumentException("cannot load a token for " + operand);
    }
    InvocationExpression load = new IdentifierExpression(loadName).invoke(entity);
    load.addAnnotation(LdTokenAnnotation.INSTANCE);
    return load.member(handleName);
  }

  /**
   * The indexer that {@code accessor} belongs to: a property named by the declaring type's default
   * member whose getter or setter is {@code accessor}. Null if there is none.
   */
  public static PropertyDefinition getIndexer(MethodDefinition accessor) {
    TypeDefinition type = accessor.getDeclaringTypeDefinition();
    if (type == null && accessor.getModule() != null) {
      type = accessor.getModule().resolve(accessor.getDeclaringType());
    }
    if (type == null || type.getDefaultMemberName() == null) {
      return null;
    }
    for (PropertyDefinition p : type.getProperties()) {
      if (p.getName().equals(type.getDefaultMemberName())
          && (isSameMethod(p.getGetMethod(), accessor)
              || isSameMethod(p.getSetMethod(), accessor))) {
        return p;
      }
    }
    return null;
  }

  private static boolean isSameMethod(MethodDefinition m, MethodReference other) {
    return m != null && (m == other || m.hasSameSignature(other));
  }

  /**
   * Whether an anonymous type creation can use projection initializers, {@code new { x, p.Y }}:
   * each argument must be an identifier or member access named like the corresponding parameter.
   */
  public static boolean canInferAnonymousTypePropertyNamesFromArguments(
      List<? extends Expression> args, List<ParameterDefinition> parameters) {
    if (args.size() != parameters.size()) {
      return false;
    }
    for (int i = 0; i < args.size(); i++) {
      Expression arg = args.get(i);
      String inferredName;
      if (arg instanceof IdentifierExpression) {
        inferredName = ((IdentifierExpression) arg).getIdentifier();
      } else if (arg instanceof MemberReferenceExpression) {
        inferredName = ((MemberReferenceExpression) arg).getMemberName();
      } else {
        inferredName = null;
      }
      if (inferredName == null || !inferredName.equals(parameters.get(i).getName())) {
        return false;
      }
    }
    return true;
  }
}
