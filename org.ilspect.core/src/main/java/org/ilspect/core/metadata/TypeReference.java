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
package org.ilspect.core.metadata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A reference to a type as it appears in metadata signatures.
 *
 * <p>References are structural: two references denoting the same signature are {@link
 * #equals(Object) equal}, which is what the rest of the decompiler relies on when comparing types
 * and resolving members.
 */
public final class TypeReference {

  public enum Kind {
    CLASS,
    VALUE_TYPE,
    GENERIC_INSTANCE,
    GENERIC_PARAMETER,
    ARRAY,
    POINTER,
    BY_REF,
    PINNED
  }

  public static final String SYSTEM = "System";

  private final Kind kind;

  private final String namespace;

  private final String name;

  private final TypeReference declaringType;

  private final TypeReference elementType;

  private final List<TypeReference> genericArguments;

  private final int rank;

  private TypeReference(
      Kind kind,
      String namespace,
      String name,
      TypeReference declaringType,
      TypeReference elementType,
      List<TypeReference> genericArguments,
      int rank) {
    this.kind = kind;
    this.namespace = namespace == null ? "" : namespace;
    this.name = name;
    this.declaringType = declaringType;
    this.elementType = elementType;
    this.genericArguments = genericArguments;
    this.rank = rank;
  }

  public static TypeReference make(String namespace, String name) {
    return new TypeReference(
        Kind.CLASS, namespace, name, null, null, Collections.emptyList(), 0);
  }

  public static TypeReference makeValueType(String namespace, String name) {
    return new TypeReference(
        Kind.VALUE_TYPE, namespace, name, null, null, Collections.emptyList(), 0);
  }

  public static TypeReference makeNested(TypeReference declaringType, String name) {
    return makeNested(declaringType, name, false);
  }

  public static TypeReference makeNested(
      TypeReference declaringType, String name, boolean valueType) {
    Objects.requireNonNull(declaringType);
    return new TypeReference(
        valueType ? Kind.VALUE_TYPE : Kind.CLASS,
        declaringType.getNamespace(),
        name,
        declaringType,
        null,
        Collections.emptyList(),
        0);
  }

  /** A type in the {@code System} namespace of the core library. */
  public static TypeReference system(String name) {
    return make(SYSTEM, name);
  }

  public static TypeReference systemValueType(String name) {
    return makeValueType(SYSTEM, name);
  }

  public static TypeReference makeArray(TypeReference elementType) {
    return makeArray(elementType, 1);
  }

  public static TypeReference makeArray(TypeReference elementType, int rank) {
    if (rank < 1) {
      throw new IllegalArgumentException("bad array rank " + rank);
    }
    return new TypeReference(
        Kind.ARRAY, null, null, null, elementType, Collections.emptyList(), rank);
  }

  public static TypeReference makePointer(TypeReference elementType) {
    return new TypeReference(
        Kind.POINTER, null, null, null, elementType, Collections.emptyList(), 0);
  }

  public static TypeReference makeByRef(TypeReference elementType) {
    return new TypeReference(
        Kind.BY_REF, null, null, null, elementType, Collections.emptyList(), 0);
  }

  public static TypeReference makePinned(TypeReference elementType) {
    return new TypeReference(
        Kind.PINNED, null, null, null, elementType, Collections.emptyList(), 0);
  }

  public static TypeReference makeGenericInstance(
      TypeReference genericType, TypeReference... arguments) {
    return makeGenericInstance(genericType, Arrays.asList(arguments));
  }

  public static TypeReference makeGenericInstance(
      TypeReference genericType, List<TypeReference> arguments) {
    if (genericType.kind != Kind.CLASS && genericType.kind != Kind.VALUE_TYPE) {
      throw new IllegalArgumentException("cannot instantiate " + genericType);
    }
    return new TypeReference(
        Kind.GENERIC_INSTANCE,
        null,
        null,
        null,
        genericType,
        Collections.unmodifiableList(new ArrayList<>(arguments)),
        0);
  }

  public static TypeReference makeGenericParameter(String name) {
    return new TypeReference(
        Kind.GENERIC_PARAMETER, null, name, null, null, Collections.emptyList(), 0);
  }

  public Kind getKind() {
    return kind;
  }

  /** element type of arrays, pointers, by-refs and pinned types; the open type of instances */
  public TypeReference getElementType() {
    return elementType;
  }

  public List<TypeReference> getGenericArguments() {
    return genericArguments;
  }

  public int getRank() {
    return rank;
  }

  public TypeReference getDeclaringType() {
    if (kind == Kind.GENERIC_INSTANCE) {
      return elementType.getDeclaringType();
    }
    return declaringType;
  }

  public String getNamespace() {
    switch (kind) {
      case CLASS:
      case VALUE_TYPE:
        return namespace;
      case GENERIC_PARAMETER:
        return "";
      default:
        return elementType.getNamespace();
    }
  }

  /** The metadata name, including a generic arity suffix such as {@code List`1}. */
  public String getName() {
    switch (kind) {
      case CLASS:
      case VALUE_TYPE:
      case GENERIC_PARAMETER:
        return name;
      case GENERIC_INSTANCE:
        return elementType.getName();
      case ARRAY:
        return elementType.getName() + arraySuffix();
      case POINTER:
        return elementType.getName() + "*";
      case BY_REF:
        return elementType.getName() + "&";
      case PINNED:
      default:
        return elementType.getName();
    }
  }

  public String getFullName() {
    switch (kind) {
      case CLASS:
      case VALUE_TYPE:
        if (declaringType != null) {
          return declaringType.getFullName() + "/" + name;
        }
        return namespace.isEmpty() ? name : namespace + "." + name;
      case GENERIC_PARAMETER:
        return name;
      case GENERIC_INSTANCE:
        {
          StringBuilder sb = new StringBuilder(elementType.getFullName()).append('<');
          for (int i = 0; i < genericArguments.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(genericArguments.get(i).getFullName());
          }
          return sb.append('>').toString();
        }
      case ARRAY:
        return elementType.getFullName() + arraySuffix();
      case POINTER:
        return elementType.getFullName() + "*";
      case BY_REF:
        return elementType.getFullName() + "&";
      case PINNED:
      default:
        return elementType.getFullName();
    }
  }

  private String arraySuffix() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 1; i < rank; i++) {
      sb.append(',');
    }
    return sb.append(']').toString();
  }

  public boolean isValueType() {
    switch (kind) {
      case VALUE_TYPE:
        return true;
      case GENERIC_INSTANCE:
        return elementType.isValueType();
      default:
        return false;
    }
  }

  public boolean isNested() {
    return getDeclaringType() != null;
  }

  public boolean isSystemType(String systemName) {
    return (kind == Kind.CLASS || kind == Kind.VALUE_TYPE)
        && declaringType == null
        && SYSTEM.equals(namespace)
        && systemName.equals(name);
  }

  /** the open generic type for instances, otherwise this type */
  public TypeReference getGenericTypeOrSelf() {
    return kind == Kind.GENERIC_INSTANCE ? elementType : this;
  }

  /** Compiler-generated anonymous types are named like {@code <>f__AnonymousType0`2}. */
  public boolean isAnonymousType() {
    TypeReference t = getGenericTypeOrSelf();
    if (t.kind != Kind.CLASS || t.name == null) {
      return false;
    }
    return t.namespace.isEmpty()
        && t.declaringType == null
        && (t.name.startsWith("<>") || t.name.startsWith("VB$"))
        && t.name.contains("AnonymousType");
  }

  public boolean containsAnonymousType() {
    if (isAnonymousType()) {
      return true;
    }
    if (elementType != null && elementType.containsAnonymousType()) {
      return true;
    }
    for (TypeReference arg : genericArguments) {
      if (arg.containsAnonymousType()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TypeReference)) {
      return false;
    }
    TypeReference other = (TypeReference) obj;
    return kind == other.kind
        && rank == other.rank
        && namespace.equals(other.namespace)
        && Objects.equals(name, other.name)
        && Objects.equals(declaringType, other.declaringType)
        && Objects.equals(elementType, other.elementType)
        && genericArguments.equals(other.genericArguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, namespace, name, declaringType, elementType, genericArguments, rank);
  }

  @Override
  public String toString() {
    return getFullName();
  }
}
