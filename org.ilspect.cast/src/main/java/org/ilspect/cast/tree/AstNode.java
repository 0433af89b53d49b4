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
import java.util.Collections;
import java.util.List;

/**
 * A node of the C#-like syntax tree. Every node knows its parent, so a pass can replace a node in
 * place, and carries a list of annotations: metadata references, variables and markers left by
 * earlier passes.
 *
 * <p>A node has at most one parent. Attaching a node that already has a parent detaches it from
 * the old one first.
 */
public abstract class AstNode {

  private AstNode parent;

  private final List<Object> annotations = new ArrayList<>(1);

  public AstNode getParent() {
    return parent;
  }

  /** whether this is one of the shared placeholder nodes that are never attached */
  public boolean isNull() {
    return false;
  }

  /** the non-null children, in source order */
  public abstract List<AstNode> getChildren();

  public abstract <R> R accept(AstVisitor<R> visitor);

  /** a deep copy of this subtree, annotations included, without a parent */
  @Override
  public abstract AstNode clone();

  /**
   * Replaces the child {@code old} by {@code replacement}; a null replacement removes the child.
   *
   * @return false if {@code old} is not a child of this node
   */
  abstract boolean replaceChild(AstNode old, AstNode replacement);

  <T extends AstNode> T adopt(T child) {
    if (child != null && !child.isNull()) {
      if (((AstNode) child).parent != null) {
        child.detach();
      }
      ((AstNode) child).parent = this;
    }
    return child;
  }

  void orphan(AstNode child) {
    if (child != null && child.parent == this) {
      child.parent = null;
    }
  }

  /** Puts {@code replacement} where this node is. */
  public void replaceWith(AstNode replacement) {
    if (parent == null) {
      throw new IllegalStateException("cannot replace the root node " + this);
    }
    if (replacement == this) {
      return;
    }
    AstNode p = parent;
    if (!p.replaceChild(this, replacement)) {
      throw new IllegalStateException(this + " is not a child of " + p);
    }
  }

  /** Removes this node from its parent; returns this node. */
  public AstNode detach() {
    if (parent != null) {
      AstNode p = parent;
      p.replaceChild(this, null);
      parent = null;
    }
    return this;
  }

  /** this node and all its descendants in pre-order */
  public List<AstNode> getDescendantsAndSelf() {
    List<AstNode> result = new ArrayList<>();
    collect(this, result);
    return result;
  }

  private static void collect(AstNode node, List<AstNode> result) {
    result.add(node);
    for (AstNode child : node.getChildren()) {
      collect(child, result);
    }
  }

  public void addAnnotation(Object annotation) {
    if (annotation == null) {
      throw new IllegalArgumentException("null annotation");
    }
    annotations.add(annotation);
  }

  /** the first annotation that is an instance of {@code type}, or null */
  public <T> T getAnnotation(Class<T> type) {
    for (Object a : annotations) {
      if (type.isInstance(a)) {
        return type.cast(a);
      }
    }
    return null;
  }

  public <T> List<T> getAnnotations(Class<T> type) {
    List<T> result = new ArrayList<>();
    for (Object a : annotations) {
      if (type.isInstance(a)) {
        result.add(type.cast(a));
      }
    }
    return result;
  }

  public List<Object> getAllAnnotations() {
    return Collections.unmodifiableList(annotations);
  }

  public void removeAnnotations(Class<?> type) {
    annotations.removeIf(type::isInstance);
  }

  /** Adds the annotations of {@code other} to those of {@code copy}; used by {@link #clone()}. */
  static <T extends AstNode> T copyAnnotations(AstNode other, T copy) {
    ((AstNode) copy).annotations.addAll(other.annotations);
    return copy;
  }

  /** Adds {@code annotation} to {@code node} and returns the node, for building trees inline. */
  public static <T extends AstNode> T annotate(T node, Object annotation) {
    if (annotation != null) {
      node.addAnnotation(annotation);
    }
    return node;
  }

  static <T extends AstNode> T cloneOrNull(T node, Class<T> type) {
    return node == null ? null : node.isNull() ? node : type.cast(node.clone());
  }

  static List<AstNode> children(AstNode... nodes) {
    List<AstNode> result = new ArrayList<>(nodes.length);
    for (AstNode n : nodes) {
      if (n != null && !n.isNull()) {
        result.add(n);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return CSharpOutputVisitor.toText(this);
  }
}
