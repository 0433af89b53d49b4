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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** A child list of an {@link AstNode}; elements added to it are attached to the owner. */
public final class NodeList<T extends AstNode> extends AbstractList<T> {

  private final AstNode owner;

  private final Class<T> elementType;

  private final List<T> elements = new ArrayList<>();

  NodeList(AstNode owner, Class<T> elementType) {
    this.owner = owner;
    this.elementType = elementType;
  }

  @Override
  public T get(int index) {
    return elements.get(index);
  }

  @Override
  public int size() {
    return elements.size();
  }

  @Override
  public void add(int index, T element) {
    if (element == null) {
      throw new IllegalArgumentException("null element");
    }
    owner.adopt(element);
    elements.add(index, element);
  }

  @Override
  public T set(int index, T element) {
    if (element == null) {
      throw new IllegalArgumentException("null element");
    }
    T old = elements.get(index);
    if (old == element) {
      return old;
    }
    owner.orphan(old);
    owner.adopt(element);
    // adopting may have removed the element from this very list
    elements.set(elements.indexOf(old), element);
    return old;
  }

  @Override
  public T remove(int index) {
    T old = elements.remove(index);
    owner.orphan(old);
    return old;
  }

  /** Moves all elements of this list to the end of {@code target}. */
  public void moveTo(Collection<? super T> target) {
    List<T> moved = new ArrayList<>(elements);
    clear();
    target.addAll(moved);
  }

  boolean replace(AstNode old, AstNode replacement) {
    for (int i = 0; i < elements.size(); i++) {
      if (elements.get(i) == old) {
        if (replacement == null) {
          remove(i);
        } else {
          set(i, elementType.cast(replacement));
        }
        return true;
      }
    }
    return false;
  }

  void cloneInto(NodeList<T> target) {
    for (T element : elements) {
      target.add(elementType.cast(element.clone()));
    }
  }
}
