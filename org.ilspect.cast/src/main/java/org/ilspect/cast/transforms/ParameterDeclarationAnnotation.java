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
import org.ilspect.cast.tree.ParameterDeclaration;

/**
 * Attached to the body of an {@code Expression.Lambda(body, parameters)} call by the pass that
 * recognized the {@code Expression.Parameter(...)} declarations; lists the lambda's parameters.
 * Each declaration is annotated with the variable it binds.
 */
public class ParameterDeclarationAnnotation {

  private final List<ParameterDeclaration> parameters;

  public ParameterDeclarationAnnotation(List<ParameterDeclaration> parameters) {
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  /** fresh copies of the declarations, ready to be attached to a lambda */
  public List<ParameterDeclaration> getParameters() {
    List<ParameterDeclaration> result = new ArrayList<>(parameters.size());
    for (ParameterDeclaration p : parameters) {
      result.add(p.clone());
    }
    return result;
  }
}
