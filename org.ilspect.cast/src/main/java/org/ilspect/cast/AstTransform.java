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
import org.ilspect.cast.tree.AstNode;

/** One rewriting pass over a syntax tree. */
public interface AstTransform {

  /**
   * Rewrites {@code root} in place.
   *
   * @return the new root, which differs from {@code root} only when the root itself was replaced
   */
  AstNode run(AstNode root) throws CancelException;
}
