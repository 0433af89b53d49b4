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

public enum ConvertTypeOptions {
  /** print {@code System.Collections.Generic.List<T>} instead of {@code List<T>} */
  INCLUDE_NAMESPACE,
  /** print {@code Int32} instead of {@code int} */
  DO_NOT_USE_PRIMITIVE_TYPE_NAMES,
  /** print {@code Inner} instead of {@code Outer.Inner} */
  DO_NOT_INCLUDE_ENCLOSING_TYPE
}
