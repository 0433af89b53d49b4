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

import java.util.Properties;
import org.ilspect.core.util.IlspectProperties;

/** Options for building syntax trees. Setters return {@code this}. */
public class DecompilerSettings {

  private boolean expressionTrees = true;

  private int maxExpressionDepth = 1000;

  private int maxConvertTypeDepth = AstBuilder.MAX_CONVERTTYPE_DEPTH;

  public static DecompilerSettings fromProperties(Properties p) {
    return new DecompilerSettings()
        .setExpressionTrees(
            IlspectProperties.getBoolean(p, IlspectProperties.EXPRESSION_TREES, true))
        .setMaxExpressionDepth(
            IlspectProperties.getInt(p, IlspectProperties.MAX_EXPRESSION_DEPTH, 1000))
        .setMaxConvertTypeDepth(
            IlspectProperties.getInt(
                p, IlspectProperties.MAX_CONVERT_TYPE_DEPTH, AstBuilder.MAX_CONVERTTYPE_DEPTH));
  }

  public static DecompilerSettings getDefault() {
    return fromProperties(IlspectProperties.getProperties());
  }

  /** whether {@code Expression.Lambda(...)} builder calls are turned back into lambdas */
  public boolean isExpressionTrees() {
    return expressionTrees;
  }

  public DecompilerSettings setExpressionTrees(boolean expressionTrees) {
    this.expressionTrees = expressionTrees;
    return this;
  }

  public int getMaxExpressionDepth() {
    return maxExpressionDepth;
  }

  public DecompilerSettings setMaxExpressionDepth(int maxExpressionDepth) {
    if (maxExpressionDepth <= 0) {
      throw new IllegalArgumentException("bad depth " + maxExpressionDepth);
    }
    this.maxExpressionDepth = maxExpressionDepth;
    return this;
  }

  public int getMaxConvertTypeDepth() {
    return maxConvertTypeDepth;
  }

  public DecompilerSettings setMaxConvertTypeDepth(int maxConvertTypeDepth) {
    if (maxConvertTypeDepth <= 0) {
      throw new IllegalArgumentException("bad depth " + maxConvertTypeDepth);
    }
    this.maxConvertTypeDepth = maxConvertTypeDepth;
    return this;
  }
}
