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

import com.ibm.wala.util.CancelException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.ilspect.cast.AstTransform;
import org.ilspect.cast.DecompilerContext;
import org.ilspect.cast.tree.AstNode;
import org.ilspect.cast.tree.Expression;
import org.ilspect.cast.tree.InvocationExpression;

/**
 * Replaces every {@code Expression.Lambda(...)} construction in a tree by the lambda it builds.
 * Constructions the converter declines stay as they are. Converted lambdas are not revisited.
 */
public class ExpressionTreeTransform implements AstTransform {

  private static final boolean DEBUG = false;

  private final DecompilerContext context;

  private final StringBuilder sb = new StringBuilder();

  private int convertedCount;

  public ExpressionTreeTransform(DecompilerContext context) {
    this.context = context;
  }

  /** how many constructions have been replaced so far */
  public int getConvertedCount() {
    return convertedCount;
  }

  @Override
  public AstNode run(AstNode root) throws CancelException {
    AstNode result = root;
    Deque<AstNode> worklist = new ArrayDeque<>();
    worklist.push(root);
    while (!worklist.isEmpty()) {
      AstNode node = worklist.pop();
      if (node instanceof InvocationExpression
          && ExpressionTreeConverter.couldBeExpressionTree((InvocationExpression) node, sb)) {
        context.throwIfCanceled();
        Optional<Expression> converted =
            ExpressionTreeConverter.tryConvert(context, (Expression) node, sb);
        if (converted.isPresent()) {
          if (DEBUG) {
            System.err.println("converted expression tree " + converted.get());
          }
          if (node == root) {
            result = converted.get();
          } else {
            node.replaceWith(converted.get());
          }
          convertedCount++;
          continue;
        }
      }
      List<AstNode> children = node.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        worklist.push(children.get(i));
      }
    }
    return result;
  }
}
