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
package org.ilspect.ilast;

/** Exhaustive dispatch over the IL node variants. */
public interface ILNodeVisitor<R> {

  R visitExpression(ILExpression expr);

  R visitLabel(ILLabel label);

  R visitBlock(ILBlock block);

  R visitBasicBlock(ILBasicBlock block);

  R visitTryCatchBlock(ILTryCatchBlock tryCatch);

  /** also receives {@link ILTryCatchBlock.FilterILBlock}s */
  R visitCatchBlock(ILTryCatchBlock.CatchBlock catchBlock);

  R visitWhileLoop(ILWhileLoop loop);

  R visitCondition(ILCondition condition);

  R visitSwitch(ILSwitch switchNode);

  R visitCaseBlock(ILSwitch.CaseBlock caseBlock);

  R visitFixedStatement(ILFixedStatement fixedStatement);
}
