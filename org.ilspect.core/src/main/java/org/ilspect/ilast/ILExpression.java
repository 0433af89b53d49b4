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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.ilspect.core.metadata.TypeReference;

/**
 * One operation with its operand and argument expressions. Nested expressions are always
 * arguments, never the operand.
 */
public class ILExpression extends ILNode {

  private ILCode code;

  private Object operand;

  private final List<ILExpression> arguments;

  private List<ILExpressionPrefix> prefixes;

  private TypeReference expectedType;

  private TypeReference inferredType;

  public ILExpression(ILCode code, Object operand, ILExpression... arguments) {
    this(code, operand, Arrays.asList(arguments));
  }

  public ILExpression(ILCode code, Object operand, List<ILExpression> arguments) {
    checkOperand(operand);
    this.code = code;
    this.operand = operand;
    this.arguments = new ArrayList<>(arguments);
  }

  private static void checkOperand(Object operand) {
    if (operand instanceof ILExpression) {
      throw new IllegalArgumentException("operand must not be an expression: " + operand);
    }
  }

  public ILCode getCode() {
    return code;
  }

  public void setCode(ILCode code) {
    this.code = code;
  }

  public Object getOperand() {
    return operand;
  }

  public void setOperand(Object operand) {
    checkOperand(operand);
    this.operand = operand;
  }

  /** the mutable argument list */
  public List<ILExpression> getArguments() {
    return arguments;
  }

  public TypeReference getExpectedType() {
    return expectedType;
  }

  public void setExpectedType(TypeReference expectedType) {
    this.expectedType = expectedType;
  }

  public TypeReference getInferredType() {
    return inferredType;
  }

  public void setInferredType(TypeReference inferredType) {
    this.inferredType = inferredType;
  }

  /** prefixes in the order they were added; null when there are none */
  public List<ILExpressionPrefix> getPrefixes() {
    return prefixes == null ? null : Collections.unmodifiableList(prefixes);
  }

  public void addPrefix(ILExpressionPrefix prefix) {
    if (prefixes == null) {
      prefixes = new ArrayList<>(1);
    }
    prefixes.add(prefix);
  }

  public ILExpressionPrefix getPrefix(ILCode prefixCode) {
    if (prefixes != null) {
      for (ILExpressionPrefix p : prefixes) {
        if (p.getCode() == prefixCode) {
          return p;
        }
      }
    }
    return null;
  }

  @Override
  public boolean isSafeToAddToEndBinSpans() {
    return true;
  }

  @Override
  public boolean match(ILCode c) {
    return code == c;
  }

  public boolean isBranch() {
    return operand instanceof ILLabel || operand instanceof ILLabel[];
  }

  public List<ILLabel> getBranchTargets() {
    if (operand instanceof ILLabel) {
      return Collections.singletonList((ILLabel) operand);
    } else if (operand instanceof ILLabel[]) {
      return Arrays.asList((ILLabel[]) operand);
    } else {
      return Collections.emptyList();
    }
  }

  @Override
  int getSlotCount() {
    return arguments.size();
  }

  @Override
  ILNode getSlot(int i) {
    return arguments.get(i);
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitExpression(this);
  }
}
