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

/**
 * A straight-line block. The structuring passes keep it starting with a label and ending with an
 * unconditional transfer of control; the type itself does not check this.
 */
public class ILBasicBlock extends ILBlockBase {

  public ILBasicBlock(ILNode... body) {
    super(body);
  }

  public ILBasicBlock() {
    super(new ArrayList<>());
  }

  @Override
  public <R> R accept(ILNodeVisitor<R> visitor) {
    return visitor.visitBasicBlock(this);
  }
}
