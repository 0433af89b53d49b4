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

import static org.ilspect.cast.transforms.ExpressionTrees.call;
import static org.ilspect.cast.transforms.ExpressionTrees.constant;
import static org.ilspect.cast.transforms.ExpressionTrees.lambda;
import static org.ilspect.cast.transforms.ExpressionTrees.variable;

import com.ibm.wala.util.CancelException;
import com.ibm.wala.util.NullProgressMonitor;
import org.ilspect.cast.DecompilerContext;
import org.ilspect.cast.tree.AstNode;
import org.ilspect.cast.tree.BlockStatement;
import org.ilspect.cast.tree.CSharpOutputVisitor;
import org.ilspect.cast.tree.ExpressionStatement;
import org.ilspect.cast.tree.IdentifierExpression;
import org.ilspect.cast.tree.InvocationExpression;
import org.ilspect.cast.tree.LambdaExpression;
import org.ilspect.cast.tree.ReturnStatement;
import org.ilspect.ilast.ILVariable;
import org.junit.Assert;
import org.junit.Test;

public class ExpressionTreeTransformTest {

  private static class CanceledMonitor extends NullProgressMonitor {
    @Override
    public boolean isCanceled() {
      return true;
    }
  }

  @Test
  public void testReplacesConstructionsInPlace() throws CancelException {
    InvocationExpression converted = lambda(call("Add", constant(2), constant(3)));
    InvocationExpression declined = lambda(call("Loop", constant(1)));
    ReturnStatement ret = new ReturnStatement(converted);
    ExpressionStatement stmt = new ExpressionStatement(declined);
    BlockStatement block = new BlockStatement(ret, stmt);

    ExpressionTreeTransform transform = new ExpressionTreeTransform(new DecompilerContext(null));
    AstNode result = transform.run(block);

    Assert.assertSame(block, result);
    Assert.assertEquals(1, transform.getConvertedCount());
    Assert.assertTrue(ret.getExpression() instanceof LambdaExpression);
    Assert.assertSame(ret, ret.getExpression().getParent());
    Assert.assertEquals("() => 2 + 3", CSharpOutputVisitor.toText(ret.getExpression()));
    Assert.assertNull(converted.getParent());
    Assert.assertSame(declined, stmt.getExpression());
  }

  @Test
  public void testConvertsArguments() throws CancelException {
    ILVariable x = new ILVariable("x");
    InvocationExpression query =
        new IdentifierExpression("source")
            .invoke("Where", lambda(call("GreaterThan", variable(x), constant(0)), x));
    ExpressionStatement stmt = new ExpressionStatement(query);

    new ExpressionTreeTransform(new DecompilerContext(null)).run(stmt);

    Assert.assertEquals("source.Where(x => x > 0);\n", CSharpOutputVisitor.toText(stmt));
  }

  @Test
  public void testReplacesRoot() throws CancelException {
    ExpressionTreeTransform transform = new ExpressionTreeTransform(new DecompilerContext(null));
    AstNode result = transform.run(lambda(constant(7)));
    Assert.assertTrue(result instanceof LambdaExpression);
    Assert.assertNotNull(result.getAnnotation(ExpressionTreeLambdaAnnotation.class));
    Assert.assertEquals("() => 7", CSharpOutputVisitor.toText(result));
  }

  @Test
  public void testNestedLambdaCountsOnce() throws CancelException {
    ILVariable x = new ILVariable("x");
    ILVariable y = new ILVariable("y");
    InvocationExpression inner = lambda(call("Add", variable(x), variable(y)), y);
    ExpressionTreeTransform transform = new ExpressionTreeTransform(new DecompilerContext(null));
    AstNode result =
        transform.run(new ReturnStatement(lambda(call("Quote", inner), x)));
    Assert.assertEquals(1, transform.getConvertedCount());
    Assert.assertEquals("return x => y => x + y;\n", CSharpOutputVisitor.toText(result));
  }

  @Test
  public void testTreeWithoutCandidatesIsUntouched() throws CancelException {
    ExpressionStatement stmt =
        new ExpressionStatement(new IdentifierExpression("list").invoke("Clear"));
    ExpressionTreeTransform transform =
        new ExpressionTreeTransform(new DecompilerContext(null).setMonitor(new CanceledMonitor()));
    Assert.assertSame(stmt, transform.run(stmt));
    Assert.assertEquals(0, transform.getConvertedCount());
  }

  @Test(expected = CancelException.class)
  public void testCancel() throws CancelException {
    DecompilerContext context = new DecompilerContext(null).setMonitor(new CanceledMonitor());
    new ExpressionTreeTransform(context).run(new ReturnStatement(lambda(constant(1))));
  }
}
