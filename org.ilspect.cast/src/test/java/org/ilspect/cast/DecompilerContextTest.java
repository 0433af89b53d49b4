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

import java.util.Collections;
import java.util.Properties;
import org.ilspect.core.metadata.InMemoryModule;
import org.ilspect.core.metadata.MethodDefinition;
import org.ilspect.core.metadata.ParameterDefinition;
import org.ilspect.core.metadata.TypeDefinition;
import org.ilspect.core.metadata.TypeReference;
import org.ilspect.core.util.IlspectProperties;
import org.junit.Assert;
import org.junit.Test;

public class DecompilerContextTest {

  @Test
  public void testModuleLookupOrder() {
    InMemoryModule methodModule = new InMemoryModule("a");
    InMemoryModule typeModule = new InMemoryModule("b");
    InMemoryModule current = new InMemoryModule("c");
    TypeReference program = TypeReference.make("Test", "Program");
    MethodDefinition main =
        methodModule
            .defineType(program)
            .addMethod(
                new MethodDefinition(
                    program,
                    "Main",
                    TypeReference.system("Void"),
                    true,
                    Collections.<ParameterDefinition>emptyList()));
    TypeDefinition helper = typeModule.defineType(TypeReference.make("Test", "Helper"));

    DecompilerContext context =
        new DecompilerContext(current).setCurrentType(helper).setCurrentMethod(main);
    Assert.assertSame(methodModule, context.getModule());
    context.setCurrentMethod(null);
    Assert.assertSame(typeModule, context.getModule());
    context.setCurrentType(null);
    Assert.assertSame(current, context.getModule());
    Assert.assertNull(new DecompilerContext(null).getModule());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullSettings() {
    new DecompilerContext(null, null);
  }

  @Test
  public void testSettingsFromProperties() {
    Properties p = new Properties();
    p.setProperty(IlspectProperties.EXPRESSION_TREES, "false");
    p.setProperty(IlspectProperties.MAX_EXPRESSION_DEPTH, "12");
    DecompilerSettings settings = DecompilerSettings.fromProperties(p);
    Assert.assertFalse(settings.isExpressionTrees());
    Assert.assertEquals(12, settings.getMaxExpressionDepth());
    Assert.assertEquals(AstBuilder.MAX_CONVERTTYPE_DEPTH, settings.getMaxConvertTypeDepth());

    DecompilerSettings defaults = DecompilerSettings.getDefault();
    Assert.assertTrue(defaults.isExpressionTrees());
    Assert.assertEquals(1000, defaults.getMaxExpressionDepth());
    Assert.assertEquals(50, defaults.getMaxConvertTypeDepth());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadDepth() {
    new DecompilerSettings().setMaxExpressionDepth(0);
  }
}
