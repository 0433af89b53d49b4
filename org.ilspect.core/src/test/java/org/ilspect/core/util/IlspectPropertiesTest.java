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
package org.ilspect.core.util;

import java.io.IOException;
import java.util.Properties;
import org.junit.Assert;
import org.junit.Test;

public class IlspectPropertiesTest {

  @Test
  public void testDefaultsOnClassPath() throws Exception {
    Properties p = IlspectProperties.loadProperties();
    Assert.assertTrue(
        IlspectProperties.getBoolean(p, IlspectProperties.DETECT_CONTROL_STRUCTURE, false));
    Assert.assertEquals(500, IlspectProperties.getInt(p, IlspectProperties.MAX_STRUCTURE_DEPTH, 0));
    Assert.assertEquals(
        50, IlspectProperties.getInt(p, IlspectProperties.MAX_CONVERT_TYPE_DEPTH, 0));
    Assert.assertTrue(IlspectProperties.getBoolean(p, IlspectProperties.EXPRESSION_TREES, false));
    Assert.assertSame(IlspectProperties.getProperties(), IlspectProperties.getProperties());
  }

  @Test
  public void testMissingKeysUseDefaults() {
    Properties p = new Properties();
    Assert.assertEquals(7, IlspectProperties.getInt(p, "absent", 7));
    Assert.assertFalse(IlspectProperties.getBoolean(p, "absent", false));
    p.setProperty("n", " 12 ");
    Assert.assertEquals(12, IlspectProperties.getInt(p, "n", 0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedNumber() {
    Properties p = new Properties();
    p.setProperty("n", "twelve");
    IlspectProperties.getInt(p, "n", 0);
  }

  @Test(expected = IOException.class)
  public void testMissingFile() throws IOException {
    IlspectProperties.loadPropertiesFromFile(getClass().getClassLoader(), "no-such.properties");
  }

  @Test
  public void testStackGuard() {
    StackGuard guard = new StackGuard(2);
    guard.enter();
    guard.enter();
    try {
      guard.enter();
      Assert.fail("expected the guard to trip");
    } catch (InsufficientStackException e) {
      Assert.assertEquals(2, guard.getDepth());
    }
    guard.exit();
    Assert.assertEquals(1, guard.getDepth());
  }
}
