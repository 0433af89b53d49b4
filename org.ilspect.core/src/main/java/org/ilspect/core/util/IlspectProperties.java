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

import com.ibm.wala.util.WalaException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/** Access to the read-only configuration in {@code ilspect.properties}. */
public final class IlspectProperties {

  public static final String PROPERTY_FILENAME = "ilspect.properties";

  public static final String DETECT_CONTROL_STRUCTURE =
      "ilspect.disassembler.detectControlStructure";

  public static final String MAX_STRUCTURE_DEPTH = "ilspect.disassembler.maxStructureDepth";

  public static final String MAX_CONVERT_TYPE_DEPTH = "ilspect.ast.maxConvertTypeDepth";

  public static final String EXPRESSION_TREES = "ilspect.ast.expressionTrees";

  public static final String MAX_EXPRESSION_DEPTH = "ilspect.ast.maxExpressionDepth";

  private static Properties cached;

  private IlspectProperties() {}

  /** the properties from the class path, cached after the first successful load */
  public static synchronized Properties getProperties() {
    if (cached == null) {
      try {
        cached = loadProperties();
      } catch (WalaException e) {
        System.err.println("using default configuration: " + e.getMessage());
        cached = new Properties();
      }
    }
    return cached;
  }

  public static Properties loadProperties() throws WalaException {
    try {
      return loadPropertiesFromFile(IlspectProperties.class.getClassLoader(), PROPERTY_FILENAME);
    } catch (IOException e) {
      throw new WalaException("Unable to set up ilspect properties", e);
    }
  }

  public static Properties loadPropertiesFromFile(ClassLoader loader, String fileName)
      throws IOException {
    if (loader == null) {
      throw new IllegalArgumentException("loader is null");
    }
    if (fileName == null) {
      throw new IllegalArgumentException("null fileName");
    }
    Properties result = new Properties();
    try (InputStream propertyStream = loader.getResourceAsStream(fileName)) {
      if (propertyStream == null) {
        throw new IOException("property file " + fileName + " not found on class path");
      }
      result.load(propertyStream);
    }
    return result;
  }

  public static boolean getBoolean(Properties p, String key, boolean defaultValue) {
    String value = p.getProperty(key);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }

  public static int getInt(Properties p, String key, int defaultValue) {
    String value = p.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad value for " + key + ": " + value, e);
    }
  }
}
