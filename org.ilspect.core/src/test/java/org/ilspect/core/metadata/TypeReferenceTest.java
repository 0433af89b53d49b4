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
package org.ilspect.core.metadata;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Assert;
import org.junit.Test;

public class TypeReferenceTest {

  @Test
  public void testNames() {
    TypeReference list = TypeReference.make("System.Collections.Generic", "List`1");
    TypeReference ofInt =
        TypeReference.makeGenericInstance(list, TypeReference.systemValueType("Int32"));
    Assert.assertEquals("List`1", ofInt.getName());
    Assert.assertEquals("System.Collections.Generic.List`1<System.Int32>", ofInt.getFullName());
    Assert.assertEquals("System.Collections.Generic", ofInt.getNamespace());
    Assert.assertSame(list, ofInt.getGenericTypeOrSelf());

    TypeReference outer = TypeReference.make("N", "Outer");
    TypeReference inner = TypeReference.makeNested(outer, "Inner");
    Assert.assertEquals("N.Outer/Inner", inner.getFullName());
    Assert.assertTrue(inner.isNested());

    TypeReference matrix = TypeReference.makeArray(TypeReference.system("String"), 2);
    Assert.assertEquals("System.String[,]", matrix.getFullName());
    Assert.assertEquals(
        "System.Int32*",
        TypeReference.makePointer(TypeReference.systemValueType("Int32")).getFullName());
  }

  @Test
  public void testStructuralEquality() {
    Assert.assertEquals(TypeReference.system("Object"), TypeReference.make("System", "Object"));
    Assert.assertEquals(
        TypeReference.system("Object").hashCode(),
        TypeReference.make("System", "Object").hashCode());
    Assert.assertNotEquals(TypeReference.system("Object"), TypeReference.make("Other", "Object"));
    Assert.assertTrue(TypeReference.system("Object").isSystemType("Object"));
    Assert.assertFalse(TypeReference.make("Other", "Object").isSystemType("Object"));
  }

  @Test
  public void testAnonymousTypes() {
    TypeReference anon = TypeReference.make("", "<>f__AnonymousType0`2");
    Assert.assertTrue(anon.isAnonymousType());
    TypeReference instance =
        TypeReference.makeGenericInstance(
            anon,
            Arrays.asList(TypeReference.systemValueType("Int32"), TypeReference.system("String")));
    Assert.assertTrue(instance.isAnonymousType());
    Assert.assertTrue(TypeReference.makeArray(instance).containsAnonymousType());
    Assert.assertFalse(TypeReference.make("App", "<>f__AnonymousType0`2").isAnonymousType());
    Assert.assertFalse(TypeReference.system("String").containsAnonymousType());
  }

  @Test
  public void testMethodSignatures() {
    TypeReference program = TypeReference.make("App", "Program");
    MethodDefinition getter =
        new MethodDefinition(
            program,
            "get_Count",
            TypeReference.systemValueType("Int32"),
            false,
            Collections.emptyList());
    Assert.assertTrue(getter.isSpecialName());
    Assert.assertTrue(getter.isGetter());
    Assert.assertTrue(getter.hasThis());
    Assert.assertTrue(getter.getParameters().isEmpty());

    MethodReference ref =
        new MethodReference(
            program,
            "get_Count",
            TypeReference.systemValueType("Int32"),
            true,
            Collections.emptyList());
    Assert.assertTrue(getter.hasSameSignature(ref));

    InMemoryModule module = new InMemoryModule("App.dll");
    module.defineType(program).addMethod(getter);
    Assert.assertSame(getter, module.resolve(ref));
    Assert.assertNotNull(module.resolve(program));
  }
}
