/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppflow;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class MacroRegistryTest {

    private static Token name(String text) {
        return new Token(Token.MACRO_NAME, 1, 1, text);
    }

    @Test
    public void testFirstOccurrenceOrder() throws Exception {
        MacroRegistry registry = new MacroRegistry();
        Macro b = registry.register(name("B"));
        Macro a = registry.register(name("A"));
        assertSame(b, registry.register(name("B")));

        assertEquals(0, b.getId());
        assertEquals(1, a.getId());
        assertEquals(2, registry.size());
        assertEquals("B", registry.getMacros().get(0).getName());
        assertSame(a, registry.getMacro("A"));
        assertSame(a, registry.getMacro(1));
        assertNull(registry.getMacro("C"));
    }

    @Test
    public void testCapacity() throws Exception {
        MacroRegistry registry = new MacroRegistry(2);
        registry.register(name("A"));
        registry.register(name("B"));
        registry.register(name("A"));
        try {
            registry.register(name("C"));
            fail("Registered a third macro");
        } catch (FlowException e) {
            assertEquals(ErrorKind.MACRO_CAPACITY_EXCEEDED, e.getKind());
            assertEquals("C", e.getToken().getText());
        }
        assertEquals(2, registry.size());
    }

    @Test
    public void testDefaultCapacity() throws Exception {
        MacroRegistry registry = new MacroRegistry();
        for (int i = 0; i < MacroRegistry.DEFAULT_CAPACITY; i++)
            registry.register(name("M" + i));
        try {
            registry.register(name("ONE_TOO_MANY"));
            fail("Registered past the default capacity");
        } catch (FlowException e) {
            assertEquals(ErrorKind.MACRO_CAPACITY_EXCEEDED, e.getKind());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadCapacity() {
        new MacroRegistry(0);
    }
}
