/*
 * Copyright 2025, AutoMQ HK Limited.
 *
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.weightedselector.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SelectorOptionsTest {

    @Test
    public void testDefaults() {
        assertTrue(SelectorOptions.DEFAULT.allowDuplicates());
        assertTrue(SelectorOptions.DEFAULT.ignoreZeroWeight());
        assertFalse(SelectorOptions.NONE.allowDuplicates());
        assertFalse(SelectorOptions.NONE.ignoreZeroWeight());
        assertEquals(0, SelectorOptions.NONE.flags());
        assertEquals(3, SelectorOptions.DEFAULT.flags());
    }

    @Test
    public void testFlags() {
        SelectorOptions duplicates = SelectorOptions.of(SelectorOptions.ALLOW_DUPLICATES);
        assertTrue(duplicates.allowDuplicates());
        assertFalse(duplicates.ignoreZeroWeight());

        SelectorOptions ignoreZero = SelectorOptions.builder().ignoreZeroWeight(true).build();
        assertEquals(SelectorOptions.IGNORE_ZERO_WEIGHT, ignoreZero.flags());
        assertEquals(ignoreZero, SelectorOptions.of(SelectorOptions.IGNORE_ZERO_WEIGHT));

        assertEquals(SelectorOptions.DEFAULT, SelectorOptions.of((short) (SelectorOptions.ALLOW_DUPLICATES | SelectorOptions.IGNORE_ZERO_WEIGHT)));
        assertNotEquals(SelectorOptions.DEFAULT, duplicates);
    }

    @Test
    public void testBuiltOptionsAreIndependentOfBuilder() {
        SelectorOptions.Builder builder = SelectorOptions.builder().allowDuplicates(true);
        SelectorOptions options = builder.build();
        builder.allowDuplicates(false).ignoreZeroWeight(true);

        assertTrue(options.allowDuplicates());
        assertFalse(options.ignoreZeroWeight());
        SelectorOptions rebuilt = builder.build();
        assertFalse(rebuilt.allowDuplicates());
        assertTrue(rebuilt.ignoreZeroWeight());
        assertNotEquals(options, rebuilt);
    }
}
