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

package com.weightedselector.selector;

import com.weightedselector.api.WeightedItem;
import com.weightedselector.api.exceptions.InvalidWeightException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CumulativeWeightsTest {

    private static final List<WeightedItem<String>> ITEMS = List.of(
        WeightedItem.of("A", 0.8),
        WeightedItem.of("B", 15.0),
        WeightedItem.of("C", 62.21),
        WeightedItem.of("D", 32.5),
        WeightedItem.of("E", 70.0));

    @Test
    public void testBuild() {
        CumulativeWeights cumulative = CumulativeWeights.build(ITEMS, 100);
        assertArrayEquals(new int[] {80, 1580, 7801, 11051, 18051}, cumulative.toArray());
        assertEquals(18051, cumulative.total());
        assertEquals(5, cumulative.size());
        assertEquals(List.of(80, 1580, 7801, 11051, 18051), cumulative.toList());
    }

    @Test
    public void testBuildEmpty() {
        CumulativeWeights cumulative = CumulativeWeights.build(List.<WeightedItem<String>>of(), 100);
        assertEquals(0, cumulative.size());
        assertEquals(0, cumulative.total());
    }

    @Test
    public void testBuildAllZero() {
        CumulativeWeights cumulative = CumulativeWeights.build(List.of(WeightedItem.of("a", 0.001), WeightedItem.of("b", 0.0)), 100);
        assertArrayEquals(new int[] {0, 0}, cumulative.toArray());
        assertEquals(0, cumulative.total());
    }

    @Test
    public void testScaleTruncates() {
        assertEquals(123, CumulativeWeights.scale(1.239, 100));
        assertEquals(1, CumulativeWeights.scale(1.99, 1));
        assertEquals(0, CumulativeWeights.scale(0.009, 100));
        assertEquals(0, CumulativeWeights.scale(-3, 100));
        assertThrows(InvalidWeightException.class, () -> CumulativeWeights.scale(1e12, 100));
    }

    @Test
    public void testBuildOverflow() {
        List<WeightedItem<String>> items = List.of(WeightedItem.of("a", 2e9), WeightedItem.of("b", 2e9));
        assertThrows(InvalidWeightException.class, () -> CumulativeWeights.build(items, 1));
    }

    @Test
    public void testSearch() {
        int[] cumulative = CumulativeWeights.build(ITEMS, 100).toArray();
        assertEquals(0, CumulativeWeights.search(cumulative, 1));
        assertEquals(0, CumulativeWeights.search(cumulative, 80));
        assertEquals(1, CumulativeWeights.search(cumulative, 81));
        assertEquals(1, CumulativeWeights.search(cumulative, 1580));
        assertEquals(2, CumulativeWeights.search(cumulative, 1581));
        assertEquals(4, CumulativeWeights.search(cumulative, 11052));
        assertEquals(4, CumulativeWeights.search(cumulative, 18051));
        // out of range rolls stay within bounds
        assertEquals(4, CumulativeWeights.search(cumulative, 20000));
    }

    @Test
    public void testSearchSkipsZeroWeightEntries() {
        // items 1 and 2 carry no weight
        int[] cumulative = new int[] {5, 5, 5, 9};
        for (int roll = 1; roll <= 5; roll++) {
            assertEquals(0, CumulativeWeights.search(cumulative, roll));
            assertEquals(0, CumulativeWeights.search(List.of(5, 5, 5, 9), roll));
        }
        for (int roll = 6; roll <= 9; roll++) {
            assertEquals(3, CumulativeWeights.search(cumulative, roll));
            assertEquals(3, CumulativeWeights.search(List.of(5, 5, 5, 9), roll));
        }
        assertEquals(1, CumulativeWeights.search(new int[] {0, 3, 3}, 1));
    }
}
