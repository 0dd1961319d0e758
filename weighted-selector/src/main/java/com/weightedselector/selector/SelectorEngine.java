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
import com.weightedselector.api.exceptions.EmptyCollectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Performs weighted draws over the items and cumulative weights handed to it on each call. It keeps no reference to
 * the selector that owns it, only the random source.
 */
class SelectorEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SelectorEngine.class);
    private final Random random;

    SelectorEngine(Random random) {
        this.random = random;
    }

    /**
     * Roll a number in {@code [1, total]}.
     */
    int roll(int total) {
        return random.nextInt(total) + 1;
    }

    int selectIndex(CumulativeWeights cumulative) {
        int size = cumulative.size();
        if (size == 0) {
            throw new EmptyCollectionException();
        }
        if (size == 1) {
            return 0;
        }
        if (cumulative.total() == 0) {
            return uniformIndex(size);
        }
        return CumulativeWeights.search(cumulative.weights(), roll(cumulative.total()));
    }

    <T> T selectOne(List<WeightedItem<T>> items, CumulativeWeights cumulative) {
        return items.get(selectIndex(cumulative)).value();
    }

    /**
     * Draw {@code count} values with replacement against the unchanged index.
     */
    <T> List<T> selectWithReplacement(List<WeightedItem<T>> items, CumulativeWeights cumulative, int count) {
        List<T> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(selectOne(items, cumulative));
        }
        return result;
    }

    /**
     * Draw up to {@code count} distinct positions without replacement. Both the items and the cumulative list are
     * copied, and after each draw the entries behind the removed position are lowered by its weight so the working
     * list stays the prefix sum of the remaining items.
     */
    <T> List<T> selectWithoutReplacement(List<WeightedItem<T>> items, List<Integer> cumulative, int count) {
        List<WeightedItem<T>> remainingItems = new ArrayList<>(items);
        List<Integer> remainingWeights = new ArrayList<>(cumulative);
        List<T> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (remainingItems.isEmpty() || remainingWeights.isEmpty()) {
                LOGGER.warn("Ran out of items after {} of {} draws without replacement", i, count);
                break;
            }
            int index = selectIndex(remainingWeights);
            result.add(remainingItems.get(index).value());

            int removedWeight = remainingWeights.get(index) - (index == 0 ? 0 : remainingWeights.get(index - 1));
            remainingItems.remove(index);
            remainingWeights.remove(index);
            if (removedWeight != 0) {
                for (int j = index; j < remainingWeights.size(); j++) {
                    remainingWeights.set(j, remainingWeights.get(j) - removedWeight);
                }
            }
        }
        return result;
    }

    private int selectIndex(List<Integer> cumulative) {
        int size = cumulative.size();
        if (size == 1) {
            return 0;
        }
        // the last entry is the total of the remaining items
        int total = cumulative.get(size - 1);
        if (total == 0) {
            return uniformIndex(size);
        }
        return CumulativeWeights.search(cumulative, roll(total));
    }

    private int uniformIndex(int size) {
        LOGGER.debug("All {} candidate weights scale to zero, falling back to a uniform pick", size);
        return random.nextInt(size);
    }
}
