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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Integer prefix sums of scaled item weights. Entry {@code i} is the sum of the scaled weights of items
 * {@code 0..i}, so the array is non-decreasing and its last entry is the total.
 */
public final class CumulativeWeights {
    public static final CumulativeWeights EMPTY = new CumulativeWeights(new int[0], 0);

    private final int[] weights;
    private final int total;

    CumulativeWeights(int[] weights, int total) {
        this.weights = weights;
        this.total = total;
    }

    public static <T> CumulativeWeights build(List<WeightedItem<T>> items, int integerFactor) {
        int[] weights = new int[items.size()];
        int total = 0;
        int index = 0;
        for (WeightedItem<T> item : items) {
            try {
                total = Math.addExact(total, scale(item.weight(), integerFactor));
            } catch (ArithmeticException e) {
                throw new InvalidWeightException("cumulative weight overflows at item " + index + ": " + item, e);
            }
            weights[index++] = total;
        }
        return new CumulativeWeights(weights, total);
    }

    /**
     * Convert a weight to its integer form. Digits past the scale factor are truncated.
     */
    public static int scale(double weight, int integerFactor) {
        double scaled = weight * integerFactor;
        if (scaled > Integer.MAX_VALUE) {
            throw new InvalidWeightException("weight " + weight + " is too large for scale factor " + integerFactor);
        }
        return scaled <= 0 ? 0 : (int) scaled;
    }

    /**
     * Find the leftmost index whose cumulative weight is {@code >= roll}. A roll beyond the last entry maps to the
     * last index.
     */
    public static int search(int[] cumulative, int roll) {
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid] < roll) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    public static int search(List<Integer> cumulative, int roll) {
        int low = 0;
        int high = cumulative.size() - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative.get(mid) < roll) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    int[] weights() {
        return weights;
    }

    public int total() {
        return total;
    }

    public int size() {
        return weights.length;
    }

    public int get(int index) {
        return weights[index];
    }

    public int[] toArray() {
        return weights.clone();
    }

    /**
     * Copy the entries into a list that can shrink as items are drawn without replacement.
     */
    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(weights.length);
        for (int weight : weights) {
            list.add(weight);
        }
        return list;
    }

    @Override
    public String toString() {
        return "CumulativeWeights{" +
            "weights=" + Arrays.toString(weights) +
            ", total=" + total +
            '}';
    }
}
