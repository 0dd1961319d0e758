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

import com.weightedselector.api.SelectorOptions;
import com.weightedselector.api.WeightedBuilder;
import com.weightedselector.api.WeightedEngine;
import com.weightedselector.api.WeightedItem;
import com.weightedselector.api.exceptions.EmptyCollectionException;
import com.weightedselector.api.exceptions.InsufficientItemsException;
import com.weightedselector.api.exceptions.InvalidCountException;
import com.weightedselector.api.exceptions.InvalidWeightException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Selects values with probability proportional to their weights.
 * <p>
 * Weights are multiplied by {@code 10^decimalPlaces} and truncated to integers, then folded into a cumulative weight
 * index that each draw binary searches. The index is rebuilt lazily, on the first selection after a mutation.
 * <p>
 * Not thread safe: the index and the random source are unsynchronized mutable state.
 *
 * @param <T> the type of the selected values
 */
public class WeightedRandomSelector<T> implements WeightedBuilder<T>, WeightedEngine<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(WeightedRandomSelector.class);
    public static final int DEFAULT_DECIMAL_PLACES = 2;
    public static final int MAX_DECIMAL_PLACES = 9;

    private final List<WeightedItem<T>> items = new ArrayList<>();
    private final SelectorOptions options;
    /**
     * All weights are multiplied by this factor to get an integer. Digits past it are ignored.
     */
    private final int integerFactor;
    private final SelectorEngine engine;

    private CacheState state = CacheState.DIRTY;
    private CumulativeWeights cumulativeWeights = CumulativeWeights.EMPTY;
    /**
     * Only materialized when duplicates are not allowed, since only draws without replacement shrink it.
     */
    private List<Integer> cumulativeWeightsList;

    public WeightedRandomSelector() {
        this(SelectorOptions.DEFAULT);
    }

    public WeightedRandomSelector(SelectorOptions options) {
        this(options, DEFAULT_DECIMAL_PLACES);
    }

    public WeightedRandomSelector(SelectorOptions options, int decimalPlaces) {
        this(options, decimalPlaces, new Random());
    }

    public WeightedRandomSelector(Iterable<WeightedItem<T>> items) {
        this(items, SelectorOptions.DEFAULT);
    }

    public WeightedRandomSelector(Iterable<WeightedItem<T>> items, SelectorOptions options) {
        this(items, options, DEFAULT_DECIMAL_PLACES);
    }

    public WeightedRandomSelector(Iterable<WeightedItem<T>> items, SelectorOptions options, int decimalPlaces) {
        this(options, decimalPlaces);
        add(items);
    }

    // visible for testing
    WeightedRandomSelector(SelectorOptions options, int decimalPlaces, Random random) {
        this.options = Objects.requireNonNull(options, "options");
        this.integerFactor = integerFactor(decimalPlaces);
        this.engine = new SelectorEngine(Objects.requireNonNull(random, "random"));
    }

    static int integerFactor(int decimalPlaces) {
        if (decimalPlaces < 0 || decimalPlaces > MAX_DECIMAL_PLACES) {
            throw new IllegalArgumentException("decimalPlaces must be in [0, " + MAX_DECIMAL_PLACES + "], but was "
                + decimalPlaces);
        }
        int factor = 1;
        for (int i = 0; i < decimalPlaces; i++) {
            factor *= 10;
        }
        return factor;
    }

    @Override
    public void add(WeightedItem<T> item) {
        Objects.requireNonNull(item, "item");
        double weight = item.weight();
        if (!Double.isFinite(weight)) {
            throw new InvalidWeightException("weight must be finite, but was " + weight + " for " + item);
        }
        if (weight <= 0) {
            if (options.ignoreZeroWeight()) {
                return;
            }
            throw new InvalidWeightException("weight must be > 0, but was " + weight + " for " + item);
        }
        // a single weight must fit the integer index, only the running sum is checked at build time
        CumulativeWeights.scale(weight, integerFactor);
        items.add(item);
        state = CacheState.DIRTY;
    }

    @Override
    public void add(T value, double weight) {
        add(new WeightedItem<>(value, weight));
    }

    @Override
    public void add(Iterable<WeightedItem<T>> items) {
        for (WeightedItem<T> item : items) {
            add(item);
        }
    }

    public void addMany(Iterable<WeightedItem<T>> items) {
        add(items);
    }

    @Override
    public void remove(WeightedItem<T> item) {
        items.remove(item);
        state = CacheState.DIRTY;
    }

    @Override
    public void clear() {
        items.clear();
        state = CacheState.DIRTY;
    }

    @Override
    public void build() {
        if (state == CacheState.CLEAN) {
            return;
        }
        cumulativeWeights = CumulativeWeights.build(items, integerFactor);
        cumulativeWeightsList = options.allowDuplicates() ? null : cumulativeWeights.toList();
        state = CacheState.CLEAN;
        LOGGER.debug("Rebuilt cumulative weights for {} items, total={}", items.size(), cumulativeWeights.total());
    }

    @Override
    public T select() {
        if (items.isEmpty()) {
            throw new EmptyCollectionException();
        }
        build();
        return engine.selectOne(items, cumulativeWeights);
    }

    @Override
    public List<T> select(int count) {
        if (count <= 0) {
            throw new InvalidCountException(count);
        }
        if (items.isEmpty()) {
            throw new EmptyCollectionException();
        }
        if (!options.allowDuplicates() && items.size() < count) {
            throw new InsufficientItemsException(count, items.size());
        }
        build();
        if (options.allowDuplicates()) {
            return engine.selectWithReplacement(items, cumulativeWeights, count);
        }
        return engine.selectWithoutReplacement(items, cumulativeWeightsList, count);
    }

    public List<T> selectMany(int count) {
        return select(count);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<WeightedItem<T>> items() {
        return Collections.unmodifiableList(items);
    }

    public SelectorOptions options() {
        return options;
    }

    public int integerFactor() {
        return integerFactor;
    }

    public CacheState state() {
        return state;
    }

    public int[] cumulativeWeights() {
        build();
        return cumulativeWeights.toArray();
    }

    public int totalCumulativeWeight() {
        build();
        return cumulativeWeights.total();
    }
}
