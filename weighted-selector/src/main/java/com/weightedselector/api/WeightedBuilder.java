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

import com.weightedselector.api.exceptions.InvalidWeightException;

/**
 * Mutation side of a weighted selector.
 */
public interface WeightedBuilder<T> {

    /**
     * Recompute the cumulative weight index if the items changed since the last build. Selections call this
     * automatically.
     */
    void build();

    /**
     * Append an item.
     *
     * @throws InvalidWeightException if the weight is not positive and zero weights are not ignored, or is not finite
     */
    void add(WeightedItem<T> item);

    void add(T value, double weight);

    /**
     * Add every item in order. Items added before a failing one stay added.
     */
    void add(Iterable<WeightedItem<T>> items);

    /**
     * Remove the first item equal to the given one, both value and weight, if present.
     */
    void remove(WeightedItem<T> item);

    void clear();
}
