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

import java.util.Objects;

/**
 * An immutable value paired with its relative selection weight.
 *
 * @param <T> the type of the value
 */
public final class WeightedItem<T> {
    private final T value;
    private final double weight;

    public WeightedItem(T value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    public static <T> WeightedItem<T> of(T value, double weight) {
        return new WeightedItem<>(value, weight);
    }

    public T value() {
        return value;
    }

    public double weight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WeightedItem<?> that = (WeightedItem<?>) o;
        return Double.compare(that.weight, weight) == 0 && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, weight);
    }

    @Override
    public String toString() {
        return "WeightedItem{" +
            "value=" + value +
            ", weight=" + weight +
            '}';
    }
}
