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

import com.weightedselector.api.exceptions.EmptyCollectionException;
import com.weightedselector.api.exceptions.InsufficientItemsException;
import com.weightedselector.api.exceptions.InvalidCountException;

import java.util.List;

/**
 * Selection side of a weighted selector.
 */
public interface WeightedEngine<T> {

    /**
     * Draw one value with probability proportional to its weight.
     *
     * @throws EmptyCollectionException if there is nothing to select from
     */
    T select();

    /**
     * Draw {@code count} values.
     *
     * @throws InvalidCountException      if {@code count <= 0}
     * @throws EmptyCollectionException   if there is nothing to select from
     * @throws InsufficientItemsException if duplicates are not allowed and {@code count} exceeds the item count
     */
    List<T> select(int count);
}
