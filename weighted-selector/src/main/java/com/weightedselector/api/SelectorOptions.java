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

public class SelectorOptions {
    public static final short ALLOW_DUPLICATES = 1;
    public static final short IGNORE_ZERO_WEIGHT = 2;

    public static final SelectorOptions NONE = new SelectorOptions(false, false);
    public static final SelectorOptions DEFAULT = new SelectorOptions(true, true);

    private final boolean allowDuplicates;
    private final boolean ignoreZeroWeight;

    private SelectorOptions(boolean allowDuplicates, boolean ignoreZeroWeight) {
        this.allowDuplicates = allowDuplicates;
        this.ignoreZeroWeight = ignoreZeroWeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SelectorOptions of(short flags) {
        return builder()
            .allowDuplicates((flags & ALLOW_DUPLICATES) != 0)
            .ignoreZeroWeight((flags & IGNORE_ZERO_WEIGHT) != 0)
            .build();
    }

    public boolean allowDuplicates() {
        return allowDuplicates;
    }

    public boolean ignoreZeroWeight() {
        return ignoreZeroWeight;
    }

    public short flags() {
        short flags = 0;
        if (allowDuplicates) {
            flags |= ALLOW_DUPLICATES;
        }
        if (ignoreZeroWeight) {
            flags |= IGNORE_ZERO_WEIGHT;
        }
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SelectorOptions)) {
            return false;
        }
        return flags() == ((SelectorOptions) o).flags();
    }

    @Override
    public int hashCode() {
        return flags();
    }

    @Override
    public String toString() {
        return "SelectorOptions{" +
            "allowDuplicates=" + allowDuplicates +
            ", ignoreZeroWeight=" + ignoreZeroWeight +
            '}';
    }

    public static class Builder {
        private boolean allowDuplicates;
        private boolean ignoreZeroWeight;

        /**
         * Let a value be drawn more than once by a single multi-selection.
         */
        public Builder allowDuplicates(boolean allowDuplicates) {
            this.allowDuplicates = allowDuplicates;
            return this;
        }

        /**
         * Silently drop items whose weight is not positive instead of rejecting them.
         */
        public Builder ignoreZeroWeight(boolean ignoreZeroWeight) {
            this.ignoreZeroWeight = ignoreZeroWeight;
            return this;
        }

        /**
         * Every call returns a new instance, so later changes to this builder do not reach options already built.
         */
        public SelectorOptions build() {
            return new SelectorOptions(allowDuplicates, ignoreZeroWeight);
        }
    }

}
