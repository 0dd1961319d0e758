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

package com.weightedselector.api.exceptions;

/**
 * Base class of the failures a selector reports to its caller. All of them are precondition violations detected
 * synchronously, so none of them is retried internally.
 */
public class SelectorException extends RuntimeException {
    private final int code;

    public SelectorException(int code, String str) {
        this(code, str, null);
    }

    public SelectorException(int code, String str, Throwable e) {
        super("code: " + code + ", " + str, e);
        this.code = code;
    }

    public int getCode() {
        return this.code;
    }
}
