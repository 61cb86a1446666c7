/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.bayesiantree.config;

/**
 * Names of the settings accepted by
 * {@link IDynamicConfig#setConfig(String, Object, Class)}.
 */
public class Config {

    private Config() {
    }

    /**
     * Strengthening of the prior with depth, a double in [0, 1].
     */
    public static final String DELTA = "delta";

    /**
     * Whether splits with identical child predictions are removed after fitting.
     */
    public static final String PRUNE = "prune";

    /**
     * Whether fitting progress is logged at INFO rather than DEBUG.
     */
    public static final String VERBOSE = "verbose";
}
