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

package com.amazon.bayesiantree.state;

/**
 * Converts a model to and from a state object that holds plain values only.
 * Rebuilding the model requires a context that is not part of the state.
 *
 * @param <Model>   the model class
 * @param <State>   the state class
 * @param <Context> the context needed to rebuild the model
 */
public interface IContextualStateMapper<Model, State, Context> {

    State toState(Model model);

    Model toModel(State state, Context context);
}
