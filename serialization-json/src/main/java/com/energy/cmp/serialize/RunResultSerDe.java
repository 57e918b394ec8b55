/*
 * Copyright 2024 The Contextual Matrix Profile Authors. All Rights Reserved.
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

package com.energy.cmp.serialize;

import lombok.Getter;

import com.energy.cmp.returntypes.RunResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link RunResult} serialization. Internally we use the
 * {@link RunResultMapper} class to convert a RunResult into a corresponding
 * state object, and we use <a href="https://github.com/google/gson">Gson</a>
 * to write the state object as a JSON string. The Gson instance is exposed so
 * users can customize the output (e.g., by enabling pretty printing).
 */
@Getter
public class RunResultSerDe {

    private final RunResultMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization. Null values
     * are written, so undefined distances appear as explicit nulls.
     */
    public RunResultSerDe() {
        this(new RunResultMapper(), new GsonBuilder().serializeNulls().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A RunResultMapper instance, used to convert a RunResult to a
     *               corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link RunResultState} object.
     */
    public RunResultSerDe(RunResultMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * @param result the result of a run
     * @return a json string
     */
    public String toJson(RunResult result) {
        return gson.toJson(mapper.toState(result));
    }

    /**
     * @param json a json string produced by {@link #toJson(RunResult)}
     * @return the result, without distance profiles
     */
    public RunResult fromJson(String json) {
        RunResultState state = gson.fromJson(json, RunResultState.class);
        return mapper.toModel(state);
    }
}
