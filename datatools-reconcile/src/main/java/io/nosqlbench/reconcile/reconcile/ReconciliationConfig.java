package io.nosqlbench.reconcile.reconcile;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.reconcile.linalg.SparseMode;
import io.nosqlbench.reconcile.weights.WeightMethod;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Caller-facing options of a min-trace reconciliation.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "method": "mint_shrink",   // ols, wls_var, wls_struct, mint_cov, mint_shrink
 *   "sparse": "auto"           // true, false, auto
 * }
 * }</pre>
 *
 * <p>Both fields are optional; the defaults are {@code wls_var} and {@code auto}.
 * Names are validated when the config is created or loaded, so an unknown method
 * fails before any forecast or matrix work.
 */
public final class ReconciliationConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @SerializedName("method")
    private String method = WeightMethod.DEFAULT.methodName();

    @SerializedName("sparse")
    private String sparse = SparseMode.AUTO.modeName();

    private transient WeightMethod weightMethod;
    private transient SparseMode sparseMode;

    ReconciliationConfig() {
        validate();
    }

    /**
     * Creates a config from option names.
     *
     * @param method weight method name, null for the default
     * @param sparse sparse mode name, null for {@code auto}
     * @throws io.nosqlbench.reconcile.weights.UnsupportedMethodException if the method is unknown
     * @throws IllegalArgumentException if the sparse mode is unknown
     */
    public ReconciliationConfig(String method, String sparse) {
        this.method = method == null ? WeightMethod.DEFAULT.methodName() : method;
        this.sparse = sparse == null ? SparseMode.AUTO.modeName() : sparse;
        validate();
    }

    public ReconciliationConfig(WeightMethod method, SparseMode sparse) {
        this(method.methodName(), sparse.modeName());
    }

    public static ReconciliationConfig defaults() {
        return new ReconciliationConfig();
    }

    /**
     * Parses a config from JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed or the sparse mode is unknown
     * @throws io.nosqlbench.reconcile.weights.UnsupportedMethodException if the method is unknown
     */
    public static ReconciliationConfig fromJson(String json) {
        ReconciliationConfig config;
        try {
            config = GSON.fromJson(json, ReconciliationConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid reconciliation config: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new IllegalArgumentException("Empty reconciliation config");
        }
        config.validate();
        return config;
    }

    /**
     * Loads a config from a JSON file.
     */
    public static ReconciliationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            ReconciliationConfig config;
            try {
                config = GSON.fromJson(reader, ReconciliationConfig.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid reconciliation config in " + path + ": " + e.getMessage(), e);
            }
            if (config == null) {
                throw new IllegalArgumentException("Empty reconciliation config in " + path);
            }
            config.validate();
            return config;
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private void validate() {
        if (method == null) {
            method = WeightMethod.DEFAULT.methodName();
        }
        if (sparse == null) {
            sparse = SparseMode.AUTO.modeName();
        }
        this.weightMethod = WeightMethod.fromName(method);
        this.sparseMode = SparseMode.fromName(sparse);
    }

    public WeightMethod method() {
        return weightMethod;
    }

    public SparseMode sparse() {
        return sparseMode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconciliationConfig)) return false;
        ReconciliationConfig that = (ReconciliationConfig) o;
        return weightMethod == that.weightMethod && sparseMode == that.sparseMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(weightMethod, sparseMode);
    }

    @Override
    public String toString() {
        return "ReconciliationConfig{method=" + weightMethod + ", sparse=" + sparseMode + "}";
    }
}
