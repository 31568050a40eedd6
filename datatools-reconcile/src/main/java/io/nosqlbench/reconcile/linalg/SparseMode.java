package io.nosqlbench.reconcile.linalg;

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

/// Caller choice of linear algebra backend.
public enum SparseMode {

    /// Always use the sparse backend.
    TRUE("true"),

    /// Always use the dense backend.
    FALSE("false"),

    /// Use the sparse backend when sparse matrix support is present at runtime.
    AUTO("auto");

    private final String name;

    SparseMode(String name) {
        this.name = name;
    }

    public String modeName() {
        return name;
    }

    /// Decides whether the sparse backend is used.
    ///
    /// @return true for [#TRUE], false for [#FALSE], and [SparseCapability#isAvailable()] for [#AUTO]
    public boolean resolve() {
        return switch (this) {
            case TRUE -> true;
            case FALSE -> false;
            case AUTO -> SparseCapability.isAvailable();
        };
    }

    /// Parses a mode name.
    ///
    /// @param name `true`, `false` or `auto`, case-insensitive; null means [#AUTO]
    /// @throws IllegalArgumentException if the name is not recognized
    public static SparseMode fromName(String name) {
        if (name == null) {
            return AUTO;
        }
        return switch (name.trim().toLowerCase()) {
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException(
                "Unknown sparse mode: " + name + ". Expected true, false, or auto.");
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
