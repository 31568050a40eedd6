package io.nosqlbench.reconcile.weights;

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

import java.util.ArrayList;
import java.util.List;

/// Estimation methods for the reconciliation weight matrix W.
///
/// | Method | W |
/// |--------|---|
/// | `ols` | identity |
/// | `wls_var` | diagonal of residual second moments |
/// | `wls_struct` | diagonal of leaf counts per series |
/// | `mint_cov` | full residual second-moment matrix `(Rᵗ R) / n` |
/// | `mint_shrink` | `λ · diag target + (1 − λ) · (Rᵗ R) / n` |
public enum WeightMethod {

    OLS("ols", false),
    WLS_VAR("wls_var", true),
    WLS_STRUCT("wls_struct", false),
    MINT_COV("mint_cov", true),
    MINT_SHRINK("mint_shrink", true);

    /// Method used when none is named.
    public static final WeightMethod DEFAULT = WLS_VAR;

    private final String name;
    private final boolean usesResiduals;

    WeightMethod(String name, boolean usesResiduals) {
        this.name = name;
        this.usesResiduals = usesResiduals;
    }

    public String methodName() {
        return name;
    }

    /// @return true if the estimate depends on residual values
    public boolean usesResiduals() {
        return usesResiduals;
    }

    /// Parses a method name.
    ///
    /// @param name one of `ols`, `wls_var`, `wls_struct`, `mint_cov`, `mint_shrink`; null means [#DEFAULT]
    /// @return the method
    /// @throws UnsupportedMethodException if the name is not recognized
    public static WeightMethod fromName(String name) {
        if (name == null) {
            return DEFAULT;
        }
        for (WeightMethod method : values()) {
            if (method.name.equals(name.trim())) {
                return method;
            }
        }
        throw new UnsupportedMethodException(name);
    }

    static List<String> names() {
        List<String> names = new ArrayList<>();
        for (WeightMethod method : values()) {
            names.add(method.name);
        }
        return names;
    }

    @Override
    public String toString() {
        return name;
    }
}
