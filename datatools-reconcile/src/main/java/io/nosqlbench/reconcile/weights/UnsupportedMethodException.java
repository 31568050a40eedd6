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

import io.nosqlbench.reconcile.ReconciliationException;

/// Thrown when a reconciliation method name is not one of the known weight methods.
public class UnsupportedMethodException extends ReconciliationException {

    private final String methodName;

    public UnsupportedMethodException(String methodName) {
        super("Unknown reconciliation method: '" + methodName + "'. Expected one of "
            + WeightMethod.names());
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }
}
