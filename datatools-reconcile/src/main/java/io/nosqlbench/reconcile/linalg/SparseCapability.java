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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Runtime detection of sparse matrix support.
///
/// The probe runs once, at class load, and the answer is fixed for the JVM.
public final class SparseCapability {

    private static final Logger logger = LogManager.getLogger(SparseCapability.class);

    static final String SPARSE_MATRIX_CLASS = "org.apache.commons.math3.linear.OpenMapRealMatrix";

    private static final boolean available = probe(SPARSE_MATRIX_CLASS);

    private SparseCapability() {
        // Utility class
    }

    /// @return true if sparse matrices can be used by this JVM
    public static boolean isAvailable() {
        return available;
    }

    static boolean probe(String className) {
        try {
            Class.forName(className, false, SparseCapability.class.getClassLoader());
            logger.debug("Sparse matrix support available via {}", className);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            logger.debug("Sparse matrix support unavailable: {}", e.toString());
            return false;
        }
    }
}
