package io.nosqlbench.reconcile.hierarchy;

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

/// Thrown when a key table cannot be resolved into a summing structure.
///
/// This covers a missing or ambiguous leaf level, aggregation levels that cannot
/// be ordered against each other for merging, aggregate series that match no
/// leaves, and residuals that leave no common timestamps after alignment.
public class HierarchyStructureException extends ReconciliationException {

    public HierarchyStructureException(String message) {
        super(message);
    }
}
