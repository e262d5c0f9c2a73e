/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.cequel.metal.exception;

import org.apache.flink.annotation.PublicEvolving;

import com.datastax.driver.core.ConsistencyLevel;

import javax.annotation.Nullable;

/**
 * Thrown when a statement appended to a batch requests a consistency level that differs from the
 * level of the batch. It is raised before anything of the current batch buffer is sent.
 */
@PublicEvolving
public class BatchConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ConsistencyLevel statementConsistency;
    @Nullable private final ConsistencyLevel batchConsistency;

    public BatchConfigurationException(
            ConsistencyLevel statementConsistency, @Nullable ConsistencyLevel batchConsistency) {
        super(
                String.format(
                        "Attempting to perform query with consistency %s in batch with consistency %s. "
                                + "Set the consistency on the batch instead of individual statements.",
                        statementConsistency,
                        batchConsistency == null ? "<default>" : batchConsistency));
        this.statementConsistency = statementConsistency;
        this.batchConsistency = batchConsistency;
    }

    public ConsistencyLevel getStatementConsistency() {
        return statementConsistency;
    }

    @Nullable
    public ConsistencyLevel getBatchConsistency() {
        return batchConsistency;
    }
}
