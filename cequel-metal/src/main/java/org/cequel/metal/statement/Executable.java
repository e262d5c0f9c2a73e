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

package org.cequel.metal.statement;

import org.apache.flink.annotation.PublicEvolving;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.Statement;

import java.util.Optional;

/**
 * A unit of work that travels to the cluster as one request: either a single {@link CqlStatement}
 * or a {@link CqlBatch}.
 */
@PublicEvolving
public interface Executable {

    /** Consistency requested by the unit itself, if any. */
    Optional<ConsistencyLevel> getConsistency();

    /** CQL rendering used for logging. */
    String toCql();

    /**
     * Converts this unit into a driver statement executed at the given consistency.
     *
     * @param consistency the resolved consistency level
     * @return a new driver statement
     */
    Statement toDriverStatement(ConsistencyLevel consistency);
}
