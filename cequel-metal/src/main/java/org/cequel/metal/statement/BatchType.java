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

import com.datastax.driver.core.BatchStatement;

/** Kind of batch sent on flush. */
@PublicEvolving
public enum BatchType {

    /** Atomic across partitions, tracked in the batch log. */
    LOGGED("BEGIN BATCH", BatchStatement.Type.LOGGED),

    /** No batch log; cheaper, atomic only within a partition. */
    UNLOGGED("BEGIN UNLOGGED BATCH", BatchStatement.Type.UNLOGGED);

    private final String beginClause;
    private final BatchStatement.Type driverType;

    BatchType(String beginClause, BatchStatement.Type driverType) {
        this.beginClause = beginClause;
        this.driverType = driverType;
    }

    public String getBeginClause() {
        return beginClause;
    }

    public BatchStatement.Type getDriverType() {
        return driverType;
    }
}
