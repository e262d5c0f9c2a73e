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
import org.apache.flink.util.Preconditions;

import com.datastax.driver.core.BatchStatement;
import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.Statement;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * An immutable group of statements sent to the cluster as a single {@code BATCH} request.
 *
 * <p>The batch carries no consistency of its own: the level is chosen by the batch scope that
 * produced it and passed at execution time. Statements inside a batch never carry their own
 * level; see {@link org.cequel.metal.batch.BatchContext}.
 */
@PublicEvolving
public final class CqlBatch implements Executable {

    private final BatchType type;
    private final List<CqlStatement> statements;

    public CqlBatch(BatchType type, List<CqlStatement> statements) {
        Preconditions.checkNotNull(type, "type cannot be null");
        Preconditions.checkArgument(
                statements != null && !statements.isEmpty(),
                "A batch needs at least one statement");
        this.type = type;
        this.statements = ImmutableList.copyOf(statements);
    }

    public BatchType getType() {
        return type;
    }

    public List<CqlStatement> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    @Override
    public Optional<ConsistencyLevel> getConsistency() {
        return Optional.empty();
    }

    /**
     * Renders the batch as CQL text, e.g.
     *
     * <pre>
     * BEGIN UNLOGGED BATCH
     * INSERT INTO posts (id, title) VALUES (?, ?)
     * APPLY BATCH
     * </pre>
     */
    @Override
    public String toCql() {
        StringBuilder cql = new StringBuilder(type.getBeginClause()).append('\n');
        for (CqlStatement statement : statements) {
            cql.append(statement.getCql()).append('\n');
        }
        return cql.append("APPLY BATCH").toString();
    }

    @Override
    public Statement toDriverStatement(ConsistencyLevel consistency) {
        BatchStatement batch = new BatchStatement(type.getDriverType());
        for (CqlStatement statement : statements) {
            batch.add(statement.toDriverStatement(consistency));
        }
        batch.setConsistencyLevel(consistency);
        return batch;
    }

    @Override
    public String toString() {
        return "CqlBatch{type=" + type + ", statements=" + statements.size() + '}';
    }
}
