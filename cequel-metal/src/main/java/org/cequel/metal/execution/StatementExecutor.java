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

package org.cequel.metal.execution;

import org.apache.flink.annotation.Internal;
import org.apache.flink.util.Preconditions;
import org.cequel.metal.client.ClusterClient;
import org.cequel.metal.client.ClusterConnection;
import org.cequel.metal.exception.ConnectionFailureClassifier;
import org.cequel.metal.statement.Executable;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Sends statements and batches to the cluster, one blocking request at a time.
 *
 * <h3>Consistency</h3>
 *
 * <p>A statement's own consistency level wins over the level passed by the caller (the batch
 * level, for flushed batches), which wins over the default level of the keyspace.
 *
 * <h3>Error Handling Contract</h3>
 *
 * <ul>
 *   <li><strong>Connection failures</strong> (see {@link ConnectionFailureClassifier}): the failed
 *       connection is invalidated, a fresh one is obtained and the statement is sent exactly once
 *       more. If that attempt fails on the connection again, its exception is rethrown with the
 *       first failure attached as suppressed.
 *   <li><strong>Closed session</strong>: an {@link IllegalStateException} raised by a connection
 *       that another caller invalidated meanwhile is retried once on the current connection.
 *   <li><strong>Any other error</strong> (invalid query, syntax, authorization, unavailable
 *       replicas, coordinator timeouts): rethrown immediately and unchanged.
 * </ul>
 */
@Internal
public class StatementExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(StatementExecutor.class);

    /** Statements are resent at most once after a connection failure. */
    static final int MAX_CONNECTION_RETRIES = 1;

    private final ClusterClient clusterClient;
    private final ConsistencyLevel defaultConsistency;
    @Nullable private final Long slowlogThresholdMs;

    public StatementExecutor(
            ClusterClient clusterClient,
            ConsistencyLevel defaultConsistency,
            @Nullable Long slowlogThresholdMs) {
        this.clusterClient =
                Preconditions.checkNotNull(clusterClient, "ClusterClient cannot be null");
        this.defaultConsistency =
                Preconditions.checkNotNull(defaultConsistency, "defaultConsistency cannot be null");
        this.slowlogThresholdMs = slowlogThresholdMs;
    }

    /**
     * Executes a statement at the default consistency, unless it carries its own.
     *
     * @param statement the statement or batch
     * @return the driver result, unchanged
     */
    public ResultSet execute(Executable statement) {
        return execute(statement, null);
    }

    /**
     * Executes a statement or batch.
     *
     * @param statement the statement or batch
     * @param consistency the level to use when the statement carries none; the keyspace default
     *     applies when null
     * @return the driver result, unchanged
     */
    public ResultSet execute(Executable statement, @Nullable ConsistencyLevel consistency) {
        Preconditions.checkNotNull(statement, "statement cannot be null");
        final ConsistencyLevel resolved = resolveConsistency(statement, consistency);

        RuntimeException firstFailure = null;
        for (int attempt = 0; ; attempt++) {
            ClusterConnection connection = null;
            try {
                connection = clusterClient.current();
                return send(connection, statement, resolved);
            } catch (RuntimeException e) {
                Optional<String> connectionFailure =
                        ConnectionFailureClassifier.getConnectionFailureMessage(e);
                if (!connectionFailure.isPresent()) {
                    if (attempt < MAX_CONNECTION_RETRIES && isReplacedWhileInUse(connection, e)) {
                        LOG.warn(
                                "Connection was replaced while in use; retrying once on the new"
                                        + " one: {}",
                                statement.toCql(),
                                e);
                        firstFailure = e;
                        continue;
                    }
                    throw e;
                }
                if (connection != null) {
                    clusterClient.invalidate(connection);
                }
                if (attempt >= MAX_CONNECTION_RETRIES) {
                    if (firstFailure != null && firstFailure != e) {
                        e.addSuppressed(firstFailure);
                    }
                    LOG.error(
                            "{} again while retrying, giving up on: {}",
                            connectionFailure.get(),
                            statement.toCql());
                    throw e;
                }
                LOG.warn(
                        "{}; reconnecting and retrying once: {}",
                        connectionFailure.get(),
                        statement.toCql(),
                        e);
                firstFailure = e;
            }
        }
    }

    /**
     * Resolves the consistency level a statement is sent with.
     *
     * @param statement the statement or batch
     * @param consistency the level requested by the caller, if any
     * @return the statement's own level, else the requested level, else the default
     */
    public ConsistencyLevel resolveConsistency(
            Executable statement, @Nullable ConsistencyLevel consistency) {
        return statement
                .getConsistency()
                .orElse(consistency != null ? consistency : defaultConsistency);
    }

    public ConsistencyLevel getDefaultConsistency() {
        return defaultConsistency;
    }

    /**
     * A request sent on a connection another caller has just invalidated fails with an {@link
     * IllegalStateException} from the closed session rather than a connection failure.
     */
    private boolean isReplacedWhileInUse(
            @Nullable ClusterConnection connection, RuntimeException failure) {
        return connection != null
                && failure instanceof IllegalStateException
                && !clusterClient.isCurrent(connection);
    }

    private ResultSet send(
            ClusterConnection connection, Executable statement, ConsistencyLevel consistency) {
        long startTimeNanos = System.nanoTime();
        ResultSet resultSet = connection.execute(statement, consistency);
        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTimeNanos);

        if (slowlogThresholdMs != null && latencyMillis > slowlogThresholdMs) {
            LOG.warn(
                    "Slow CQL ({} ms, threshold {} ms) at {}: {}",
                    latencyMillis,
                    slowlogThresholdMs,
                    consistency,
                    statement.toCql());
        } else {
            LOG.debug("CQL ({} ms) at {}: {}", latencyMillis, consistency, statement.toCql());
        }
        return resultSet;
    }
}
