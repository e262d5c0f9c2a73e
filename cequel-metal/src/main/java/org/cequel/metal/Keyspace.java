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

package org.cequel.metal;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.function.ThrowingConsumer;
import org.cequel.metal.batch.BatchContext;
import org.cequel.metal.batch.BatchManager;
import org.cequel.metal.batch.BatchOptions;
import org.cequel.metal.batch.BatchScope;
import org.cequel.metal.client.ClusterClient;
import org.cequel.metal.client.ClusterConnectionFactory;
import org.cequel.metal.client.DriverClusterConnectionFactory;
import org.cequel.metal.config.ConnectionConfig;
import org.cequel.metal.execution.StatementExecutor;
import org.cequel.metal.statement.CqlStatement;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * Handle to one Cassandra keyspace. Entry point for executing statements and grouping writes into
 * batches.
 *
 * <p>The handle owns a single cluster connection, built on first use and shared by every thread
 * using the handle. A statement failing with a connection-level error is retried once on a rebuilt
 * connection.
 *
 * <pre>{@code
 * Map<String, Object> options = new HashMap<>();
 * options.put("host", "10.0.0.1,10.0.0.2");
 * options.put("keyspace", "blog");
 * options.put("datacenter", "dc1");
 *
 * try (Keyspace keyspace = Keyspace.connect(options)) {
 *     keyspace.batch(BatchOptions.DEFAULTS, batch -> {
 *         keyspace.write(CqlStatement.of("INSERT INTO posts (id, title) VALUES (?, ?)", 1, "a"));
 *         keyspace.write(CqlStatement.of("INSERT INTO posts (id, title) VALUES (?, ?)", 2, "b"));
 *     });
 * }
 * }</pre>
 *
 * <p>Instances are thread safe. Batch scopes are tracked per thread: a write issued by a thread
 * only joins a batch opened by that same thread.
 */
@PublicEvolving
public class Keyspace implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Keyspace.class);

    private final ConnectionConfig config;
    private final ClusterClient client;
    private final StatementExecutor executor;
    private final BatchManager batchManager;

    @VisibleForTesting
    Keyspace(ConnectionConfig config, ClusterConnectionFactory connectionFactory) {
        this.config = Preconditions.checkNotNull(config, "ConnectionConfig cannot be null");
        this.client = new ClusterClient(config, connectionFactory);
        this.executor =
                new StatementExecutor(
                        client,
                        config.getDefaultConsistency(),
                        config.getSlowlogThresholdMs().orElse(null));
        this.batchManager = new BatchManager(executor);
    }

    /**
     * Creates a handle from raw options. See {@link org.cequel.metal.config.KeyspaceOptions} for
     * the recognized keys; any other key is handed to the cluster builder untouched.
     *
     * <p>No connection is opened until the first statement is executed.
     *
     * @throws IllegalArgumentException if an option has an invalid value
     */
    public static Keyspace connect(Map<String, ?> options) {
        return connect(ConnectionConfig.fromMap(options));
    }

    public static Keyspace connect(ConnectionConfig config) {
        return connect(config, new DriverClusterConnectionFactory());
    }

    public static Keyspace connect(
            ConnectionConfig config, ClusterConnectionFactory connectionFactory) {
        Preconditions.checkNotNull(connectionFactory, "ClusterConnectionFactory cannot be null");
        LOG.debug("Creating keyspace handle with {}", config);
        return new Keyspace(config, connectionFactory);
    }

    /**
     * Executes a statement immediately, even when a batch is open on the current thread.
     *
     * @param statement the statement
     * @return the driver result set
     */
    public ResultSet execute(CqlStatement statement) {
        return executor.execute(statement);
    }

    /**
     * Executes a statement immediately at the given consistency level, unless the statement
     * carries its own.
     */
    public ResultSet execute(CqlStatement statement, @Nullable ConsistencyLevel consistency) {
        return executor.execute(statement, consistency);
    }

    /**
     * Issues a write. Inside a batch scope opened by the current thread the statement is buffered
     * in that batch, otherwise it is executed immediately.
     *
     * @param statement the write statement
     * @throws org.cequel.metal.exception.BatchConfigurationException if the statement sets a
     *     consistency level other than the one of the open batch
     */
    public void write(CqlStatement statement) {
        Preconditions.checkNotNull(statement, "statement cannot be null");
        Optional<BatchContext> batch = batchManager.current();
        if (batch.isPresent()) {
            batch.get().append(statement);
        } else {
            executor.execute(statement);
        }
    }

    /**
     * Runs a block inside a batch scope. Writes issued by the block are sent when it returns
     * normally, and discarded when it throws. Nested calls on the same thread join the outer
     * batch.
     *
     * @param options options of the batch
     * @param block the block issuing writes
     * @param <E> exception type of the block
     * @throws E the exception thrown by the block, unchanged
     */
    public <E extends Throwable> void batch(
            BatchOptions options, ThrowingConsumer<BatchScope, E> block) throws E {
        batchManager.batch(options, block);
    }

    /** Runs a block inside a batch scope with default options. */
    public <E extends Throwable> void batch(ThrowingConsumer<BatchScope, E> block) throws E {
        batch(BatchOptions.DEFAULTS, block);
    }

    /**
     * Opens a batch scope for use with try-with-resources. {@link BatchScope#complete()} has to be
     * called before the scope is closed, otherwise the buffered writes are discarded.
     */
    public BatchScope openBatch(BatchOptions options) {
        return batchManager.open(options);
    }

    /**
     * Whether the configured keyspace exists in the cluster.
     *
     * @return false if the cluster does not know the keyspace
     * @throws IllegalStateException if no keyspace is configured
     */
    public boolean exists() {
        String name =
                config.getKeyspace()
                        .orElseThrow(() -> new IllegalStateException("No keyspace configured"));
        return client.current().keyspaceExists(name);
    }

    public Optional<String> getName() {
        return config.getKeyspace();
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    @VisibleForTesting
    ClusterClient getClient() {
        return client;
    }

    /** Closes the cluster connection. The handle cannot be used afterwards. */
    @Override
    public void close() {
        client.close();
    }
}
