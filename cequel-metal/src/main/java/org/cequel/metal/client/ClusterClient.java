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

package org.cequel.metal.client;

import org.apache.flink.annotation.Internal;
import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.Preconditions;
import org.cequel.metal.config.ConnectionConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * Owns the cached {@link ClusterConnection} of one {@link org.cequel.metal.Keyspace}.
 *
 * <p>The connection is built lazily on the first {@link #current()} call and shared by every
 * caller until it is {@link #invalidate(ClusterConnection) invalidated} after a connection
 * failure. The next {@link #current()} then builds a new one from the same configuration.
 *
 * <h3>Concurrency</h3>
 *
 * <p>Borrowing an existing connection does not lock. Building and invalidating are serialized, and
 * an invalidation only takes effect if the failed connection is still the current one. When
 * several callers fail on the same connection, the first invalidation discards it and the others
 * are no-ops, so exactly one rebuild happens per failed connection.
 */
@Internal
public class ClusterClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterClient.class);

    private final ConnectionConfig config;
    private final ClusterConnectionFactory connectionFactory;
    private final Object lock = new Object();

    @Nullable private volatile ClusterConnection current;

    @GuardedBy("lock")
    private boolean closed;

    @GuardedBy("lock")
    private int buildCount;

    public ClusterClient(ConnectionConfig config, ClusterConnectionFactory connectionFactory) {
        this.config = Preconditions.checkNotNull(config, "ConnectionConfig cannot be null");
        this.connectionFactory =
                Preconditions.checkNotNull(
                        connectionFactory, "ClusterConnectionFactory cannot be null");
    }

    /**
     * Returns the live connection, building it first if there is none.
     *
     * @return the current connection
     * @throws IllegalStateException if this client has been closed
     * @throws RuntimeException if building the connection fails; nothing is cached in that case
     */
    public ClusterConnection current() {
        ClusterConnection connection = current;
        if (connection != null) {
            return connection;
        }
        synchronized (lock) {
            Preconditions.checkState(!closed, "The cluster client has been closed");
            if (current == null) {
                LOG.debug("Building Cassandra connection with {}", config);
                current = connectionFactory.connect(config);
                buildCount++;
            }
            return current;
        }
    }

    /**
     * Discards the given connection if it is still the current one and closes it.
     *
     * @param failed the connection that reported a connection failure
     * @return true if the connection was discarded, false if it had already been replaced
     */
    public boolean invalidate(ClusterConnection failed) {
        Preconditions.checkNotNull(failed, "failed connection cannot be null");
        synchronized (lock) {
            if (current != failed) {
                LOG.debug("Ignoring invalidation of a connection that was already replaced");
                return false;
            }
            current = null;
        }
        LOG.info("Discarding Cassandra connection after a connection failure");
        closeConnection(failed);
        return true;
    }

    /**
     * Whether the given connection is the one handed out by {@link #current()}. A connection that
     * was borrowed before a concurrent invalidation is no longer current and may already be closed.
     */
    public boolean isCurrent(ClusterConnection connection) {
        return connection != null && current == connection;
    }

    /** Whether a connection is currently cached. */
    public boolean isConnected() {
        return current != null;
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    /** Number of connections built so far. */
    @VisibleForTesting
    int getBuildCount() {
        synchronized (lock) {
            return buildCount;
        }
    }

    /** Closes the current connection, if any. Further {@link #current()} calls fail. */
    @Override
    public void close() {
        ClusterConnection connection;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            connection = current;
            current = null;
        }
        if (connection != null) {
            LOG.info("Closing Cassandra connection");
            connection.close();
        }
    }

    private static void closeConnection(ClusterConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            // close failures of a discarded connection are logged only
            LOG.warn("Failed to close discarded Cassandra connection", e);
        }
    }
}
