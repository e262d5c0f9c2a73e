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
import org.apache.flink.util.Preconditions;
import org.cequel.metal.config.ConnectionConfig;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Opens {@link DriverClusterConnection}s with the DataStax driver.
 *
 * <p>The session is bound to the configured keyspace only when the cluster knows it. This keeps a
 * handle to a keyspace that does not exist (yet) usable, e.g. to check {@code exists()} or to
 * issue keyspace-qualified statements.
 */
@Internal
public class DriverClusterConnectionFactory implements ClusterConnectionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DriverClusterConnectionFactory.class);

    private final ClusterBuilderCustomizer customizer;

    public DriverClusterConnectionFactory() {
        this(ClusterBuilderCustomizer.NO_OP);
    }

    public DriverClusterConnectionFactory(ClusterBuilderCustomizer customizer) {
        this.customizer =
                Preconditions.checkNotNull(customizer, "ClusterBuilderCustomizer cannot be null");
    }

    @Override
    public ClusterConnection connect(ConnectionConfig config) {
        Preconditions.checkArgument(config != null, "ConnectionConfig cannot be null");

        final Cluster cluster;
        try {
            cluster = new KeyspaceClusterBuilder(config, customizer).getCluster();
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(
                    "Failed to create Cassandra cluster. "
                            + "Check your cluster configuration (contact points, credentials, etc.)",
                    e);
        }

        try {
            cluster.init();
            Session session = openSession(cluster, config.getKeyspace());
            LOG.info(
                    "Connected to Cassandra cluster '{}' (hosts: {}, keyspace: {})",
                    cluster.getClusterName(),
                    config.getHosts(),
                    session.getLoggedKeyspace());
            return new DriverClusterConnection(cluster, session);
        } catch (RuntimeException e) {
            RuntimeException failure =
                    new RuntimeException(
                            "Failed to connect to Cassandra cluster. "
                                    + "Check that the hosts "
                                    + config.getHosts()
                                    + " are reachable and accept the configured credentials",
                            e);
            // Clean up cluster if session connection fails
            if (!cluster.isClosed()) {
                try {
                    cluster.close();
                } catch (Exception closeException) {
                    failure.addSuppressed(closeException);
                }
            }
            throw failure;
        }
    }

    private static Session openSession(Cluster cluster, Optional<String> keyspace) {
        if (keyspace.isPresent()) {
            if (cluster.getMetadata().getKeyspace(keyspace.get()) != null) {
                return cluster.connect(keyspace.get());
            }
            LOG.warn(
                    "Keyspace '{}' does not exist; opening a session without a logged keyspace",
                    keyspace.get());
        }
        return cluster.connect();
    }
}
