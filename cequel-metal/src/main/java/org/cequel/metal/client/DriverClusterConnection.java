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
import org.cequel.metal.statement.Executable;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Session;

import javax.annotation.Nullable;

/**
 * {@link ClusterConnection} backed by a DataStax driver {@link Session} and the {@link Cluster} it
 * was opened from.
 */
@Internal
public class DriverClusterConnection implements ClusterConnection {

    @Nullable private final Cluster cluster;
    private final Session session;

    /**
     * Creates a connection that owns both the session and the cluster.
     *
     * @param cluster the cluster the session belongs to; closed after the session. May be null
     *     when the cluster is owned elsewhere.
     * @param session the session used to execute statements
     */
    public DriverClusterConnection(@Nullable Cluster cluster, Session session) {
        Preconditions.checkArgument(session != null, "Session cannot be null");
        this.cluster = cluster;
        this.session = session;
    }

    @Override
    public ResultSet execute(Executable statement, ConsistencyLevel consistency) {
        return session.execute(statement.toDriverStatement(consistency));
    }

    @Override
    public boolean keyspaceExists(String keyspace) {
        return session.getCluster().getMetadata().getKeyspace(keyspace) != null;
    }

    public Session getSession() {
        return session;
    }

    @Nullable
    public Cluster getCluster() {
        return cluster;
    }

    /** Closes the session, then the cluster. Safe to call multiple times. */
    @Override
    public void close() {
        if (!session.isClosed()) {
            session.close();
        }
        if (cluster != null && !cluster.isClosed()) {
            cluster.close();
        }
    }

    @Override
    public String toString() {
        return "DriverClusterConnection{session=" + session.getLoggedKeyspace() + '}';
    }
}
