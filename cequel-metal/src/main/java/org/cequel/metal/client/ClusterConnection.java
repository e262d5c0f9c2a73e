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
import org.cequel.metal.statement.Executable;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.ResultSet;

/**
 * A live connection to the cluster: the narrow contract between the execution core and the
 * driver.
 *
 * <p>Implementations are responsible for:
 *
 * <ul>
 *   <li>Converting an {@link Executable} into a driver request and executing it synchronously
 *   <li>Answering whether a keyspace is known to the cluster
 *   <li>Releasing the underlying driver resources (via {@link #close()})
 * </ul>
 *
 * <p>Connections are shared by every caller of a {@link org.cequel.metal.Keyspace} and must be
 * safe for concurrent use.
 */
@Internal
public interface ClusterConnection extends AutoCloseable {

    /**
     * Executes a unit of work as one request.
     *
     * @param statement the statement or batch to send
     * @param consistency the resolved consistency level
     * @return the driver result, unchanged
     */
    ResultSet execute(Executable statement, ConsistencyLevel consistency);

    /**
     * Checks whether the cluster knows the given keyspace.
     *
     * @param keyspace keyspace name; unquoted names are case-insensitive
     * @return false if the keyspace does not exist
     */
    boolean keyspaceExists(String keyspace);

    /**
     * Closes the connection and its driver resources.
     *
     * <p>This method should be idempotent - safe to call multiple times.
     */
    @Override
    void close();
}
