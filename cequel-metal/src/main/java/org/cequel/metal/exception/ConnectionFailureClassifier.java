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

import com.datastax.driver.core.exceptions.BusyConnectionException;
import com.datastax.driver.core.exceptions.BusyPoolException;
import com.datastax.driver.core.exceptions.ConnectionException;
import com.datastax.driver.core.exceptions.NoHostAvailableException;

import java.util.Optional;

/**
 * Defines the central list of driver exceptions that mean the connection itself is unusable, as
 * opposed to errors the cluster reports about a statement.
 *
 * <p>A connection failure makes the executor discard the cached connection, rebuild it and resend
 * the statement once. Anything not listed here (invalid queries, syntax errors, authorization,
 * unavailable replicas, coordinator timeouts) is a query-semantic error and is never retried.
 *
 * <p>Connection failures include:
 *
 * <ul>
 *   <li>No host could be reached ({@link NoHostAvailableException})
 *   <li>The transport broke or timed out client-side ({@link ConnectionException} and its
 *       subclasses, e.g. {@code TransportException}, {@code OperationTimedOutException})
 *   <li>Connections or pools are saturated ({@link BusyConnectionException}, {@link
 *       BusyPoolException})
 * </ul>
 */
public class ConnectionFailureClassifier {

    /** Enumeration of connection failure types with descriptive messages. */
    private enum ConnectionFailureType {
        NO_HOST_AVAILABLE(
                NoHostAvailableException.class, "No Cassandra host could be reached"),
        CONNECTION(ConnectionException.class, "The connection to a Cassandra host broke"),
        BUSY_CONNECTION(
                BusyConnectionException.class, "All connections to a Cassandra host are busy"),
        BUSY_POOL(BusyPoolException.class, "The connection pool of a Cassandra host is busy");

        private final Class<? extends Exception> exceptionClass;
        private final String message;

        ConnectionFailureType(Class<? extends Exception> exceptionClass, String message) {
            this.exceptionClass = exceptionClass;
            this.message = message;
        }
    }

    private ConnectionFailureClassifier() {}

    /**
     * Checks whether the given exception or any of its causes is a connection failure and returns
     * a description of it if so.
     *
     * @param throwable the exception to check
     * @return Optional containing the description, or empty for query-semantic errors
     */
    public static Optional<String> getConnectionFailureMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            for (ConnectionFailureType type : ConnectionFailureType.values()) {
                if (type.exceptionClass.isInstance(current)) {
                    return Optional.of(type.message);
                }
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * Checks whether the given exception or any of its causes is a connection failure.
     *
     * @param throwable the exception to check
     * @return true if the connection that produced the exception should be rebuilt
     */
    public static boolean isConnectionFailure(Throwable throwable) {
        return getConnectionFailureMessage(throwable).isPresent();
    }
}
