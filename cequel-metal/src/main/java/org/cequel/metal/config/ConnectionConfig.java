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

package org.cequel.metal.config;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.Preconditions;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.policies.LoadBalancingPolicy;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable connect-time configuration of a {@link org.cequel.metal.Keyspace}.
 *
 * <p>Instances are created either from a loosely typed option map ({@link #fromMap(Map)}), using
 * the keys declared in {@link KeyspaceOptions}, or through {@link #builder()}. Resolution is a pure
 * transformation: nothing is connected or read from disk here. Certificate and key paths are only
 * opened when the connection is built.
 */
@PublicEvolving
public final class ConnectionConfig {

    private final String hosts;
    private final int port;
    @Nullable private final String keyspace;
    @Nullable private final String username;
    @Nullable private final String password;
    private final SslConfig sslConfig;
    @Nullable private final String datacenter;
    @Nullable private final Integer connectionsPerRemoteNode;
    @Nullable private final LoadBalancingPolicy loadBalancingPolicy;
    private final ConsistencyLevel defaultConsistency;
    private final long connectTimeoutMs;
    private final long readTimeoutMs;
    @Nullable private final Long slowlogThresholdMs;
    private final Map<String, Object> clientOptions;

    private ConnectionConfig(Builder builder) {
        this.hosts = builder.hosts;
        this.port = builder.port;
        this.keyspace = builder.keyspace;
        this.username = builder.username;
        this.password = builder.password;
        this.sslConfig = builder.sslConfig;
        this.datacenter = builder.datacenter;
        this.connectionsPerRemoteNode = builder.connectionsPerRemoteNode;
        this.loadBalancingPolicy = builder.loadBalancingPolicy;
        this.defaultConsistency = builder.defaultConsistency;
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.readTimeoutMs = builder.readTimeoutMs;
        this.slowlogThresholdMs = builder.slowlogThresholdMs;
        this.clientOptions =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.clientOptions));
    }

    /**
     * Resolves a configuration from an option map.
     *
     * <p>Recognized keys are listed in {@link KeyspaceOptions}. Values may be strings or already
     * typed values (numbers, booleans); {@code null} values are treated as absent. The value of
     * {@link KeyspaceOptions#LOAD_BALANCING_POLICY} must be a {@link LoadBalancingPolicy}. Every
     * other key is kept unchanged in {@link #getClientOptions()}.
     *
     * @param options the connection options
     * @return the resolved configuration
     * @throws IllegalArgumentException if a recognized option has an invalid value
     */
    public static ConnectionConfig fromMap(Map<String, ?> options) {
        Preconditions.checkNotNull(options, "options cannot be null");

        Map<String, String> recognized = new HashMap<>();
        Map<String, Object> passThrough = new LinkedHashMap<>();
        LoadBalancingPolicy policy = null;
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (KeyspaceOptions.LOAD_BALANCING_POLICY.equals(key)) {
                if (!(value instanceof LoadBalancingPolicy)) {
                    throw new IllegalArgumentException(
                            String.format(
                                    "Option '%s' must be a %s, got: %s",
                                    key,
                                    LoadBalancingPolicy.class.getName(),
                                    value.getClass().getName()));
                }
                policy = (LoadBalancingPolicy) value;
            } else if (KeyspaceOptions.RECOGNIZED_KEYS.contains(key)) {
                recognized.put(key, String.valueOf(value));
            } else {
                passThrough.put(key, value);
            }
        }

        Configuration configuration = Configuration.fromMap(recognized);
        Builder builder =
                builder()
                        .setHosts(configuration.get(KeyspaceOptions.HOST))
                        .setPort(configuration.get(KeyspaceOptions.PORT))
                        .setKeyspace(configuration.get(KeyspaceOptions.KEYSPACE))
                        .setCredentials(
                                configuration.get(KeyspaceOptions.USERNAME),
                                configuration.get(KeyspaceOptions.PASSWORD))
                        .setSslConfig(
                                SslConfig.builder()
                                        .setEnabled(configuration.get(KeyspaceOptions.SSL))
                                        .setServerCert(
                                                configuration.get(KeyspaceOptions.SERVER_CERT))
                                        .setClientCert(
                                                configuration.get(KeyspaceOptions.CLIENT_CERT))
                                        .setPrivateKey(
                                                configuration.get(KeyspaceOptions.PRIVATE_KEY))
                                        .setPassphrase(
                                                configuration.get(KeyspaceOptions.PASSPHRASE))
                                        .build())
                        .setDatacenter(configuration.get(KeyspaceOptions.DATACENTER))
                        .setConnectionsPerRemoteNode(
                                configuration.get(KeyspaceOptions.CONNECTIONS_PER_REMOTE_NODE))
                        .setLoadBalancingPolicy(policy)
                        .setDefaultConsistency(
                                parseConsistencyLevel(
                                        configuration.get(KeyspaceOptions.DEFAULT_CONSISTENCY)))
                        .setConnectTimeoutMs(configuration.get(KeyspaceOptions.CONNECT_TIMEOUT))
                        .setReadTimeoutMs(configuration.get(KeyspaceOptions.READ_TIMEOUT))
                        .setSlowlogThresholdMs(
                                configuration.get(KeyspaceOptions.SLOWLOG_THRESHOLD));
        passThrough.forEach(builder::setClientOption);
        return builder.build();
    }

    /**
     * Parses a consistency level name, case-insensitively.
     *
     * @param level the level name, e.g. {@code "local_quorum"}
     * @return the parsed level
     * @throws IllegalArgumentException if the name is empty or unknown
     */
    public static ConsistencyLevel parseConsistencyLevel(@Nullable String level) {
        if (StringUtils.isBlank(level)) {
            throw new IllegalArgumentException("Consistency level cannot be empty");
        }

        try {
            return ConsistencyLevel.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid consistency level: "
                            + level
                            + ". Valid values are: "
                            + Arrays.toString(ConsistencyLevel.values()),
                    e);
        }
    }

    /** Comma-separated contact points, each optionally carrying its own port. */
    public String getHosts() {
        return hosts;
    }

    public int getPort() {
        return port;
    }

    public Optional<String> getKeyspace() {
        return Optional.ofNullable(keyspace);
    }

    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    public SslConfig getSslConfig() {
        return sslConfig;
    }

    public Optional<String> getDatacenter() {
        return Optional.ofNullable(datacenter);
    }

    public Optional<Integer> getConnectionsPerRemoteNode() {
        return Optional.ofNullable(connectionsPerRemoteNode);
    }

    /** The explicitly supplied policy, returned as the same instance that was configured. */
    public Optional<LoadBalancingPolicy> getLoadBalancingPolicy() {
        return Optional.ofNullable(loadBalancingPolicy);
    }

    public ConsistencyLevel getDefaultConsistency() {
        return defaultConsistency;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public Optional<Long> getSlowlogThresholdMs() {
        return Optional.ofNullable(slowlogThresholdMs);
    }

    /** Options that are not recognized by this layer, in insertion order. */
    public Map<String, Object> getClientOptions() {
        return clientOptions;
    }

    @Override
    public String toString() {
        return "ConnectionConfig{"
                + "hosts='"
                + hosts
                + '\''
                + ", port="
                + port
                + ", keyspace="
                + keyspace
                + ", username="
                + username
                + ", ssl="
                + sslConfig
                + ", datacenter="
                + datacenter
                + ", connectionsPerRemoteNode="
                + connectionsPerRemoteNode
                + ", loadBalancingPolicy="
                + loadBalancingPolicy
                + ", defaultConsistency="
                + defaultConsistency
                + ", clientOptions="
                + clientOptions.keySet()
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ConnectionConfig}. */
    @PublicEvolving
    public static class Builder {

        private String hosts = KeyspaceOptions.HOST.defaultValue();
        private int port = KeyspaceOptions.PORT.defaultValue();
        @Nullable private String keyspace;
        @Nullable private String username;
        @Nullable private String password;
        private SslConfig sslConfig = SslConfig.DISABLED;
        @Nullable private String datacenter;
        @Nullable private Integer connectionsPerRemoteNode;
        @Nullable private LoadBalancingPolicy loadBalancingPolicy;
        private ConsistencyLevel defaultConsistency =
                ConsistencyLevel.valueOf(KeyspaceOptions.DEFAULT_CONSISTENCY.defaultValue());
        private long connectTimeoutMs = KeyspaceOptions.CONNECT_TIMEOUT.defaultValue();
        private long readTimeoutMs = KeyspaceOptions.READ_TIMEOUT.defaultValue();
        @Nullable private Long slowlogThresholdMs;
        private final Map<String, Object> clientOptions = new LinkedHashMap<>();

        public Builder setHosts(String hosts) {
            Preconditions.checkArgument(
                    StringUtils.isNotBlank(hosts), "Hosts configuration cannot be empty");
            this.hosts = hosts;
            return this;
        }

        public Builder setPort(int port) {
            Preconditions.checkArgument(
                    port > 0 && port <= 65535, "Invalid port number: %s", port);
            this.port = port;
            return this;
        }

        public Builder setKeyspace(@Nullable String keyspace) {
            this.keyspace = keyspace;
            return this;
        }

        public Builder setCredentials(@Nullable String username, @Nullable String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder setSslConfig(SslConfig sslConfig) {
            this.sslConfig = Preconditions.checkNotNull(sslConfig, "sslConfig cannot be null");
            return this;
        }

        public Builder setDatacenter(@Nullable String datacenter) {
            this.datacenter = datacenter;
            return this;
        }

        public Builder setConnectionsPerRemoteNode(@Nullable Integer connectionsPerRemoteNode) {
            Preconditions.checkArgument(
                    connectionsPerRemoteNode == null || connectionsPerRemoteNode >= 0,
                    "connections_per_remote_node must be >= 0, got: %s",
                    connectionsPerRemoteNode);
            this.connectionsPerRemoteNode = connectionsPerRemoteNode;
            return this;
        }

        public Builder setLoadBalancingPolicy(@Nullable LoadBalancingPolicy loadBalancingPolicy) {
            this.loadBalancingPolicy = loadBalancingPolicy;
            return this;
        }

        public Builder setDefaultConsistency(ConsistencyLevel defaultConsistency) {
            this.defaultConsistency =
                    Preconditions.checkNotNull(
                            defaultConsistency, "defaultConsistency cannot be null");
            return this;
        }

        public Builder setConnectTimeoutMs(long connectTimeoutMs) {
            Preconditions.checkArgument(
                    connectTimeoutMs > 0,
                    "connect_timeout must be positive, got: %s ms",
                    connectTimeoutMs);
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder setReadTimeoutMs(long readTimeoutMs) {
            Preconditions.checkArgument(
                    readTimeoutMs > 0, "read_timeout must be positive, got: %s ms", readTimeoutMs);
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder setSlowlogThresholdMs(@Nullable Long slowlogThresholdMs) {
            Preconditions.checkArgument(
                    slowlogThresholdMs == null || slowlogThresholdMs >= 0,
                    "slowlog_threshold must be >= 0, got: %s",
                    slowlogThresholdMs);
            this.slowlogThresholdMs = slowlogThresholdMs;
            return this;
        }

        public Builder setClientOption(String key, Object value) {
            Preconditions.checkArgument(
                    !KeyspaceOptions.RECOGNIZED_KEYS.contains(key),
                    "'%s' is a recognized option and cannot be passed as a client option",
                    key);
            clientOptions.put(key, value);
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(this);
        }
    }
}
