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
import org.cequel.metal.config.SslConfig;
import org.cequel.metal.policy.LoadBalancingPolicyBuilder;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.HostDistance;
import com.datastax.driver.core.PoolingOptions;
import com.datastax.driver.core.QueryOptions;
import com.datastax.driver.core.RemoteEndpointAwareNettySSLOptions;
import com.datastax.driver.core.SocketOptions;
import com.datastax.driver.core.policies.LoadBalancingPolicy;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;

import java.io.File;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the driver {@link Cluster} for a {@link ConnectionConfig}. This is the single place where
 * every connect-time option is applied.
 *
 * <p>Options that are not set in the configuration are not passed to the driver at all, so driver
 * defaults apply to them.
 */
@Internal
public class KeyspaceClusterBuilder {

    private static final Pattern HOST_PORT_PATTERN = Pattern.compile("^([^:]+)(?::(\\d+))?$");

    private final ConnectionConfig config;
    private final ClusterBuilderCustomizer customizer;

    public KeyspaceClusterBuilder(ConnectionConfig config) {
        this(config, ClusterBuilderCustomizer.NO_OP);
    }

    public KeyspaceClusterBuilder(ConnectionConfig config, ClusterBuilderCustomizer customizer) {
        this.config = Preconditions.checkNotNull(config, "ConnectionConfig cannot be null");
        this.customizer =
                Preconditions.checkNotNull(customizer, "ClusterBuilderCustomizer cannot be null");
    }

    /**
     * Builds a new, not yet initialized cluster.
     *
     * @return the cluster; the caller owns it and must close it
     */
    public Cluster getCluster() {
        return buildCluster(Cluster.builder());
    }

    @VisibleForTesting
    Cluster buildCluster(Cluster.Builder builder) {
        configureHosts(builder, config.getHosts());

        config.getUsername()
                .ifPresent(
                        username ->
                                builder.withCredentials(
                                        username, config.getPassword().orElse("")));

        if (config.getSslConfig().isEnabled()) {
            builder.withSSL(
                    new RemoteEndpointAwareNettySSLOptions(
                            createSslContext(config.getSslConfig())));
        }

        Optional<LoadBalancingPolicy> policy =
                LoadBalancingPolicyBuilder.build(
                        config.getDatacenter().orElse(null),
                        config.getLoadBalancingPolicy().orElse(null));
        policy.ifPresent(builder::withLoadBalancingPolicy);

        config.getConnectionsPerRemoteNode()
                .ifPresent(
                        connections ->
                                builder.withPoolingOptions(
                                        new PoolingOptions()
                                                .setConnectionsPerHost(
                                                        HostDistance.REMOTE,
                                                        connections,
                                                        connections)));

        builder.withQueryOptions(createQueryOptions()).withSocketOptions(createSocketOptions());

        customizer.customize(builder, config.getClientOptions());
        return builder.build();
    }

    private void configureHosts(Cluster.Builder builder, String hostsString) {
        String[] hostEntries = hostsString.split(",");
        List<InetSocketAddress> contactPoints = new ArrayList<>(hostEntries.length);

        for (String hostEntry : hostEntries) {
            String trimmedEntry = hostEntry.trim();
            if (trimmedEntry.isEmpty()) {
                throw new IllegalArgumentException(
                        String.format("Empty host entry found in: %s", hostsString));
            }

            Matcher matcher = HOST_PORT_PATTERN.matcher(trimmedEntry);
            if (!matcher.matches()) {
                throw new IllegalArgumentException(
                        String.format("Invalid host format: %s", trimmedEntry));
            }

            String host = matcher.group(1);
            String portGroup = matcher.group(2);

            int hostPort = config.getPort();
            if (portGroup != null) {
                hostPort = Integer.parseInt(portGroup);
                if (hostPort <= 0 || hostPort > 65535) {
                    throw new IllegalArgumentException(
                            String.format("Invalid port number: %s for host: %s", hostPort, host));
                }
            }
            contactPoints.add(new InetSocketAddress(host, hostPort));
        }

        for (InetSocketAddress contactPoint : contactPoints) {
            if (contactPoint.isUnresolved()) {
                throw new IllegalArgumentException(
                        String.format("Cannot resolve host: %s", contactPoint.getHostString()));
            }
        }

        // the driver port is global: it only applies to nodes discovered after the contact points
        builder.addContactPointsWithPorts(contactPoints).withPort(config.getPort());
    }

    private QueryOptions createQueryOptions() {
        return new QueryOptions().setConsistencyLevel(config.getDefaultConsistency());
    }

    private SocketOptions createSocketOptions() {
        return new SocketOptions()
                .setConnectTimeoutMillis(validateTimeout(config.getConnectTimeoutMs(), "connect"))
                .setReadTimeoutMillis(validateTimeout(config.getReadTimeoutMs(), "read"));
    }

    private int validateTimeout(long timeoutMs, String timeoutType) {
        if (timeoutMs > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    String.format(
                            "%s timeout too large: %d ms (max: %d ms)",
                            timeoutType, timeoutMs, Integer.MAX_VALUE));
        }
        return (int) timeoutMs;
    }

    private static SslContext createSslContext(SslConfig sslConfig) {
        if (sslConfig.getClientCert().isPresent() && !sslConfig.getPrivateKey().isPresent()) {
            throw new IllegalArgumentException(
                    "A private key is required when a client certificate is configured");
        }
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (sslConfig.getServerCert().isPresent()) {
                builder.trustManager(new File(sslConfig.getServerCert().get()));
            }
            if (sslConfig.getClientCert().isPresent()) {
                builder.keyManager(
                        new File(sslConfig.getClientCert().get()),
                        new File(sslConfig.getPrivateKey().get()),
                        sslConfig.getPassphrase().orElse(null));
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid certificate or private key: %s", e.getMessage()), e);
        }
    }
}
