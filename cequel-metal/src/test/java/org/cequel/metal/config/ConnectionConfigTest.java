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

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.policies.LoadBalancingPolicy;
import com.datastax.driver.core.policies.RoundRobinPolicy;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link ConnectionConfig}. */
class ConnectionConfigTest {

    @Test
    void testDefaultValues() {
        ConnectionConfig config = ConnectionConfig.fromMap(new HashMap<>());

        assertThat(config.getHosts()).isEqualTo("127.0.0.1");
        assertThat(config.getPort()).isEqualTo(9042);
        assertThat(config.getKeyspace()).isEmpty();
        assertThat(config.getUsername()).isEmpty();
        assertThat(config.getPassword()).isEmpty();
        assertThat(config.getSslConfig()).isEqualTo(SslConfig.DISABLED);
        assertThat(config.getDatacenter()).isEmpty();
        assertThat(config.getConnectionsPerRemoteNode()).isEmpty();
        assertThat(config.getLoadBalancingPolicy()).isEmpty();
        assertThat(config.getDefaultConsistency()).isEqualTo(ConsistencyLevel.QUORUM);
        assertThat(config.getConnectTimeoutMs()).isEqualTo(5000L);
        assertThat(config.getReadTimeoutMs()).isEqualTo(12000L);
        assertThat(config.getSlowlogThresholdMs()).isEmpty();
        assertThat(config.getClientOptions()).isEmpty();
    }

    @Test
    void testStringAndTypedValuesAreParsed() {
        Map<String, Object> options = new HashMap<>();
        options.put("host", "node1,node2:9043");
        options.put("port", "9142");
        options.put("keyspace", "blog");
        options.put("username", "cassandra");
        options.put("password", "secret");
        options.put("default_consistency", "local_quorum");
        options.put("connect_timeout", 1000);
        options.put("read_timeout", "2000");
        options.put("slowlog_threshold", 250L);

        ConnectionConfig config = ConnectionConfig.fromMap(options);

        assertThat(config.getHosts()).isEqualTo("node1,node2:9043");
        assertThat(config.getPort()).isEqualTo(9142);
        assertThat(config.getKeyspace()).contains("blog");
        assertThat(config.getUsername()).contains("cassandra");
        assertThat(config.getPassword()).contains("secret");
        assertThat(config.getDefaultConsistency()).isEqualTo(ConsistencyLevel.LOCAL_QUORUM);
        assertThat(config.getConnectTimeoutMs()).isEqualTo(1000L);
        assertThat(config.getReadTimeoutMs()).isEqualTo(2000L);
        assertThat(config.getSlowlogThresholdMs()).contains(250L);
    }

    @Test
    void testTlsOptionsAreEchoedExactly() {
        Map<String, Object> options = new HashMap<>();
        options.put("ssl", true);
        options.put("server_cert", "a");
        options.put("client_cert", "b");
        options.put("private_key", "c");
        options.put("passphrase", "d");

        SslConfig ssl = ConnectionConfig.fromMap(options).getSslConfig();

        assertThat(ssl.isEnabled()).isTrue();
        assertThat(ssl.getServerCert()).contains("a");
        assertThat(ssl.getClientCert()).contains("b");
        assertThat(ssl.getPrivateKey()).contains("c");
        assertThat(ssl.getPassphrase()).contains("d");
    }

    @Test
    void testUnsetAndZeroAreDistinguished() {
        Map<String, Object> options = new HashMap<>();
        options.put("connections_per_remote_node", 0);
        options.put("datacenter", "dc1");

        ConnectionConfig config = ConnectionConfig.fromMap(options);

        assertThat(config.getConnectionsPerRemoteNode()).contains(0);
        assertThat(config.getDatacenter()).contains("dc1");

        // null values count as absent
        options.put("connections_per_remote_node", null);
        options.put("datacenter", null);
        ConnectionConfig unset = ConnectionConfig.fromMap(options);

        assertThat(unset.getConnectionsPerRemoteNode()).isEmpty();
        assertThat(unset.getDatacenter()).isEmpty();
    }

    @Test
    void testExplicitLoadBalancingPolicyIsKept() {
        LoadBalancingPolicy policy = new RoundRobinPolicy();
        Map<String, Object> options = new HashMap<>();
        options.put("load_balancing_policy", policy);
        options.put("datacenter", "dc1");

        ConnectionConfig config = ConnectionConfig.fromMap(options);

        assertThat(config.getLoadBalancingPolicy()).containsSame(policy);
        assertThat(config.getDatacenter()).contains("dc1");
    }

    @Test
    void testLoadBalancingPolicyMustBeAPolicyInstance() {
        Map<String, Object> options = new HashMap<>();
        options.put("load_balancing_policy", "RoundRobinPolicy");

        assertThatThrownBy(() -> ConnectionConfig.fromMap(options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("load_balancing_policy");
    }

    @Test
    void testUnrecognizedOptionsArePassedThrough() {
        Object marker = new Object();
        Map<String, Object> options = new HashMap<>();
        options.put("compression", "lz4");
        options.put("custom", marker);
        options.put("keyspace", "blog");

        ConnectionConfig config = ConnectionConfig.fromMap(options);

        assertThat(config.getClientOptions())
                .containsOnlyKeys("compression", "custom")
                .containsEntry("compression", "lz4");
        assertThat(config.getClientOptions().get("custom")).isSameAs(marker);
    }

    @Test
    void testRecognizedKeyCannotBeAClientOption() {
        assertThatThrownBy(() -> ConnectionConfig.builder().setClientOption("port", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'port' is a recognized option");
    }

    @Test
    void testBuilderValidation() {
        assertThatThrownBy(() -> ConnectionConfig.builder().setHosts(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hosts configuration cannot be empty");

        assertThatThrownBy(() -> ConnectionConfig.builder().setPort(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid port number");

        assertThatThrownBy(() -> ConnectionConfig.builder().setPort(65536))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid port number");

        assertThatThrownBy(() -> ConnectionConfig.builder().setConnectionsPerRemoteNode(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("connections_per_remote_node must be >= 0");

        assertThatThrownBy(() -> ConnectionConfig.builder().setConnectTimeoutMs(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("connect_timeout must be positive");

        assertThatThrownBy(() -> ConnectionConfig.builder().setReadTimeoutMs(-5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("read_timeout must be positive");

        assertThatThrownBy(() -> ConnectionConfig.builder().setSlowlogThresholdMs(-1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("slowlog_threshold must be >= 0");
    }

    @Test
    void testInvalidNumberIsRejected() {
        Map<String, Object> options = new HashMap<>();
        options.put("port", "not-a-port");

        assertThatThrownBy(() -> ConnectionConfig.fromMap(options))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testParseConsistencyLevel() {
        assertThat(ConnectionConfig.parseConsistencyLevel("one")).isEqualTo(ConsistencyLevel.ONE);
        assertThat(ConnectionConfig.parseConsistencyLevel(" LOCAL_ONE "))
                .isEqualTo(ConsistencyLevel.LOCAL_ONE);

        assertThatThrownBy(() -> ConnectionConfig.parseConsistencyLevel(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Consistency level cannot be empty");

        assertThatThrownBy(() -> ConnectionConfig.parseConsistencyLevel("MOST"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid consistency level: MOST. Valid values are:");
    }

    @Test
    void testToStringMasksPassword() {
        ConnectionConfig config =
                ConnectionConfig.builder().setCredentials("cassandra", "secret").build();

        assertThat(config.toString()).doesNotContain("secret");
    }
}
