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
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options recognized when connecting a {@link org.cequel.metal.Keyspace}.
 *
 * <h3>Unset vs. default</h3>
 *
 * <p>Options declared with {@code noDefaultValue()} are reported as {@link java.util.Optional#empty()}
 * when omitted. This matters for {@link #DATACENTER} and {@link #CONNECTIONS_PER_REMOTE_NODE}: an
 * explicit {@code 0} is passed through to the driver, an omitted option is not passed at all.
 *
 * <h3>Precedence</h3>
 *
 * <ul>
 *   <li>{@link #LOAD_BALANCING_POLICY} wins over {@link #DATACENTER} for routing purposes. The
 *       datacenter is still reported by the configuration.
 *   <li>The TLS material options are only consulted when {@link #SSL} is {@code true}.
 * </ul>
 *
 * <p>Any key that is not declared here is kept verbatim as a client option and handed to the
 * connection factory.
 */
@PublicEvolving
public class KeyspaceOptions {

    public static final ConfigOption<String> HOST =
            ConfigOptions.key("host")
                    .stringType()
                    .defaultValue("127.0.0.1")
                    .withDescription(
                            "Cassandra hosts to connect to, comma-separated "
                                    + "(e.g., 'localhost,host2:9043'). Entries without a port use 'port'.");

    public static final ConfigOption<Integer> PORT =
            ConfigOptions.key("port")
                    .intType()
                    .defaultValue(9042)
                    .withDescription("Cassandra native protocol port (default: 9042).");

    public static final ConfigOption<String> KEYSPACE =
            ConfigOptions.key("keyspace")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Name of the keyspace this handle is scoped to.");

    public static final ConfigOption<String> USERNAME =
            ConfigOptions.key("username")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Username for plain text authentication.");

    public static final ConfigOption<String> PASSWORD =
            ConfigOptions.key("password")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Password for plain text authentication.");

    public static final ConfigOption<Boolean> SSL =
            ConfigOptions.key("ssl")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Whether to encrypt client-to-node traffic with TLS.");

    public static final ConfigOption<String> SERVER_CERT =
            ConfigOptions.key("server_cert")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Path to the PEM encoded certificate used to verify the nodes. Only used when 'ssl' is true.");

    public static final ConfigOption<String> CLIENT_CERT =
            ConfigOptions.key("client_cert")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Path to the PEM encoded client certificate chain. Only used when 'ssl' is true.");

    public static final ConfigOption<String> PRIVATE_KEY =
            ConfigOptions.key("private_key")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Path to the PEM encoded private key of the client certificate. Only used when 'ssl' is true.");

    public static final ConfigOption<String> PASSPHRASE =
            ConfigOptions.key("passphrase")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Passphrase of 'private_key', if it is encrypted. Only used when 'ssl' is true.");

    public static final ConfigOption<String> DATACENTER =
            ConfigOptions.key("datacenter")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Local datacenter. Requests are routed token-aware within this datacenter. "
                                    + "Ignored for routing if 'load_balancing_policy' is specified.");

    public static final ConfigOption<Integer> CONNECTIONS_PER_REMOTE_NODE =
            ConfigOptions.key("connections_per_remote_node")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "Number of connections opened to each node of a remote datacenter. "
                                    + "Driver default applies when not set.");

    /**
     * Key of the explicit load balancing policy. The value is a {@link
     * com.datastax.driver.core.policies.LoadBalancingPolicy} instance rather than a string, so it
     * is not declared as a {@link ConfigOption}.
     */
    public static final String LOAD_BALANCING_POLICY = "load_balancing_policy";

    public static final ConfigOption<String> DEFAULT_CONSISTENCY =
            ConfigOptions.key("default_consistency")
                    .stringType()
                    .defaultValue("QUORUM")
                    .withDescription(
                            "Consistency level used when neither the statement nor the batch sets one.");

    public static final ConfigOption<Long> CONNECT_TIMEOUT =
            ConfigOptions.key("connect_timeout")
                    .longType()
                    .defaultValue(5000L)
                    .withDescription(
                            "Time limit for establishing a connection to Cassandra nodes (in milliseconds).");

    public static final ConfigOption<Long> READ_TIMEOUT =
            ConfigOptions.key("read_timeout")
                    .longType()
                    .defaultValue(12000L)
                    .withDescription(
                            "Time limit for waiting for a response from Cassandra after sending a query (in milliseconds).");

    public static final ConfigOption<Long> SLOWLOG_THRESHOLD =
            ConfigOptions.key("slowlog_threshold")
                    .longType()
                    .noDefaultValue()
                    .withDescription(
                            "Statements taking longer than this many milliseconds are logged at WARN level.");

    /** Keys of every recognized option, including {@link #LOAD_BALANCING_POLICY}. */
    public static final Set<String> RECOGNIZED_KEYS =
            Collections.unmodifiableSet(
                    new LinkedHashSet<>(
                            Arrays.asList(
                                    HOST.key(),
                                    PORT.key(),
                                    KEYSPACE.key(),
                                    USERNAME.key(),
                                    PASSWORD.key(),
                                    SSL.key(),
                                    SERVER_CERT.key(),
                                    CLIENT_CERT.key(),
                                    PRIVATE_KEY.key(),
                                    PASSPHRASE.key(),
                                    DATACENTER.key(),
                                    CONNECTIONS_PER_REMOTE_NODE.key(),
                                    LOAD_BALANCING_POLICY,
                                    DEFAULT_CONSISTENCY.key(),
                                    CONNECT_TIMEOUT.key(),
                                    READ_TIMEOUT.key(),
                                    SLOWLOG_THRESHOLD.key())));

    private KeyspaceOptions() {}
}
