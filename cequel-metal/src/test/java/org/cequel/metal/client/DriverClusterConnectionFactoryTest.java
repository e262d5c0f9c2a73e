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

import org.cequel.metal.config.ConnectionConfig;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link DriverClusterConnectionFactory}. */
class DriverClusterConnectionFactoryTest {

    @Test
    void testConfigurationErrorsAreNotWrapped() {
        ConnectionConfig config = ConnectionConfig.builder().setHosts("node1:0").build();

        assertThatThrownBy(() -> new DriverClusterConnectionFactory().connect(config))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid port number: 0 for host: node1");
    }

    @Test
    void testCustomizerFailureIsWrapped() {
        IllegalStateException customizerError = new IllegalStateException("bad option");
        ClusterBuilderCustomizer customizer =
                (builder, options) -> {
                    throw customizerError;
                };

        assertThatThrownBy(
                        () ->
                                new DriverClusterConnectionFactory(customizer)
                                        .connect(ConnectionConfig.builder().build()))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("Failed to create Cassandra cluster")
                .hasCause(customizerError);
    }

    @Test
    void testNullConfigIsRejected() {
        assertThatThrownBy(() -> new DriverClusterConnectionFactory().connect(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("ConnectionConfig cannot be null");
    }
}
