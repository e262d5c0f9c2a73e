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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link SslConfig}. */
class SslConfigTest {

    @Test
    void testDisabledHasNoMaterial() {
        assertThat(SslConfig.DISABLED.isEnabled()).isFalse();
        assertThat(SslConfig.DISABLED.getServerCert()).isEmpty();
        assertThat(SslConfig.DISABLED.getClientCert()).isEmpty();
        assertThat(SslConfig.DISABLED.getPrivateKey()).isEmpty();
        assertThat(SslConfig.DISABLED.getPassphrase()).isEmpty();
        assertThat(SslConfig.builder().build()).isEqualTo(SslConfig.DISABLED);
    }

    @Test
    void testEqualityAndHashCode() {
        SslConfig first = SslConfig.builder().setEnabled(true).setServerCert("ca.pem").build();
        SslConfig second = SslConfig.builder().setEnabled(true).setServerCert("ca.pem").build();
        SslConfig other = SslConfig.builder().setEnabled(true).setServerCert("other.pem").build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second).isNotEqualTo(other);
    }

    @Test
    void testToStringMasksSecrets() {
        SslConfig config =
                SslConfig.builder()
                        .setEnabled(true)
                        .setServerCert("ca.pem")
                        .setPrivateKey("client.key")
                        .setPassphrase("changeit")
                        .build();

        assertThat(config.toString())
                .contains("ca.pem")
                .doesNotContain("client.key")
                .doesNotContain("changeit");
    }
}
