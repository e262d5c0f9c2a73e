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

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * TLS settings of a connection. Every piece of material is optional; an absent value is reported
 * as {@link Optional#empty()} and never replaced by a default.
 */
@PublicEvolving
public final class SslConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** TLS disabled, no material. */
    public static final SslConfig DISABLED = new SslConfig(false, null, null, null, null);

    private final boolean enabled;
    @Nullable private final String serverCert;
    @Nullable private final String clientCert;
    @Nullable private final String privateKey;
    @Nullable private final String passphrase;

    SslConfig(
            boolean enabled,
            @Nullable String serverCert,
            @Nullable String clientCert,
            @Nullable String privateKey,
            @Nullable String passphrase) {
        this.enabled = enabled;
        this.serverCert = serverCert;
        this.clientCert = clientCert;
        this.privateKey = privateKey;
        this.passphrase = passphrase;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Path to the certificate used to verify the nodes. */
    public Optional<String> getServerCert() {
        return Optional.ofNullable(serverCert);
    }

    /** Path to the client certificate chain. */
    public Optional<String> getClientCert() {
        return Optional.ofNullable(clientCert);
    }

    /** Path to the private key of the client certificate. */
    public Optional<String> getPrivateKey() {
        return Optional.ofNullable(privateKey);
    }

    public Optional<String> getPassphrase() {
        return Optional.ofNullable(passphrase);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SslConfig that = (SslConfig) o;
        return enabled == that.enabled
                && Objects.equals(serverCert, that.serverCert)
                && Objects.equals(clientCert, that.clientCert)
                && Objects.equals(privateKey, that.privateKey)
                && Objects.equals(passphrase, that.passphrase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, serverCert, clientCert, privateKey, passphrase);
    }

    @Override
    public String toString() {
        return "SslConfig{"
                + "enabled="
                + enabled
                + ", serverCert="
                + serverCert
                + ", clientCert="
                + clientCert
                + ", privateKey="
                + (privateKey == null ? null : "****")
                + ", passphrase="
                + (passphrase == null ? null : "****")
                + '}';
    }

    /** Builder for {@link SslConfig}. */
    @PublicEvolving
    public static class Builder {

        private boolean enabled;
        @Nullable private String serverCert;
        @Nullable private String clientCert;
        @Nullable private String privateKey;
        @Nullable private String passphrase;

        public Builder setEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder setServerCert(@Nullable String serverCert) {
            this.serverCert = serverCert;
            return this;
        }

        public Builder setClientCert(@Nullable String clientCert) {
            this.clientCert = clientCert;
            return this;
        }

        public Builder setPrivateKey(@Nullable String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder setPassphrase(@Nullable String passphrase) {
            this.passphrase = passphrase;
            return this;
        }

        public SslConfig build() {
            return new SslConfig(enabled, serverCert, clientCert, privateKey, passphrase);
        }
    }
}
