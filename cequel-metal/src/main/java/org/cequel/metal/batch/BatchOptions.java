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

package org.cequel.metal.batch;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.Preconditions;
import org.cequel.metal.config.ConnectionConfig;
import org.cequel.metal.statement.BatchType;

import com.datastax.driver.core.ConsistencyLevel;

import javax.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Options of a batch scope.
 *
 * <ul>
 *   <li>{@code consistency} - level of every batch flushed by the scope. When unset, the keyspace
 *       default applies.
 *   <li>{@code unlogged} - send unlogged batches instead of logged ones.
 *   <li>{@code auto_apply} - flush automatically each time this many statements are buffered.
 *       When unset, the scope flushes once, when it completes.
 * </ul>
 */
@PublicEvolving
public final class BatchOptions {

    public static final ConfigOption<String> CONSISTENCY =
            ConfigOptions.key("consistency")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Consistency level of the flushed batches.");

    public static final ConfigOption<Boolean> UNLOGGED =
            ConfigOptions.key("unlogged")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Whether to send unlogged batches.");

    public static final ConfigOption<Integer> AUTO_APPLY =
            ConfigOptions.key("auto_apply")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "Number of buffered statements that triggers an automatic flush.");

    /** Logged batch, default consistency, flushed once on completion. */
    public static final BatchOptions DEFAULTS = builder().build();

    @Nullable private final ConsistencyLevel consistency;
    private final boolean unlogged;
    @Nullable private final Integer autoApply;

    private BatchOptions(
            @Nullable ConsistencyLevel consistency, boolean unlogged, @Nullable Integer autoApply) {
        this.consistency = consistency;
        this.unlogged = unlogged;
        this.autoApply = autoApply;
    }

    /**
     * Resolves batch options from an option map with the keys {@code consistency}, {@code
     * unlogged} and {@code auto_apply}.
     *
     * @param options the options; unknown keys are rejected
     * @return the resolved options
     * @throws IllegalArgumentException for unknown keys or invalid values
     */
    public static BatchOptions fromMap(Map<String, ?> options) {
        Preconditions.checkNotNull(options, "options cannot be null");
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            if (!key.equals(CONSISTENCY.key())
                    && !key.equals(UNLOGGED.key())
                    && !key.equals(AUTO_APPLY.key())) {
                throw new IllegalArgumentException("Unknown batch option: " + key);
            }
            if (entry.getValue() instanceof ConsistencyLevel) {
                values.put(key, ((ConsistencyLevel) entry.getValue()).name());
            } else if (entry.getValue() != null) {
                values.put(key, String.valueOf(entry.getValue()));
            }
        }

        Configuration configuration = Configuration.fromMap(values);
        String consistency = configuration.get(CONSISTENCY);
        return builder()
                .setConsistency(
                        consistency == null
                                ? null
                                : ConnectionConfig.parseConsistencyLevel(consistency))
                .setUnlogged(configuration.get(UNLOGGED))
                .setAutoApply(configuration.get(AUTO_APPLY))
                .build();
    }

    public Optional<ConsistencyLevel> getConsistency() {
        return Optional.ofNullable(consistency);
    }

    public boolean isUnlogged() {
        return unlogged;
    }

    public BatchType getBatchType() {
        return unlogged ? BatchType.UNLOGGED : BatchType.LOGGED;
    }

    public Optional<Integer> getAutoApply() {
        return Optional.ofNullable(autoApply);
    }

    @Override
    public String toString() {
        return "BatchOptions{consistency="
                + consistency
                + ", unlogged="
                + unlogged
                + ", autoApply="
                + autoApply
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BatchOptions}. */
    @PublicEvolving
    public static class Builder {

        @Nullable private ConsistencyLevel consistency;
        private boolean unlogged = UNLOGGED.defaultValue();
        @Nullable private Integer autoApply;

        /**
         * Sets the consistency level of the flushed batches.
         *
         * @param consistency the level, or null for the keyspace default
         * @return this builder
         */
        public Builder setConsistency(@Nullable ConsistencyLevel consistency) {
            this.consistency = consistency;
            return this;
        }

        public Builder setUnlogged(boolean unlogged) {
            this.unlogged = unlogged;
            return this;
        }

        /**
         * Sets the number of buffered statements that triggers an automatic flush.
         *
         * @param autoApply threshold (must be > 0), or null to flush only on completion
         * @return this builder
         * @throws IllegalArgumentException if autoApply is not positive
         */
        public Builder setAutoApply(@Nullable Integer autoApply) {
            Preconditions.checkArgument(
                    autoApply == null || autoApply > 0, "autoApply must be null or > 0");
            this.autoApply = autoApply;
            return this;
        }

        public BatchOptions build() {
            return new BatchOptions(consistency, unlogged, autoApply);
        }
    }
}
