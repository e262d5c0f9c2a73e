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

import org.cequel.metal.statement.BatchType;

import com.datastax.driver.core.ConsistencyLevel;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link BatchOptions}. */
class BatchOptionsTest {

    @Test
    void testDefaultValues() {
        BatchOptions options = BatchOptions.DEFAULTS;

        assertThat(options.getConsistency()).isEmpty();
        assertThat(options.isUnlogged()).isFalse();
        assertThat(options.getBatchType()).isEqualTo(BatchType.LOGGED);
        assertThat(options.getAutoApply()).isEmpty();
    }

    @Test
    void testCustomValues() {
        BatchOptions options =
                BatchOptions.builder()
                        .setConsistency(ConsistencyLevel.ALL)
                        .setUnlogged(true)
                        .setAutoApply(50)
                        .build();

        assertThat(options.getConsistency()).contains(ConsistencyLevel.ALL);
        assertThat(options.getBatchType()).isEqualTo(BatchType.UNLOGGED);
        assertThat(options.getAutoApply()).contains(50);
    }

    @Test
    void testAutoApplyMustBePositive() {
        assertThatThrownBy(() -> BatchOptions.builder().setAutoApply(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("autoApply must be null or > 0");

        assertThatThrownBy(() -> BatchOptions.builder().setAutoApply(-3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("autoApply must be null or > 0");

        assertThat(BatchOptions.builder().setAutoApply(null).build().getAutoApply()).isEmpty();
    }

    @Test
    void testFromMap() {
        Map<String, Object> values = new HashMap<>();
        values.put("consistency", "one");
        values.put("unlogged", "true");
        values.put("auto_apply", 10);

        BatchOptions options = BatchOptions.fromMap(values);

        assertThat(options.getConsistency()).contains(ConsistencyLevel.ONE);
        assertThat(options.isUnlogged()).isTrue();
        assertThat(options.getAutoApply()).contains(10);
    }

    @Test
    void testFromMapAcceptsConsistencyLevelValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("consistency", ConsistencyLevel.LOCAL_QUORUM);

        assertThat(BatchOptions.fromMap(values).getConsistency())
                .contains(ConsistencyLevel.LOCAL_QUORUM);
    }

    @Test
    void testFromMapRejectsUnknownKeysAndInvalidValues() {
        Map<String, Object> unknown = new HashMap<>();
        unknown.put("timestamp", 1L);
        assertThatThrownBy(() -> BatchOptions.fromMap(unknown))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown batch option: timestamp");

        Map<String, Object> zero = new HashMap<>();
        zero.put("auto_apply", 0);
        assertThatThrownBy(() -> BatchOptions.fromMap(zero))
                .isInstanceOf(IllegalArgumentException.class);

        Map<String, Object> badLevel = new HashMap<>();
        badLevel.put("consistency", "MOST");
        assertThatThrownBy(() -> BatchOptions.fromMap(badLevel))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid consistency level: MOST");
    }
}
