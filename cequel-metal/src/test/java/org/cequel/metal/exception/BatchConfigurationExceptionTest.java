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

import com.datastax.driver.core.ConsistencyLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link BatchConfigurationException}. */
class BatchConfigurationExceptionTest {

    @Test
    void testMessageNamesBothLevels() {
        BatchConfigurationException e =
                new BatchConfigurationException(ConsistencyLevel.ONE, ConsistencyLevel.ALL);

        assertThat(e)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(
                        "Attempting to perform query with consistency ONE in batch with consistency ALL. "
                                + "Set the consistency on the batch instead of individual statements.");
        assertThat(e.getStatementConsistency()).isEqualTo(ConsistencyLevel.ONE);
        assertThat(e.getBatchConsistency()).isEqualTo(ConsistencyLevel.ALL);
    }

    @Test
    void testUnsetBatchLevel() {
        BatchConfigurationException e =
                new BatchConfigurationException(ConsistencyLevel.QUORUM, null);

        assertThat(e).hasMessageContaining("in batch with consistency <default>");
        assertThat(e.getBatchConsistency()).isNull();
    }
}
