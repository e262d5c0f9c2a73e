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

package org.cequel.metal;

import org.cequel.metal.batch.BatchOptions;
import org.cequel.metal.exception.BatchConfigurationException;
import org.cequel.metal.statement.CqlStatement;

import com.datastax.driver.core.ConsistencyLevel;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Runs {@link Keyspace} against a Cassandra container. */
@Testcontainers
class KeyspaceITCase {

    private static final int CQL_PORT = 9042;
    private static final String KEYSPACE = "cequel_it";
    private static final String DATACENTER = "datacenter1";

    @Container
    private static final CassandraContainer CASSANDRA =
            new CassandraContainer(DockerImageName.parse("cassandra:4.0.8"));

    private static Keyspace keyspace;

    @BeforeAll
    static void setUp() {
        Map<String, Object> options = new HashMap<>();
        options.put("host", CASSANDRA.getHost());
        options.put("port", CASSANDRA.getMappedPort(CQL_PORT));
        options.put("keyspace", KEYSPACE);
        options.put("datacenter", DATACENTER);
        options.put("default_consistency", "ONE");
        options.put("read_timeout", 36000);
        keyspace = Keyspace.connect(options);
    }

    @AfterAll
    static void tearDown() {
        if (keyspace != null) {
            keyspace.close();
        }
    }

    @Test
    void testKeyspaceLifecycleAndBatches() {
        assertThat(keyspace.exists()).isFalse();

        keyspace.execute(
                CqlStatement.of(
                        "CREATE KEYSPACE "
                                + KEYSPACE
                                + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 1}"));
        keyspace.execute(
                CqlStatement.of(
                        "CREATE TABLE "
                                + KEYSPACE
                                + ".posts (id int PRIMARY KEY, title text)"));
        assertThat(keyspace.exists()).isTrue();

        keyspace.batch(
                BatchOptions.builder().setAutoApply(2).build(),
                batch -> {
                    for (int i = 0; i < 5; i++) {
                        keyspace.write(insert(i));
                    }
                    assertThat(batch.getContext().getFlushCount()).isEqualTo(2);
                });
        assertThat(countPosts()).isEqualTo(5L);

        assertThatThrownBy(
                        () ->
                                keyspace.batch(
                                        BatchOptions.builder()
                                                .setConsistency(ConsistencyLevel.ONE)
                                                .build(),
                                        batch -> {
                                            keyspace.write(insert(10));
                                            keyspace.write(
                                                    insert(11)
                                                            .withConsistency(
                                                                    ConsistencyLevel.ALL));
                                        }))
                .isInstanceOf(BatchConfigurationException.class);
        assertThat(countPosts()).isEqualTo(5L);

        keyspace.batch(
                BatchOptions.builder().setUnlogged(true).build(),
                batch -> keyspace.write(insert(20)));
        assertThat(countPosts()).isEqualTo(6L);
    }

    private static CqlStatement insert(int id) {
        return CqlStatement.of(
                "INSERT INTO " + KEYSPACE + ".posts (id, title) VALUES (?, ?)", id, "post " + id);
    }

    private static long countPosts() {
        return keyspace.execute(CqlStatement.of("SELECT COUNT(*) FROM " + KEYSPACE + ".posts"))
                .one()
                .getLong(0);
    }
}
