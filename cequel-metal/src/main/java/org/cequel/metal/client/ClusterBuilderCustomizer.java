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

import org.apache.flink.annotation.PublicEvolving;

import com.datastax.driver.core.Cluster;

import java.util.Map;

/**
 * Hook that receives the client options not recognized by this layer and may apply them to the
 * driver's {@link Cluster.Builder}. It runs after every recognized option has been applied.
 */
@PublicEvolving
@FunctionalInterface
public interface ClusterBuilderCustomizer {

    /** Customizer that leaves the builder untouched. */
    ClusterBuilderCustomizer NO_OP = (builder, clientOptions) -> {};

    void customize(Cluster.Builder builder, Map<String, Object> clientOptions);
}
