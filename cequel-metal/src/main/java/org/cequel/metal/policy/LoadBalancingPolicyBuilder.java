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

package org.cequel.metal.policy;

import org.apache.flink.annotation.Internal;

import com.datastax.driver.core.policies.DCAwareRoundRobinPolicy;
import com.datastax.driver.core.policies.LoadBalancingPolicy;
import com.datastax.driver.core.policies.TokenAwarePolicy;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.util.Optional;

/**
 * Composes the load balancing policy handed to the driver when a connection is built.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>An explicitly supplied policy is returned unchanged, whatever the datacenter.
 *   <li>A datacenter yields a {@link TokenAwarePolicy} wrapping a {@link DCAwareRoundRobinPolicy}
 *       whose local datacenter is that datacenter.
 *   <li>Otherwise no policy is returned and the driver default applies.
 * </ol>
 *
 * <p>Driver policies are stateful once a cluster initializes them, so a new policy is created for
 * every call rather than cached.
 */
@Internal
public final class LoadBalancingPolicyBuilder {

    private LoadBalancingPolicyBuilder() {}

    public static Optional<LoadBalancingPolicy> build(
            @Nullable String datacenter, @Nullable LoadBalancingPolicy explicitPolicy) {
        if (explicitPolicy != null) {
            return Optional.of(explicitPolicy);
        }
        if (StringUtils.isEmpty(datacenter)) {
            return Optional.empty();
        }
        return Optional.of(
                new TokenAwarePolicy(
                        DCAwareRoundRobinPolicy.builder().withLocalDc(datacenter).build()));
    }
}
