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

package org.cequel.metal.statement;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.util.Preconditions;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.SimpleStatement;
import com.datastax.driver.core.Statement;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable CQL statement with positional bind values and an optional consistency override.
 *
 * <p>Statements are produced by the layers above this one (statement builders, mappers); this
 * class does not interpret the CQL text.
 */
@PublicEvolving
public final class CqlStatement implements Executable {

    private final String cql;
    private final List<Object> values;
    @Nullable private final ConsistencyLevel consistency;

    private CqlStatement(String cql, List<Object> values, @Nullable ConsistencyLevel consistency) {
        this.cql = cql;
        this.values = values;
        this.consistency = consistency;
    }

    /**
     * Creates a statement without consistency override.
     *
     * @param cql the CQL text, possibly containing {@code ?} bind markers
     * @param values values for the bind markers, in order; may contain {@code null}
     * @return the statement
     */
    public static CqlStatement of(String cql, Object... values) {
        Preconditions.checkArgument(StringUtils.isNotBlank(cql), "CQL cannot be empty");
        Preconditions.checkNotNull(values, "values cannot be null");
        return new CqlStatement(
                cql, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))), null);
    }

    /** Returns a copy of this statement that requests the given consistency level. */
    public CqlStatement withConsistency(@Nullable ConsistencyLevel consistency) {
        return new CqlStatement(cql, values, consistency);
    }

    public String getCql() {
        return cql;
    }

    public List<Object> getValues() {
        return values;
    }

    @Override
    public Optional<ConsistencyLevel> getConsistency() {
        return Optional.ofNullable(consistency);
    }

    @Override
    public String toCql() {
        return cql;
    }

    @Override
    public Statement toDriverStatement(ConsistencyLevel consistency) {
        return new SimpleStatement(cql, values.toArray()).setConsistencyLevel(consistency);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CqlStatement that = (CqlStatement) o;
        return cql.equals(that.cql)
                && values.equals(that.values)
                && consistency == that.consistency;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cql, values, consistency);
    }

    @Override
    public String toString() {
        return "CqlStatement{cql='"
                + cql
                + "', values="
                + values
                + (consistency == null ? "" : ", consistency=" + consistency)
                + '}';
    }
}
