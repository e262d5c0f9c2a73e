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
import org.apache.flink.util.Preconditions;
import org.cequel.metal.exception.BatchConfigurationException;
import org.cequel.metal.execution.StatementExecutor;
import org.cequel.metal.statement.CqlBatch;
import org.cequel.metal.statement.CqlStatement;

import com.datastax.driver.core.ConsistencyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Buffers the write statements of one batch scope and sends them as batches.
 *
 * <h3>Lifecycle</h3>
 *
 * <pre>
 *   OPEN --complete()--&gt; FLUSHED
 *   OPEN --close() without complete()--&gt; ABORTED   (buffer discarded)
 *   OPEN --append() with conflicting consistency--&gt; ABORTED
 * </pre>
 *
 * <p>While {@code OPEN}, the buffer is sent as one batch whenever it reaches the {@code
 * auto_apply} threshold or {@link #flush()} is called. Batches already sent stay applied when the
 * scope is aborted later: each flushed chunk is applied at most once, but the scope as a whole is
 * not all-or-nothing once auto-apply is used.
 *
 * <p>A context is confined to the thread that opened it and is not safe for concurrent use.
 */
@PublicEvolving
public class BatchContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchContext.class);

    /** State of a batch context. */
    public enum State {
        OPEN,
        FLUSHED,
        ABORTED
    }

    private final BatchOptions options;
    private final StatementExecutor executor;
    private final List<CqlStatement> buffer = new ArrayList<>();

    private State state = State.OPEN;
    private int flushCount;

    public BatchContext(BatchOptions options, StatementExecutor executor) {
        this.options = Preconditions.checkNotNull(options, "BatchOptions cannot be null");
        this.executor = Preconditions.checkNotNull(executor, "StatementExecutor cannot be null");
    }

    /**
     * Adds a statement to the buffer, flushing if the {@code auto_apply} threshold is reached.
     *
     * @param statement the write statement
     * @throws BatchConfigurationException if the statement requests a consistency level other than
     *     the batch level; the context is aborted and its buffer discarded
     * @throws IllegalStateException if the context is no longer open
     */
    public void append(CqlStatement statement) {
        Preconditions.checkNotNull(statement, "statement cannot be null");
        checkOpen();

        Optional<ConsistencyLevel> statementConsistency = statement.getConsistency();
        ConsistencyLevel batchConsistency = options.getConsistency().orElse(null);
        if (statementConsistency.isPresent() && statementConsistency.get() != batchConsistency) {
            abort();
            throw new BatchConfigurationException(statementConsistency.get(), batchConsistency);
        }

        buffer.add(statement);
        Optional<Integer> autoApply = options.getAutoApply();
        if (autoApply.isPresent() && buffer.size() >= autoApply.get()) {
            flush();
        }
    }

    /**
     * Sends the buffered statements as one batch and clears the buffer. Does nothing when the
     * buffer is empty. The context stays open.
     *
     * @throws IllegalStateException if the context is no longer open
     */
    public void flush() {
        checkOpen();
        if (buffer.isEmpty()) {
            return;
        }
        CqlBatch batch = new CqlBatch(options.getBatchType(), buffer);
        buffer.clear();
        executor.execute(batch, options.getConsistency().orElse(null));
        flushCount++;
    }

    /**
     * Completes the scope normally: flushes what is left and moves to {@link State#FLUSHED}.
     * Completing an already completed context does nothing.
     *
     * @throws IllegalStateException if the context was aborted
     */
    public void complete() {
        if (state == State.FLUSHED) {
            return;
        }
        checkOpen();
        flush();
        state = State.FLUSHED;
    }

    /**
     * Ends the scope. If {@link #complete()} was not called, pending statements are discarded
     * without being sent and the context moves to {@link State#ABORTED}.
     */
    @Override
    public void close() {
        if (state == State.OPEN) {
            if (!buffer.isEmpty()) {
                LOG.debug(
                        "Discarding {} unsent statement(s) of an incomplete batch",
                        buffer.size());
            }
            abort();
        }
    }

    public State getState() {
        return state;
    }

    public BatchOptions getOptions() {
        return options;
    }

    /** Number of statements buffered and not yet sent. */
    public int getPendingCount() {
        return buffer.size();
    }

    /** Number of batches sent so far. */
    public int getFlushCount() {
        return flushCount;
    }

    private void abort() {
        buffer.clear();
        state = State.ABORTED;
    }

    private void checkOpen() {
        Preconditions.checkState(
                state == State.OPEN, "Batch is %s and no longer accepts operations", state);
    }
}
