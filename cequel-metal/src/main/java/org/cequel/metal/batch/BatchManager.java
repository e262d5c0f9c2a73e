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

import org.apache.flink.annotation.Internal;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.function.ThrowingConsumer;
import org.cequel.metal.execution.StatementExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** Tracks the batch scope open on each thread for one {@link org.cequel.metal.Keyspace}. */
@Internal
public class BatchManager {

    private static final Logger LOG = LoggerFactory.getLogger(BatchManager.class);

    private final StatementExecutor executor;
    private final ThreadLocal<BatchContext> currentBatch = new ThreadLocal<>();

    public BatchManager(StatementExecutor executor) {
        this.executor = Preconditions.checkNotNull(executor, "StatementExecutor cannot be null");
    }

    /**
     * Opens a batch scope on the current thread, or joins the one already open.
     *
     * @param options options of the batch; ignored when joining an open batch
     * @return the scope guard
     */
    public BatchScope open(BatchOptions options) {
        Preconditions.checkNotNull(options, "BatchOptions cannot be null");
        BatchContext existing = currentBatch.get();
        if (existing != null) {
            LOG.debug("Joining the batch already open on this thread, ignoring {}", options);
            return new BatchScope(this, existing, false);
        }
        BatchContext context = new BatchContext(options, executor);
        currentBatch.set(context);
        return new BatchScope(this, context, true);
    }

    /**
     * Runs a block inside a batch scope. The batch is flushed when the block returns normally and
     * discarded when it throws; the exception is rethrown unchanged.
     *
     * @param options options of the batch
     * @param block the block issuing write statements
     * @param <E> exception type thrown by the block
     * @throws E if the block throws
     */
    public <E extends Throwable> void batch(
            BatchOptions options, ThrowingConsumer<BatchScope, E> block) throws E {
        Preconditions.checkNotNull(block, "block cannot be null");
        try (BatchScope scope = open(options)) {
            block.accept(scope);
            scope.complete();
        }
    }

    /** The batch open on the current thread, if any. */
    public Optional<BatchContext> current() {
        return Optional.ofNullable(currentBatch.get());
    }

    void detach(BatchContext context) {
        if (currentBatch.get() == context) {
            currentBatch.remove();
        }
    }
}
