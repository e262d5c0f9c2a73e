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
import org.cequel.metal.statement.CqlStatement;

/**
 * Guard object of a batch scope, meant for try-with-resources:
 *
 * <pre>{@code
 * try (BatchScope batch = keyspace.openBatch(BatchOptions.DEFAULTS)) {
 *     keyspace.write(insert);
 *     keyspace.write(update);
 *     batch.complete();
 * }
 * }</pre>
 *
 * <p>Reaching {@link #complete()} flushes the remaining statements. Leaving the block without it,
 * e.g. because of an exception, discards them.
 *
 * <p>A scope opened while another scope is open on the same thread joins the outer batch: its
 * options are ignored, and neither {@link #complete()} nor {@link #close()} of the inner scope
 * affect the batch. Only the outermost scope flushes.
 */
@PublicEvolving
public final class BatchScope implements AutoCloseable {

    private final BatchManager manager;
    private final BatchContext context;
    private final boolean outermost;
    private boolean closed;

    BatchScope(BatchManager manager, BatchContext context, boolean outermost) {
        this.manager = manager;
        this.context = context;
        this.outermost = outermost;
    }

    /** Adds a write statement to the batch. See {@link BatchContext#append(CqlStatement)}. */
    public void append(CqlStatement statement) {
        context.append(statement);
    }

    /** Sends the buffered statements now. See {@link BatchContext#flush()}. */
    public void flush() {
        context.flush();
    }

    /** Marks the scope as completed normally; the outermost scope flushes what is left. */
    public void complete() {
        if (outermost) {
            context.complete();
        }
    }

    public BatchContext getContext() {
        return context;
    }

    public boolean isOutermost() {
        return outermost;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (outermost) {
            try {
                context.close();
            } finally {
                manager.detach(context);
            }
        }
    }
}
