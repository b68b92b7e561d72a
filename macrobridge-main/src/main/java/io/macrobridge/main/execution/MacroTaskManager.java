/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.macrobridge.main.execution;

import com.google.inject.Inject;
import io.airlift.units.Duration;
import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.base.client.duckdb.DuckDBConfig;
import jakarta.annotation.PreDestroy;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static io.airlift.concurrent.Threads.threadsNamed;
import static io.macrobridge.base.metadata.StandardErrorCode.EXCEEDED_TIME_LIMIT;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.supplyAsync;
import static java.util.concurrent.Executors.newFixedThreadPool;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs database work on a fixed pool, so the number of per-thread cursors never exceeds
 * {@code duckdb.max-concurrent-tasks}.
 */
public class MacroTaskManager
        implements Closeable
{
    private final ExecutorService taskExecutorService;
    private final Duration queryTimeout;
    private final Duration connectionTimeout;

    @Inject
    public MacroTaskManager(DuckDBConfig duckDBConfig)
    {
        requireNonNull(duckDBConfig, "duckDBConfig is null");
        this.taskExecutorService = newFixedThreadPool(duckDBConfig.getMaxConcurrentTasks(), threadsNamed("macro-task-%s"));
        this.queryTimeout = duckDBConfig.getQueryTimeout();
        this.connectionTimeout = duckDBConfig.getConnectionTimeout();
    }

    public <T> CompletableFuture<T> addQueryTask(Supplier<T> task)
    {
        return withTimeout(supplyAsync(task, taskExecutorService), queryTimeout, "Query time limit exceeded");
    }

    public <T> CompletableFuture<T> addConnectionTask(Supplier<T> task)
    {
        return withTimeout(supplyAsync(task, taskExecutorService), connectionTimeout, "Connection time limit exceeded");
    }

    private static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, Duration timeout, String message)
    {
        return future
                .orTimeout(timeout.toMillis(), MILLISECONDS)
                .exceptionally(throwable -> {
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable;
                    if (cause instanceof TimeoutException) {
                        throw new MacroBridgeException(EXCEEDED_TIME_LIMIT, message + ": " + timeout, cause);
                    }
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new CompletionException(cause);
                });
    }

    @PreDestroy
    @Override
    public void close()
    {
        taskExecutorService.shutdownNow();
    }
}
