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

package io.macrobridge.main;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.macrobridge.base.client.duckdb.DuckDBConnectionManager;
import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.base.macro.MacroNames;
import io.macrobridge.main.catalog.MacroCatalogService;
import io.macrobridge.main.execution.MacroExecutionEngine;
import io.macrobridge.main.execution.MacroTaskManager;
import io.macrobridge.main.route.MacroRoute;
import io.macrobridge.main.route.MacroRouteSynthesizer;
import io.macrobridge.main.route.RouteSet;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of the web layer. Every call runs on the task pool of {@link MacroTaskManager}.
 */
public class MacroService
{
    private static final Logger LOG = Logger.get(MacroService.class);

    private final MacroCatalogService catalogService;
    private final MacroExecutionEngine executionEngine;
    private final MacroRouteSynthesizer routeSynthesizer;
    private final MacroTaskManager taskManager;
    private final DuckDBConnectionManager connectionManager;

    private volatile boolean isWarmed;

    @Inject
    public MacroService(
            MacroCatalogService catalogService,
            MacroExecutionEngine executionEngine,
            MacroRouteSynthesizer routeSynthesizer,
            MacroTaskManager taskManager,
            DuckDBConnectionManager connectionManager)
    {
        this.catalogService = requireNonNull(catalogService, "catalogService is null");
        this.executionEngine = requireNonNull(executionEngine, "executionEngine is null");
        this.routeSynthesizer = requireNonNull(routeSynthesizer, "routeSynthesizer is null");
        this.taskManager = requireNonNull(taskManager, "taskManager is null");
        this.connectionManager = requireNonNull(connectionManager, "connectionManager is null");
    }

    public CompletableFuture<List<MacroDescriptor>> listMacros()
    {
        return taskManager.addQueryTask(catalogService::discover);
    }

    public CompletableFuture<MacroDescriptor> getMacro(String macroName)
    {
        return taskManager.addQueryTask(() -> catalogService.getByName(MacroNames.checkValid(macroName)));
    }

    public CompletableFuture<ExecutionResult> execute(String macroName, Map<String, ?> parameters)
    {
        return taskManager.addQueryTask(() -> executionEngine.execute(macroName, parameters));
    }

    public CompletableFuture<ExecutionResult> dispatch(MacroRoute.Method method, String macroName, Map<String, ?> input)
    {
        return taskManager.addQueryTask(() -> routeSynthesizer.dispatch(method, macroName, input));
    }

    public CompletableFuture<Boolean> testConnection()
    {
        return taskManager.addConnectionTask(connectionManager::testConnection);
    }

    public boolean isWarmed()
    {
        return isWarmed;
    }

    public void warmUp()
    {
        taskManager.addQueryTask(() -> {
                    catalogService.primeCache();
                    return routeSynthesizer.generateAll(catalogService.getCachedMacros().values());
                })
                .thenAccept(routes -> {
                    isWarmed = true;
                    LOG.info("Warm up done, %s routes registered", routes.size());
                })
                .join();
    }

    public RouteSet getRouteSet()
    {
        return routeSynthesizer.getRouteSet();
    }
}
