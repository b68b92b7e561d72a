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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.base.MacroExecutionException;
import io.macrobridge.base.MacroNotFoundException;
import io.macrobridge.base.client.duckdb.DuckDBConnectionManager;
import io.macrobridge.base.client.jdbc.JdbcRecordIterator;
import io.macrobridge.base.macro.CoercedParameters;
import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.base.macro.MacroNames;
import io.macrobridge.base.macro.MacroParameterCoercer;
import io.macrobridge.main.catalog.MacroCatalogService;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.airlift.units.Duration.nanosSince;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

public class MacroExecutionEngine
{
    private static final Logger LOG = Logger.get(MacroExecutionEngine.class);
    private static final String MISSING_OBJECT_MESSAGE = "does not exist";

    private final MacroCatalogService catalogService;
    private final MacroParameterCoercer coercer;
    private final DuckDBConnectionManager connectionManager;

    @Inject
    public MacroExecutionEngine(
            MacroCatalogService catalogService,
            MacroParameterCoercer coercer,
            DuckDBConnectionManager connectionManager)
    {
        this.catalogService = requireNonNull(catalogService, "catalogService is null");
        this.coercer = requireNonNull(coercer, "coercer is null");
        this.connectionManager = requireNonNull(connectionManager, "connectionManager is null");
    }

    /**
     * Runs a macro on the cursor of the calling thread. Unknown macros and invalid parameters
     * are reported before any statement is sent to the database.
     */
    public ExecutionResult execute(String macroName, Map<String, ?> rawParameters)
    {
        MacroNames.checkValid(macroName);
        MacroDescriptor descriptor = catalogService.getByName(macroName);
        CoercedParameters parameters = coercer.validate(descriptor, rawParameters == null ? Collections.emptyMap() : rawParameters);
        List<Object> arguments = parameters.toPositionalArguments().stream()
                .map(MacroExecutionEngine::toBindableValue)
                .collect(ImmutableList.toImmutableList());
        String sql = buildStatement(descriptor, arguments.size());
        LOG.debug("Executing macro %s with %s arguments", macroName, arguments.size());

        long start = System.nanoTime();
        try (JdbcRecordIterator iterator = JdbcRecordIterator.of(connectionManager.acquire(), sql, arguments)) {
            if (descriptor.isTableMacro()) {
                List<String> columns = iterator.getColumnNames();
                List<List<Object>> rows = ImmutableList.copyOf(iterator);
                return ExecutionResult.tableResult(columns, rows, elapsedMillis(start));
            }
            Object value = iterator.hasNext() ? iterator.next().get(0) : null;
            return ExecutionResult.scalarResult(value, elapsedMillis(start));
        }
        catch (MacroBridgeException e) {
            throw e;
        }
        catch (Exception e) {
            String message = String.valueOf(e.getMessage());
            // the driver reports no structured code for missing catalog entries
            if (message.contains(MISSING_OBJECT_MESSAGE)) {
                LOG.warn("Macro %s disappeared from the database: %s", macroName, message);
                throw new MacroNotFoundException(macroName, catalogService.getCachedNames(), e);
            }
            LOG.error(e, "Failed to execute macro %s", macroName);
            throw new MacroExecutionException(macroName, message, e);
        }
    }

    @VisibleForTesting
    static String buildStatement(MacroDescriptor descriptor, int argumentCount)
    {
        String invocation = format("%s(%s)", MacroNames.checkValid(descriptor.getName()), String.join(", ", Collections.nCopies(argumentCount, "?")));
        if (descriptor.isTableMacro()) {
            return "SELECT * FROM " + invocation;
        }
        return "SELECT " + invocation;
    }

    private static Object toBindableValue(Object value)
    {
        if (value instanceof Map || value instanceof List) {
            return MacroParameterCoercer.toJson(value);
        }
        return value;
    }

    private static double elapsedMillis(long startNanos)
    {
        return nanosSince(startNanos).getValue(MILLISECONDS);
    }
}
