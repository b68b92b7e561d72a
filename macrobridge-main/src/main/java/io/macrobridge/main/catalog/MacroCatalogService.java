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

package io.macrobridge.main.catalog;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.base.MacroNotFoundException;
import io.macrobridge.base.client.duckdb.DuckDBConnectionManager;
import io.macrobridge.base.client.jdbc.JdbcRecordIterator;
import io.macrobridge.base.config.MacroConfig;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.base.macro.MacroKind;
import io.macrobridge.base.macro.MacroNames;
import org.intellij.lang.annotations.Language;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static io.macrobridge.base.macro.MacroDescriptor.UNKNOWN_TYPE;
import static io.macrobridge.base.metadata.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Discovers the macros of the attached database and keeps a name keyed cache of them.
 * The cache is only ever replaced as a whole, by the most recent completed discovery.
 */
public class MacroCatalogService
{
    private static final Logger LOG = Logger.get(MacroCatalogService.class);

    @Language("SQL")
    public static final String DISCOVERY_SQL = "SELECT function_name, parameters, parameter_types, return_type, macro_definition, function_type\n" +
            "FROM duckdb_functions()\n" +
            "WHERE function_type IN ('macro', 'table_macro') AND internal = false\n" +
            "ORDER BY function_name, len(parameters)";

    private static final String TABLE_MACRO_TAG = "table_macro";
    private static final Pattern TABLE_DEFINITION = Pattern.compile("\\b(TABLE|SELECT)\\b", Pattern.CASE_INSENSITIVE);

    private final DuckDBConnectionManager connectionManager;
    private final boolean sniffDefinitionKind;
    private final AtomicReference<Map<String, MacroDescriptor>> cache = new AtomicReference<>(ImmutableMap.of());

    @Inject
    public MacroCatalogService(DuckDBConnectionManager connectionManager, MacroConfig macroConfig)
    {
        this.connectionManager = requireNonNull(connectionManager, "connectionManager is null");
        this.sniffDefinitionKind = requireNonNull(macroConfig, "macroConfig is null").isSniffDefinitionKind();
    }

    public List<MacroDescriptor> discover()
    {
        Map<String, MacroDescriptor> discovered = new LinkedHashMap<>();
        try (JdbcRecordIterator iterator = JdbcRecordIterator.of(connectionManager.acquire(), DISCOVERY_SQL)) {
            while (iterator.hasNext()) {
                parseRow(iterator.next()).ifPresent(descriptor -> {
                    // overloads share a name, the first one wins
                    if (discovered.putIfAbsent(descriptor.getName(), descriptor) != null) {
                        LOG.warn("Macro %s is overloaded, only the first definition is exposed", descriptor.getName());
                    }
                });
            }
        }
        catch (SQLException e) {
            LOG.error(e, "Failed to discover macros");
            throw new MacroBridgeException(GENERIC_INTERNAL_ERROR, "Failed to discover macros: " + e.getMessage(), e);
        }

        cache.set(ImmutableMap.copyOf(discovered));
        LOG.info("Discovered %s macros", discovered.size());
        return ImmutableList.copyOf(discovered.values());
    }

    public MacroDescriptor getByName(String name)
    {
        MacroDescriptor descriptor = cache.get().get(name);
        if (descriptor != null) {
            return descriptor;
        }
        LOG.debug("Macro %s is not cached, refreshing the catalog", name);
        discover();
        descriptor = cache.get().get(name);
        if (descriptor == null) {
            throw new MacroNotFoundException(name, getCachedNames());
        }
        return descriptor;
    }

    public void primeCache()
    {
        discover();
    }

    public List<String> getCachedNames()
    {
        return ImmutableList.copyOf(cache.get().keySet());
    }

    public Map<String, MacroDescriptor> getCachedMacros()
    {
        return cache.get();
    }

    @VisibleForTesting
    Optional<MacroDescriptor> parseRow(List<Object> row)
    {
        String name = (String) row.get(0);
        if (!MacroNames.isValid(name)) {
            LOG.warn("Skipping macro %s, the name is not a valid identifier", name);
            return Optional.empty();
        }

        List<String> parameters = toStringList(row.get(1));
        List<String> declaredTypes = toStringList(row.get(2));
        List<String> parameterTypes = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            String type = i < declaredTypes.size() ? declaredTypes.get(i) : null;
            parameterTypes.add(type == null ? UNKNOWN_TYPE : type);
        }

        String returnType = row.get(3) == null ? UNKNOWN_TYPE : row.get(3).toString();
        String definition = row.get(4) == null ? "" : row.get(4).toString();
        String functionType = row.get(5) == null ? "" : row.get(5).toString();
        return Optional.of(new MacroDescriptor(name, parameters, parameterTypes, returnType, classify(functionType, definition)));
    }

    @VisibleForTesting
    MacroKind classify(String functionType, String definition)
    {
        if (TABLE_MACRO_TAG.equalsIgnoreCase(functionType)) {
            return MacroKind.TABLE;
        }
        if (sniffDefinitionKind && TABLE_DEFINITION.matcher(definition).find()) {
            return MacroKind.TABLE;
        }
        return MacroKind.SCALAR;
    }

    private static List<String> toStringList(Object value)
    {
        if (!(value instanceof List)) {
            return ImmutableList.of();
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<?>) value) {
            strings.add(element == null ? null : element.toString());
        }
        return strings;
    }
}
