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

package io.macrobridge.main.route;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.base.MacroNotFoundException;
import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.base.macro.MacroNames;
import io.macrobridge.main.catalog.MacroCatalogService;
import io.macrobridge.main.execution.MacroExecutionEngine;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static io.macrobridge.base.metadata.StandardErrorCode.METHOD_NOT_ALLOWED;
import static io.macrobridge.main.route.MacroRoute.InputShape.BODY;
import static io.macrobridge.main.route.MacroRoute.InputShape.QUERY_STRING;
import static io.macrobridge.main.route.MacroRoute.Method.GET;
import static io.macrobridge.main.route.MacroRoute.Method.POST;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps every discovered macro to externally reachable routes: {@code GET} for every macro and
 * additionally {@code POST} for table macros. Registration is additive and keyed by macro name.
 */
public class MacroRouteSynthesizer
{
    private static final Logger LOG = Logger.get(MacroRouteSynthesizer.class);

    private final MacroCatalogService catalogService;
    private final MacroExecutionEngine executionEngine;

    // guarded by this
    private final Set<String> registered = new HashSet<>();
    private final AtomicReference<RouteSet> routeSet = new AtomicReference<>(RouteSet.empty());

    @Inject
    public MacroRouteSynthesizer(MacroCatalogService catalogService, MacroExecutionEngine executionEngine)
    {
        this.catalogService = requireNonNull(catalogService, "catalogService is null");
        this.executionEngine = requireNonNull(executionEngine, "executionEngine is null");
    }

    public RouteSet generateAll()
    {
        return generateAll(catalogService.discover());
    }

    public synchronized RouteSet generateAll(Collection<MacroDescriptor> catalog)
    {
        ImmutableList.Builder<MacroRoute> added = ImmutableList.builder();
        for (MacroDescriptor descriptor : catalog) {
            if (!registered.add(descriptor.getName())) {
                continue;
            }
            added.add(new MacroRoute(descriptor, GET, QUERY_STRING, input -> executionEngine.execute(descriptor.getName(), dropBlankValues(input))));
            if (descriptor.isTableMacro()) {
                added.add(new MacroRoute(descriptor, POST, BODY, input -> executionEngine.execute(descriptor.getName(), input)));
            }
        }
        ImmutableList<MacroRoute> routes = added.build();
        if (routes.isEmpty()) {
            return routeSet.get();
        }
        RouteSet updated = routeSet.updateAndGet(current -> current.withRoutes(routes));
        LOG.info("Registered %s routes, %s routes in total", routes.size(), updated.size());
        return updated;
    }

    public RouteSet getRouteSet()
    {
        return routeSet.get();
    }

    /**
     * Executes the route registered for the macro and verb. Macros created after the last
     * generation are picked up by generating routes once more.
     */
    public ExecutionResult dispatch(MacroRoute.Method method, String macroName, Map<String, ?> input)
    {
        MacroNames.checkValid(macroName);
        RouteSet routes = routeSet.get();
        if (!routes.contains(macroName)) {
            routes = generateAll();
        }

        Optional<MacroRoute> route = routes.find(macroName, method);
        if (route.isPresent()) {
            return route.get().handle(input);
        }
        if (routes.contains(macroName)) {
            throw new MacroBridgeException(METHOD_NOT_ALLOWED, format("Macro '%s' does not accept %s requests, allowed: %s", macroName, method, routes.getMethods(macroName)));
        }
        throw new MacroNotFoundException(macroName, ImmutableList.copyOf(routes.getNames()));
    }

    private static Map<String, ?> dropBlankValues(Map<String, ?> input)
    {
        Map<String, Object> filtered = new LinkedHashMap<>();
        input.forEach((name, value) -> {
            if (value != null && !(value instanceof String && ((String) value).isBlank())) {
                filtered.put(name, value);
            }
        });
        return filtered;
    }
}
