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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Immutable dispatch table from macro name and verb to route.
 */
public final class RouteSet
{
    private static final RouteSet EMPTY = new RouteSet(ImmutableMap.of());

    private final Map<String, Map<MacroRoute.Method, MacroRoute>> routes;

    public static RouteSet empty()
    {
        return EMPTY;
    }

    private RouteSet(Map<String, Map<MacroRoute.Method, MacroRoute>> routes)
    {
        this.routes = routes;
    }

    /**
     * Returns a table holding these routes and the given ones. A route never replaces an existing one.
     */
    public RouteSet withRoutes(Collection<MacroRoute> additional)
    {
        Map<String, Map<MacroRoute.Method, MacroRoute>> merged = new LinkedHashMap<>();
        routes.forEach((name, byMethod) -> merged.put(name, new LinkedHashMap<>(byMethod)));
        for (MacroRoute route : additional) {
            merged.computeIfAbsent(route.getName(), ignored -> new LinkedHashMap<>())
                    .putIfAbsent(route.getMethod(), route);
        }
        ImmutableMap.Builder<String, Map<MacroRoute.Method, MacroRoute>> builder = ImmutableMap.builder();
        merged.forEach((name, byMethod) -> builder.put(name, ImmutableMap.copyOf(byMethod)));
        return new RouteSet(builder.buildOrThrow());
    }

    public Optional<MacroRoute> find(String name, MacroRoute.Method method)
    {
        return Optional.ofNullable(routes.getOrDefault(name, ImmutableMap.of()).get(method));
    }

    public boolean contains(String name)
    {
        return routes.containsKey(name);
    }

    public Set<MacroRoute.Method> getMethods(String name)
    {
        return routes.getOrDefault(name, ImmutableMap.of()).keySet();
    }

    public Set<String> getNames()
    {
        return ImmutableSet.copyOf(routes.keySet());
    }

    public List<MacroRoute> getRoutes()
    {
        return routes.values().stream()
                .flatMap(byMethod -> byMethod.values().stream())
                .collect(ImmutableList.toImmutableList());
    }

    public int size()
    {
        return routes.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RouteSet that = (RouteSet) o;
        return Objects.equals(routes, that.routes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(routes);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("routes", getRoutes())
                .toString();
    }
}
