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

package io.macrobridge.base.macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Typed parameter values of one invocation, keyed by declared parameter name. A key mapped to
 * {@code null} was supplied and binds SQL NULL; a missing key was not supplied at all.
 */
public final class CoercedParameters
{
    private final MacroDescriptor descriptor;
    private final Map<String, Object> values;

    public CoercedParameters(MacroDescriptor descriptor, Map<String, Object> values)
    {
        this.descriptor = requireNonNull(descriptor, "descriptor is null");
        requireNonNull(values, "values is null");
        for (String name : values.keySet()) {
            checkArgument(descriptor.getParameters().contains(name), "%s is not a parameter of macro %s", name, descriptor.getName());
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String name : descriptor.getParameters()) {
            if (values.containsKey(name)) {
                ordered.put(name, values.get(name));
            }
        }
        this.values = Collections.unmodifiableMap(ordered);
    }

    public boolean isSupplied(String name)
    {
        return values.containsKey(name);
    }

    public Object get(String name)
    {
        return values.get(name);
    }

    public int size()
    {
        return values.size();
    }

    public Map<String, Object> asMap()
    {
        return values;
    }

    /**
     * Values to bind, in declared parameter order. Parameters that were not supplied are skipped.
     */
    public List<Object> toPositionalArguments()
    {
        return Collections.unmodifiableList(new ArrayList<>(values.values()));
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
        CoercedParameters that = (CoercedParameters) o;
        return Objects.equals(descriptor, that.descriptor) &&
                Objects.equals(values, that.values);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(descriptor, values);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("macro", descriptor.getName())
                .add("values", values)
                .toString();
    }
}
