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

import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * One entry of the dispatch table: a verb on the path of one macro, bound to a handler
 * parameterized by the macro's descriptor.
 */
public final class MacroRoute
{
    public enum Method
    {
        GET,
        POST,
    }

    public enum InputShape
    {
        QUERY_STRING,
        BODY,
    }

    private final MacroDescriptor descriptor;
    private final Method method;
    private final InputShape inputShape;
    private final Function<Map<String, ?>, ExecutionResult> handler;

    public MacroRoute(MacroDescriptor descriptor, Method method, InputShape inputShape, Function<Map<String, ?>, ExecutionResult> handler)
    {
        this.descriptor = requireNonNull(descriptor, "descriptor is null");
        this.method = requireNonNull(method, "method is null");
        this.inputShape = requireNonNull(inputShape, "inputShape is null");
        this.handler = requireNonNull(handler, "handler is null");
    }

    public String getName()
    {
        return descriptor.getName();
    }

    public String getPath()
    {
        return "/" + descriptor.getName();
    }

    public MacroDescriptor getDescriptor()
    {
        return descriptor;
    }

    public Method getMethod()
    {
        return method;
    }

    public InputShape getInputShape()
    {
        return inputShape;
    }

    public ExecutionResult handle(Map<String, ?> input)
    {
        return handler.apply(input);
    }

    // the handler is derived from the other fields
    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MacroRoute that = (MacroRoute) o;
        return Objects.equals(descriptor, that.descriptor) &&
                method == that.method &&
                inputShape == that.inputShape;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(descriptor, method, inputShape);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("method", method)
                .add("path", getPath())
                .add("inputShape", inputShape)
                .toString();
    }
}
