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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class MacroDescriptor
{
    public static final String UNKNOWN_TYPE = "UNKNOWN";

    private final String name;
    private final List<String> parameters;
    private final List<String> parameterTypes;
    private final String returnType;
    private final MacroKind kind;

    public static MacroDescriptor scalarMacro(String name, List<String> parameters, List<String> parameterTypes)
    {
        return new MacroDescriptor(name, parameters, parameterTypes, UNKNOWN_TYPE, MacroKind.SCALAR);
    }

    public static MacroDescriptor tableMacro(String name, List<String> parameters, List<String> parameterTypes)
    {
        return new MacroDescriptor(name, parameters, parameterTypes, UNKNOWN_TYPE, MacroKind.TABLE);
    }

    @JsonCreator
    public MacroDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<String> parameters,
            @JsonProperty("parameter_types") List<String> parameterTypes,
            @JsonProperty("return_type") String returnType,
            @JsonProperty("macro_type") MacroKind kind)
    {
        this.name = MacroNames.checkValid(name);
        this.parameters = ImmutableList.copyOf(requireNonNull(parameters, "parameters is null"));
        this.parameterTypes = ImmutableList.copyOf(requireNonNull(parameterTypes, "parameterTypes is null"));
        checkArgument(this.parameters.size() == this.parameterTypes.size(),
                "macro %s declares %s parameters but %s parameter types", name, this.parameters.size(), this.parameterTypes.size());
        this.returnType = returnType == null ? UNKNOWN_TYPE : returnType;
        this.kind = requireNonNull(kind, "kind is null");
    }

    @JsonProperty
    public String getName()
    {
        return name;
    }

    @JsonProperty
    public List<String> getParameters()
    {
        return parameters;
    }

    @JsonProperty("parameter_types")
    public List<String> getParameterTypes()
    {
        return parameterTypes;
    }

    @JsonProperty("return_type")
    public String getReturnType()
    {
        return returnType;
    }

    @JsonProperty("macro_type")
    public MacroKind getKind()
    {
        return kind;
    }

    public boolean isTableMacro()
    {
        return kind == MacroKind.TABLE;
    }

    public int getParameterIndex(String parameterName)
    {
        return parameters.indexOf(parameterName);
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
        MacroDescriptor that = (MacroDescriptor) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(parameterTypes, that.parameterTypes) &&
                Objects.equals(returnType, that.returnType) &&
                kind == that.kind;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, parameters, parameterTypes, returnType, kind);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("parameters", parameters)
                .add("parameterTypes", parameterTypes)
                .add("returnType", returnType)
                .add("kind", kind)
                .toString();
    }
}
