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

package io.macrobridge.base;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

import static io.macrobridge.base.metadata.StandardErrorCode.INVALID_PARAMETER;

public class MacroParameterException
        extends MacroBridgeException
{
    private final Optional<String> parameterName;
    private final Optional<String> expectedType;
    private final Optional<Object> providedValue;

    public MacroParameterException(String message)
    {
        this(message, null, null, null, null);
    }

    public MacroParameterException(String message, String parameterName, String expectedType, Object providedValue)
    {
        this(message, parameterName, expectedType, providedValue, null);
    }

    public MacroParameterException(String message, String parameterName, String expectedType, Object providedValue, Throwable cause)
    {
        super(INVALID_PARAMETER, message, cause);
        this.parameterName = Optional.ofNullable(parameterName);
        this.expectedType = Optional.ofNullable(expectedType);
        this.providedValue = Optional.ofNullable(providedValue);
    }

    public Optional<String> getParameterName()
    {
        return parameterName;
    }

    public Optional<String> getExpectedType()
    {
        return expectedType;
    }

    public Optional<Object> getProvidedValue()
    {
        return providedValue;
    }

    @Override
    public Map<String, Object> getDetails()
    {
        ImmutableMap.Builder<String, Object> details = ImmutableMap.builder();
        parameterName.ifPresent(name -> details.put("parameter_name", name));
        expectedType.ifPresent(type -> details.put("expected_type", type));
        providedValue.ifPresent(value -> details.put("provided_value", String.valueOf(value)));
        return details.build();
    }
}
