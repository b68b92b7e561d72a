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

package io.macrobridge.main.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.macrobridge.base.MacroParameterException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;

public class MacroExecutionRequestDto
{
    public static final int MAX_PARAMETERS = 50;
    public static final int MAX_STRING_VALUE_LENGTH = 10000;

    private final Map<String, Object> parameters;

    @JsonCreator
    public MacroExecutionRequestDto(@JsonProperty("parameters") Map<String, Object> parameters)
    {
        // JSON null values are legal and mean "not supplied"
        this.parameters = parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(parameters));
    }

    @JsonProperty
    public Map<String, Object> getParameters()
    {
        return parameters;
    }

    /**
     * Limits applied to every parameter map received in a request body.
     */
    public static Map<String, Object> checkParameters(Map<String, Object> parameters)
    {
        if (parameters == null) {
            return Collections.emptyMap();
        }
        if (parameters.size() > MAX_PARAMETERS) {
            throw new MacroParameterException(format("Too many parameters (max %s)", MAX_PARAMETERS));
        }
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            String name = entry.getKey();
            if (name.startsWith("_") || name.startsWith("$")) {
                throw new MacroParameterException(format("Parameter name '%s' is not allowed", name), name, null, null);
            }
            if (entry.getValue() instanceof String && ((String) entry.getValue()).length() > MAX_STRING_VALUE_LENGTH) {
                throw new MacroParameterException(format("Parameter '%s' value too long", name), name, null, null);
            }
        }
        return parameters;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("parameters", parameters)
                .toString();
    }
}
