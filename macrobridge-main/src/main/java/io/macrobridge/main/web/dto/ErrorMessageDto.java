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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorMessageDto
{
    private final String code;
    private final String message;
    private final Map<String, Object> details;

    public ErrorMessageDto(String code, String message)
    {
        this(code, message, ImmutableMap.of());
    }

    @JsonCreator
    public ErrorMessageDto(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("details") Map<String, Object> details)
    {
        this.code = code;
        this.message = message;
        // provided values may be null
        this.details = details == null ? ImmutableMap.of() : new LinkedHashMap<>(details);
    }

    @JsonProperty
    public String getCode()
    {
        return code;
    }

    @JsonProperty
    public String getMessage()
    {
        return message;
    }

    @JsonProperty
    public Map<String, Object> getDetails()
    {
        return details;
    }

    @Override
    public boolean equals(Object that)
    {
        if (this == that) {
            return true;
        }
        if (that == null || getClass() != that.getClass()) {
            return false;
        }
        ErrorMessageDto errorMessageDto = (ErrorMessageDto) that;
        return Objects.equals(code, errorMessageDto.code) &&
                Objects.equals(message, errorMessageDto.message) &&
                Objects.equals(details, errorMessageDto.details);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(code, message, details);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("code", code)
                .add("message", message)
                .add("details", details)
                .toString();
    }
}
