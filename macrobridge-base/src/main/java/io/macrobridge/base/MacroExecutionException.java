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

import static io.macrobridge.base.metadata.StandardErrorCode.MACRO_EXECUTION_ERROR;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public class MacroExecutionException
        extends MacroBridgeException
{
    private final String macroName;
    private final String originalError;

    public MacroExecutionException(String macroName, String originalError, Throwable cause)
    {
        super(MACRO_EXECUTION_ERROR, format("Failed to execute macro '%s': %s", macroName, originalError), cause);
        this.macroName = requireNonNull(macroName, "macroName is null");
        this.originalError = String.valueOf(originalError);
    }

    public String getMacroName()
    {
        return macroName;
    }

    public String getOriginalError()
    {
        return originalError;
    }

    @Override
    public Map<String, Object> getDetails()
    {
        return ImmutableMap.of(
                "macro_name", macroName,
                "original_error", originalError);
    }
}
