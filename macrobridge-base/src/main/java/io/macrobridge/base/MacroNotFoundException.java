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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

import static io.macrobridge.base.metadata.StandardErrorCode.MACRO_NOT_FOUND;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public class MacroNotFoundException
        extends MacroBridgeException
{
    public static final int MAX_REPORTED_MACROS = 10;

    private final String macroName;
    private final List<String> availableMacros;

    public MacroNotFoundException(String macroName)
    {
        this(macroName, ImmutableList.of());
    }

    public MacroNotFoundException(String macroName, List<String> availableMacros)
    {
        this(macroName, availableMacros, null);
    }

    public MacroNotFoundException(String macroName, List<String> availableMacros, Throwable cause)
    {
        super(MACRO_NOT_FOUND, format("Macro '%s' not found", macroName), cause);
        this.macroName = requireNonNull(macroName, "macroName is null");
        this.availableMacros = availableMacros.stream()
                .limit(MAX_REPORTED_MACROS)
                .collect(ImmutableList.toImmutableList());
    }

    public String getMacroName()
    {
        return macroName;
    }

    public List<String> getAvailableMacros()
    {
        return availableMacros;
    }

    @Override
    public Map<String, Object> getDetails()
    {
        ImmutableMap.Builder<String, Object> details = ImmutableMap.builder();
        details.put("macro_name", macroName);
        if (!availableMacros.isEmpty()) {
            details.put("available_macros", availableMacros);
        }
        return details.build();
    }
}
