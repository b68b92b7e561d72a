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

import io.macrobridge.base.MacroBridgeException;

import java.util.regex.Pattern;

import static io.macrobridge.base.metadata.StandardErrorCode.INVALID_MACRO_NAME;
import static java.lang.String.format;

/**
 * A macro name is embedded in statement text as an identifier, never bound as a value,
 * so it has to match {@link #IDENTIFIER_PATTERN} first.
 */
public final class MacroNames
{
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");
    public static final int MAX_NAME_LENGTH = 100;

    private MacroNames() {}

    public static boolean isValid(String name)
    {
        return name != null
                && name.length() <= MAX_NAME_LENGTH
                && IDENTIFIER_PATTERN.matcher(name).matches();
    }

    public static String checkValid(String name)
    {
        if (!isValid(name)) {
            throw new MacroBridgeException(INVALID_MACRO_NAME, format("Invalid macro name: '%s'", name));
        }
        return name;
    }
}
