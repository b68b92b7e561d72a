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

package io.macrobridge.base.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import jakarta.validation.constraints.NotNull;

public class MacroConfig
{
    public static final String MACRO_SNIFF_DEFINITION_KIND = "macro.sniff-definition-kind";
    public static final String MACRO_API_VERSION = "macro.api-version";

    private boolean sniffDefinitionKind = true;
    private String apiVersion = "1.0.0";

    public boolean isSniffDefinitionKind()
    {
        return sniffDefinitionKind;
    }

    @Config(MACRO_SNIFF_DEFINITION_KIND)
    @ConfigDescription("Classify a macro tagged as scalar as a table macro when its definition contains TABLE or SELECT")
    public MacroConfig setSniffDefinitionKind(boolean sniffDefinitionKind)
    {
        this.sniffDefinitionKind = sniffDefinitionKind;
        return this;
    }

    @NotNull
    public String getApiVersion()
    {
        return apiVersion;
    }

    @Config(MACRO_API_VERSION)
    public MacroConfig setApiVersion(String apiVersion)
    {
        this.apiVersion = apiVersion;
        return this;
    }
}
