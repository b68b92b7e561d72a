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

package io.macrobridge.server.module;

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.macrobridge.base.config.MacroConfig;
import io.macrobridge.base.macro.MacroParameterCoercer;
import io.macrobridge.main.MacroService;
import io.macrobridge.main.catalog.MacroCatalogService;
import io.macrobridge.main.execution.MacroExecutionEngine;
import io.macrobridge.main.execution.MacroTaskManager;
import io.macrobridge.main.route.MacroRouteSynthesizer;

import static io.airlift.configuration.ConfigBinder.configBinder;

public class MainModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(MacroConfig.class);
        binder.bind(MacroParameterCoercer.class).in(Scopes.SINGLETON);
        binder.bind(MacroCatalogService.class).in(Scopes.SINGLETON);
        binder.bind(MacroExecutionEngine.class).in(Scopes.SINGLETON);
        binder.bind(MacroRouteSynthesizer.class).in(Scopes.SINGLETON);
        binder.bind(MacroTaskManager.class).in(Scopes.SINGLETON);
        binder.bind(MacroService.class).in(Scopes.SINGLETON);
    }
}
