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
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.macrobridge.main.web.ExecuteResource;
import io.macrobridge.main.web.MacroBridgeExceptionMapper;
import io.macrobridge.main.web.MacroResource;
import io.macrobridge.main.web.SystemResource;

import static io.airlift.jaxrs.JaxrsBinder.jaxrsBinder;

public class WebModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        jaxrsBinder(binder).bind(SystemResource.class);
        jaxrsBinder(binder).bind(MacroResource.class);
        jaxrsBinder(binder).bind(ExecuteResource.class);
        jaxrsBinder(binder).bindInstance(new MacroBridgeExceptionMapper());
    }
}
