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

package io.macrobridge.main.web;

import com.google.inject.Inject;
import io.macrobridge.main.MacroService;
import io.macrobridge.main.web.dto.MacroExecutionRequestDto;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.container.Suspended;

import java.util.Map;

import static io.macrobridge.main.web.MacroBridgeExceptionMapper.bindAsyncResponse;
import static io.macrobridge.main.web.dto.MacroExecutionRequestDto.checkParameters;
import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;
import static java.util.Objects.requireNonNull;

@Path("/api/v1/macros")
public class MacroResource
{
    private final MacroService macroService;

    @Inject
    public MacroResource(MacroService macroService)
    {
        this.macroService = requireNonNull(macroService, "macroService is null");
    }

    @GET
    @Produces(APPLICATION_JSON)
    public void listMacros(@Suspended AsyncResponse asyncResponse)
    {
        macroService.listMacros()
                .whenComplete(bindAsyncResponse(asyncResponse));
    }

    @GET
    @Path("/{macroName}")
    @Produces(APPLICATION_JSON)
    public void getMacro(
            @PathParam("macroName") String macroName,
            @Suspended AsyncResponse asyncResponse)
    {
        macroService.getMacro(macroName)
                .whenComplete(bindAsyncResponse(asyncResponse));
    }

    @POST
    @Path("/{macroName}/execute")
    @Consumes(APPLICATION_JSON)
    @Produces(APPLICATION_JSON)
    public void execute(
            @PathParam("macroName") String macroName,
            MacroExecutionRequestDto request,
            @Suspended AsyncResponse asyncResponse)
    {
        Map<String, Object> parameters;
        try {
            parameters = checkParameters(request == null ? null : request.getParameters());
        }
        catch (RuntimeException e) {
            asyncResponse.resume(e);
            return;
        }
        macroService.execute(macroName, parameters)
                .whenComplete(bindAsyncResponse(asyncResponse));
    }
}
