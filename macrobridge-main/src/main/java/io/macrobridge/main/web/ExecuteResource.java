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
import io.macrobridge.main.route.MacroRoute;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.container.Suspended;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.UriInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.macrobridge.main.web.MacroBridgeExceptionMapper.bindAsyncResponse;
import static io.macrobridge.main.web.dto.MacroExecutionRequestDto.checkParameters;
import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;
import static java.util.Objects.requireNonNull;

/**
 * Routes synthesized from the catalog: query-string parameters on {@code GET},
 * a flat JSON object of parameters on {@code POST}.
 */
@Path("/api/v1/execute")
public class ExecuteResource
{
    private final MacroService macroService;

    @Inject
    public ExecuteResource(MacroService macroService)
    {
        this.macroService = requireNonNull(macroService, "macroService is null");
    }

    @GET
    @Path("/{macroName}")
    @Produces(APPLICATION_JSON)
    public void executeWithQuery(
            @PathParam("macroName") String macroName,
            @Context UriInfo uriInfo,
            @Suspended AsyncResponse asyncResponse)
    {
        Map<String, Object> parameters = new LinkedHashMap<>();
        MultivaluedMap<String, String> queryParameters = uriInfo.getQueryParameters();
        for (Map.Entry<String, List<String>> entry : queryParameters.entrySet()) {
            // a repeated name keeps its first value
            if (!entry.getValue().isEmpty()) {
                parameters.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        macroService.dispatch(MacroRoute.Method.GET, macroName, parameters)
                .whenComplete(bindAsyncResponse(asyncResponse));
    }

    @POST
    @Path("/{macroName}")
    @Consumes(APPLICATION_JSON)
    @Produces(APPLICATION_JSON)
    public void executeWithBody(
            @PathParam("macroName") String macroName,
            Map<String, Object> body,
            @Suspended AsyncResponse asyncResponse)
    {
        Map<String, Object> parameters;
        try {
            parameters = checkParameters(body);
        }
        catch (RuntimeException e) {
            asyncResponse.resume(e);
            return;
        }
        macroService.dispatch(MacroRoute.Method.POST, macroName, parameters)
                .whenComplete(bindAsyncResponse(asyncResponse));
    }
}
