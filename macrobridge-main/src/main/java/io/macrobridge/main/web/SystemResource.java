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
import io.airlift.log.Logger;
import io.macrobridge.base.config.MacroConfig;
import io.macrobridge.main.MacroService;
import io.macrobridge.main.web.dto.HealthDto;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.container.Suspended;
import jakarta.ws.rs.core.Response;

import java.time.Instant;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;
import static java.util.Objects.requireNonNull;

@Path("/api/v1")
public class SystemResource
{
    private static final Logger LOG = Logger.get(SystemResource.class);

    private final MacroService macroService;
    private final String version;

    @Inject
    public SystemResource(MacroService macroService, MacroConfig macroConfig)
    {
        this.macroService = requireNonNull(macroService, "macroService is null");
        this.version = requireNonNull(macroConfig, "macroConfig is null").getApiVersion();
    }

    @GET
    @Path("/health")
    @Produces(APPLICATION_JSON)
    public void health(@Suspended AsyncResponse asyncResponse)
    {
        macroService.testConnection()
                .exceptionally(throwable -> {
                    LOG.error(throwable, "Health check failed");
                    return false;
                })
                .thenAccept(connected -> {
                    HealthDto health = HealthDto.of(connected, Instant.now().toString(), version);
                    Response.Status status = connected ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
                    asyncResponse.resume(Response.status(status).entity(health).type(APPLICATION_JSON).build());
                });
    }
}
