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

package io.macrobridge.testing;

import com.google.common.io.Closer;
import com.google.common.io.Resources;
import com.google.inject.Key;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpClientConfig;
import io.airlift.http.client.HttpUriBuilder;
import io.airlift.http.client.Request;
import io.airlift.http.client.ResponseHandler;
import io.airlift.http.client.StringResponseHandler;
import io.airlift.http.client.jetty.JettyHttpClient;
import io.airlift.json.JsonCodec;
import io.airlift.units.Duration;
import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.main.web.dto.ErrorMessageDto;
import io.macrobridge.main.web.dto.HealthDto;
import io.macrobridge.main.web.dto.MacroExecutionRequestDto;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.google.common.net.HttpHeaders.CONTENT_TYPE;
import static io.airlift.http.client.HttpUriBuilder.uriBuilderFrom;
import static io.airlift.http.client.JsonBodyGenerator.jsonBodyGenerator;
import static io.airlift.http.client.Request.Builder.prepareGet;
import static io.airlift.http.client.Request.Builder.preparePost;
import static io.airlift.http.client.StaticBodyGenerator.createStaticBodyGenerator;
import static io.airlift.http.client.StringResponseHandler.createStringResponseHandler;
import static io.airlift.json.JsonCodec.jsonCodec;
import static io.airlift.json.JsonCodec.listJsonCodec;
import static io.airlift.json.JsonCodec.mapJsonCodec;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

public abstract class RequireMacroBridgeServer
{
    protected TestingMacroBridgeServer macroBridgeServer;
    protected Closer closer = Closer.create();
    protected HttpClient client;

    private static final JsonCodec<ErrorMessageDto> ERROR_CODEC = jsonCodec(ErrorMessageDto.class);
    private static final JsonCodec<ExecutionResult> EXECUTION_RESULT_CODEC = jsonCodec(ExecutionResult.class);
    private static final JsonCodec<MacroDescriptor> MACRO_DESCRIPTOR_CODEC = jsonCodec(MacroDescriptor.class);
    private static final JsonCodec<List<MacroDescriptor>> MACRO_DESCRIPTOR_LIST_CODEC = listJsonCodec(MacroDescriptor.class);
    private static final JsonCodec<MacroExecutionRequestDto> EXECUTION_REQUEST_CODEC = jsonCodec(MacroExecutionRequestDto.class);
    private static final JsonCodec<Map<String, Object>> PARAMETERS_CODEC = mapJsonCodec(String.class, Object.class);
    protected static final JsonCodec<HealthDto> HEALTH_CODEC = jsonCodec(HealthDto.class);

    public RequireMacroBridgeServer() {}

    @BeforeClass
    public void init()
            throws Exception
    {
        this.macroBridgeServer = createMacroBridgeServer();
        this.client = closer.register(createHttpClient());
        closer.register(macroBridgeServer);
        prepare();
    }

    protected static JettyHttpClient createHttpClient()
    {
        return new JettyHttpClient(new HttpClientConfig().setIdleTimeout(new Duration(20, SECONDS)));
    }

    protected TestingMacroBridgeServer createMacroBridgeServer()
            throws Exception
    {
        return TestingMacroBridgeServer.builder()
                .setRequireConfig("duckdb.database-path", ":memory:")
                .setRequireConfig("duckdb.read-only", "false")
                .setRequireConfig("duckdb.init-sql-path", seedPath())
                .build();
    }

    protected static String seedPath()
            throws Exception
    {
        return Path.of(requireNonNull(Resources.getResource("duckdb/init.sql")).toURI()).toString();
    }

    protected TestingMacroBridgeServer server()
    {
        return macroBridgeServer;
    }

    protected void prepare() {}

    public <T> T getInstance(Key<T> key)
    {
        return macroBridgeServer.getInstance(key);
    }

    @AfterClass(alwaysRun = true)
    public void close()
            throws IOException
    {
        cleanup();
        closer.close();
    }

    protected void cleanup() {}

    public <T, E extends Exception> T executeHttpRequest(Request request, ResponseHandler<T, E> responseHandler)
            throws E
    {
        return client.execute(request, responseHandler);
    }

    protected StringResponseHandler.StringResponse health()
    {
        Request request = prepareGet()
                .setUri(server().getHttpServerBasedUrl().resolve("/api/v1/health"))
                .build();
        return executeHttpRequest(request, createStringResponseHandler());
    }

    protected List<MacroDescriptor> listMacros()
    {
        Request request = prepareGet()
                .setUri(server().getHttpServerBasedUrl().resolve("/api/v1/macros"))
                .build();

        StringResponseHandler.StringResponse response = executeHttpRequest(request, createStringResponseHandler());
        if (response.getStatusCode() != 200) {
            getWebApplicationException(response);
        }
        return MACRO_DESCRIPTOR_LIST_CODEC.fromJson(response.getBody());
    }

    protected MacroDescriptor getMacro(String macroName)
    {
        Request request = prepareGet()
                .setUri(server().getHttpServerBasedUrl().resolve(format("/api/v1/macros/%s", macroName)))
                .build();

        StringResponseHandler.StringResponse response = executeHttpRequest(request, createStringResponseHandler());
        if (response.getStatusCode() != 200) {
            getWebApplicationException(response);
        }
        return MACRO_DESCRIPTOR_CODEC.fromJson(response.getBody());
    }

    protected ExecutionResult executeMacro(String macroName, MacroExecutionRequestDto requestDto)
    {
        Request request = preparePost()
                .setUri(server().getHttpServerBasedUrl().resolve(format("/api/v1/macros/%s/execute", macroName)))
                .setHeader(CONTENT_TYPE, "application/json")
                .setBodyGenerator(jsonBodyGenerator(EXECUTION_REQUEST_CODEC, requestDto))
                .build();
        return executionResult(request);
    }

    protected StringResponseHandler.StringResponse executeMacro(String macroName, String rawBody)
    {
        Request request = preparePost()
                .setUri(server().getHttpServerBasedUrl().resolve(format("/api/v1/macros/%s/execute", macroName)))
                .setHeader(CONTENT_TYPE, "application/json")
                .setBodyGenerator(createStaticBodyGenerator(rawBody, UTF_8))
                .build();
        return executeHttpRequest(request, createStringResponseHandler());
    }

    protected ExecutionResult executeWithQuery(String macroName, Map<String, String> queryParameters)
    {
        HttpUriBuilder uriBuilder = uriBuilderFrom(server().getHttpServerBasedUrl())
                .appendPath("/api/v1/execute")
                .appendPath(macroName);
        queryParameters.forEach((name, value) -> uriBuilder.addParameter(name, value));
        Request request = prepareGet()
                .setUri(uriBuilder.build())
                .build();
        return executionResult(request);
    }

    protected ExecutionResult executeWithBody(String macroName, Map<String, Object> body)
    {
        Request request = preparePost()
                .setUri(server().getHttpServerBasedUrl().resolve(format("/api/v1/execute/%s", macroName)))
                .setHeader(CONTENT_TYPE, "application/json")
                .setBodyGenerator(jsonBodyGenerator(PARAMETERS_CODEC, body))
                .build();
        return executionResult(request);
    }

    private ExecutionResult executionResult(Request request)
    {
        StringResponseHandler.StringResponse response = executeHttpRequest(request, createStringResponseHandler());
        if (response.getStatusCode() != 200) {
            getWebApplicationException(response);
        }
        return EXECUTION_RESULT_CODEC.fromJson(response.getBody());
    }

    public static void getWebApplicationException(StringResponseHandler.StringResponse response)
    {
        String body = response.getBody();
        ErrorMessageDto errorMessageDto;
        try {
            errorMessageDto = ERROR_CODEC.fromJson(body);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(format("Illegal response body '%s' with status code %d", body, response.getStatusCode()), e);
        }

        throw new WebApplicationException(
                Response.status(response.getStatusCode())
                        .type(MediaType.APPLICATION_JSON_TYPE)
                        .entity(errorMessageDto)
                        .build());
    }
}
