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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Throwables;
import io.airlift.log.Logger;
import io.macrobridge.base.ErrorCode;
import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.main.web.dto.ErrorMessageDto;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;

import static io.macrobridge.base.metadata.StandardErrorCode.DATABASE_CONNECTION_ERROR;
import static io.macrobridge.base.metadata.StandardErrorCode.EXCEEDED_TIME_LIMIT;
import static io.macrobridge.base.metadata.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.macrobridge.base.metadata.StandardErrorCode.GENERIC_USER_ERROR;
import static io.macrobridge.base.metadata.StandardErrorCode.MACRO_NOT_FOUND;
import static io.macrobridge.base.metadata.StandardErrorCode.METHOD_NOT_ALLOWED;
import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;
import static jakarta.ws.rs.core.Response.Status.BAD_REQUEST;
import static jakarta.ws.rs.core.Response.Status.GATEWAY_TIMEOUT;
import static jakarta.ws.rs.core.Response.Status.INTERNAL_SERVER_ERROR;
import static jakarta.ws.rs.core.Response.Status.NOT_FOUND;
import static jakarta.ws.rs.core.Response.Status.SERVICE_UNAVAILABLE;

public final class MacroBridgeExceptionMapper
        implements ExceptionMapper<Throwable>
{
    private static final Logger LOG = Logger.get(MacroBridgeExceptionMapper.class);

    public static BiConsumer<? super Object, ? super Throwable> bindAsyncResponse(AsyncResponse asyncResponse)
    {
        return (response, throwable) -> {
            if (throwable != null) {
                asyncResponse.resume(throwable);
            }
            else if (response instanceof Response) {
                asyncResponse.resume(response);
            }
            else {
                asyncResponse.resume(Response.ok(response).build());
            }
        };
    }

    @Override
    public Response toResponse(Throwable throwable)
    {
        if ((throwable instanceof ExecutionException || throwable instanceof CompletionException) && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }

        if (throwable instanceof MacroBridgeException) {
            return failure((MacroBridgeException) throwable);
        }
        if (throwable instanceof WebApplicationException) {
            Response response = ((WebApplicationException) throwable).getResponse();
            LOG.warn("Request failed with status %s: %s", response.getStatus(), throwable.getMessage());
            String code = response.getStatus() >= 500 ? GENERIC_INTERNAL_ERROR.name() : GENERIC_USER_ERROR.name();
            return errorResponse(response.getStatus(), new ErrorMessageDto(code, throwable.getMessage()));
        }
        if (Throwables.getCausalChain(throwable).stream().anyMatch(JsonProcessingException.class::isInstance)) {
            LOG.warn("Malformed request body: %s", throwable.getMessage());
            return errorResponse(BAD_REQUEST.getStatusCode(), new ErrorMessageDto(GENERIC_USER_ERROR.name(), "Invalid JSON body"));
        }

        LOG.error(throwable, "Unexpected failure, type: %s, message: %s", throwable.getClass(), throwable.getMessage());
        return errorResponse(INTERNAL_SERVER_ERROR.getStatusCode(), new ErrorMessageDto(GENERIC_INTERNAL_ERROR.name(), throwable.getMessage()));
    }

    private static Response failure(MacroBridgeException exception)
    {
        ErrorCode errorCode = exception.getErrorCode();
        int status;
        switch (errorCode.getType()) {
            case USER_ERROR:
                if (errorCode.equals(MACRO_NOT_FOUND.toErrorCode())) {
                    status = NOT_FOUND.getStatusCode();
                }
                else if (errorCode.equals(METHOD_NOT_ALLOWED.toErrorCode())) {
                    status = 405;
                }
                else {
                    status = BAD_REQUEST.getStatusCode();
                }
                LOG.warn("%s: %s", errorCode.getName(), exception.getMessage());
                break;
            case INSUFFICIENT_RESOURCES:
                status = errorCode.equals(EXCEEDED_TIME_LIMIT.toErrorCode()) ? GATEWAY_TIMEOUT.getStatusCode() : SERVICE_UNAVAILABLE.getStatusCode();
                LOG.warn("%s: %s", errorCode.getName(), exception.getMessage());
                break;
            case EXTERNAL:
            case INTERNAL_ERROR:
            default:
                status = errorCode.equals(DATABASE_CONNECTION_ERROR.toErrorCode()) ? SERVICE_UNAVAILABLE.getStatusCode() : INTERNAL_SERVER_ERROR.getStatusCode();
                LOG.error(exception, "%s: %s", errorCode.getName(), exception.getMessage());
                break;
        }
        return errorResponse(status, new ErrorMessageDto(errorCode.getName(), exception.getMessage(), exception.getDetails()));
    }

    private static Response errorResponse(int status, ErrorMessageDto errorMessage)
    {
        return Response
                .status(status)
                .type(APPLICATION_JSON)
                .entity(errorMessage)
                .build();
    }
}
