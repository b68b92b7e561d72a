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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

public class MacroBridgeException
        extends RuntimeException
{
    private final ErrorCode errorCode;

    public MacroBridgeException(ErrorCodeSupplier errorCode, String message)
    {
        this(errorCode, message, null);
    }

    public MacroBridgeException(ErrorCodeSupplier errorCode, Throwable throwable)
    {
        this(errorCode, null, throwable);
    }

    public MacroBridgeException(ErrorCodeSupplier errorCodeSupplier, String message, Throwable cause)
    {
        super(message, cause);
        this.errorCode = errorCodeSupplier.toErrorCode();
    }

    public ErrorCode getErrorCode()
    {
        return errorCode;
    }

    /**
     * Structured context a caller can report next to the message, keyed by snake_case names.
     */
    public Map<String, Object> getDetails()
    {
        return ImmutableMap.of();
    }

    @Override
    public String getMessage()
    {
        String message = super.getMessage();
        if (message == null && getCause() != null) {
            message = getCause().getMessage();
        }
        if (message == null) {
            message = errorCode.getName();
        }
        return message;
    }
}
