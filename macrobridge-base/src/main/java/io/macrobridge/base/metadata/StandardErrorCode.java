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

package io.macrobridge.base.metadata;

import io.macrobridge.base.ErrorCode;
import io.macrobridge.base.ErrorCodeSupplier;
import io.macrobridge.base.ErrorType;

import static io.macrobridge.base.ErrorType.EXTERNAL;
import static io.macrobridge.base.ErrorType.INSUFFICIENT_RESOURCES;
import static io.macrobridge.base.ErrorType.INTERNAL_ERROR;
import static io.macrobridge.base.ErrorType.USER_ERROR;

public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    GENERIC_USER_ERROR(0, USER_ERROR),
    MACRO_NOT_FOUND(1, USER_ERROR),
    INVALID_PARAMETER(2, USER_ERROR),
    INVALID_MACRO_NAME(3, USER_ERROR),
    METHOD_NOT_ALLOWED(4, USER_ERROR),

    GENERIC_INTERNAL_ERROR(65536, INTERNAL_ERROR),

    EXCEEDED_TIME_LIMIT(131072, INSUFFICIENT_RESOURCES),

    MACRO_EXECUTION_ERROR(196608, EXTERNAL),
    DATABASE_CONNECTION_ERROR(196609, EXTERNAL),
    /**/;

    private final ErrorCode errorCode;

    StandardErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
