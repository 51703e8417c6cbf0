/*
 * Copyright 2026 Fleetwarden Authors.
 *
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

package io.fleetwarden.api.connector.cloud;

public class CloudConnectorException extends RuntimeException {

    public enum ErrorCode {
        Internal,
        InvalidData,
        NotFound,
        /**
         * The provider rejected a request, as it would shrink a group below its minimum size.
         */
        MinSizeViolation,
    }

    private final ErrorCode errorCode;

    private CloudConnectorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean isThis(Throwable cause, ErrorCode errorCode) {
        return cause instanceof CloudConnectorException && ((CloudConnectorException) cause).getErrorCode() == errorCode;
    }

    public static CloudConnectorException internalError(String message, Object... args) {
        return new CloudConnectorException(ErrorCode.Internal, String.format(message, args), null);
    }

    public static CloudConnectorException invalidArgument(String message, Object... args) {
        return new CloudConnectorException(ErrorCode.InvalidData, String.format(message, args), null);
    }

    public static CloudConnectorException minSizeViolation(String region, String instanceId, Throwable cause) {
        return new CloudConnectorException(
                ErrorCode.MinSizeViolation,
                String.format("Terminating instance %s in region %s would violate its group's min size constraint", instanceId, region),
                cause
        );
    }

    public static void checkArgument(boolean isValid, String message, Object... args) {
        if (!isValid) {
            throw invalidArgument(message, args);
        }
    }
}
