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

/**
 * Scaling activity status codes the reconciliation logic distinguishes. Everything else maps to {@link #Other}.
 */
public enum ActivityStatus {
    Successful,
    InProgress,
    Failed,
    Cancelled,
    WaitingForSpotInstanceId,
    Other;

    public boolean isFailure() {
        return this == Failed || this == Cancelled;
    }

    public static ActivityStatus fromProviderCode(String statusCode) {
        if (statusCode == null) {
            return Other;
        }
        for (ActivityStatus status : values()) {
            if (status.name().equals(statusCode)) {
                return status;
            }
        }
        return Other;
    }
}
