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

import java.util.Objects;

import io.fleetwarden.common.util.StringExt;

/**
 * A historical provisioning event of a scaling group (launch, termination or failure).
 */
public class ScalingActivity {

    private final String id;
    private final String groupId;
    private final long startTime;
    private final int progress;
    private final ActivityStatus status;
    private final String statusCode;
    private final String statusMessage;
    private final String cause;

    private ScalingActivity(String id,
                            String groupId,
                            long startTime,
                            int progress,
                            String statusCode,
                            String statusMessage,
                            String cause) {
        this.id = id;
        this.groupId = groupId;
        this.startTime = startTime;
        this.progress = progress;
        this.status = ActivityStatus.fromProviderCode(statusCode);
        this.statusCode = statusCode;
        this.statusMessage = StringExt.nonNull(statusMessage);
        this.cause = StringExt.nonNull(cause);
    }

    public String getId() {
        return id;
    }

    public String getGroupId() {
        return groupId;
    }

    public long getStartTime() {
        return startTime;
    }

    /**
     * Completion percentage, 100 for a finished activity.
     */
    public int getProgress() {
        return progress;
    }

    public boolean isCompleted() {
        return progress == 100;
    }

    public ActivityStatus getStatus() {
        return status;
    }

    /**
     * Raw provider status code, kept for logging when the status is {@link ActivityStatus#Other}.
     */
    public String getStatusCode() {
        return statusCode;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public String getCause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScalingActivity that = (ScalingActivity) o;
        return startTime == that.startTime &&
                progress == that.progress &&
                Objects.equals(id, that.id) &&
                Objects.equals(groupId, that.groupId) &&
                Objects.equals(statusCode, that.statusCode) &&
                Objects.equals(statusMessage, that.statusMessage) &&
                Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, groupId, startTime, progress, statusCode, statusMessage, cause);
    }

    @Override
    public String toString() {
        return "ScalingActivity{" +
                "id='" + id + '\'' +
                ", groupId='" + groupId + '\'' +
                ", startTime=" + startTime +
                ", progress=" + progress +
                ", statusCode='" + statusCode + '\'' +
                ", statusMessage='" + statusMessage + '\'' +
                ", cause='" + cause + '\'' +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String groupId;
        private long startTime;
        private int progress;
        private String statusCode;
        private String statusMessage;
        private String cause;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withGroupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder withStartTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder withProgress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder withStatusCode(String statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder withStatus(ActivityStatus status) {
            this.statusCode = status.name();
            return this;
        }

        public Builder withStatusMessage(String statusMessage) {
            this.statusMessage = statusMessage;
            return this;
        }

        public Builder withCause(String cause) {
            this.cause = cause;
            return this;
        }

        public ScalingActivity build() {
            return new ScalingActivity(id, groupId, startTime, progress, statusCode, statusMessage, cause);
        }
    }
}
