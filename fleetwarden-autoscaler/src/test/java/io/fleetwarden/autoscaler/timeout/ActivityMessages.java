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

package io.fleetwarden.autoscaler.timeout;

/**
 * Scaling activity texts, as reported by AWS Auto Scaling.
 */
final class ActivityMessages {

    static final String INSTANCE_LIMIT = "You have requested more instances (12) than your current instance limit of 10 allows for "
            + "the specified instance type. Please visit http://aws.amazon.com/contact-us/ec2-request to request an adjustment "
            + "to this limit. Launching EC2 instance failed.";

    static final String VOLUME_LIMIT = "Instance became unhealthy while waiting for instance to be in InService state. "
            + "Termination Reason: Client.VolumeLimitExceeded: Volume limit exceeded";

    static final String CAPACITY_LIMIT = "Insufficient capacity. Launching EC2 instance failed.";

    static final String AZ_LIMIT = "We currently do not have sufficient m4.large capacity in the Availability Zone you requested "
            + "(us-west-2a). Our system will be working on provisioning additional capacity. You can currently get m4.large "
            + "capacity by not specifying an Availability Zone in your request or choosing us-west-2b, us-west-2c. "
            + "Launching EC2 instance failed.";

    static final String SPOT_REQUEST_CANCELLED = "Spot instance request: sir-abc12345 has been cancelled.";

    static final String SPOT_LIMIT = "Max spot instance count exceeded. Placing Spot instance request failed.";

    static final String SPOT_REQUEST_WAITING = "Placed Spot instance request: sir-def67890. Waiting for instance(s)";

    static final String LAUNCH_CAUSE = "At 2026-10-19T10:15:30Z an instance was started in response to a difference between "
            + "desired and actual capacity, increasing the capacity from 4 to 6.";

    static final String AZ_BALANCE_CAUSE = "At 2026-10-19T10:15:30Z a user request update of AutoScalingGroup constraints. "
            + "An instance was launched to aid in balancing the group's zones.";

    private ActivityMessages() {
    }
}
