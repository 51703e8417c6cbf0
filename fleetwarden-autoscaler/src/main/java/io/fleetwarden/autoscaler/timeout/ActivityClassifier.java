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
 * Maps provider free-text scaling activity descriptions to a closed set of categories. Text that matches
 * nothing is {@link ActivityClassification.Category#Unclassified}, never an error.
 */
public interface ActivityClassifier {

    /**
     * Classifies an activity status message. The possible categories are the capacity failure kinds, and the spot
     * request states.
     */
    ActivityClassification classifyStatusMessage(String statusMessage);

    /**
     * Classifies an activity cause, which tells why an instance launch was attempted.
     */
    ActivityClassification classifyCause(String cause);
}
