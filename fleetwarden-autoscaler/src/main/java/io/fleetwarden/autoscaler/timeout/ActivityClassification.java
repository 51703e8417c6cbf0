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

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Result of matching a scaling activity status message or cause against the known provider wordings, with the
 * values extracted from the matched text.
 */
public class ActivityClassification {

    public enum Category {
        InstanceLimit,
        VolumeLimit,
        CapacityLimit,
        AzLimit,
        SpotRequestCancelled,
        SpotLimit,
        SpotRequestWaiting,
        LaunchInstance,
        AzRebalance,
        Unclassified
    }

    private static final ActivityClassification UNCLASSIFIED = new ActivityClassification(Category.Unclassified, null, null, null, null);

    private final Category category;
    private final Integer first;
    private final Integer second;
    private final String spotRequestId;
    private final String availabilityZone;

    private ActivityClassification(Category category, Integer first, Integer second, String spotRequestId, String availabilityZone) {
        this.category = category;
        this.first = first;
        this.second = second;
        this.spotRequestId = spotRequestId;
        this.availabilityZone = availabilityZone;
    }

    public Category getCategory() {
        return category;
    }

    public boolean is(Category expected) {
        return category == expected;
    }

    /**
     * Instance count requested, for {@link Category#InstanceLimit}.
     */
    public OptionalInt getRequestedInstances() {
        return category == Category.InstanceLimit ? OptionalInt.of(first) : OptionalInt.empty();
    }

    /**
     * Account instance limit, for {@link Category#InstanceLimit}.
     */
    OptionalInt getInstanceLimit() {
        return category == Category.InstanceLimit ? OptionalInt.of(second) : OptionalInt.empty();
    }

    public OptionalInt getOriginalCapacity() {
        return category == Category.LaunchInstance ? OptionalInt.of(first) : OptionalInt.empty();
    }

    OptionalInt getTargetCapacity() {
        return category == Category.LaunchInstance ? OptionalInt.of(second) : OptionalInt.empty();
    }

    /**
     * Spot instance request id, for {@link Category#SpotRequestWaiting} and {@link Category#SpotRequestCancelled}.
     */
    public Optional<String> getSpotRequestId() {
        return Optional.ofNullable(spotRequestId);
    }

    Optional<String> getAvailabilityZone() {
        return Optional.ofNullable(availabilityZone);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ActivityClassification{category=").append(category);
        if (first != null) {
            sb.append(", first=").append(first).append(", second=").append(second);
        }
        if (spotRequestId != null) {
            sb.append(", spotRequestId=").append(spotRequestId);
        }
        if (availabilityZone != null) {
            sb.append(", availabilityZone=").append(availabilityZone);
        }
        return sb.append('}').toString();
    }

    public static ActivityClassification instanceLimit(int requested, int limit) {
        return new ActivityClassification(Category.InstanceLimit, requested, limit, null, null);
    }

    public static ActivityClassification volumeLimit() {
        return new ActivityClassification(Category.VolumeLimit, null, null, null, null);
    }

    public static ActivityClassification capacityLimit() {
        return new ActivityClassification(Category.CapacityLimit, null, null, null, null);
    }

    public static ActivityClassification azLimit(String availabilityZone) {
        return new ActivityClassification(Category.AzLimit, null, null, null, availabilityZone);
    }

    public static ActivityClassification spotRequestCancelled(String spotRequestId) {
        return new ActivityClassification(Category.SpotRequestCancelled, null, null, spotRequestId, null);
    }

    public static ActivityClassification spotLimit() {
        return new ActivityClassification(Category.SpotLimit, null, null, null, null);
    }

    public static ActivityClassification spotRequestWaiting(String spotRequestId) {
        return new ActivityClassification(Category.SpotRequestWaiting, null, null, spotRequestId, null);
    }

    public static ActivityClassification launchInstance(int originalCapacity, int targetCapacity) {
        return new ActivityClassification(Category.LaunchInstance, originalCapacity, targetCapacity, null, null);
    }

    public static ActivityClassification azRebalance() {
        return new ActivityClassification(Category.AzRebalance, null, null, null, null);
    }

    public static ActivityClassification unclassified() {
        return UNCLASSIFIED;
    }
}
