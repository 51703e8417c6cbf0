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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spectator.api.Registry;
import io.fleetwarden.api.connector.cloud.ActivityStatus;
import io.fleetwarden.api.connector.cloud.Page;
import io.fleetwarden.api.connector.cloud.ScalingActivity;
import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.connector.cloud.SpotInstanceRequest;
import io.fleetwarden.autoscaler.group.ScalingGroup;
import io.fleetwarden.autoscaler.group.ScalingGroupId;
import io.fleetwarden.common.util.CollectionsExt;
import io.fleetwarden.common.util.DateTimeExt;
import io.fleetwarden.common.util.rx.ReactorExt;
import io.fleetwarden.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Tracks scaling groups that recently failed to provision capacity, and marks them as timed out, so scale up
 * decisions can avoid them. While doing so, it also reverts desired capacity increases the provider could not
 * satisfy, and cancels spot requests waiting for too long.
 * <p>
 * State is kept across control loop iterations, keyed by {@link ScalingGroupId}. The class is not thread safe,
 * and is expected to be driven by a single control loop.
 */
@Singleton
public class TimeoutReconciler {

    private static final Logger logger = LoggerFactory.getLogger(TimeoutReconciler.class);

    private final TimeoutReconcilerConfiguration configuration;
    private final ScalingGroupConnector connector;
    private final ActivityClassifier classifier;
    private final Clock clock;
    private final Scheduler scheduler;
    private final TimeoutReconcilerMetrics metrics;
    private final SpotOutbidTracker spotOutbidTracker;

    private final Map<ScalingGroupId, Long> timeouts = new HashMap<>();
    private final Map<String, String> lastActivityIds = new HashMap<>();

    @Inject
    public TimeoutReconciler(TimeoutReconcilerConfiguration configuration,
                             ScalingGroupConnector connector,
                             ActivityClassifier classifier,
                             Clock clock,
                             Registry registry) {
        this(configuration, connector, classifier, clock, registry, Schedulers.boundedElastic());
    }

    public TimeoutReconciler(TimeoutReconcilerConfiguration configuration,
                             ScalingGroupConnector connector,
                             ActivityClassifier classifier,
                             Clock clock,
                             Registry registry,
                             Scheduler scheduler) {
        this.configuration = configuration;
        this.connector = connector;
        this.classifier = classifier;
        this.clock = clock;
        this.scheduler = scheduler;
        this.metrics = new TimeoutReconcilerMetrics(registry);
        this.spotOutbidTracker = new SpotOutbidTracker(configuration, connector, clock, metrics);
    }

    /**
     * Refreshes the timeout state of the given groups from the latest provider data. Must be called once per
     * control loop iteration, before any {@link #isTimedOut(ScalingGroup)} query. In dry run mode, no provider
     * state is changed, but timeouts are still recorded.
     */
    public void refreshTimeouts(List<ScalingGroup> groups, boolean dryRun) {
        spotOutbidTracker.refresh(groups);

        Map<String, List<ScalingGroup>> groupsByRegion = CollectionsExt.groupByOrdered(groups, ScalingGroup::getRegion);
        List<String> regions = new ArrayList<>(groupsByRegion.keySet());
        Map<String, String> watermarks = new HashMap<>(lastActivityIds);
        int concurrency = Math.min(regions.size(), configuration.getRegionConcurrency());

        List<RegionActivities> allActivities = ReactorExt.mapOrdered(
                regions,
                region -> loadActivities(region, watermarks.get(region)),
                concurrency,
                scheduler
        ).block();

        for (RegionActivities regionActivities : allActivities) {
            String region = regionActivities.getRegion();
            regionActivities.getNewestCompletedActivityId().ifPresent(id -> lastActivityIds.put(region, id));

            for (ScalingGroup group : groupsByRegion.get(region)) {
                List<ScalingActivity> groupActivities = regionActivities.getActivitiesByGroup().getOrDefault(group.getName(), Collections.emptyList());
                if (!reconcile(group, groupActivities, dryRun)) {
                    if (timeouts.remove(group.getId()) != null) {
                        logger.info("{} timeout cleared", group);
                    } else {
                        logger.debug("{} has no timeout", group);
                    }
                }
            }
        }
    }

    public boolean isTimedOut(ScalingGroup group) {
        Long expiry = timeouts.get(group.getId());
        if (expiry != null && clock.isBefore(expiry)) {
            return true;
        }
        return spotOutbidTracker.isSpotTimedOut(group.getId());
    }

    /**
     * Returns the expiry time of the activity driven timeout of a group, which may already be in the past.
     */
    public Optional<Long> getTimeoutExpiry(ScalingGroupId groupId) {
        return Optional.ofNullable(timeouts.get(groupId));
    }

    public Optional<Long> getSpotTimeoutExpiry(ScalingGroupId groupId) {
        return spotOutbidTracker.getSpotTimeoutExpiry(groupId);
    }

    @VisibleForTesting
    Optional<String> getLastActivityId(String region) {
        return Optional.ofNullable(lastActivityIds.get(region));
    }

    @VisibleForTesting
    SpotOutbidTracker getSpotOutbidTracker() {
        return spotOutbidTracker;
    }

    /**
     * Activities are returned newest first. Reading stops at the activity seen as newest completed in the previous
     * pass, or at the first activity older than the staleness window, whichever comes first.
     */
    private RegionActivities loadActivities(String region, String watermark) {
        long cutoff = clock.wallTime() - configuration.getActivityStalenessMs();

        String newestCompletedId = null;
        Map<String, List<ScalingActivity>> activitiesByGroup = new HashMap<>();
        int count = 0;
        String pageToken = null;

        pages:
        do {
            Page<ScalingActivity> page = connector.getScalingActivities(region, pageToken);
            for (ScalingActivity activity : page.getItems()) {
                if (newestCompletedId == null && activity.isCompleted()) {
                    newestCompletedId = activity.getId();
                }
                if (activity.getId().equals(watermark)) {
                    break pages;
                }
                if (activity.getStartTime() < cutoff) {
                    break pages;
                }
                activitiesByGroup.computeIfAbsent(activity.getGroupId(), g -> new ArrayList<>()).add(activity);
                count++;
            }
            pageToken = page.getNextPageToken().orElse(null);
        } while (pageToken != null);

        logger.debug("Region {}: loaded {} new scaling activities (watermark {})", region, count, watermark);
        return new RegionActivities(region, activitiesByGroup, Optional.ofNullable(newestCompletedId));
    }

    /**
     * Applies the recovery rules to the recent activities of a group, newest first.
     *
     * @return true if the group is disqualified, in which case its current timeout must be kept
     */
    @VisibleForTesting
    boolean reconcile(ScalingGroup group, List<ScalingActivity> activities, boolean dryRun) {
        boolean disqualified = false;
        for (ScalingActivity activity : activities) {
            ActivityStatus status = activity.getStatus();
            if (status.isFailure()) {
                logger.warn("{} scaling failure: {}", group, activity);
                if (applyFailureRules(group, activity, dryRun)) {
                    return true;
                }
            } else if (status == ActivityStatus.WaitingForSpotInstanceId) {
                logger.warn("{} waiting for spot: {}", group, activity);
                if (handleWaitingForSpot(group, activity, dryRun)) {
                    disqualified = true;
                }
            }
        }
        return disqualified;
    }

    /**
     * @return true if a rule matched and the remaining activities must not be examined
     */
    private boolean applyFailureRules(ScalingGroup group, ScalingActivity activity, boolean dryRun) {
        ActivityClassification classification = classifier.classifyStatusMessage(activity.getStatusMessage());
        switch (classification.getCategory()) {
            case InstanceLimit:
                int maxDesiredCapacity = classification.getRequestedInstances().getAsInt() - 1;
                if (group.getDesiredCapacity() > maxDesiredCapacity) {
                    timeOut(group, activity, TimeoutReason.InstanceLimit);
                    changeDesiredCapacity(group, maxDesiredCapacity, TimeoutReason.InstanceLimit, dryRun);
                }
                return true;
            case VolumeLimit:
                timeOut(group, activity, TimeoutReason.VolumeLimit);
                return true;
            case CapacityLimit:
                if (revertCapacity(group, activity, TimeoutReason.CapacityLimit, dryRun)) {
                    timeOut(group, activity, TimeoutReason.CapacityLimit);
                }
                return true;
            case AzLimit:
                if (!group.getName().contains(configuration.getAzRestrictedGroupMarker())) {
                    return false;
                }
                if (revertCapacity(group, activity, TimeoutReason.AzLimit, dryRun)) {
                    timeOut(group, activity, TimeoutReason.AzLimit);
                }
                return true;
            case SpotRequestCancelled:
                logger.debug("{} spot request {} cancelled, skipping", group, classification.getSpotRequestId().orElse("?"));
                return false;
            case SpotLimit:
                timeOut(group, activity, TimeoutReason.SpotLimit);
                if (group.getDesiredCapacity() > group.getActualCapacity()) {
                    changeDesiredCapacity(group, group.getActualCapacity(), TimeoutReason.SpotLimit, dryRun);
                }
                return true;
            default:
                return false;
        }
    }

    /**
     * @return true if the group was timed out
     */
    private boolean handleWaitingForSpot(ScalingGroup group, ScalingActivity activity, boolean dryRun) {
        if (classifier.classifyCause(activity.getCause()).is(ActivityClassification.Category.AzRebalance)) {
            logger.info("{} ignoring zone balancing launch {}", group, activity.getId());
            return false;
        }
        if (clock.elapsedSince(activity.getStartTime()) <= configuration.getSpotRequestTimeoutMs()) {
            return false;
        }

        timeOut(group, activity, TimeoutReason.SpotRequestWaiting);

        Optional<String> spotRequestId = classifier.classifyStatusMessage(activity.getStatusMessage()).getSpotRequestId();
        if (!spotRequestId.isPresent()) {
            return true;
        }
        if (dryRun) {
            logger.info("[Dry run] Would have cancelled spot request {} and decremented desired capacity", spotRequestId.get());
            metrics.capacityChanged(TimeoutReason.SpotRequestWaiting, true);
            return true;
        }
        if (cancelSpotRequest(group.getRegion(), spotRequestId.get())) {
            group.setDesiredCapacity(group.getDesiredCapacity() - 1);
            metrics.capacityChanged(TimeoutReason.SpotRequestWaiting, false);
        }
        return true;
    }

    /**
     * Lowers the desired capacity back to its value before the capacity increase that triggered the activity.
     *
     * @return true if the increase could be identified, and the desired capacity is above the original value
     */
    private boolean revertCapacity(ScalingGroup group, ScalingActivity activity, TimeoutReason reason, boolean dryRun) {
        ActivityClassification cause = classifier.classifyCause(activity.getCause());
        if (!cause.is(ActivityClassification.Category.LaunchInstance)) {
            return false;
        }
        int originalCapacity = cause.getOriginalCapacity().getAsInt();
        if (group.getDesiredCapacity() <= originalCapacity) {
            return false;
        }
        changeDesiredCapacity(group, originalCapacity, reason, dryRun);
        return true;
    }

    private void changeDesiredCapacity(ScalingGroup group, int desiredCapacity, TimeoutReason reason, boolean dryRun) {
        if (dryRun) {
            logger.info("[Dry run] Would have set desired capacity to {}", desiredCapacity);
        } else {
            group.setDesiredCapacity(desiredCapacity);
        }
        metrics.capacityChanged(reason, dryRun);
    }

    @VisibleForTesting
    boolean cancelSpotRequest(String region, String spotRequestId) {
        Optional<SpotInstanceRequest> request = connector.findSpotInstanceRequest(region, spotRequestId);
        if (!request.isPresent()) {
            logger.info("Spot instance request {} not found in region {}", spotRequestId, region);
            return false;
        }
        if (!request.get().isCancellable()) {
            logger.info("Spot instance request {} not cancelled, as it is in state {}", spotRequestId, request.get().getState());
            return false;
        }
        connector.cancelSpotInstanceRequest(region, spotRequestId);
        metrics.spotRequestCancelled();
        logger.info("Spot instance request {} cancelled", spotRequestId);
        return true;
    }

    private void timeOut(ScalingGroup group, ScalingActivity activity, TimeoutReason reason) {
        long expiry = activity.getStartTime() + configuration.getTimeoutMs();
        timeouts.put(group.getId(), expiry);
        metrics.timedOut(reason);
        logger.info("{} is timed out until {} ({})", group, DateTimeExt.toUtcDateTimeString(expiry), reason);
    }

    private static class RegionActivities {

        private final String region;
        private final Map<String, List<ScalingActivity>> activitiesByGroup;
        private final Optional<String> newestCompletedActivityId;

        private RegionActivities(String region,
                                 Map<String, List<ScalingActivity>> activitiesByGroup,
                                 Optional<String> newestCompletedActivityId) {
            this.region = region;
            this.activitiesByGroup = activitiesByGroup;
            this.newestCompletedActivityId = newestCompletedActivityId;
        }

        private String getRegion() {
            return region;
        }

        private Map<String, List<ScalingActivity>> getActivitiesByGroup() {
            return activitiesByGroup;
        }

        private Optional<String> getNewestCompletedActivityId() {
            return newestCompletedActivityId;
        }
    }
}
