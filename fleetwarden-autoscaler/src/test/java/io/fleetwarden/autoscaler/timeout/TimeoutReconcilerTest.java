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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.netflix.spectator.api.DefaultRegistry;
import io.fleetwarden.api.connector.cloud.ActivityStatus;
import io.fleetwarden.api.connector.cloud.InstanceGroup;
import io.fleetwarden.api.connector.cloud.InstanceLaunchConfiguration;
import io.fleetwarden.api.connector.cloud.Page;
import io.fleetwarden.api.connector.cloud.ScalingActivity;
import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.connector.cloud.SpotInstanceRequest;
import io.fleetwarden.autoscaler.group.ScalingGroup;
import io.fleetwarden.autoscaler.group.ScalingGroupGenerator;
import io.fleetwarden.common.util.archaius2.Archaius2Ext;
import io.fleetwarden.common.util.time.Clocks;
import io.fleetwarden.common.util.time.TestClock;
import org.junit.Test;
import reactor.core.scheduler.Schedulers;

import static io.fleetwarden.autoscaler.group.ScalingGroupGenerator.REGION;
import static io.fleetwarden.autoscaler.group.ScalingGroupGenerator.newScalingGroup;
import static io.fleetwarden.autoscaler.group.ScalingGroupGenerator.onDemandLaunchConfiguration;
import static io.fleetwarden.autoscaler.group.ScalingGroupGenerator.schedulableNode;
import static io.fleetwarden.autoscaler.group.ScalingGroupGenerator.spotLaunchConfiguration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TimeoutReconcilerTest {

    private static final long NOW = 1_800_000_000_000L;
    private static final long ONE_HOUR_MS = 3_600_000L;

    private static final InstanceLaunchConfiguration M4_LARGE = onDemandLaunchConfiguration("lc-m4", "m4.large");
    private static final InstanceLaunchConfiguration R4_SPOT = spotLaunchConfiguration("lc-r4-spot", "r4.large", 0.1);

    private final TestClock clock = Clocks.test(NOW);
    private final ScalingGroupConnector connector = mock(ScalingGroupConnector.class);
    private final DefaultRegistry registry = new DefaultRegistry();

    private final TimeoutReconciler reconciler = new TimeoutReconciler(
            Archaius2Ext.newConfiguration(TimeoutReconcilerConfiguration.class),
            connector,
            new DefaultActivityClassifier(),
            clock,
            registry,
            Schedulers.immediate()
    );

    private int nextActivityId;

    @Test
    public void testInstanceLimitCapsDesiredCapacity() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        ScalingActivity failure = failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, "");
        givenActivities(failure);

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector).setDesiredCapacity(REGION, "workers", 11);
        assertThat(group.getDesiredCapacity()).isEqualTo(11);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(reconciler.getTimeoutExpiry(group.getId())).contains(failure.getStartTime() + ONE_HOUR_MS);
        assertThat(timeouts(TimeoutReason.InstanceLimit)).isEqualTo(1);
        assertThat(capacityChanges(TimeoutReason.InstanceLimit, false)).isEqualTo(1);

        clock.advanceTime(51, TimeUnit.MINUTES);
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testInstanceLimitInDryRunOnlyRecordsTimeout() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        givenActivities(failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, ""));

        reconciler.refreshTimeouts(Collections.singletonList(group), true);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(group.getDesiredCapacity()).isEqualTo(12);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(capacityChanges(TimeoutReason.InstanceLimit, true)).isEqualTo(1);
    }

    @Test
    public void testInstanceLimitBelowCapIsIgnored() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 11, 20, M4_LARGE);
        givenActivities(failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, ""));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testVolumeLimitTimesOutWithoutCapacityChange() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 8, 20, M4_LARGE);
        givenActivities(failed("workers", minutesAgo(5), ActivityMessages.VOLUME_LIMIT, ActivityMessages.LAUNCH_CAUSE));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.isTimedOut(group)).isTrue();
    }

    @Test
    public void testCapacityLimitRevertsLaunchIncrease() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 6, 20, M4_LARGE);
        givenActivities(failed("workers", minutesAgo(5), ActivityMessages.CAPACITY_LIMIT, ActivityMessages.LAUNCH_CAUSE));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector).setDesiredCapacity(REGION, "workers", 4);
        assertThat(reconciler.isTimedOut(group)).isTrue();
    }

    @Test
    public void testCapacityLimitWithoutLaunchCauseIsNotTimedOut() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 6, 20, M4_LARGE);
        givenActivities(
                failed("workers", minutesAgo(5), ActivityMessages.CAPACITY_LIMIT, "manual change"),
                failed("workers", minutesAgo(6), ActivityMessages.VOLUME_LIMIT, "")
        );

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testAzLimitAppliesOnlyToZoneRestrictedGroups() {
        ScalingGroup restricted = newScalingGroup(connector, "workers-only-az-a", 0, 6, 20, M4_LARGE);
        ScalingGroup regular = newScalingGroup(connector, "workers", 0, 6, 20, M4_LARGE);
        givenActivities(
                failed("workers-only-az-a", minutesAgo(5), ActivityMessages.AZ_LIMIT, ActivityMessages.LAUNCH_CAUSE),
                failed("workers", minutesAgo(5), ActivityMessages.AZ_LIMIT, ActivityMessages.LAUNCH_CAUSE)
        );

        reconciler.refreshTimeouts(Arrays.asList(restricted, regular), false);

        verify(connector).setDesiredCapacity(REGION, "workers-only-az-a", 4);
        verify(connector, never()).setDesiredCapacity(eq(REGION), eq("workers"), anyInt());
        assertThat(reconciler.isTimedOut(restricted)).isTrue();
        assertThat(reconciler.isTimedOut(regular)).isFalse();
    }

    @Test
    public void testCapacityLimitInDryRunOnlyRecordsTimeout() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 6, 20, M4_LARGE);
        givenActivities(failed("workers", minutesAgo(5), ActivityMessages.CAPACITY_LIMIT, ActivityMessages.LAUNCH_CAUSE));

        reconciler.refreshTimeouts(Collections.singletonList(group), true);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(group.getDesiredCapacity()).isEqualTo(6);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(capacityChanges(TimeoutReason.CapacityLimit, true)).isEqualTo(1);
    }

    @Test
    public void testAzLimitInDryRunOnlyRecordsTimeout() {
        ScalingGroup group = newScalingGroup(connector, "workers-only-az-a", 0, 6, 20, M4_LARGE);
        givenActivities(failed("workers-only-az-a", minutesAgo(5), ActivityMessages.AZ_LIMIT, ActivityMessages.LAUNCH_CAUSE));

        reconciler.refreshTimeouts(Collections.singletonList(group), true);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(group.getDesiredCapacity()).isEqualTo(6);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(capacityChanges(TimeoutReason.AzLimit, true)).isEqualTo(1);
    }

    @Test
    public void testSpotLimitInDryRunOnlyRecordsTimeout() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 5, 20, M4_LARGE, schedulableNode("i-1"), schedulableNode("i-2"));
        givenActivities(failed("workers", minutesAgo(2), ActivityMessages.SPOT_LIMIT, ""));

        reconciler.refreshTimeouts(Collections.singletonList(group), true);

        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(group.getDesiredCapacity()).isEqualTo(5);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(timeouts(TimeoutReason.SpotLimit)).isEqualTo(1);
        assertThat(capacityChanges(TimeoutReason.SpotLimit, true)).isEqualTo(1);
        assertThat(capacityChanges(TimeoutReason.SpotLimit, false)).isZero();
    }

    @Test
    public void testSpotRequestCancellationDoesNotStopReconciliation() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        givenActivities(
                cancelled("workers", minutesAgo(2), ActivityMessages.SPOT_REQUEST_CANCELLED),
                failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, "")
        );

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector).setDesiredCapacity(REGION, "workers", 11);
        assertThat(reconciler.isTimedOut(group)).isTrue();
    }

    @Test
    public void testSpotRequestCancellationAloneIsBenign() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        givenActivities(cancelled("workers", minutesAgo(2), ActivityMessages.SPOT_REQUEST_CANCELLED));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testFirstMatchingFailureWins() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 5, 20, M4_LARGE, schedulableNode("i-1"), schedulableNode("i-2"));
        givenActivities(
                failed("workers", minutesAgo(2), ActivityMessages.SPOT_LIMIT, ""),
                failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, "")
        );

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector).setDesiredCapacity(REGION, "workers", 2);
        verify(connector, times(1)).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(timeouts(TimeoutReason.SpotLimit)).isEqualTo(1);
        assertThat(timeouts(TimeoutReason.InstanceLimit)).isZero();
    }

    @Test
    public void testWaitingSpotRequestsAreCancelled() {
        ScalingGroup group = newScalingGroup(connector, "spot-workers", 0, 6, 20, R4_SPOT);
        givenActivities(
                waitingForSpot("spot-workers", minutesAgo(6), "Placed Spot instance request: sir-1. Waiting for instance(s)"),
                waitingForSpot("spot-workers", minutesAgo(8), "Placed Spot instance request: sir-2. Waiting for instance(s)")
        );
        when(connector.findSpotInstanceRequest(REGION, "sir-1")).thenReturn(Optional.of(new SpotInstanceRequest("sir-1", SpotInstanceRequest.State.Open)));
        when(connector.findSpotInstanceRequest(REGION, "sir-2")).thenReturn(Optional.of(new SpotInstanceRequest("sir-2", SpotInstanceRequest.State.Active)));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector).cancelSpotInstanceRequest(REGION, "sir-1");
        verify(connector).cancelSpotInstanceRequest(REGION, "sir-2");
        verify(connector).setDesiredCapacity(REGION, "spot-workers", 5);
        verify(connector).setDesiredCapacity(REGION, "spot-workers", 4);
        assertThat(group.getDesiredCapacity()).isEqualTo(4);
        assertThat(reconciler.isTimedOut(group)).isTrue();
        assertThat(registry.counter(TimeoutReconcilerMetrics.SPOT_REQUEST_CANCELLATIONS).count()).isEqualTo(2);
    }

    @Test
    public void testSpotRequestInFinalStateIsNotCancelled() {
        ScalingGroup group = newScalingGroup(connector, "spot-workers", 0, 6, 20, R4_SPOT);
        givenActivities(waitingForSpot("spot-workers", minutesAgo(6), ActivityMessages.SPOT_REQUEST_WAITING));
        when(connector.findSpotInstanceRequest(REGION, "sir-def67890"))
                .thenReturn(Optional.of(new SpotInstanceRequest("sir-def67890", SpotInstanceRequest.State.Closed)));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).cancelSpotInstanceRequest(anyString(), anyString());
        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.isTimedOut(group)).isTrue();
    }

    @Test
    public void testUnknownSpotRequestIsNotCancelled() {
        when(connector.findSpotInstanceRequest(REGION, "sir-gone")).thenReturn(Optional.empty());

        assertThat(reconciler.cancelSpotRequest(REGION, "sir-gone")).isFalse();
        verify(connector, never()).cancelSpotInstanceRequest(anyString(), anyString());
    }

    @Test
    public void testRecentSpotRequestIsLeftAlone() {
        ScalingGroup group = newScalingGroup(connector, "spot-workers", 0, 6, 20, R4_SPOT);
        givenActivities(waitingForSpot("spot-workers", minutesAgo(2), ActivityMessages.SPOT_REQUEST_WAITING));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).findSpotInstanceRequest(anyString(), anyString());
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testZoneBalancingSpotRequestIsIgnored() {
        ScalingGroup group = newScalingGroup(connector, "spot-workers", 0, 6, 20, R4_SPOT);
        ScalingActivity balancing = ScalingActivity.newBuilder()
                .withId("balance")
                .withGroupId("spot-workers")
                .withStartTime(minutesAgo(30))
                .withProgress(20)
                .withStatus(ActivityStatus.WaitingForSpotInstanceId)
                .withStatusMessage(ActivityMessages.SPOT_REQUEST_WAITING)
                .withCause(ActivityMessages.AZ_BALANCE_CAUSE)
                .build();
        givenActivities(balancing);

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).findSpotInstanceRequest(anyString(), anyString());
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testWaitingSpotRequestInDryRunIsNotCancelled() {
        ScalingGroup group = newScalingGroup(connector, "spot-workers", 0, 6, 20, R4_SPOT);
        givenActivities(waitingForSpot("spot-workers", minutesAgo(6), ActivityMessages.SPOT_REQUEST_WAITING));

        reconciler.refreshTimeouts(Collections.singletonList(group), true);

        verify(connector, never()).findSpotInstanceRequest(anyString(), anyString());
        verify(connector, never()).cancelSpotInstanceRequest(anyString(), anyString());
        assertThat(group.getDesiredCapacity()).isEqualTo(6);
        assertThat(reconciler.isTimedOut(group)).isTrue();
    }

    @Test
    public void testActivitiesOfOtherGroupsAreNotApplied() {
        ScalingGroup failing = newScalingGroup(connector, "failing", 0, 12, 20, M4_LARGE);
        ScalingGroup healthy = newScalingGroup(connector, "healthy", 0, 12, 20, M4_LARGE);
        givenActivities(failed("failing", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, ""));

        reconciler.refreshTimeouts(Arrays.asList(failing, healthy), false);

        assertThat(reconciler.isTimedOut(failing)).isTrue();
        assertThat(reconciler.isTimedOut(healthy)).isFalse();
    }

    @Test
    public void testWatermarkStopsActivityScan() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        ScalingActivity inProgress = ScalingActivity.newBuilder()
                .withId("a3")
                .withGroupId("workers")
                .withStartTime(minutesAgo(1))
                .withProgress(30)
                .withStatus(ActivityStatus.InProgress)
                .build();
        ScalingActivity completed = successful("a2", "workers", minutesAgo(5));
        ScalingActivity olderFailure = failed("workers", minutesAgo(10), ActivityMessages.INSTANCE_LIMIT, "");
        when(connector.getScalingActivities(eq(REGION), isNull())).thenReturn(new Page<>(Arrays.asList(inProgress, completed), "page2"));
        when(connector.getScalingActivities(REGION, "page2")).thenReturn(new Page<>(Collections.singletonList(olderFailure), null));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);
        assertThat(reconciler.getLastActivityId(REGION)).contains("a2");
        assertThat(reconciler.isTimedOut(group)).isTrue();

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        // The second pass stops at a2, so the older failure is not reapplied, and the timeout is cleared
        verify(connector, times(2)).getScalingActivities(eq(REGION), isNull());
        verify(connector, times(1)).getScalingActivities(REGION, "page2");
        verify(connector, times(1)).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.getLastActivityId(REGION)).contains("a2");
        assertThat(reconciler.isTimedOut(group)).isFalse();
    }

    @Test
    public void testWatermarkIsKeptWithoutCompletedActivities() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 1, 20, M4_LARGE);
        givenActivities(successful("a1", "workers", minutesAgo(5)));
        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        givenActivities();
        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        assertThat(reconciler.getLastActivityId(REGION)).contains("a1");
    }

    @Test
    public void testStaleActivitiesAreNotExamined() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        ScalingActivity stale = failed("workers", minutesAgo(61), ActivityMessages.INSTANCE_LIMIT, "");
        when(connector.getScalingActivities(eq(REGION), isNull())).thenReturn(new Page<>(Collections.singletonList(stale), "page2"));

        reconciler.refreshTimeouts(Collections.singletonList(group), false);

        verify(connector, never()).getScalingActivities(REGION, "page2");
        verify(connector, never()).setDesiredCapacity(anyString(), anyString(), anyInt());
        assertThat(reconciler.isTimedOut(group)).isFalse();
        // A completed activity becomes the watermark, even if it is beyond the staleness cutoff
        assertThat(reconciler.getLastActivityId(REGION)).contains(stale.getId());
    }

    @Test
    public void testActivityFetchFailurePropagates() {
        ScalingGroup group = newScalingGroup(connector, "workers", 0, 12, 20, M4_LARGE);
        when(connector.getScalingActivities(eq(REGION), any())).thenThrow(new IllegalStateException("simulated provider failure"));

        assertThatThrownBy(() -> reconciler.refreshTimeouts(Collections.singletonList(group), false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("simulated provider failure");
    }

    @Test
    public void testActivityFetchesAreBoundedByRegionConcurrency() {
        TimeoutReconciler boundedReconciler = new TimeoutReconciler(
                Archaius2Ext.newConfiguration(TimeoutReconcilerConfiguration.class, "fleetwarden.reconciler.regionConcurrency", "2"),
                connector,
                new DefaultActivityClassifier(),
                clock,
                registry,
                Schedulers.boundedElastic()
        );
        List<ScalingGroup> groups = Arrays.asList(
                groupInRegion("us-east-1"),
                groupInRegion("us-east-2"),
                groupInRegion("us-west-1"),
                groupInRegion("us-west-2"),
                groupInRegion("eu-west-1")
        );
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(connector.getScalingActivities(anyString(), isNull())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return Page.empty();
        });

        boundedReconciler.refreshTimeouts(groups, false);

        verify(connector, times(5)).getScalingActivities(anyString(), isNull());
        assertThat(maxInFlight.get()).isBetween(1, 2);
    }

    @Test
    public void testNoGroupsNoProviderCalls() {
        reconciler.refreshTimeouts(Collections.emptyList(), false);

        verify(connector, never()).getScalingActivities(anyString(), any());
    }

    private ScalingGroup groupInRegion(String region) {
        InstanceGroup instanceGroup = ScalingGroupGenerator.instanceGroup("workers-" + region)
                .withLaunchConfigurationName(M4_LARGE.getId())
                .build();
        return new ScalingGroup(connector, region, instanceGroup, M4_LARGE, Collections.emptyList());
    }

    private void givenActivities(ScalingActivity... activities) {
        when(connector.getScalingActivities(eq(REGION), isNull())).thenReturn(new Page<>(Arrays.asList(activities), null));
    }

    private long minutesAgo(int minutes) {
        return clock.wallTime() - TimeUnit.MINUTES.toMillis(minutes);
    }

    private ScalingActivity failed(String groupName, long startTime, String statusMessage, String cause) {
        return ScalingActivity.newBuilder()
                .withId("activity-" + nextActivityId++)
                .withGroupId(groupName)
                .withStartTime(startTime)
                .withProgress(100)
                .withStatus(ActivityStatus.Failed)
                .withStatusMessage(statusMessage)
                .withCause(cause)
                .build();
    }

    private ScalingActivity cancelled(String groupName, long startTime, String statusMessage) {
        return ScalingActivity.newBuilder()
                .withId("activity-" + nextActivityId++)
                .withGroupId(groupName)
                .withStartTime(startTime)
                .withProgress(100)
                .withStatus(ActivityStatus.Cancelled)
                .withStatusMessage(statusMessage)
                .build();
    }

    private ScalingActivity waitingForSpot(String groupName, long startTime, String statusMessage) {
        return ScalingActivity.newBuilder()
                .withId("activity-" + nextActivityId++)
                .withGroupId(groupName)
                .withStartTime(startTime)
                .withProgress(20)
                .withStatus(ActivityStatus.WaitingForSpotInstanceId)
                .withStatusMessage(statusMessage)
                .withCause(ActivityMessages.LAUNCH_CAUSE)
                .build();
    }

    private static ScalingActivity successful(String id, String groupName, long startTime) {
        return ScalingActivity.newBuilder()
                .withId(id)
                .withGroupId(groupName)
                .withStartTime(startTime)
                .withProgress(100)
                .withStatus(ActivityStatus.Successful)
                .build();
    }

    private long timeouts(TimeoutReason reason) {
        return registry.counter(registry.createId(TimeoutReconcilerMetrics.TIMEOUTS).withTag("reason", reason.name())).count();
    }

    private long capacityChanges(TimeoutReason reason, boolean dryRun) {
        return registry.counter(registry.createId(TimeoutReconcilerMetrics.CAPACITY_CHANGES)
                .withTag("reason", reason.name())
                .withTag("dryRun", Boolean.toString(dryRun))
        ).count();
    }
}
