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
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.connector.cloud.SpotPrice;
import io.fleetwarden.autoscaler.group.ScalingGroup;
import io.fleetwarden.autoscaler.group.ScalingGroupId;
import io.fleetwarden.common.util.DateTimeExt;
import io.fleetwarden.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a rolling per region spot price history, and times out spot groups that spent too long outbid. This is
 * a separate timeout channel from the activity driven one, so a spot group can be timed out by either.
 */
class SpotOutbidTracker {

    private static final Logger logger = LoggerFactory.getLogger(SpotOutbidTracker.class);

    private static final Comparator<SpotPrice> TIMESTAMP_ORDER = Comparator.comparingLong(SpotPrice::getTimestamp);

    private final TimeoutReconcilerConfiguration configuration;
    private final ScalingGroupConnector connector;
    private final Clock clock;
    private final TimeoutReconcilerMetrics metrics;

    private final Map<String, List<SpotPrice>> priceHistoryByRegion = new HashMap<>();
    private final Map<ScalingGroupId, Long> spotTimeouts = new HashMap<>();

    SpotOutbidTracker(TimeoutReconcilerConfiguration configuration,
                      ScalingGroupConnector connector,
                      Clock clock,
                      TimeoutReconcilerMetrics metrics) {
        this.configuration = configuration;
        this.connector = connector;
        this.clock = clock;
        this.metrics = metrics;
    }

    void refresh(List<ScalingGroup> groups) {
        Map<String, List<ScalingGroup>> spotGroupsByRegion = new LinkedHashMap<>();
        for (ScalingGroup group : groups) {
            if (group.isSpot()) {
                spotGroupsByRegion.computeIfAbsent(group.getRegion(), r -> new ArrayList<>()).add(group);
            }
        }

        long now = clock.wallTime();
        spotGroupsByRegion.forEach((region, regionGroups) -> {
            Set<String> instanceTypes = regionGroups.stream().map(ScalingGroup::getInstanceType).collect(Collectors.toCollection(LinkedHashSet::new));
            List<SpotPrice> history = updateHistory(region, instanceTypes, now);
            for (ScalingGroup group : regionGroups) {
                evaluate(group, history, now);
            }
        });

        metrics.setSpotTimedOutGroups((int) spotTimeouts.values().stream().filter(clock::isBefore).count());
    }

    boolean isSpotTimedOut(ScalingGroupId groupId) {
        Long expiry = spotTimeouts.get(groupId);
        return expiry != null && clock.isBefore(expiry);
    }

    Optional<Long> getSpotTimeoutExpiry(ScalingGroupId groupId) {
        return Optional.ofNullable(spotTimeouts.get(groupId));
    }

    List<SpotPrice> getPriceHistory(String region) {
        return Collections.unmodifiableList(priceHistoryByRegion.getOrDefault(region, Collections.emptyList()));
    }

    /**
     * Drops samples older than the history period, and appends samples newer than the latest one held. Overlapping
     * samples returned by the provider are deduplicated.
     */
    private List<SpotPrice> updateHistory(String region, Set<String> instanceTypes, long now) {
        long periodStart = now - configuration.getSpotPriceHistoryPeriodMs();
        List<SpotPrice> retained = priceHistoryByRegion.getOrDefault(region, Collections.emptyList()).stream()
                .filter(price -> price.getTimestamp() >= periodStart)
                .collect(Collectors.toList());
        long fetchFrom = retained.stream().mapToLong(SpotPrice::getTimestamp).max().orElse(periodStart);

        List<SpotPrice> fetched = connector.getSpotPriceHistory(region, instanceTypes, fetchFrom);

        LinkedHashSet<SpotPrice> merged = new LinkedHashSet<>(retained);
        merged.addAll(fetched);
        List<SpotPrice> history = new ArrayList<>(merged);
        history.sort(TIMESTAMP_ORDER);

        priceHistoryByRegion.put(region, history);
        logger.debug("Region {}: {} spot price samples ({} fetched)", region, history.size(), fetched.size());
        return history;
    }

    private void evaluate(ScalingGroup group, List<SpotPrice> history, long now) {
        double bidPrice = group.getBidPrice().orElse(0.0);

        Map<String, Long> lastSampleByZone = new HashMap<>();
        Map<String, Long> outbidTimeByZone = new HashMap<>();
        for (SpotPrice price : history) {
            if (!price.getInstanceType().equals(group.getInstanceType())) {
                continue;
            }
            Long previous = lastSampleByZone.put(price.getAvailabilityZone(), price.getTimestamp());
            if (previous != null && price.getPrice() > bidPrice) {
                outbidTimeByZone.merge(price.getAvailabilityZone(), price.getTimestamp() - previous, Long::sum);
            }
        }

        List<Long> outbidTimes = outbidTimeByZone.values().stream().filter(time -> time > 0).collect(Collectors.toList());
        long averageOutbidMs = outbidTimes.isEmpty()
                ? 0
                : outbidTimes.stream().mapToLong(Long::longValue).sum() / outbidTimes.size();

        if (averageOutbidMs > configuration.getMaxAverageOutbidMs()) {
            long expiry = now + configuration.getTimeoutMs();
            spotTimeouts.put(group.getId(), expiry);
            metrics.timedOut(TimeoutReason.SpotOutbid);
            logger.info("{} is spot timed out until {}: outbid for {} on average in {} zones (bid price {})",
                    group, DateTimeExt.toUtcDateTimeString(expiry), DateTimeExt.toSecondsString(averageOutbidMs), outbidTimes.size(), bidPrice);
        } else if (spotTimeouts.remove(group.getId()) != null) {
            logger.info("{} spot timeout cleared: outbid for {} on average", group, DateTimeExt.toSecondsString(averageOutbidMs));
        }
    }
}
