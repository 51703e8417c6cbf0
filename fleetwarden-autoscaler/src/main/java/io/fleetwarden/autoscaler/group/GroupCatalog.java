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

package io.fleetwarden.autoscaler.group;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import io.fleetwarden.api.connector.cloud.InstanceGroup;
import io.fleetwarden.api.connector.cloud.InstanceLaunchConfiguration;
import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.node.ClusterNode;
import io.fleetwarden.common.util.CollectionsExt;
import io.fleetwarden.common.util.StringExt;
import io.fleetwarden.common.util.rx.ReactorExt;
import io.fleetwarden.common.util.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Discovers the worker scaling groups of the cluster across all configured regions. Regions are loaded
 * concurrently, and the result lists groups region by region, in configuration order, each region sorted by
 * group name.
 */
@Singleton
public class GroupCatalog {

    private static final Logger logger = LoggerFactory.getLogger(GroupCatalog.class);

    @VisibleForTesting
    static final String TAG_CLUSTER = "KubernetesCluster";

    /**
     * Role tag keys, in no particular precedence. When a group carries more than one, the last one found wins.
     */
    @VisibleForTesting
    static final Set<String> TAG_ROLES = new HashSet<>(Arrays.asList("KubernetesRole", "Role"));

    @VisibleForTesting
    static final Set<String> WORKER_ROLES = new HashSet<>(Arrays.asList("worker", "kubernetes-minion"));

    private final GroupCatalogConfiguration configuration;
    private final ScalingGroupConnector connector;
    private final Scheduler scheduler;

    @Inject
    public GroupCatalog(GroupCatalogConfiguration configuration, ScalingGroupConnector connector) {
        this(configuration, connector, Schedulers.boundedElastic());
    }

    public GroupCatalog(GroupCatalogConfiguration configuration, ScalingGroupConnector connector, Scheduler scheduler) {
        this.configuration = configuration;
        this.connector = connector;
        this.scheduler = scheduler;
    }

    /**
     * Builds a fresh snapshot of the cluster scaling groups. A provider failure in any region fails the whole
     * call, as a partial group list would look like groups were removed.
     */
    public List<ScalingGroup> listGroups(Collection<ClusterNode> clusterNodes) {
        List<String> regions = configuration.getRegions();
        int concurrency = Math.min(regions.size(), configuration.getRegionConcurrency());

        List<Pair<String, RegionSnapshot>> snapshots = ReactorExt.mapOrdered(
                regions,
                region -> Pair.of(region, loadRegion(region)),
                concurrency,
                scheduler
        ).block();

        List<ScalingGroup> result = new ArrayList<>();
        for (Pair<String, RegionSnapshot> snapshot : snapshots) {
            String region = snapshot.getLeft();
            RegionSnapshot regionSnapshot = snapshot.getRight();
            for (InstanceGroup instanceGroup : regionSnapshot.getInstanceGroups()) {
                InstanceLaunchConfiguration launchConfiguration = regionSnapshot.getLaunchConfigurations().get(instanceGroup.getLaunchConfigurationName());
                if (launchConfiguration == null) {
                    logger.warn("Ignoring group {}/{}: launch configuration {} not found",
                            region, instanceGroup.getId(), instanceGroup.getLaunchConfigurationName());
                    continue;
                }
                result.add(new ScalingGroup(connector, region, instanceGroup, launchConfiguration, clusterNodes));
            }
        }
        logger.debug("Loaded {} cluster scaling groups from regions {}", result.size(), regions);
        return result;
    }

    private RegionSnapshot loadRegion(String region) {
        List<InstanceGroup> clusterGroups = connector.getInstanceGroups(region).stream()
                .filter(this::isClusterWorkerGroup)
                .sorted(Comparator.comparing(InstanceGroup::getId))
                .collect(Collectors.toList());

        List<String> launchConfigurationNames = clusterGroups.stream()
                .map(InstanceGroup::getLaunchConfigurationName)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());

        Map<String, InstanceLaunchConfiguration> launchConfigurations = new HashMap<>();
        for (List<String> batch : CollectionsExt.chop(launchConfigurationNames, configuration.getLaunchConfigurationBatchSize())) {
            for (InstanceLaunchConfiguration launchConfiguration : connector.getLaunchConfigurations(region, batch)) {
                launchConfigurations.put(launchConfiguration.getId(), launchConfiguration);
            }
        }
        logger.debug("Region {}: {} cluster groups, {} launch configurations", region, clusterGroups.size(), launchConfigurations.size());
        return new RegionSnapshot(clusterGroups, launchConfigurations);
    }

    /**
     * Without a configured cluster name, all groups are accepted.
     */
    @VisibleForTesting
    boolean isClusterWorkerGroup(InstanceGroup instanceGroup) {
        String clusterName = configuration.getClusterName();
        if (StringExt.isEmpty(clusterName)) {
            return true;
        }
        String groupCluster = null;
        String role = null;
        for (Map.Entry<String, String> tag : instanceGroup.getTags().entrySet()) {
            if (TAG_CLUSTER.equals(tag.getKey())) {
                groupCluster = tag.getValue();
            } else if (TAG_ROLES.contains(tag.getKey())) {
                role = tag.getValue();
            }
        }
        return clusterName.equals(groupCluster) && role != null && WORKER_ROLES.contains(role);
    }

    private static class RegionSnapshot {

        private final List<InstanceGroup> instanceGroups;
        private final Map<String, InstanceLaunchConfiguration> launchConfigurations;

        private RegionSnapshot(List<InstanceGroup> instanceGroups, Map<String, InstanceLaunchConfiguration> launchConfigurations) {
            this.instanceGroups = instanceGroups;
            this.launchConfigurations = launchConfigurations;
        }

        private List<InstanceGroup> getInstanceGroups() {
            return instanceGroups;
        }

        private Map<String, InstanceLaunchConfiguration> getLaunchConfigurations() {
            return launchConfigurations;
        }
    }
}
