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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.fleetwarden.api.connector.cloud.CloudConnectorException;
import io.fleetwarden.api.connector.cloud.InstanceGroup;
import io.fleetwarden.api.connector.cloud.InstanceLaunchConfiguration;
import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.node.ClusterNode;
import io.fleetwarden.api.node.Workload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A scaling group as seen during one control loop iteration. It is built from a provider snapshot, and only its
 * desired capacity and membership change afterwards, through {@link #scale(int)}, {@link #setDesiredCapacity(int)}
 * and {@link #scaleNodesIn(Collection)}. State that must survive iterations is kept elsewhere, keyed by
 * {@link #getId()}.
 */
public class ScalingGroup {

    private static final Logger logger = LoggerFactory.getLogger(ScalingGroup.class);

    public static final String SELECTOR_INSTANCE_TYPE = "aws/type";
    public static final String SELECTOR_INSTANCE_CLASS = "aws/class";
    public static final String SELECTOR_IMAGE_ID = "aws/ami-id";
    public static final String SELECTOR_REGION = "aws/region";
    public static final String SELECTOR_KUBE_INSTANCE_TYPE = "beta.kubernetes.io/instance-type";
    public static final String SELECTOR_KUBE_REGION = "failure-domain.beta.kubernetes.io/region";

    /**
     * Group tags with this key prefix become selectors, with the prefix removed.
     */
    public static final String SELECTOR_TAG_PREFIX = "kube/";

    private final ScalingGroupConnector connector;
    private final ScalingGroupId id;
    private final InstanceLaunchConfiguration launchConfiguration;
    private final int minSize;
    private final int maxSize;
    private final Map<String, String> selectors;
    private final Map<String, String> noScheduleTaints;
    private final Set<String> instanceIds;
    private final List<ClusterNode> nodes;
    private final List<ClusterNode> unschedulableNodes;

    private int desiredCapacity;

    public ScalingGroup(ScalingGroupConnector connector,
                        String region,
                        InstanceGroup instanceGroup,
                        InstanceLaunchConfiguration launchConfiguration,
                        Collection<ClusterNode> clusterNodes) {
        this(connector, region, instanceGroup, launchConfiguration, clusterNodes, Collections.emptyMap());
    }

    public ScalingGroup(ScalingGroupConnector connector,
                        String region,
                        InstanceGroup instanceGroup,
                        InstanceLaunchConfiguration launchConfiguration,
                        Collection<ClusterNode> clusterNodes,
                        Map<String, String> noScheduleTaints) {
        this.connector = connector;
        this.id = ScalingGroupId.of(region, instanceGroup.getId());
        this.launchConfiguration = launchConfiguration;
        this.minSize = instanceGroup.getMin();
        this.maxSize = instanceGroup.getMax();
        this.desiredCapacity = instanceGroup.getDesired();
        this.selectors = Collections.unmodifiableMap(buildSelectors(region, launchConfiguration, instanceGroup.getTags()));
        this.noScheduleTaints = Collections.unmodifiableMap(new HashMap<>(noScheduleTaints));
        this.instanceIds = new HashSet<>(instanceGroup.getInstanceIds());
        this.nodes = clusterNodes.stream()
                .filter(node -> instanceIds.contains(node.getInstanceId()))
                .collect(Collectors.toCollection(ArrayList::new));
        this.unschedulableNodes = nodes.stream()
                .filter(ClusterNode::isUnschedulable)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public ScalingGroupId getId() {
        return id;
    }

    public String getRegion() {
        return id.getRegion();
    }

    public String getName() {
        return id.getName();
    }

    public int getDesiredCapacity() {
        return desiredCapacity;
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Number of cluster nodes backed by instances of this group.
     */
    public int getActualCapacity() {
        return nodes.size();
    }

    public InstanceLaunchConfiguration getLaunchConfiguration() {
        return launchConfiguration;
    }

    public String getInstanceType() {
        return launchConfiguration.getInstanceType();
    }

    public boolean isSpot() {
        return launchConfiguration.getSpotPrice().isPresent();
    }

    public Optional<Double> getBidPrice() {
        return launchConfiguration.getSpotPrice();
    }

    public Map<String, String> getSelectors() {
        return selectors;
    }

    public Map<String, String> getNoScheduleTaints() {
        return noScheduleTaints;
    }

    public List<ClusterNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<ClusterNode> getUnschedulableNodes() {
        return Collections.unmodifiableList(unschedulableNodes);
    }

    /**
     * Sets the desired capacity of the underlying group directly, bypassing the cooldown period. No min/max
     * validation is done here. This is meant for internal control, scaling decisions should go through
     * {@link #scale(int)}.
     */
    public void setDesiredCapacity(int newDesiredCapacity) {
        logger.info("{}: setting desired capacity to {} (was {})", this, newDesiredCapacity, desiredCapacity);
        connector.setDesiredCapacity(id.getRegion(), id.getName(), newDesiredCapacity);
        this.desiredCapacity = newDesiredCapacity;
    }

    /**
     * Scales the group up towards the target capacity, capped at the group's max size. Unschedulable nodes are
     * uncordoned first, until enough schedulable nodes exist, whether or not the capacity changes afterwards.
     * This method never lowers the desired capacity, as the provider would pick the instances to terminate by its
     * own policy. Use {@link #scaleNodesIn(Collection)} to shrink the group.
     *
     * @return true if the desired capacity has been increased
     */
    public boolean scale(int targetCapacity) {
        int desired = Math.min(maxSize, targetCapacity);
        int numUnschedulable = unschedulableNodes.size();
        int numSchedulable = getActualCapacity() - numUnschedulable;

        logger.info("{}: desired {}, currently at {}", this, desired, desiredCapacity);
        logger.info("{}: cluster nodes: {} schedulable, {} unschedulable", this, numSchedulable, numUnschedulable);

        if (numSchedulable < desired) {
            for (Iterator<ClusterNode> it = unschedulableNodes.iterator(); it.hasNext() && numSchedulable < desired; ) {
                ClusterNode node = it.next();
                if (node.uncordon()) {
                    it.remove();
                    numSchedulable++;
                }
            }
        }

        if (desiredCapacity == desired) {
            logger.info("{}: doing nothing, desired capacity correctly set: {}, schedulable: {}", this, desired, numSchedulable);
            return false;
        }
        if (desiredCapacity == maxSize) {
            logger.info("{}: desired same as max, desired: {}, schedulable: {}", this, desiredCapacity, numSchedulable);
            return false;
        }
        if (desiredCapacity < desired) {
            setDesiredCapacity(desired);
            return true;
        }

        logger.info("{}: not scaling down from {} to {}, schedulable: {}", this, desiredCapacity, desired, numSchedulable);
        return false;
    }

    /**
     * Terminates the instances backing the given nodes, one by one. The desired capacity is decremented with each
     * termination, unless the group is already at its min size. A termination refused because of the min size
     * constraint is logged and skipped. Any other provider failure aborts the remaining terminations.
     */
    public void scaleNodesIn(Collection<ClusterNode> nodesToRemove) {
        for (ClusterNode node : nodesToRemove) {
            boolean decrementCapacity = desiredCapacity > minSize;
            try {
                connector.terminateInstance(id.getRegion(), node.getInstanceId(), decrementCapacity);
            } catch (CloudConnectorException e) {
                if (!CloudConnectorException.isThis(e, CloudConnectorException.ErrorCode.MinSizeViolation)) {
                    throw e;
                }
                logger.warn("{}: failed to terminate instance {}: {}", this, node.getInstanceId(), e.getMessage());
                continue;
            }
            if (decrementCapacity) {
                desiredCapacity--;
            }
            nodes.remove(node);
            unschedulableNodes.remove(node);
            instanceIds.remove(node.getInstanceId());
            logger.info("{}: scaled node {} in (decrement desired capacity: {})", this, node.getInstanceId(), decrementCapacity);
        }
    }

    public boolean contains(ClusterNode node) {
        return instanceIds.contains(node.getInstanceId());
    }

    public boolean isMatchForSelectors(Map<String, String> requiredSelectors) {
        for (Map.Entry<String, String> entry : requiredSelectors.entrySet()) {
            if (!entry.getValue().equals(selectors.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if the workload selects this group, and tolerates all of its NoSchedule taints.
     */
    public boolean isTaintsTolerated(Workload workload) {
        if (!isMatchForSelectors(workload.getSelectors())) {
            return false;
        }
        if (workload.hasNoScheduleWildcardToleration()) {
            return true;
        }
        return workload.getNoScheduleExistentialTolerations().containsAll(noScheduleTaints.keySet());
    }

    @Override
    public String toString() {
        return "ScalingGroup{" +
                "id=" + id +
                ", instanceType=" + launchConfiguration.getInstanceType() +
                ", spot=" + isSpot() +
                '}';
    }

    static Map<String, String> buildSelectors(String region,
                                              InstanceLaunchConfiguration launchConfiguration,
                                              Map<String, String> tags) {
        String instanceType = launchConfiguration.getInstanceType();

        Map<String, String> selectors = new HashMap<>();
        selectors.put(SELECTOR_INSTANCE_TYPE, instanceType);
        selectors.put(SELECTOR_INSTANCE_CLASS, instanceType.substring(0, 1));
        selectors.put(SELECTOR_IMAGE_ID, launchConfiguration.getImageId());
        selectors.put(SELECTOR_REGION, region);
        tags.forEach((key, value) -> {
            if (key.startsWith(SELECTOR_TAG_PREFIX)) {
                selectors.put(key.substring(SELECTOR_TAG_PREFIX.length()), value);
            }
        });

        selectors.put(SELECTOR_KUBE_INSTANCE_TYPE, instanceType);
        selectors.put(SELECTOR_KUBE_REGION, region);
        return selectors;
    }
}
