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

package io.fleetwarden.ext.aws;

import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.amazonaws.AmazonWebServiceRequest;
import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.model.Activity;
import com.amazonaws.services.autoscaling.model.AmazonAutoScalingException;
import com.amazonaws.services.autoscaling.model.AutoScalingGroup;
import com.amazonaws.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import com.amazonaws.services.autoscaling.model.DescribeAutoScalingGroupsResult;
import com.amazonaws.services.autoscaling.model.DescribeLaunchConfigurationsRequest;
import com.amazonaws.services.autoscaling.model.DescribeLaunchConfigurationsResult;
import com.amazonaws.services.autoscaling.model.DescribeScalingActivitiesRequest;
import com.amazonaws.services.autoscaling.model.DescribeScalingActivitiesResult;
import com.amazonaws.services.autoscaling.model.LaunchConfiguration;
import com.amazonaws.services.autoscaling.model.SetDesiredCapacityRequest;
import com.amazonaws.services.autoscaling.model.TagDescription;
import com.amazonaws.services.autoscaling.model.TerminateInstanceInAutoScalingGroupRequest;
import com.amazonaws.services.ec2.model.AmazonEC2Exception;
import com.amazonaws.services.ec2.model.CancelSpotInstanceRequestsRequest;
import com.amazonaws.services.ec2.model.DescribeSpotInstanceRequestsRequest;
import com.amazonaws.services.ec2.model.DescribeSpotInstanceRequestsResult;
import com.amazonaws.services.ec2.model.DescribeSpotPriceHistoryRequest;
import com.amazonaws.services.ec2.model.DescribeSpotPriceHistoryResult;
import com.google.common.base.Strings;
import io.fleetwarden.api.connector.cloud.CloudConnectorException;
import io.fleetwarden.api.connector.cloud.InstanceGroup;
import io.fleetwarden.api.connector.cloud.InstanceLaunchConfiguration;
import io.fleetwarden.api.connector.cloud.Page;
import io.fleetwarden.api.connector.cloud.ScalingActivity;
import io.fleetwarden.api.connector.cloud.ScalingGroupConnector;
import io.fleetwarden.api.connector.cloud.SpotInstanceRequest;
import io.fleetwarden.api.connector.cloud.SpotPrice;
import io.fleetwarden.common.util.CollectionsExt;
import io.fleetwarden.common.util.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScalingGroupConnector} backed by AWS Auto Scaling groups. All calls block the caller until AWS responds.
 */
@Singleton
public class AwsScalingGroupConnector implements ScalingGroupConnector {

    private static final Logger logger = LoggerFactory.getLogger(AwsScalingGroupConnector.class);

    static final String ERROR_SPOT_REQUEST_NOT_FOUND = "InvalidSpotInstanceRequestID.NotFound";

    static final String ERROR_MIN_SIZE_VIOLATION = "Terminating instance without replacement will violate group's min size constraint.";

    private final AwsConfiguration configuration;
    private final AmazonClientProvider clientProvider;

    @Inject
    public AwsScalingGroupConnector(AwsConfiguration configuration, AmazonClientProvider clientProvider) {
        this.configuration = configuration;
        this.clientProvider = clientProvider;
    }

    @Override
    public List<InstanceGroup> getInstanceGroups(String region) {
        AmazonAutoScaling client = clientProvider.getAutoScalingClient(region);
        PageCollector<DescribeAutoScalingGroupsRequest, AutoScalingGroup> pageCollector = new PageCollector<>(
                token -> withTimeout(new DescribeAutoScalingGroupsRequest().withMaxRecords(configuration.getPageSize()).withNextToken(token)),
                request -> {
                    DescribeAutoScalingGroupsResult result = client.describeAutoScalingGroups(request);
                    return Pair.of(result.getAutoScalingGroups(), result.getNextToken());
                }
        );
        return pageCollector.getAll().stream().map(this::toInstanceGroup).collect(Collectors.toList());
    }

    @Override
    public List<InstanceLaunchConfiguration> getLaunchConfigurations(String region, List<String> names) {
        if (names.isEmpty()) {
            return Collections.emptyList();
        }
        AmazonAutoScaling client = clientProvider.getAutoScalingClient(region);
        PageCollector<DescribeLaunchConfigurationsRequest, LaunchConfiguration> pageCollector = new PageCollector<>(
                token -> withTimeout(new DescribeLaunchConfigurationsRequest()
                        .withLaunchConfigurationNames(names)
                        .withMaxRecords(configuration.getPageSize())
                        .withNextToken(token)
                ),
                request -> {
                    DescribeLaunchConfigurationsResult result = client.describeLaunchConfigurations(request);
                    return Pair.of(result.getLaunchConfigurations(), result.getNextToken());
                }
        );
        return pageCollector.getAll().stream().map(this::toInstanceLaunchConfiguration).collect(Collectors.toList());
    }

    @Override
    public void setDesiredCapacity(String region, String groupId, int desired) {
        clientProvider.getAutoScalingClient(region).setDesiredCapacity(withTimeout(new SetDesiredCapacityRequest()
                .withAutoScalingGroupName(groupId)
                .withDesiredCapacity(desired)
                .withHonorCooldown(false)
        ));
        logger.info("Set desired capacity of {}/{} to {}", region, groupId, desired);
    }

    @Override
    public void terminateInstance(String region, String instanceId, boolean decrementDesiredCapacity) {
        TerminateInstanceInAutoScalingGroupRequest request = withTimeout(new TerminateInstanceInAutoScalingGroupRequest()
                .withInstanceId(instanceId)
                .withShouldDecrementDesiredCapacity(decrementDesiredCapacity)
        );
        try {
            clientProvider.getAutoScalingClient(region).terminateInstanceInAutoScalingGroup(request);
        } catch (AmazonAutoScalingException e) {
            if (isMinSizeViolation(e)) {
                throw CloudConnectorException.minSizeViolation(region, instanceId, e);
            }
            throw e;
        }
        logger.info("Terminated instance {} in region {} (decrement desired capacity: {})", instanceId, region, decrementDesiredCapacity);
    }

    @Override
    public Page<ScalingActivity> getScalingActivities(String region, String pageToken) {
        DescribeScalingActivitiesResult result = clientProvider.getAutoScalingClient(region).describeScalingActivities(withTimeout(
                new DescribeScalingActivitiesRequest().withMaxRecords(configuration.getPageSize()).withNextToken(pageToken)
        ));
        List<ScalingActivity> activities = CollectionsExt.nonNull(result.getActivities()).stream()
                .map(this::toScalingActivity)
                .collect(Collectors.toList());
        return new Page<>(activities, result.getNextToken());
    }

    @Override
    public Optional<SpotInstanceRequest> findSpotInstanceRequest(String region, String requestId) {
        DescribeSpotInstanceRequestsResult result;
        try {
            result = clientProvider.getEc2Client(region).describeSpotInstanceRequests(withTimeout(
                    new DescribeSpotInstanceRequestsRequest().withSpotInstanceRequestIds(requestId)
            ));
        } catch (AmazonEC2Exception e) {
            String errorCode = e.getErrorCode();
            // Spot request id provided is unknown / invalid
            if (errorCode != null && errorCode.contains(ERROR_SPOT_REQUEST_NOT_FOUND) && e.getStatusCode() == 400) {
                logger.info("AWS spot instance request {} NOT FOUND", requestId);
                return Optional.empty();
            }
            throw e;
        }
        return CollectionsExt.nonNull(result.getSpotInstanceRequests()).stream()
                .findFirst()
                .map(awsRequest -> new SpotInstanceRequest(
                        awsRequest.getSpotInstanceRequestId(),
                        SpotInstanceRequest.State.fromProviderState(awsRequest.getState())
                ));
    }

    @Override
    public void cancelSpotInstanceRequest(String region, String requestId) {
        clientProvider.getEc2Client(region).cancelSpotInstanceRequests(withTimeout(
                new CancelSpotInstanceRequestsRequest().withSpotInstanceRequestIds(requestId)
        ));
    }

    @Override
    public List<SpotPrice> getSpotPriceHistory(String region, Collection<String> instanceTypes, long startTime) {
        if (instanceTypes.isEmpty()) {
            return Collections.emptyList();
        }
        PageCollector<DescribeSpotPriceHistoryRequest, com.amazonaws.services.ec2.model.SpotPrice> pageCollector = new PageCollector<>(
                token -> withTimeout(new DescribeSpotPriceHistoryRequest()
                        .withInstanceTypes(instanceTypes)
                        .withProductDescriptions(configuration.getSpotProductDescription())
                        .withStartTime(new Date(startTime))
                        .withNextToken(token)
                ),
                request -> {
                    DescribeSpotPriceHistoryResult result = clientProvider.getEc2Client(region).describeSpotPriceHistory(request);
                    return Pair.of(result.getSpotPriceHistory(), result.getNextToken());
                }
        );
        return pageCollector.getAll().stream().map(this::toSpotPrice).collect(Collectors.toList());
    }

    private <R extends AmazonWebServiceRequest> R withTimeout(R request) {
        request.setSdkRequestTimeout((int) configuration.getAwsRequestTimeoutMs());
        return request;
    }

    private boolean isMinSizeViolation(AmazonAutoScalingException e) {
        String message = e.getErrorMessage();
        return message != null && message.contains(ERROR_MIN_SIZE_VIOLATION);
    }

    private InstanceGroup toInstanceGroup(AutoScalingGroup awsScalingGroup) {
        Map<String, String> tags = CollectionsExt.isNullOrEmpty(awsScalingGroup.getTags())
                ? Collections.emptyMap()
                : awsScalingGroup.getTags().stream().collect(Collectors.toMap(TagDescription::getKey, TagDescription::getValue, (first, second) -> second, LinkedHashMap::new));
        return InstanceGroup.newBuilder()
                .withId(awsScalingGroup.getAutoScalingGroupName())
                .withLaunchConfigurationName(awsScalingGroup.getLaunchConfigurationName())
                .withMin(awsScalingGroup.getMinSize())
                .withDesired(awsScalingGroup.getDesiredCapacity())
                .withMax(awsScalingGroup.getMaxSize())
                .withTags(tags)
                .withInstanceIds(CollectionsExt.nonNull(awsScalingGroup.getInstances()).stream()
                        .map(com.amazonaws.services.autoscaling.model.Instance::getInstanceId)
                        .collect(Collectors.toList())
                )
                .build();
    }

    private InstanceLaunchConfiguration toInstanceLaunchConfiguration(LaunchConfiguration awsLaunchConfiguration) {
        String spotPrice = awsLaunchConfiguration.getSpotPrice();
        return new InstanceLaunchConfiguration(
                awsLaunchConfiguration.getLaunchConfigurationName(),
                awsLaunchConfiguration.getInstanceType(),
                awsLaunchConfiguration.getImageId(),
                Strings.isNullOrEmpty(spotPrice) ? Optional.empty() : Optional.of(Double.parseDouble(spotPrice))
        );
    }

    private ScalingActivity toScalingActivity(Activity activity) {
        return ScalingActivity.newBuilder()
                .withId(activity.getActivityId())
                .withGroupId(activity.getAutoScalingGroupName())
                .withStartTime(activity.getStartTime() == null ? 0 : activity.getStartTime().getTime())
                .withProgress(activity.getProgress() == null ? 0 : activity.getProgress())
                .withStatusCode(activity.getStatusCode())
                .withStatusMessage(activity.getStatusMessage())
                .withCause(activity.getCause())
                .build();
    }

    private SpotPrice toSpotPrice(com.amazonaws.services.ec2.model.SpotPrice awsSpotPrice) {
        return new SpotPrice(
                awsSpotPrice.getTimestamp().getTime(),
                awsSpotPrice.getAvailabilityZone(),
                awsSpotPrice.getInstanceType(),
                Double.parseDouble(awsSpotPrice.getSpotPrice())
        );
    }
}
