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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.AmazonAutoScalingClientBuilder;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Region scoped AWS clients, created on first use and shared afterwards.
 */
@Singleton
public class AmazonClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AmazonClientProvider.class);

    private final AWSCredentialsProvider credentialsProvider;

    private final Map<String, AmazonAutoScaling> autoScalingClients = new HashMap<>();
    private final Map<String, AmazonEC2> ec2Clients = new HashMap<>();

    @Inject
    public AmazonClientProvider(AWSCredentialsProvider credentialsProvider) {
        this.credentialsProvider = credentialsProvider;
    }

    public AmazonAutoScaling getAutoScalingClient(String region) {
        String key = normalize(region);
        AmazonAutoScaling client;
        synchronized (this) {
            client = autoScalingClients.get(key);
            if (client == null) {
                client = AmazonAutoScalingClientBuilder.standard()
                        .withCredentials(credentialsProvider)
                        .withRegion(key)
                        .build();
                autoScalingClients.put(key, client);
                logger.info("Created AWS Auto Scaling client for region {}", key);
            }
        }
        return client;
    }

    public AmazonEC2 getEc2Client(String region) {
        String key = normalize(region);
        AmazonEC2 client;
        synchronized (this) {
            client = ec2Clients.get(key);
            if (client == null) {
                client = AmazonEC2ClientBuilder.standard()
                        .withCredentials(credentialsProvider)
                        .withRegion(key)
                        .build();
                ec2Clients.put(key, client);
                logger.info("Created AWS EC2 client for region {}", key);
            }
        }
        return client;
    }

    @PreDestroy
    public synchronized void shutdown() {
        autoScalingClients.values().forEach(AmazonAutoScaling::shutdown);
        ec2Clients.values().forEach(AmazonEC2::shutdown);
        autoScalingClients.clear();
        ec2Clients.clear();
    }

    private static String normalize(String region) {
        return region.trim().toLowerCase();
    }
}
