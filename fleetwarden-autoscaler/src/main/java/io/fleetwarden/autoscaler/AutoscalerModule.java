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

package io.fleetwarden.autoscaler;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.fleetwarden.autoscaler.group.GroupCatalog;
import io.fleetwarden.autoscaler.group.GroupCatalogConfiguration;
import io.fleetwarden.autoscaler.timeout.ActivityClassifier;
import io.fleetwarden.autoscaler.timeout.DefaultActivityClassifier;
import io.fleetwarden.autoscaler.timeout.TimeoutReconciler;
import io.fleetwarden.autoscaler.timeout.TimeoutReconcilerConfiguration;
import io.fleetwarden.common.util.time.Clock;
import io.fleetwarden.common.util.time.Clocks;

/**
 * Binds the group catalog and the timeout reconciler. A {@link io.fleetwarden.api.connector.cloud.ScalingGroupConnector}
 * and an Archaius {@link ConfigProxyFactory} must be provided by other modules.
 */
public class AutoscalerModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(ActivityClassifier.class).to(DefaultActivityClassifier.class);
        bind(Clock.class).toInstance(Clocks.system());
        bind(GroupCatalog.class);
        bind(TimeoutReconciler.class);
    }

    @Provides
    @Singleton
    public GroupCatalogConfiguration getGroupCatalogConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(GroupCatalogConfiguration.class);
    }

    @Provides
    @Singleton
    public TimeoutReconcilerConfiguration getTimeoutReconcilerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(TimeoutReconcilerConfiguration.class);
    }

    @Provides
    @Singleton
    public Registry getRegistry() {
        return new DefaultRegistry();
    }
}
