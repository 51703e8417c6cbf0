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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "fleetwarden.ext.aws")
public interface AwsConfiguration {

    /**
     * Page size for the list operations. 100 is the maximum accepted by the Auto Scaling API.
     */
    @DefaultValue("100")
    int getPageSize();

    /**
     * Spot price history is fetched for this product description only.
     */
    @DefaultValue("Linux/UNIX")
    String getSpotProductDescription();

    /**
     * Timeout of a single AWS request. Paginated operations apply it to each page request.
     */
    @DefaultValue("10000")
    long getAwsRequestTimeoutMs();
}
