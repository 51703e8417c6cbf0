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

package io.fleetwarden.api.connector.cloud;

import java.util.Objects;

/**
 * A single spot market price observation.
 */
public class SpotPrice {

    private final long timestamp;
    private final String availabilityZone;
    private final String instanceType;
    private final double price;

    public SpotPrice(long timestamp, String availabilityZone, String instanceType, double price) {
        this.timestamp = timestamp;
        this.availabilityZone = availabilityZone;
        this.instanceType = instanceType;
        this.price = price;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getAvailabilityZone() {
        return availabilityZone;
    }

    public String getInstanceType() {
        return instanceType;
    }

    public double getPrice() {
        return price;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SpotPrice spotPrice = (SpotPrice) o;
        return timestamp == spotPrice.timestamp &&
                Double.compare(spotPrice.price, price) == 0 &&
                Objects.equals(availabilityZone, spotPrice.availabilityZone) &&
                Objects.equals(instanceType, spotPrice.instanceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, availabilityZone, instanceType, price);
    }

    @Override
    public String toString() {
        return "SpotPrice{" +
                "timestamp=" + timestamp +
                ", availabilityZone='" + availabilityZone + '\'' +
                ", instanceType='" + instanceType + '\'' +
                ", price=" + price +
                '}';
    }
}
