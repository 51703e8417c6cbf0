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

public class SpotInstanceRequest {

    public enum State {
        Open,
        Active,
        Closed,
        Cancelled,
        Failed,
        Unknown;

        public static State fromProviderState(String state) {
            if (state == null) {
                return Unknown;
            }
            for (State value : values()) {
                if (value.name().equalsIgnoreCase(state)) {
                    return value;
                }
            }
            return Unknown;
        }
    }

    private final String id;
    private final State state;

    public SpotInstanceRequest(String id, State state) {
        this.id = id;
        this.state = state;
    }

    public String getId() {
        return id;
    }

    public State getState() {
        return state;
    }

    /**
     * Only open or active requests can still turn into an instance, so only these are worth cancelling.
     */
    public boolean isCancellable() {
        return state == State.Open || state == State.Active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SpotInstanceRequest that = (SpotInstanceRequest) o;
        return Objects.equals(id, that.id) && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, state);
    }

    @Override
    public String toString() {
        return "SpotInstanceRequest{" +
                "id='" + id + '\'' +
                ", state=" + state +
                '}';
    }
}
