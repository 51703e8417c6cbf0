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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.fleetwarden.common.util.CollectionsExt;
import io.fleetwarden.common.util.StringExt;

/**
 * One page of a paginated provider listing.
 */
public class Page<T> {

    private static final Page<?> EMPTY = new Page<>(Collections.emptyList(), null);

    private final List<T> items;
    private final String nextPageToken;

    public Page(List<T> items, String nextPageToken) {
        this.items = Collections.unmodifiableList(CollectionsExt.nonNull(items));
        this.nextPageToken = nextPageToken;
    }

    public List<T> getItems() {
        return items;
    }

    /**
     * Token to request the next page with, or {@link Optional#empty()} if this is the last page.
     */
    public Optional<String> getNextPageToken() {
        return StringExt.isEmpty(nextPageToken) ? Optional.empty() : Optional.of(nextPageToken);
    }

    @SuppressWarnings("unchecked")
    public static <T> Page<T> empty() {
        return (Page<T>) EMPTY;
    }

    @Override
    public String toString() {
        return "Page{" +
                "items=" + items.size() +
                ", nextPageToken='" + nextPageToken + '\'' +
                '}';
    }
}
