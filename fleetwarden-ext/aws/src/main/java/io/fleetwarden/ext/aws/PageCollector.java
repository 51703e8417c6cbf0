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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import io.fleetwarden.common.util.StringExt;
import io.fleetwarden.common.util.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows AWS next page tokens until the last page, and returns all items loaded.
 */
class PageCollector<R, T> {

    private static final Logger logger = LoggerFactory.getLogger(PageCollector.class);

    private final Function<String, R> requestFun;
    private final Function<R, Pair<List<T>, String>> pageFun;

    PageCollector(Function<String, R> requestFun,
                  Function<R, Pair<List<T>, String>> pageFun) {
        this.requestFun = requestFun;
        this.pageFun = pageFun;
    }

    List<T> getAll() {
        List<T> loadedItems = new ArrayList<>();
        String token = null;
        int pageNumber = 0;
        do {
            Pair<List<T>, String> page = pageFun.apply(requestFun.apply(token));
            if (page.getLeft() != null) {
                loadedItems.addAll(page.getLeft());
            }
            logger.debug("Loaded AWS page {} (loaded until now {})", pageNumber, loadedItems.size());
            token = page.getRight();
            pageNumber++;
        } while (!StringExt.isEmpty(token));
        return loadedItems;
    }
}
