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

package io.fleetwarden.common.util.rx;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Supplementary Spring Reactor operators.
 */
public final class ReactorExt {

    private ReactorExt() {
    }

    /**
     * Apply a blocking function to each item on the given scheduler, with at most <tt>concurrencyLimit</tt> calls
     * in flight. The result list preserves the order of <tt>items</tt>. The first failure terminates the returned
     * {@link Mono} with that error, and cancels all calls still in progress. The function must not return null.
     */
    public static <T, R> Mono<List<R>> mapOrdered(List<T> items,
                                                  Function<T, R> blockingFun,
                                                  int concurrencyLimit,
                                                  Scheduler scheduler) {
        if (items.isEmpty()) {
            return Mono.just(Collections.emptyList());
        }
        return Flux.fromIterable(items)
                .flatMapSequential(item -> Mono.fromCallable(() -> blockingFun.apply(item)).subscribeOn(scheduler),
                        Math.max(1, concurrencyLimit)
                )
                .collectList();
    }
}
