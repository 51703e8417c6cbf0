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

package io.fleetwarden.autoscaler.timeout;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Singleton;

import io.fleetwarden.common.util.StringExt;

/**
 * {@link ActivityClassifier} for the AWS Auto Scaling activity wording. Rules are evaluated in order, and the
 * first match wins. Anchored rules must match from the start of the text, the others anywhere in it.
 */
@Singleton
public class DefaultActivityClassifier implements ActivityClassifier {

    private static final List<Rule> STATUS_MESSAGE_RULES = Arrays.asList(
            Rule.anchored(
                    "You have requested more instances \\((?<requested>\\d+)\\) than your current instance limit of (?<limit>\\d+)",
                    m -> ActivityClassification.instanceLimit(Integer.parseInt(m.group("requested")), Integer.parseInt(m.group("limit")))
            ),
            Rule.anchored(
                    "Instance became unhealthy while waiting for instance to be in InService state\\. "
                            + "Termination Reason: Client\\.VolumeLimitExceeded: Volume limit exceeded",
                    m -> ActivityClassification.volumeLimit()
            ),
            Rule.anchored(
                    "Insufficient capacity\\. Launching EC2 instance failed\\.",
                    m -> ActivityClassification.capacityLimit()
            ),
            Rule.unanchored(
                    "We currently do not have sufficient .+ capacity in the Availability Zone you requested \\(?(?<zone>[^().]+)\\)?\\.",
                    m -> ActivityClassification.azLimit(m.group("zone"))
            ),
            Rule.unanchored(
                    "Spot instance request: (?<requestId>.+) has been cancelled\\.",
                    m -> ActivityClassification.spotRequestCancelled(m.group("requestId"))
            ),
            Rule.anchored(
                    "Max spot instance count exceeded\\. Placing Spot instance request failed\\.",
                    m -> ActivityClassification.spotLimit()
            ),
            Rule.unanchored(
                    "Placed Spot instance request: (?<requestId>.+)\\. Waiting for instance\\(s\\)",
                    m -> ActivityClassification.spotRequestWaiting(m.group("requestId"))
            )
    );

    private static final List<Rule> CAUSE_RULES = Arrays.asList(
            Rule.unanchored(
                    "At \\d{4}-\\d\\d-\\d\\dT\\d\\d:\\d\\d:\\d\\dZ an instance was started in response to a difference between "
                            + "desired and actual capacity, increasing the capacity from (?<original>\\d+) to (?<target>\\d+)\\.",
                    m -> ActivityClassification.launchInstance(Integer.parseInt(m.group("original")), Integer.parseInt(m.group("target")))
            ),
            Rule.unanchored(
                    "An instance was launched to aid in balancing the group's zones\\.",
                    m -> ActivityClassification.azRebalance()
            )
    );

    @Override
    public ActivityClassification classifyStatusMessage(String statusMessage) {
        return classify(STATUS_MESSAGE_RULES, statusMessage);
    }

    @Override
    public ActivityClassification classifyCause(String cause) {
        return classify(CAUSE_RULES, cause);
    }

    private static ActivityClassification classify(List<Rule> rules, String text) {
        if (StringExt.isEmpty(text)) {
            return ActivityClassification.unclassified();
        }
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern.matcher(text);
            if (rule.anchored ? matcher.lookingAt() : matcher.find()) {
                return rule.extractor.apply(matcher);
            }
        }
        return ActivityClassification.unclassified();
    }

    private static class Rule {

        private final Pattern pattern;
        private final boolean anchored;
        private final Function<Matcher, ActivityClassification> extractor;

        private Rule(String regExp, boolean anchored, Function<Matcher, ActivityClassification> extractor) {
            this.pattern = Pattern.compile(regExp);
            this.anchored = anchored;
            this.extractor = extractor;
        }

        private static Rule anchored(String regExp, Function<Matcher, ActivityClassification> extractor) {
            return new Rule(regExp, true, extractor);
        }

        private static Rule unanchored(String regExp, Function<Matcher, ActivityClassification> extractor) {
            return new Rule(regExp, false, extractor);
        }
    }
}
