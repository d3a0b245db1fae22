package me.golemcore.orchestrator.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A paused tool call waiting for a human decision.
 *
 * <p>
 * Registered when the backend emits an approval-request item. The
 * {@code continuationToken} is the response id current at request time and is
 * used to resume the paused call once the decision arrives.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApprovalRequest {

    String id;
    String toolName;
    String arguments;
    String serverLabel;
    String continuationToken;
    @Builder.Default
    ApprovalStatus status = ApprovalStatus.PENDING;
    Map<String, Object> requestPayload;

    public ApprovalRequest resolve(boolean approved) {
        return toBuilder().status(approved ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED).build();
    }
}
