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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One event of a model-backend response stream, as classified by the
 * orchestrator.
 *
 * <p>
 * The {@code payload} is the raw upstream event and is passed through
 * unmodified. {@code sequenceNumber} is the ordering key inside the
 * conversation log; {@code status} is only set on approval-request events.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResponseEvent {

    public static final String STATUS_WAITING_APPROVAL = "waiting-approval";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    String id;
    String type;
    ResponseEventKind kind;
    Long sequenceNumber;
    String itemId;
    Map<String, Object> payload;
    Instant timestamp;
    String status;

    @JsonIgnore
    public boolean isDelta() {
        return kind != null && kind.isDelta();
    }

    @JsonIgnore
    public boolean isError() {
        return kind == ResponseEventKind.ERROR;
    }

    /**
     * Source of an error event; upstream error events carry no source and count
     * as backend failures.
     */
    @JsonIgnore
    public ErrorSource getErrorSource() {
        Object source = payload != null ? payload.get("source") : null;
        return source instanceof String value ? ErrorSource.fromValue(value) : ErrorSource.BACKEND;
    }

    public ResponseEvent withStatus(String newStatus) {
        return toBuilder().status(newStatus).build();
    }
}
