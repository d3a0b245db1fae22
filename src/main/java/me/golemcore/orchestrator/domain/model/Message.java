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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * A single entry of the conversation message log.
 *
 * <p>
 * Messages are appended in causal arrival order and never edited afterwards.
 * The role is one of {@code user}, {@code assistant} or {@code developer};
 * developer messages carry agent instructions loaded at initialization.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_DEVELOPER = "developer";

    private static final Set<String> KNOWN_ROLES = Set.of(ROLE_USER, ROLE_ASSISTANT, ROLE_DEVELOPER);

    private String role;
    private String content;

    public static Message user(String content) {
        return new Message(ROLE_USER, content);
    }

    public static Message assistant(String content) {
        return new Message(ROLE_ASSISTANT, content);
    }

    public static Message developer(String content) {
        return new Message(ROLE_DEVELOPER, content);
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public static boolean isKnownRole(String role) {
        return role != null && KNOWN_ROLES.contains(role);
    }
}
