package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link ConversationProperties} - conversation lifecycle limits</li>
 * <li>{@link LlmProperties} - model backend endpoint and request defaults</li>
 * <li>{@link HttpProperties} - HTTP client timeouts and pooling</li>
 * <li>{@link AgentProperties} - agent definitions keyed by agent id</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private ConversationProperties conversation = new ConversationProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private Map<String, AgentProperties> agents = new LinkedHashMap<>();

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private Duration initTimeout = Duration.ofSeconds(60);
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String apiUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String defaultModel = "gpt-5";
        private String defaultReasoningEffort = "minimal";
        private String reasoningSummary = "detailed";
        private String verbosity = "low";
        private int compactThreshold = 0;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 300000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private boolean retryOnConnectionFailure = false;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentProperties {
        private String model;
        private String reasoningEffort;
        private String instructions;
        private List<ToolProperties> tools = new ArrayList<>();
    }

    @Data
    public static class ToolProperties {
        private String type;
        private String serverLabel;
        private String serverUrl;
        private String serverDescription;
        private Map<String, String> headers = new LinkedHashMap<>();
        private List<String> allowedTools = new ArrayList<>();
        private String requireApproval;
        private Map<String, Object> config = new LinkedHashMap<>();
        private boolean enabled = true;
    }
}
