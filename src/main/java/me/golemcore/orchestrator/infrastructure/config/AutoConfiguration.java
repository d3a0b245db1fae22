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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared orchestrator infrastructure.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} used across the
 * application</li>
 * <li>Provides the executor that runs conversation actors</li>
 * <li>Logs startup information (backend, defaults, configured agents)</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final OrchestratorProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Executor shared by all conversation actors. Each actor keeps at most one
     * task on it at a time; turns block while streaming, so the pool grows
     * with the number of busy conversations.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conversationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "conversation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @PostConstruct
    public void init() {
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        log.info("GolemCore Orchestrator starting...");
        log.info("Responses API: {}", llm.getApiUrl());
        log.info("Default Model: {} (reasoning effort {})", llm.getDefaultModel(), llm.getDefaultReasoningEffort());
        log.info("Compaction Threshold: {}", llm.getCompactThreshold() > 0 ? llm.getCompactThreshold() : "disabled");
        log.info("Configured Agents: {}", properties.getAgents().keySet());
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("No API key configured, LLM calls will fail until orchestrator.llm.api-key is set");
        }
    }
}
