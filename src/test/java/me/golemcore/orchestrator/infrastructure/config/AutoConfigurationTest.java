package me.golemcore.orchestrator.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ConversationPhase;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.ResponseEventKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldLogStartupWithoutApiKey() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(new OrchestratorProperties());

        assertDoesNotThrow(autoConfiguration::init);
    }

    @Test
    void shouldSerializeEventsInSnakeCase() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        ResponseEvent event = ResponseEvent.builder()
                .id("evt_1")
                .type("response.created")
                .kind(ResponseEventKind.RESPONSE_CREATED)
                .sequenceNumber(4L)
                .payload(Map.of("type", "response.created"))
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(event);

        assertTrue(json.contains("\"sequence_number\":4"));
        assertTrue(json.contains("\"timestamp\":\"2026-03-01T10:00:00Z\""));
        assertEquals(ConversationPhase.READY, mapper.readValue("\"READY\"", ConversationPhase.class));
    }

    @Test
    void shouldRunConversationWorkOnDaemonThreads() throws Exception {
        ExecutorService executor = new AutoConfiguration(new OrchestratorProperties()).conversationExecutor();
        try {
            Future<Boolean> daemon = executor.submit(() -> Thread.currentThread().isDaemon()
                    && Thread.currentThread().getName().startsWith("conversation-"));

            assertTrue(daemon.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
