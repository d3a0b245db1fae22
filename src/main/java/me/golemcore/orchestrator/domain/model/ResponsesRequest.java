package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outbound streaming request to the model backend's responses endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponsesRequest {

    private String model;
    private List<Object> input;
    private List<Map<String, Object>> tools;

    @JsonProperty("tool_choice")
    private String toolChoice;

    @JsonProperty("previous_response_id")
    private String previousResponseId;

    private Reasoning reasoning;
    private Text text;

    @JsonProperty("parallel_tool_calls")
    @Builder.Default
    private boolean parallelToolCalls = true;

    @Builder.Default
    private boolean stream = true;

    @JsonProperty("context_management")
    private List<Map<String, Object>> contextManagement;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Reasoning {
        private String effort;
        private String summary;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Text {
        private Map<String, Object> format;
        private String verbosity;
    }
}
