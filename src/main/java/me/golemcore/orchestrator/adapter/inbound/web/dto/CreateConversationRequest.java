package me.golemcore.orchestrator.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("task_id")
    private String taskId;
}
