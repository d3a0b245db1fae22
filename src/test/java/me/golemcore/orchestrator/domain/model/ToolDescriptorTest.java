package me.golemcore.orchestrator.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolDescriptorTest {

    @Test
    void shouldRenderRemoteToolServer() {
        ToolDescriptor github = ToolDescriptor.builder()
                .type(ToolDescriptor.TYPE_MCP)
                .serverLabel("github")
                .serverUrl("https://mcp.example.com/github")
                .headers(Map.of("Authorization", "Bearer token"))
                .allowedTools(List.of("create_issue"))
                .requireApproval("always")
                .build();

        Map<String, Object> payload = github.toRequestPayload();

        assertTrue(github.isRemoteToolServer());
        assertEquals("mcp", payload.get("type"));
        assertEquals("github", payload.get("server_label"));
        assertEquals("https://mcp.example.com/github", payload.get("server_url"));
        assertEquals("", payload.get("server_description"));
        assertEquals(Map.of("Authorization", "Bearer token"), payload.get("headers"));
        assertEquals(List.of("create_issue"), payload.get("allowed_tools"));
        assertEquals("always", payload.get("require_approval"));
    }

    @Test
    void shouldOmitEmptyAllowedTools() {
        Map<String, Object> payload = ToolDescriptor.builder()
                .type(ToolDescriptor.TYPE_MCP)
                .serverLabel("docs")
                .serverUrl("https://mcp.example.com/docs")
                .build()
                .toRequestPayload();

        assertFalse(payload.containsKey("allowed_tools"));
        assertEquals(Map.of(), payload.get("require_approval"));
    }

    @Test
    void shouldMergeConfigIntoBuiltInTool() {
        ToolDescriptor interpreter = ToolDescriptor.builder()
                .type(ToolDescriptor.TYPE_CODE_INTERPRETER)
                .config(Map.of("container", Map.of("type", "auto")))
                .build();

        assertFalse(interpreter.isRemoteToolServer());
        assertEquals(Map.of("type", "code_interpreter", "container", Map.of("type", "auto")),
                interpreter.toRequestPayload());
    }
}
