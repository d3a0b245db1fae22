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

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative definition of a tool the backend may invoke on behalf of the
 * agent.
 *
 * <p>
 * Descriptors are discriminated by {@code type}. Remote tool servers
 * ({@code mcp}) additionally carry the server location, an optional allow-list
 * of tool names and the approval policy; every other type is forwarded as
 * {@code {type, ...config}}.
 *
 * @since 1.0
 */
@Value
@Builder
public class ToolDescriptor {

    public static final String TYPE_MCP = "mcp";
    public static final String TYPE_WEB_SEARCH = "web_search_preview";
    public static final String TYPE_CODE_INTERPRETER = "code_interpreter";
    public static final String TYPE_IMAGE_GENERATION = "image_generation";

    String type;
    String serverLabel;
    String serverUrl;
    String serverDescription;
    Map<String, String> headers;
    List<String> allowedTools;
    Object requireApproval;
    Map<String, Object> config;

    public boolean isRemoteToolServer() {
        return TYPE_MCP.equals(type);
    }

    /**
     * Renders the descriptor in the shape the backend expects in the request
     * {@code tools} array.
     */
    public Map<String, Object> toRequestPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        if (isRemoteToolServer()) {
            payload.put("server_label", serverLabel);
            payload.put("server_url", serverUrl);
            payload.put("server_description", serverDescription != null ? serverDescription : "");
            payload.put("headers", headers != null ? new LinkedHashMap<>(headers) : Map.of());
            payload.put("require_approval", requireApproval != null ? requireApproval : Map.of());
            if (allowedTools != null && !allowedTools.isEmpty()) {
                payload.put("allowed_tools", List.copyOf(allowedTools));
            }
        }
        if (config != null) {
            payload.putAll(config);
        }
        return payload;
    }
}
