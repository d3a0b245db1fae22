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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of response stream event kinds known to the orchestrator.
 *
 * <p>
 * Kinds flagged as delta carry incremental content for live display and are
 * never persisted. Any wire type not listed here maps to {@link #OTHER}, which
 * is persisted with its raw payload; an unlisted type whose name contains
 * {@code .delta} maps to {@link #OTHER_DELTA}.
 *
 * @since 1.0
 */
public enum ResponseEventKind {

    RESPONSE_CREATED("response.created", false),
    RESPONSE_IN_PROGRESS("response.in_progress", false),
    RESPONSE_COMPLETED("response.completed", false),
    RESPONSE_FAILED("response.failed", false),
    RESPONSE_INCOMPLETE("response.incomplete", false),

    OUTPUT_ITEM_ADDED("response.output_item.added", false),
    OUTPUT_ITEM_DONE("response.output_item.done", false),
    CONTENT_PART_ADDED("response.content_part.added", false),
    CONTENT_PART_DONE("response.content_part.done", false),
    OUTPUT_TEXT_DONE("response.output_text.done", false),
    REASONING_SUMMARY_PART_ADDED("response.reasoning_summary_part.added", false),
    REASONING_SUMMARY_PART_DONE("response.reasoning_summary_part.done", false),
    REASONING_SUMMARY_TEXT_DONE("response.reasoning_summary_text.done", false),

    WEB_SEARCH_CALL_IN_PROGRESS("response.web_search_call.in_progress", false),
    WEB_SEARCH_CALL_SEARCHING("response.web_search_call.searching", false),
    WEB_SEARCH_CALL_COMPLETED("response.web_search_call.completed", false),

    CODE_INTERPRETER_CALL_IN_PROGRESS("response.code_interpreter_call.in_progress", false),
    CODE_INTERPRETER_CALL_INTERPRETING("response.code_interpreter_call.interpreting", false),
    CODE_INTERPRETER_CALL_COMPLETED("response.code_interpreter_call.completed", false),

    MCP_CALL_IN_PROGRESS("response.mcp_call.in_progress", false),
    MCP_CALL_COMPLETED("response.mcp_call.completed", false),
    MCP_CALL_FAILED("response.mcp_call.failed", false),
    MCP_CALL_ARGUMENTS_DONE("response.mcp_call_arguments.done", false),
    MCP_LIST_TOOLS_IN_PROGRESS("response.mcp_list_tools.in_progress", false),
    MCP_LIST_TOOLS_COMPLETED("response.mcp_list_tools.completed", false),
    MCP_LIST_TOOLS_FAILED("response.mcp_list_tools.failed", false),

    ERROR("error", false),

    OUTPUT_TEXT_DELTA("response.output_text.delta", true),
    REASONING_SUMMARY_TEXT_DELTA("response.reasoning_summary_text.delta", true),
    MCP_CALL_ARGUMENTS_DELTA("response.mcp_call_arguments.delta", true),
    CODE_INTERPRETER_CALL_CODE_DELTA("response.code_interpreter_call_code.delta", true),

    OTHER_DELTA(null, true),
    OTHER(null, false);

    private static final String DELTA_MARKER = ".delta";
    private static final Map<String, ResponseEventKind> BY_TYPE = new HashMap<>();

    static {
        for (ResponseEventKind kind : values()) {
            if (kind.type != null) {
                BY_TYPE.put(kind.type, kind);
            }
        }
    }

    private final String type;
    private final boolean delta;

    ResponseEventKind(String type, boolean delta) {
        this.type = type;
        this.delta = delta;
    }

    /**
     * Wire type of this kind, or {@code null} for the fallback kinds.
     */
    public String getType() {
        return type;
    }

    public boolean isDelta() {
        return delta;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResponseEventKind fromType(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        ResponseEventKind kind = BY_TYPE.get(type);
        if (kind != null) {
            return kind;
        }
        return type.contains(DELTA_MARKER) ? OTHER_DELTA : OTHER;
    }
}
