package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Chat message model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    public static final Set<String> ROLES = Set.of(ROLE_SYSTEM, ROLE_USER, ROLE_ASSISTANT, ROLE_TOOL);

    @JsonProperty("role")
    private String role; // system, user, assistant, tool

    @JsonProperty("content")
    private MessageContent content;

    @JsonProperty("name")
    private String name;

    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    public static Message of(String role, String text) {
        return Message.builder()
                .role(role)
                .content(MessageContent.text(text))
                .build();
    }

    /**
     * Plain text of the content; empty when there is none.
     */
    @JsonIgnore
    public String getText() {
        return content != null ? content.asText() : "";
    }
}
