package com.openforge.gateway.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the conversation sent to a backend.
 *
 * role variants:
 *   "system"      persona / instructions; scanned by the complexity scorer
 *   "user"        caller turn
 *   "assistant"   earlier model reply
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return new Message(SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(USER, content);
    }

    public static Message assistant(String content) {
        return new Message(ASSISTANT, content);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
