package com.openforge.gateway.llm.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompletionRequestTest {

    @Test
    void defaultsShouldFillOnlyUnsetFields() {
        CompletionRequest request = CompletionRequest.builder()
                .agentId("a").messages(List.of(Message.user("hi"))).temperature(0.9).build();

        CompletionRequest effective = request.withDefaults("gpt-4o", 1024, 0.2);

        assertEquals("gpt-4o", effective.model());
        assertEquals(1024, effective.maxTokens());
        assertEquals(0.9, effective.temperature(), 1e-9);
        assertNull(request.model());
    }

    @Test
    void zeroOrBlankDefaultsShouldBeIgnored() {
        CompletionRequest request = CompletionRequest.of("a", null, List.of(Message.user("hi")));

        CompletionRequest effective = request.withDefaults(" ", 0, 0.0);

        assertNull(effective.model());
        assertNull(effective.maxTokens());
        assertNull(effective.temperature());
    }

    @Test
    void blankModelCountsAsUnset() {
        CompletionRequest request = CompletionRequest.of("a", "", List.of(Message.user("hi")));

        assertFalse(request.hasModel());
        assertEquals("claude-3-haiku", request.withDefaults("claude-3-haiku", null, null).model());
    }

    @Test
    void messagesShouldBeCopiedOnConstruction() {
        List<Message> messages = new ArrayList<>(List.of(Message.user("hi")));
        CompletionRequest request = CompletionRequest.of("a", null, messages);

        messages.add(Message.user("later"));

        assertEquals(1, request.messages().size());
        assertTrue(CompletionRequest.builder().build().messages().isEmpty());
    }
}
