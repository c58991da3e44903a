package com.openforge.gateway.routing;

import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityScorerTest {

    @Test
    void longConversationWithAnalyticalSystemPromptShouldScoreHigh() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("Analyze the following transcripts carefully."));
        for (int i = 0; i < 11; i++) {
            messages.add(Message.user("y".repeat(800)));
        }

        double score = ComplexityScorer.score(CompletionRequest.of("a", null, messages));

        // chars > 8000 (+0.3), messages > 10 (+0.2), "analyze" (+0.2)
        assertTrue(score >= 0.7 - 1e-9, "score was " + score);
    }

    @Test
    void shortRequestShouldScoreZero() {
        assertEquals(0.0, ComplexityScorer.score(CompletionRequest.of("a", null, List.of(Message.user("hi")))), 1e-9);
    }

    @Test
    void scoreShouldBeClampedToOne() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("Reason step by step and implement the algorithm in code."));
        for (int i = 0; i < 20; i++) {
            messages.add(Message.user("z".repeat(1000)));
        }
        CompletionRequest request = CompletionRequest.builder()
                .agentId("a").messages(messages).maxTokens(8000).build();

        assertEquals(1.0, ComplexityScorer.score(request), 1e-9);
    }

    @Test
    void keywordsOnlyCountInSystemMessage() {
        CompletionRequest userOnly = CompletionRequest.of("a", null,
                List.of(Message.user("please analyze and implement this")));
        CompletionRequest withSystem = CompletionRequest.of("a", null,
                List.of(Message.system("please analyze and implement this")));

        assertEquals(0.0, ComplexityScorer.score(userOnly), 1e-9);
        assertEquals(0.35, ComplexityScorer.score(withSystem), 1e-9);
    }

    @Test
    void maxTokensBandsShouldAdd() {
        List<Message> hi = List.of(Message.user("hi"));

        assertEquals(0.1, ComplexityScorer.score(CompletionRequest.builder().messages(hi).maxTokens(2001).build()), 1e-9);
        assertEquals(0.15, ComplexityScorer.score(CompletionRequest.builder().messages(hi).maxTokens(4001).build()), 1e-9);
        assertEquals(0.0, ComplexityScorer.score(CompletionRequest.builder().messages(hi).maxTokens(2000).build()), 1e-9);
    }

    @Test
    void characterBandsShouldAdd() {
        assertEquals(0.1, ComplexityScorer.score(CompletionRequest.of("a", null, List.of(Message.user("c".repeat(2001))))), 1e-9);
        assertEquals(0.2, ComplexityScorer.score(CompletionRequest.of("a", null, List.of(Message.user("c".repeat(4001))))), 1e-9);
        assertEquals(0.3, ComplexityScorer.score(CompletionRequest.of("a", null, List.of(Message.user("c".repeat(8001))))), 1e-9);
    }
}
