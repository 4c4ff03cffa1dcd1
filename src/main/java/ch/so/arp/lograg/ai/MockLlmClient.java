package ch.so.arp.lograg.ai;

import java.util.List;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted.
 */
class MockLlmClient implements LlmClient {

    @Override
    public String complete(List<ChatMessage> messages) {
        String question = messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
        return "[mocked answer] Provide an API key to reach the real OpenAI service. Question was: " + question
                + " (" + messages.size() + " messages)";
    }
}
