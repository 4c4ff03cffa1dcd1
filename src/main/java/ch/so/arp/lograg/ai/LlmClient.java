package ch.so.arp.lograg.ai;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate the assistant reply for the given conversation.
     *
     * @param messages the conversation, system prompt first and the question last
     * @return the generated text
     * @throws UpstreamUnavailableException if the model cannot be reached in time
     */
    String complete(List<ChatMessage> messages);
}
