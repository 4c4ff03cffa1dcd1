package ch.so.arp.lograg.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One message of a chat completion conversation. The role is one of
 * {@code system}, {@code user} or {@code assistant}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }
}
