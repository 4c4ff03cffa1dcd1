package ch.so.arp.lograg.query;

import ch.so.arp.lograg.ai.ChatMessage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Earlier exchange of a conversation. Only user questions and assistant
 * answers are accepted; instructions to the model are never taken from the
 * client.
 */
public record ConversationTurn(
        @NotBlank @Pattern(regexp = "user|assistant") String role,
        @NotBlank String content) {

    public static ConversationTurn user(String content) {
        return new ConversationTurn(ChatMessage.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ChatMessage.ASSISTANT, content);
    }

    boolean isForwardable() {
        return (ChatMessage.USER.equals(role) || ChatMessage.ASSISTANT.equals(role))
                && content != null && !content.isBlank();
    }

    ChatMessage toChatMessage() {
        return new ChatMessage(role, content);
    }
}
