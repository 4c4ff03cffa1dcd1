package ch.so.arp.lograg.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.lograg.ai.ChatMessage;
import ch.so.arp.lograg.ai.LlmClient;

/**
 * Answers a question from retrieved log passages. When no passage reaches the
 * threshold the fixed refusal is returned and the language model is not
 * called.
 */
public class GroundedAnswerComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroundedAnswerComposer.class);

    private static final String INSTRUCTIONS = """
            You are an assistant answering questions about operational logs.
            Use only the numbered log excerpts below to answer. Refer to excerpts by their number.
            If the excerpts do not contain the answer, say that you don't know instead of guessing.

            Log excerpts:
            """;

    private final ThresholdRetriever retriever;
    private final LlmClient llmClient;
    private final int maxHistory;

    public GroundedAnswerComposer(ThresholdRetriever retriever, LlmClient llmClient, int maxHistory) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        if (maxHistory < 0) {
            throw new IllegalArgumentException("maxHistory must not be negative");
        }
        this.maxHistory = maxHistory;
    }

    /**
     * @param query     the question
     * @param k         maximum number of candidate passages
     * @param threshold minimum similarity of a usable passage
     * @param history   earlier turns, oldest first; turns other than user
     *                  or assistant turns are dropped and only the latest
     *                  {@code maxHistory} are passed on
     * @return the grounded answer, or {@link Answer#refusal()}
     */
    public Answer answer(String query, int k, double threshold, List<ConversationTurn> history) {
        List<ScoredChunk> citations = retriever.retrieve(query, k, threshold);
        if (citations.isEmpty()) {
            LOGGER.info("No passage reached threshold {} for '{}', refusing", threshold, query);
            return Answer.refusal();
        }
        String text = llmClient.complete(messages(query, citations, history));
        return new Answer(text, citations);
    }

    private List<ChatMessage> messages(String query, List<ScoredChunk> citations, List<ConversationTurn> history) {
        StringJoiner context = new StringJoiner("\n\n");
        for (int i = 0; i < citations.size(); i++) {
            context.add(citations.get(i).formatForPrompt(i + 1));
        }
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(INSTRUCTIONS + context));
        List<ChatMessage> turns = new ArrayList<>();
        for (ConversationTurn turn : history == null ? List.<ConversationTurn>of() : history) {
            if (turn != null && turn.isForwardable()) {
                turns.add(turn.toChatMessage());
            } else {
                LOGGER.warn("Dropping history turn {}", turn);
            }
        }
        messages.addAll(turns.subList(Math.max(0, turns.size() - maxHistory), turns.size()));
        messages.add(ChatMessage.user(query));
        return messages;
    }
}
