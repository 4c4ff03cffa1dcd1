package ch.so.arp.lograg.query;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for questions. {@code k}, {@code threshold} and
 * {@code history} are optional. History turns
 * must be {@code user} or {@code assistant} turns with content.
 */
public record QuestionRequest(
        @NotBlank String question,
        @Min(1) Integer k,
        @DecimalMin("-1.0") @DecimalMax("1.0") Double threshold,
        @Valid List<ConversationTurn> history) {
}
