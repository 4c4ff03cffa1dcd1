package ch.so.arp.lograg.ai;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link LlmClient} calling the OpenAI chat completions endpoint. Sampling
 * temperature is fixed at zero so that answers stay close to the retrieved
 * log context.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final String model;

    OpenAiLlmClient(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'lograg.openai.api-key' must be provided when mocks are disabled");
        }
        this.model = properties.getChatModel();
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public String complete(List<ChatMessage> messages) {
        LOGGER.debug("Requesting completion from model {} with {} messages", model, messages.size());
        CompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new CompletionRequest(model, 0.0d, messages))
                    .retrieve()
                    .body(CompletionResponse.class);
        } catch (RestClientException ex) {
            throw new UpstreamUnavailableException("Chat completion with model " + model + " failed", ex);
        }
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new UpstreamUnavailableException("Chat completion with model " + model + " returned no choices");
        }
        return response.choices().get(0).message().content();
    }

    record CompletionRequest(String model, double temperature, List<ChatMessage> messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ChatMessage message) {
    }
}
