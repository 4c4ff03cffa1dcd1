package ch.so.arp.lograg.ai;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the embedding and language model collaborators. The
 * {@code lograg.mock-openai} toggle decides whether deterministic local
 * implementations or the OpenAI API are used.
 */
@Configuration
@EnableConfigurationProperties(OpenAiClientProperties.class)
public class AiConfiguration {

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties) {
        return new OpenAiLlmClient(properties, restClientBuilder(properties));
    }

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(OpenAiClientProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "lograg.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties) {
        return new OpenAiEmbeddingProvider(properties, restClientBuilder(properties));
    }

    // Timeouts live on the HTTP client; callers see them as UpstreamUnavailableException.
    private RestClient.Builder restClientBuilder(OpenAiClientProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return RestClient.builder().requestFactory(requestFactory);
    }
}
