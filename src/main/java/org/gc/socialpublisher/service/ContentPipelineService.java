package org.gc.socialpublisher.service;

import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.dto.ProducedContent;
import org.gc.socialpublisher.exception.PipelineFailureException;
import org.gc.socialpublisher.properties.ContentPipelineProperties;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Client of the external content pipeline (research, copywriting and slide rendering).
 */
@Slf4j
@Service
public class ContentPipelineService {

    static final String MODE_LIVE = "live";
    static final String MODE_DRY_RUN = "dry-run";

    private final WebClient webClient;
    private final ContentPipelineProperties properties;

    public ContentPipelineService(WebClient.Builder webClientBuilder, ContentPipelineProperties properties) {
        this.properties = properties;
        this.webClient = webClientBuilder
                .baseUrl(properties.getBaseUrl())
                .build();
    }

    /**
     * Produces one post. A null topic lets the pipeline pick a trending one; {@code publishIntended}
     * false asks for a dry run: slides are rendered but the pipeline publishes nothing.
     */
    public Mono<ProducedContent> produce(String topic, Integer template, boolean publishIntended) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("topic", topic);
        requestBody.put("template", template);
        requestBody.put("mode", publishIntended ? MODE_LIVE : MODE_DRY_RUN);

        log.info("Requesting content from pipeline: topic={}, template={}, mode={}",
                topic != null ? topic : "(auto)", template, requestBody.get("mode"));

        return webClient.post()
                .uri("/pipeline/produce")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(ProducedContent.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .switchIfEmpty(Mono.error(new PipelineFailureException("Content pipeline returned an empty response")))
                .flatMap(content -> {
                    if (content.getArtifactUrls() == null || content.getArtifactUrls().isEmpty()) {
                        return Mono.error(new PipelineFailureException("Pipeline returned no slides to publish"));
                    }
                    return Mono.just(content);
                })
                .onErrorMap(error -> !(error instanceof PipelineFailureException), this::toPipelineFailure)
                .doOnSuccess(content -> log.info("Pipeline produced content ref={} with {} slides",
                        content.getPipelineRef(), content.getArtifactUrls().size()))
                .doOnError(error -> log.error("Content pipeline call failed: {}", error.getMessage()));
    }

    private PipelineFailureException toPipelineFailure(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            String body = responseError.getResponseBodyAsString();
            String detail = body == null || body.isBlank() ? responseError.getStatusText() : abbreviate(body, 240);
            return new PipelineFailureException(
                    "Content pipeline returned HTTP " + responseError.getStatusCode().value() + ": " + detail,
                    "pipeline_http", String.valueOf(responseError.getStatusCode().value()), error);
        }
        if (error instanceof TimeoutException) {
            return new PipelineFailureException(
                    "Content pipeline did not answer within " + properties.getTimeoutSeconds() + "s", error);
        }
        return new PipelineFailureException("Content pipeline unreachable: " + error.getMessage(), error);
    }

    private static String abbreviate(String text, int max) {
        String trimmed = text.strip();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }
}
