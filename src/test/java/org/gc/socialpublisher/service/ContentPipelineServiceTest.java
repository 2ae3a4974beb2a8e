package org.gc.socialpublisher.service;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.gc.socialpublisher.exception.PipelineFailureException;
import org.gc.socialpublisher.properties.ContentPipelineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;

class ContentPipelineServiceTest {

    private WireMockServer wireMockServer;
    private ContentPipelineProperties properties;
    private ContentPipelineService service;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());

        properties = new ContentPipelineProperties();
        properties.setBaseUrl(wireMockServer.baseUrl());
        properties.setTimeoutSeconds(5);
        service = new ContentPipelineService(WebClient.builder(), properties);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    @Test
    @DisplayName("Produced content is read from the pipeline response")
    void producesContent() {
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"post_id\":\"run-2026-10-19-001\",\"topic\":\"Passkeys explained\","
                                + "\"caption\":\"Passwords are out. #security\","
                                + "\"artifacts\":[\"https://cdn.example.com/1.png\",\"https://cdn.example.com/2.png\"],"
                                + "\"research_notes\":\"ignored\"}")));

        StepVerifier.create(service.produce("Passkeys explained", 3, true))
                .assertNext(content -> {
                    assertThat(content.getPipelineRef()).isEqualTo("run-2026-10-19-001");
                    assertThat(content.getCaption()).startsWith("Passwords are out");
                    assertThat(content.getArtifactUrls()).hasSize(2);
                })
                .verifyComplete();

        verify(postRequestedFor(urlEqualTo("/pipeline/produce"))
                .withRequestBody(equalToJson("{\"topic\":\"Passkeys explained\",\"template\":3,\"mode\":\"live\"}")));
    }

    @Test
    void dryRunWhenNotPublishing() {
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"post_id\":\"r-1\",\"caption\":\"Draft\",\"artifacts\":[\"https://cdn.example.com/1.png\"]}")));

        StepVerifier.create(service.produce(null, null, false))
                .expectNextCount(1)
                .verifyComplete();

        verify(postRequestedFor(urlEqualTo("/pipeline/produce"))
                .withRequestBody(equalToJson("{\"topic\":null,\"template\":null,\"mode\":\"dry-run\"}")));
    }

    @Test
    @DisplayName("HTTP errors become pipeline failures carrying the status")
    void httpErrorBecomesPipelineFailure() {
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse().withStatus(500).withBody("renderer crashed")));

        StepVerifier.create(service.produce(null, null, true))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(PipelineFailureException.class);
                    PipelineFailureException failure = (PipelineFailureException) error;
                    assertThat(failure.getMessage()).isEqualTo("Content pipeline returned HTTP 500: renderer crashed");
                    assertThat(failure.getTag()).isEqualTo("pipeline_http");
                    assertThat(failure.getCode()).isEqualTo("500");
                })
                .verify();
    }

    @Test
    void contentWithoutSlidesIsRejected() {
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"post_id\":\"r-2\",\"caption\":\"Empty\",\"artifacts\":[]}")));

        StepVerifier.create(service.produce(null, null, true))
                .expectErrorMatches(error -> error instanceof PipelineFailureException
                        && error.getMessage().contains("no slides"))
                .verify();
    }

    @Test
    void slowPipelineTimesOut() {
        properties.setTimeoutSeconds(1);
        ContentPipelineService impatient = new ContentPipelineService(WebClient.builder(), properties);
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse()
                        .withFixedDelay(2_500)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"post_id\":\"late\",\"artifacts\":[\"https://cdn.example.com/1.png\"]}")));

        StepVerifier.create(impatient.produce(null, null, true))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(PipelineFailureException.class)
                        .hasMessageContaining("within 1s"))
                .verify();
    }

    @Test
    @DisplayName("An empty response body is a pipeline failure, not a missing value")
    void emptyResponseIsPipelineFailure() {
        stubFor(post(urlEqualTo("/pipeline/produce"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")));

        StepVerifier.create(service.produce("Passkeys explained", null, true))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(PipelineFailureException.class)
                        .hasMessage("Content pipeline returned an empty response"))
                .verify();
    }
}
