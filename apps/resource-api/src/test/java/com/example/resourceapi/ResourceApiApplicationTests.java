package com.example.resourceapi;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class ResourceApiApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void contextLoads() {
    }

    @Test
    void shouldRejectApiCallsWithoutBearerToken() {
        webTestClient.get().uri("/api/grade")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("authentication_error");
    }

    @Test
    void shouldRejectInvalidBearerToken() {
        webTestClient.get().uri("/api/grade")
                .header("Authorization", "Bearer not-a-jwt")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void shouldCreateAndFetchWithDevLoginToken() {
        String token = devLogin("tester");

        Map<?, ?> created = webTestClient.post().uri("/api/grade")
                .header("Authorization", "Bearer " + token)
                .header("X-Correlation-Id", "it-corr-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "Integration", "description", "created by test"))
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals("X-Correlation-Id", "it-corr-1")
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();

        assertThat(created).isNotNull();
        assertThat(((Map<?, ?>) created.get("created")).get("correlation_id")).isEqualTo("it-corr-1");

        webTestClient.get().uri("/api/grade/{id}", created.get("_id"))
                .header("Authorization", "Bearer " + token)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("Integration")
                .jsonPath("$.created.by_user").isEqualTo("tester");

        webTestClient.get().uri("/api/grade/000000000000000000000000")
                .header("Authorization", "Bearer " + token)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldServeHealthWithoutToken() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk();
    }

    private String devLogin(String subject) {
        Map<?, ?> response = webTestClient.post().uri("/dev-login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("subject", subject, "roles", List.of("reader")))
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertThat(response).isNotNull();
        return (String) response.get("access_token");
    }
}
