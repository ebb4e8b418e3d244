package com.example.resourceapi.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientIpExtractor")
class ClientIpExtractorTest {

    @Test
    @DisplayName("should ignore X-Forwarded-For from an untrusted peer")
    void shouldIgnoreSpoofedHeader() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .remoteAddress(new InetSocketAddress("203.0.113.9", 5000))
                .header("X-Forwarded-For", "1.1.1.1")
                .build();

        assertThat(ClientIpExtractor.extract(request)).isEqualTo("203.0.113.9");
    }

    @Test
    @DisplayName("should take the rightmost untrusted hop behind a trusted proxy")
    void shouldUseRightmostUntrustedHop() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .remoteAddress(new InetSocketAddress("10.1.2.3", 5000))
                .header("X-Forwarded-For", "1.1.1.1, 198.51.100.4, 192.168.0.10")
                .build();

        assertThat(ClientIpExtractor.extract(request)).isEqualTo("198.51.100.4");
    }

    @Test
    @DisplayName("should answer unknown without a remote address")
    void shouldAnswerUnknown() {
        assertThat(ClientIpExtractor.extract(MockServerHttpRequest.get("/").build())).isEqualTo("unknown");
    }

    @ParameterizedTest
    @ValueSource(strings = {"10.0.0.1", "172.16.5.4", "172.31.255.255", "192.168.1.1", "127.0.0.1", "::1", "fd00::1"})
    @DisplayName("should trust private network addresses")
    void shouldTrustPrivateRanges(String ip) {
        assertThat(ClientIpExtractor.isTrustedProxy(ip)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"172.32.0.1", "8.8.8.8", "203.0.113.1"})
    @DisplayName("should not trust public addresses")
    void shouldNotTrustPublic(String ip) {
        assertThat(ClientIpExtractor.isTrustedProxy(ip)).isFalse();
    }
}
