package com.licensor.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@AutoConfigureObservability
class SmokeHealthTest {
  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;

  @Test void actuatorHealthIsUp() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
  }

  @Test void apiHealthIsOpenAndEchoesRequestId() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Request-Id", "smoke-1");
    var r = rest.exchange("http://localhost:" + port + "/api/v1/health", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
    assertThat(r.getBody()).contains("licensor-api");
    assertThat(r.getHeaders().getFirst("X-Request-Id")).isEqualTo("smoke-1");
  }

  @Test void prometheusIsScrapable() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/prometheus", String.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
  }
}
