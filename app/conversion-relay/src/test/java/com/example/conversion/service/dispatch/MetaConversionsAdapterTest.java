package com.example.conversion.service.dispatch;

import static com.example.conversion.service.dispatch.AdapterFixtures.credentials;
import static com.example.conversion.service.dispatch.AdapterFixtures.purchase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.PixelEnvironment;
import com.example.conversion.model.Platform;
import com.example.conversion.service.dispatch.AdapterFixtures.HttpFixture;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;

class MetaConversionsAdapterTest {

  private static final String EVENTS_URL = "http://meta.test/v21.0/px-1/events";
  private static final Map<String, String> LIVE_CREDENTIALS =
      Map.of("pixelId", "px-1", "accessToken", "token-1");

  @Test
  void sendPostsPurchaseWithSharedEventId() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andExpect(method(POST))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andExpect(jsonPath("$.data[0].event_name").value("Purchase"))
        .andExpect(jsonPath("$.data[0].event_id").value("evt-1"))
        .andExpect(jsonPath("$.data[0].event_time").value(1_792_400_400))
        .andExpect(jsonPath("$.data[0].action_source").value("website"))
        .andExpect(jsonPath("$.data[0].custom_data.order_id").value("1001"))
        .andExpect(jsonPath("$.data[0].custom_data.contents[0].id").value("v-1"))
        .andExpect(jsonPath("$.test_event_code").doesNotExist())
        .andRespond(withSuccess("{\"events_received\":1}", MediaType.APPLICATION_JSON));

    final DeliveryResult result =
        adapter(fixture)
            .send(purchase(), credentials(Platform.META, PixelEnvironment.LIVE, LIVE_CREDENTIALS));

    fixture.server().verify();
    assertThat(result.ok()).isTrue();
    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(result.requestJson()).contains("\"event_id\":\"evt-1\"");
  }

  @Test
  void sendAddsTestEventCodeOnlyInTestEnvironment() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andExpect(jsonPath("$.test_event_code").value("TEST123"))
        .andRespond(withSuccess("{\"events_received\":1}", MediaType.APPLICATION_JSON));

    final DeliveryResult result =
        adapter(fixture)
            .send(
                purchase(),
                credentials(
                    Platform.META,
                    PixelEnvironment.TEST,
                    Map.of("pixelId", "px-1", "accessToken", "token-1", "testEventCode", "TEST123")));

    assertThat(result.ok()).isTrue();
  }

  @Test
  void errorObjectInSuccessfulResponseIsFailure() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andRespond(
            withSuccess(
                "{\"error\":{\"message\":\"Invalid parameter\",\"code\":100}}",
                MediaType.APPLICATION_JSON));

    final DeliveryResult result =
        adapter(fixture)
            .send(purchase(), credentials(Platform.META, PixelEnvironment.LIVE, LIVE_CREDENTIALS));

    assertThat(result.ok()).isFalse();
    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(result.error()).isEqualTo("Invalid parameter");
  }

  @Test
  void httpErrorKeepsStatusAndTruncatedBody() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("x".repeat(500)));

    final DeliveryResult result =
        adapter(fixture)
            .send(purchase(), credentials(Platform.META, PixelEnvironment.LIVE, LIVE_CREDENTIALS));

    assertThat(result.ok()).isFalse();
    assertThat(result.statusCode()).isEqualTo(400);
    assertThat(result.error()).startsWith("http_400: ").hasSize(120);
  }

  @Test
  void timeoutIsReportedAsTimeout() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    final DeliveryResult result =
        adapter(fixture)
            .send(purchase(), credentials(Platform.META, PixelEnvironment.LIVE, LIVE_CREDENTIALS));

    assertThat(result.ok()).isFalse();
    assertThat(result.statusCode()).isNull();
    assertThat(result.error()).isEqualTo("timeout");
  }

  @Test
  void connectionFailureIsReportedWithReason() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();
    fixture
        .server()
        .expect(requestTo(EVENTS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    final DeliveryResult result =
        adapter(fixture)
            .send(purchase(), credentials(Platform.META, PixelEnvironment.LIVE, LIVE_CREDENTIALS));

    assertThat(result.error()).startsWith("connection_failed: ");
  }

  @Test
  void missingCredentialsFailWithoutCallingPlatform() {
    final HttpFixture fixture = AdapterFixtures.newHttpFixture();

    final DeliveryResult result =
        adapter(fixture)
            .send(
                purchase(),
                credentials(Platform.META, PixelEnvironment.LIVE, Map.of("pixelId", "px-1")));

    fixture.server().verify();
    assertThat(result.ok()).isFalse();
    assertThat(result.error()).isEqualTo("missing_credentials: accessToken");
  }

  private MetaConversionsAdapter adapter(HttpFixture fixture) {
    return new MetaConversionsAdapter(fixture.client(), AdapterFixtures.PROPERTIES);
  }
}
