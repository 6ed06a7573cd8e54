package com.example.conversion.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.Shop;
import com.example.conversion.model.TrackingMode;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class OriginValidatorTest {

  private static final Shop SHOP =
      new Shop(
          UUID.randomUUID(),
          "demo.myshopify.com",
          "shop.example.com",
          List.of("store.example.net"),
          "secret",
          null,
          null,
          TrackingMode.PURCHASE_ONLY,
          true);

  private final OriginValidator strict = new OriginValidator(properties(true));
  private final OriginValidator lenient = new OriginValidator(properties(false));

  @Test
  void precheckAcceptsHttpsOrigin() {
    assertThat(strict.precheck("https://shop.example.com", false)).isEmpty();
  }

  @Test
  void precheckRejectsNullOriginUnlessSigned() {
    assertThat(strict.precheck("null", false)).contains("null_origin");
    assertThat(strict.precheck(null, true)).isEmpty();
    assertThat(lenient.precheck(null, false)).isEmpty();
  }

  @Test
  void precheckRejectsExtensionAndFileSchemes() {
    assertThat(strict.precheck("chrome-extension://abcdef", false)).contains("forbidden_protocol");
    assertThat(strict.precheck("file:///tmp/index.html", false)).contains("forbidden_protocol");
    assertThat(strict.precheck("ftp://example.com", false)).contains("forbidden_protocol");
  }

  @Test
  void precheckAllowsPlainHttpOnlyForLocalhostInLenientMode() {
    assertThat(lenient.precheck("http://localhost:3000", false)).isEmpty();
    assertThat(strict.precheck("http://localhost:3000", false)).contains("insecure_origin");
    assertThat(lenient.precheck("http://shop.example.com", false)).contains("insecure_origin");
  }

  @Test
  void resolveHostFallsBackToReferer() {
    assertThat(strict.resolveHost(null, "https://Store.Example.net/checkout?x=1"))
        .contains("store.example.net");
    assertThat(strict.resolveHost("https://shop.example.com", "https://other.test/"))
        .contains("shop.example.com");
    assertThat(strict.resolveHost("null", null)).isEmpty();
  }

  @Test
  void allowedHostsIncludeShopDomainsSubdomainsAndPlatformHosts() {
    assertThat(strict.isAllowedHost("demo.myshopify.com", SHOP)).isTrue();
    assertThat(strict.isAllowedHost("www.shop.example.com", SHOP)).isTrue();
    assertThat(strict.isAllowedHost("store.example.net", SHOP)).isTrue();
    assertThat(strict.isAllowedHost("checkout.shopify.com", SHOP)).isTrue();
    assertThat(strict.isAllowedHost("evil-shop.example.com", SHOP)).isFalse();
    assertThat(strict.isAllowedHost("attacker.test", SHOP)).isFalse();
  }

  private static IngestProperties properties(boolean strictSecurity) {
    return new IngestProperties(
        null, null, null, null, strictSecurity, false, true, false, null, null, null, null, null);
  }
}
