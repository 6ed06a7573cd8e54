/*
 * どこで: Conversion Relay 認証
 * 何を: Origin/Referer の事前判定とショップ許可ホスト判定を行う
 * なぜ: ショップ自身/ストアフロント/プラットフォーム以外からの送信を弾くため
 */
package com.example.conversion.service.auth;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.Shop;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OriginValidator {

  private static final Set<String> FORBIDDEN_SCHEMES = Set.of("file", "chrome-extension", "data", "blob");
  private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1");

  private final IngestProperties properties;

  /**
   * ショップ解決前のプロトコル判定。
   *
   * @param signed 署名ヘッダーが付いているか（この時点では未検証）
   * @return 拒否理由。許可なら empty
   */
  public Optional<String> precheck(String origin, boolean signed) {
    if (origin == null || origin.isBlank() || "null".equals(origin.trim())) {
      if (signed && properties.nullOriginAllowedWhenSigned()) {
        return Optional.empty();
      }
      return properties.strict() ? Optional.of("null_origin") : Optional.empty();
    }
    final URI uri;
    try {
      uri = new URI(origin.trim());
    } catch (URISyntaxException ex) {
      return Optional.of("invalid_origin");
    }
    final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (FORBIDDEN_SCHEMES.contains(scheme)) {
      return Optional.of("forbidden_protocol");
    }
    if ("http".equals(scheme)) {
      final String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
      if (!properties.strict() && LOCAL_HOSTS.contains(host)) {
        return Optional.empty();
      }
      return Optional.of("insecure_origin");
    }
    if (!"https".equals(scheme)) {
      return Optional.of("forbidden_protocol");
    }
    return Optional.empty();
  }

  /** Origin が無ければ Referer のホストを使う。 */
  public Optional<String> resolveHost(String origin, String referer) {
    final Optional<String> fromOrigin = host(origin);
    return fromOrigin.isPresent() ? fromOrigin : host(referer);
  }

  public boolean isAllowedHost(String host, Shop shop) {
    final List<String> allowed = new ArrayList<>();
    allowed.add(shop.shopDomain());
    if (shop.primaryDomain() != null) {
      allowed.add(shop.primaryDomain());
    }
    allowed.addAll(shop.storefrontDomains());
    allowed.addAll(properties.platformHosts());
    final String candidate = host.toLowerCase(Locale.ROOT);
    for (String domain : allowed) {
      final String normalized = domain.trim().toLowerCase(Locale.ROOT);
      if (normalized.isEmpty()) {
        continue;
      }
      if (candidate.equals(normalized) || candidate.endsWith("." + normalized)) {
        return true;
      }
    }
    return false;
  }

  private Optional<String> host(String value) {
    if (value == null || value.isBlank() || "null".equals(value.trim())) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(new URI(value.trim()).getHost()).map(h -> h.toLowerCase(Locale.ROOT));
    } catch (URISyntaxException ex) {
      return Optional.empty();
    }
  }
}
