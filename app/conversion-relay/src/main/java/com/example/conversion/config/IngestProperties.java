/*
 * どこで: Conversion Relay の設定バインド
 * 何を: 受信エンドポイントの上限値/署名ポリシー/リプレイ窓を保持する
 * なぜ: 本番と開発で strict/lenient を切り替えられるようにするため
 */
package com.example.conversion.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversion.ingest")
public record IngestProperties(
    Integer maxBodyBytes,
    Integer maxBatchSize,
    Duration timestampWindow,
    Duration nonceTtl,
    Boolean strictSecurity,
    boolean allowUnsignedEvents,
    Boolean allowNullOriginWithSignature,
    boolean asyncDispatch,
    Integer rateLimitPerMinute,
    List<String> platformHosts,
    String signatureHeader,
    String timestampHeader,
    String shopDomainHeader) {

  public IngestProperties {
    maxBodyBytes = maxBodyBytes == null || maxBodyBytes <= 0 ? 65536 : maxBodyBytes;
    maxBatchSize = maxBatchSize == null || maxBatchSize <= 0 ? 100 : maxBatchSize;
    timestampWindow = timestampWindow == null ? Duration.ofMinutes(5) : timestampWindow;
    nonceTtl = nonceTtl == null ? Duration.ofHours(1) : nonceTtl;
    strictSecurity = strictSecurity == null ? Boolean.TRUE : strictSecurity;
    allowNullOriginWithSignature =
        allowNullOriginWithSignature == null ? Boolean.TRUE : allowNullOriginWithSignature;
    rateLimitPerMinute = rateLimitPerMinute == null ? 600 : rateLimitPerMinute;
    platformHosts =
        platformHosts == null || platformHosts.isEmpty()
            ? List.of("checkout.shopify.com", "shopify.com", "myshopify.com")
            : List.copyOf(platformHosts);
    signatureHeader =
        signatureHeader == null || signatureHeader.isBlank()
            ? "X-Tracking-Guardian-Signature"
            : signatureHeader;
    timestampHeader =
        timestampHeader == null || timestampHeader.isBlank()
            ? "X-Tracking-Guardian-Timestamp"
            : timestampHeader;
    shopDomainHeader =
        shopDomainHeader == null || shopDomainHeader.isBlank()
            ? "X-Shopify-Shop-Domain"
            : shopDomainHeader;
  }

  public boolean strict() {
    return Boolean.TRUE.equals(strictSecurity);
  }

  public boolean nullOriginAllowedWhenSigned() {
    return Boolean.TRUE.equals(allowNullOriginWithSignature);
  }
}
