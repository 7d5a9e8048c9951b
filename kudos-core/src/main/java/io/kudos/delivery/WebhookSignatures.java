package io.kudos.delivery;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures for webhook bodies, sent as {@code sha256=<hex>}.
 */
public final class WebhookSignatures {
  public static final String HEADER = "X-Kudos-Signature";
  private static final String ALGORITHM = "HmacSHA256";

  private WebhookSignatures() {
  }

  /**
   * @param body   the exact request body
   * @param secret the shared secret
   * @return the header value, {@code sha256=} followed by lowercase hex
   */
  public static String sign(String body, String secret) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
      return "sha256=" + HexFormat.of().formatHex(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
