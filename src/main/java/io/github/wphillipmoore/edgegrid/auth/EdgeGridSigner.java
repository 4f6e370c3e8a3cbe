package io.github.wphillipmoore.edgegrid.auth;

import io.github.wphillipmoore.edgegrid.TransportRequest;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * {@link Signer} for the EdgeGrid V1 scheme ({@code EG1-HMAC-SHA256}).
 *
 * <p>The signing key is the HMAC of the request timestamp under the client secret. The signature
 * is the HMAC, under that key, of the tab-joined method, scheme, host, path and query, canonical
 * signed headers, content hash and the unsigned authorization header.
 *
 * <p>Signed header names are lower-cased but their values keep their case; only surrounding
 * whitespace is trimmed and inner runs of whitespace collapsed to one space.
 */
public final class EdgeGridSigner implements Signer {

  static final String ALGORITHM = "EG1-HMAC-SHA256";
  private static final String HMAC = "HmacSHA256";
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HH:mm:ss'+0000'", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  private final EdgeGridCredentials credentials;
  private final Clock clock;
  private final Supplier<String> nonces;

  /**
   * Creates a signer.
   *
   * @param credentials the client credentials
   */
  public EdgeGridSigner(EdgeGridCredentials credentials) {
    this(credentials, Clock.systemUTC(), () -> UUID.randomUUID().toString());
  }

  EdgeGridSigner(EdgeGridCredentials credentials, Clock clock, Supplier<String> nonces) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.nonces = Objects.requireNonNull(nonces, "nonces");
  }

  @Override
  public void sign(TransportRequest request) {
    String timestamp = TIMESTAMP.format(clock.instant());
    String authHeader =
        ALGORITHM
            + " client_token="
            + credentials.clientToken()
            + ";access_token="
            + credentials.accessToken()
            + ";timestamp="
            + timestamp
            + ";nonce="
            + nonces.get()
            + ";";
    String signingKey = hmac(timestamp, credentials.clientSecret());
    String signature = hmac(dataToSign(request, authHeader), signingKey);
    request.setHeader("Authorization", authHeader + "signature=" + signature);
  }

  String dataToSign(TransportRequest request, String authHeader) {
    URI uri = request.getUri();
    String pathAndQuery = uri.getRawPath();
    if (pathAndQuery == null || pathAndQuery.isEmpty()) {
      pathAndQuery = "/";
    }
    if (uri.getRawQuery() != null) {
      pathAndQuery += "?" + uri.getRawQuery();
    }
    String authority = uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    return String.join(
        "\t",
        request.getMethod().toUpperCase(Locale.ROOT),
        uri.getScheme().toLowerCase(Locale.ROOT),
        authority.toLowerCase(Locale.ROOT),
        pathAndQuery,
        canonicalHeaders(request),
        contentHash(request),
        authHeader);
  }

  /** Joins the configured headers present on the request as {@code name:value}, in name order. */
  String canonicalHeaders(TransportRequest request) {
    List<String> names = new ArrayList<>(credentials.headersToSign());
    names.sort(String.CASE_INSENSITIVE_ORDER);
    List<String> lines = new ArrayList<>();
    for (String name : names) {
      String value = request.getHeader(name);
      if (value != null) {
        lines.add(name.toLowerCase(Locale.ROOT) + ":" + value.trim().replaceAll("\\s+", " "));
      }
    }
    return String.join("\t", lines);
  }

  String contentHash(TransportRequest request) {
    String body = request.getBody();
    if (!"POST".equals(request.getMethod()) || body == null || body.isEmpty()) {
      return "";
    }
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > credentials.maxBody()) {
      bytes = Arrays.copyOf(bytes, credentials.maxBody());
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return Base64.getEncoder().encodeToString(digest.digest(bytes));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  static String hmac(String data, String key) {
    try {
      Mac mac = Mac.getInstance(HMAC);
      mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC));
      return Base64.getEncoder()
          .encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 is not available", e);
    }
  }
}
