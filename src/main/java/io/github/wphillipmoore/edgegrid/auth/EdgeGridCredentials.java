package io.github.wphillipmoore.edgegrid.auth;

import java.util.List;
import java.util.Objects;

/**
 * EdgeGrid API client credentials.
 *
 * <p>{@code maxBody} limits how much of a {@code POST} body is hashed; values &lt;= 0 select
 * {@link #DEFAULT_MAX_BODY}.
 *
 * @param host the API host name, without scheme
 * @param clientToken the client token
 * @param clientSecret the client secret
 * @param accessToken the access token
 * @param headersToSign request header names included in the signature
 * @param maxBody maximum number of body bytes hashed
 */
public record EdgeGridCredentials(
    String host,
    String clientToken,
    String clientSecret,
    String accessToken,
    List<String> headersToSign,
    int maxBody) {

  /** Default maximum body size used for the content hash (131072 bytes). */
  public static final int DEFAULT_MAX_BODY = 131072;

  /** Validates non-null fields and applies the default body limit. */
  public EdgeGridCredentials {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(clientToken, "clientToken");
    Objects.requireNonNull(clientSecret, "clientSecret");
    Objects.requireNonNull(accessToken, "accessToken");
    headersToSign = List.copyOf(Objects.requireNonNull(headersToSign, "headersToSign"));
    if (maxBody <= 0) {
      maxBody = DEFAULT_MAX_BODY;
    }
  }

  /** Creates credentials that sign no extra headers and use the default body limit. */
  public EdgeGridCredentials(
      String host, String clientToken, String clientSecret, String accessToken) {
    this(host, clientToken, clientSecret, accessToken, List.of(), DEFAULT_MAX_BODY);
  }

  @Override
  public String toString() {
    return "EdgeGridCredentials[host="
        + host
        + ", clientToken="
        + clientToken
        + ", clientSecret=***, accessToken="
        + accessToken
        + ", headersToSign="
        + headersToSign
        + ", maxBody="
        + maxBody
        + "]";
  }
}
