package io.github.wphillipmoore.edgegrid;

import io.github.wphillipmoore.edgegrid.auth.EdgeGridCredentials;
import io.github.wphillipmoore.edgegrid.auth.EdgeGridSigner;
import io.github.wphillipmoore.edgegrid.auth.Signer;
import io.github.wphillipmoore.edgegrid.exception.ConfigurationException;
import io.github.wphillipmoore.edgegrid.exception.RequestCreationException;
import io.github.wphillipmoore.edgegrid.json.JsonCodec;
import io.github.wphillipmoore.edgegrid.retry.RetryConfig;
import io.github.wphillipmoore.edgegrid.retry.RetryingTransport;
import io.github.wphillipmoore.edgegrid.retry.Sleeper;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes signed EdgeGrid API calls.
 *
 * <p>Applies default headers, serializes the request body, signs, dispatches through the optional
 * retry and throttling layers, and decodes success responses. Non-success statuses are returned,
 * not thrown: mapping them to errors is up to the endpoint client. Sessions are immutable and safe
 * for concurrent use.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * EdgeGridSession session = EdgeGridSession.forCredentials(
 *         new EdgeGridCredentials(host, clientToken, clientSecret, accessToken))
 *     .retries(new RetryConfig())
 *     .build();
 * }</pre>
 */
public final class EdgeGridSession {

  /** Client version reported in the default user agent. */
  public static final String VERSION = "1.0.0";

  static final String DEFAULT_USER_AGENT =
      "EdgeGrid-Java/" + VERSION + " java/" + System.getProperty("java.version");
  static final String APPLICATION_JSON = "application/json";

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final String baseUrl;
  private final Signer signer;
  private final EdgeGridTransport client;
  private final EdgeGridTransport dispatch;
  private final Logger logger;
  private final String userAgent;
  private final @Nullable Duration timeout;
  private final int requestLimit;
  private final @Nullable RetryConfig retryConfig;
  private final JsonCodec codec = JsonCodec.getDefault();

  private EdgeGridSession(Builder builder, String baseUrl) {
    this.baseUrl = baseUrl;
    this.signer = builder.signer;
    this.client = builder.transport != null ? builder.transport : new HttpClientTransport();
    this.logger = builder.logger;
    this.userAgent = builder.userAgent;
    this.timeout = builder.timeout;
    this.requestLimit = builder.requestLimit;
    this.retryConfig = builder.retryConfig;

    EdgeGridTransport chain = client;
    if (builder.httpTracing) {
      chain = new TracingTransport(chain, this::log);
    }
    chain = new SigningTransport(chain, signer);
    if (requestLimit > 0) {
      chain = new ThrottlingTransport(chain, requestLimit);
    }
    if (retryConfig != null) {
      chain = RetryingTransport.standard(chain, retryConfig, builder.sleeper, logger, this::log);
    }
    this.dispatch = chain;
  }

  /**
   * Returns a builder that signs with {@link EdgeGridSigner} and targets the credentials' host.
   *
   * @param credentials the client credentials
   * @return a new builder
   */
  public static Builder forCredentials(EdgeGridCredentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    return new Builder(credentials.host(), new EdgeGridSigner(credentials));
  }

  /** Returns the base URL every request path is resolved against. */
  public String getBaseUrl() {
    return baseUrl;
  }

  /** Returns the effective user agent. */
  public String getUserAgent() {
    return userAgent;
  }

  /** Returns the per-second request ceiling, {@code 0} if unlimited. */
  public int getRequestLimit() {
    return requestLimit;
  }

  /** Returns the retry configuration, or {@code null} if retries are disabled. */
  public @Nullable RetryConfig getRetryConfig() {
    return retryConfig;
  }

  /**
   * Executes one API call.
   *
   * @param request the request descriptor
   * @param context the call context
   * @param outputType the type to decode a success body into, or {@code null} to skip decoding
   * @param body at most one value to send as the JSON request body
   * @param <T> the decoded type
   * @return the response with status, headers, raw body and decoded value
   * @throws IllegalArgumentException if more than one body is supplied
   * @throws RequestCreationException if the request path does not form a valid URL
   * @throws io.github.wphillipmoore.edgegrid.exception.MarshalingException if the body cannot be
   *     serialized
   * @throws io.github.wphillipmoore.edgegrid.exception.TransportException if no response arrives
   * @throws io.github.wphillipmoore.edgegrid.exception.RequestCancelledException if the context
   *     ends first
   * @throws io.github.wphillipmoore.edgegrid.exception.UnmarshalingException if a success body
   *     does not decode
   */
  public <T> ApiResponse<T> exec(
      ApiRequest request, RequestContext context, @Nullable Class<T> outputType, Object... body) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(context, "context");
    if (body.length > 1) {
      throw new IllegalArgumentException(
          "at most one request body may be supplied, got " + body.length);
    }
    String payload = null;
    if (body.length == 1) {
      payload = codec.marshal(Objects.requireNonNull(body[0], "body"));
    }

    TransportRequest wire =
        new TransportRequest(
            request.method(), buildUri(request), buildHeaders(request, context), payload, timeout);
    TransportResponse response = dispatch.send(wire, context);

    T value = null;
    if (outputType != null && isDecodable(response.statusCode())) {
      value = codec.unmarshal(response.body(), outputType, response.statusCode());
    }
    return new ApiResponse<>(response.statusCode(), response.headers(), response.body(), value);
  }

  /**
   * Signs {@code request} in place, for callers that dispatch requests themselves.
   *
   * @param request the request to sign
   */
  public void sign(TransportRequest request) {
    signer.sign(Objects.requireNonNull(request, "request"));
  }

  /**
   * Returns the logger for a call: the context's override, else the session logger.
   *
   * @param context the call context
   * @return the logger to use
   */
  public Logger log(RequestContext context) {
    Logger override = context.getLogger();
    return override != null ? override : logger;
  }

  /** Returns the underlying transport, without signing or retries. */
  public EdgeGridTransport client() {
    return client;
  }

  URI buildUri(ApiRequest request) {
    String query = request.canonicalQuery();
    try {
      return new URI(baseUrl + request.path() + (query.isEmpty() ? "" : "?" + query));
    } catch (URISyntaxException e) {
      throw new RequestCreationException("failed to create request: " + e.getMessage(), e);
    }
  }

  Map<String, String> buildHeaders(ApiRequest request, RequestContext context) {
    Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.putAll(request.headers());
    context.getHeaders().forEach(headers::putIfAbsent);
    headers.putIfAbsent("User-Agent", userAgent);
    headers.putIfAbsent("Content-Type", APPLICATION_JSON);
    headers.putIfAbsent("Accept", APPLICATION_JSON);
    return headers;
  }

  static boolean isDecodable(int statusCode) {
    return statusCode >= 200 && statusCode < 300 && statusCode != 204 && statusCode != 205;
  }

  /** Builder for {@link EdgeGridSession}. */
  public static final class Builder {

    private final String baseUrl;
    private final Signer signer;
    private @Nullable EdgeGridTransport transport;
    private Logger logger = LoggerFactory.getLogger(EdgeGridSession.class);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean httpTracing;
    private int requestLimit;
    private @Nullable RetryConfig retryConfig;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private Sleeper sleeper = Sleeper.SYSTEM;

    /**
     * Creates a builder with the required session parameters.
     *
     * @param baseUrl the API host, with or without scheme; {@code https} is assumed if absent
     * @param signer the request signer
     */
    public Builder(String baseUrl, Signer signer) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      this.signer = Objects.requireNonNull(signer, "signer");
    }

    /** Sets the transport. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(EdgeGridTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets the session logger. */
    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    /** Sets the user agent sent when a request does not set one. */
    public Builder userAgent(String userAgent) {
      this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
      return this;
    }

    /** Enables debug dumps of every wire request and response. Defaults to {@code false}. */
    public Builder httpTracing(boolean httpTracing) {
      this.httpTracing = httpTracing;
      return this;
    }

    /** Sets the maximum number of requests per second. {@code 0}, the default, is unlimited. */
    public Builder requestLimit(int requestLimit) {
      this.requestLimit = requestLimit;
      return this;
    }

    /** Enables retries of idempotent requests. Pass {@code null} to disable, the default. */
    public Builder retries(@Nullable RetryConfig retryConfig) {
      this.retryConfig = retryConfig;
      return this;
    }

    /** Sets the per-attempt timeout. Defaults to 30 seconds. Pass {@code null} for no timeout. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Package-private setter for test injection. */
    Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    /**
     * Builds the session.
     *
     * @return the configured session
     * @throws ConfigurationException listing every invalid setting
     */
    public EdgeGridSession build() {
      List<String> problems = new ArrayList<>();
      if (userAgent.isEmpty()) {
        problems.add("user agent should not be empty");
      }
      if (requestLimit < 0) {
        problems.add("request limit cannot be negative");
      }
      if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
        problems.add("timeout must be positive");
      }
      String normalized = null;
      try {
        normalized = normalizeBaseUrl(baseUrl);
      } catch (URISyntaxException | IllegalArgumentException e) {
        problems.add("invalid base URL: " + e.getMessage());
      }
      if (!problems.isEmpty()) {
        throw new ConfigurationException("session configuration failed", problems);
      }
      return new EdgeGridSession(this, Objects.requireNonNull(normalized, "baseUrl"));
    }

    static String normalizeBaseUrl(String baseUrl) throws URISyntaxException {
      String url = baseUrl.contains("://") ? baseUrl : "https://" + baseUrl;
      while (url.endsWith("/")) {
        url = url.substring(0, url.length() - 1);
      }
      URI uri = new URI(url);
      if (uri.getHost() == null || uri.getHost().isEmpty()) {
        throw new IllegalArgumentException("missing host in " + baseUrl);
      }
      String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
      if (!"https".equals(scheme) && !"http".equals(scheme)) {
        throw new IllegalArgumentException("unsupported scheme " + uri.getScheme());
      }
      return url;
    }
  }
}
