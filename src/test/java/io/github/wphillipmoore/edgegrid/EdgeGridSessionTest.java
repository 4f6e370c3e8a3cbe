package io.github.wphillipmoore.edgegrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.github.wphillipmoore.edgegrid.auth.EdgeGridCredentials;
import io.github.wphillipmoore.edgegrid.auth.Signer;
import io.github.wphillipmoore.edgegrid.exception.ConfigurationException;
import io.github.wphillipmoore.edgegrid.exception.RequestCreationException;
import io.github.wphillipmoore.edgegrid.exception.UnmarshalingException;
import io.github.wphillipmoore.edgegrid.retry.RetryConfig;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class EdgeGridSessionTest {

  private static final String BASE_URL = "https://akab-host.luna.akamaiapis.net";

  record Payload(String name) {}

  private final AtomicInteger signatures = new AtomicInteger();
  private final Signer signer =
      request -> request.setHeader("Authorization", "sig-" + signatures.incrementAndGet());
  private final List<TransportRequest> sent = new ArrayList<>();
  private final Deque<TransportResponse> responses = new ArrayDeque<>();
  private final EdgeGridTransport transport =
      (request, context) -> {
        sent.add(request);
        return responses.removeFirst();
      };

  private EdgeGridSession.Builder builder() {
    return new EdgeGridSession.Builder(BASE_URL, signer).transport(transport);
  }

  private static TransportResponse json(int status, String body) {
    return new TransportResponse(status, body, Map.of("Content-Type", "application/json"));
  }

  @Nested
  class Headers {

    @Test
    void appliesDefaults() {
      responses.add(json(200, "{\"name\":\"x\"}"));
      EdgeGridSession session = builder().build();

      session.exec(ApiRequest.get("/papi/v1/x"), RequestContext.background(), Payload.class);

      TransportRequest request = sent.get(0);
      assertThat(request.getHeader("User-Agent")).isEqualTo(EdgeGridSession.DEFAULT_USER_AGENT);
      assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
      assertThat(request.getHeader("Accept")).isEqualTo("application/json");
      assertThat(request.getHeader("Authorization")).isEqualTo("sig-1");
      assertThat(request.getTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void requestHeadersWinOverContextHeadersWinOverDefaults() {
      responses.add(json(200, "{}"));
      EdgeGridSession session = builder().userAgent("custom-agent").build();
      RequestContext context =
          RequestContext.builder()
              .header("accept", "text/plain")
              .header("User-Agent", "context-agent")
              .header("X-Extra", "1")
              .build();
      ApiRequest request =
          ApiRequest.get("/papi/v1/x").withHeader("Accept", "application/vnd.test+json");

      session.exec(request, context, null);

      TransportRequest wire = sent.get(0);
      assertThat(wire.getHeader("Accept")).isEqualTo("application/vnd.test+json");
      assertThat(wire.getHeader("User-Agent")).isEqualTo("context-agent");
      assertThat(wire.getHeader("X-Extra")).isEqualTo("1");
    }

    @Test
    void buildsUriFromBaseUrlPathAndQuery() {
      responses.add(json(200, "{}"));
      EdgeGridSession session = builder().build();

      session.exec(
          ApiRequest.get("/papi/v1/x").withQuery("groupId", "grp 1").withQuery("contractId", "c"),
          RequestContext.background(),
          null);

      assertThat(sent.get(0).getUri().toString())
          .isEqualTo(BASE_URL + "/papi/v1/x?contractId=c&groupId=grp+1");
    }
  }

  @Nested
  class Bodies {

    @Test
    void marshalsSingleBody() {
      responses.add(json(200, "{\"name\":\"back\"}"));
      EdgeGridSession session = builder().build();

      ApiResponse<Payload> response =
          session.exec(
              ApiRequest.post("/papi/v1/x"),
              RequestContext.background(),
              Payload.class,
              new Payload("out"));

      assertThat(sent.get(0).getBody()).isEqualTo("{\"name\":\"out\"}");
      assertThat(response.value()).isEqualTo(new Payload("back"));
    }

    @Test
    void rejectsMoreThanOneBody() {
      EdgeGridSession session = builder().build();

      assertThatThrownBy(
              () ->
                  session.exec(
                      ApiRequest.post("/x"),
                      RequestContext.background(),
                      null,
                      new Payload("a"),
                      new Payload("b")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("at most one request body may be supplied, got 2");
      assertThat(sent).isEmpty();
    }

    @Test
    void noContentIsNotDecoded() {
      responses.add(new TransportResponse(204, "", Map.of()));

      ApiResponse<Payload> response =
          builder()
              .build()
              .exec(ApiRequest.get("/x"), RequestContext.background(), Payload.class);

      assertThat(response.statusCode()).isEqualTo(204);
      assertThat(response.value()).isNull();
    }

    @Test
    void errorStatusIsReturnedWithRawBody() {
      responses.add(json(404, "{\"type\":\"not_found\"}"));

      ApiResponse<Payload> response =
          builder()
              .build()
              .exec(ApiRequest.get("/x"), RequestContext.background(), Payload.class);

      assertThat(response.statusCode()).isEqualTo(404);
      assertThat(response.body()).isEqualTo("{\"type\":\"not_found\"}");
      assertThat(response.value()).isNull();
    }

    @Test
    void invalidPathIsRequestCreationError() {
      EdgeGridSession session = builder().build();

      assertThatThrownBy(
              () -> session.exec(ApiRequest.get("/a b"), RequestContext.background(), null))
          .isInstanceOf(RequestCreationException.class)
          .hasMessageStartingWith("failed to create request: ");
      assertThat(sent).isEmpty();
    }

    @Test
    void undecodableSuccessBodyFails() {
      responses.add(json(200, "not json"));
      EdgeGridSession session = builder().build();

      assertThatThrownBy(
              () -> session.exec(ApiRequest.get("/x"), RequestContext.background(), Payload.class))
          .isInstanceOfSatisfying(
              UnmarshalingException.class,
              e -> assertThat(e.getResponseText()).isEqualTo("not json"));
    }
  }

  @Nested
  class Configuration {

    @Test
    void reportsEveryProblem() {
      EdgeGridSession.Builder builder =
          new EdgeGridSession.Builder("ftp://files.example", signer)
              .userAgent("")
              .requestLimit(-1)
              .timeout(Duration.ZERO);

      assertThatThrownBy(builder::build)
          .isInstanceOfSatisfying(
              ConfigurationException.class,
              e ->
                  assertThat(e.getProblems())
                      .containsExactly(
                          "user agent should not be empty",
                          "request limit cannot be negative",
                          "timeout must be positive",
                          "invalid base URL: unsupported scheme ftp"));
    }

    @Test
    void defaultsToHttps() {
      EdgeGridSession session =
          new EdgeGridSession.Builder("akab-host.luna.akamaiapis.net/", signer).build();

      assertThat(session.getBaseUrl()).isEqualTo(BASE_URL);
      assertThat(session.getRequestLimit()).isZero();
      assertThat(session.getRetryConfig()).isNull();
    }

    @Test
    void forCredentialsTargetsCredentialHost() {
      EdgeGridSession session =
          EdgeGridSession.forCredentials(
                  new EdgeGridCredentials("akab-host.luna.akamaiapis.net", "c", "s", "a"))
              .build();

      assertThat(session.getBaseUrl()).isEqualTo(BASE_URL);
      assertThat(session.client()).isInstanceOf(HttpClientTransport.class);
    }

    @Test
    void contextLoggerWins() {
      Logger override = mock(Logger.class);
      Logger sessionLogger = mock(Logger.class);
      EdgeGridSession session = builder().logger(sessionLogger).build();

      assertThat(session.log(RequestContext.background())).isSameAs(sessionLogger);
      assertThat(session.log(RequestContext.builder().logger(override).build()))
          .isSameAs(override);
    }
  }

  @Nested
  class Retries {

    @Test
    void retriesRateLimitedGetAfterAnnouncedWait() {
      responses.add(
          new TransportResponse(
              429,
              "",
              Map.of(
                  "X-RateLimit-Next", "2006-01-02T15:04:10.729Z",
                  "Date", "Mon, 02 Jan 2006 15:04:05 GMT")));
      responses.add(json(200, "{\"name\":\"x\"}"));
      List<Duration> sleeps = new ArrayList<>();
      EdgeGridSession session =
          builder()
              .retries(new RetryConfig())
              .sleeper((duration, context) -> sleeps.add(duration))
              .build();

      ApiResponse<Payload> response =
          session.exec(ApiRequest.get("/papi/v1/foo"), RequestContext.background(), Payload.class);

      assertThat(response.value()).isEqualTo(new Payload("x"));
      assertThat(sleeps).containsExactly(Duration.ofMillis(5729));
      assertThat(sent)
          .extracting(r -> r.getHeader("Authorization"))
          .containsExactly("sig-1", "sig-2");
    }

    @Test
    void doesNotRetryPost() {
      responses.add(json(500, "{}"));
      List<Duration> sleeps = new ArrayList<>();
      EdgeGridSession session =
          builder()
              .retries(new RetryConfig())
              .sleeper((duration, context) -> sleeps.add(duration))
              .build();

      ApiResponse<Payload> response =
          session.exec(ApiRequest.post("/papi/v1/foo"), RequestContext.background(), Payload.class);

      assertThat(response.statusCode()).isEqualTo(500);
      assertThat(sleeps).isEmpty();
      assertThat(sent).hasSize(1);
    }
  }
}
