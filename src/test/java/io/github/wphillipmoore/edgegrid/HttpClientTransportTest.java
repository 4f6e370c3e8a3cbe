package io.github.wphillipmoore.edgegrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import io.github.wphillipmoore.edgegrid.exception.RequestCancelledException;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HttpClientTransportTest {

  private final HttpClientTransport transport = new HttpClientTransport();
  private final CountDownLatch release = new CountDownLatch(1);
  private final ExecutorService handlers = Executors.newCachedThreadPool();

  private HttpServer server;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    baseUrl = "http://localhost:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    if (server != null) {
      server.stop(0);
    }
    handlers.shutdownNow();
  }

  private void startServer(int statusCode, String responseBody, Map<String, String> headers) {
    server.createContext(
        "/",
        exchange -> {
          headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.start();
  }

  private TransportRequest request(String method, String path, String body) {
    return new TransportRequest(
        method,
        URI.create(baseUrl + path),
        Map.of("Content-Type", "application/json", "X-Trace", "abc"),
        body,
        Duration.ofSeconds(5));
  }

  @Nested
  class Exchange {

    @Test
    void sendsMethodHeadersAndBody() {
      AtomicReference<String> seen = new AtomicReference<>();
      server.createContext(
          "/",
          exchange -> {
            seen.set(
                exchange.getRequestMethod()
                    + " "
                    + exchange.getRequestURI()
                    + " "
                    + exchange.getRequestHeaders().getFirst("X-Trace")
                    + " "
                    + new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-Reply", "yes");
            exchange.sendResponseHeaders(201, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
              os.write(body);
            }
          });
      server.start();

      TransportResponse response =
          transport.send(
              request("PUT", "/papi/v1/x?a=1", "{\"k\":1}"), RequestContext.background());

      assertThat(seen.get()).isEqualTo("PUT /papi/v1/x?a=1 abc {\"k\":1}");
      assertThat(response.statusCode()).isEqualTo(201);
      assertThat(response.body()).isEqualTo("{\"ok\":true}");
      assertThat(response.header("x-reply")).isEqualTo("yes");
    }

    @Test
    void returnsErrorStatusesAsResponses() {
      startServer(500, "boom", Map.of());

      TransportResponse response =
          transport.send(request("GET", "/", null), RequestContext.background());

      assertThat(response.statusCode()).isEqualTo(500);
      assertThat(response.body()).isEqualTo("boom");
    }

    @Test
    void doesNotFollowRedirects() {
      startServer(302, "", Map.of("Location", "/elsewhere"));

      TransportResponse response =
          transport.send(request("GET", "/", null), RequestContext.background());

      assertThat(response.statusCode()).isEqualTo(302);
      assertThat(response.header("Location")).isEqualTo("/elsewhere");
      assertThat(response.body()).isEmpty();
    }

    @Test
    void skipsHeadersTheClientManages() {
      startServer(200, "{}", Map.of());
      TransportRequest request =
          new TransportRequest(
              "GET",
              URI.create(baseUrl + "/"),
              Map.of("Host", "example.com", "Content-Length", "3"),
              null,
              null);

      assertThat(transport.send(request, RequestContext.background()).statusCode())
          .isEqualTo(200);
    }
  }

  @Nested
  class Failures {

    @Test
    void connectionRefusedIsTransportError() {
      server.start();
      server.stop(0);
      String url = baseUrl + "/papi/v1/x";
      TransportRequest request =
          new TransportRequest("GET", URI.create(url), Map.of(), null, Duration.ofSeconds(5));

      assertThatThrownBy(() -> transport.send(request, RequestContext.background()))
          .isInstanceOfSatisfying(
              TransportException.class,
              e -> {
                assertThat(e.getMessage()).startsWith("HTTP request failed: ");
                assertThat(e.getMethod()).isEqualTo("GET");
                assertThat(e.getUrl()).isEqualTo(url);
                assertThat(e.getCause()).isNotNull();
              });
      server = null;
    }

    @Test
    void invalidHeaderIsTransportError() {
      TransportRequest request =
          new TransportRequest("GET", URI.create(baseUrl), Map.of("bad header", "x"), null, null);

      assertThatThrownBy(() -> transport.send(request, RequestContext.background()))
          .isInstanceOf(TransportException.class)
          .hasMessageStartingWith("invalid request: ")
          .hasCauseInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class Cancellation {

    private void startSlowServer() {
      server.createContext(
          "/",
          exchange -> {
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
          });
      server.setExecutor(handlers);
      server.start();
    }

    @Test
    void cancelledContextSendsNothing() {
      RequestContext context = RequestContext.builder().build();
      context.cancel();

      assertThatThrownBy(() -> transport.send(request("GET", "/", null), context))
          .isInstanceOf(RequestCancelledException.class)
          .hasMessage("context canceled");
    }

    @Test
    void cancellationAbandonsInFlightRequest() {
      startSlowServer();
      RequestContext context = RequestContext.builder().build();
      ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
      try {
        scheduler.schedule(context::cancel, 100, TimeUnit.MILLISECONDS);

        assertThatThrownBy(() -> transport.send(request("GET", "/", null), context))
            .isInstanceOf(RequestCancelledException.class)
            .hasMessage("context canceled");
      } finally {
        scheduler.shutdownNow();
      }
    }

    @Test
    void deadlineAbandonsInFlightRequest() {
      startSlowServer();
      RequestContext context = RequestContext.builder().timeout(Duration.ofMillis(100)).build();

      assertThatThrownBy(() -> transport.send(request("GET", "/", null), context))
          .isInstanceOfSatisfying(
              RequestCancelledException.class, e -> assertThat(e.isDeadlineExceeded()).isTrue());
    }
  }

  @Test
  void flattenHeadersJoinsRepeatedValues() {
    HttpHeaders headers =
        HttpHeaders.of(
            Map.of("Vary", List.of("Accept", "Origin"), "Date", List.of("now")), (a, b) -> true);

    assertThat(HttpClientTransport.flattenHeaders(headers))
        .containsEntry("Vary", "Accept, Origin")
        .containsEntry("Date", "now");
  }
}
