package io.github.wphillipmoore.edgegrid.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.TransportRequest;
import io.github.wphillipmoore.edgegrid.TransportResponse;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EndpointRetryPolicyTest {

  private static final RequestContext CONTEXT = RequestContext.background();

  @Mock private RetryPolicy base;

  private EndpointRetryPolicy policy(String... excluded) {
    return new EndpointRetryPolicy(
        base, List.of(excluded).stream().map(PathPattern::compile).toList());
  }

  @Nested
  class Methods {

    @Test
    void neverRetriesNonGet() {
      for (String method : List.of("POST", "PUT", "PATCH", "DELETE")) {
        TransportRequest request = request(method, "/papi/v1/search/find-by-value");

        assertThat(policy().shouldRetry(CONTEXT, request, response(500), null)).isFalse();
        assertThat(policy().shouldRetry(CONTEXT, request, response(429), null)).isFalse();
        assertThat(policy().shouldRetry(CONTEXT, request, response(409), null)).isFalse();
      }
      verifyNoInteractions(base);
    }

    @Test
    void neverRetriesFailedNonGet() {
      TransportException failure =
          new TransportException("reset", "POST", "https://h/x", new IOException("reset"));

      assertThat(policy().shouldRetry(CONTEXT, request("POST", "/x"), null, failure)).isFalse();
      verifyNoInteractions(base);
    }
  }

  @Nested
  class Exclusions {

    @Test
    void excludedRateLimitIsNotRetried() {
      TransportRequest request = request("GET", "/papi/v1/properties/prp_1/versions/2/rules");

      assertThat(
              policy("/papi/v1/properties/*/versions/*/rules")
                  .shouldRetry(CONTEXT, request, response(429), null))
          .isFalse();
      verifyNoInteractions(base);
    }

    @Test
    void excludedTransportFailureIsNotRetried() {
      TransportException failure =
          new TransportException("reset", "GET", "https://h/papi/v1/x", new IOException("reset"));

      TransportRequest request = request("GET", "/papi/v1/x");

      assertThat(policy("/papi/v1/*").shouldRetry(CONTEXT, request, null, failure)).isFalse();
      verifyNoInteractions(base);
    }

    @Test
    void nonMatchingPathIsNotExcluded() {
      EndpointRetryPolicy policy = policy("/papi/v1/properties/*/versions/*/rules");

      assertThat(policy.isExcluded("/papi/v1/rule-formats")).isFalse();
      assertThat(policy.isExcluded("/papi/v1/properties/p/versions/1/rules")).isTrue();
    }
  }

  @Nested
  class SpecialStatuses {

    @Test
    void papiRateLimitAlwaysRetried() {
      TransportRequest request = request("GET", "/papi/v1/rule-formats");

      assertThat(policy().shouldRetry(CONTEXT, request, response(429), null)).isTrue();
      verifyNoInteractions(base);
    }

    @Test
    void conflictAlwaysRetried() {
      TransportRequest request = request("GET", "/siteshield/v1/maps");

      assertThat(policy().shouldRetry(CONTEXT, request, response(409), null)).isTrue();
      verifyNoInteractions(base);
    }

    @Test
    void otherRateLimitDelegates() {
      TransportRequest request = request("GET", "/siteshield/v1/maps");
      TransportResponse response = response(429);
      when(base.shouldRetry(CONTEXT, request, response, null)).thenReturn(false);

      assertThat(policy().shouldRetry(CONTEXT, request, response, null)).isFalse();
      verify(base).shouldRetry(CONTEXT, request, response, null);
    }

    @Test
    void getFailureDelegates() {
      when(base.shouldRetry(any(), any(), any(), any())).thenReturn(true);
      TransportException failure =
          new TransportException("reset", "GET", "https://h/x", new IOException("reset"));

      assertThat(policy().shouldRetry(CONTEXT, request("GET", "/x"), null, failure)).isTrue();
    }
  }

  private static TransportRequest request(String method, String path) {
    return new TransportRequest(method, URI.create("https://h" + path), Map.of(), null, null);
  }

  private static TransportResponse response(int status) {
    return new TransportResponse(status, "", Map.of());
  }
}
