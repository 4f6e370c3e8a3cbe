package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.TransportRequest;
import io.github.wphillipmoore.edgegrid.TransportResponse;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.net.ProtocolException;
import java.security.cert.CertificateException;
import javax.net.ssl.SSLHandshakeException;
import org.jspecify.annotations.Nullable;

/**
 * Method-agnostic classification of retryable outcomes.
 *
 * <p>Transport failures are retried unless they are permanent (certificate rejection, malformed
 * request, too many redirects). Responses are retried on 429, on status 0 and on 5xx other than
 * 501.
 */
public final class StandardRetryPolicy implements RetryPolicy {

  @Override
  public boolean shouldRetry(
      RequestContext context,
      TransportRequest request,
      @Nullable TransportResponse response,
      @Nullable TransportException failure) {
    context.throwIfDone();
    if (failure != null) {
      return !isPermanent(failure);
    }
    if (response == null) {
      return false;
    }
    int status = response.statusCode();
    if (status == 429) {
      return true;
    }
    return status == 0 || (status >= 500 && status != 501);
  }

  static boolean isPermanent(TransportException failure) {
    for (Throwable cause = failure.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof SSLHandshakeException
          || cause instanceof CertificateException
          || cause instanceof ProtocolException
          || cause instanceof IllegalArgumentException) {
        return true;
      }
    }
    return false;
  }
}
