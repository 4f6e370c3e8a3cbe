package io.github.wphillipmoore.edgegrid.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class TransportExceptionTest {

  @Test
  void constructWithoutCause() {
    TransportException ex = new TransportException("fail", "GET", "https://host/api");

    assertThat(ex.getMessage()).isEqualTo("fail");
    assertThat(ex.getMethod()).isEqualTo("GET");
    assertThat(ex.getUrl()).isEqualTo("https://host/api");
    assertThat(ex.getCause()).isNull();
  }

  @Test
  void constructWithCause() {
    Throwable cause = new IOException("reset");
    TransportException ex = new TransportException("fail", "POST", "https://host/api", cause);

    assertThat(ex.getCause()).isSameAs(cause);
    assertThat(ex.getMethod()).isEqualTo("POST");
  }

  @Test
  void nullMethodThrows() {
    assertThatThrownBy(() -> new TransportException("fail", null, "https://host/api"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("method");
  }

  @Test
  void cancellationMessagesNameTheReason() {
    assertThat(new RequestCancelledException(true).getMessage())
        .isEqualTo("context deadline exceeded");
    assertThat(new RequestCancelledException(false).getMessage()).isEqualTo("context canceled");
    assertThat(new RequestCancelledException(true).isDeadlineExceeded()).isTrue();
  }
}
