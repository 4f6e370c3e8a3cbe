package io.github.wphillipmoore.edgegrid.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ApiExceptionTest {

  @Test
  void messageStartsWithOperation() {
    ApiException ex = new ApiException("fetching rule tree", new ApiError("t", "T", "d", 500));

    assertThat(ex.getMessage()).startsWith("fetching rule tree: API error: ");
    assertThat(ex.getMessage()).contains("\"statusCode\":500");
    assertThat(ex.getOperation()).isEqualTo("fetching rule tree");
  }

  @Test
  void fromResponseParsesBody() {
    ApiException ex =
        ApiException.fromResponse(
            "searching properties",
            "{\"type\":\"internal_error\",\"title\":\"Internal Server Error\","
                + "\"detail\":\"Error searching for property\",\"status\":505}",
            500);

    assertThat(ex.getStatusCode()).isEqualTo(500);
    ApiError expected =
        new ApiError(
            "internal_error", "Internal Server Error", "Error searching for property", 500);
    assertThat(ex.is(expected)).isTrue();
    assertThat(ex.is(new ApiError("internal_error", "Internal Server Error", "other", 500)))
        .isFalse();
  }

  @Test
  void isNotFoundFollowsStatus() {
    assertThat(ApiException.fromResponse("op", "", 404).isNotFound()).isTrue();
    assertThat(ApiException.fromResponse("op", "", 403).isNotFound()).isFalse();
  }

  @Test
  void nullOperationThrows() {
    assertThatThrownBy(() -> new ApiException(null, new ApiError("", "", "", 500)))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("operation");
  }

  @Test
  void isEdgeGridException() {
    ApiException ex = ApiException.fromResponse("op", "", 500);

    assertThat(ex).isInstanceOf(EdgeGridException.class);
    assertThat(ex).isInstanceOf(RuntimeException.class);
  }
}
