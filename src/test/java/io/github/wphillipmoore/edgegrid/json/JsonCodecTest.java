package io.github.wphillipmoore.edgegrid.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;
import io.github.wphillipmoore.edgegrid.exception.MarshalingException;
import io.github.wphillipmoore.edgegrid.exception.UnmarshalingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  record Sample(
      @OmitEmpty String label,
      @OmitEmpty @SerializedName("is_on") boolean on,
      @OmitEmpty int count,
      @OmitEmpty List<String> tags,
      String always,
      String nullable) {}

  record Reading(double value) {}

  @Nested
  class Marshal {

    @Test
    void omitsEmptyAnnotatedMembers() {
      String json = codec.marshal(new Sample("", false, 0, List.of(), "", null));

      assertThat(json).isEqualTo("{\"always\":\"\",\"nullable\":null}");
    }

    @Test
    void keepsPopulatedAnnotatedMembers() {
      String json = codec.marshal(new Sample("x", true, 2, List.of("a"), "y", "z"));

      assertThat(json)
          .isEqualTo(
              "{\"label\":\"x\",\"is_on\":true,\"count\":2,\"tags\":[\"a\"],"
                  + "\"always\":\"y\",\"nullable\":\"z\"}");
    }

    @Test
    void doesNotEscapeHtml() {
      assertThat(codec.marshal(Map.of("k", "<a&b>"))).isEqualTo("{\"k\":\"<a&b>\"}");
    }

    @Test
    void nonFiniteNumberFailsAsMarshalingError() {
      assertThatThrownBy(() -> codec.marshal(new Reading(Double.NaN)))
          .isInstanceOf(MarshalingException.class)
          .hasMessageStartingWith("marshaling request body: ");
    }
  }

  @Nested
  class Unmarshal {

    @Test
    void decodesIntoRecord() {
      Sample sample =
          codec.unmarshal("{\"label\":\"x\",\"is_on\":true,\"always\":\"a\"}", Sample.class, 200);

      assertThat(sample.label()).isEqualTo("x");
      assertThat(sample.on()).isTrue();
      assertThat(sample.count()).isZero();
      assertThat(sample.nullable()).isNull();
    }

    @Test
    void malformedBodyKeepsRawText() {
      assertThatThrownBy(() -> codec.unmarshal("{not json", Sample.class, 200))
          .isInstanceOfSatisfying(
              UnmarshalingException.class,
              e -> {
                assertThat(e.getMessage()).startsWith("unmarshaling response body: ");
                assertThat(e.getResponseText()).isEqualTo("{not json");
                assertThat(e.getStatusCode()).isEqualTo(200);
              });
    }

    @Test
    void emptyBodyIsAnError() {
      assertThatThrownBy(() -> codec.unmarshal("", Sample.class, 201))
          .isInstanceOf(UnmarshalingException.class)
          .hasMessage("unmarshaling response body: unexpected end of JSON input");
    }

    @Test
    void wrongShapeIsAnError() {
      assertThatThrownBy(() -> codec.unmarshal("[1,2]", Sample.class, 200))
          .isInstanceOf(UnmarshalingException.class);
    }
  }

  @Test
  void emptinessFollowsJsonValue() {
    assertThat(OmitEmptyAdapterFactory.isEmpty(new JsonPrimitive(0.0))).isTrue();
    assertThat(OmitEmptyAdapterFactory.isEmpty(new JsonPrimitive(0.5))).isFalse();
    assertThat(OmitEmptyAdapterFactory.isEmpty(new JsonPrimitive(""))).isTrue();
    assertThat(OmitEmptyAdapterFactory.isEmpty(new JsonPrimitive(false))).isTrue();
  }
}
