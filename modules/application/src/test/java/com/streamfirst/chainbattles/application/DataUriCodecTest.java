package com.streamfirst.chainbattles.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DataUriCodecTest {

  @Test
  void encodesWithMediaTypePrefix() {
    assertThat(DataUriCodec.encode(DataUriCodec.JSON_MEDIA_TYPE, "{\"a\":1}"))
        .isEqualTo("data:application/json;base64,eyJhIjoxfQ==");
    assertThat(DataUriCodec.encode(DataUriCodec.SVG_MEDIA_TYPE, "Levels: 0"))
        .isEqualTo("data:image/svg+xml;base64,TGV2ZWxzOiAw");
  }

  @Test
  void decodesNonAsciiText() {
    String uri = DataUriCodec.encode(DataUriCodec.SVG_MEDIA_TYPE, "Krieger é⚔");

    assertThat(DataUriCodec.decode(uri, DataUriCodec.SVG_MEDIA_TYPE)).isEqualTo("Krieger é⚔");
  }

  @Test
  void rejectsOtherMediaType() {
    String uri = DataUriCodec.encode(DataUriCodec.SVG_MEDIA_TYPE, "<svg/>");

    assertThatThrownBy(() -> DataUriCodec.decode(uri, DataUriCodec.JSON_MEDIA_TYPE))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("application/json");
  }

  @Test
  void rejectsInvalidPayload() {
    assertThatThrownBy(
            () -> DataUriCodec.decode("data:application/json;base64,%%%", DataUriCodec.JSON_MEDIA_TYPE))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
