package com.streamfirst.chainbattles.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.chainbattles.domain.StatAttribute;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.StatVariant;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class MetadataAssemblerTest {

  private static final String BASELINE_IMAGE =
      "data:image/svg+xml;base64,"
          + Base64.getEncoder()
              .encodeToString(SvgImageRendererTest.BASELINE_SVG.getBytes(StandardCharsets.UTF_8));

  private final MetadataAssembler assembler =
      new MetadataAssembler(new SvgImageRenderer(), RegistrySettings.defaults());

  @Test
  void buildsBaselineDocumentInCanonicalForm() {
    String expectedJson =
        "{\"name\":\"Chain Battles #1\",\"description\":\"Battles on chain\",\"image\":\""
            + BASELINE_IMAGE
            + "\",\"attributes\":[{\"trait_type\":\"health\",\"value\":\"10\"},"
            + "{\"trait_type\":\"strength\",\"value\":\"6\"},"
            + "{\"trait_type\":\"speed\",\"value\":\"3\"}]}";

    String uri = assembler.buildMetadata(TokenId.of(1), StatRecord.baseline(StatVariant.FULL));

    assertThat(uri)
        .isEqualTo(
            "data:application/json;base64,"
                + Base64.getEncoder().encodeToString(expectedJson.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void base64PaddingIsNotEscaped() {
    String uri = assembler.buildMetadata(TokenId.of(1), StatRecord.baseline(StatVariant.FULL));

    String json = DataUriCodec.decode(uri, DataUriCodec.JSON_MEDIA_TYPE);

    assertThat(BASELINE_IMAGE).endsWith("=");
    assertThat(json).contains(BASELINE_IMAGE).doesNotContain("\\u003d");
  }

  @Test
  void reducedDocumentHasNoAttributes() {
    String uri = assembler.buildMetadata(TokenId.of(12), StatRecord.baseline(StatVariant.REDUCED));

    String json = DataUriCodec.decode(uri, DataUriCodec.JSON_MEDIA_TYPE);

    assertThat(json)
        .startsWith("{\"name\":\"Chain Battles #12\",\"description\":\"Battles on chain\",\"image\":")
        .doesNotContain("attributes");
  }

  @Test
  void parseRecoversDocumentAndImage() {
    StatRecord stats = new StatRecord(StatVariant.FULL, 2, 27, 13, 6);

    TokenMetadata metadata = assembler.parse(assembler.buildMetadata(TokenId.of(5), stats));

    assertThat(metadata.name()).isEqualTo("Chain Battles #5");
    assertThat(metadata.description()).isEqualTo("Battles on chain");
    assertThat(metadata.attributes())
        .containsExactly(
            new StatAttribute("health", "27"),
            new StatAttribute("strength", "13"),
            new StatAttribute("speed", "6"));
    assertThat(MetadataAssembler.decodeImage(metadata))
        .startsWith("<svg ")
        .endsWith("</svg>")
        .contains(">Levels: 2</text>");
  }

  @Test
  void usesConfiguredTexts() {
    RegistrySettings settings =
        RegistrySettings.builder().collectionName("Arena").description("Pit fights").build();
    MetadataAssembler custom = new MetadataAssembler(new SvgImageRenderer("Rogue"), settings);

    TokenMetadata metadata =
        custom.parse(custom.buildMetadata(TokenId.of(3), StatRecord.baseline(StatVariant.FULL)));

    assertThat(metadata.name()).isEqualTo("Arena #3");
    assertThat(metadata.description()).isEqualTo("Pit fights");
    assertThat(MetadataAssembler.decodeImage(metadata)).contains(">Rogue</text>");
  }

  @Test
  void parseRejectsMalformedDocuments() {
    String notJson = DataUriCodec.encode(DataUriCodec.JSON_MEDIA_TYPE, "not json at all {");
    String missingImage =
        DataUriCodec.encode(DataUriCodec.JSON_MEDIA_TYPE, "{\"name\":\"x\",\"description\":\"y\"}");

    assertThatThrownBy(() -> assembler.parse(notJson)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> assembler.parse(missingImage))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("image");
  }
}
