package com.streamfirst.chainbattles.application;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.streamfirst.chainbattles.domain.StatAttribute;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the metadata document of a token and encodes it, with the rendered image embedded, as a
 * {@code data:application/json;base64,} URI.
 *
 * <p>Fields are written in the order name, description, image, attributes, and the JSON is
 * compact, so equal inputs always produce byte-identical URIs.
 */
@Slf4j
public class MetadataAssembler {

  private static final String TRAIT_TYPE = "trait_type";
  private static final String VALUE = "value";

  // default Gson escapes '=' in the base64 padding
  private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

  private final SvgImageRenderer renderer;
  private final String collectionName;
  private final String description;

  public MetadataAssembler(SvgImageRenderer renderer, RegistrySettings settings) {
    this.renderer = renderer;
    this.collectionName = settings.getCollectionName();
    this.description = settings.getDescription();
  }

  public String buildMetadata(@NonNull TokenId tokenId, @NonNull StatRecord stats) {
    String imageUri = DataUriCodec.encode(DataUriCodec.SVG_MEDIA_TYPE, renderer.render(stats));

    JsonObject document = new JsonObject();
    document.addProperty("name", collectionName + " #" + tokenId.toDecimalString());
    document.addProperty("description", description);
    document.addProperty("image", imageUri);
    if (stats.isFull()) {
      JsonArray attributes = new JsonArray();
      for (StatAttribute attribute : stats.attributes()) {
        JsonObject trait = new JsonObject();
        trait.addProperty(TRAIT_TYPE, attribute.traitType());
        trait.addProperty(VALUE, attribute.value());
        attributes.add(trait);
      }
      document.add("attributes", attributes);
    }

    String json = gson.toJson(document);
    log.debug("Assembled metadata for token {} ({} bytes of JSON)", tokenId, json.length());
    return DataUriCodec.encode(DataUriCodec.JSON_MEDIA_TYPE, json);
  }

  /**
   * Decodes a URI produced by {@link #buildMetadata}.
   *
   * @throws IllegalArgumentException if the URI or the document inside it is malformed
   */
  public TokenMetadata parse(String metadataUri) {
    String json = DataUriCodec.decode(metadataUri, DataUriCodec.JSON_MEDIA_TYPE);
    try {
      JsonObject document = JsonParser.parseString(json).getAsJsonObject();
      List<StatAttribute> attributes = new ArrayList<>();
      if (document.has("attributes")) {
        for (JsonElement element : document.getAsJsonArray("attributes")) {
          JsonObject trait = element.getAsJsonObject();
          attributes.add(
              new StatAttribute(requiredString(trait, TRAIT_TYPE), requiredString(trait, VALUE)));
        }
      }
      return new TokenMetadata(
          requiredString(document, "name"),
          requiredString(document, "description"),
          requiredString(document, "image"),
          attributes);
    } catch (JsonParseException | IllegalStateException | ClassCastException e) {
      throw new IllegalArgumentException("Malformed metadata document", e);
    }
  }

  private static String requiredString(JsonObject object, String field) {
    JsonElement element = object.get(field);
    if (element == null || !element.isJsonPrimitive()) {
      throw new IllegalArgumentException("Metadata field '" + field + "' is missing");
    }
    return element.getAsString();
  }

  /** Decodes the SVG text embedded in a metadata document. */
  public static String decodeImage(TokenMetadata metadata) {
    return DataUriCodec.decode(metadata.image(), DataUriCodec.SVG_MEDIA_TYPE);
  }
}
