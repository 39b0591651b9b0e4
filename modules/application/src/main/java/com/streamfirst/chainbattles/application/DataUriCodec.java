package com.streamfirst.chainbattles.application;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Wraps text as a base64 {@code data:} URI so one document can be embedded in another without
 * delimiter collisions.
 */
public final class DataUriCodec {

  public static final String SVG_MEDIA_TYPE = "image/svg+xml";
  public static final String JSON_MEDIA_TYPE = "application/json";

  private DataUriCodec() {}

  /** Returns {@code data:<mediaType>;base64,<base64 of the UTF-8 bytes of text>}. */
  public static String encode(String mediaType, String text) {
    return prefix(mediaType)
        + Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Inverse of {@link #encode}.
   *
   * @throws IllegalArgumentException if the URI is not a base64 data URI of {@code mediaType}
   */
  public static String decode(String uri, String mediaType) {
    String prefix = prefix(mediaType);
    if (uri == null || !uri.startsWith(prefix)) {
      throw new IllegalArgumentException("Not a base64 " + mediaType + " data URI");
    }
    byte[] payload = Base64.getDecoder().decode(uri.substring(prefix.length()));
    return new String(payload, StandardCharsets.UTF_8);
  }

  private static String prefix(String mediaType) {
    return "data:" + mediaType + ";base64,";
  }
}
