package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.StatRecord;
import lombok.NonNull;

/**
 * Renders a stat record into a fixed 350x350 SVG card: black background, the character label and
 * a "Levels: n" line. Output depends only on the label and the record's level.
 */
public class SvgImageRenderer {

  private static final String HEADER =
      "<svg xmlns=\"http://www.w3.org/2000/svg\" preserveAspectRatio=\"xMinYMin meet\""
          + " viewBox=\"0 0 350 350\">"
          + "<style>.base { fill: white; font-family: serif; font-size: 14px; }</style>"
          + "<rect width=\"100%\" height=\"100%\" fill=\"black\" />";
  private static final String TEXT_ATTRIBUTES =
      "\" class=\"base\" dominant-baseline=\"middle\" text-anchor=\"middle\">";
  private static final String FOOTER = "</svg>";

  private final String characterLabel;

  public SvgImageRenderer() {
    this(RegistrySettings.DEFAULT_CHARACTER_LABEL);
  }

  public SvgImageRenderer(@NonNull String characterLabel) {
    this.characterLabel = characterLabel;
  }

  public String render(@NonNull StatRecord stats) {
    return render(characterLabel, "Levels: " + stats.level());
  }

  /**
   * Renders the card with arbitrary title and status lines. Both are escaped, so markup in either
   * ends up as text inside the document.
   */
  public String render(@NonNull String title, @NonNull String status) {
    return HEADER
        + textLine("40%", title)
        + textLine("50%", status)
        + FOOTER;
  }

  private static String textLine(String y, String content) {
    return "<text x=\"50%\" y=\"" + y + TEXT_ATTRIBUTES + escapeXml(content) + "</text>";
  }

  /** Escapes the five XML special characters. */
  static String escapeXml(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> escaped.append("&amp;");
        case '<' -> escaped.append("&lt;");
        case '>' -> escaped.append("&gt;");
        case '"' -> escaped.append("&quot;");
        case '\'' -> escaped.append("&apos;");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
