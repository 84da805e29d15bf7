package com.edareport.analyzer.service.rendering;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.apache.commons.text.StringEscapeUtils;

/**
 * Minimal SVG writer used by the chart renderers. Coordinates are written with two decimals and
 * {@link Locale#ROOT}, so the same drawing calls always produce the same bytes.
 */
final class SvgCanvas {

  static final String FONT_FAMILY = "DejaVu Sans, Verdana, Arial, sans-serif";

  private final int width;
  private final int height;
  private final StringBuilder body = new StringBuilder();

  SvgCanvas(int width, int height) {
    this.width = width;
    this.height = height;
    rect(0, 0, width, height, "#ffffff", null);
  }

  SvgCanvas rect(double x, double y, double w, double h, String fill, String stroke) {
    body.append("<rect x=\"")
        .append(num(x))
        .append("\" y=\"")
        .append(num(y))
        .append("\" width=\"")
        .append(num(w))
        .append("\" height=\"")
        .append(num(h))
        .append("\" fill=\"")
        .append(fill)
        .append('"');
    if (stroke != null) {
      body.append(" stroke=\"").append(stroke).append("\" stroke-width=\"1\"");
    }
    body.append("/>\n");
    return this;
  }

  SvgCanvas line(double x1, double y1, double x2, double y2, String stroke) {
    body.append("<line x1=\"")
        .append(num(x1))
        .append("\" y1=\"")
        .append(num(y1))
        .append("\" x2=\"")
        .append(num(x2))
        .append("\" y2=\"")
        .append(num(y2))
        .append("\" stroke=\"")
        .append(stroke)
        .append("\" stroke-width=\"1\"/>\n");
    return this;
  }

  /** Open path through {@code xs[i], ys[i]}; both arrays must have the same length. */
  SvgCanvas polyline(double[] xs, double[] ys, String stroke, double strokeWidth) {
    body.append("<polyline points=\"");
    for (int i = 0; i < xs.length; i++) {
      if (i > 0) {
        body.append(' ');
      }
      body.append(num(xs[i])).append(',').append(num(ys[i]));
    }
    body.append("\" fill=\"none\" stroke=\"")
        .append(stroke)
        .append("\" stroke-width=\"")
        .append(num(strokeWidth))
        .append("\"/>\n");
    return this;
  }

  SvgCanvas text(double x, double y, String content, Anchor anchor, int fontSize, String fill) {
    return text(x, y, content, anchor, fontSize, fill, 0, false);
  }

  SvgCanvas text(
      double x,
      double y,
      String content,
      Anchor anchor,
      int fontSize,
      String fill,
      int rotation,
      boolean bold) {
    body.append("<text x=\"")
        .append(num(x))
        .append("\" y=\"")
        .append(num(y))
        .append("\" text-anchor=\"")
        .append(anchor.svgValue)
        .append("\" font-size=\"")
        .append(fontSize)
        .append("\" fill=\"")
        .append(fill)
        .append('"');
    if (bold) {
      body.append(" font-weight=\"bold\"");
    }
    if (rotation != 0) {
      body.append(" transform=\"rotate(")
          .append(rotation)
          .append(' ')
          .append(num(x))
          .append(' ')
          .append(num(y))
          .append(")\"");
    }
    body.append('>').append(StringEscapeUtils.escapeXml10(content)).append("</text>\n");
    return this;
  }

  byte[] toBytes() {
    String svg =
        "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\""
            + width
            + "\" height=\""
            + height
            + "\" viewBox=\"0 0 "
            + width
            + ' '
            + height
            + "\" font-family=\""
            + FONT_FAMILY
            + "\">\n"
            + body
            + "</svg>\n";
    return svg.getBytes(StandardCharsets.UTF_8);
  }

  static String num(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  /** Short label for an axis tick or bin edge. */
  static String tickLabel(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e9) {
      return Long.toString((long) value);
    }
    double magnitude = Math.abs(value);
    if (magnitude >= 1e6 || magnitude < 1e-3) {
      return String.format(Locale.ROOT, "%.2e", value);
    }
    String fixed = String.format(Locale.ROOT, "%.3f", value);
    return fixed.replaceAll("0+$", "").replaceAll("\\.$", "");
  }

  /** Truncates long category or column names so labels stay inside the chart. */
  static String shorten(String label, int maxLength) {
    if (label.length() <= maxLength) {
      return label;
    }
    return label.substring(0, maxLength - 1) + "\u2026";
  }

  enum Anchor {
    START("start"),
    MIDDLE("middle"),
    END("end");

    private final String svgValue;

    Anchor(String svgValue) {
      this.svgValue = svgValue;
    }
  }
}
