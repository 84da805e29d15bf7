package com.edareport.analyzer.dto.profile;

import java.util.Base64;

import lombok.Value;

/** An encoded image plus its caption, embeddable without any external file reference. */
@Value
public class ChartArtifact {

  public static final String SVG_MEDIA_TYPE = "image/svg+xml";

  String mediaType;
  byte[] content;
  String caption;

  public String toDataUri() {
    return "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(content);
  }
}
