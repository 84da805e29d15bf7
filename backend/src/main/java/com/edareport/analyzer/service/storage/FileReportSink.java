package com.edareport.analyzer.service.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.config.ApplicationProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes finished reports to disk under {@code report.output.directory}. Target paths are always
 * resolved relative to that directory and may not leave it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileReportSink {

  private final ApplicationProperties properties;

  public boolean isEnabled() {
    return properties.getOutput().isPersistEnabled();
  }

  public Path write(String outputPath, String html) throws IOException {
    Path target = resolve(outputPath);
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(target, html, StandardCharsets.UTF_8);
    log.info("Wrote report to {} ({} characters)", target, html.length());
    return target;
  }

  Path resolve(String outputPath) {
    if (outputPath == null || outputPath.isBlank()) {
      throw new IllegalArgumentException("Output path must not be blank");
    }
    Path root = Paths.get(properties.getOutput().getDirectory()).toAbsolutePath().normalize();
    Path target;
    try {
      target = root.resolve(outputPath).normalize();
    } catch (InvalidPathException e) {
      throw new IllegalArgumentException("Invalid output path: " + outputPath, e);
    }
    if (!target.startsWith(root) || target.equals(root)) {
      throw new IllegalArgumentException(
          "Output path must point to a file inside the report directory: " + outputPath);
    }
    return target;
  }
}
