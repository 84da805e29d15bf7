package com.edareport.analyzer.service.assembly;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the static report resources (page skeleton, stylesheet, navigation script) from the
 * classpath and fills {@code {{PLACEHOLDER}}} slots.
 */
@Slf4j
@Service
public class ReportTemplateService {

  public static final String PAGE_TEMPLATE = "report-template.html";
  public static final String STYLESHEET = "report.css";
  public static final String NAVIGATION_SCRIPT = "navigation.js";

  private static final String TEMPLATES_PATH = "report/";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)\\}\\}");

  private final Map<String, String> cache = new ConcurrentHashMap<>();

  public String loadTemplate(String name) throws IOException {
    String cached = cache.get(name);
    if (cached != null) {
      return cached;
    }

    String fileName = TEMPLATES_PATH + name;
    ClassPathResource resource = new ClassPathResource(fileName);

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      String content = reader.lines().collect(Collectors.joining("\n"));
      cache.put(name, content);
      return content;
    } catch (IOException e) {
      log.error("Failed to load report template: {}", fileName, e);
      throw new IOException("Failed to load report template: " + fileName, e);
    }
  }

  /**
   * Replaces every placeholder in one pass, so substituted content is never scanned for further
   * placeholders.
   *
   * @throws IllegalStateException if the template names a placeholder without a value
   */
  public String render(String template, Map<String, String> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder(template.length() * 2);
    while (matcher.find()) {
      String key = matcher.group(1);
      String value = values.get(key);
      if (value == null) {
        throw new IllegalStateException("No value for template placeholder " + key);
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
