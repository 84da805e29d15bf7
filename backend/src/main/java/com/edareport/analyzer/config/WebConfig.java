package com.edareport.analyzer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.edareport.analyzer.CorrelationIdFilter;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  private static final String[] DEFAULT_METHODS = new String[] {"GET", "POST", "DELETE", "OPTIONS"};
  private static final String[] DEFAULT_HEADERS = new String[] {"*"};

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var mapping = registry.addMapping("/api/**");

    if (allowedOrigins == null || allowedOrigins.length == 0) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOriginPatterns(allowedOrigins);
    }

    mapping
        .allowedMethods(DEFAULT_METHODS)
        .allowedHeaders(DEFAULT_HEADERS)
        .exposedHeaders("X-Report-Id", CorrelationIdFilter.CORRELATION_ID_HEADER)
        .allowCredentials(true);
  }
}
