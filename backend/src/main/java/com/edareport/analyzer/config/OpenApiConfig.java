package com.edareport.analyzer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:EDA Report API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Profiles tabular data and returns a self-contained HTML"
          + " exploratory data analysis report.}")
  private String description;

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI().info(new Info().title(title).version(version).description(description));
  }
}
