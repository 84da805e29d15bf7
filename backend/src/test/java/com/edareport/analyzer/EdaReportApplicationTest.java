package com.edareport.analyzer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.edareport.analyzer.service.ReportGenerationService;

@SpringBootTest
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
class EdaReportApplicationTest {

  @Autowired private ReportGenerationService reportGenerationService;

  @Test
  void contextLoads() {
    assertThat(reportGenerationService).isNotNull();
  }
}
