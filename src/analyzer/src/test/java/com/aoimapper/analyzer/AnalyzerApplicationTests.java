package com.aoimapper.analyzer;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.aoimapper.analyzer.imagery.CompositeCache;
import com.aoimapper.analyzer.imagery.NoopCompositeCache;
import com.aoimapper.analyzer.pipeline.AnalysisOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "imagery.cache.enabled=false"
    })
class AnalyzerApplicationTests {
  @Autowired
  private AnalysisOrchestrator orchestrator;

  @Autowired
  private CompositeCache compositeCache;

  @Test
  void contextLoads() {
    assertNotNull(orchestrator);
    assertInstanceOf(NoopCompositeCache.class, compositeCache);
  }
}
