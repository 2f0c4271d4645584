package com.aoimapper.analyzer.api;

import com.aoimapper.analyzer.model.AnalysisResponse;
import com.aoimapper.analyzer.model.AnalysisResult;
import com.aoimapper.analyzer.model.AnalyzeRequest;
import com.aoimapper.analyzer.pipeline.AnalysisOrchestrator;
import com.aoimapper.analyzer.pipeline.ValidationException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point of the AOI analysis pipeline.
 *
 * <p>{@code POST /api/aoi/analyze} runs one synchronous analysis and returns the area summary
 * with one GeoJSON layer per land-cover class. Failures are mapped by
 * {@link ApiExceptionHandler}.
 *
 * <p>The run is bounded by the request timeout only. A client that disconnects does not cancel
 * it; the handler is synchronous and the container reports the disconnect on write.
 */
@RestController
@RequestMapping("/api/aoi")
public class AnalysisController {
  private final AnalysisOrchestrator orchestrator;
  private final GeoJsonMapper geoJsonMapper;

  public AnalysisController(AnalysisOrchestrator orchestrator, GeoJsonMapper geoJsonMapper) {
    this.orchestrator = orchestrator;
    this.geoJsonMapper = geoJsonMapper;
  }

  /**
   * Analyzes a circular AOI.
   *
   * @param request AOI center, area and optional timeout
   * @return summary and layers
   */
  @PostMapping(
      value = "/analyze",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AnalysisResponse analyze(@RequestBody(required = false) AnalyzeRequest request) {
    if (request == null) {
      throw new ValidationException("request body is required");
    }
    AnalysisResult result = orchestrator.analyze(request.toAoiRequest(), request.timeout());
    return geoJsonMapper.toResponse(result);
  }
}
