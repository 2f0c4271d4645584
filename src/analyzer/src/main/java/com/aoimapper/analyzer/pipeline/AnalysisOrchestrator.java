package com.aoimapper.analyzer.pipeline;

import com.aoimapper.analyzer.aggregate.AreaAggregator;
import com.aoimapper.analyzer.classify.ClassifiedRaster;
import com.aoimapper.analyzer.classify.SpectralClassifier;
import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.geometry.EqualAreaProjection;
import com.aoimapper.analyzer.geometry.GeometryBuilder;
import com.aoimapper.analyzer.imagery.CompositeFetcher;
import com.aoimapper.analyzer.imagery.ImagerySession;
import com.aoimapper.analyzer.imagery.ImagerySource;
import com.aoimapper.analyzer.imagery.RasterComposite;
import com.aoimapper.analyzer.model.AnalysisResult;
import com.aoimapper.analyzer.model.AnalysisSummary;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.AoiRequest;
import com.aoimapper.analyzer.model.LandCoverClass;
import com.aoimapper.analyzer.model.LayerFeatureCollection;
import com.aoimapper.analyzer.vectorize.Vectorizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the analysis pipeline for one AOI request.
 *
 * <p>Stages run in order: geometry, imagery, classification, vectorization, aggregation. Any
 * failure ends the run in {@link AnalysisStage#FAILED} and is reported as an
 * {@link AnalysisException}; partial results are never returned. The imagery session is
 * closed on every exit path.
 */
@Component
public class AnalysisOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

  private final GeometryBuilder geometryBuilder;
  private final ImagerySource imagerySource;
  private final CompositeFetcher compositeFetcher;
  private final SpectralClassifier classifier;
  private final Vectorizer vectorizer;
  private final AreaAggregator aggregator;
  private final AnalyzerProperties.Timeouts timeouts;
  private final List<AnalysisListener> listeners;
  private final MeterRegistry meterRegistry;

  @Autowired
  public AnalysisOrchestrator(
      GeometryBuilder geometryBuilder,
      ImagerySource imagerySource,
      CompositeFetcher compositeFetcher,
      SpectralClassifier classifier,
      Vectorizer vectorizer,
      AreaAggregator aggregator,
      AnalyzerProperties properties,
      ObjectProvider<AnalysisListener> listeners,
      MeterRegistry meterRegistry) {
    this(
        geometryBuilder,
        imagerySource,
        compositeFetcher,
        classifier,
        vectorizer,
        aggregator,
        properties,
        listeners.orderedStream().collect(Collectors.toList()),
        meterRegistry);
  }

  public AnalysisOrchestrator(
      GeometryBuilder geometryBuilder,
      ImagerySource imagerySource,
      CompositeFetcher compositeFetcher,
      SpectralClassifier classifier,
      Vectorizer vectorizer,
      AreaAggregator aggregator,
      AnalyzerProperties properties,
      List<AnalysisListener> listeners,
      MeterRegistry meterRegistry) {
    this.geometryBuilder = geometryBuilder;
    this.imagerySource = imagerySource;
    this.compositeFetcher = compositeFetcher;
    this.classifier = classifier;
    this.vectorizer = vectorizer;
    this.aggregator = aggregator;
    this.timeouts = properties.timeouts();
    this.listeners = List.copyOf(listeners);
    this.meterRegistry = meterRegistry;
  }

  /**
   * Analyzes an AOI with the configured default timeout.
   *
   * @param request analysis input
   * @return summary and layers
   */
  public AnalysisResult analyze(AoiRequest request) {
    return analyze(request, (Duration) null);
  }

  /**
   * Analyzes an AOI within a caller-supplied time bound.
   *
   * @param request analysis input
   * @param timeout caller bound; {@code null} or non-positive selects the default, larger
   *     values are capped at the configured maximum
   * @return summary and layers
   */
  public AnalysisResult analyze(AoiRequest request, Duration timeout) {
    return analyze(request, CancellationToken.withTimeout(effectiveTimeout(timeout)));
  }

  /**
   * Analyzes an AOI under an existing cancellation token.
   *
   * @param request analysis input
   * @param token cancellation and deadline of the run
   * @return summary and layers
   * @throws AnalysisException on any failure, carrying its {@link AnalysisErrorKind}
   */
  public AnalysisResult analyze(AoiRequest request, CancellationToken token) {
    Run run = new Run(request);
    long startNs = System.nanoTime();
    try {
      AoiGeometry aoi = run.stage(AnalysisStage.VALIDATING, token, () -> geometryBuilder.build(request));
      EqualAreaProjection projection = EqualAreaProjection.centeredOn(aoi.center());

      RasterComposite composite = run.stage(AnalysisStage.FETCHING_IMAGERY, token, () -> {
        try (ImagerySession session = imagerySource.openSession()) {
          return compositeFetcher.fetch(session, aoi, projection, token);
        }
      });
      ClassifiedRaster raster = run.stage(
          AnalysisStage.CLASSIFYING, token, () -> classifier.classify(composite, token));
      Map<LandCoverClass, LayerFeatureCollection> layers = run.stage(
          AnalysisStage.VECTORIZING, token, () -> vectorizer.vectorize(raster, aoi, projection, token));
      AnalysisResult result = run.stage(
          AnalysisStage.AGGREGATING,
          token,
          () -> new AnalysisResult(aggregator.aggregate(request, aoi, projection, layers), layers));
      AnalysisSummary summary = result.summary();
      run.transition(AnalysisStage.DONE);
      runCounter("success").increment();
      log.info(
          "Analysis '{}' done in {} ms: water={} agriculture={} forest={} infrastructure={} total={} m2",
          run.name,
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs),
          summary.waterAreaSqM(),
          summary.agricultureAreaSqM(),
          summary.forestAreaSqM(),
          summary.infrastructureAreaSqM(),
          summary.totalAreaSqM());
      return result;
    } catch (AnalysisException ex) {
      run.fail(ex);
      runCounter(ex.kind().code()).increment();
      throw ex;
    } catch (RuntimeException ex) {
      InternalAnalysisException failure =
          new InternalAnalysisException("Unexpected failure: " + ex.getMessage(), ex);
      run.fail(failure);
      runCounter(failure.kind().code()).increment();
      throw failure;
    }
  }

  Duration effectiveTimeout(Duration requested) {
    Duration fallback = timeouts == null || timeouts.defaultTimeout() == null
        ? Duration.ofSeconds(120)
        : timeouts.defaultTimeout();
    Duration max = timeouts == null || timeouts.maxTimeout() == null ? Duration.ofSeconds(600) : timeouts.maxTimeout();
    if (requested == null || requested.isZero() || requested.isNegative()) {
      return fallback.compareTo(max) > 0 ? max : fallback;
    }
    return requested.compareTo(max) > 0 ? max : requested;
  }

  private Counter runCounter(String outcome) {
    return Counter.builder("analyzer.pipeline.runs.total")
        .description("Analysis runs (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private Timer stageTimer(AnalysisStage stage) {
    return Timer.builder("analyzer.pipeline.stage.duration")
        .description("Analysis stage duration (seconds)")
        .tag("stage", stage.name().toLowerCase(Locale.ROOT))
        .register(meterRegistry);
  }

  /** State of one run. Stages only move forward. */
  private final class Run {
    private final String name;
    private final String context;
    private AnalysisStage current;

    private Run(AoiRequest request) {
      this.name = request == null || request.name() == null ? "<unnamed>" : request.name();
      this.context = request == null
          ? "no request"
          : "center=" + request.latitude() + "," + request.longitude() + " area_sq_m=" + request.areaSqM();
    }

    private <T> T stage(AnalysisStage stage, CancellationToken token, Supplier<T> body) {
      transition(stage);
      token.throwIfCancelled();
      long startNs = System.nanoTime();
      try {
        T value = body.get();
        token.throwIfCancelled();
        return value;
      } catch (AnalysisException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        log.error(
            "Analysis '{}' failed unexpectedly in {} ({})", name, stage, context, ex);
        throw new InternalAnalysisException(
            "Unexpected failure while " + stage.name().toLowerCase(Locale.ROOT) + ": " + ex.getMessage(), ex);
      } finally {
        stageTimer(stage).record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      }
    }

    private void transition(AnalysisStage next) {
      AnalysisStage from = current;
      if (from != null && (from.isTerminal() || next.ordinal() <= from.ordinal())) {
        throw new IllegalStateException("illegal transition " + from + " -> " + next);
      }
      current = next;
      log.info("Analysis '{}' {} -> {}", name, from == null ? "START" : from, next);
      for (AnalysisListener listener : listeners) {
        try {
          listener.onTransition(name, from, next);
        } catch (RuntimeException ex) {
          log.warn("Analysis listener {} failed on transition to {}", listener.getClass().getSimpleName(), next, ex);
        }
      }
    }

    private void fail(AnalysisException failure) {
      AnalysisStage failedIn = current;
      if (failure.kind() == AnalysisErrorKind.INTERNAL) {
        log.error("Analysis '{}' failed in {}: {}", name, failedIn, failure.getMessage(), failure);
      } else {
        log.warn("Analysis '{}' failed in {}: {} ({})", name, failedIn, failure.getMessage(), failure.kind().code());
      }
      current = AnalysisStage.FAILED;
      for (AnalysisListener listener : listeners) {
        try {
          listener.onTransition(name, failedIn, AnalysisStage.FAILED);
          listener.onFailure(name, failedIn, failure);
        } catch (RuntimeException ex) {
          log.warn("Analysis listener {} failed on failure notification", listener.getClass().getSimpleName(), ex);
        }
      }
    }
  }
}
