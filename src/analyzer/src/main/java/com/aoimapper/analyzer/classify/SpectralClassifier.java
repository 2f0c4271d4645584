package com.aoimapper.analyzer.classify;

import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.imagery.RasterComposite;
import com.aoimapper.analyzer.model.LandCoverClass;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Labels every composite cell with the first matching rule of the policy. */
@Component
public class SpectralClassifier {
  private static final Logger log = LoggerFactory.getLogger(SpectralClassifier.class);
  private static final int PARALLEL_THRESHOLD = 262_144;
  private static final int ROW_BLOCK = 64;

  private final ClassificationPolicy policy;

  @Autowired
  public SpectralClassifier(AnalyzerProperties properties) {
    this(ClassificationPolicy.fromProperties(properties.classification()));
  }

  public SpectralClassifier(ClassificationPolicy policy) {
    this.policy = policy;
  }

  public ClassificationPolicy policy() {
    return policy;
  }

  /**
   * Classifies a composite.
   *
   * @param composite median composite
   * @param token cancellation and deadline of the run
   * @return label raster on the composite grid
   */
  public ClassifiedRaster classify(RasterComposite composite, CancellationToken token) {
    int columns = composite.grid().columns();
    int rows = composite.grid().rows();
    byte[] labels = new byte[composite.grid().cellCount()];
    List<ClassificationRule> rules = policy.rules();
    byte unclassified = (byte) LandCoverClass.UNCLASSIFIED.ordinal();

    int blocks = (rows + ROW_BLOCK - 1) / ROW_BLOCK;
    IntStream stream = IntStream.range(0, blocks);
    if (labels.length >= PARALLEL_THRESHOLD) {
      stream = stream.parallel();
    }
    stream.forEach(block -> {
      token.throwIfCancelled();
      int endRow = Math.min(rows, (block + 1) * ROW_BLOCK);
      for (int row = block * ROW_BLOCK; row < endRow; row++) {
        for (int column = 0; column < columns; column++) {
          int index = row * columns + column;
          labels[index] = unclassified;
          if (!composite.isValid(index)) {
            continue;
          }
          for (ClassificationRule rule : rules) {
            if (rule.matches(composite, index)) {
              labels[index] = (byte) rule.target().ordinal();
              break;
            }
          }
        }
      }
    });

    ClassifiedRaster raster = new ClassifiedRaster(composite.grid(), labels, policy.precedence());
    if (log.isDebugEnabled()) {
      for (LandCoverClass landCoverClass : LandCoverClass.values()) {
        log.debug("Classified {} cells as {}", raster.count(landCoverClass), landCoverClass.key());
      }
    }
    return raster;
  }
}
