package com.aoimapper.analyzer.vectorize;

import com.aoimapper.analyzer.classify.ClassifiedRaster;
import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.geometry.EqualAreaProjection;
import com.aoimapper.analyzer.imagery.RasterGrid;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.LandCoverClass;
import com.aoimapper.analyzer.model.LandCoverFeature;
import com.aoimapper.analyzer.model.LayerFeatureCollection;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import com.aoimapper.analyzer.pipeline.InternalAnalysisException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts a classified raster into one polygon layer per reported class.
 *
 * <p>Layers are built in class precedence order. After simplification each layer loses the
 * area already claimed by earlier layers and is clipped to the AOI, so layers never overlap
 * and never leave the AOI. Pieces smaller than the minimum region area are dropped.
 */
@Component
public class Vectorizer {
  private static final Logger log = LoggerFactory.getLogger(Vectorizer.class);

  private final double simplifyToleranceM;
  private final double minRegionAreaSqM;

  @Autowired
  public Vectorizer(AnalyzerProperties properties) {
    this(properties.vectorization().simplifyToleranceM(), properties.vectorization().minRegionAreaSqM());
  }

  public Vectorizer(double simplifyToleranceM, double minRegionAreaSqM) {
    if (simplifyToleranceM < 0 || minRegionAreaSqM < 0) {
      throw new IllegalArgumentException("vectorization parameters must be >= 0");
    }
    this.simplifyToleranceM = simplifyToleranceM;
    this.minRegionAreaSqM = minRegionAreaSqM;
  }

  /**
   * Vectorizes a classified raster.
   *
   * @param raster classified raster on the AOI's planar grid
   * @param aoi AOI geometry
   * @param projection planar reference of the run
   * @param token cancellation and deadline of the run
   * @return one layer per reported class, possibly empty
   * @throws InternalAnalysisException when an output polygon is invalid
   */
  public Map<LandCoverClass, LayerFeatureCollection> vectorize(
      ClassifiedRaster raster,
      AoiGeometry aoi,
      EqualAreaProjection projection,
      CancellationToken token) {
    Map<LandCoverClass, LayerFeatureCollection> layers = new EnumMap<>(LandCoverClass.class);
    for (LandCoverClass landCoverClass : LandCoverClass.layered()) {
      layers.put(landCoverClass, LayerFeatureCollection.empty(landCoverClass));
    }

    Polygon aoiPlanar = projection.toPlane(aoi);
    if (aoiPlanar.isEmpty() || !(aoiPlanar.getArea() > 0)) {
      log.info("AOI has no planar area, returning empty layers");
      return layers;
    }

    RasterGrid grid = raster.grid();
    RegionMap regions = RegionLabeler.label(raster);
    token.throwIfCancelled();

    double cellArea = grid.cellArea();
    List<TracedRing> rings = BoundaryTracer.trace(
        grid, regions, region -> regions.cellCounts()[region] * cellArea >= minRegionAreaSqM);
    token.throwIfCancelled();
    log.debug("Traced {} rings over {} regions", rings.size(), regions.regionCount());

    GeometryFactory factory = EqualAreaProjection.GEOMETRY_FACTORY;
    Map<LandCoverClass, List<Polygon>> polygonsByClass = assemble(rings, regions, factory);

    Geometry claimed = factory.createPolygon();
    for (LandCoverClass landCoverClass : raster.precedence()) {
      if (landCoverClass == LandCoverClass.UNCLASSIFIED) {
        continue;
      }
      token.throwIfCancelled();
      List<Polygon> polygons = polygonsByClass.getOrDefault(landCoverClass, List.of());
      if (polygons.isEmpty()) {
        continue;
      }
      try {
        Geometry layer = factory.createMultiPolygon(polygons.toArray(new Polygon[0]));
        if (simplifyToleranceM > 0) {
          layer = TopologyPreservingSimplifier.simplify(layer, simplifyToleranceM);
        }
        if (!layer.isValid()) {
          layer = GeometryFixer.fix(layer);
        }
        layer = OverlayNGRobust.overlay(layer, claimed, OverlayNG.DIFFERENCE);
        layer = OverlayNGRobust.overlay(layer, aoiPlanar, OverlayNG.INTERSECTION);
        claimed = OverlayNGRobust.overlay(claimed, layer, OverlayNG.UNION);
        layers.put(landCoverClass, toLayer(landCoverClass, layer, projection));
      } catch (TopologyException ex) {
        throw new InternalAnalysisException(
            "Vectorization of layer " + landCoverClass.key() + " failed: " + ex.getMessage(), ex);
      }
    }
    return layers;
  }

  private Map<LandCoverClass, List<Polygon>> assemble(
      List<TracedRing> rings,
      RegionMap regions,
      GeometryFactory factory) {
    Map<Integer, List<TracedRing>> ringsByRegion = new HashMap<>();
    for (TracedRing ring : rings) {
      ringsByRegion.computeIfAbsent(ring.region(), k -> new ArrayList<>()).add(ring);
    }

    Map<LandCoverClass, List<Polygon>> polygonsByClass = new EnumMap<>(LandCoverClass.class);
    for (Map.Entry<Integer, List<TracedRing>> entry : ringsByRegion.entrySet()) {
      List<Polygon> target = polygonsByClass.computeIfAbsent(
          regions.landCoverClass(entry.getKey()), k -> new ArrayList<>());
      for (Polygon polygon : buildRegion(entry.getValue(), factory)) {
        if (polygon.isValid()) {
          target.add(polygon);
        } else {
          // Self-touching rings at diagonal pinches are split into valid parts.
          collectPolygons(GeometryFixer.fix(polygon), target);
        }
      }
    }
    return polygonsByClass;
  }

  private List<Polygon> buildRegion(List<TracedRing> rings, GeometryFactory factory) {
    List<LinearRing> shells = new ArrayList<>();
    List<LinearRing> holes = new ArrayList<>();
    for (TracedRing ring : rings) {
      LinearRing linearRing = factory.createLinearRing(ring.coordinates());
      if (ring.shell()) {
        shells.add(linearRing);
      } else {
        holes.add(linearRing);
      }
    }
    if (shells.isEmpty()) {
      throw new InternalAnalysisException("Region boundary has holes but no outer ring");
    }

    List<List<LinearRing>> holesByShell = new ArrayList<>();
    for (int k = 0; k < shells.size(); k++) {
      holesByShell.add(new ArrayList<>());
    }
    if (shells.size() == 1) {
      holesByShell.get(0).addAll(holes);
    } else {
      List<Polygon> shellPolygons = new ArrayList<>();
      for (LinearRing shell : shells) {
        shellPolygons.add(factory.createPolygon(shell));
      }
      for (LinearRing hole : holes) {
        Geometry interior = factory.createPolygon(hole).getInteriorPoint();
        int owner = 0;
        for (int k = 0; k < shellPolygons.size(); k++) {
          if (shellPolygons.get(k).contains(interior)) {
            owner = k;
            break;
          }
        }
        holesByShell.get(owner).add(hole);
      }
    }

    List<Polygon> polygons = new ArrayList<>(shells.size());
    for (int k = 0; k < shells.size(); k++) {
      polygons.add(factory.createPolygon(shells.get(k), holesByShell.get(k).toArray(new LinearRing[0])));
    }
    return polygons;
  }

  private LayerFeatureCollection toLayer(
      LandCoverClass landCoverClass,
      Geometry layer,
      EqualAreaProjection projection) {
    List<Polygon> pieces = new ArrayList<>();
    collectPolygons(layer, pieces);

    List<LandCoverFeature> features = new ArrayList<>();
    int dropped = 0;
    for (Polygon piece : pieces) {
      double area = piece.getArea();
      if (piece.isEmpty() || area < minRegionAreaSqM || !(area > 0)) {
        dropped++;
        continue;
      }
      TopologyValidationError error = new IsValidOp(piece).getValidationError();
      if (error != null) {
        throw new InternalAnalysisException(
            "Invalid " + landCoverClass.key() + " polygon: " + error.getMessage() + " at " + error.getCoordinate());
      }
      features.add(new LandCoverFeature(landCoverClass, piece, projection.toGeographic(piece), area));
    }
    log.debug("Layer {}: {} features, {} pieces under minimum area", landCoverClass.key(), features.size(), dropped);
    return new LayerFeatureCollection(landCoverClass, features);
  }

  private static void collectPolygons(Geometry geometry, List<Polygon> out) {
    if (geometry instanceof Polygon) {
      if (!geometry.isEmpty()) {
        out.add((Polygon) geometry);
      }
    } else if (geometry instanceof GeometryCollection) {
      for (int k = 0; k < geometry.getNumGeometries(); k++) {
        collectPolygons(geometry.getGeometryN(k), out);
      }
    }
  }
}
