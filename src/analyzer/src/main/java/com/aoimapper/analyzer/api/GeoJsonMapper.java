package com.aoimapper.analyzer.api;

import com.aoimapper.analyzer.model.AnalysisResponse;
import com.aoimapper.analyzer.model.AnalysisResult;
import com.aoimapper.analyzer.model.GeoJsonFeature;
import com.aoimapper.analyzer.model.GeoJsonFeatureCollection;
import com.aoimapper.analyzer.model.LandCoverClass;
import com.aoimapper.analyzer.model.LandCoverFeature;
import com.aoimapper.analyzer.model.LayerFeatureCollection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.springframework.stereotype.Component;

/** Maps pipeline results to GeoJSON (RFC 7946) response payloads. */
@Component
public class GeoJsonMapper {

  public AnalysisResponse toResponse(AnalysisResult result) {
    Map<String, GeoJsonFeatureCollection> layers = new LinkedHashMap<>();
    for (LandCoverClass landCoverClass : LandCoverClass.layered()) {
      layers.put(landCoverClass.key(), toFeatureCollection(result.layer(landCoverClass)));
    }
    return new AnalysisResponse(result.summary(), layers);
  }

  GeoJsonFeatureCollection toFeatureCollection(LayerFeatureCollection layer) {
    List<GeoJsonFeature> features = new ArrayList<>(layer.features().size());
    for (LandCoverFeature feature : layer.features()) {
      Map<String, Object> properties = new LinkedHashMap<>();
      properties.put("class", feature.landCoverClass().key());
      properties.put("area_sq_m", feature.areaSqM());
      features.add(new GeoJsonFeature("Feature", polygon(feature.geographic()), properties));
    }
    return new GeoJsonFeatureCollection("FeatureCollection", features);
  }

  private Map<String, Object> polygon(Polygon polygon) {
    List<List<double[]>> rings = new ArrayList<>(polygon.getNumInteriorRing() + 1);
    rings.add(ring(polygon.getExteriorRing()));
    for (int k = 0; k < polygon.getNumInteriorRing(); k++) {
      rings.add(ring(polygon.getInteriorRingN(k)));
    }
    Map<String, Object> geometry = new LinkedHashMap<>();
    geometry.put("type", "Polygon");
    geometry.put("coordinates", rings);
    return geometry;
  }

  private List<double[]> ring(LineString ring) {
    Coordinate[] coordinates = ring.getCoordinates();
    List<double[]> positions = new ArrayList<>(coordinates.length);
    for (Coordinate coordinate : coordinates) {
      positions.add(new double[] {coordinate.x, coordinate.y});
    }
    return positions;
  }
}
