package com.aoimapper.analyzer.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.AoiRequest;
import com.aoimapper.analyzer.model.GeoPoint;
import com.aoimapper.analyzer.pipeline.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Polygon;

class GeometryBuilderTest {
  private final GeometryBuilder builder = new GeometryBuilder(64);

  @Test
  void buildProducesClosedCounterClockwiseRingAtRadius() {
    AoiGeometry aoi = builder.build(new AoiRequest("hyderabad", 17.385, 78.4867, 5_000_000.0));

    assertThat(aoi.vertices()).hasSize(65);
    assertThat(aoi.vertexCount()).isEqualTo(64);
    assertThat(aoi.vertices().get(0)).isEqualTo(aoi.vertices().get(64));
    assertThat(aoi.radiusM()).isCloseTo(Math.sqrt(5_000_000.0 / Math.PI), within(1e-9));
    for (GeoPoint vertex : aoi.vertices()) {
      assertThat(SphericalEarth.distanceM(aoi.center(), vertex)).isCloseTo(aoi.radiusM(), within(1e-3));
    }

    Polygon planar = EqualAreaProjection.centeredOn(aoi.center()).toPlane(aoi);
    assertThat(Orientation.isCCW(planar.getExteriorRing().getCoordinates())).isTrue();
    assertThat(planar.isValid()).isTrue();
  }

  @Test
  void firstVertexIsDueNorth() {
    AoiGeometry aoi = builder.build(new AoiRequest("north", 10.0, 20.0, 1_000_000.0));

    GeoPoint first = aoi.vertices().get(0);
    assertThat(first.longitude()).isCloseTo(20.0, within(1e-9));
    assertThat(first.latitude()).isGreaterThan(10.0);
  }

  @Test
  void tinyAreaStillYieldsClosedRing() {
    AoiGeometry aoi = builder.build(new AoiRequest("tiny", 45.0, 7.0, Double.MIN_VALUE));

    assertThat(aoi.vertices()).hasSize(65);
    assertThat(aoi.vertices().get(0)).isEqualTo(aoi.vertices().get(64));
    assertThat(aoi.vertices().get(10).latitude()).isCloseTo(45.0, within(1e-9));
  }

  @Test
  void ringStaysContinuousAcrossTheAntimeridian() {
    AoiGeometry aoi = builder.build(new AoiRequest("dateline", -17.0, 180.0, 5_000_000.0));

    double minLon = aoi.vertices().stream().mapToDouble(GeoPoint::longitude).min().orElseThrow();
    double maxLon = aoi.vertices().stream().mapToDouble(GeoPoint::longitude).max().orElseThrow();
    assertThat(maxLon - minLon).isLessThan(0.05);
    assertThat(maxLon).isGreaterThan(180.0);
    assertThat(minLon).isLessThan(180.0);

    Polygon planar = EqualAreaProjection.centeredOn(aoi.center()).toPlane(aoi);
    assertThat(planar.isValid()).isTrue();
    assertThat(planar.getArea()).isCloseTo(5_000_000.0, within(50_000.0));
  }

  @Test
  void westernDatelineRingUnwrapsBelowMinus180() {
    AoiGeometry aoi = builder.build(new AoiRequest("dateline-west", 10.0, -179.999, 10_000_000.0));

    assertThat(aoi.vertices()).allSatisfy(vertex ->
        assertThat(vertex.longitude()).isCloseTo(-179.999, within(0.05)));
    assertThat(aoi.vertices()).anySatisfy(vertex -> assertThat(vertex.longitude()).isLessThan(-180.0));
  }

  @Test
  void continentalAreaFallsShortByCapDeficit() {
    double areaSqM = 1e14;
    AoiGeometry aoi = new GeometryBuilder(1024).build(new AoiRequest("continent", 0.0, 0.0, areaSqM));

    double planarArea = EqualAreaProjection.centeredOn(aoi.center()).toPlane(aoi).getArea();
    double angle = aoi.radiusM() / SphericalEarth.RADIUS_M;
    double capArea = 2 * Math.PI * SphericalEarth.RADIUS_M * SphericalEarth.RADIUS_M * (1 - Math.cos(angle));

    assertThat(planarArea).isCloseTo(capArea, within(capArea * 1e-3));
    assertThat(1 - planarArea / areaSqM).isBetween(0.05, 0.08);
  }

  @Test
  void areaBeyondQuarterGreatCircleRadiusIsRejected() {
    assertThat(builder.build(new AoiRequest("max", 0.0, 0.0, GeometryBuilder.MAX_AREA_SQ_M)).vertices()).hasSize(65);
    assertThatThrownBy(() -> builder.build(new AoiRequest("too-big", 0.0, 0.0, GeometryBuilder.MAX_AREA_SQ_M * 1.01)))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("area_sq_m must be <=");
  }

  @ParameterizedTest
  @CsvSource({
      "0.0, 0.0, 1000000.0",
      "17.385, 78.4867, 5000000.0",
      "-45.0, -70.0, 250000000.0",
      "60.0, 25.0, 1.0",
      "89.9999, 0.0, 10000000.0",
      "90.0, 0.0, 10000000.0",
      "-90.0, 45.0, 10000000.0"
  })
  void planarAreaMatchesRequestedArea(double latitude, double longitude, double areaSqM) {
    AoiGeometry aoi = builder.build(new AoiRequest("area", latitude, longitude, areaSqM));

    double planarArea = EqualAreaProjection.centeredOn(aoi.center()).toPlane(aoi).getArea();

    assertThat(Math.abs(planarArea - areaSqM) / areaSqM).isLessThan(0.01);
  }

  @Test
  void moreVerticesApproachRequestedAreaMoreClosely() {
    AoiRequest request = new AoiRequest("precision", 30.0, 30.0, 2_000_000.0);
    AoiGeometry coarse = new GeometryBuilder(32).build(request);
    AoiGeometry fine = new GeometryBuilder(256).build(request);

    double coarseArea = EqualAreaProjection.centeredOn(coarse.center()).toPlane(coarse).getArea();
    double fineArea = EqualAreaProjection.centeredOn(fine.center()).toPlane(fine).getArea();

    assertThat(Math.abs(fineArea - 2_000_000.0)).isLessThan(Math.abs(coarseArea - 2_000_000.0));
  }

  @Test
  void rejectsTooFewVertices() {
    assertThatThrownBy(() -> new GeometryBuilder(16))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32");
  }

  @Test
  void validateRejectsOutOfRangeInput() {
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 90.0001, 0.0, 1.0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("latitude must be within [-90,90]");
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 0.0, -180.5, 1.0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("longitude must be within [-180,180]");
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 0.0, 0.0, 0.0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("area_sq_m must be > 0");
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 0.0, 0.0, -5.0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("area_sq_m must be > 0");
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 0.0, 0.0, Double.NaN)))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> builder.build(new AoiRequest("a", 0.0, 0.0, Double.POSITIVE_INFINITY)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("area_sq_m must be finite");
    assertThatThrownBy(() -> builder.build(new AoiRequest(" ", 0.0, 0.0, 1.0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("name must not be blank");
    assertThatThrownBy(() -> builder.build(null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void boundaryCoordinatesAreAccepted() {
    assertThat(builder.build(new AoiRequest("corner", -90.0, -180.0, 1.0)).vertices()).hasSize(65);
    assertThat(builder.build(new AoiRequest("corner", 90.0, 180.0, 1.0)).vertices()).hasSize(65);
  }
}
