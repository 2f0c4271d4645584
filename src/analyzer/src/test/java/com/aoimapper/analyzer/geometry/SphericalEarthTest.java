package com.aoimapper.analyzer.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.aoimapper.analyzer.model.GeoPoint;
import org.junit.jupiter.api.Test;

class SphericalEarthTest {

  @Test
  void destinationTravelsRequestedDistance() {
    GeoPoint origin = new GeoPoint(17.385, 78.4867);

    for (double bearing = 0; bearing < 360; bearing += 22.5) {
      GeoPoint target = SphericalEarth.destination(origin, bearing, 12_345.0);
      assertThat(SphericalEarth.distanceM(origin, target)).isCloseTo(12_345.0, within(1e-4));
    }
  }

  @Test
  void destinationFromNorthPoleFollowsMeridian() {
    GeoPoint pole = new GeoPoint(90.0, 0.0);

    GeoPoint south = SphericalEarth.destination(pole, 90.0, 100_000.0);

    assertThat(south.latitude()).isLessThan(90.0);
    assertThat(south.longitude()).isCloseTo(90.0, within(1e-9));
  }

  @Test
  void normalizeLongitudeWrapsIntoRange() {
    assertThat(SphericalEarth.normalizeLongitude(190.0)).isCloseTo(-170.0, within(1e-12));
    assertThat(SphericalEarth.normalizeLongitude(-190.0)).isCloseTo(170.0, within(1e-12));
    assertThat(SphericalEarth.normalizeLongitude(180.0)).isEqualTo(180.0);
    assertThat(SphericalEarth.normalizeLongitude(540.0)).isEqualTo(180.0);
  }

  @Test
  void unwrapLongitudeKeepsValuesNearReference() {
    assertThat(SphericalEarth.unwrapLongitude(-179.98, 180.0)).isCloseTo(180.02, within(1e-9));
    assertThat(SphericalEarth.unwrapLongitude(179.98, -179.999)).isCloseTo(-180.02, within(1e-9));
    assertThat(SphericalEarth.unwrapLongitude(12.5, 10.0)).isCloseTo(12.5, within(1e-12));
  }
}
