package com.aoimapper.analyzer.geometry;

import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.GeoPoint;
import java.util.List;
import java.util.Locale;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Lambert azimuthal equal-area projection centered on an AOI.
 *
 * <p>Planar areas in this projection equal areas on the authalic sphere, so it is the shared
 * spatial reference for rasters, vector layers and area accounting of one run. Instances hold
 * mutable proj4j transforms and are confined to a single request.
 */
public final class EqualAreaProjection {
  public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

  private static final String SPHERE =
      String.format(Locale.ROOT, "+a=%.3f +b=%.3f", SphericalEarth.RADIUS_M, SphericalEarth.RADIUS_M);

  private final GeoPoint center;
  private final String proj4;
  private final CoordinateTransform forward;
  private final CoordinateTransform inverse;

  private EqualAreaProjection(GeoPoint center) {
    this.center = center;
    this.proj4 = String.format(
        Locale.ROOT,
        "+proj=laea +lat_0=%.9f +lon_0=%.9f +x_0=0 +y_0=0 %s +units=m +no_defs",
        center.latitude(),
        center.longitude(),
        SPHERE);

    CRSFactory crsFactory = new CRSFactory();
    CoordinateReferenceSystem geographic =
        crsFactory.createFromParameters("aoi-geographic", "+proj=longlat " + SPHERE + " +no_defs");
    CoordinateReferenceSystem planar = crsFactory.createFromParameters("aoi-laea", proj4);
    CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    this.forward = transformFactory.createTransform(geographic, planar);
    this.inverse = transformFactory.createTransform(planar, geographic);
  }

  public static EqualAreaProjection centeredOn(GeoPoint center) {
    return new EqualAreaProjection(center);
  }

  public GeoPoint center() {
    return center;
  }

  /**
   * PROJ definition of the planar reference, shared with the imagery source.
   *
   * @return proj4 parameter string
   */
  public String proj4() {
    return proj4;
  }

  public Coordinate toPlane(GeoPoint point) {
    ProjCoordinate out = new ProjCoordinate();
    forward.transform(new ProjCoordinate(point.longitude(), point.latitude()), out);
    return new Coordinate(out.x, out.y);
  }

  public GeoPoint toGeographic(double x, double y) {
    ProjCoordinate out = new ProjCoordinate();
    inverse.transform(new ProjCoordinate(x, y), out);
    return new GeoPoint(out.y, SphericalEarth.unwrapLongitude(out.x, center.longitude()));
  }

  /**
   * Projects an AOI ring into the plane.
   *
   * @param aoi AOI geometry
   * @return planar polygon (zero area for a collapsed AOI)
   */
  public Polygon toPlane(AoiGeometry aoi) {
    List<GeoPoint> vertices = aoi.vertices();
    Coordinate[] ring = new Coordinate[vertices.size()];
    for (int i = 0; i < vertices.size() - 1; i++) {
      ring[i] = toPlane(vertices.get(i));
    }
    ring[ring.length - 1] = new Coordinate(ring[0]);
    return GEOMETRY_FACTORY.createPolygon(ring);
  }

  /**
   * Returns a copy of a planar geometry with coordinates in longitude/latitude degrees.
   *
   * <p>Longitudes are unwrapped around the projection center, so a geometry straddling the
   * antimeridian keeps its shape instead of spanning the globe.
   *
   * @param planar geometry in projection meters
   * @param <T> geometry type
   * @return geographic copy of the same type
   */
  @SuppressWarnings("unchecked")
  public <T extends Geometry> T toGeographic(T planar) {
    Geometry copy = planar.copy();
    copy.apply(new CoordinateSequenceFilter() {
      private final ProjCoordinate in = new ProjCoordinate();
      private final ProjCoordinate out = new ProjCoordinate();

      @Override
      public void filter(CoordinateSequence seq, int i) {
        in.x = seq.getX(i);
        in.y = seq.getY(i);
        inverse.transform(in, out);
        seq.setOrdinate(i, CoordinateSequence.X, SphericalEarth.unwrapLongitude(out.x, center.longitude()));
        seq.setOrdinate(i, CoordinateSequence.Y, out.y);
      }

      @Override
      public boolean isDone() {
        return false;
      }

      @Override
      public boolean isGeometryChanged() {
        return true;
      }
    });
    return (T) copy;
  }
}
