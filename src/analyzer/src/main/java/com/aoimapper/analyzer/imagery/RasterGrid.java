package com.aoimapper.analyzer.imagery;

import org.locationtech.jts.geom.Envelope;

/**
 * Regular grid in the AOI's planar reference.
 *
 * <p>The origin is the top-left corner; row 0 is the northernmost row and cell
 * {@code (column, row)} is stored at index {@code row * columns + column}.
 *
 * @param crs proj4 definition of the planar reference
 * @param originX x of the top-left corner in meters
 * @param originY y of the top-left corner in meters
 * @param cellSize cell edge length in meters
 * @param columns number of columns
 * @param rows number of rows
 */
public record RasterGrid(String crs, double originX, double originY, double cellSize, int columns, int rows) {
  public RasterGrid {
    if (columns <= 0 || rows <= 0) {
      throw new IllegalArgumentException("grid must have at least one cell");
    }
    if (!(cellSize > 0) || Double.isInfinite(cellSize)) {
      throw new IllegalArgumentException("cell size must be > 0");
    }
  }

  /**
   * Builds the smallest grid centered on {@code envelope} that covers it, coarsening the cell
   * size until the grid holds at most {@code maxCells} cells.
   *
   * @param envelope planar extent to cover
   * @param crs proj4 definition of the plane
   * @param cellSize preferred cell size in meters
   * @param maxCells upper bound on cell count
   * @return covering grid
   */
  public static RasterGrid covering(Envelope envelope, String crs, double cellSize, long maxCells) {
    double width = Math.max(0.0, envelope.getWidth());
    double height = Math.max(0.0, envelope.getHeight());
    double size = cellSize;
    if (cellCount(width, height, size) > maxCells) {
      size = Math.max(cellSize, Math.sqrt(width * height / Math.max(1L, maxCells)));
      while (cellCount(width, height, size) > maxCells) {
        size *= 1.01;
      }
    }
    int columns = (int) Math.max(1L, (long) Math.ceil(width / size));
    int rows = (int) Math.max(1L, (long) Math.ceil(height / size));
    double centerX = (envelope.getMinX() + envelope.getMaxX()) / 2.0;
    double centerY = (envelope.getMinY() + envelope.getMaxY()) / 2.0;
    return new RasterGrid(crs, centerX - columns * size / 2.0, centerY + rows * size / 2.0, size, columns, rows);
  }

  private static long cellCount(double width, double height, double size) {
    return Math.max(1L, (long) Math.ceil(width / size)) * Math.max(1L, (long) Math.ceil(height / size));
  }

  public int cellCount() {
    return columns * rows;
  }

  public int index(int column, int row) {
    return row * columns + column;
  }

  public double cellArea() {
    return cellSize * cellSize;
  }

  /** X of the vertical grid line {@code column} (0..columns). */
  public double lineX(int column) {
    return originX + column * cellSize;
  }

  /** Y of the horizontal grid line {@code row} (0..rows). */
  public double lineY(int row) {
    return originY - row * cellSize;
  }

  public Envelope envelope() {
    return new Envelope(originX, lineX(columns), lineY(rows), originY);
  }
}
