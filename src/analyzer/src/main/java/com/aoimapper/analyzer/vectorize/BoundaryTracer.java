package com.aoimapper.analyzer.vectorize;

import com.aoimapper.analyzer.imagery.RasterGrid;
import com.aoimapper.analyzer.pipeline.InternalAnalysisException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntPredicate;
import org.locationtech.jts.geom.Coordinate;

/**
 * Traces region boundaries along grid lines.
 *
 * <p>Boundary edges are directed so the region lies on their left. Grid vertex {@code (i, j)}
 * sits at {@code (lineX(i), lineY(j))}; {@code j} grows southward. At a vertex the walk prefers
 * a left turn, then straight, then a right turn, which keeps diagonal neighbors in separate
 * rings. Collinear vertices are dropped.
 */
final class BoundaryTracer {
  static final int EAST = 0;
  static final int NORTH = 1;
  static final int WEST = 2;
  static final int SOUTH = 3;

  private final RasterGrid grid;
  private final int vertexColumns;
  private final BitSet edges;

  private BoundaryTracer(RasterGrid grid) {
    this.grid = grid;
    this.vertexColumns = grid.columns() + 1;
    long keySpace = 4L * vertexColumns * (grid.rows() + 1L);
    if (keySpace > Integer.MAX_VALUE) {
      throw new InternalAnalysisException("Raster of " + grid.cellCount() + " cells is too large to vectorize");
    }
    this.edges = new BitSet((int) keySpace);
  }

  /**
   * Traces every ring of the regions accepted by {@code include}.
   *
   * @param grid raster grid
   * @param regions region labeling of the grid
   * @param include region ids to trace
   * @return shells and holes of the included regions
   */
  static List<TracedRing> trace(RasterGrid grid, RegionMap regions, IntPredicate include) {
    BoundaryTracer tracer = new BoundaryTracer(grid);
    tracer.collectEdges(regions, include);
    return tracer.walk(regions);
  }

  private void collectEdges(RegionMap regions, IntPredicate include) {
    int columns = grid.columns();
    int rows = grid.rows();
    int[] regionOf = regions.regionOf();
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        int region = regionOf[row * columns + column];
        if (region < 0 || !include.test(region)) {
          continue;
        }
        if (!sameRegion(regionOf, column, row + 1, region)) {
          edges.set(key(vertex(column, row + 1), EAST));
        }
        if (!sameRegion(regionOf, column + 1, row, region)) {
          edges.set(key(vertex(column + 1, row + 1), NORTH));
        }
        if (!sameRegion(regionOf, column, row - 1, region)) {
          edges.set(key(vertex(column + 1, row), WEST));
        }
        if (!sameRegion(regionOf, column - 1, row, region)) {
          edges.set(key(vertex(column, row), SOUTH));
        }
      }
    }
  }

  private boolean sameRegion(int[] regionOf, int column, int row, int region) {
    if (column < 0 || row < 0 || column >= grid.columns() || row >= grid.rows()) {
      return false;
    }
    return regionOf[row * grid.columns() + column] == region;
  }

  private List<TracedRing> walk(RegionMap regions) {
    List<TracedRing> rings = new ArrayList<>();
    BitSet visited = new BitSet(edges.size());
    for (int start = edges.nextSetBit(0); start >= 0; start = edges.nextSetBit(start + 1)) {
      if (visited.get(start)) {
        continue;
      }
      rings.add(walkRing(start, visited, regions));
    }
    return rings;
  }

  private TracedRing walkRing(int start, BitSet visited, RegionMap regions) {
    int startVertex = start >>> 2;
    int startDirection = start & 3;
    int region = regions.regionOf()[leftCell(startVertex, startDirection)];

    List<int[]> corners = new ArrayList<>();
    int vertex = startVertex;
    int direction = startDirection;
    int previous = -1;
    do {
      visited.set(key(vertex, direction));
      if (direction != previous) {
        corners.add(new int[] {vertex % vertexColumns, vertex / vertexColumns});
      }
      previous = direction;
      vertex = advance(vertex, direction);
      direction = nextDirection(vertex, direction);
    } while (vertex != startVertex || direction != startDirection);
    if (previous == startDirection) {
      corners.remove(0);
    }

    Coordinate[] coordinates = new Coordinate[corners.size() + 1];
    long doubleArea = 0L;
    for (int k = 0; k < corners.size(); k++) {
      int[] a = corners.get(k);
      int[] b = corners.get((k + 1) % corners.size());
      // y grows northward while j grows southward
      doubleArea += (long) a[0] * -b[1] - (long) b[0] * -a[1];
      coordinates[k] = new Coordinate(grid.lineX(a[0]), grid.lineY(a[1]));
    }
    coordinates[corners.size()] = new Coordinate(coordinates[0]);
    return new TracedRing(region, coordinates, doubleArea > 0);
  }

  private int nextDirection(int vertex, int incoming) {
    int left = (incoming + 1) & 3;
    if (edges.get(key(vertex, left))) {
      return left;
    }
    if (edges.get(key(vertex, incoming))) {
      return incoming;
    }
    int right = (incoming + 3) & 3;
    if (edges.get(key(vertex, right))) {
      return right;
    }
    throw new InternalAnalysisException(
        "Open region boundary at grid vertex (" + vertex % vertexColumns + ", " + vertex / vertexColumns + ")");
  }

  private int advance(int vertex, int direction) {
    return switch (direction) {
      case EAST -> vertex + 1;
      case NORTH -> vertex - vertexColumns;
      case WEST -> vertex - 1;
      default -> vertex + vertexColumns;
    };
  }

  private int leftCell(int vertex, int direction) {
    int i = vertex % vertexColumns;
    int j = vertex / vertexColumns;
    return switch (direction) {
      case EAST -> grid.index(i, j - 1);
      case NORTH -> grid.index(i - 1, j - 1);
      case WEST -> grid.index(i - 1, j);
      default -> grid.index(i, j);
    };
  }

  private int vertex(int i, int j) {
    return j * vertexColumns + i;
  }

  private static int key(int vertex, int direction) {
    return (vertex << 2) | direction;
  }
}
