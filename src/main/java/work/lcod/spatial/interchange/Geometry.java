package work.lcod.spatial.interchange;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Geometry of an exported element, one record per interchange geometry type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Geometry.PointSetGeometry.class, name = "PointSetGeometry"),
    @JsonSubTypes.Type(value = Geometry.LineSetGeometry.class, name = "LineSetGeometry"),
    @JsonSubTypes.Type(value = Geometry.SurfaceGeometry.class, name = "SurfaceGeometry"),
    @JsonSubTypes.Type(value = Geometry.SurfaceGridGeometry.class, name = "SurfaceGridGeometry"),
    @JsonSubTypes.Type(value = Geometry.VolumeGridGeometry.class, name = "VolumeGridGeometry")
})
public interface Geometry {
    /**
     * @return number of vertices
     */
    long numNodes();

    /**
     * @return number of cells (points, segments, faces or blocks)
     */
    long numCells();

    record PointSetGeometry(double[][] vertices) implements Geometry {
        @Override
        public long numNodes() {
            return vertices.length;
        }

        @Override
        public long numCells() {
            return vertices.length;
        }
    }

    record LineSetGeometry(double[][] vertices, int[][] segments) implements Geometry {
        @Override
        public long numNodes() {
            return vertices.length;
        }

        @Override
        public long numCells() {
            return segments.length;
        }
    }

    record SurfaceGeometry(double[][] vertices, int[][] triangles) implements Geometry {
        @Override
        public long numNodes() {
            return vertices.length;
        }

        @Override
        public long numCells() {
            return triangles.length;
        }
    }

    record SurfaceGridGeometry(
        double[] origin,
        double[] axisU,
        double[] axisV,
        double[] tensorU,
        double[] tensorV,
        double[] offsetW
    ) implements Geometry {
        @Override
        public long numNodes() {
            return (tensorU.length + 1L) * (tensorV.length + 1);
        }

        @Override
        public long numCells() {
            return (long) tensorU.length * tensorV.length;
        }
    }

    record VolumeGridGeometry(
        double[] origin,
        double[] axisU,
        double[] axisV,
        double[] axisW,
        double[] tensorU,
        double[] tensorV,
        double[] tensorW
    ) implements Geometry {
        @Override
        public long numNodes() {
            return (tensorU.length + 1L) * (tensorV.length + 1) * (tensorW.length + 1);
        }

        @Override
        public long numCells() {
            return (long) tensorU.length * tensorV.length * tensorW.length;
        }
    }
}
