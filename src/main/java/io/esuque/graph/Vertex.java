package io.esuque.graph;

import java.util.Objects;

public class Vertex {

    private final int vertexId;
    private String vertexLabel;

    public Vertex(int vertexId) {
        this(vertexId, null);
    }

    public Vertex(int vertexId, String vertexLabel) {
        this.vertexId = vertexId;
        this.vertexLabel = vertexLabel;
    }

    public Vertex(Vertex other) {
        this(other.vertexId, other.vertexLabel);
    }

    public int getVertexId() {
        return vertexId;
    }

    public String getVertexLabel() {
        return vertexLabel;
    }

    public void setVertexLabel(String vertexLabel) {
        this.vertexLabel = vertexLabel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Vertex vertex = (Vertex) o;

        if (vertexId != vertex.vertexId) return false;
        return Objects.equals(vertexLabel, vertex.vertexLabel);
    }

    @Override
    public int hashCode() {
        int result = vertexId;
        result = 31 * result + (vertexLabel != null ? vertexLabel.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return "Vertex{" +
                "vertexId=" + vertexId +
                ",vertexLabel=" + vertexLabel +
                '}';
    }
}
