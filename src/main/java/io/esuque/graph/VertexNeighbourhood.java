package io.esuque.graph;

import com.koloboke.collect.IntCollection;

/**
 * Outgoing edges of a single vertex, kept in insertion order and free of
 * duplicates.
 */
public interface VertexNeighbourhood {
    /**
     * @return read-only, restartable view of the neighbour ids in insertion order.
     */
    IntCollection getNeighbourVertices();

    boolean isNeighbourVertex(int vertexId);

    /**
     * Appends {@code neighbourVertexId} unless it is already present.
     *
     * @return true if the neighbourhood changed.
     */
    boolean addEdge(int neighbourVertexId);

    /**
     * @return true if {@code neighbourVertexId} was present and got removed.
     */
    boolean removeEdge(int neighbourVertexId);

    VertexNeighbourhood copy();
}
