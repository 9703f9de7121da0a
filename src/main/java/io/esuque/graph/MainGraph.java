package io.esuque.graph;

import com.koloboke.collect.IntCollection;

/**
 * Adjacency list graph with a fixed number of vertices.
 * <p>
 * Vertex ids are zero based everywhere except in {@link #insertEdge} and
 * {@link #removeEdge}, which take the one based ids used by the text input
 * format. Edges are stored as given: inserting {@code (a,b)} does not add
 * {@code (b,a)}.
 */
public interface MainGraph {
    int MAX_NUMBER_VERTICES = 100;

    void reset();

    /**
     * Discards the current contents and allocates {@code numVertices}
     * unlabelled vertices without edges.
     *
     * @throws IllegalArgumentException if {@code numVertices} is negative or
     *                                  above {@link #MAX_NUMBER_VERTICES}.
     */
    void setSize(int numVertices);

    int getNumberVertices();

    int getNumberEdges();

    Vertex getVertex(int vertexId);

    void setLabel(int vertexId, String label);

    String getLabel(int vertexId);

    /**
     * Adds the edge {@code source -> destination} (one based). Self loops,
     * out of range ids and edges already present are ignored.
     */
    void insertEdge(int source, int destination);

    /**
     * Removes the edge {@code source -> destination} (one based) if present.
     */
    void removeEdge(int source, int destination);

    boolean isNeighborVertex(int v1, int v2);

    VertexNeighbourhood getVertexNeighbourhood(int vertexId);

    /**
     * @return read-only view of the neighbours of {@code vertexId} in
     * insertion order.
     */
    IntCollection neighborsOf(int vertexId);
}
