package io.esuque.embedding;

import io.esuque.graph.MainGraph;
import io.esuque.utils.collection.IntArrayList;

import java.util.Objects;

/**
 * Ordered set of vertices together with the number of graph edges among
 * them. Vertices are kept in the order they were added.
 */
public class VertexInducedEmbedding implements Embedding {
    protected final MainGraph mainGraph;

    protected IntArrayList vertices;

    // Edge tracking for incremental modifications {{
    private int numEdges;
    private IntArrayList numEdgesAddedWithWord;
    // }}

    public VertexInducedEmbedding(MainGraph mainGraph) {
        this.mainGraph = mainGraph;
        this.vertices = new IntArrayList();
        this.numEdgesAddedWithWord = new IntArrayList();
        this.numEdges = 0;
    }

    public VertexInducedEmbedding(VertexInducedEmbedding other) {
        this.mainGraph = other.mainGraph;
        this.vertices = new IntArrayList(other.vertices);
        this.numEdgesAddedWithWord = new IntArrayList(other.numEdgesAddedWithWord);
        this.numEdges = other.numEdges;
    }

    @Override
    public IntArrayList getVertices() {
        return vertices;
    }

    @Override
    public int getNumVertices() {
        return vertices.size();
    }

    @Override
    public int getNumEdges() {
        return numEdges;
    }

    @Override
    public boolean containsWord(int word) {
        return vertices.contains(word);
    }

    @Override
    public void addWord(int word) {
        vertices.add(word);
        updateEdges(word, vertices.size() - 1);
    }

    @Override
    public void removeLastWord() {
        if (getNumVertices() == 0) {
            return;
        }

        numEdges -= numEdgesAddedWithWord.pop();
        vertices.removeLast();
    }

    @Override
    public VertexInducedEmbedding copy() {
        return new VertexInducedEmbedding(this);
    }

    /**
     * Space separated, one based vertex ids in insertion order.
     */
    @Override
    public String toOutputString() {
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < vertices.size(); ++i) {
            sb.append(vertices.getUnchecked(i) + 1);
            sb.append(" ");
        }

        return sb.toString();
    }

    /**
     * Counts the stored edges, in either direction, between the new vertex
     * and every vertex added before it.
     */
    private void updateEdges(int newVertexId, int positionAdded) {
        int addedEdges = 0;

        for (int i = 0; i < positionAdded; ++i) {
            int existingVertexId = vertices.getUnchecked(i);

            if (mainGraph.isNeighborVertex(existingVertexId, newVertexId)) {
                ++addedEdges;
            }

            if (mainGraph.isNeighborVertex(newVertexId, existingVertexId)) {
                ++addedEdges;
            }
        }

        numEdgesAddedWithWord.add(addedEdges);
        numEdges += addedEdges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VertexInducedEmbedding that = (VertexInducedEmbedding) o;
        return Objects.equals(vertices, that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertices);
    }

    @Override
    public String toString() {
        return "Embedding{" +
                "vertices=" + vertices + ", " +
                "numEdges=" + numEdges +
                "}";
    }
}
