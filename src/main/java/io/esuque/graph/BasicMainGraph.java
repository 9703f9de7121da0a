package io.esuque.graph;

import com.koloboke.collect.IntCollection;
import org.apache.log4j.Logger;

import java.util.Arrays;

public class BasicMainGraph implements MainGraph {
    private static final Logger LOG = Logger.getLogger(BasicMainGraph.class);

    protected Vertex[] vertexIndexF;
    protected VertexNeighbourhood[] vertexNeighbourhoods;

    protected int numVertices;
    protected int numEdges;

    protected String name;

    public BasicMainGraph() {
        this("main");
    }

    public BasicMainGraph(String name) {
        this.name = name;
        reset();
    }

    public BasicMainGraph(String name, int numVertices) {
        this(name);
        setSize(numVertices);
    }

    /**
     * Deep copy: labels and edge order are the same as in {@code other} but
     * nothing mutable is shared.
     */
    public BasicMainGraph(BasicMainGraph other) {
        this.name = other.name;
        this.numVertices = other.numVertices;
        this.numEdges = other.numEdges;
        this.vertexIndexF = new Vertex[numVertices];
        this.vertexNeighbourhoods = new VertexNeighbourhood[numVertices];

        for (int i = 0; i < numVertices; ++i) {
            vertexIndexF[i] = new Vertex(other.vertexIndexF[i]);
            vertexNeighbourhoods[i] = other.vertexNeighbourhoods[i].copy();
        }
    }

    @Override
    public void reset() {
        numVertices = 0;
        numEdges = 0;
        vertexIndexF = new Vertex[0];
        vertexNeighbourhoods = new VertexNeighbourhood[0];
    }

    @Override
    public void setSize(int numVertices) {
        if (numVertices < 0 || numVertices > MAX_NUMBER_VERTICES) {
            throw new IllegalArgumentException("Number of vertices must be between 0 and " +
                    MAX_NUMBER_VERTICES + ", got " + numVertices);
        }

        reset();

        this.numVertices = numVertices;
        vertexIndexF = new Vertex[numVertices];
        vertexNeighbourhoods = new VertexNeighbourhood[numVertices];

        for (int i = 0; i < numVertices; ++i) {
            vertexIndexF[i] = createVertex(i);
            vertexNeighbourhoods[i] = createVertexNeighbourhood();
        }
    }

    @Override
    public int getNumberVertices() {
        return numVertices;
    }

    @Override
    public int getNumberEdges() {
        return numEdges;
    }

    @Override
    public Vertex getVertex(int vertexId) {
        checkVertex(vertexId);
        return vertexIndexF[vertexId];
    }

    @Override
    public void setLabel(int vertexId, String label) {
        getVertex(vertexId).setVertexLabel(label);
    }

    @Override
    public String getLabel(int vertexId) {
        return getVertex(vertexId).getVertexLabel();
    }

    @Override
    public void insertEdge(int source, int destination) {
        int vertexFrom = source - 1;
        int vertexTo = destination - 1;

        if (!isValidEdge(vertexFrom, vertexTo)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Ignoring insert of invalid edge (" + source + "," + destination + ") in " + name);
            }

            return;
        }

        if (vertexNeighbourhoods[vertexFrom].addEdge(vertexTo)) {
            ++numEdges;
        }
    }

    @Override
    public void removeEdge(int source, int destination) {
        int vertexFrom = source - 1;
        int vertexTo = destination - 1;

        if (!isValidEdge(vertexFrom, vertexTo)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Ignoring removal of invalid edge (" + source + "," + destination + ") in " + name);
            }

            return;
        }

        if (vertexNeighbourhoods[vertexFrom].removeEdge(vertexTo)) {
            --numEdges;
        }
    }

    @Override
    public boolean isNeighborVertex(int v1, int v2) {
        if (!isInRange(v1) || !isInRange(v2)) {
            return false;
        }

        return vertexNeighbourhoods[v1].isNeighbourVertex(v2);
    }

    @Override
    public VertexNeighbourhood getVertexNeighbourhood(int vertexId) {
        checkVertex(vertexId);
        return vertexNeighbourhoods[vertexId];
    }

    @Override
    public IntCollection neighborsOf(int vertexId) {
        return getVertexNeighbourhood(vertexId).getNeighbourVertices();
    }

    protected Vertex createVertex(int id) {
        return new Vertex(id);
    }

    protected VertexNeighbourhood createVertexNeighbourhood() {
        return new BasicVertexNeighbourhood();
    }

    private boolean isValidEdge(int vertexFrom, int vertexTo) {
        return vertexFrom != vertexTo && isInRange(vertexFrom) && isInRange(vertexTo);
    }

    private boolean isInRange(int vertexId) {
        return vertexId >= 0 && vertexId < numVertices;
    }

    private void checkVertex(int vertexId) {
        if (!isInRange(vertexId)) {
            throw new IndexOutOfBoundsException("Vertex " + vertexId + " not in [0," + numVertices + ")");
        }
    }

    @Override
    public String toString() {
        return name;
    }

    public String toDetailedString() {
        return "Vertices: " + Arrays.toString(vertexIndexF) +
                "\n Neighbourhoods: " + Arrays.toString(vertexNeighbourhoods);
    }
}
