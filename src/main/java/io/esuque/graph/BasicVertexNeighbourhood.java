package io.esuque.graph;

import io.esuque.utils.collection.IntArrayList;
import io.esuque.utils.collection.IntArrayListView;
import com.koloboke.collect.IntCollection;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;

public class BasicVertexNeighbourhood implements VertexNeighbourhood {
    // Neighbour ids in the order the edges were inserted
    protected IntArrayList orderedNeighbours;
    // Same ids, for constant time membership checks
    protected HashIntSet neighbourSet;

    private IntArrayListView neighboursView;

    public BasicVertexNeighbourhood() {
        this.orderedNeighbours = new IntArrayList();
        this.neighbourSet = HashIntSets.newMutableSet();
    }

    public BasicVertexNeighbourhood(BasicVertexNeighbourhood other) {
        this.orderedNeighbours = new IntArrayList(other.orderedNeighbours);
        this.neighbourSet = HashIntSets.newMutableSet(other.neighbourSet);
    }

    @Override
    public IntCollection getNeighbourVertices() {
        if (neighboursView == null) {
            neighboursView = new IntArrayListView(orderedNeighbours);
        }

        return neighboursView;
    }

    @Override
    public boolean isNeighbourVertex(int vertexId) {
        return neighbourSet.contains(vertexId);
    }

    @Override
    public boolean addEdge(int neighbourVertexId) {
        if (!neighbourSet.add(neighbourVertexId)) {
            return false;
        }

        orderedNeighbours.add(neighbourVertexId);
        return true;
    }

    @Override
    public boolean removeEdge(int neighbourVertexId) {
        if (!neighbourSet.removeInt(neighbourVertexId)) {
            return false;
        }

        orderedNeighbours.removeInt(neighbourVertexId);
        return true;
    }

    @Override
    public VertexNeighbourhood copy() {
        return new BasicVertexNeighbourhood(this);
    }

    @Override
    public String toString() {
        return "BasicVertexNeighbourhood{" +
                "orderedNeighbours=" + orderedNeighbours +
                '}';
    }
}
