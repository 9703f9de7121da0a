package io.esuque.computation;

import io.esuque.embedding.Embedding;
import io.esuque.graph.MainGraph;
import io.esuque.utils.collection.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps a copy of every subgraph, as zero based vertex ids in discovery order.
 */
public class CollectingSubgraphCallback implements SubgraphCallback {
    private final List<IntArrayList> subgraphs = new ArrayList<>();

    @Override
    public void init(MainGraph mainGraph, int subgraphSize) {
        subgraphs.clear();
    }

    @Override
    public void apply(Embedding subgraph) {
        subgraphs.add(new IntArrayList(subgraph.getVertices()));
    }

    @Override
    public void finish() {
        // Nothing to flush
    }

    public List<IntArrayList> getSubgraphs() {
        return Collections.unmodifiableList(subgraphs);
    }
}
