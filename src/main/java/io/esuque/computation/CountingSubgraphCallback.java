package io.esuque.computation;

import io.esuque.embedding.Embedding;
import io.esuque.graph.MainGraph;
import com.koloboke.collect.map.IntLongMap;
import com.koloboke.collect.map.hash.HashIntLongMaps;
import org.apache.log4j.Logger;

/**
 * Counts subgraphs, in total and grouped by the number of stored edges among
 * their vertices.
 */
public class CountingSubgraphCallback implements SubgraphCallback {
    private static final Logger LOG = Logger.getLogger(CountingSubgraphCallback.class);

    private final IntLongMap countsByNumEdges = HashIntLongMaps.newMutableMap();
    private long numSubgraphs;
    private int subgraphSize;

    @Override
    public void init(MainGraph mainGraph, int subgraphSize) {
        this.subgraphSize = subgraphSize;
        this.numSubgraphs = 0;
        countsByNumEdges.clear();
    }

    @Override
    public void apply(Embedding subgraph) {
        ++numSubgraphs;
        countsByNumEdges.addValue(subgraph.getNumEdges(), 1L);
    }

    @Override
    public void finish() {
        if (LOG.isInfoEnabled()) {
            LOG.info("Subgraphs of size " + subgraphSize + ": " + numSubgraphs);
            LOG.info("Subgraphs by number of edges: " + countsByNumEdges);
        }
    }

    public long getNumSubgraphs() {
        return numSubgraphs;
    }

    public long getNumSubgraphsWithEdges(int numEdges) {
        return countsByNumEdges.getOrDefault(numEdges, 0L);
    }
}
