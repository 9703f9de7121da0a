package io.esuque.computation;

import io.esuque.embedding.VertexInducedEmbedding;
import io.esuque.extender.ExclusiveNeighbourhoodExtender;
import io.esuque.extender.Extender;
import io.esuque.graph.MainGraph;
import io.esuque.utils.collection.IntArrayList;
import org.apache.log4j.Logger;

import java.util.List;

/**
 * Enumerates every connected induced subgraph with a given number of
 * vertices (ESU). Each subgraph is produced once, under its smallest vertex,
 * and the order of the output only depends on the graph.
 * <p>
 * The graph must not change while an enumeration runs.
 */
public class SubgraphEnumerator {
    private static final Logger LOG = Logger.getLogger(SubgraphEnumerator.class);

    private final MainGraph mainGraph;
    private final Extender extender;

    public SubgraphEnumerator(MainGraph mainGraph) {
        this(mainGraph, new ExclusiveNeighbourhoodExtender(mainGraph));
    }

    public SubgraphEnumerator(MainGraph mainGraph, Extender extender) {
        this.mainGraph = mainGraph;
        this.extender = extender;
    }

    /**
     * @return the subgraphs of size {@code k}, as zero based vertex ids in
     * discovery order.
     * @throws IllegalArgumentException if {@code k} is not in [1, number of vertices].
     */
    public List<IntArrayList> enumerateSubgraphs(int k) {
        CollectingSubgraphCallback collector = new CollectingSubgraphCallback();
        enumerateSubgraphs(k, collector);
        return collector.getSubgraphs();
    }

    /**
     * Streams the subgraphs of size {@code k} to {@code callback}.
     *
     * @return number of subgraphs produced.
     * @throws IllegalArgumentException if {@code k} is not in [1, number of vertices].
     */
    public long enumerateSubgraphs(int k, SubgraphCallback callback) {
        int numVertices = mainGraph.getNumberVertices();

        if (k < 1 || k > numVertices) {
            throw new IllegalArgumentException("Subgraph size must be between 1 and " +
                    numVertices + ", got " + k);
        }

        long start = 0;

        if (LOG.isInfoEnabled()) {
            start = System.currentTimeMillis();
            LOG.info("Enumerating subgraphs of size " + k + " in " + mainGraph);
        }

        callback.init(mainGraph, k);

        long numSubgraphs = 0;

        for (int root = 0; root < numVertices; ++root) {
            VertexInducedEmbedding subgraph = new VertexInducedEmbedding(mainGraph);
            IntArrayList extension = extender.extend(subgraph, root, root, new IntArrayList());
            subgraph.addWord(root);

            numSubgraphs += extend(subgraph, extension, root, k, callback);
        }

        callback.finish();

        if (LOG.isInfoEnabled()) {
            LOG.info("Found " + numSubgraphs + " subgraphs in " + (System.currentTimeMillis() - start) + " ms");
        }

        return numSubgraphs;
    }

    /**
     * Grows {@code subgraph} with the candidates in {@code extension}, front
     * to back. A candidate taken out of {@code extension} is not offered again
     * in this branch, so {@code extension} is consumed. {@code subgraph} is
     * left as it was given.
     */
    private long extend(VertexInducedEmbedding subgraph, IntArrayList extension, int root, int k,
                        SubgraphCallback callback) {
        if (subgraph.getNumVertices() == k) {
            callback.apply(subgraph);
            return 1;
        }

        VertexInducedEmbedding branch = subgraph.copy();
        long numSubgraphs = 0;

        while (!extension.isEmpty() && branch.getNumVertices() < k) {
            int word = extension.removeFirst();

            IntArrayList nextExtension = extender.extend(branch, root, word, extension);

            branch.addWord(word);
            numSubgraphs += extend(branch, nextExtension, root, k, callback);
            branch.removeLastWord();
        }

        return numSubgraphs;
    }
}
