package io.esuque.computation;

import io.esuque.embedding.Embedding;
import io.esuque.graph.MainGraph;

/**
 * Receives the subgraphs produced by {@link SubgraphEnumerator}.
 * <p>
 * The embedding passed to {@link #apply} is reused by the enumerator once the
 * call returns; implementations that keep it must copy it.
 */
public interface SubgraphCallback {
    void init(MainGraph mainGraph, int subgraphSize);

    void apply(Embedding subgraph);

    void finish();
}
