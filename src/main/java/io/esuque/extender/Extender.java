package io.esuque.extender;

import io.esuque.embedding.Embedding;
import io.esuque.utils.collection.IntArrayList;

public interface Extender {
    /**
     * Computes the candidates available once {@code word} joins
     * {@code embedding}.
     *
     * @param embedding        subgraph before {@code word} is added; empty when
     *                         {@code word} is the root itself.
     * @param root             anchor of the enumeration, the smallest vertex id
     *                         the subgraph may contain.
     * @param word             vertex about to be added.
     * @param currentExtension candidates inherited from the parent level. Not
     *                         modified.
     * @return a new list holding {@code currentExtension} followed by the new
     * candidates.
     */
    IntArrayList extend(Embedding embedding, int root, int word,
                        IntArrayList currentExtension);
}
