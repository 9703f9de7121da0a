package io.esuque.embedding;

import io.esuque.utils.collection.IntArrayList;

public interface Embedding {
    IntArrayList getVertices();

    int getNumVertices();

    int getNumEdges();

    void addWord(int word);

    void removeLastWord();

    boolean containsWord(int word);

    Embedding copy();

    String toOutputString();
}
