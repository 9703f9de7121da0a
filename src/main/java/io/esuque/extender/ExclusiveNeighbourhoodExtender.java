package io.esuque.extender;

import io.esuque.embedding.Embedding;
import io.esuque.graph.MainGraph;
import io.esuque.utils.collection.IntArrayList;
import com.koloboke.collect.IntCursor;
import org.apache.log4j.Logger;

/**
 * ESU extension step. A neighbour {@code u} of the new vertex becomes a
 * candidate only if {@code u > root}, it is not in the subgraph and it is not
 * adjacent to any vertex already in the subgraph. Neighbours of earlier
 * vertices were offered at an earlier level, so skipping them keeps every
 * connected subgraph reachable through exactly one branch.
 */
public class ExclusiveNeighbourhoodExtender implements Extender {
    private static final Logger LOG = Logger.getLogger(ExclusiveNeighbourhoodExtender.class);

    private final MainGraph mainGraph;

    public ExclusiveNeighbourhoodExtender(MainGraph mainGraph) {
        this.mainGraph = mainGraph;
    }

    @Override
    public IntArrayList extend(Embedding embedding, int root, int word,
                               IntArrayList currentExtension) {
        IntArrayList newExtension = new IntArrayList(currentExtension);

        IntCursor neighbours = mainGraph.neighborsOf(word).cursor();

        while (neighbours.moveNext()) {
            int u = neighbours.elem();

            if (u <= root || u == word || embedding.containsWord(u)) {
                continue;
            }

            if (isNeighbourOfEmbedding(embedding, u)) {
                continue;
            }

            newExtension.addIfAbsent(u);
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Extension of " + embedding.getVertices() + " with " + word + ": " + newExtension);
        }

        return newExtension;
    }

    private boolean isNeighbourOfEmbedding(Embedding embedding, int vertexId) {
        IntArrayList vertices = embedding.getVertices();
        int numVertices = vertices.size();

        for (int i = 0; i < numVertices; ++i) {
            if (mainGraph.isNeighborVertex(vertices.getUnchecked(i), vertexId)) {
                return true;
            }
        }

        return false;
    }
}
