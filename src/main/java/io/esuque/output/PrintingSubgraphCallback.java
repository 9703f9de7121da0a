package io.esuque.output;

import io.esuque.computation.SubgraphCallback;
import io.esuque.embedding.Embedding;
import io.esuque.graph.MainGraph;
import org.apache.log4j.Logger;

import java.io.PrintStream;

/**
 * Writes one line per subgraph with its one based vertex ids in discovery
 * order, e.g. {@code "1 2 5 "}.
 */
public class PrintingSubgraphCallback implements SubgraphCallback {
    private static final Logger LOG = Logger.getLogger(PrintingSubgraphCallback.class);

    private final PrintStream out;
    private long numPrinted;

    public PrintingSubgraphCallback(PrintStream out) {
        this.out = out;
    }

    @Override
    public void init(MainGraph mainGraph, int subgraphSize) {
        numPrinted = 0;

        if (LOG.isDebugEnabled()) {
            LOG.debug("Printing subgraphs of size " + subgraphSize + " of " + mainGraph);
        }
    }

    @Override
    public void apply(Embedding subgraph) {
        out.println(subgraph.toOutputString());
        ++numPrinted;
    }

    @Override
    public void finish() {
        out.flush();

        if (out.checkError()) {
            LOG.error("Error writing subgraphs, " + numPrinted + " lines attempted");
        }
    }

    public long getNumPrinted() {
        return numPrinted;
    }
}
