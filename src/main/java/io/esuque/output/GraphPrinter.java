package io.esuque.output;

import io.esuque.graph.MainGraph;
import com.koloboke.collect.IntCursor;

import java.io.PrintStream;

/**
 * Tabular listing of a graph: each vertex description followed by its
 * outgoing edges, using one based vertex ids.
 */
public class GraphPrinter {
    static final String HEADER = "Description\t\t\t\t\tFrom\tTo";
    static final String EDGE_INDENT = "\t\t\t\t\t\t\t";
    static final String DISPLAY_ERROR = "DISPLAY ERROR: No path exists";

    private final PrintStream out;

    public GraphPrinter(PrintStream out) {
        this.out = out;
    }

    public void displayAll(MainGraph graph) {
        out.println(HEADER);

        int numVertices = graph.getNumberVertices();

        for (int v = 0; v < numVertices; ++v) {
            String label = graph.getLabel(v);
            out.println(label == null ? "" : label);

            IntCursor neighbours = graph.neighborsOf(v).cursor();

            while (neighbours.moveNext()) {
                out.println(EDGE_INDENT + (v + 1) + "\t\t" + (neighbours.elem() + 1));
            }
        }

        out.flush();
    }

    /**
     * Prints a single {@code source destination} row (one based ids), or an
     * error line if either id is out of range.
     */
    public void display(MainGraph graph, int source, int destination) {
        int numVertices = graph.getNumberVertices();

        if (source < 1 || source > numVertices || destination < 1 || destination > numVertices) {
            out.println(DISPLAY_ERROR);
        } else {
            out.println(source + "\t" + destination);
        }

        out.flush();
    }
}
