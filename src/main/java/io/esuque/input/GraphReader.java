package io.esuque.input;

import io.esuque.graph.BasicMainGraph;
import io.esuque.graph.MainGraph;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringTokenizer;

/**
 * Reads graphs in the following text format:
 * <pre>
 * 3
 * first vertex description
 * second vertex description
 * third vertex description
 * 1 2
 * 2 3
 * 0 0
 * </pre>
 * The first line holds the number of vertices, followed by one description
 * line per vertex and then one based {@code source destination} pairs. Pairs
 * are read until one with source 0 or the end of the input. Every pair goes
 * through {@link MainGraph#insertEdge}, so invalid pairs are dropped there.
 * <p>
 * Input that ends early leaves the graph with whatever was read so far.
 */
public class GraphReader {
    private static final Logger LOG = Logger.getLogger(GraphReader.class);

    public BasicMainGraph read(Path filePath) throws IOException {
        try (InputStream is = Files.newInputStream(filePath)) {
            return read(is, filePath.getFileName().toString());
        }
    }

    public BasicMainGraph read(InputStream is, String name) throws IOException {
        BasicMainGraph graph = new BasicMainGraph(name);
        read(is, graph);
        return graph;
    }

    public void read(InputStream is, MainGraph graph) throws IOException {
        long start = 0;

        if (LOG.isInfoEnabled()) {
            start = System.currentTimeMillis();
            LOG.info("Reading graph " + graph);
        }

        BufferedReader reader = new BufferedReader(
                new InputStreamReader(new BOMInputStream(is), StandardCharsets.UTF_8));

        graph.reset();

        int lineNumber = readGraph(reader, graph);

        if (LOG.isInfoEnabled()) {
            LOG.info("Done in " + (System.currentTimeMillis() - start) + " ms, " + lineNumber + " lines");
            LOG.info("Number vertices: " + graph.getNumberVertices());
            LOG.info("Number edges: " + graph.getNumberEdges());
        }

        if (LOG.isDebugEnabled() && graph instanceof BasicMainGraph) {
            LOG.debug(((BasicMainGraph) graph).toDetailedString());
        }
    }

    private int readGraph(BufferedReader reader, MainGraph graph) throws IOException {
        int lineNumber = 0;

        String line = reader.readLine();

        while (line != null && line.trim().isEmpty()) {
            ++lineNumber;
            line = reader.readLine();
        }

        if (line == null) {
            LOG.warn("Empty graph input");
            return lineNumber;
        }

        ++lineNumber;

        int numVertices = parseInt(new StringTokenizer(line).nextToken(), lineNumber);

        try {
            graph.setSize(numVertices);
        } catch (IllegalArgumentException e) {
            throw new GraphFormatException("Invalid number of vertices " + numVertices, lineNumber, e);
        }

        for (int v = 0; v < numVertices; ++v) {
            line = reader.readLine();

            if (line == null) {
                LOG.warn("Input ended after " + v + " of " + numVertices + " vertex descriptions");
                return lineNumber;
            }

            ++lineNumber;
            graph.setLabel(v, line);
        }

        boolean hasSource = false;
        int source = 0;

        while ((line = reader.readLine()) != null) {
            ++lineNumber;

            StringTokenizer tokenizer = new StringTokenizer(line);

            while (tokenizer.hasMoreTokens()) {
                int value = parseInt(tokenizer.nextToken(), lineNumber);

                if (!hasSource) {
                    if (value == 0) {
                        return lineNumber;
                    }

                    source = value;
                    hasSource = true;
                } else {
                    graph.insertEdge(source, value);
                    hasSource = false;
                }
            }
        }

        if (hasSource) {
            LOG.warn("Input ended before the destination of an edge starting at vertex " + source);
        }

        return lineNumber;
    }

    private int parseInt(String token, int lineNumber) throws GraphFormatException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new GraphFormatException("Expected a number, found '" + token + "'", lineNumber, e);
        }
    }
}
