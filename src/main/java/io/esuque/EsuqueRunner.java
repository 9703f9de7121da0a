package io.esuque;

import io.esuque.computation.CountingSubgraphCallback;
import io.esuque.computation.SubgraphCallback;
import io.esuque.computation.SubgraphEnumerator;
import io.esuque.conf.Configuration;
import io.esuque.conf.YamlConfiguration;
import io.esuque.graph.MainGraph;
import io.esuque.input.GraphReader;
import io.esuque.output.GraphPrinter;
import io.esuque.output.PrintingSubgraphCallback;
import org.apache.commons.cli.*;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;

public class EsuqueRunner {
    /**
     * Class logger
     */
    private static final Logger LOG = Logger.getLogger(EsuqueRunner.class);

    private final PrintStream out;

    public EsuqueRunner() {
        this(System.out);
    }

    public EsuqueRunner(PrintStream out) {
        this.out = out;
    }

    static Options createOptions() {
        Options options = new Options();
        options.addOption(YamlConfiguration.createYamlOption());
        options.addOption("g", "graph", true, "Graph file to read (overrides input_graph_path)");
        options.addOption("k", "size", true, "Size of the subgraphs to enumerate (overrides subgraph_size)");
        options.addOption("d", "display", false, "Display the graph before enumerating");
        options.addOption("h", "help", false, "Print this message");
        return options;
    }

    /**
     * @return 0 on success, 1 on any error.
     */
    public int run(String[] args) {
        Options options = createOptions();
        CommandLine cmd;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            LOG.error("Unable to parse command line parameters: " + e.getMessage());
            printHelp(options);
            return 1;
        }

        if (cmd.hasOption("h")) {
            printHelp(options);
            return 0;
        }

        try {
            YamlConfiguration yamlConfig = new YamlConfiguration(cmd);
            yamlConfig.load();
            applyCommandLineOverrides(cmd, yamlConfig);

            Configuration conf = yamlConfig.createConfiguration();
            configureLogging(conf, yamlConfig);

            return run(conf);
        } catch (IOException e) {
            LOG.error("Unable to read graph: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Enumeration failed: " + e.getMessage(), e);
        }

        return 1;
    }

    protected int run(Configuration conf) throws IOException {
        if (LOG.isDebugEnabled()) {
            for (Map.Entry<String, String> entry : conf.getValues().entrySet()) {
                LOG.debug("Configuration [" + entry.getKey() + "] = [" + entry.getValue() + "]");
            }
        }

        Path graphPath = conf.getMainGraphPath();

        if (graphPath == null) {
            LOG.error("No input graph given, set input_graph_path or use -g");
            return 1;
        }

        MainGraph graph = new GraphReader().read(graphPath);

        if (conf.isDisplayGraph()) {
            new GraphPrinter(out).displayAll(graph);
        }

        int k = conf.getSubgraphSize();

        if (LOG.isDebugEnabled()) {
            LOG.debug("Attempting to enumerate subgraphs of size " + k + " in " + graph);
        }

        SubgraphCallback callback;

        if (conf.isOutputActive()) {
            callback = new PrintingSubgraphCallback(out);
        } else {
            callback = new CountingSubgraphCallback();
        }

        long numSubgraphs = new SubgraphEnumerator(graph).enumerateSubgraphs(k, callback);

        if (LOG.isInfoEnabled()) {
            LOG.info("Found " + numSubgraphs + " connected subgraphs of size " + k + " in " + graph);
        }

        return 0;
    }

    private void applyCommandLineOverrides(CommandLine cmd, YamlConfiguration yamlConfig) {
        if (cmd.hasOption("g")) {
            yamlConfig.set("input_graph_path", cmd.getOptionValue("g"));
        }

        if (cmd.hasOption("k")) {
            yamlConfig.set("subgraph_size", cmd.getOptionValue("k"));
        }

        if (cmd.hasOption("d")) {
            yamlConfig.set("display_graph", Boolean.TRUE);
        }
    }

    private void configureLogging(Configuration conf, YamlConfiguration yamlConfig) {
        Boolean verbose = yamlConfig.getBoolean("verbose");
        Level level;

        if (verbose != null && verbose) {
            level = Level.DEBUG;
        } else {
            level = Level.toLevel(conf.getLogLevel(), Level.INFO);
        }

        Logger.getLogger("io.esuque").setLevel(level);
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "esuque", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    /**
     * Execute EsuqueRunner.
     *
     * @param args Typically command line arguments.
     */
    public static void main(String[] args) {
        System.exit(new EsuqueRunner().run(args));
    }
}
