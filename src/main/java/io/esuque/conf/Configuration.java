package io.esuque.conf;

import org.apache.log4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Configuration {
    private static final Logger LOG = Logger.getLogger(Configuration.class);

    public static final String CONF_MAINGRAPH_PATH = "esuque.graph.location";
    public static final String CONF_MAINGRAPH_PATH_DEFAULT = null;

    public static final String CONF_SUBGRAPH_SIZE = "esuque.subgraph.size";
    public static final int CONF_SUBGRAPH_SIZE_DEFAULT = 3;

    public static final String CONF_DISPLAY_GRAPH = "esuque.graph.display";
    public static final boolean CONF_DISPLAY_GRAPH_DEFAULT = false;

    public static final String CONF_OUTPUT_ACTIVE = "esuque.output.active";
    public static final boolean CONF_OUTPUT_ACTIVE_DEFAULT = true;

    public static final String CONF_LOG_LEVEL = "esuque.log.level";
    public static final String CONF_LOG_LEVEL_DEFAULT = "info";

    private final Map<String, String> values;

    public Configuration() {
        values = new LinkedHashMap<>();
    }

    public void set(String key, String value) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Setting [" + key + "] to [" + value + "]");
        }

        values.put(key, value);
    }

    public void setInt(String key, int value) {
        set(key, Integer.toString(value));
    }

    public void setBoolean(String key, boolean value) {
        set(key, Boolean.toString(value));
    }

    public String getString(String key, String defaultValue) {
        String value = values.get(key);

        return value == null ? defaultValue : value;
    }

    public int getInteger(String key, int defaultValue) {
        String value = values.get(key);

        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);

        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public Map<String, String> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Path getMainGraphPath() {
        String path = getString(CONF_MAINGRAPH_PATH, CONF_MAINGRAPH_PATH_DEFAULT);

        return path == null ? null : Paths.get(path);
    }

    public int getSubgraphSize() {
        return getInteger(CONF_SUBGRAPH_SIZE, CONF_SUBGRAPH_SIZE_DEFAULT);
    }

    public boolean isDisplayGraph() {
        return getBoolean(CONF_DISPLAY_GRAPH, CONF_DISPLAY_GRAPH_DEFAULT);
    }

    public boolean isOutputActive() {
        return getBoolean(CONF_OUTPUT_ACTIVE, CONF_OUTPUT_ACTIVE_DEFAULT);
    }

    public String getLogLevel() {
        return getString(CONF_LOG_LEVEL, CONF_LOG_LEVEL_DEFAULT);
    }

    @Override
    public String toString() {
        return "Configuration{" + values + "}";
    }
}
