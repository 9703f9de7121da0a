package io.esuque.conf;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.ByteStreams;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * YAML based config.
 * <p/>
 * The bundled defaults are always loaded first; user files are applied on
 * top of them in the order given.
 */
public class YamlConfiguration {

    static final String DEFAULT_CONFIGURATION = "esuque.default.yaml";
    static final String DEFAULT_CUSTOM_CONFIGURATION = "esuque.yaml";
    private static final Logger LOG = Logger.getLogger(YamlConfiguration.class);

    private static final List<String> BASE_CONFIGS = Lists.newArrayList(DEFAULT_CONFIGURATION);

    private static final Map<String, ConfigurationAssignment> VALID_PROPERTIES =
            ImmutableMap.<String, ConfigurationAssignment>builder()
                    // Input
                    .put("input_graph_path", new StringConfigurationAssignment(Configuration.CONF_MAINGRAPH_PATH))
                    .put("display_graph", new BooleanConfigurationAssignment(Configuration.CONF_DISPLAY_GRAPH))

                    // Enumeration
                    .put("subgraph_size", new IntegerConfigurationAssignment(Configuration.CONF_SUBGRAPH_SIZE))

                    // Output
                    .put("output_active", new BooleanConfigurationAssignment(Configuration.CONF_OUTPUT_ACTIVE))

                    // Logging
                    .put("log_level", new StringConfigurationAssignment(Configuration.CONF_LOG_LEVEL))
                    .put("verbose", new DummyConfigurationAssignment()) // Handled on EsuqueRunner
                    .build();

    private final Set<String> configurations;
    private final boolean customConfigurationOptional;
    private final Map<String, Object> properties;

    public YamlConfiguration() {
        configurations = new LinkedHashSet<>();
        configurations.addAll(BASE_CONFIGS);
        customConfigurationOptional = false;
        properties = new LinkedHashMap<>();
    }

    public YamlConfiguration(List<String> userConfigs) {
        configurations = new LinkedHashSet<>();
        configurations.addAll(BASE_CONFIGS);
        configurations.addAll(userConfigs);
        customConfigurationOptional = false;
        properties = new LinkedHashMap<>();
    }

    /**
     * Takes the files given with {@code -y}, or the optional
     * {@value #DEFAULT_CUSTOM_CONFIGURATION} on the classpath when there are none.
     */
    public YamlConfiguration(CommandLine cmd) {
        configurations = new LinkedHashSet<>();
        configurations.addAll(BASE_CONFIGS);
        properties = new LinkedHashMap<>();

        if (cmd.hasOption("y")) {
            configurations.addAll(Arrays.asList(cmd.getOptionValues("y")));
            customConfigurationOptional = false;
        } else {
            configurations.add(DEFAULT_CUSTOM_CONFIGURATION);
            customConfigurationOptional = true;
        }
    }

    public static Option createYamlOption() {
        Option option = new Option("y", "yaml", true, "YAML configuration files (defaults to " + DEFAULT_CUSTOM_CONFIGURATION + " on classpath)");
        option.setArgs(Option.UNLIMITED_VALUES);
        return option;
    }

    public void load() {
        for (String configPath : configurations) {
            if (customConfigurationOptional && configPath.equals(DEFAULT_CUSTOM_CONFIGURATION)
                    && YamlConfiguration.class.getClassLoader().getResource(configPath) == null) {
                LOG.info("No " + DEFAULT_CUSTOM_CONFIGURATION + " found on classpath, using defaults");
                continue;
            }

            loadConfig(configPath);
        }
    }

    public Object get(String key) {
        return properties.get(key);
    }

    public void set(String key, Object value) {
        properties.put(key, value);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    public Boolean getBoolean(String key) {
        String value = getString(key);
        return value == null ? null : Boolean.valueOf(value);
    }

    public Configuration createConfiguration() {
        Configuration configuration = new Configuration();
        populateConfiguration(configuration);
        return configuration;
    }

    public void populateConfiguration(Configuration configuration) {
        for (Map.Entry<String, ConfigurationAssignment> property : VALID_PROPERTIES.entrySet()) {
            String propertyKey = property.getKey();
            Object propertyValue = properties.get(propertyKey);

            if (propertyValue != null) {
                property.getValue().assign(propertyKey, propertyValue, configuration);
            }
        }

        addUnrecognizedProperties(configuration);
    }

    private void addUnrecognizedProperties(Configuration configuration) {
        Set<String> unrecognizedKeys = new LinkedHashSet<>(properties.keySet());
        unrecognizedKeys.removeAll(VALID_PROPERTIES.keySet());

        for (String unrecognizedKey : unrecognizedKeys) {
            LOG.info("Unknown YAML key, keeping it as a custom argument: " + unrecognizedKey);

            Object value = properties.get(unrecognizedKey);
            String valueStr;

            if (value == null) {
                continue;
            } else if (!(value instanceof Collection)) {
                valueStr = value.toString();
            } else {
                valueStr = Joiner.on(',').join((Collection<?>) value);
            }

            LOG.info("Setting custom argument [" + unrecognizedKey + "] to [" + valueStr + "]");
            configuration.set(unrecognizedKey, valueStr);
        }
    }

    private void loadConfig(String urlStr) {
        loadConfig(getConfigUrl(urlStr));
    }

    private void loadConfig(URL url) {
        try {
            LOG.info("Loading settings from " + url);

            byte[] configBytes;
            try {
                configBytes = readUrl(url);
            } catch (IOException e) {
                throw new RuntimeException("Unable to read yaml config " + url, e);
            }

            Yaml yaml = new Yaml();
            Object result = yaml.load(new ByteArrayInputStream(configBytes));

            if (result == null) {
                return;
            }

            if (!(result instanceof Map)) {
                throw new RuntimeException("Invalid yaml, expected a mapping at the top level of " + url);
            }

            for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                properties.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } catch (YAMLException e) {
            throw new RuntimeException("Invalid yaml", e);
        }
    }

    private URL getConfigUrl(String urlStr) {
        URL url;
        try {
            url = new URL(urlStr);
            url.openStream().close(); // catches well-formed but bogus URLs
        } catch (Exception e) {
            ClassLoader loader = YamlConfiguration.class.getClassLoader();
            url = loader.getResource(urlStr);
            if (url == null) {
                url = getFileUrl(urlStr);
            }
            if (url == null) {
                throw new RuntimeException("Unable to find yaml config file location: " + urlStr, e);
            }
        }

        return url;
    }

    private URL getFileUrl(String pathStr) {
        File file = new File(pathStr);

        if (!file.isFile()) {
            return null;
        }

        try {
            return file.toURI().toURL();
        } catch (IOException e) {
            throw new RuntimeException("Invalid yaml config file path: " + pathStr, e);
        }
    }

    private byte[] readUrl(URL url) throws IOException {
        try (InputStream is = url.openStream()) {
            return ByteStreams.toByteArray(is);
        }
    }

    private interface ConfigurationAssignment {
        void assign(String propertyKey, Object propertyValue, Configuration configuration);
    }

    private static class DummyConfigurationAssignment implements ConfigurationAssignment {
        @Override
        public void assign(String propertyKey, Object propertyValue, Configuration configuration) {
            // Empty on purpose
        }
    }

    private static class IntegerConfigurationAssignment implements ConfigurationAssignment {
        private String configurationKey;

        public IntegerConfigurationAssignment(String configurationKey) {
            this.configurationKey = configurationKey;
        }

        @Override
        public void assign(String propertyKey, Object propertyValue, Configuration configuration) {
            try {
                configuration.setInt(configurationKey, Integer.parseInt(propertyValue.toString().trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid YAML property " + propertyKey + ": " + propertyValue, e);
            }
        }
    }

    private static class BooleanConfigurationAssignment implements ConfigurationAssignment {
        private String configurationKey;

        public BooleanConfigurationAssignment(String configurationKey) {
            this.configurationKey = configurationKey;
        }

        @Override
        public void assign(String propertyKey, Object propertyValue, Configuration configuration) {
            configuration.setBoolean(configurationKey, Boolean.valueOf(propertyValue.toString()));
        }
    }

    private static class StringConfigurationAssignment implements ConfigurationAssignment {
        private String configurationKey;

        public StringConfigurationAssignment(String configurationKey) {
            this.configurationKey = configurationKey;
        }

        @Override
        public void assign(String propertyKey, Object propertyValue, Configuration configuration) {
            configuration.set(configurationKey, propertyValue.toString());
        }
    }
}
