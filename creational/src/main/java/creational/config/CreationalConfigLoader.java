package creational.config;

import creational.abstractfactory.NotificationChannel;
import creational.factory.payment.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads {@link CreationalConfig} from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code creational.properties} on the classpath</li>
 *   <li>{@code creational.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file values, using the same keys
 * (e.g., {@code -Dcreational.race.callers=500}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code creational.service.name} - service name</li>
 *   <li>{@code creational.notification.channel} - EMAIL or SMS</li>
 *   <li>{@code creational.payment.method} - CARD, UPI or NET</li>
 *   <li>{@code creational.race.callers} - concurrent callers in a singleton race</li>
 *   <li>{@code creational.demo.timeout} - per-demo timeout in seconds, 0 for none</li>
 * </ul>
 *
 * @see CreationalConfig
 */
public final class CreationalConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CreationalConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "creational.properties";
    static final String YAML_RESOURCE = "creational.yml";

    private CreationalConfigLoader() {}

    /**
     * Load from classpath (creational.properties or creational.yml).
     * @throws CreationalConfigException if no config file found
     */
    public static CreationalConfig load() {
        InputStream is = getResource(PROPERTIES_RESOURCE);
        if (is != null) {
            return loadProperties(is, PROPERTIES_RESOURCE);
        }

        is = getResource(YAML_RESOURCE);
        if (is != null) {
            return loadYaml(is, YAML_RESOURCE);
        }

        throw new CreationalConfigException(
                "Config file required: " + PROPERTIES_RESOURCE + " or " + YAML_RESOURCE);
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws CreationalConfigException if the file cannot be parsed
     */
    public static CreationalConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return CreationalConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static CreationalConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new CreationalConfigException("Failed to load " + source, e);
        }
    }

    private static CreationalConfig loadYaml(InputStream is, String source) {
        Object root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new CreationalConfigException("Failed to load " + source, e);
        }
        if (root == null) {
            return CreationalConfig.DEFAULTS;
        }
        if (!(root instanceof Map)) {
            throw new CreationalConfigException("Failed to load " + source + ": root is not a mapping");
        }
        Properties props = new Properties();
        flatten("", (Map<?, ?>) root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    private static void flatten(String prefix, Map<?, ?> map, Properties props) {
        for (var entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String key = prefix.isEmpty() ? name : prefix + "." + name;
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<?, ?>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static CreationalConfig parse(Properties props) {
        CreationalConfig.Builder b = CreationalConfig.builder();

        getString(props, "creational.service.name").ifPresent(v -> {
            if (!v.isEmpty()) b.serviceName(v);
        });

        getString(props, "creational.notification.channel").ifPresent(v -> {
            try {
                b.notificationChannel(NotificationChannel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid notification.channel: {}", v);
            }
        });

        getString(props, "creational.payment.method").ifPresent(v -> {
            try {
                b.paymentMethod(PaymentMethod.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid payment.method: {}", v);
            }
        });

        getInt(props, "creational.race.callers").ifPresent(v -> {
            if (v > 0) {
                b.raceCallers(v);
            } else {
                log.warn("Invalid race.callers: {}", v);
            }
        });

        getLong(props, "creational.demo.timeout").ifPresent(v -> {
            if (v >= 0) {
                b.demoTimeoutSeconds(v);
            } else {
                log.warn("Invalid demo.timeout: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
