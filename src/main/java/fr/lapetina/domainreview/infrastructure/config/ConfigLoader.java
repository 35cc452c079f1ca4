package fr.lapetina.domainreview.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads a {@link ReviewConfig} from YAML.
 *
 * A path that does not exist on disk is looked up as a classpath resource, which is how
 * the bundled {@code config.yaml} and test configurations are found. Keys may be written
 * in camelCase or snake_case ({@code sleep_time} and {@code sleepTime} are the same option);
 * any other unknown key rejects the whole file.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        Constructor constructor = new Constructor(ReviewConfig.class, new LoaderOptions());
        constructor.setPropertyUtils(new SnakeCasePropertyUtils());
        this.yaml = new Yaml(constructor);
    }

    /**
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public ReviewConfig load() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream in = Files.newInputStream(configPath)) {
                return parse(in, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration not found on disk or classpath: " + configPath);
            }
            log.info("Loading configuration from classpath: {}", resource);
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration classpath:" + resource, e);
        }
    }

    public ReviewConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ReviewConfig parse(InputStream in, String origin) {
        try {
            ReviewConfig config = yaml.load(in);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    public static ReviewConfig createDefault() {
        return new ReviewConfig();
    }

    /**
     * {@code virustotal_api_key} to {@code virustotalApiKey}. Names without underscores are unchanged.
     */
    static String toCamelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder camel = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = camel.length() > 0;
            } else {
                camel.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return camel.toString();
    }

    private static final class SnakeCasePropertyUtils extends PropertyUtils {
        @Override
        public Property getProperty(Class<?> type, String name) {
            return super.getProperty(type, toCamelCase(name));
        }
    }

    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
