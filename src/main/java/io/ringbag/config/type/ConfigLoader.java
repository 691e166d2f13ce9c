package io.ringbag.config.type;

import io.ringbag.config.impl.StorageOptions;
import io.ringbag.config.impl.TopicConfig;
import io.ringbag.core.error.ConfigurationException;
import io.ringbag.storage.BackendId;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads storage options from a YAML file.
     * <p>
     * The YAML file is expected to have the following structure:
     * <pre>
     * uri: /data/bags/run-1
     * storageId: segment
     * backendConfig:
     *   segmentBytes: 1048576
     * topics:
     *   - name: /imu
     *     type: sensor_msgs/Imu
     *     format: proto3
     * </pre>
     * Only {@code uri} is required.
     *
     * @param path the path to the options YAML file
     * @return the populated options
     * @throws IOException if the file cannot be read
     * @throws ConfigurationException if the document does not match the expected structure
     */
    public static StorageOptions load(final String path) throws IOException {
        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            return fromYaml(in);
        }
    }

    @SuppressWarnings("unchecked")
    public static StorageOptions fromYaml(final InputStream in) {
        final Yaml yaml = new Yaml();

        try {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) throw new ConfigurationException("Empty storage options document");

            final String uri = (String) m.get("uri");
            if (uri == null) throw new ConfigurationException("Storage options need a 'uri'");

            final StorageOptions.StorageOptionsBuilder builder = StorageOptions.builder()
                    .uri(uri)
                    .storageId((String) m.getOrDefault("storageId", BackendId.DEFAULT.getIdentifier()));

            final Map<String, Object> backend = (Map<String, Object>) m.get("backendConfig");
            if (backend != null) builder.backendConfig(backend);

            builder.topics(loadTopics((List<Map<String, Object>>) m.getOrDefault("topics", List.of())).stream()
                    .map(TopicConfig::toDescriptor)
                    .collect(Collectors.toList()));

            return builder.build();
        } catch (final YAMLException | ClassCastException | IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Malformed storage options: " + e.getMessage(), e);
        }
    }

    private static List<TopicConfig> loadTopics(final List<Map<String, Object>> list) {
        return list.stream()
                .map(t -> new TopicConfig(
                        (String) t.get("name"),
                        (String) t.get("type"),
                        (String) t.get("format")))
                .collect(Collectors.toList());
    }
}
