package io.ringbag.metadata;

import io.ringbag.core.model.TopicDescriptor;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes {@code metadata.yaml} next to the data files of a file-backed bag.
 */
public final class BagMetadataIo {
    public static final String FILE_NAME = "metadata.yaml";

    private BagMetadataIo() {
    }

    public static Path pathIn(final Path bagDirectory) {
        return bagDirectory.resolve(FILE_NAME);
    }

    /**
     * Writes to a temp file first and moves it into place, so a reader never sees half a document.
     */
    public static void write(final Path bagDirectory, final BagMetadata metadata) throws IOException {
        final Path target = pathIn(bagDirectory);
        final Path tmp = target.resolveSibling(FILE_NAME + ".tmp");

        try (final Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            yaml().dump(toMap(metadata), out);
        }

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static Optional<BagMetadata> read(final Path bagDirectory) throws IOException {
        final Path file = pathIn(bagDirectory);
        if (!Files.isRegularFile(file)) return Optional.empty();

        try (final InputStream in = Files.newInputStream(file)) {
            final Map<String, Object> m = yaml().load(in);
            if (m == null) throw new IOException("Empty metadata file " + file);
            return Optional.of(fromMap(m));
        } catch (final ClassCastException | NullPointerException | IllegalArgumentException e) {
            throw new IOException("Malformed metadata file " + file, e);
        }
    }

    static Map<String, Object> toMap(final BagMetadata metadata) {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put("version", metadata.version());
        m.put("storageIdentifier", metadata.storageIdentifier());
        m.put("messageCount", metadata.messageCount());
        m.put("startingTimeNanos", metadata.startingTimeNanos());
        m.put("durationNanos", metadata.durationNanos());

        final List<Map<String, Object>> topics = new ArrayList<>();
        for (final TopicInformation t : metadata.topics()) {
            final Map<String, Object> tm = new LinkedHashMap<>();
            tm.put("name", t.topic().name());
            tm.put("type", t.topic().typeIdentifier());
            tm.put("format", t.topic().serializationFormat());
            tm.put("messageCount", t.messageCount());
            topics.add(tm);
        }
        m.put("topics", topics);
        return m;
    }

    @SuppressWarnings("unchecked")
    static BagMetadata fromMap(final Map<String, Object> m) {
        final List<Map<String, Object>> list = (List<Map<String, Object>>) m.getOrDefault("topics", List.of());

        final List<TopicInformation> topics = list.stream()
                .map(t -> new TopicInformation(
                        new TopicDescriptor((String) t.get("name"), (String) t.get("type"), (String) t.get("format")),
                        asLong(t.get("messageCount"))))
                .toList();

        return new BagMetadata(
                ((Number) m.get("version")).intValue(),
                (String) m.get("storageIdentifier"),
                asLong(m.get("messageCount")),
                asLong(m.get("startingTimeNanos")),
                asLong(m.get("durationNanos")),
                topics);
    }

    // SnakeYAML hands back Integer or Long depending on magnitude.
    private static long asLong(final Object value) {
        return ((Number) value).longValue();
    }

    private static Yaml yaml() {
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options);
    }
}
