package io.procmon.internal.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.procmon.Settings;
import io.procmon.core.SettingStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON file persistence for the ignore and kill lists.
 *
 * <p>File layout:
 * <pre>
 * {
 *   "ignore" : [ "svchost", "explorer" ],
 *   "kill" : [ "notepad" ]
 * }
 * </pre>
 *
 * <p>All list access is synchronized on the store: trigger threads read the lists while the
 * console edits them.
 */
public class JsonSettingsStore implements Settings {
    private static final Logger log = LoggerFactory.getLogger(JsonSettingsStore.class);

    private static final List<String> LIST_NAMES = List.of(IGNORE, KILL);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Map<String, List<String>> lists = new LinkedHashMap<>();

    public JsonSettingsStore(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        for (String listName : LIST_NAMES) {
            lists.put(listName, new ArrayList<>());
        }
    }

    @Override
    public synchronized void load() {
        try {
            if (!Files.exists(path)) {
                // new launch: create the settings file
                log.info("Creating settings file path={}", path);
                save();
                return;
            }

            Map<String, List<String>> stored = objectMapper.readValue(path.toFile(), new TypeReference<Map<String, List<String>>>() {
            });
            for (String listName : LIST_NAMES) {
                List<String> values = lists.get(listName);
                values.clear();
                List<String> storedValues = stored == null ? null : stored.get(listName);
                if (storedValues != null) {
                    for (String v : storedValues) {
                        if (v != null && !v.isBlank() && !values.contains(v)) {
                            values.add(v);
                        }
                    }
                }
            }
            if (stored != null) {
                for (String key : stored.keySet()) {
                    if (!LIST_NAMES.contains(key)) {
                        log.warn("Ignoring unknown settings list name={} path={}", key, path);
                    }
                }
            }
            log.info("Loaded settings path={} ignore={} kill={}", path, lists.get(IGNORE).size(), lists.get(KILL).size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load settings from " + path, e);
        }
    }

    @Override
    public synchronized List<String> get(String listName) {
        return List.copyOf(required(listName));
    }

    @Override
    public synchronized SettingStatus add(String listName, String value, boolean apply) {
        List<String> values = required(listName);
        if (value == null || value.isBlank()) {
            return SettingStatus.INVALID;
        }
        if (LIST_NAMES.contains(value)) {
            return SettingStatus.RESERVED;
        }
        if (values.contains(value)) {
            return SettingStatus.NO_CHANGE;
        }
        if (apply) {
            values.add(value);
        }
        return SettingStatus.SUCCESS;
    }

    @Override
    public synchronized SettingStatus remove(String listName, String value, boolean apply) {
        List<String> values = required(listName);
        if (value == null || value.isBlank()) {
            return SettingStatus.INVALID;
        }
        if (!values.contains(value)) {
            return SettingStatus.NO_CHANGE;
        }
        if (apply) {
            values.remove(value);
        }
        return SettingStatus.SUCCESS;
    }

    @Override
    public Path location() {
        return path;
    }

    @Override
    public void save() throws IOException {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        synchronized (this) {
            for (Map.Entry<String, List<String>> e : lists.entrySet()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }

        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), copy);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        log.info("Saved settings path={}", path);
    }

    private List<String> required(String listName) {
        List<String> values = lists.get(listName);
        if (values == null) {
            throw new IllegalArgumentException("Unknown settings list: " + listName);
        }
        return values;
    }
}
