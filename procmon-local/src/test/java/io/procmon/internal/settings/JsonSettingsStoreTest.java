package io.procmon.internal.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.procmon.Settings;
import io.procmon.core.SettingStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSettingsStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void firstLoadShouldCreateEmptySettingsFile() throws Exception {
        Path file = dir.resolve("nested").resolve("settings.json");
        JsonSettingsStore store = new JsonSettingsStore(file, objectMapper);

        store.load();

        assertThat(file).exists();
        assertThat(objectMapper.readTree(file.toFile()).get("ignore").isArray()).isTrue();
        assertThat(objectMapper.readTree(file.toFile()).get("kill").isArray()).isTrue();
        assertThat(store.get(Settings.IGNORE)).isEmpty();
        assertThat(store.get(Settings.KILL)).isEmpty();
    }

    @Test
    void savedListsShouldSurviveReload() throws Exception {
        Path file = dir.resolve("settings.json");
        JsonSettingsStore store = new JsonSettingsStore(file, objectMapper);
        store.load();
        store.add(Settings.IGNORE, "svchost", true);
        store.add(Settings.IGNORE, "explorer", true);
        store.add(Settings.KILL, "notepad", true);
        store.save();

        JsonSettingsStore reloaded = new JsonSettingsStore(file, objectMapper);
        reloaded.load();

        assertThat(reloaded.get(Settings.IGNORE)).containsExactly("svchost", "explorer");
        assertThat(reloaded.get(Settings.KILL)).containsExactly("notepad");
        assertThat(Files.exists(dir.resolve("settings.json.tmp"))).isFalse();
    }

    @Test
    void unsavedChangesShouldNotReachDisk() {
        Path file = dir.resolve("settings.json");
        JsonSettingsStore store = new JsonSettingsStore(file, objectMapper);
        store.load();
        store.add(Settings.KILL, "notepad", true);

        JsonSettingsStore reloaded = new JsonSettingsStore(file, objectMapper);
        reloaded.load();

        assertThat(reloaded.get(Settings.KILL)).isEmpty();
    }

    @Test
    void addShouldReportStatus() {
        JsonSettingsStore store = new JsonSettingsStore(dir.resolve("settings.json"), objectMapper);

        assertThat(store.add(Settings.KILL, "notepad", true)).isEqualTo(SettingStatus.SUCCESS);
        assertThat(store.add(Settings.KILL, "notepad", true)).isEqualTo(SettingStatus.NO_CHANGE);
        assertThat(store.add(Settings.KILL, "  ", true)).isEqualTo(SettingStatus.INVALID);
        assertThat(store.add(Settings.KILL, "ignore", true)).isEqualTo(SettingStatus.RESERVED);
        assertThat(store.get(Settings.KILL)).containsExactly("notepad");
    }

    @Test
    void removeShouldReportStatus() {
        JsonSettingsStore store = new JsonSettingsStore(dir.resolve("settings.json"), objectMapper);
        store.add(Settings.IGNORE, "svchost", true);

        assertThat(store.remove(Settings.IGNORE, "svchost", true)).isEqualTo(SettingStatus.SUCCESS);
        assertThat(store.remove(Settings.IGNORE, "svchost", true)).isEqualTo(SettingStatus.NO_CHANGE);
        assertThat(store.get(Settings.IGNORE)).isEmpty();
    }

    @Test
    void dryRunShouldNotMutate() {
        JsonSettingsStore store = new JsonSettingsStore(dir.resolve("settings.json"), objectMapper);
        store.add(Settings.IGNORE, "keep", true);

        assertThat(store.add(Settings.IGNORE, "svchost", false)).isEqualTo(SettingStatus.SUCCESS);
        assertThat(store.remove(Settings.IGNORE, "keep", false)).isEqualTo(SettingStatus.SUCCESS);
        assertThat(store.get(Settings.IGNORE)).containsExactly("keep");
    }

    @Test
    void loadShouldDropDuplicatesAndUnknownLists() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"ignore\":[\"a\",\"a\",\"\"],\"kill\":[\"b\"],\"other\":[\"c\"]}");
        JsonSettingsStore store = new JsonSettingsStore(file, objectMapper);

        store.load();

        assertThat(store.get(Settings.IGNORE)).containsExactly("a");
        assertThat(store.get(Settings.KILL)).containsExactly("b");
    }

    @Test
    void malformedFileShouldFailLoad() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ not json");
        JsonSettingsStore store = new JsonSettingsStore(file, objectMapper);

        assertThatThrownBy(store::load)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining(file.toString());
    }

    @Test
    void unknownListNameShouldBeRejected() {
        JsonSettingsStore store = new JsonSettingsStore(dir.resolve("settings.json"), objectMapper);

        assertThatThrownBy(() -> store.get("other")).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.location()).isEqualTo(dir.resolve("settings.json"));
        assertThat(store.get(Settings.IGNORE)).isEqualTo(List.of());
    }
}
