package io.procmon;

import io.procmon.core.SettingStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Named string lists kept between sessions (the ignore list and the kill list).
 */
public interface Settings {

    String IGNORE = "ignore";
    String KILL = "kill";

    /**
     * Copy of the named list in insertion order.
     *
     * @throws IllegalArgumentException for an unknown list name
     */
    List<String> get(String listName);

    /**
     * Append {@code value} unless already present. With {@code apply == false} only the status is computed.
     */
    SettingStatus add(String listName, String value, boolean apply);

    SettingStatus remove(String listName, String value, boolean apply);

    /**
     * Where the settings are stored.
     */
    Path location();

    /**
     * Read the stored settings, creating an empty file on first launch.
     */
    void load();

    void save() throws IOException;
}
