package taskworker.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads worker settings from the {@code [TASKER]} section of an INI file.
 * Keys are the environment names without the {@code TASKER_} prefix, in any
 * case: {@code database_uri}, {@code interval_time}, {@code admin_port}, ...
 *
 * <pre>
 * [TASKER]
 * database_uri = jdbc:sqlite:/var/lib/tasker.db
 * interval_time = 2
 * </pre>
 */
public final class IniConfigLoader {

    public static final String SECTION = "TASKER";
    private static final String PREFIX = "TASKER_";

    private IniConfigLoader() {
    }

    /**
     * @return settings keyed the way {@link WorkerConfig#fromProperties} expects
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if the file has no {@code [TASKER]} section
     */
    public static Map<String, String> load(Path file) throws IOException {
        Ini ini = new Ini(file.toFile());

        Profile.Section section = ini.get(SECTION);
        if (section == null) {
            throw new IllegalArgumentException("No [" + SECTION + "] section in " + file);
        }

        Map<String, String> settings = new LinkedHashMap<>();
        for (String key : section.keySet()) {
            String value = section.get(key);
            if (value == null || value.isBlank()) {
                continue;
            }
            settings.put(PREFIX + key.trim().toUpperCase(Locale.ROOT), value.trim());
        }
        return settings;
    }
}
