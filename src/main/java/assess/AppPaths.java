package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Per-user locations for config, credentials, templates and logs.
 *   macOS   ~/Library/Application Support/PantherAssess
 *   Windows %APPDATA%/PantherAssess
 *   other   ~/.config/PantherAssess
 * The system property {@code panther.assess.home} overrides the base directory.
 */
public final class AppPaths {

    private static final Logger log = LoggerFactory.getLogger(AppPaths.class);

    static final String HOME_OVERRIDE = "panther.assess.home";
    static final String BUNDLED_TEMPLATES_INDEX = "/templates/bundled.txt";

    private AppPaths() {}

    public static Path userDataDir() {
        Path dir;
        String override = System.getProperty(HOME_OVERRIDE);
        if (override != null && !override.isBlank()) {
            dir = Paths.get(override.trim());
        } else {
            String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
            Path home = Paths.get(System.getProperty("user.home"));
            if (os.contains("mac")) {
                dir = home.resolve("Library").resolve("Application Support").resolve("PantherAssess");
            } else if (os.contains("win") && System.getenv("APPDATA") != null) {
                dir = Paths.get(System.getenv("APPDATA")).resolve("PantherAssess");
            } else {
                dir = home.resolve(".config").resolve("PantherAssess");
            }
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("Could not create user data dir {}: {}", dir, e.toString());
        }
        return dir;
    }

    public static Path configFile() {
        return userDataDir().resolve("application.properties");
    }

    public static Path defaultReportsDir() {
        Path desktop = Paths.get(System.getProperty("user.home"), "Desktop");
        if (Files.isDirectory(desktop)) return desktop;
        return userDataDir().resolve("reports");
    }

    public static Path defaultTemplatesDir() {
        return userDataDir().resolve("templates");
    }

    /** Creates the templates dir and, when it holds no template yet, copies in the bundled ones. */
    public static Path prepareTemplatesDir(Path dir) throws IOException {
        Files.createDirectories(dir);
        boolean empty;
        try (Stream<Path> st = Files.list(dir)) {
            empty = st.noneMatch(p -> p.getFileName().toString().endsWith(".json"));
        }
        if (empty) seedBundledTemplates(dir);
        return dir;
    }

    static int seedBundledTemplates(Path dir) throws IOException {
        int copied = 0;
        try (InputStream index = AppPaths.class.getResourceAsStream(BUNDLED_TEMPLATES_INDEX)) {
            if (index == null) return 0;
            BufferedReader reader = new BufferedReader(new InputStreamReader(index, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim();
                if (name.isEmpty() || name.startsWith("#")) continue;
                try (InputStream tpl = AppPaths.class.getResourceAsStream("/templates/" + name)) {
                    if (tpl == null) {
                        log.warn("Bundled template listed but missing: {}", name);
                        continue;
                    }
                    Files.copy(tpl, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                    copied++;
                }
            }
        }
        log.info("Seeded {} bundled template(s) into {}", copied, dir);
        return copied;
    }
}
