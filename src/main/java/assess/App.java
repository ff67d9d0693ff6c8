package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.io.IOException;
import java.nio.file.Files;

public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String FORCE_HEADLESS_ENV = "PANTHER_ASSESS_FORCE_HEADLESS";

    public static void main(String[] args) {
        boolean headless = false;
        for (String a : args) if ("--headless".equalsIgnoreCase(a)) headless = true;

        // Lets scheduled jobs force headless mode even for a plain "java -jar" launch.
        if (!headless) headless = truthy(System.getenv(FORCE_HEADLESS_ENV));

        AppConfig cfg = ConfigLoader.load();
        if (!Files.exists(AppPaths.configFile())) {
            // first run: leave an editable copy of the defaults
            try {
                ConfigLoader.save(cfg);
            } catch (IOException e) {
                log.warn("Could not write default settings: {}", e.getMessage());
            }
        }

        if (!headless) {
            SwingUtilities.invokeLater(() -> ReporterWindow.launch(cfg));
            return;
        }

        System.setProperty("java.awt.headless", "true");
        log.info("Panther Assessment starting headless");
        int code = new HeadlessRunner(cfg, CredentialStores.open(), CanvasClient.factory(cfg), System.out, System.err)
                .run(args);
        System.exit(code);
    }

    static boolean truthy(String v) {
        if (v == null || v.isBlank()) return false;
        String t = v.trim();
        return "1".equals(t) || "true".equalsIgnoreCase(t) || "yes".equalsIgnoreCase(t);
    }
}
