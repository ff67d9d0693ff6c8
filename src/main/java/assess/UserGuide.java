package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Component;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/** The bundled Word user guide, copied out of the jar so the OS can open it. */
final class UserGuide {

    private static final Logger log = LoggerFactory.getLogger(UserGuide.class);

    static final String RESOURCE = "/guide/PantherAssessment_User_Guide.docx";

    private UserGuide() {}

    /** @return the extracted copy, or null when the guide is not bundled */
    static Path extract() throws IOException {
        try (InputStream in = UserGuide.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("User guide {} is not on the classpath", RESOURCE);
                return null;
            }
            Path dir = Paths.get(System.getProperty("java.io.tmpdir"), "PantherAssessment");
            Files.createDirectories(dir);
            Path copy = dir.resolve("PantherAssessment_User_Guide.docx");
            Files.copy(in, copy, StandardCopyOption.REPLACE_EXISTING);
            return copy;
        }
    }

    static void open(Component parent) {
        try {
            Path guide = extract();
            if (guide == null) {
                UiKit.warn(parent, "Help File Not Found",
                        "User guide document could not be found.\nLooking for: " + RESOURCE);
                return;
            }
            DesktopLinks.open(guide.toFile());
        } catch (IOException | RuntimeException e) {
            log.warn("Could not open user guide", e);
            UiKit.warn(parent, "Error Opening File", "Could not open user guide: " + e.getMessage());
        }
    }
}
