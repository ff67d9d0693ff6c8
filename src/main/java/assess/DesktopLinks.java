package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;

/** Opens URLs, files and folders with the OS default handler. */
final class DesktopLinks {

    private static final Logger log = LoggerFactory.getLogger(DesktopLinks.class);

    private DesktopLinks() {}

    static void browse(String url) throws IOException {
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            Desktop.getDesktop().browse(URI.create(url));
            return;
        }
        launch(url);
    }

    static void open(File fileOrDir) throws IOException {
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.OPEN)) {
            Desktop.getDesktop().open(fileOrDir);
            return;
        }
        launch(fileOrDir.getAbsolutePath());
    }

    private static void launch(String target) throws IOException {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        ProcessBuilder pb;
        if (os.contains("win")) pb = new ProcessBuilder("explorer", target);
        else if (os.contains("mac")) pb = new ProcessBuilder("open", target);
        else pb = new ProcessBuilder("xdg-open", target);
        log.debug("Opening {} via {}", target, pb.command().get(0));
        pb.start();
    }
}
