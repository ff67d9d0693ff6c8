package assess;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/** Write-to-temp-then-rename helpers so a half-written report never replaces a good one. */
public final class SafeFileOps {

    private SafeFileOps() {}

    @FunctionalInterface
    public interface Writer {
        void writeTo(Path tmp) throws IOException;
    }

    /** Runs the writer against a temp sibling of target, then moves it over target. */
    public static void replace(Path target, Writer writer) throws IOException {
        ensureParent(target);
        Path tmp = tempSibling(target);
        try {
            writer.writeTo(tmp);
            move(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, REPLACE_EXISTING);
        }
    }

    public static void ensureParent(Path p) throws IOException {
        Path parent = p.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static Path tempSibling(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir == null) dir = Paths.get(".");
        return Files.createTempFile(dir, "tmp_", ".tmp");
    }
}
