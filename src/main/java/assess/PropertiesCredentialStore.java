package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Properties;

/** File-backed store used when the OS has no keychain backend. */
public class PropertiesCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(PropertiesCredentialStore.class);

    private final Path file;

    public PropertiesCredentialStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized String get(String key) {
        String v = read().getProperty(key);
        return (v == null || v.isBlank()) ? null : v;
    }

    @Override
    public synchronized void put(String key, String value) {
        Properties p = read();
        p.setProperty(key, value);
        write(p);
    }

    @Override
    public synchronized void delete(String key) {
        Properties p = read();
        if (p.remove(key) != null) write(p);
    }

    private Properties read() {
        Properties p = new Properties();
        if (!Files.exists(file)) return p;
        try (InputStream is = Files.newInputStream(file)) {
            p.load(is);
        } catch (IOException e) {
            throw new CredentialStoreException("Could not read " + file, e);
        }
        return p;
    }

    private void write(Properties p) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (OutputStream os = Files.newOutputStream(file)) {
                p.store(os, "Panther Assessment credentials");
            }
            restrictPermissions();
        } catch (IOException e) {
            throw new CredentialStoreException("Could not write " + file, e);
        }
    }

    private void restrictPermissions() {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions on {}: {}", file, e.toString());
        }
    }
}
