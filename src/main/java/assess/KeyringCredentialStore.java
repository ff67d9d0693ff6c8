package assess;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OS keychain (macOS Keychain, Windows Credential Manager, Secret Service). */
public class KeyringCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(KeyringCredentialStore.class);

    private final Keyring keyring;

    KeyringCredentialStore(Keyring keyring) {
        this.keyring = keyring;
    }

    public static KeyringCredentialStore create() throws BackendNotSupportedException {
        return new KeyringCredentialStore(Keyring.create());
    }

    @Override
    public String get(String key) {
        try {
            String v = keyring.getPassword(SERVICE, key);
            return (v == null || v.isEmpty()) ? null : v;
        } catch (PasswordAccessException e) {
            // most backends report a missing entry this way
            log.debug("No keychain entry for {}: {}", key, e.getMessage());
            return null;
        }
    }

    @Override
    public void put(String key, String value) {
        try {
            keyring.setPassword(SERVICE, key, value);
        } catch (PasswordAccessException e) {
            throw new CredentialStoreException("Could not save " + key + " to the keychain", e);
        }
    }

    @Override
    public void delete(String key) {
        if (get(key) == null) return;
        try {
            keyring.deletePassword(SERVICE, key);
        } catch (PasswordAccessException e) {
            throw new CredentialStoreException("Could not delete " + key + " from the keychain", e);
        }
    }
}
