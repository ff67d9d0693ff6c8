package assess;

import com.github.javakeyring.BackendNotSupportedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CredentialStores {

    private static final Logger log = LoggerFactory.getLogger(CredentialStores.class);

    private CredentialStores() {}

    /** The OS keychain when one is available, otherwise credentials.properties in the user data dir. */
    public static CredentialStore open() {
        try {
            return KeyringCredentialStore.create();
        } catch (BackendNotSupportedException | RuntimeException e) {
            PropertiesCredentialStore fallback =
                    new PropertiesCredentialStore(AppPaths.userDataDir().resolve("credentials.properties"));
            log.warn("No OS keychain available ({}); storing credentials in {}", e.getMessage(), fallback.file());
            return fallback;
        }
    }

    /** abcd...wxyz form for logs. */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) return "(none)";
        if (secret.length() <= 8) return "****";
        return secret.substring(0, 4) + "..." + secret.substring(secret.length() - 4);
    }
}
