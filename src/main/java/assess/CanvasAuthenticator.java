package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a working Canvas connection from the credential store, prompting for
 * the Canvas URL and API token when needed.
 */
public class CanvasAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(CanvasAuthenticator.class);

    private final CredentialStore store;
    private final CanvasApi.Factory clients;
    private final AuthPrompts prompts;

    public CanvasAuthenticator(CredentialStore store, CanvasApi.Factory clients, AuthPrompts prompts) {
        this.store = store;
        this.clients = clients;
        this.prompts = prompts;
    }

    /** @return a tested client, or null when the user gave up */
    public CanvasApi authenticate() {
        while (true) {
            String url = savedUrl();
            if (url == null) {
                url = promptForUrl();
                if (url == null) return null;
                putQuietly(CredentialStore.CANVAS_URL, url);
            }

            String saved = store.get(CredentialStore.CANVAS_TOKEN);
            if (saved != null) {
                CanvasApi client = clients.create(url, saved);
                if (client.testConnection()) {
                    log.info("Signed in to {} with saved token {}", url, CredentialStores.mask(saved));
                    return client;
                }
                log.info("Saved token for {} was rejected; removing it", url);
                deleteQuietly(CredentialStore.CANVAS_TOKEN);
            }

            String token = prompts.askToken(url);
            if (token == null || token.isBlank()) return null;
            token = token.trim();

            CanvasApi client = clients.create(url, token);
            if (client.testConnection()) {
                putQuietly(CredentialStore.CANVAS_TOKEN, token);
                log.info("Signed in to {} with new token {}", url, CredentialStores.mask(token));
                return client;
            }

            if (!prompts.askChangeUrl()) return null;
            deleteQuietly(CredentialStore.CANVAS_URL);
        }
    }

    /** Only uses what is already stored; never prompts. */
    public CanvasApi authenticateStored() {
        String url = savedUrl();
        String token = store.get(CredentialStore.CANVAS_TOKEN);
        if (url == null || token == null) return null;
        CanvasApi client = clients.create(url, token);
        return client.testConnection() ? client : null;
    }

    public void resetCredentials() {
        deleteQuietly(CredentialStore.CANVAS_URL);
        deleteQuietly(CredentialStore.CANVAS_TOKEN);
        log.info("Canvas URL and token cleared");
    }

    private String savedUrl() {
        String url = store.get(CredentialStore.CANVAS_URL);
        return url == null ? null : normalizeUrl(url);
    }

    private String promptForUrl() {
        while (true) {
            String entered = prompts.askCanvasUrl();
            if (entered == null) return null;
            String url = normalizeUrl(entered);
            if (url != null) return url;
            prompts.showInvalidUrl(entered);
        }
    }

    /** @return the URL without trailing slashes, or null unless it starts with http:// or https:// */
    static String normalizeUrl(String raw) {
        if (raw == null) return null;
        String url = raw.trim();
        if (!(url.startsWith("http://") || url.startsWith("https://"))) return null;
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        return url;
    }

    private void putQuietly(String key, String value) {
        try {
            store.put(key, value);
        } catch (CredentialStoreException e) {
            log.warn("{}; continuing without saving", e.getMessage());
        }
    }

    private void deleteQuietly(String key) {
        try {
            store.delete(key);
        } catch (CredentialStoreException e) {
            log.warn(e.getMessage());
        }
    }
}
