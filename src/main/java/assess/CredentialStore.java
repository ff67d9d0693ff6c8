package assess;

/** Small key/value secret store for the Canvas URL and API token. */
public interface CredentialStore {

    String SERVICE = "PantherAssessment";
    String CANVAS_URL = "canvas_url";
    String CANVAS_TOKEN = "canvas_token";

    /** @return the stored value, or null when nothing is stored under the key */
    String get(String key);

    void put(String key, String value);

    void delete(String key);
}
