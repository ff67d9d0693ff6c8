package assess;

public class CredentialStoreException extends RuntimeException {
    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
