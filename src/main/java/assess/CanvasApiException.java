package assess;

/** Any failed Canvas call. Status is the HTTP status, or 0 when no response arrived. */
public class CanvasApiException extends RuntimeException {

    private final int status;

    public CanvasApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public CanvasApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    static CanvasApiException forStatus(int status) {
        switch (status) {
            case 401: return new CanvasApiException(status, "Invalid API token or expired session");
            case 403: return new CanvasApiException(status, "Insufficient permissions to access this resource");
            case 404: return new CanvasApiException(status, "Resource not found");
            default:  return new CanvasApiException(status, "HTTP Error: " + status);
        }
    }
}
