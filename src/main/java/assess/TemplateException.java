package assess;

import java.io.IOException;

public class TemplateException extends IOException {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
