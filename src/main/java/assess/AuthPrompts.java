package assess;

/** User interaction needed while signing in to Canvas. Swing in the app, scripted in tests. */
public interface AuthPrompts {

    /** @return the text typed, or null when cancelled */
    String askCanvasUrl();

    void showInvalidUrl(String entered);

    /** Shows the token instructions for the given Canvas URL. @return the token, or null when cancelled */
    String askToken(String canvasUrl);

    /** Called after a token was rejected. @return true to forget the saved URL and start over */
    boolean askChangeUrl();
}
