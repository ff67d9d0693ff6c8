package assess;

import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JPasswordField;
import javax.swing.JTextField;
import javax.swing.WindowConstants;
import java.awt.Font;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/** Modal dialogs for the Canvas URL and API token. Safe to call from a worker thread. */
class SwingAuthPrompts implements AuthPrompts {

    private final JFrame owner;

    SwingAuthPrompts(JFrame owner) {
        this.owner = owner;
    }

    @Override
    public String askCanvasUrl() {
        return UiKit.onEventThread(this::urlDialog);
    }

    @Override
    public void showInvalidUrl(String entered) {
        UiKit.onEventThread(() -> {
            UiKit.warn(owner, "Invalid URL", "Please enter a valid URL starting with http:// or https://");
            return null;
        });
    }

    @Override
    public String askToken(String canvasUrl) {
        return UiKit.onEventThread(() -> tokenDialog(canvasUrl));
    }

    @Override
    public boolean askChangeUrl() {
        Boolean change = UiKit.onEventThread(() -> UiKit.confirm(owner, "Authentication Failed",
                "Could not connect to Canvas. This could be due to:\n"
                        + "  - Invalid API token\n"
                        + "  - Incorrect Canvas URL\n\n"
                        + "Would you like to change the Canvas URL?"));
        return change != null && change;
    }

    private String urlDialog() {
        JDialog dlg = new JDialog(owner, "Canvas URL Setup", true);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        JPanel root = UiKit.panel();
        root.add(UiKit.ta("""
            Welcome to Panther Assessment!

            Please enter your institution's Canvas URL.
            Example: https://fit.instructure.com
            """));
        JTextField url = new JTextField("https://", 32);
        root.add(UiKit.row(new JLabel("Canvas URL:"), url));

        AtomicReference<String> result = new AtomicReference<>();
        JButton cancel = UiKit.fancyButton("Cancel");
        JButton ok = UiKit.fancyButton("Continue");
        cancel.addActionListener(e -> dlg.dispose());
        ok.addActionListener(e -> {
            result.set(url.getText());
            dlg.dispose();
        });
        url.addActionListener(e -> ok.doClick());
        root.add(UiKit.rightRow(cancel, ok));

        dlg.setContentPane(root);
        dlg.getRootPane().setDefaultButton(ok);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
        return result.get();
    }

    private String tokenDialog(String canvasUrl) {
        JDialog dlg = new JDialog(owner, "Canvas API Token Setup", true);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        JPanel root = UiKit.panel();
        JLabel title = UiKit.h1("First Time Setup");
        title.setFont(title.getFont().deriveFont(Font.BOLD, 16f));
        root.add(title);
        root.add(UiKit.space(8));
        root.add(UiKit.lab("<html><b>Create a Canvas API token that will log you in to Canvas automatically</b><br><br>"
                + "<b>Step 1:</b> Click 'Open Canvas Settings' below<br>"
                + "<b>Step 2:</b> In Canvas, scroll down to <b>Approved Integrations</b><br>"
                + "<b>Step 3:</b> Click <b>+ New Access Token</b><br>"
                + "<b>Step 4:</b> Purpose: <b>Panther Assessment</b><br>"
                + "<b>Step 5:</b> Leave expiration blank (never expires)<br>"
                + "<b>Step 6:</b> Click <b>Generate Token</b><br>"
                + "<b>Step 7:</b> Copy the token and paste below<br><br>"
                + "<i>You only need to do this once. Your token is saved in the system keychain.</i></html>"));
        root.add(UiKit.space(8));

        JButton open = UiKit.fancyButton("Open Canvas Settings");
        open.addActionListener(e -> {
            try {
                DesktopLinks.browse(canvasUrl + "/profile/settings");
            } catch (IOException | RuntimeException ex) {
                UiKit.warn(dlg, "Browser", "Could not open a browser: " + ex.getMessage()
                        + "\nOpen " + canvasUrl + "/profile/settings manually.");
            }
        });
        root.add(UiKit.row(open));

        JPasswordField token = new JPasswordField(36);
        root.add(UiKit.row(new JLabel("Paste your API token:"), token));

        AtomicReference<String> result = new AtomicReference<>();
        JButton cancel = UiKit.fancyButton("Cancel");
        JButton save = UiKit.fancyButton("Save Token");
        cancel.addActionListener(e -> dlg.dispose());
        save.addActionListener(e -> {
            String t = new String(token.getPassword()).trim();
            if (t.isEmpty()) {
                UiKit.warn(dlg, "No Token", "Please enter your API token.");
                return;
            }
            result.set(t);
            dlg.dispose();
        });
        token.addActionListener(e -> save.doClick());
        root.add(UiKit.rightRow(cancel, save));

        dlg.setContentPane(root);
        dlg.getRootPane().setDefaultButton(save);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
        return result.get();
    }
}
