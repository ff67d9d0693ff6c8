package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.Box;
import javax.swing.BoxLayout;
import javax.swing.JButton;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JTextArea;
import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import javax.swing.border.AbstractBorder;
import javax.swing.border.EmptyBorder;
import javax.swing.plaf.basic.BasicButtonUI;
import java.awt.Color;
import java.awt.Component;
import java.awt.Cursor;
import java.awt.FlowLayout;
import java.awt.Font;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.RenderingHints;
import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/** Shared Swing building blocks so every window looks the same. */
final class UiKit {

    private static final Logger log = LoggerFactory.getLogger(UiKit.class);

    static final Color PANTHER_RED = new Color(0x9E1B32);
    static final Color BACKGROUND = Color.WHITE;

    private UiKit() {}

    static void systemLookAndFeel() {
        try {
            UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
        } catch (Exception e) {
            log.debug("System look and feel unavailable: {}", e.toString());
        }
    }

    static JPanel panel() {
        JPanel p = new JPanel();
        p.setLayout(new BoxLayout(p, BoxLayout.Y_AXIS));
        p.setBorder(new EmptyBorder(14, 14, 14, 14));
        p.setBackground(BACKGROUND);
        return p;
    }

    static JLabel h1(String s) {
        JLabel l = new JLabel(s);
        l.setFont(l.getFont().deriveFont(Font.BOLD, 20f));
        l.setAlignmentX(Component.LEFT_ALIGNMENT);
        return l;
    }

    static JLabel lab(String s) {
        JLabel l = new JLabel(s);
        l.setAlignmentX(Component.LEFT_ALIGNMENT);
        return l;
    }

    static JPanel row(Component... c) {
        JPanel r = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));
        r.setOpaque(false);
        r.setAlignmentX(Component.LEFT_ALIGNMENT);
        for (Component x : c) r.add(x);
        return r;
    }

    static JPanel rightRow(Component... c) {
        JPanel r = new JPanel(new FlowLayout(FlowLayout.RIGHT, 10, 6));
        r.setOpaque(false);
        r.setAlignmentX(Component.LEFT_ALIGNMENT);
        for (Component x : c) r.add(x);
        return r;
    }

    static JTextArea ta(String s) {
        JTextArea a = new JTextArea(s);
        a.setLineWrap(true);
        a.setWrapStyleWord(true);
        a.setEditable(false);
        a.setBackground(new Color(252, 253, 255));
        a.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createLineBorder(new Color(225, 230, 240)),
                new EmptyBorder(8, 8, 8, 8)
        ));
        a.setAlignmentX(Component.LEFT_ALIGNMENT);
        return a;
    }

    static Component space(int h) {
        return Box.createVerticalStrut(h);
    }

    /** Light rounded button with consistent padding. */
    static JButton fancyButton(String text) {
        JButton b = new JButton(text);
        b.setUI(new BasicButtonUI());
        b.setBackground(new Color(0xF3D6DB));
        b.setForeground(new Color(0x3A0A13));
        b.setFocusPainted(false);
        b.setCursor(Cursor.getPredefinedCursor(Cursor.HAND_CURSOR));
        b.setOpaque(true);
        b.setBorder(new RoundedBorder(PANTHER_RED));
        return b;
    }

    static void error(Component parent, String title, String message) {
        JOptionPane.showMessageDialog(parent, message, title, JOptionPane.ERROR_MESSAGE);
    }

    static void warn(Component parent, String title, String message) {
        JOptionPane.showMessageDialog(parent, message, title, JOptionPane.WARNING_MESSAGE);
    }

    static void info(Component parent, String title, String message) {
        JOptionPane.showMessageDialog(parent, message, title, JOptionPane.INFORMATION_MESSAGE);
    }

    static boolean confirm(Component parent, String title, String message) {
        return JOptionPane.showConfirmDialog(parent, message, title, JOptionPane.YES_NO_OPTION)
                == JOptionPane.YES_OPTION;
    }

    static void busy(Component c, boolean on) {
        c.setCursor(on ? Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR) : Cursor.getDefaultCursor());
    }

    /**
     * Runs a dialog on the event thread and waits for its answer; runs it in place
     * when already there. Returns null if the waiting thread is interrupted.
     */
    static <T> T onEventThread(Supplier<T> dialog) {
        if (SwingUtilities.isEventDispatchThread()) return dialog.get();
        AtomicReference<T> answer = new AtomicReference<>();
        try {
            SwingUtilities.invokeAndWait(() -> answer.set(dialog.get()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
        return answer.get();
    }

    private static class RoundedBorder extends AbstractBorder {
        private final Color line;

        RoundedBorder(Color line) { this.line = line; }

        @Override
        public void paintBorder(Component c, Graphics g, int x, int y, int w, int h) {
            Graphics2D g2 = (Graphics2D) g.create();
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setColor(line);
            g2.drawRoundRect(x, y, w - 1, h - 1, 14, 14);
            g2.dispose();
        }

        @Override
        public Insets getBorderInsets(Component c) { return new Insets(6, 12, 6, 12); }

        @Override
        public Insets getBorderInsets(Component c, Insets in) { return getBorderInsets(c); }
    }
}
