package assess;

import assess.CanvasModel.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListCellRenderer;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JComponent;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JMenu;
import javax.swing.JMenuBar;
import javax.swing.JMenuItem;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JTextField;
import javax.swing.ListSelectionModel;
import javax.swing.SwingConstants;
import javax.swing.SwingWorker;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.Font;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Year;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Main window:
 *  - signs in on start (stored token, or the URL/token dialogs)
 *  - course filters and the multi-select course list
 *  - "Continue with Selected Sections" loads assignments and opens the outcome manager
 */
public class ReporterWindow {

    private static final Logger log = LoggerFactory.getLogger(ReporterWindow.class);

    private final ReporterSession session;
    private final CredentialStore store;
    private final JFrame frame;

    private final JTextField codeField = new JTextField(12);
    private final JComboBox<String> yearBox = new JComboBox<>();
    private final JComboBox<String> semesterBox = new JComboBox<>(new String[]{"", "Fall", "Spring", "Summer"});
    private final DefaultListModel<Course> courseModel = new DefaultListModel<>();
    private final JList<Course> courseList = new JList<>(courseModel);
    private final JLabel selectionInfo = UiKit.lab("No sections selected");
    private final JLabel userLabel = UiKit.lab(" ");

    ReporterWindow(ReporterSession session, CredentialStore store) {
        this.session = session;
        this.store = store;
        this.frame = new JFrame("Panther Assessment");
    }

    /** Entry point from {@link App}; must run on the event dispatch thread. */
    public static void launch(AppConfig cfg) {
        UiKit.systemLookAndFeel();
        ReporterWindow w = new ReporterWindow(new ReporterSession(cfg), CredentialStores.open());
        w.show();
    }

    void show() {
        frame.setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
        frame.setJMenuBar(buildMenu());
        frame.setContentPane(buildContent());
        frame.setSize(900, 680);
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);

        signIn(signedIn -> {
            if (signedIn) {
                searchCourses();
            } else {
                UiKit.error(frame, "Authentication Failed",
                        "Could not authenticate with Canvas. The application will now close.");
                frame.dispose();
                System.exit(1);
            }
        });
    }

    // -------------------- layout --------------------

    private JMenuBar buildMenu() {
        JMenuBar bar = new JMenuBar();
        JMenu menu = new JMenu("User Guide and Settings");
        JMenuItem guide = new JMenuItem("Open User Guide");
        guide.addActionListener(e -> UserGuide.open(frame));
        JMenuItem url = new JMenuItem("Change Canvas URL...");
        url.addActionListener(e -> changeCanvasUrl());
        menu.add(guide);
        menu.addSeparator();
        menu.add(url);
        bar.add(menu);
        return bar;
    }

    private JComponent buildContent() {
        JPanel root = new JPanel(new BorderLayout(0, 10));
        root.setBackground(UiKit.BACKGROUND);
        root.setBorder(BorderFactory.createEmptyBorder(20, 20, 20, 20));

        JPanel header = UiKit.panel();
        header.setBorder(BorderFactory.createEmptyBorder());
        JLabel title = UiKit.h1("Panther Assessment");
        title.setForeground(UiKit.PANTHER_RED);
        header.add(title);
        header.add(UiKit.lab("Canvas Assessment Data Exporter"));
        header.add(userLabel);
        root.add(header, BorderLayout.NORTH);

        yearBox.addItem("");
        int current = Year.now().getValue();
        for (int y = current - 3; y <= current + 1; y++) yearBox.addItem(String.valueOf(y));

        JButton search = UiKit.fancyButton("Search");
        search.addActionListener(e -> searchCourses());
        codeField.addActionListener(e -> searchCourses());
        codeField.setToolTipText("e.g., PSY1411, 1411");
        yearBox.addActionListener(e -> searchCourses());
        semesterBox.addActionListener(e -> searchCourses());

        JPanel filters = UiKit.row(new JLabel("Course Code:"), codeField,
                new JLabel("Year:"), yearBox, new JLabel("Semester:"), semesterBox, search);
        filters.setBorder(BorderFactory.createTitledBorder("Filters"));

        courseList.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        courseList.setCellRenderer(new DefaultListCellRenderer() {
            @Override
            public Component getListCellRendererComponent(JList<?> list, Object value, int index,
                                                          boolean isSelected, boolean cellHasFocus) {
                Object shown = value instanceof Course ? ((Course) value).displayText() : value;
                return super.getListCellRendererComponent(list, shown, index, isSelected, cellHasFocus);
            }
        });
        courseList.addListSelectionListener(e -> {
            if (e.getValueIsAdjusting()) return;
            int n = courseList.getSelectedIndices().length;
            selectionInfo.setText(n == 0 ? "No sections selected" : n + " section(s) selected");
        });

        JButton load = UiKit.fancyButton("Continue with Selected Sections");
        load.addActionListener(e -> loadAssignments());
        JButton templates = UiKit.fancyButton("Manage Templates");
        templates.addActionListener(e -> openTemplates());

        JPanel center = new JPanel(new BorderLayout(0, 6));
        center.setOpaque(false);
        center.setBorder(BorderFactory.createTitledBorder("Course Selection"));
        center.add(filters, BorderLayout.NORTH);
        JScrollPane scroll = new JScrollPane(courseList);
        scroll.setPreferredSize(new Dimension(600, 320));
        center.add(scroll, BorderLayout.CENTER);
        center.add(UiKit.row(load, templates), BorderLayout.SOUTH);
        root.add(center, BorderLayout.CENTER);

        JButton guide = UiKit.fancyButton("User Guide");
        guide.addActionListener(e -> UserGuide.open(frame));
        JButton close = UiKit.fancyButton("Close");
        close.addActionListener(e -> frame.dispose());

        JPanel south = UiKit.panel();
        south.setBorder(BorderFactory.createEmptyBorder());
        selectionInfo.setFont(selectionInfo.getFont().deriveFont(Font.BOLD));
        south.add(selectionInfo);
        JPanel buttons = new JPanel(new BorderLayout());
        buttons.setOpaque(false);
        buttons.setAlignmentX(Component.LEFT_ALIGNMENT);
        buttons.add(UiKit.row(guide), BorderLayout.WEST);
        buttons.add(UiKit.rightRow(close), BorderLayout.EAST);
        south.add(buttons);
        JLabel credit = new JLabel("Developed at Florida Tech", SwingConstants.CENTER);
        credit.setForeground(new Color(0x999999));
        credit.setAlignmentX(Component.LEFT_ALIGNMENT);
        south.add(credit);
        root.add(south, BorderLayout.SOUTH);
        return root;
    }

    // -------------------- actions --------------------

    /** Authenticates off the event thread; the dialogs it needs hop back onto it. */
    private void signIn(Consumer<Boolean> onDone) {
        UiKit.busy(frame, true);
        CanvasAuthenticator auth = new CanvasAuthenticator(store,
                CanvasClient.factory(session.config()), new SwingAuthPrompts(frame));
        new SwingWorker<CanvasApi, Void>() {
            @Override
            protected CanvasApi doInBackground() {
                CanvasApi api = auth.authenticate();
                if (api != null) {
                    session.connect(api);
                    session.userName();
                }
                return api;
            }

            @Override
            protected void done() {
                UiKit.busy(frame, false);
                CanvasApi api;
                try {
                    api = get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    log.error("Signing in to Canvas failed", e.getCause());
                    api = null;
                }
                if (api != null) userLabel.setText("Signed in as " + session.userName());
                onDone.accept(api != null);
            }
        }.execute();
    }

    private void changeCanvasUrl() {
        if (!UiKit.confirm(frame, "Change Canvas URL",
                "This will reset your Canvas URL and require re-authentication.\n\nContinue?")) {
            return;
        }
        new CanvasAuthenticator(store, CanvasClient.factory(session.config()), new SwingAuthPrompts(frame))
                .resetCredentials();
        courseModel.clear();
        signIn(signedIn -> {
            if (signedIn) {
                UiKit.info(frame, "Success", "Canvas URL updated successfully. Reloading courses...");
                searchCourses();
            } else {
                UiKit.error(frame, "Setup Cancelled", "Canvas URL was not changed.");
            }
        });
    }

    private void searchCourses() {
        if (!session.isConnected()) {
            UiKit.warn(frame, "Not Connected", "Please log in first.");
            return;
        }
        CourseFilter filter = new CourseFilter(codeField.getText(),
                (String) yearBox.getSelectedItem(), (String) semesterBox.getSelectedItem());
        UiKit.busy(frame, true);
        new SwingWorker<List<Course>, Void>() {
            @Override
            protected List<Course> doInBackground() {
                return session.findCourses(filter);
            }

            @Override
            protected void done() {
                UiKit.busy(frame, false);
                List<Course> found;
                try {
                    found = get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    log.error("Course search failed", e.getCause());
                    UiKit.error(frame, "Error", "Error fetching courses:\n" + e.getCause().getMessage());
                    return;
                }
                courseModel.clear();
                for (Course c : found) courseModel.addElement(c);
                if (found.isEmpty()) {
                    selectionInfo.setText("No sections selected");
                    UiKit.info(frame, "No Matches", "No courses match your search criteria.");
                } else {
                    selectionInfo.setText("Found " + found.size() + " course(s)");
                }
            }
        }.execute();
    }

    private void loadAssignments() {
        List<Course> selected = courseList.getSelectedValuesList();
        if (selected.isEmpty()) {
            UiKit.warn(frame, "No Selection", "Please select at least one course section.");
            return;
        }
        UiKit.busy(frame, true);
        new SwingWorker<AssignmentCatalog, Void>() {
            @Override
            protected AssignmentCatalog doInBackground() {
                return session.loadAssignments(selected);
            }

            @Override
            protected void done() {
                UiKit.busy(frame, false);
                AssignmentCatalog catalog;
                try {
                    catalog = get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    log.error("Loading assignments failed", e.getCause());
                    UiKit.error(frame, "Error", "Error loading assignments:\n" + e.getCause().getMessage());
                    return;
                }
                if (catalog.isEmpty()) {
                    UiKit.info(frame, "No Assignments", "No assignments found in selected courses.");
                    return;
                }
                new OutcomeManagerDialog(frame, session, ReporterWindow.this::templateStore).open();
            }
        }.execute();
    }

    private void openTemplates() {
        TemplateStore templates = templateStore();
        if (templates == null) return;
        new TemplateManagerDialog(frame, session, templates, null).open();
    }

    /** The user's template store, seeded with bundled templates on first use; null (after a message) when unusable. */
    TemplateStore templateStore() {
        try {
            return new TemplateStore(AppPaths.prepareTemplatesDir(Paths.get(session.config().templatesDirectory)));
        } catch (IOException e) {
            log.error("Templates directory unavailable", e);
            UiKit.error(frame, "Templates", "Could not open the templates folder:\n" + e.getMessage());
            return null;
        }
    }
}
