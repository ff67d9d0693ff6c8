package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JTextArea;
import javax.swing.JTextField;
import javax.swing.ListSelectionModel;
import javax.swing.SwingWorker;
import javax.swing.WindowConstants;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.awt.Window;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;

/** Saved templates: apply, edit, delete, save current outcomes, import and export. */
class TemplateManagerDialog {

    private static final Logger log = LoggerFactory.getLogger(TemplateManagerDialog.class);

    private final Window owner;
    private final ReporterSession session;
    private final TemplateStore store;
    private final Runnable onApplied;

    private final DefaultListModel<CourseTemplate> model = new DefaultListModel<>();
    private final JList<CourseTemplate> list = new JList<>(model);
    private JDialog dlg;

    /** @param onApplied run on the event thread after a template replaced the outcomes; may be null */
    TemplateManagerDialog(Window owner, ReporterSession session, TemplateStore store, Runnable onApplied) {
        this.owner = owner;
        this.session = session;
        this.store = store;
        this.onApplied = onApplied;
    }

    void open() {
        dlg = new JDialog(owner, "Template Manager", JDialog.DEFAULT_MODALITY_TYPE);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        JPanel root = new JPanel(new BorderLayout(0, 8));
        root.setBorder(BorderFactory.createEmptyBorder(14, 14, 14, 14));
        root.setBackground(UiKit.BACKGROUND);
        root.add(UiKit.lab("Saved Templates:"), BorderLayout.NORTH);

        list.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        JScrollPane scroll = new JScrollPane(list);
        scroll.setPreferredSize(new Dimension(760, 420));
        root.add(scroll, BorderLayout.CENTER);

        JButton apply = UiKit.fancyButton("Apply Template");
        apply.addActionListener(e -> applySelected());
        JButton edit = UiKit.fancyButton("Edit Template");
        edit.addActionListener(e -> editSelected());
        JButton delete = UiKit.fancyButton("Delete Template");
        delete.addActionListener(e -> deleteSelected());
        JButton save = UiKit.fancyButton("Save Current as Template");
        save.addActionListener(e -> {
            if (saveCurrent(dlg, session, store)) refresh();
        });
        JButton imp = UiKit.fancyButton("Import...");
        imp.addActionListener(e -> importTemplate());
        JButton exp = UiKit.fancyButton("Export...");
        exp.addActionListener(e -> exportSelected());
        JButton close = UiKit.fancyButton("Close");
        close.addActionListener(e -> dlg.dispose());

        JPanel buttons = UiKit.panel();
        buttons.setBorder(BorderFactory.createEmptyBorder());
        buttons.add(UiKit.row(apply, edit, delete, save));
        buttons.add(UiKit.row(imp, exp));
        buttons.add(UiKit.rightRow(close));
        root.add(buttons, BorderLayout.SOUTH);

        refresh();
        dlg.setContentPane(root);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
    }

    private void refresh() {
        model.clear();
        try {
            for (CourseTemplate t : store.list()) model.addElement(t);
        } catch (IOException e) {
            log.error("Listing templates in {} failed", store.directory(), e);
            UiKit.error(dlg, "Templates", "Could not read templates:\n" + e.getMessage());
        }
    }

    private CourseTemplate selected(String verb) {
        CourseTemplate t = list.getSelectedValue();
        if (t == null) UiKit.warn(dlg, "No Selection", "Select a template to " + verb + ".");
        return t;
    }

    // -------------------- actions --------------------

    private void applySelected() {
        CourseTemplate t = selected("apply");
        if (t == null) return;
        AssignmentCatalog catalog = session.catalog();
        if (catalog.isEmpty()) {
            UiKit.warn(dlg, "No Assignments", "Select course sections and load their assignments first.");
            return;
        }
        if (!UiKit.confirm(dlg, "Apply Template", "Apply template '" + t.templateName + "'?\n"
                + "This will replace current outcome configuration.")) {
            return;
        }

        UiKit.busy(dlg, true);
        new SwingWorker<List<OutcomeDefinition>, Void>() {
            @Override
            protected List<OutcomeDefinition> doInBackground() {
                return new TemplateApplier(session.discovery()).apply(t, catalog);
            }

            @Override
            protected void done() {
                UiKit.busy(dlg, false);
                try {
                    session.board().replaceAll(get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    log.error("Applying template '{}' failed", t.templateName, e.getCause());
                    UiKit.error(dlg, "Error", "Could not apply template:\n" + e.getCause().getMessage());
                    return;
                } catch (IllegalArgumentException e) {
                    UiKit.error(dlg, "Error", "Could not apply template:\n" + e.getMessage());
                    return;
                }
                if (onApplied != null) onApplied.run();
                UiKit.info(dlg, "Template Applied",
                        "Loaded " + session.board().size() + " outcomes from template.");
            }
        }.execute();
    }

    private void editSelected() {
        CourseTemplate t = selected("edit");
        if (t == null) return;

        JTextField name = new JTextField(t.templateName, 28);
        JTextField code = new JTextField(t.courseCode, 28);
        JTextArea notes = new JTextArea(t.notes, 4, 28);
        notes.setLineWrap(true);
        if (!showForm("Edit Template: " + t.templateName, name, code, notes, "Save")) return;

        String newName = name.getText().trim();
        String newCode = code.getText().trim();
        if (newName.isEmpty() || newCode.isEmpty()) {
            UiKit.warn(dlg, "Missing Name", "Enter a template name and course code.");
            return;
        }
        String oldName = t.templateName;
        String oldCode = t.courseCode;
        try {
            boolean moved = !TemplateStore.fileName(oldCode, oldName).equals(TemplateStore.fileName(newCode, newName));
            if (moved && store.get(newCode, newName) != null
                    && !UiKit.confirm(dlg, "Template Exists",
                    "A template named '" + newName + "' already exists. Overwrite it?")) {
                return;
            }
            t.templateName = newName;
            t.courseCode = newCode;
            t.notes = notes.getText();
            store.update(oldCode, oldName, t);
            UiKit.info(dlg, "Saved", "Template updated.");
        } catch (IOException e) {
            log.error("Updating template '{}' failed", oldName, e);
            UiKit.error(dlg, "Error", "Could not update template:\n" + e.getMessage());
        }
        refresh();
    }

    private void deleteSelected() {
        CourseTemplate t = selected("delete");
        if (t == null) return;
        if (!UiKit.confirm(dlg, "Delete Template", "Delete template '" + t.templateName + "'?")) return;
        try {
            if (store.delete(t.courseCode, t.templateName)) UiKit.info(dlg, "Deleted", "Template deleted.");
            else UiKit.warn(dlg, "Error", "Could not delete template.");
        } catch (IOException e) {
            log.error("Deleting template '{}' failed", t.templateName, e);
            UiKit.warn(dlg, "Error", "Could not delete template.\n" + e.getMessage());
        }
        refresh();
    }

    private void importTemplate() {
        JFileChooser fc = jsonChooser();
        if (fc.showOpenDialog(dlg) != JFileChooser.APPROVE_OPTION) return;
        try {
            CourseTemplate t = store.importFrom(fc.getSelectedFile().toPath());
            UiKit.info(dlg, "Imported", "Template '" + t.templateName + "' imported.");
        } catch (IOException e) {
            log.warn("Import of {} failed", fc.getSelectedFile(), e);
            UiKit.error(dlg, "Import Failed", e.getMessage());
        }
        refresh();
    }

    private void exportSelected() {
        CourseTemplate t = selected("export");
        if (t == null) return;
        JFileChooser fc = jsonChooser();
        fc.setSelectedFile(new File(TemplateStore.fileName(t.courseCode, t.templateName)));
        if (fc.showSaveDialog(dlg) != JFileChooser.APPROVE_OPTION) return;
        Path target = fc.getSelectedFile().toPath();
        try {
            store.exportTo(t, target);
            UiKit.info(dlg, "Exported", "Template exported to:\n" + target);
        } catch (IOException e) {
            log.error("Export to {} failed", target, e);
            UiKit.error(dlg, "Export Failed", e.getMessage());
        }
    }

    // -------------------- shared forms --------------------

    /**
     * Asks for a name, course code and notes and saves the session's outcomes as a template.
     * @return true when a template was written
     */
    static boolean saveCurrent(Window parent, ReporterSession session, TemplateStore store) {
        if (session.board().isEmpty()) {
            UiKit.warn(parent, "No Outcomes", "Please create at least one outcome before saving a template.");
            return false;
        }
        JTextField name = new JTextField(28);
        name.setToolTipText("e.g., Standard Assessment");
        JTextField code = new JTextField(TemplateMapper.defaultCourseCode(session.catalog()), 28);
        JTextArea notes = new JTextArea(4, 28);
        notes.setLineWrap(true);
        notes.setToolTipText("Optional notes about this template...");
        if (!form(parent, "Save as Template", name, code, notes, "Save")) return false;

        String templateName = name.getText().trim();
        String courseCode = code.getText().trim();
        if (templateName.isEmpty()) {
            UiKit.warn(parent, "Missing Name", "Enter a template name.");
            return false;
        }
        if (courseCode.isEmpty()) courseCode = "UNKNOWN";

        try {
            if (store.get(courseCode, templateName) != null
                    && !UiKit.confirm(parent, "Template Exists",
                    "A template named '" + templateName + "' already exists. Overwrite it?")) {
                return false;
            }
            CourseTemplate t = TemplateMapper.fromOutcomes(templateName, courseCode, notes.getText(),
                    session.userName(), session.board().outcomes(), LocalDateTime.now());
            Path saved = store.save(t);
            UiKit.info(parent, "Template Saved",
                    "Template '" + templateName + "' has been saved successfully!\n\nLocation: " + saved);
            return true;
        } catch (IOException e) {
            log.error("Saving template '{}' failed", templateName, e);
            UiKit.error(parent, "Error Saving Template", "Failed to save template: " + e.getMessage());
            return false;
        }
    }

    private boolean showForm(String title, JTextField name, JTextField code, JTextArea notes, String okText) {
        return form(dlg, title, name, code, notes, okText);
    }

    private static boolean form(Window parent, String title, JTextField name, JTextField code,
                                JTextArea notes, String okText) {
        JDialog d = new JDialog(parent, title, JDialog.DEFAULT_MODALITY_TYPE);
        d.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        JPanel grid = new JPanel(new GridBagLayout());
        grid.setOpaque(false);
        GridBagConstraints c = new GridBagConstraints();
        c.insets = new Insets(4, 4, 4, 4);
        c.anchor = GridBagConstraints.NORTHWEST;
        c.fill = GridBagConstraints.HORIZONTAL;
        addRow(grid, c, 0, "Template Name:", name);
        addRow(grid, c, 1, "Course Code:", code);
        addRow(grid, c, 2, "Notes:", new JScrollPane(notes));

        boolean[] ok = {false};
        JButton cancel = UiKit.fancyButton("Cancel");
        cancel.addActionListener(e -> d.dispose());
        JButton save = UiKit.fancyButton(okText);
        save.addActionListener(e -> {
            ok[0] = true;
            d.dispose();
        });

        JPanel root = UiKit.panel();
        grid.setAlignmentX(Component.LEFT_ALIGNMENT);
        root.add(grid);
        root.add(UiKit.rightRow(cancel, save));
        d.setContentPane(root);
        d.getRootPane().setDefaultButton(save);
        d.pack();
        d.setLocationRelativeTo(parent);
        d.setVisible(true);
        return ok[0];
    }

    private static void addRow(JPanel grid, GridBagConstraints c, int y, String label, Component field) {
        c.gridy = y;
        c.gridx = 0;
        c.weightx = 0;
        grid.add(new JLabel(label), c);
        c.gridx = 1;
        c.weightx = 1;
        grid.add(field, c);
    }

    private static JFileChooser jsonChooser() {
        JFileChooser fc = new JFileChooser();
        fc.setFileFilter(new FileNameExtensionFilter("Template files (*.json)", "json"));
        return fc;
    }
}
