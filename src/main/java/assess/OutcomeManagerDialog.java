package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JFileChooser;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.ListSelectionModel;
import javax.swing.ProgressMonitor;
import javax.swing.SwingUtilities;
import javax.swing.SwingWorker;
import javax.swing.WindowConstants;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.Window;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/** Outcomes for the loaded sections, plus report generation. */
class OutcomeManagerDialog {

    private static final Logger log = LoggerFactory.getLogger(OutcomeManagerDialog.class);

    private final Window owner;
    private final ReporterSession session;
    private final Supplier<TemplateStore> templates;

    private final DefaultListModel<OutcomeDefinition> model = new DefaultListModel<>();
    private final JList<OutcomeDefinition> list = new JList<>(model);
    private JDialog dlg;

    OutcomeManagerDialog(Window owner, ReporterSession session, Supplier<TemplateStore> templates) {
        this.owner = owner;
        this.session = session;
        this.templates = templates;
    }

    void open() {
        dlg = new JDialog(owner, "Configure Assessment Outcomes", JDialog.DEFAULT_MODALITY_TYPE);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        AssignmentCatalog catalog = session.catalog();
        JPanel root = new JPanel(new BorderLayout(0, 8));
        root.setBackground(UiKit.BACKGROUND);
        root.setBorder(BorderFactory.createEmptyBorder(14, 14, 14, 14));
        root.add(UiKit.ta("Selected " + catalog.courses().size() + " course section(s) with "
                + catalog.assignments().size() + " assignment(s).\n\n"
                + "Create custom outcomes and assign assessments to each one."), BorderLayout.NORTH);

        list.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        list.addMouseListener(new MouseAdapter() {
            @Override
            public void mouseClicked(MouseEvent e) {
                if (e.getClickCount() == 2 && SwingUtilities.isLeftMouseButton(e)) editSelected();
            }
        });
        JScrollPane scroll = new JScrollPane(list);
        scroll.setPreferredSize(new Dimension(720, 340));
        scroll.setBorder(BorderFactory.createTitledBorder("Custom Outcomes"));

        JButton add = UiKit.fancyButton("+ Add Outcome");
        add.addActionListener(e -> {
            if (new OutcomeEditorDialog(dlg, session, null).open()) refresh();
        });
        JButton edit = UiKit.fancyButton("Edit");
        edit.addActionListener(e -> editSelected());
        JButton remove = UiKit.fancyButton("Remove");
        remove.addActionListener(e -> removeSelected());
        JButton loadTemplate = UiKit.fancyButton("Load Template");
        loadTemplate.addActionListener(e -> {
            TemplateStore store = templates.get();
            if (store != null) new TemplateManagerDialog(dlg, session, store, this::refresh).open();
        });

        JPanel center = new JPanel(new BorderLayout());
        center.setOpaque(false);
        center.add(scroll, BorderLayout.CENTER);
        center.add(UiKit.row(add, edit, remove, loadTemplate), BorderLayout.SOUTH);
        root.add(center, BorderLayout.CENTER);

        JButton saveTemplate = UiKit.fancyButton("Save as Template");
        saveTemplate.addActionListener(e -> {
            TemplateStore store = templates.get();
            if (store != null) TemplateManagerDialog.saveCurrent(dlg, session, store);
        });
        JButton generate = UiKit.fancyButton("Generate Report");
        generate.addActionListener(e -> generateReport());
        JButton close = UiKit.fancyButton("Close");
        close.addActionListener(e -> dlg.dispose());
        root.add(UiKit.rightRow(saveTemplate, generate, close), BorderLayout.SOUTH);

        refresh();
        dlg.setContentPane(root);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
    }

    private void refresh() {
        model.clear();
        for (OutcomeDefinition o : session.board().outcomes()) model.addElement(o);
    }

    private void editSelected() {
        OutcomeDefinition o = list.getSelectedValue();
        if (o == null) {
            UiKit.warn(dlg, "No Selection", "Select an outcome to edit.");
            return;
        }
        if (new OutcomeEditorDialog(dlg, session, o).open()) refresh();
    }

    private void removeSelected() {
        OutcomeDefinition o = list.getSelectedValue();
        if (o == null) {
            UiKit.warn(dlg, "No Selection", "Select an outcome to remove.");
            return;
        }
        if (!UiKit.confirm(dlg, "Remove Outcome", "Remove outcome '" + o.name + "'?")) return;
        session.board().remove(o.name);
        refresh();
    }

    // -------------------- report --------------------

    private void generateReport() {
        if (session.board().isEmpty()) {
            UiKit.warn(dlg, "No Outcomes", "Please create at least one outcome before generating a report.");
            return;
        }
        Path target = chooseTarget();
        if (target == null) return;

        List<OutcomeDefinition> outcomes = new ArrayList<>(session.board().outcomes());
        List<CourseInfo> courses = session.catalog().courses();
        ProgressMonitor monitor = new ProgressMonitor(dlg, "Generating report...", "", 0, 100);
        monitor.setMillisToDecideToPopup(0);
        monitor.setMillisToPopup(0);

        new SwingWorker<ReportGenerator.Result, Object>() {
            @Override
            protected ReportGenerator.Result doInBackground() throws ReportException {
                ReportProgress progress = new SwingProgress((percent, label) -> {
                    monitor.setProgress(percent);
                    monitor.setNote(label);
                }, monitor::isCanceled);
                return new ReportGenerator(session.api(), session.config()).generate(outcomes, courses, target, progress);
            }

            @Override
            protected void done() {
                monitor.close();
                ReportGenerator.Result result;
                try {
                    result = get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ReportCancelledException) {
                        log.info("Report generation cancelled");
                        return;
                    }
                    log.error("Report generation failed", cause);
                    UiKit.error(dlg, "Error", "Error generating report:\n" + cause.getMessage());
                    return;
                }
                reportDone(result);
            }
        }.execute();
    }

    private Path chooseTarget() {
        AppConfig cfg = session.config();
        File dir = new File(cfg.outputDirectory);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            log.warn("Output directory {} could not be created", dir);
        }
        JFileChooser fc = new JFileChooser(dir);
        fc.setDialogTitle("Save Report");
        fc.setFileFilter(new FileNameExtensionFilter("Excel Files (*.xlsx)", "xlsx"));
        fc.setSelectedFile(new File(dir, ReportFileNames.defaultName(session.catalog().courses(),
                LocalDateTime.now(), cfg.timestampFiles)));
        if (fc.showSaveDialog(dlg) != JFileChooser.APPROVE_OPTION) return null;
        File f = fc.getSelectedFile();
        if (!f.getName().toLowerCase().endsWith(".xlsx")) f = new File(f.getParentFile(), f.getName() + ".xlsx");
        if (f.exists() && !UiKit.confirm(dlg, "Replace File", f.getName() + " already exists. Replace it?")) {
            return null;
        }
        return Paths.get(f.getAbsolutePath());
    }

    private void reportDone(ReportGenerator.Result result) {
        Path folder = result.workbook.toAbsolutePath().getParent();
        StringBuilder msg = new StringBuilder("Report generated successfully!\n\n")
                .append("File: ").append(result.workbook.getFileName()).append('\n')
                .append("Location: ").append(folder).append('\n');
        if (result.csv != null) msg.append("CSV: ").append(result.csv.getFileName()).append('\n');
        msg.append("Students: ").append(result.students).append('\n')
                .append("Outcomes: ").append(result.outcomes).append("\n\n")
                .append("Would you like to open the report folder?");
        if (!UiKit.confirm(dlg, "Report Generated", msg.toString())) return;
        try {
            DesktopLinks.open(folder.toFile());
        } catch (IOException | RuntimeException e) {
            log.warn("Could not open {}", folder, e);
            UiKit.warn(dlg, "Open Folder", "Could not open " + folder + ":\n" + e.getMessage());
        }
    }
}
