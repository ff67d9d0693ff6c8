package assess;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSpinner;
import javax.swing.JTextField;
import javax.swing.ListSelectionModel;
import javax.swing.SpinnerNumberModel;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.awt.Window;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Add or edit one outcome: name, description, threshold, assignments and their parts. */
class OutcomeEditorDialog {

    private final Window owner;
    private final ReporterSession session;
    private final OutcomeDefinition existing;

    private final JTextField name = new JTextField(30);
    private final JTextField description = new JTextField(30);
    private final JSpinner threshold;
    private final DefaultListModel<MergedAssignment> model = new DefaultListModel<>();
    private final JList<MergedAssignment> assignmentList = new JList<>(model);
    private Map<Long, List<AssignmentPart>> parts = new LinkedHashMap<>();
    private JDialog dlg;

    /** @param existing the outcome being edited, or null to add a new one */
    OutcomeEditorDialog(Window owner, ReporterSession session, OutcomeDefinition existing) {
        this.owner = owner;
        this.session = session;
        this.existing = existing;
        double start = existing != null ? existing.threshold : session.config().defaultThreshold;
        this.threshold = new JSpinner(new SpinnerNumberModel(clamp(start), 0.0, 100.0, 1.0));
    }

    /** @return true when the board changed */
    boolean open() {
        dlg = new JDialog(owner, existing == null ? "Add Custom Outcome" : "Edit Outcome",
                JDialog.DEFAULT_MODALITY_TYPE);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        for (MergedAssignment a : session.catalog().assignments()) model.addElement(a);
        assignmentList.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        name.setToolTipText("e.g., Critical Thinking");
        description.setToolTipText("e.g., Student demonstrates critical thinking skills");
        if (existing != null) {
            name.setText(existing.name);
            description.setText(existing.description);
            parts = new LinkedHashMap<>(existing.partsConfig());
            List<Integer> sel = new ArrayList<>();
            for (int i = 0; i < model.size(); i++) {
                if (existing.assignments().contains(model.get(i))) sel.add(i);
            }
            assignmentList.setSelectedIndices(sel.stream().mapToInt(Integer::intValue).toArray());
        }

        JPanel form = new JPanel(new GridBagLayout());
        form.setOpaque(false);
        GridBagConstraints c = new GridBagConstraints();
        c.insets = new Insets(4, 4, 4, 4);
        c.anchor = GridBagConstraints.WEST;
        c.fill = GridBagConstraints.HORIZONTAL;
        c.gridy = 0; c.gridx = 0; form.add(new JLabel("Outcome Name:"), c);
        c.gridx = 1; c.weightx = 1; form.add(name, c);
        c.gridy = 1; c.gridx = 0; c.weightx = 0; form.add(new JLabel("Description:"), c);
        c.gridx = 1; c.weightx = 1; form.add(description, c);
        c.gridy = 2; c.gridx = 0; c.weightx = 0; form.add(new JLabel("Mastery Threshold (%):"), c);
        c.gridx = 1; c.fill = GridBagConstraints.NONE; form.add(threshold, c);

        JPanel center = new JPanel(new BorderLayout(0, 4));
        center.setOpaque(false);
        center.add(new JLabel("Select assignments that contribute to this outcome:"), BorderLayout.NORTH);
        JScrollPane scroll = new JScrollPane(assignmentList);
        scroll.setPreferredSize(new Dimension(620, 300));
        center.add(scroll, BorderLayout.CENTER);
        JButton configure = UiKit.fancyButton("Configure Assignment Parts");
        configure.addActionListener(e -> configureParts());
        center.add(UiKit.row(configure), BorderLayout.SOUTH);

        JButton cancel = UiKit.fancyButton("Cancel");
        cancel.addActionListener(e -> dlg.dispose());
        JButton save = UiKit.fancyButton(existing == null ? "Add Outcome" : "Update Outcome");
        boolean[] changed = {false};
        save.addActionListener(e -> {
            if (saveOutcome()) {
                changed[0] = true;
                dlg.dispose();
            }
        });

        JPanel root = new JPanel(new BorderLayout(0, 8));
        root.setBackground(UiKit.BACKGROUND);
        root.setBorder(BorderFactory.createEmptyBorder(14, 14, 14, 14));
        root.add(form, BorderLayout.NORTH);
        root.add(center, BorderLayout.CENTER);
        root.add(UiKit.rightRow(cancel, save), BorderLayout.SOUTH);

        dlg.setContentPane(root);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
        return changed[0];
    }

    private void configureParts() {
        if (name.getText().isBlank()) {
            UiKit.warn(dlg, "Missing Outcome Name",
                    "Please enter an outcome name first before configuring assignment parts.");
            return;
        }
        List<MergedAssignment> selected = assignmentList.getSelectedValuesList();
        if (selected.isEmpty()) {
            UiKit.warn(dlg, "No Selection", "Please select at least one assignment first.");
            return;
        }
        new PartsDialog(dlg, session.discovery(), selected, parts).open(result -> {
            parts = new LinkedHashMap<>(result);
            UiKit.info(dlg, "Configuration Saved", "Assignment parts configured for outcome '"
                    + name.getText().trim() + "': " + parts.size() + " assignment(s).");
        });
    }

    private boolean saveOutcome() {
        List<MergedAssignment> selected = assignmentList.getSelectedValuesList();
        Map<Long, List<AssignmentPart>> kept = new LinkedHashMap<>();
        for (MergedAssignment a : selected) {
            if (parts.containsKey(a.id)) kept.put(a.id, parts.get(a.id));
        }
        OutcomeDefinition o = new OutcomeDefinition(name.getText().trim(), description.getText().trim(),
                ((Number) threshold.getValue()).doubleValue(), selected, kept);
        try {
            if (existing == null) session.board().add(o);
            else session.board().replace(existing.name, o);
            return true;
        } catch (IllegalArgumentException e) {
            UiKit.warn(dlg, "Invalid Outcome", e.getMessage());
            return false;
        }
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(100, v));
    }
}
