package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JTabbedPane;
import javax.swing.ListSelectionModel;
import javax.swing.SwingWorker;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.Window;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * One tab per selected assignment listing its rubric criteria and quiz question
 * groups. Parts already chosen for the outcome are pre-selected.
 */
class PartsDialog {

    private static final Logger log = LoggerFactory.getLogger(PartsDialog.class);

    /** What Canvas offers for one assignment. */
    static final class Available {
        final List<AssignmentPart.RubricCriterionPart> criteria;
        final List<AssignmentPart> quizGroups;

        Available(List<AssignmentPart.RubricCriterionPart> criteria, List<AssignmentPart> quizGroups) {
            this.criteria = criteria;
            this.quizGroups = quizGroups;
        }

        boolean isEmpty() {
            return criteria.isEmpty() && quizGroups.isEmpty();
        }
    }

    private final Window owner;
    private final PartsDiscovery discovery;
    private final List<MergedAssignment> assignments;
    private final Map<Long, List<AssignmentPart>> current;

    PartsDialog(Window owner, PartsDiscovery discovery, List<MergedAssignment> assignments,
                Map<Long, List<AssignmentPart>> current) {
        this.owner = owner;
        this.discovery = discovery;
        this.assignments = assignments;
        this.current = current;
    }

    /**
     * Discovers parts in the background, then shows the dialog.
     * @param onSaved receives the new parts map (assignment id -> selected parts) when the user saves
     */
    void open(Consumer<Map<Long, List<AssignmentPart>>> onSaved) {
        UiKit.busy(owner, true);
        new SwingWorker<Map<Long, Available>, Void>() {
            @Override
            protected Map<Long, Available> doInBackground() {
                return discoverAll(discovery, assignments);
            }

            @Override
            protected void done() {
                UiKit.busy(owner, false);
                Map<Long, Available> found;
                try {
                    found = get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    log.error("Discovering assignment parts failed", e.getCause());
                    UiKit.error(owner, "Error", "Could not load assignment parts:\n" + e.getCause().getMessage());
                    return;
                }
                show(found, onSaved);
            }
        }.execute();
    }

    static Map<Long, Available> discoverAll(PartsDiscovery discovery, List<MergedAssignment> assignments) {
        Map<Long, Available> out = new LinkedHashMap<>();
        for (MergedAssignment a : assignments) {
            List<AssignmentPart.RubricCriterionPart> criteria =
                    discovery.hasRubric(a) ? discovery.discoverRubricCriteria(a) : List.of();
            List<AssignmentPart> groups =
                    discovery.hasQuiz(a) ? discovery.discoverQuizGroups(a) : List.of();
            out.put(a.id, new Available(criteria, groups));
        }
        return out;
    }

    private void show(Map<Long, Available> found, Consumer<Map<Long, List<AssignmentPart>>> onSaved) {
        JDialog dlg = new JDialog(owner, "Configure Assignment Parts", JDialog.DEFAULT_MODALITY_TYPE);
        dlg.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);

        JPanel root = new JPanel(new BorderLayout(0, 8));
        root.setBorder(BorderFactory.createEmptyBorder(14, 14, 14, 14));
        root.setBackground(UiKit.BACKGROUND);
        root.add(UiKit.ta("Select specific parts of each assignment to include.\n"
                + "For quizzes: select question groups\n"
                + "For papers: select rubric criteria"), BorderLayout.NORTH);

        JTabbedPane tabs = new JTabbedPane();
        Map<Long, List<JList<AssignmentPart>>> lists = new LinkedHashMap<>();
        for (MergedAssignment a : assignments) {
            Available av = found.get(a.id);
            JPanel tab = UiKit.panel();
            List<JList<AssignmentPart>> tabLists = new ArrayList<>();
            if (av == null || av.isEmpty()) {
                tab.add(UiKit.lab("<html>This assignment doesn't have quizzes or rubrics.<br>"
                        + "The entire assignment will be used.</html>"));
            } else {
                List<AssignmentPart> saved = current.getOrDefault(a.id, List.of());
                if (!av.criteria.isEmpty()) {
                    tab.add(UiKit.lab("Select rubric criteria to include:"));
                    tabLists.add(addList(tab, new ArrayList<>(av.criteria), saved));
                }
                if (!av.quizGroups.isEmpty()) {
                    tab.add(UiKit.space(8));
                    tab.add(UiKit.lab("Select question groups to include:"));
                    tabLists.add(addList(tab, av.quizGroups, saved));
                }
            }
            lists.put(a.id, tabLists);
            tabs.addTab(shortTitle(a.name), tab);
        }
        tabs.setPreferredSize(new Dimension(700, 420));
        root.add(tabs, BorderLayout.CENTER);

        JButton close = UiKit.fancyButton("Close");
        close.addActionListener(e -> dlg.dispose());
        JButton save = UiKit.fancyButton("Save Configuration");
        save.addActionListener(e -> {
            Map<Long, List<AssignmentPart>> result = new LinkedHashMap<>();
            lists.forEach((id, ls) -> {
                List<AssignmentPart> chosen = new ArrayList<>();
                for (JList<AssignmentPart> l : ls) chosen.addAll(l.getSelectedValuesList());
                if (!chosen.isEmpty()) result.put(id, chosen);
            });
            dlg.dispose();
            onSaved.accept(result);
        });
        root.add(UiKit.rightRow(close, save), BorderLayout.SOUTH);

        dlg.setContentPane(root);
        dlg.pack();
        dlg.setLocationRelativeTo(owner);
        dlg.setVisible(true);
    }

    private static JList<AssignmentPart> addList(JPanel tab, List<AssignmentPart> parts, List<AssignmentPart> saved) {
        DefaultListModel<AssignmentPart> model = new DefaultListModel<>();
        for (AssignmentPart p : parts) model.addElement(p);
        JList<AssignmentPart> list = new JList<>(model);
        list.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        List<Integer> pre = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) if (isSaved(parts.get(i), saved)) pre.add(i);
        list.setSelectedIndices(pre.stream().mapToInt(Integer::intValue).toArray());
        JScrollPane scroll = new JScrollPane(list);
        scroll.setAlignmentX(Component.LEFT_ALIGNMENT);
        tab.add(scroll);
        return list;
    }

    /** Matches by criterion description / group name, so parts discovered again still pre-select. */
    static boolean isSaved(AssignmentPart part, List<AssignmentPart> saved) {
        for (AssignmentPart s : saved) {
            if (part instanceof AssignmentPart.RubricCriterionPart && s instanceof AssignmentPart.RubricCriterionPart) {
                if (((AssignmentPart.RubricCriterionPart) part).description
                        .equals(((AssignmentPart.RubricCriterionPart) s).description)) return true;
            } else if (part instanceof AssignmentPart.QuizGroupPart && s instanceof AssignmentPart.QuizGroupPart) {
                if (((AssignmentPart.QuizGroupPart) part).groupName
                        .equals(((AssignmentPart.QuizGroupPart) s).groupName)) return true;
            } else if (part == AssignmentPart.AllQuestionsPart.INSTANCE && s == part) {
                return true;
            }
        }
        return false;
    }

    private static String shortTitle(String name) {
        return name.length() > 30 ? name.substring(0, 30) + "..." : name;
    }
}
