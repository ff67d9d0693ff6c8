package assess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A user-defined learning outcome: the assignments that feed it and, per
 * assignment, the parts that count. An assignment with no entry in the parts
 * map counts with its whole score.
 */
public class OutcomeDefinition {

    public final String name;
    public final String description;
    public final double threshold;
    private final List<MergedAssignment> assignments;
    private final Map<Long, List<AssignmentPart>> partsConfig;

    public OutcomeDefinition(String name, String description, double threshold,
                             List<MergedAssignment> assignments, Map<Long, List<AssignmentPart>> partsConfig) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.threshold = threshold;
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        Map<Long, List<AssignmentPart>> copy = new LinkedHashMap<>();
        if (partsConfig != null) {
            partsConfig.forEach((k, v) -> {
                if (v != null && !v.isEmpty()) copy.put(k, List.copyOf(v));
            });
        }
        this.partsConfig = Collections.unmodifiableMap(copy);
    }

    public List<MergedAssignment> assignments() {
        return assignments;
    }

    public Map<Long, List<AssignmentPart>> partsConfig() {
        return partsConfig;
    }

    /** Selected parts of the assignment, empty when the whole assignment counts. */
    public List<AssignmentPart> partsFor(MergedAssignment a) {
        List<AssignmentPart> parts = partsConfig.get(a.id);
        return parts == null ? List.of() : parts;
    }

    public boolean usesRubric(MergedAssignment a) {
        for (AssignmentPart p : partsFor(a)) if (p instanceof AssignmentPart.RubricCriterionPart) return true;
        return false;
    }

    public boolean usesQuizGroups(MergedAssignment a) {
        for (AssignmentPart p : partsFor(a)) if (p instanceof AssignmentPart.QuizGroupPart) return true;
        return false;
    }

    public OutcomeDefinition renamed(String newName, String newDescription, double newThreshold,
                                     List<MergedAssignment> newAssignments) {
        Map<Long, List<AssignmentPart>> kept = new LinkedHashMap<>();
        for (MergedAssignment a : newAssignments) {
            if (partsConfig.containsKey(a.id)) kept.put(a.id, partsConfig.get(a.id));
        }
        return new OutcomeDefinition(newName, newDescription, newThreshold, newAssignments, kept);
    }

    public String displayText() {
        return name + " (" + Numbers.plain(threshold) + "%) - " + assignments.size() + " assignment(s)";
    }

    @Override
    public String toString() {
        return displayText();
    }
}
