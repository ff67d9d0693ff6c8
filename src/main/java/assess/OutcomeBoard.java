package assess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The ordered outcomes being configured for the current course selection. */
public class OutcomeBoard {

    private final List<OutcomeDefinition> outcomes = new ArrayList<>();

    public List<OutcomeDefinition> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    public OutcomeDefinition find(String name) {
        for (OutcomeDefinition o : outcomes) if (o.name.equals(name)) return o;
        return null;
    }

    /** @throws IllegalArgumentException with a message fit for the user */
    public void add(OutcomeDefinition outcome) {
        validate(outcome, null);
        outcomes.add(outcome);
    }

    /** Replaces the outcome named oldName in place, keeping its position. */
    public void replace(String oldName, OutcomeDefinition outcome) {
        int idx = indexOf(oldName);
        if (idx < 0) throw new IllegalArgumentException("Outcome '" + oldName + "' no longer exists.");
        validate(outcome, oldName);
        outcomes.set(idx, outcome);
    }

    public boolean remove(String name) {
        int idx = indexOf(name);
        if (idx < 0) return false;
        outcomes.remove(idx);
        return true;
    }

    public void clear() {
        outcomes.clear();
    }

    public void replaceAll(List<OutcomeDefinition> fresh) {
        OutcomeBoard scratch = new OutcomeBoard();
        for (OutcomeDefinition o : fresh) scratch.add(o);
        outcomes.clear();
        outcomes.addAll(scratch.outcomes);
    }

    private void validate(OutcomeDefinition o, String replacing) {
        if (o.name == null || o.name.isBlank()) {
            throw new IllegalArgumentException("Please enter an outcome name.");
        }
        if (o.assignments().isEmpty()) {
            throw new IllegalArgumentException("Please select at least one assignment.");
        }
        if (Double.isNaN(o.threshold) || o.threshold < 0 || o.threshold > 100) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100.");
        }
        for (OutcomeDefinition existing : outcomes) {
            if (existing.name.equals(o.name) && !existing.name.equals(replacing)) {
                throw new IllegalArgumentException("An outcome named '" + o.name + "' already exists.");
            }
        }
    }

    private int indexOf(String name) {
        for (int i = 0; i < outcomes.size(); i++) {
            if (outcomes.get(i).name.equals(name)) return i;
        }
        return -1;
    }
}
