package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds outcomes from a template against the currently loaded assignments.
 * Excluded outcomes and assignments are skipped, and an outcome none of whose
 * assignments exist in the selection is dropped.
 */
public class TemplateApplier {

    private static final Logger log = LoggerFactory.getLogger(TemplateApplier.class);

    private final PartsDiscovery discovery;

    public TemplateApplier(PartsDiscovery discovery) {
        this.discovery = discovery;
    }

    public List<OutcomeDefinition> apply(CourseTemplate template, AssignmentCatalog catalog) {
        List<OutcomeDefinition> out = new ArrayList<>();
        for (CourseTemplate.Outcome to : template.outcomes) {
            if (!to.included) continue;

            List<MergedAssignment> matched = new ArrayList<>();
            Map<Long, List<AssignmentPart>> parts = new LinkedHashMap<>();
            for (CourseTemplate.Assignment ta : to.assignments) {
                if (!ta.included) continue;
                MergedAssignment a = catalog.byName(ta.name);
                if (a == null) {
                    log.info("Template assignment '{}' not found in the selected courses", ta.name);
                    continue;
                }
                if (matched.contains(a)) continue;
                matched.add(a);

                List<String> groups = new ArrayList<>();
                for (CourseTemplate.QuestionGroup g : ta.questionGroups) if (g.selected) groups.add(g.name);
                List<String> criteria = new ArrayList<>();
                for (CourseTemplate.RubricCriterion c : ta.rubricCriteria) if (c.selected) criteria.add(c.description);
                if (groups.isEmpty() && criteria.isEmpty()) continue;

                List<AssignmentPart> found = discovery.rediscover(a, groups, criteria);
                if (!found.isEmpty()) parts.put(a.id, found);
            }

            if (matched.isEmpty()) {
                log.info("Outcome '{}' skipped: none of its assignments are in the selection", to.title);
                continue;
            }
            out.add(new OutcomeDefinition(to.title, to.description, to.threshold, matched, parts));
        }
        log.info("Applied template '{}': {} outcome(s)", template.templateName, out.size());
        return out;
    }
}
