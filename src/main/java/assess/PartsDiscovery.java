package assess;

import assess.AssignmentPart.AllQuestionsPart;
import assess.AssignmentPart.QuizGroupPart;
import assess.AssignmentPart.RubricCriterionPart;
import assess.CanvasModel.Assignment;
import assess.CanvasModel.QuizGroup;
import assess.CanvasModel.QuizQuestion;
import assess.CanvasModel.RubricCriterion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds the rubric criteria and quiz question groups of a merged assignment.
 * Criteria are matched across sections by description, groups by name.
 */
public class PartsDiscovery {

    private static final Logger log = LoggerFactory.getLogger(PartsDiscovery.class);

    private final CanvasApi api;

    public PartsDiscovery(CanvasApi api) {
        this.api = api;
    }

    public boolean hasQuiz(MergedAssignment a) {
        boolean quizLike = a.quizId != null || a.quizAssignment || a.submissionTypes.contains("online_quiz");
        return quizLike && a.hasAnyQuizId();
    }

    public boolean hasRubric(MergedAssignment a) {
        return !a.rubric.isEmpty();
    }

    public List<RubricCriterionPart> discoverRubricCriteria(MergedAssignment a) {
        return collectCriteria(a, d -> true);
    }

    /** Question groups of every section's quiz; a single {@link AllQuestionsPart} when there are none. */
    public List<AssignmentPart> discoverQuizGroups(MergedAssignment a) {
        Map<String, GroupBuilder> byName = new LinkedHashMap<>();
        for (long cid : a.courseIds()) {
            Long qid = a.quizIdFor(cid);
            if (qid == null) continue;
            List<QuizQuestion> questions = api.getQuizQuestions(cid, qid);
            collectGroups(cid, qid, questions, name -> true, byName);
        }
        List<AssignmentPart> parts = new ArrayList<>();
        for (GroupBuilder b : byName.values()) parts.add(b.build());
        if (parts.isEmpty()) parts.add(AllQuestionsPart.INSTANCE);
        return parts;
    }

    /**
     * Finds the named question groups (exact) and rubric criteria (trimmed,
     * case-insensitive) again in the currently selected sections. Quiz groups
     * come first. Sections that fail to load are skipped.
     */
    public List<AssignmentPart> rediscover(MergedAssignment a, List<String> groupNames, List<String> criterionDescriptions) {
        List<AssignmentPart> parts = new ArrayList<>();

        for (String wanted : groupNames) {
            Map<String, GroupBuilder> byName = new LinkedHashMap<>();
            for (long cid : a.courseIds()) {
                Long qid = a.quizIdFor(cid);
                if (qid == null) qid = a.quizId;
                if (qid == null) continue;
                List<QuizQuestion> questions;
                try {
                    questions = api.getQuizQuestions(cid, qid);
                } catch (CanvasApiException e) {
                    log.warn("Quiz {} in course {} unavailable: {}", qid, cid, e.getMessage());
                    continue;
                }
                collectGroups(cid, qid, questions, wanted::equals, byName);
            }
            for (GroupBuilder b : byName.values()) parts.add(b.build());
        }

        for (String wanted : criterionDescriptions) {
            String key = wanted.trim().toLowerCase(Locale.ROOT);
            parts.addAll(collectCriteria(a, d -> d.trim().toLowerCase(Locale.ROOT).equals(key)));
        }
        return parts;
    }

    private List<RubricCriterionPart> collectCriteria(MergedAssignment a, Predicate<String> accept) {
        Map<String, CriterionBuilder> byDescription = new LinkedHashMap<>();
        for (long cid : a.courseIds()) {
            List<RubricCriterion> rubric;
            try {
                Assignment fetched = api.getAssignment(cid, a.assignmentIdFor(cid));
                rubric = fetched == null || fetched.rubric == null ? List.of() : fetched.rubric;
            } catch (CanvasApiException e) {
                log.warn("Rubric of assignment {} in course {} unavailable ({}); using the first section's rubric",
                        a.name, cid, e.getMessage());
                rubric = a.rubric;
            }
            for (RubricCriterion c : rubric) {
                String description = c.description == null ? "Unnamed Criterion" : c.description.trim();
                if (!accept.test(description)) continue;
                byDescription.computeIfAbsent(description, d -> new CriterionBuilder(d, Numbers.nz(c.points)))
                        .ids.put(cid, c.id);
            }
        }
        List<RubricCriterionPart> out = new ArrayList<>();
        for (CriterionBuilder b : byDescription.values()) out.add(b.build());
        return out;
    }

    private void collectGroups(long cid, long qid, List<QuizQuestion> questions,
                               Predicate<String> accept, Map<String, GroupBuilder> byName) {
        Set<Long> groupIds = new LinkedHashSet<>();
        for (QuizQuestion q : questions) {
            if (q.quizGroupId != null) groupIds.add(q.quizGroupId);
        }
        for (Long gid : groupIds) {
            QuizGroup group;
            try {
                group = api.getQuizGroup(cid, qid, gid);
            } catch (CanvasApiException e) {
                log.warn("Question group {} of quiz {} (course {}) skipped: {}", gid, qid, cid, e.getMessage());
                continue;
            }
            if (group == null) continue;
            String name = group.name == null ? "Group " + gid : group.name;
            if (!accept.test(name)) continue;
            GroupBuilder b = byName.computeIfAbsent(name, GroupBuilder::new);
            b.ids.put(cid, gid);
            b.picks.put(cid, group.pickCount == null ? 0 : group.pickCount);
            b.points.put(cid, Numbers.nz(group.questionPoints));
        }
    }

    private static final class CriterionBuilder {
        final String description;
        final double points;
        final Map<Long, String> ids = new LinkedHashMap<>();

        CriterionBuilder(String description, double points) {
            this.description = description;
            this.points = points;
        }

        RubricCriterionPart build() {
            return new RubricCriterionPart(description, points, ids);
        }
    }

    private static final class GroupBuilder {
        final String name;
        final Map<Long, Long> ids = new LinkedHashMap<>();
        final Map<Long, Integer> picks = new LinkedHashMap<>();
        final Map<Long, Double> points = new LinkedHashMap<>();

        GroupBuilder(String name) {
            this.name = name;
        }

        QuizGroupPart build() {
            return new QuizGroupPart(name, ids, picks, points);
        }
    }
}
