package assess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A scorable piece of an assignment: one rubric criterion, one quiz question
 * group, or every question of a quiz. Per-course ids are kept because each
 * section has its own copy of the assignment.
 */
public interface AssignmentPart {

    String displayText();

    final class RubricCriterionPart implements AssignmentPart {
        public final String description;
        public final double points;
        private final Map<Long, String> criterionIdsByCourse;

        public RubricCriterionPart(String description, double points, Map<Long, String> criterionIdsByCourse) {
            this.description = description;
            this.points = points;
            this.criterionIdsByCourse = Collections.unmodifiableMap(new LinkedHashMap<>(criterionIdsByCourse));
        }

        public Map<Long, String> criterionIdsByCourse() {
            return criterionIdsByCourse;
        }

        public String criterionIdFor(long courseId) {
            return criterionIdsByCourse.get(courseId);
        }

        @Override
        public String displayText() {
            return description + " (" + Numbers.plain(points) + " pts) - " + criterionIdsByCourse.size() + " course(s)";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RubricCriterionPart)) return false;
            RubricCriterionPart other = (RubricCriterionPart) o;
            return description.equals(other.description) && criterionIdsByCourse.equals(other.criterionIdsByCourse);
        }

        @Override
        public int hashCode() {
            return Objects.hash(description, criterionIdsByCourse);
        }

        @Override
        public String toString() {
            return displayText();
        }
    }

    final class QuizGroupPart implements AssignmentPart {
        public final String groupName;
        private final Map<Long, Long> groupIdsByCourse;
        private final Map<Long, Integer> pickCountByCourse;
        private final Map<Long, Double> questionPointsByCourse;

        public QuizGroupPart(String groupName, Map<Long, Long> groupIdsByCourse,
                             Map<Long, Integer> pickCountByCourse, Map<Long, Double> questionPointsByCourse) {
            this.groupName = groupName;
            this.groupIdsByCourse = Collections.unmodifiableMap(new LinkedHashMap<>(groupIdsByCourse));
            this.pickCountByCourse = Collections.unmodifiableMap(new LinkedHashMap<>(pickCountByCourse));
            this.questionPointsByCourse = Collections.unmodifiableMap(new LinkedHashMap<>(questionPointsByCourse));
        }

        public Map<Long, Long> groupIdsByCourse() {
            return groupIdsByCourse;
        }

        public Long groupIdFor(long courseId) {
            return groupIdsByCourse.get(courseId);
        }

        public double questionPointsFor(long courseId) {
            Double v = questionPointsByCourse.get(courseId);
            return v == null ? 0.0 : v;
        }

        public int pickCountFor(long courseId) {
            Integer v = pickCountByCourse.get(courseId);
            return v == null ? 0 : v;
        }

        @Override
        public String displayText() {
            int pick = 0;
            double pts = 0;
            if (!groupIdsByCourse.isEmpty()) {
                long first = groupIdsByCourse.keySet().iterator().next();
                pick = pickCountFor(first);
                pts = questionPointsFor(first);
            }
            return groupName + " (" + pick + " questions, " + Numbers.plain(pts) + " pts each) - "
                    + groupIdsByCourse.size() + " course(s)";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof QuizGroupPart)) return false;
            QuizGroupPart other = (QuizGroupPart) o;
            return groupName.equals(other.groupName) && groupIdsByCourse.equals(other.groupIdsByCourse);
        }

        @Override
        public int hashCode() {
            return Objects.hash(groupName, groupIdsByCourse);
        }

        @Override
        public String toString() {
            return displayText();
        }
    }

    /** A quiz without question groups: the whole quiz score counts. */
    final class AllQuestionsPart implements AssignmentPart {
        public static final AllQuestionsPart INSTANCE = new AllQuestionsPart();

        private AllQuestionsPart() {}

        @Override
        public String displayText() {
            return "All Questions";
        }

        @Override
        public String toString() {
            return displayText();
        }
    }
}
