package assess;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Canvas REST payloads. Field names map to the snake_case keys Canvas sends;
 * anything we do not read is ignored.
 */
public final class CanvasModel {

    private CanvasModel() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Course {
        public Long id;
        public String name;
        public String courseCode;
        public Term term;
        public Integer totalStudents;

        public String termName() {
            return term == null ? null : term.name;
        }

        public String displayText() {
            String t = termName();
            return ns(name) + " (" + (t == null || t.isBlank() ? "No Term" : t) + ")";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Term {
        public Long id;
        public String name;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Account {
        public Long id;
        public String name;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {
        public Long id;
        public String name;
        public String sortableName;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Enrollment {
        public Long id;
        public Long userId;
        public Long courseId;
        public Long courseSectionId;
        public User user;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Assignment {
        public Long id;
        public Long courseId;
        public String name;
        public Double pointsPossible;
        public Long quizId;
        public Boolean isQuizAssignment;
        public List<String> submissionTypes;
        public List<RubricCriterion> rubric;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RubricCriterion {
        public String id;
        public String description;
        public Double points;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Submission {
        public Long id;
        public Long userId;
        public Double score;
        public String workflowState;
        /** criterion id -> rating */
        public Map<String, RubricRating> rubricAssessment;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RubricRating {
        public Double points;
        public String comments;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuizQuestion {
        public Long id;
        public Long quizGroupId;
        public String questionName;
        public Double pointsPossible;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuizGroup {
        public Long id;
        public String name;
        public Integer pickCount;
        public Double questionPoints;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuizSubmission {
        public Long id;
        public Long userId;
        public Long quizId;
        public String workflowState;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuizSubmissionQuestion {
        public Long id;
        public Long quizGroupId;
        /** Canvas sends a boolean, and some instances the string "true". */
        public Object correct;

        public boolean answeredCorrectly() {
            return Boolean.TRUE.equals(correct) || "true".equals(correct);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Outcome {
        public Long id;
        public String title;
        public String description;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutcomeLink {
        public Outcome outcome;
    }

    private static String ns(String s) { return s == null ? "" : s; }
}
