package assess;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Saved outcome configuration that can be re-applied to another semester's
 * sections. Assignments are matched by name, question groups by name and
 * rubric criteria by description, never by Canvas id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CourseTemplate {

    public String templateName;
    public String courseCode;
    public LocalDateTime createdDate;
    public LocalDateTime lastModified;
    public String createdBy = "Unknown";
    public List<Outcome> outcomes = new ArrayList<>();
    public String notes = "";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Outcome {
        public String title;
        public String description;
        public double threshold = 70.0;
        public boolean included = true;
        public List<Assignment> assignments = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Assignment {
        public String name;
        /** "quiz" or "assignment" */
        public String assignmentType;
        public boolean included = true;
        // stored, not applied to scores
        public double weight = 1.0;
        public List<QuestionGroup> questionGroups = new ArrayList<>();
        public List<RubricCriterion> rubricCriteria = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuestionGroup {
        public String name;
        public boolean selected = true;

        public QuestionGroup() {}

        public QuestionGroup(String name) {
            this.name = name;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RubricCriterion {
        public String description;
        public boolean selected = true;

        public RubricCriterion() {}

        public RubricCriterion(String description) {
            this.description = description;
        }
    }

    public String displayText() {
        String modified = lastModified == null ? "" : DateTimeFormatter.ofPattern("yyyy-MM-dd").format(lastModified);
        return templateName + " (" + courseCode + ") - " + outcomes.size() + " outcomes - Modified: " + modified;
    }

    @Override
    public String toString() {
        return displayText();
    }
}
