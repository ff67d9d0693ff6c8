package assess;

import java.time.LocalDateTime;
import java.util.List;

/** Outcomes on the board -> a {@link CourseTemplate}. */
public final class TemplateMapper {

    private TemplateMapper() {}

    public static CourseTemplate fromOutcomes(String templateName, String courseCode, String notes,
                                              String createdBy, List<OutcomeDefinition> outcomes,
                                              LocalDateTime now) {
        CourseTemplate t = new CourseTemplate();
        t.templateName = templateName;
        t.courseCode = courseCode;
        t.createdDate = now;
        t.lastModified = now;
        t.createdBy = createdBy == null || createdBy.isBlank() ? "User" : createdBy;
        t.notes = notes == null ? "" : notes;

        for (OutcomeDefinition o : outcomes) {
            CourseTemplate.Outcome to = new CourseTemplate.Outcome();
            to.title = o.name;
            to.description = o.description;
            to.threshold = o.threshold;
            to.included = true;
            for (MergedAssignment a : o.assignments()) {
                CourseTemplate.Assignment ta = new CourseTemplate.Assignment();
                ta.name = a.name;
                ta.assignmentType = a.quizId != null ? "quiz" : "assignment";
                for (AssignmentPart part : o.partsFor(a)) {
                    if (part instanceof AssignmentPart.QuizGroupPart) {
                        ta.questionGroups.add(new CourseTemplate.QuestionGroup(((AssignmentPart.QuizGroupPart) part).groupName));
                    } else if (part instanceof AssignmentPart.RubricCriterionPart) {
                        ta.rubricCriteria.add(new CourseTemplate.RubricCriterion(((AssignmentPart.RubricCriterionPart) part).description));
                    }
                }
                to.assignments.add(ta);
            }
            t.outcomes.add(to);
        }
        return t;
    }

    /** First word of the first assignment's course name ("PSY3421 - Intro" -> "PSY3421"), else UNKNOWN. */
    public static String defaultCourseCode(AssignmentCatalog catalog) {
        if (catalog == null || catalog.isEmpty()) return "UNKNOWN";
        String courseName = catalog.assignments().get(0).courseName.trim();
        if (courseName.isEmpty()) return "UNKNOWN";
        return courseName.split("\\s+")[0];
    }
}
