package assess;

import assess.CanvasModel.RubricCriterion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assignments that share a name across the selected course sections, treated as one.
 * The first occurrence supplies id, points, rubric and course name.
 */
public class MergedAssignment {

    public final long id;
    public final String name;
    public final double pointsPossible;
    public final String courseName;
    public final Long quizId;
    public final boolean quizAssignment;
    public final List<String> submissionTypes;
    public final List<RubricCriterion> rubric;

    private final List<Long> courseIds = new ArrayList<>();
    private final Map<Long, Long> assignmentIdsByCourse = new LinkedHashMap<>();
    // values may be null: the course's copy is not a quiz
    private final Map<Long, Long> quizIdsByCourse = new LinkedHashMap<>();

    public MergedAssignment(long id, String name, double pointsPossible, String courseName, Long quizId,
                            boolean quizAssignment, List<String> submissionTypes, List<RubricCriterion> rubric) {
        this.id = id;
        this.name = name;
        this.pointsPossible = pointsPossible;
        this.courseName = courseName == null ? "" : courseName;
        this.quizId = quizId;
        this.quizAssignment = quizAssignment;
        this.submissionTypes = submissionTypes == null ? List.of() : List.copyOf(submissionTypes);
        this.rubric = rubric == null ? List.of() : List.copyOf(rubric);
    }

    public void addCourse(long courseId, long assignmentId, Long courseQuizId) {
        if (!courseIds.contains(courseId)) courseIds.add(courseId);
        assignmentIdsByCourse.put(courseId, assignmentId);
        quizIdsByCourse.put(courseId, courseQuizId);
    }

    public List<Long> courseIds() {
        return Collections.unmodifiableList(courseIds);
    }

    public Map<Long, Long> quizIdsByCourse() {
        return Collections.unmodifiableMap(quizIdsByCourse);
    }

    public long assignmentIdFor(long courseId) {
        Long v = assignmentIdsByCourse.get(courseId);
        return v == null ? id : v;
    }

    public Long quizIdFor(long courseId) {
        return quizIdsByCourse.containsKey(courseId) ? quizIdsByCourse.get(courseId) : quizId;
    }

    public boolean hasAnyQuizId() {
        for (Long q : quizIdsByCourse.values()) if (q != null) return true;
        return quizId != null;
    }

    public String displayText() {
        String pts = Numbers.plain(pointsPossible);
        if (courseIds.size() > 1) {
            return name + " (from " + courseIds.size() + " sections, " + pts + " pts)";
        }
        return name + " - " + courseName + " (" + pts + " pts)";
    }

    @Override
    public String toString() {
        return displayText();
    }
}
