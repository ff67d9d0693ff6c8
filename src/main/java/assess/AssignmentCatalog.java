package assess;

import assess.CanvasModel.Assignment;
import assess.CanvasModel.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Assignments of the selected courses, merged by name in order of first appearance. */
public class AssignmentCatalog {

    private static final Logger log = LoggerFactory.getLogger(AssignmentCatalog.class);

    private final List<MergedAssignment> assignments;
    private final List<CourseInfo> courses;

    public AssignmentCatalog(List<MergedAssignment> assignments, List<CourseInfo> courses) {
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        this.courses = Collections.unmodifiableList(new ArrayList<>(courses));
    }

    public static AssignmentCatalog load(CanvasApi api, List<Course> selected) {
        Map<String, MergedAssignment> byName = new LinkedHashMap<>();
        List<CourseInfo> infos = new ArrayList<>();
        for (Course course : selected) {
            CourseInfo info = CourseInfo.of(course);
            for (Assignment a : api.getAssignments(course.id)) {
                String name = a.name == null ? "Unnamed" : a.name;
                MergedAssignment merged = byName.get(name);
                if (merged == null) {
                    merged = new MergedAssignment(a.id, name, Numbers.nz(a.pointsPossible), info.name, a.quizId,
                            Boolean.TRUE.equals(a.isQuizAssignment), a.submissionTypes, a.rubric);
                    byName.put(name, merged);
                }
                merged.addCourse(course.id, a.id, a.quizId);
            }
            infos.add(info);
        }
        log.info("Loaded {} assignment(s) from {} course(s)", byName.size(), infos.size());
        return new AssignmentCatalog(new ArrayList<>(byName.values()), infos);
    }

    public List<MergedAssignment> assignments() {
        return assignments;
    }

    public List<CourseInfo> courses() {
        return courses;
    }

    public MergedAssignment byName(String name) {
        for (MergedAssignment a : assignments) if (a.name.equals(name)) return a;
        return null;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }
}
