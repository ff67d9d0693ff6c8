package assess;

import assess.CanvasModel.Course;

/** A selected course section as the report sees it. */
public class CourseInfo {
    public final long id;
    public final String name;
    public final String code;

    public CourseInfo(long id, String name, String code) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.code = code == null ? "" : code;
    }

    public static CourseInfo of(Course c) {
        return new CourseInfo(c.id, c.name == null ? "Unknown" : c.name, c.courseCode);
    }

    @Override
    public String toString() {
        return name;
    }
}
