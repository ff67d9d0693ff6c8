package assess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Result of {@link OutcomeReportBuilder}: ordered columns and one row per student. */
public class OutcomeReport {

    public static final String COL_STUDENT_ID = "Student ID";
    public static final String COL_STUDENT_NAME = "Student Name";
    public static final String COL_COURSE_ID = "Course ID";
    public static final String MET = "Met";
    public static final String NOT_MET = "Not Met";

    private final List<String> columns;
    private final List<ReportRow> rows;
    private final List<OutcomeDefinition> outcomes;
    private final List<CourseInfo> courses;

    public OutcomeReport(List<String> columns, List<ReportRow> rows,
                         List<OutcomeDefinition> outcomes, List<CourseInfo> courses) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.courses = Collections.unmodifiableList(new ArrayList<>(courses));
    }

    public static String scoreColumn(OutcomeDefinition o, MergedAssignment a) {
        return o.name + " - " + a.name;
    }

    public static String totalColumn(OutcomeDefinition o) {
        return o.name + " Total (%)";
    }

    public static String statusColumn(OutcomeDefinition o) {
        return o.name + " Status";
    }

    public List<String> columns() {
        return columns;
    }

    public List<ReportRow> rows() {
        return rows;
    }

    public List<OutcomeDefinition> outcomes() {
        return outcomes;
    }

    public List<CourseInfo> courses() {
        return courses;
    }
}
