package assess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One student's line of the outcome report. */
public class ReportRow {

    public final long studentId;
    public final String studentName;
    public final Long courseId;

    // column -> Long, Double, String or null (empty cell)
    private final Map<String, Object> cells = new LinkedHashMap<>();
    // outcome -> unrounded percentage, only when the student had points possible
    private final Map<String, Double> percentages = new LinkedHashMap<>();

    public ReportRow(long studentId, String studentName, Long courseId) {
        this.studentId = studentId;
        this.studentName = studentName;
        this.courseId = courseId;
        cells.put(OutcomeReport.COL_STUDENT_ID, studentId);
        cells.put(OutcomeReport.COL_STUDENT_NAME, studentName);
        cells.put(OutcomeReport.COL_COURSE_ID, courseId);
    }

    void put(String column, Object value) {
        cells.put(column, value);
    }

    void putPercentage(String outcome, double pct) {
        percentages.put(outcome, pct);
    }

    public Object get(String column) {
        return cells.get(column);
    }

    public Map<String, Object> cells() {
        return Collections.unmodifiableMap(cells);
    }

    /** @return the percentage, or null when nothing was graded for the outcome */
    public Double percentage(String outcome) {
        return percentages.get(outcome);
    }
}
