package assess;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReportFileNames {

    private static final Pattern COURSE_CODE = Pattern.compile("^([A-Z]+\\s*\\d+)");
    private static final DateTimeFormatter TS_FILE = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private ReportFileNames() {}

    /** "PSY 3421 - Intro" -> "PSY3421"; anything else -> "Course". */
    public static String courseCode(List<CourseInfo> courses) {
        if (courses == null || courses.isEmpty()) return "Course";
        Matcher m = COURSE_CODE.matcher(courses.get(0).name);
        return m.find() ? m.group(1).replace(" ", "") : "Course";
    }

    public static String defaultName(List<CourseInfo> courses, LocalDateTime now, boolean timestamp) {
        String base = courseCode(courses) + "_outcome_report";
        return timestamp ? base + "_" + TS_FILE.format(now) + ".xlsx" : base + ".xlsx";
    }

    /** report.xlsx -> report.csv */
    public static String csvSibling(String xlsxName) {
        int dot = xlsxName.lastIndexOf('.');
        return (dot > 0 ? xlsxName.substring(0, dot) : xlsxName) + ".csv";
    }
}
