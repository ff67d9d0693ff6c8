package assess;

import assess.CanvasModel.Account;
import assess.CanvasModel.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Course code / year / semester filter for the course list. Blank filters match everything. */
public class CourseFilter {

    private static final Logger log = LoggerFactory.getLogger(CourseFilter.class);

    private final String code;
    private final String year;
    private final String semester;

    public CourseFilter(String code, String year, String semester) {
        this.code = trim(code).toUpperCase(Locale.ROOT);
        this.year = trim(year);
        this.semester = trim(semester);
    }

    public static CourseFilter none() {
        return new CourseFilter("", "", "");
    }

    public boolean matches(Course c) {
        String courseCode = c.courseCode == null ? "" : c.courseCode.toUpperCase(Locale.ROOT);
        String term = c.termName() == null ? "" : c.termName();
        if (!code.isEmpty() && !courseCode.contains(code)) return false;
        if (!year.isEmpty() && !term.contains(year)) return false;
        if (!semester.isEmpty() && !term.contains(semester)) return false;
        return true;
    }

    public List<Course> apply(List<Course> courses) {
        List<Course> out = new ArrayList<>();
        for (Course c : courses) if (matches(c)) out.add(c);
        return out;
    }

    /**
     * Teacher courses, or in admin mode every available/completed course of the
     * user's admin accounts (deduplicated by id).
     */
    public static List<Course> loadCourses(CanvasApi api, boolean adminMode) {
        if (!adminMode) return api.getCourses("teacher");
        Map<Long, Course> byId = new LinkedHashMap<>();
        for (Account a : api.getAccounts()) {
            if (a.id == null) continue;
            for (Course c : api.getAccountCourses(a.id)) {
                if (c.id != null) byId.putIfAbsent(c.id, c);
            }
        }
        log.info("Admin mode: {} course(s) across admin accounts", byId.size());
        return new ArrayList<>(byId.values());
    }

    private static String trim(String s) { return s == null ? "" : s.trim(); }
}
