package assess;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Templates as JSON files named {@code <safe course code>_<safe name>.json} in one directory. */
public class TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(TemplateStore.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public TemplateStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /** Letters, digits, space, '-' and '_' are kept; everything else becomes '_'. */
    static String safeName(String name) {
        StringBuilder sb = new StringBuilder();
        name.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_') sb.appendCodePoint(cp);
            else sb.append('_');
        });
        return sb.toString();
    }

    public static String fileName(String courseCode, String templateName) {
        return safeName(courseCode) + "_" + safeName(templateName) + ".json";
    }

    public List<CourseTemplate> list() throws IOException {
        return list(null);
    }

    /** Every readable template (optionally of one course code), newest course code / modification first. */
    public List<CourseTemplate> list(String courseCode) throws IOException {
        List<CourseTemplate> out = new ArrayList<>();
        if (!Files.isDirectory(directory)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory, "*.json")) {
            for (Path p : ds) {
                CourseTemplate t;
                try {
                    t = read(p);
                } catch (TemplateException e) {
                    log.warn("Could not load template {}: {}", p, e.getMessage());
                    continue;
                }
                if (courseCode == null || courseCode.equals(t.courseCode)) out.add(t);
            }
        }
        out.sort(Comparator.comparing((CourseTemplate t) -> t.courseCode)
                .thenComparing(t -> t.lastModified)
                .reversed());
        return out;
    }

    public CourseTemplate get(String courseCode, String templateName) throws IOException {
        for (CourseTemplate t : list(courseCode)) {
            if (t.templateName.equals(templateName)) return t;
        }
        return null;
    }

    /** Stamps lastModified and writes the template into the store. */
    public Path save(CourseTemplate t) throws IOException {
        t.lastModified = LocalDateTime.now();
        if (t.createdDate == null) t.createdDate = t.lastModified;
        Path target = directory.resolve(fileName(t.courseCode, t.templateName));
        write(t, target);
        log.info("Saved template '{}' ({}) to {}", t.templateName, t.courseCode, target);
        return target;
    }

    /**
     * Saves an edited template first, then removes the file it was stored under
     * before if code or name moved it. A failed save leaves the old file in place.
     */
    public Path update(String oldCode, String oldName, CourseTemplate t) throws IOException {
        Path target = save(t);
        Path old = directory.resolve(fileName(oldCode, oldName));
        if (!old.equals(target) && Files.deleteIfExists(old)) {
            log.info("Renamed template '{}' ({}) to '{}' ({})", oldName, oldCode, t.templateName, t.courseCode);
        }
        return target;
    }

    public boolean delete(String courseCode, String templateName) throws IOException {
        if (get(courseCode, templateName) == null) return false;
        boolean removed = Files.deleteIfExists(directory.resolve(fileName(courseCode, templateName)));
        if (removed) log.info("Deleted template '{}' ({})", templateName, courseCode);
        return removed;
    }

    /** Writes the template to exactly the chosen file. */
    public void exportTo(CourseTemplate t, Path file) throws IOException {
        write(t, file);
        log.info("Exported template '{}' to {}", t.templateName, file);
    }

    public CourseTemplate importFrom(Path file) throws IOException {
        CourseTemplate t = read(file);
        save(t);
        return t;
    }

    public static CourseTemplate read(Path file) throws TemplateException {
        CourseTemplate t;
        try {
            t = MAPPER.readValue(file.toFile(), CourseTemplate.class);
        } catch (IOException e) {
            throw new TemplateException("Unreadable template " + file.getFileName() + ": " + e.getMessage(), e);
        }
        if (t == null) throw new TemplateException("Empty template file " + file.getFileName());
        requireField(t.templateName, "template_name", file);
        requireField(t.courseCode, "course_code", file);
        if (t.createdDate == null) throw missing("created_date", file);
        if (t.lastModified == null) throw missing("last_modified", file);
        normalize(t, file);
        return t;
    }

    private static void write(CourseTemplate t, Path target) throws IOException {
        SafeFileOps.replace(target, tmp -> MAPPER.writeValue(tmp.toFile(), t));
    }

    private static void normalize(CourseTemplate t, Path file) throws TemplateException {
        if (t.createdBy == null) t.createdBy = "Unknown";
        if (t.notes == null) t.notes = "";
        if (t.outcomes == null) t.outcomes = new ArrayList<>();
        for (CourseTemplate.Outcome o : t.outcomes) {
            requireField(o.title, "title", file);
            if (o.description == null) throw missing("description", file);
            if (o.assignments == null) o.assignments = new ArrayList<>();
            for (CourseTemplate.Assignment a : o.assignments) {
                requireField(a.name, "name", file);
                if (a.assignmentType == null) throw missing("assignment_type", file);
                if (a.questionGroups == null) a.questionGroups = new ArrayList<>();
                if (a.rubricCriteria == null) a.rubricCriteria = new ArrayList<>();
            }
        }
    }

    private static void requireField(String value, String key, Path file) throws TemplateException {
        if (value == null) throw missing(key, file);
    }

    private static TemplateException missing(String key, Path file) {
        return new TemplateException("Template " + file.getFileName() + " has no '" + key + "'");
    }
}
