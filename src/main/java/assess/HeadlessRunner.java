package assess;

import assess.CanvasModel.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code --headless --template <file|name> --courses <id,id,...> [--out <path>]}
 * Uses stored credentials only. Exit codes: 0 ok, 2 bad arguments or no
 * credentials, 1 anything else.
 */
public final class HeadlessRunner {

    private static final Logger log = LoggerFactory.getLogger(HeadlessRunner.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT =
            "Usage: --headless --template <file|template name> --courses <id,id,...> [--out <report.xlsx>]";

    private final AppConfig cfg;
    private final CredentialStore store;
    private final CanvasApi.Factory clients;
    private final PrintStream out;
    private final PrintStream err;

    public HeadlessRunner(AppConfig cfg, CredentialStore store, CanvasApi.Factory clients,
                          PrintStream out, PrintStream err) {
        this.cfg = cfg;
        this.store = store;
        this.clients = clients;
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        Map<String, String> opts = parse(args);
        if (opts == null || !opts.containsKey("--template") || !opts.containsKey("--courses")) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        List<Long> courseIds = new ArrayList<>();
        for (String s : opts.get("--courses").split(",")) {
            if (s.isBlank()) continue;
            try {
                courseIds.add(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                err.println("Not a course id: " + s.trim());
                return USAGE;
            }
        }
        if (courseIds.isEmpty()) {
            err.println(USAGE_TEXT);
            return USAGE;
        }

        CanvasApi api = new CanvasAuthenticator(store, clients, null).authenticateStored();
        if (api == null) {
            err.println("No working Canvas credentials are stored. Start the app once without --headless to sign in.");
            return USAGE;
        }

        try {
            CourseTemplate template = resolveTemplate(opts.get("--template"));
            if (template == null) {
                err.println("Template not found: " + opts.get("--template"));
                return USAGE;
            }

            Map<Long, Course> available = new HashMap<>();
            for (Course c : CourseFilter.loadCourses(api, cfg.adminMode)) available.put(c.id, c);
            List<Course> selected = new ArrayList<>();
            for (Long id : courseIds) {
                Course c = available.get(id);
                if (c == null) {
                    err.println("Course " + id + " is not one of your courses.");
                    return USAGE;
                }
                selected.add(c);
            }

            AssignmentCatalog catalog = AssignmentCatalog.load(api, selected);
            List<OutcomeDefinition> outcomes = new TemplateApplier(new PartsDiscovery(api)).apply(template, catalog);
            OutcomeBoard board = new OutcomeBoard();
            board.replaceAll(outcomes);
            if (board.isEmpty()) {
                err.println("Template '" + template.templateName + "' matched no assignments in the selected courses.");
                return FAILED;
            }

            Path target = opts.containsKey("--out")
                    ? Paths.get(opts.get("--out"))
                    : Paths.get(cfg.outputDirectory).resolve(
                            ReportFileNames.defaultName(catalog.courses(), LocalDateTime.now(), cfg.timestampFiles));

            ReportGenerator.Result result = new ReportGenerator(api, cfg)
                    .generate(board.outcomes(), catalog.courses(), target, new LoggingProgress());
            out.println("Report written: " + result.workbook.toAbsolutePath());
            if (result.csv != null) out.println("CSV written: " + result.csv.toAbsolutePath());
            out.println("Students: " + result.students + ", outcomes: " + result.outcomes);
            return OK;
        } catch (ReportException | IOException | CanvasApiException | IllegalArgumentException e) {
            log.error("Headless report failed", e);
            err.println("Report failed: " + e.getMessage());
            return FAILED;
        }
    }

    private CourseTemplate resolveTemplate(String ref) throws IOException {
        Path file = Paths.get(ref);
        if (Files.isRegularFile(file)) return TemplateStore.read(file);
        Path dir = AppPaths.prepareTemplatesDir(Paths.get(cfg.templatesDirectory));
        for (CourseTemplate t : new TemplateStore(dir).list()) {
            if (t.templateName.equals(ref)) return t;
        }
        return null;
    }

    /** --key value pairs; --headless is a bare flag. Null on malformed input. */
    static Map<String, String> parse(String[] args) {
        Map<String, String> opts = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--headless".equalsIgnoreCase(a)) continue;
            if (!a.startsWith("--") || i + 1 >= args.length) return null;
            opts.put(a, args[++i]);
        }
        return opts;
    }

    private static final class LoggingProgress implements ReportProgress {
        private String last;

        @Override
        public void update(int percent, String label) {
            if (!label.equals(last)) log.info("[{}%] {}", percent, label);
            last = label;
        }

        @Override
        public boolean isCancelled() {
            return false;
        }
    }
}
