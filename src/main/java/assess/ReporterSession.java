package assess;

import assess.CanvasModel.Course;
import assess.CanvasModel.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** What the desktop window is working on: the Canvas connection, loaded assignments and outcomes. */
public class ReporterSession {

    private static final Logger log = LoggerFactory.getLogger(ReporterSession.class);

    private final AppConfig cfg;
    private final OutcomeBoard board = new OutcomeBoard();
    private CanvasApi api;
    private AssignmentCatalog catalog = new AssignmentCatalog(List.of(), List.of());
    private String userName;

    public ReporterSession(AppConfig cfg) {
        this.cfg = cfg;
    }

    public AppConfig config() {
        return cfg;
    }

    public CanvasApi api() {
        return api;
    }

    public boolean isConnected() {
        return api != null;
    }

    public void connect(CanvasApi api) {
        this.api = api;
        this.userName = null;
        this.catalog = new AssignmentCatalog(List.of(), List.of());
        board.clear();
    }

    public List<Course> findCourses(CourseFilter filter) {
        return filter.apply(CourseFilter.loadCourses(api, cfg.adminMode));
    }

    /** Loads the selection's assignments; outcomes of the previous selection are dropped. */
    public AssignmentCatalog loadAssignments(List<Course> selected) {
        board.clear();
        catalog = AssignmentCatalog.load(api, selected);
        return catalog;
    }

    public AssignmentCatalog catalog() {
        return catalog;
    }

    public OutcomeBoard board() {
        return board;
    }

    public PartsDiscovery discovery() {
        return new PartsDiscovery(api);
    }

    /** Canvas display name of the signed-in user, "User" when it cannot be read. */
    public String userName() {
        if (userName == null) {
            try {
                User u = api.getUserInfo();
                userName = u == null || u.name == null ? "User" : u.name;
            } catch (CanvasApiException e) {
                log.warn("Could not read Canvas user: {}", e.getMessage());
                userName = "User";
            }
        }
        return userName;
    }
}
