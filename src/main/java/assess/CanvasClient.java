package assess;

import assess.CanvasModel.Account;
import assess.CanvasModel.Assignment;
import assess.CanvasModel.Course;
import assess.CanvasModel.Enrollment;
import assess.CanvasModel.Outcome;
import assess.CanvasModel.OutcomeLink;
import assess.CanvasModel.QuizGroup;
import assess.CanvasModel.QuizQuestion;
import assess.CanvasModel.QuizSubmission;
import assess.CanvasModel.QuizSubmissionQuestion;
import assess.CanvasModel.Submission;
import assess.CanvasModel.User;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Canvas REST client on java.net.http with Link-header pagination and 429 back-off. */
public class CanvasClient implements CanvasApi {

    private static final Logger log = LoggerFactory.getLogger(CanvasClient.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final int PAGE_SIZE = 100;
    static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    /** Waits out a rate limit; swapped in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long seconds) throws InterruptedException;
    }

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final int maxRetries;
    private final HttpClient http;
    private final Sleeper sleeper;

    public CanvasClient(String baseUrl, String token, int timeoutSeconds, int maxRetries) {
        this(baseUrl, token, timeoutSeconds, maxRetries, s -> Thread.sleep(s * 1000L));
    }

    CanvasClient(String baseUrl, String token, int timeoutSeconds, int maxRetries, Sleeper sleeper) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.token = token;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.maxRetries = Math.max(0, maxRetries);
        this.sleeper = sleeper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static CanvasApi.Factory factory(AppConfig cfg) {
        return (url, tok) -> new CanvasClient(url, tok, cfg.requestTimeoutSeconds, cfg.maxRetries);
    }

    // -------------------- operations --------------------

    @Override
    public boolean testConnection() {
        try {
            get("/api/v1/users/self", Params.none());
            return true;
        } catch (CanvasApiException e) {
            log.info("Connection test against {} failed: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public User getUserInfo() {
        return as(get("/api/v1/users/self", Params.none()), User.class);
    }

    @Override
    public List<Account> getAccounts() {
        return asList(paginate("/api/v1/accounts", Params.none()), Account.class);
    }

    @Override
    public List<Course> getCourses(String enrollmentType) {
        Params p = Params.of("include[]", "term")
                .add("include[]", "total_students")
                .add("enrollment_state", "active");
        if (enrollmentType != null && !enrollmentType.isBlank()) p.add("enrollment_type", enrollmentType);
        return asList(paginate("/api/v1/courses", p), Course.class);
    }

    @Override
    public List<Course> getAccountCourses(long accountId) {
        Params p = Params.of("include[]", "term")
                .add("include[]", "total_students")
                .add("state[]", "available")
                .add("state[]", "completed");
        return asList(paginate("/api/v1/accounts/" + accountId + "/courses", p), Course.class);
    }

    @Override
    public Course getCourse(long courseId) {
        Params p = Params.of("include[]", "term").add("include[]", "total_students");
        return as(get("/api/v1/courses/" + courseId, p), Course.class);
    }

    @Override
    public List<Enrollment> getEnrollments(long courseId) {
        Params p = Params.of("type[]", "StudentEnrollment").add("state[]", "active");
        return asList(paginate("/api/v1/courses/" + courseId + "/enrollments", p), Enrollment.class);
    }

    @Override
    public List<Assignment> getAssignments(long courseId) {
        return asList(paginate("/api/v1/courses/" + courseId + "/assignments",
                Params.of("include[]", "rubric")), Assignment.class);
    }

    @Override
    public Assignment getAssignment(long courseId, long assignmentId) {
        return as(get("/api/v1/courses/" + courseId + "/assignments/" + assignmentId,
                Params.of("include[]", "rubric")), Assignment.class);
    }

    @Override
    public List<Submission> getSubmissions(long courseId, long assignmentId) {
        Params p = Params.of("include[]", "user").add("include[]", "rubric_assessment");
        return asList(paginate("/api/v1/courses/" + courseId + "/assignments/" + assignmentId + "/submissions", p),
                Submission.class);
    }

    @Override
    public List<QuizQuestion> getQuizQuestions(long courseId, long quizId) {
        return asList(paginate("/api/v1/courses/" + courseId + "/quizzes/" + quizId + "/questions", Params.none()),
                QuizQuestion.class);
    }

    @Override
    public QuizGroup getQuizGroup(long courseId, long quizId, long groupId) {
        return as(get("/api/v1/courses/" + courseId + "/quizzes/" + quizId + "/groups/" + groupId, Params.none()),
                QuizGroup.class);
    }

    @Override
    public List<QuizSubmission> getQuizSubmissions(long courseId, long quizId) {
        List<JsonNode> pages = paginate("/api/v1/courses/" + courseId + "/quizzes/" + quizId + "/submissions",
                Params.none());
        return asList(unwrap(pages, "quiz_submissions"), QuizSubmission.class);
    }

    @Override
    public List<QuizSubmissionQuestion> getQuizSubmissionQuestions(long quizSubmissionId) {
        JsonNode body = get("/api/v1/quiz_submissions/" + quizSubmissionId + "/questions", Params.none());
        List<JsonNode> one = new ArrayList<>();
        one.add(body);
        return asList(unwrap(one, "quiz_submission_questions"), QuizSubmissionQuestion.class);
    }

    @Override
    public List<Outcome> getOutcomes(long courseId) {
        List<OutcomeLink> links = asList(
                paginate("/api/v1/courses/" + courseId + "/outcome_group_links", Params.none()), OutcomeLink.class);
        List<Outcome> out = new ArrayList<>();
        for (OutcomeLink link : links) {
            if (link.outcome == null || link.outcome.id == null) continue;
            out.add(as(get("/api/v1/outcomes/" + link.outcome.id, Params.none()), Outcome.class));
        }
        return out;
    }

    // -------------------- core --------------------

    /** Single GET; the parsed body. */
    JsonNode get(String endpoint, Params params) {
        HttpResponse<String> resp = send(baseUrl + endpoint + params.toQuery());
        return parse(resp);
    }

    /** Follows rel="next" links; array pages are concatenated, an object page counts as one element. */
    List<JsonNode> paginate(String endpoint, Params params) {
        Params first = params.copy().add("per_page", String.valueOf(PAGE_SIZE));
        String url = baseUrl + endpoint + first.toQuery();
        List<JsonNode> all = new ArrayList<>();
        int pages = 0;
        while (url != null) {
            HttpResponse<String> resp = send(url);
            JsonNode node = parse(resp);
            if (node.isArray()) {
                node.forEach(all::add);
            } else {
                all.add(node);
            }
            pages++;
            // the next link already carries the query
            url = nextLink(resp.headers().firstValue("Link").orElse(null));
        }
        log.debug("GET {} -> {} item(s) over {} page(s)", endpoint, all.size(), pages);
        return all;
    }

    private HttpResponse<String> send(String url) {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Authorization", "Bearer " + token)
                    .header("Accept", "application/json")
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CanvasApiException(0, "Unexpected error: invalid URL " + url, e);
        }

        for (int attempt = 0; ; attempt++) {
            HttpResponse<String> resp;
            try {
                resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (HttpTimeoutException e) {
                throw new CanvasApiException(0, "Request timed out", e);
            } catch (ConnectException e) {
                throw new CanvasApiException(0, "Connection error - check your internet connection", e);
            } catch (IOException e) {
                throw new CanvasApiException(0, "Unexpected error: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CanvasApiException(0, "Request interrupted", e);
            }

            int status = resp.statusCode();
            if (status == 429 && attempt < maxRetries) {
                long wait = retryAfter(resp.headers().firstValue("Retry-After").orElse(null));
                log.warn("Rate limited by Canvas; retrying in {}s ({}/{})", wait, attempt + 1, maxRetries);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CanvasApiException(429, "Request interrupted", e);
                }
                continue;
            }
            if (status < 200 || status >= 300) {
                log.debug("GET {} -> HTTP {}", req.uri().getPath(), status);
                throw CanvasApiException.forStatus(status);
            }
            return resp;
        }
    }

    private static JsonNode parse(HttpResponse<String> resp) {
        String body = resp.body();
        if (body == null || body.isBlank()) return MAPPER.nullNode();
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CanvasApiException(resp.statusCode(), "Unexpected error: response is not JSON", e);
        }
    }

    static List<JsonNode> unwrap(List<JsonNode> pages, String field) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode page : pages) {
            JsonNode inner = page.get(field);
            if (inner != null && inner.isArray()) {
                inner.forEach(out::add);
            } else if (inner == null && page.isObject()) {
                out.add(page);
            }
        }
        return out;
    }

    static String nextLink(String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) return null;
        for (String part : linkHeader.split(",")) {
            if (part.contains("rel=\"next\"")) {
                String target = part.split(";")[0].trim();
                if (target.startsWith("<")) target = target.substring(1);
                if (target.endsWith(">")) target = target.substring(0, target.length() - 1);
                return target.isEmpty() ? null : target;
            }
        }
        return null;
    }

    static long retryAfter(String header) {
        if (header == null) return DEFAULT_RETRY_AFTER_SECONDS;
        try {
            return Math.max(0, Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private static <T> T as(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CanvasApiException(0, "Unexpected error: cannot read " + type.getSimpleName(), e);
        }
    }

    private static <T> List<T> asList(List<JsonNode> nodes, Class<T> type) {
        List<T> out = new ArrayList<>(nodes.size());
        for (JsonNode n : nodes) out.add(as(n, type));
        return out;
    }

    private static String stripTrailingSlash(String url) {
        String u = url == null ? "" : url.trim();
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }

    /** Ordered query parameters; repeated keys are allowed (include[]=a&include[]=b). */
    static final class Params {
        private final List<String[]> pairs = new ArrayList<>();

        static Params none() { return new Params(); }

        static Params of(String key, String value) { return new Params().add(key, value); }

        Params add(String key, String value) {
            pairs.add(new String[]{key, value});
            return this;
        }

        Params copy() {
            Params p = new Params();
            p.pairs.addAll(pairs);
            return p;
        }

        String toQuery() {
            if (pairs.isEmpty()) return "";
            StringBuilder sb = new StringBuilder("?");
            for (String[] kv : pairs) {
                if (sb.length() > 1) sb.append('&');
                sb.append(URLEncoder.encode(kv[0], StandardCharsets.UTF_8))
                  .append('=')
                  .append(URLEncoder.encode(kv[1], StandardCharsets.UTF_8));
            }
            return sb.toString();
        }
    }
}
