package assess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class HeadlessRunnerTest {

    @TempDir
    Path dir;

    @Mock
    private CredentialStore store;
    @Mock
    private CanvasApi.Factory clients;
    @Mock
    private CanvasApi api;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private HeadlessRunner runner;

    @BeforeEach
    void setUp() {
        AppConfig cfg = new AppConfig();
        cfg.templatesDirectory = dir.resolve("templates").toString();
        cfg.outputDirectory = dir.resolve("reports").toString();
        runner = new HeadlessRunner(cfg, store, clients,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String errText() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("options are --key value pairs with a bare --headless flag")
    void parse() {
        Map<String, String> opts = HeadlessRunner.parse(
                new String[]{"--headless", "--template", "Core", "--courses", "1,2", "--out", "r.xlsx"});

        assertThat(opts).containsOnly(
                Map.entry("--template", "Core"), Map.entry("--courses", "1,2"), Map.entry("--out", "r.xlsx"));
        assertThat(HeadlessRunner.parse(new String[]{"--template"})).isNull();
        assertThat(HeadlessRunner.parse(new String[]{"stray"})).isNull();
    }

    @Test
    @DisplayName("missing or malformed arguments print usage and exit 2")
    void usage() {
        assertThat(runner.run(new String[]{"--headless", "--template", "Core"})).isEqualTo(HeadlessRunner.USAGE);
        assertThat(errText()).contains("Usage:");

        assertThat(runner.run(new String[]{"--template", "Core", "--courses", "12,abc"})).isEqualTo(HeadlessRunner.USAGE);
        assertThat(errText()).contains("Not a course id: abc");

        assertThat(runner.run(new String[]{"--template", "Core", "--courses", " , "})).isEqualTo(HeadlessRunner.USAGE);
        then(clients).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("without stored credentials nothing is prompted and the exit code is 2")
    void noCredentials() {
        // when
        int code = runner.run(new String[]{"--headless", "--template", "Core", "--courses", "12"});

        // then
        assertThat(code).isEqualTo(HeadlessRunner.USAGE);
        assertThat(errText()).contains("No working Canvas credentials");
    }

    @Test
    @DisplayName("an unknown template name exits 2")
    void unknownTemplate() {
        // given
        given(store.get(CredentialStore.CANVAS_URL)).willReturn("https://canvas.fit.edu");
        given(store.get(CredentialStore.CANVAS_TOKEN)).willReturn("tok");
        given(clients.create("https://canvas.fit.edu", "tok")).willReturn(api);
        given(api.testConnection()).willReturn(true);

        // when
        int code = runner.run(new String[]{"--headless", "--template", "Nope", "--courses", "12"});

        // then
        assertThat(code).isEqualTo(HeadlessRunner.USAGE);
        assertThat(errText()).contains("Template not found: Nope");
    }

    @Test
    @DisplayName("a course outside the user's list exits 2")
    void unknownCourse() {
        // given
        given(store.get(CredentialStore.CANVAS_URL)).willReturn("https://canvas.fit.edu");
        given(store.get(CredentialStore.CANVAS_TOKEN)).willReturn("tok");
        given(clients.create("https://canvas.fit.edu", "tok")).willReturn(api);
        given(api.testConnection()).willReturn(true);
        given(api.getCourses("teacher")).willReturn(List.of(Fixtures.course(1, "PSY 1411 A", "PSY1411", null)));

        // when
        int code = runner.run(new String[]{"--template", "Sample Program Outcomes", "--courses", "99"});

        // then
        assertThat(code).isEqualTo(HeadlessRunner.USAGE);
        assertThat(errText()).contains("Course 99 is not one of your courses.");
    }

    @Test
    @DisplayName("the force-headless variable accepts 1, true and yes")
    void truthy() {
        assertThat(App.truthy("1")).isTrue();
        assertThat(App.truthy(" TRUE ")).isTrue();
        assertThat(App.truthy("yes")).isTrue();
        assertThat(App.truthy("0")).isFalse();
        assertThat(App.truthy("")).isFalse();
        assertThat(App.truthy(null)).isFalse();
    }
}
