package assess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("a missing file yields the defaults")
    void load_missingFile() {
        // when
        AppConfig cfg = ConfigLoader.load(dir.resolve("absent.properties"));

        // then
        assertThat(cfg.canvasBaseUrl).isEmpty();
        assertThat(cfg.requestTimeoutSeconds).isEqualTo(30);
        assertThat(cfg.maxRetries).isEqualTo(5);
        assertThat(cfg.adminMode).isFalse();
        assertThat(cfg.defaultThreshold).isEqualTo(70.0);
        assertThat(cfg.borderlineRange).isEqualTo(5.0);
        assertThat(cfg.colorMet).isEqualTo("90EE90");
        assertThat(cfg.timestampFiles).isTrue();
        assertThat(cfg.includeSummarySheet).isTrue();
        assertThat(cfg.csvExport).isFalse();
        assertThat(cfg.outputDirectory).isNotBlank();
        assertThat(cfg.templatesDirectory).endsWith("templates");
    }

    @Test
    @DisplayName("values are read from the file and blank ones fall back to defaults")
    void load_values() throws IOException {
        // given
        Path file = dir.resolve("application.properties");
        Files.writeString(file, String.join("\n",
                "canvas.base.url=https://canvas.fit.edu",
                "canvas.max.retries=2",
                "canvas.admin.mode=true",
                "report.default.threshold=75.5",
                "report.color.met=   ",
                "output.csv.export=true",
                "output.timestamp.files=false",
                "templates.directory=" + dir.resolve("tpl").toString().replace('\\', '/')));

        // when
        AppConfig cfg = ConfigLoader.load(file);

        // then
        assertThat(cfg.canvasBaseUrl).isEqualTo("https://canvas.fit.edu");
        assertThat(cfg.maxRetries).isEqualTo(2);
        assertThat(cfg.adminMode).isTrue();
        assertThat(cfg.defaultThreshold).isEqualTo(75.5);
        assertThat(cfg.colorMet).isEqualTo("90EE90");
        assertThat(cfg.csvExport).isTrue();
        assertThat(cfg.timestampFiles).isFalse();
        assertThat(Path.of(cfg.templatesDirectory)).isEqualTo(dir.resolve("tpl"));
    }

    @Test
    @DisplayName("saved settings load back unchanged")
    void save_thenLoad() throws IOException {
        // given
        AppConfig cfg = new AppConfig();
        cfg.canvasBaseUrl = "https://canvas.example.edu";
        cfg.borderlineRange = 2.5;
        cfg.includeSummarySheet = false;
        cfg.outputDirectory = dir.resolve("reports").toString();
        cfg.templatesDirectory = dir.resolve("templates").toString();
        Path file = dir.resolve("nested").resolve("application.properties");

        // when
        ConfigLoader.save(cfg, file);
        AppConfig back = ConfigLoader.load(file);

        // then
        assertThat(back.canvasBaseUrl).isEqualTo("https://canvas.example.edu");
        assertThat(back.borderlineRange).isEqualTo(2.5);
        assertThat(back.includeSummarySheet).isFalse();
        assertThat(back.outputDirectory).isEqualTo(cfg.outputDirectory);
    }

    @Test
    @DisplayName("the bundled sample template is seeded into an empty templates dir only")
    void prepareTemplatesDir() throws IOException {
        // given
        Path templates = dir.resolve("templates");

        // when
        AppPaths.prepareTemplatesDir(templates);

        // then
        assertThat(templates.resolve("SAMPLE_Sample Program Outcomes.json")).exists();
        assertThat(new TemplateStore(templates).list())
                .extracting(t -> t.templateName)
                .containsExactly("Sample Program Outcomes");

        // when
        Files.delete(templates.resolve("SAMPLE_Sample Program Outcomes.json"));
        Files.writeString(templates.resolve("mine.json"), "{}");
        AppPaths.prepareTemplatesDir(templates);

        // then
        assertThat(templates.resolve("SAMPLE_Sample Program Outcomes.json")).doesNotExist();
    }
}
