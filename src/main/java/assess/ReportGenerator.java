package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Builds the report, computes statistics and writes the workbook (and CSV when enabled). */
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    public static final class Result {
        public final Path workbook;
        public final Path csv;
        public final int students;
        public final int outcomes;

        Result(Path workbook, Path csv, int students, int outcomes) {
            this.workbook = workbook;
            this.csv = csv;
            this.students = students;
            this.outcomes = outcomes;
        }
    }

    private final CanvasApi api;
    private final AppConfig cfg;

    public ReportGenerator(CanvasApi api, AppConfig cfg) {
        this.api = api;
        this.cfg = cfg;
    }

    public Result generate(List<OutcomeDefinition> outcomes, List<CourseInfo> courses, Path target,
                           ReportProgress progress) throws ReportException {
        if (outcomes.isEmpty()) throw new ReportException("Create at least one outcome first.");

        OutcomeReport report;
        try {
            report = new OutcomeReportBuilder(api).build(outcomes, courses, progress);
        } catch (CanvasApiException e) {
            throw new ReportException("Canvas request failed: " + e.getMessage(), e);
        }
        if (progress.isCancelled()) throw new ReportCancelledException();

        List<OutcomeStatistics> stats = OutcomeStatistics.summarize(report, cfg.borderlineRange);
        Path csv = null;
        try {
            new ExcelReportWriter(cfg).write(report, stats, target);
            if (cfg.csvExport) {
                Path name = target.getFileName();
                csv = target.resolveSibling(ReportFileNames.csvSibling(name == null ? "report.xlsx" : name.toString()));
                new CsvReportWriter().write(report, csv);
            }
        } catch (IOException e) {
            log.error("Writing report {} failed", target, e);
            throw new ReportException("Could not write " + target + ": " + e.getMessage(), e);
        }
        progress.update(100, "Done");
        return new Result(target, csv, report.rows().size(), outcomes.size());
    }
}
