package assess;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** The main report sheet as CSV. */
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    public void write(OutcomeReport report, Path target) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(report.columns().toArray(new String[0]))
                .build();
        SafeFileOps.replace(target, tmp -> {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(w, format)) {
                for (ReportRow row : report.rows()) {
                    List<Object> values = new ArrayList<>();
                    for (String col : report.columns()) values.add(text(row.get(col)));
                    printer.printRecord(values);
                }
            }
        });
        log.info("Wrote CSV report {} ({} rows)", target, report.rows().size());
    }

    private static Object text(Object v) {
        if (v instanceof Double) return Numbers.plain((Double) v);
        return v;
    }
}
