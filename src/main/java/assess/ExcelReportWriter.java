package assess;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the outcome report workbook:
 *  - "Outcome Report": one row per student, Status cells coloured
 *  - "Summary": statistics per outcome, overall and per section (optional)
 * The workbook is written to a temp sibling and moved over the target.
 */
public class ExcelReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ExcelReportWriter.class);

    public static final String REPORT_SHEET = "Outcome Report";
    public static final String SUMMARY_SHEET = "Summary";

    static final List<String> SUMMARY_COLUMNS = List.of(
            "Outcome", "Scope", "Threshold (%)", "Students", "Mean (%)", "Median (%)",
            "Std Dev", "% Meeting", "Met", "Borderline", "Not Met");

    private static final int MAX_WIDTH_CHARS = 50;

    private final AppConfig cfg;

    public ExcelReportWriter(AppConfig cfg) {
        this.cfg = cfg;
    }

    public void write(OutcomeReport report, List<OutcomeStatistics> stats, Path target) throws IOException {
        SafeFileOps.replace(target, tmp -> {
            try (XSSFWorkbook wb = new XSSFWorkbook()) {
                Styles styles = new Styles(wb);
                writeReportSheet(wb, styles, report);
                if (cfg.includeSummarySheet) writeSummarySheet(wb, styles, stats);
                try (OutputStream os = Files.newOutputStream(tmp)) {
                    wb.write(os);
                }
            }
        });
        log.info("Wrote report {} ({} students, {} outcomes)", target, report.rows().size(), report.outcomes().size());
    }

    // -------------------- sheets --------------------

    private void writeReportSheet(XSSFWorkbook wb, Styles styles, OutcomeReport report) {
        Sheet sheet = wb.createSheet(REPORT_SHEET);
        List<String> cols = report.columns();
        int[] widths = new int[cols.size()];

        writeHeader(sheet, styles, cols, widths);

        int r = 1;
        for (ReportRow row : report.rows()) {
            Row xr = sheet.createRow(r++);
            for (int c = 0; c < cols.size(); c++) {
                Object v = row.get(cols.get(c));
                Cell cell = xr.createCell(c);
                setValue(cell, v);
                widths[c] = Math.max(widths[c], text(v).length());
            }
            for (OutcomeDefinition o : report.outcomes()) {
                int c = cols.indexOf(OutcomeReport.statusColumn(o));
                if (c < 0) continue;
                Double pct = row.percentage(o.name);
                String band = OutcomeStatistics.band(pct == null ? 0 : pct, o.threshold, cfg.borderlineRange);
                xr.getCell(c).setCellStyle(styles.forBand(band));
            }
        }
        applyWidths(sheet, widths);
    }

    private void writeSummarySheet(XSSFWorkbook wb, Styles styles, List<OutcomeStatistics> stats) {
        Sheet sheet = wb.createSheet(SUMMARY_SHEET);
        int[] widths = new int[SUMMARY_COLUMNS.size()];
        writeHeader(sheet, styles, SUMMARY_COLUMNS, widths);

        int r = 1;
        for (OutcomeStatistics s : stats) {
            Object[] values = {
                    s.outcome, s.scope, s.threshold, (long) s.count,
                    round1(s.mean), round1(s.median), round1(s.stdDev), round1(s.percentMeeting),
                    (long) s.met, (long) s.borderline, (long) s.notMet
            };
            Row xr = sheet.createRow(r++);
            for (int c = 0; c < values.length; c++) {
                setValue(xr.createCell(c), values[c]);
                widths[c] = Math.max(widths[c], text(values[c]).length());
            }
        }
        applyWidths(sheet, widths);
    }

    // -------------------- helpers --------------------

    private static void writeHeader(Sheet sheet, Styles styles, List<String> cols, int[] widths) {
        Row header = sheet.createRow(0);
        for (int c = 0; c < cols.size(); c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(cols.get(c));
            cell.setCellStyle(styles.header);
            widths[c] = cols.get(c).length();
        }
        sheet.createFreezePane(0, 1);
    }

    private static void applyWidths(Sheet sheet, int[] widths) {
        for (int c = 0; c < widths.length; c++) {
            sheet.setColumnWidth(c, Math.min(widths[c] + 2, MAX_WIDTH_CHARS) * 256);
        }
    }

    private static void setValue(Cell cell, Object v) {
        if (v == null) {
            cell.setBlank();
        } else if (v instanceof Number) {
            cell.setCellValue(((Number) v).doubleValue());
        } else {
            cell.setCellValue(String.valueOf(v));
        }
    }

    private static String text(Object v) {
        if (v == null) return "";
        if (v instanceof Double) return Numbers.plain((Double) v);
        return String.valueOf(v);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    static byte[] rgb(String hex, String fallback) {
        String h = hex == null ? "" : hex.trim();
        if (h.startsWith("#")) h = h.substring(1);
        if (!h.matches("[0-9a-fA-F]{6}")) {
            log.warn("Invalid colour '{}', using {}", hex, fallback);
            h = fallback;
        }
        return new byte[]{
                (byte) Integer.parseInt(h.substring(0, 2), 16),
                (byte) Integer.parseInt(h.substring(2, 4), 16),
                (byte) Integer.parseInt(h.substring(4, 6), 16)
        };
    }

    private final class Styles {
        final CellStyle header;
        final CellStyle met;
        final CellStyle notMet;
        final CellStyle borderline;

        Styles(XSSFWorkbook wb) {
            Font bold = wb.createFont();
            bold.setBold(true);
            header = wb.createCellStyle();
            header.setFont(bold);

            met = fill(wb, rgb(cfg.colorMet, "90EE90"));
            notMet = fill(wb, rgb(cfg.colorNotMet, "FFB6C1"));
            borderline = fill(wb, rgb(cfg.colorBorderline, "FFFFE0"));
        }

        CellStyle forBand(String band) {
            if (OutcomeReport.MET.equals(band)) return met;
            if (OutcomeReport.NOT_MET.equals(band)) return notMet;
            return borderline;
        }

        private CellStyle fill(XSSFWorkbook wb, byte[] color) {
            XSSFCellStyle s = wb.createCellStyle();
            s.setFillForegroundColor(new XSSFColor(color, null));
            s.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            return s;
        }
    }
}
