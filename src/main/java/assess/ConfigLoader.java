package assess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Properties;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static AppConfig load() {
        return load(AppPaths.configFile());
    }

    public static AppConfig load(Path configPath) {
        Properties p = new Properties();
        try (InputStream is = Files.newInputStream(configPath, StandardOpenOption.READ)) {
            p.load(is);
            log.debug("Config path: {}", configPath.toAbsolutePath());
        } catch (NoSuchFileException e) {
            log.info("No config at {}; using defaults", configPath);
        } catch (Exception e) {
            log.warn("Failed to read {}: {}", configPath, e.getMessage());
        }

        AppConfig cfg = new AppConfig();
        cfg.canvasBaseUrl = get(p, "canvas.base.url", "");
        cfg.requestTimeoutSeconds = Integer.parseInt(get(p, "canvas.request.timeout.seconds", "30"));
        cfg.maxRetries = Integer.parseInt(get(p, "canvas.max.retries", "5"));
        cfg.adminMode = Boolean.parseBoolean(get(p, "canvas.admin.mode", "false"));

        cfg.defaultThreshold = Double.parseDouble(get(p, "report.default.threshold", "70"));
        cfg.borderlineRange = Double.parseDouble(get(p, "report.borderline.range", "5"));
        cfg.colorMet = get(p, "report.color.met", "90EE90");
        cfg.colorNotMet = get(p, "report.color.not_met", "FFB6C1");
        cfg.colorBorderline = get(p, "report.color.borderline", "FFFFE0");

        cfg.outputDirectory = get(p, "output.default.directory", AppPaths.defaultReportsDir().toString());
        cfg.timestampFiles = Boolean.parseBoolean(get(p, "output.timestamp.files", "true"));
        cfg.includeSummarySheet = Boolean.parseBoolean(get(p, "output.include.summary.sheet", "true"));
        cfg.csvExport = Boolean.parseBoolean(get(p, "output.csv.export", "false"));

        cfg.templatesDirectory = get(p, "templates.directory", AppPaths.defaultTemplatesDir().toString());
        return cfg;
    }

    public static void save(AppConfig cfg) throws IOException {
        save(cfg, AppPaths.configFile());
    }

    public static void save(AppConfig cfg, Path configPath) throws IOException {
        Properties p = new Properties();
        p.setProperty("canvas.base.url", nz(cfg.canvasBaseUrl));
        p.setProperty("canvas.request.timeout.seconds", String.valueOf(cfg.requestTimeoutSeconds));
        p.setProperty("canvas.max.retries", String.valueOf(cfg.maxRetries));
        p.setProperty("canvas.admin.mode", String.valueOf(cfg.adminMode));
        p.setProperty("report.default.threshold", String.valueOf(cfg.defaultThreshold));
        p.setProperty("report.borderline.range", String.valueOf(cfg.borderlineRange));
        p.setProperty("report.color.met", nz(cfg.colorMet));
        p.setProperty("report.color.not_met", nz(cfg.colorNotMet));
        p.setProperty("report.color.borderline", nz(cfg.colorBorderline));
        p.setProperty("output.default.directory", nz(cfg.outputDirectory));
        p.setProperty("output.timestamp.files", String.valueOf(cfg.timestampFiles));
        p.setProperty("output.include.summary.sheet", String.valueOf(cfg.includeSummarySheet));
        p.setProperty("output.csv.export", String.valueOf(cfg.csvExport));
        p.setProperty("templates.directory", nz(cfg.templatesDirectory));

        if (configPath.getParent() != null) Files.createDirectories(configPath.getParent());
        try (OutputStream os = Files.newOutputStream(configPath)) {
            p.store(os, "Panther Assessment settings");
        }
        log.info("Saved config to {}", configPath);
    }

    private static String get(Properties p, String key, String def) {
        String v = p.getProperty(key);
        if (v == null) return def;
        v = v.trim();
        return v.isEmpty() ? def : v;
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
