package assess;

public class AppConfig {
    // Canvas
    public String canvasBaseUrl = "";
    public int requestTimeoutSeconds = 30;
    /** How many times a 429 response is retried before giving up. */
    public int maxRetries = 5;
    /** List courses through the admin accounts instead of teacher enrollments. */
    public boolean adminMode = false;

    // Report
    public double defaultThreshold = 70;
    /** Points below the threshold that still count as borderline. */
    public double borderlineRange = 5;
    public String colorMet = "90EE90";
    public String colorNotMet = "FFB6C1";
    public String colorBorderline = "FFFFE0";

    // Output
    public String outputDirectory;
    public boolean timestampFiles = true;
    public boolean includeSummarySheet = true;
    public boolean csvExport = false;

    // Templates
    public String templatesDirectory;
}
