package assess;

public class ReportCancelledException extends ReportException {
    public ReportCancelledException() {
        super("Report generation cancelled");
    }
}
