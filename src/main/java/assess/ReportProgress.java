package assess;

/** Progress sink for report generation, 0..100. */
public interface ReportProgress {

    void update(int percent, String label);

    boolean isCancelled();

    ReportProgress NONE = new ReportProgress() {
        @Override
        public void update(int percent, String label) {
        }

        @Override
        public boolean isCancelled() {
            return false;
        }
    };
}
