package assess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Summary numbers for one outcome over a set of students (all, or one course section). */
public class OutcomeStatistics {

    public static final String SCOPE_ALL = "All";

    public final String outcome;
    public final String scope;
    public final double threshold;
    public final int count;
    public final double mean;
    public final double median;
    public final double stdDev;
    public final double percentMeeting;
    public final int met;
    public final int borderline;
    public final int notMet;

    private OutcomeStatistics(String outcome, String scope, double threshold, int count, double mean, double median,
                              double stdDev, double percentMeeting, int met, int borderline, int notMet) {
        this.outcome = outcome;
        this.scope = scope;
        this.threshold = threshold;
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.stdDev = stdDev;
        this.percentMeeting = percentMeeting;
        this.met = met;
        this.borderline = borderline;
        this.notMet = notMet;
    }

    /**
     * Statistics over the given percentages. Borderline means below the threshold
     * by less than {@code borderlineRange} points; Not Met excludes borderline.
     */
    public static OutcomeStatistics of(String outcome, String scope, double threshold,
                                       List<Double> percentages, double borderlineRange) {
        List<Double> v = new ArrayList<>(percentages);
        Collections.sort(v);
        int n = v.size();
        if (n == 0) return new OutcomeStatistics(outcome, scope, threshold, 0, 0, 0, 0, 0, 0, 0, 0);

        double sum = 0;
        int met = 0;
        int borderline = 0;
        for (double p : v) {
            sum += p;
            if (p >= threshold) met++;
            else if (p >= threshold - borderlineRange) borderline++;
        }
        double mean = sum / n;
        double median = n % 2 == 1 ? v.get(n / 2) : (v.get(n / 2 - 1) + v.get(n / 2)) / 2.0;

        double sd = 0;
        if (n > 1) {
            double sq = 0;
            for (double p : v) sq += (p - mean) * (p - mean);
            sd = Math.sqrt(sq / (n - 1));
        }
        return new OutcomeStatistics(outcome, scope, threshold, n, mean, median, sd,
                met * 100.0 / n, met, borderline, n - met - borderline);
    }

    /** One "All" entry per outcome followed by one per course section. */
    public static List<OutcomeStatistics> summarize(OutcomeReport report, double borderlineRange) {
        List<OutcomeStatistics> out = new ArrayList<>();
        for (OutcomeDefinition o : report.outcomes()) {
            out.add(of(o.name, SCOPE_ALL, o.threshold, percentages(report, o, null), borderlineRange));
            for (CourseInfo c : report.courses()) {
                out.add(of(o.name, c.name, o.threshold, percentages(report, o, c.id), borderlineRange));
            }
        }
        return out;
    }

    private static List<Double> percentages(OutcomeReport report, OutcomeDefinition o, Long courseId) {
        List<Double> out = new ArrayList<>();
        for (ReportRow r : report.rows()) {
            if (courseId != null && !courseId.equals(r.courseId)) continue;
            Double p = r.percentage(o.name);
            if (p != null) out.add(p);
        }
        return out;
    }

    /** Met / Borderline / Not Met label for one percentage. */
    public static String band(double pct, double threshold, double borderlineRange) {
        if (pct >= threshold) return OutcomeReport.MET;
        if (pct >= threshold - borderlineRange) return "Borderline";
        return OutcomeReport.NOT_MET;
    }
}
