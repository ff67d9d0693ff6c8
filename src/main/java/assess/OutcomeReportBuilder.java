package assess;

import assess.AssignmentPart.AllQuestionsPart;
import assess.AssignmentPart.QuizGroupPart;
import assess.AssignmentPart.RubricCriterionPart;
import assess.CanvasModel.Enrollment;
import assess.CanvasModel.QuizSubmission;
import assess.CanvasModel.QuizSubmissionQuestion;
import assess.CanvasModel.RubricRating;
import assess.CanvasModel.Submission;
import assess.CanvasModel.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls enrollments, submissions, quiz answers and rubric assessments for the
 * selected outcomes and turns them into one row per student.
 *
 * Everything is fetched up front per course section; scoring then only reads
 * the caches. A student's scores only come from sections they are enrolled in.
 */
public class OutcomeReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(OutcomeReportBuilder.class);

    private final CanvasApi api;

    // (course, assignment) -> submissions, shared by score and rubric passes
    private final Map<List<Long>, List<Submission>> submissionCache = new HashMap<>();

    public OutcomeReportBuilder(CanvasApi api) {
        this.api = api;
    }

    private static final class Student {
        final long id;
        final String name;
        final String sortableName;
        final List<Long> courses = new ArrayList<>();

        Student(long id, String name, String sortableName) {
            this.id = id;
            this.name = name;
            this.sortableName = sortableName;
        }

        boolean enrolledIn(long courseId) {
            return courses.contains(courseId);
        }
    }

    public OutcomeReport build(List<OutcomeDefinition> outcomes, List<CourseInfo> selectedCourses,
                               ReportProgress progress) throws ReportException {
        submissionCache.clear();

        Set<Long> courseIds = new LinkedHashSet<>();
        for (OutcomeDefinition o : outcomes) {
            for (MergedAssignment a : o.assignments()) courseIds.addAll(a.courseIds());
        }
        if (courseIds.isEmpty()) {
            for (CourseInfo c : selectedCourses) courseIds.add(c.id);
        }

        progress.update(10, "Fetching students...");
        Map<Long, Student> students = fetchStudents(courseIds);
        if (students.isEmpty()) {
            throw new ReportException("No students found in the selected courses");
        }
        log.info("Building report: {} outcome(s), {} course(s), {} student(s)",
                outcomes.size(), courseIds.size(), students.size());

        progress.update(20, "Fetching assignment submissions...");
        Map<Long, Map<Long, Double>> wholeScores = fetchWholeScores(outcomes, students, progress);

        progress.update(35, "Pre-fetching quiz data...");
        Map<List<Long>, Map<Long, List<QuizSubmissionQuestion>>> quizData = fetchQuizData(outcomes, students, progress);

        progress.update(55, "Pre-fetching rubric data...");
        Map<List<Long>, Map<String, RubricRating>> rubricData = fetchRubricData(outcomes, students, progress);

        progress.update(70, "Calculating outcome scores...");
        List<String> columns = columns(outcomes);
        List<ReportRow> rows = new ArrayList<>();
        int idx = 0;
        for (Student s : students.values()) {
            if (progress.isCancelled()) throw new ReportCancelledException();
            rows.add(scoreStudent(s, outcomes, wholeScores, quizData, rubricData));
            progress.update(70 + (int) ((idx++ / (double) students.size()) * 20), "Calculating outcome scores...");
        }
        rows.sort(Comparator.comparing((ReportRow r) -> r.studentName));

        progress.update(90, "Creating report...");
        return new OutcomeReport(columns, rows, outcomes, selectedCourses);
    }

    // -------------------- fetch --------------------

    private Map<Long, Student> fetchStudents(Set<Long> courseIds) {
        Map<Long, Student> students = new LinkedHashMap<>();
        for (long cid : courseIds) {
            for (Enrollment e : api.getEnrollments(cid)) {
                User u = e.user;
                if (u == null || u.id == null) continue;
                Student s = students.get(u.id);
                if (s == null) {
                    s = new Student(u.id, u.name == null ? "Unknown" : u.name,
                            u.sortableName == null ? "Unknown" : u.sortableName);
                    students.put(u.id, s);
                }
                s.courses.add(cid);
            }
        }
        return students;
    }

    private Map<Long, Map<Long, Double>> fetchWholeScores(List<OutcomeDefinition> outcomes,
                                                          Map<Long, Student> students,
                                                          ReportProgress progress) throws ReportCancelledException {
        Map<Long, Map<Long, Double>> scores = new HashMap<>();
        int idx = 0;
        for (OutcomeDefinition o : outcomes) {
            for (MergedAssignment a : o.assignments()) {
                if (scores.containsKey(a.id)) continue;
                Map<Long, Double> byStudent = new HashMap<>();
                scores.put(a.id, byStudent);
                for (long cid : a.courseIds()) {
                    for (Submission sub : submissions(cid, a.assignmentIdFor(cid))) {
                        Student s = sub.userId == null ? null : students.get(sub.userId);
                        if (s == null || !s.enrolledIn(cid)) continue;
                        if ("graded".equals(sub.workflowState) && sub.score != null) {
                            byStudent.put(s.id, sub.score);
                        }
                    }
                }
            }
            idx++;
            progress.update(20 + (int) ((idx - 1) / (double) outcomes.size() * 15),
                    "Fetching submissions... (" + idx + "/" + outcomes.size() + " outcomes)");
            if (progress.isCancelled()) throw new ReportCancelledException();
        }
        return scores;
    }

    /** (course, quiz, student) -> question group -> answered questions */
    private Map<List<Long>, Map<Long, List<QuizSubmissionQuestion>>> fetchQuizData(
            List<OutcomeDefinition> outcomes, Map<Long, Student> students, ReportProgress progress)
            throws ReportCancelledException {
        Map<List<Long>, Map<Long, List<QuizSubmissionQuestion>>> data = new HashMap<>();
        Set<List<Long>> quizzes = new LinkedHashSet<>();
        for (OutcomeDefinition o : outcomes) {
            for (MergedAssignment a : o.assignments()) {
                if (!o.usesQuizGroups(a)) continue;
                for (long cid : a.courseIds()) {
                    Long qid = a.quizIdsByCourse().get(cid);
                    if (qid != null) quizzes.add(List.of(cid, qid));
                }
            }
        }

        int idx = 0;
        for (List<Long> quiz : quizzes) {
            long cid = quiz.get(0);
            long qid = quiz.get(1);
            for (QuizSubmission qs : api.getQuizSubmissions(cid, qid)) {
                Student s = qs.userId == null ? null : students.get(qs.userId);
                if (s == null || !s.enrolledIn(cid) || qs.id == null) continue;
                Map<Long, List<QuizSubmissionQuestion>> byGroup =
                        data.computeIfAbsent(List.of(cid, qid, s.id), k -> new HashMap<>());
                for (QuizSubmissionQuestion q : api.getQuizSubmissionQuestions(qs.id)) {
                    if (q.quizGroupId == null) continue;
                    byGroup.computeIfAbsent(q.quizGroupId, g -> new ArrayList<>()).add(q);
                }
            }
            progress.update(35 + (int) (idx++ / (double) quizzes.size() * 20),
                    "Pre-fetching quiz data... (" + idx + "/" + quizzes.size() + " quizzes)");
            if (progress.isCancelled()) throw new ReportCancelledException();
        }
        return data;
    }

    /** (course, course assignment id, student) -> criterion id -> rating */
    private Map<List<Long>, Map<String, RubricRating>> fetchRubricData(
            List<OutcomeDefinition> outcomes, Map<Long, Student> students, ReportProgress progress)
            throws ReportCancelledException {
        Map<List<Long>, Map<String, RubricRating>> data = new HashMap<>();
        Map<Long, MergedAssignment> rubricAssignments = new LinkedHashMap<>();
        for (OutcomeDefinition o : outcomes) {
            for (MergedAssignment a : o.assignments()) {
                if (o.usesRubric(a)) rubricAssignments.putIfAbsent(a.id, a);
            }
        }

        int idx = 0;
        for (MergedAssignment a : rubricAssignments.values()) {
            for (long cid : a.courseIds()) {
                long aid = a.assignmentIdFor(cid);
                for (Submission sub : submissions(cid, aid)) {
                    Student s = sub.userId == null ? null : students.get(sub.userId);
                    if (s == null || !s.enrolledIn(cid)) continue;
                    if (sub.rubricAssessment != null && !sub.rubricAssessment.isEmpty()) {
                        data.put(List.of(cid, aid, s.id), sub.rubricAssessment);
                    }
                }
            }
            progress.update(55 + (int) (idx++ / (double) rubricAssignments.size() * 15),
                    "Pre-fetching rubric data... (" + idx + "/" + rubricAssignments.size() + " assignments)");
            if (progress.isCancelled()) throw new ReportCancelledException();
        }
        return data;
    }

    private List<Submission> submissions(long courseId, long assignmentId) {
        return submissionCache.computeIfAbsent(List.of(courseId, assignmentId),
                k -> api.getSubmissions(courseId, assignmentId));
    }

    // -------------------- scoring --------------------

    private static List<String> columns(List<OutcomeDefinition> outcomes) {
        Set<String> cols = new LinkedHashSet<>();
        cols.add(OutcomeReport.COL_STUDENT_ID);
        cols.add(OutcomeReport.COL_STUDENT_NAME);
        cols.add(OutcomeReport.COL_COURSE_ID);
        for (OutcomeDefinition o : outcomes) {
            for (MergedAssignment a : o.assignments()) cols.add(OutcomeReport.scoreColumn(o, a));
            cols.add(OutcomeReport.totalColumn(o));
            cols.add(OutcomeReport.statusColumn(o));
        }
        return new ArrayList<>(cols);
    }

    private ReportRow scoreStudent(Student s, List<OutcomeDefinition> outcomes,
                                   Map<Long, Map<Long, Double>> wholeScores,
                                   Map<List<Long>, Map<Long, List<QuizSubmissionQuestion>>> quizData,
                                   Map<List<Long>, Map<String, RubricRating>> rubricData) {
        ReportRow row = new ReportRow(s.id, s.sortableName, s.courses.isEmpty() ? null : s.courses.get(0));

        for (OutcomeDefinition o : outcomes) {
            double earned = 0;
            double possible = 0;

            for (MergedAssignment a : o.assignments()) {
                String col = OutcomeReport.scoreColumn(o, a);
                Double whole = wholeScores.getOrDefault(a.id, Map.of()).get(s.id);
                List<AssignmentPart> parts = o.partsFor(a);

                if (parts.isEmpty()) {
                    row.put(col, whole);
                    if (whole != null) {
                        earned += whole;
                        possible += a.pointsPossible;
                    }
                    continue;
                }

                double partEarned = 0;
                double partPossible = 0;
                for (AssignmentPart part : parts) {
                    double[] ep = null;
                    if (part instanceof QuizGroupPart) {
                        ep = scoreQuizGroup((QuizGroupPart) part, a, s, quizData);
                    } else if (part instanceof RubricCriterionPart) {
                        ep = scoreRubricCriterion((RubricCriterionPart) part, a, s, rubricData);
                    } else if (part instanceof AllQuestionsPart && whole != null) {
                        ep = new double[]{whole, a.pointsPossible};
                    }
                    if (ep != null) {
                        partEarned += ep[0];
                        partPossible += ep[1];
                    }
                }

                if (partPossible > 0 || partEarned > 0) {
                    row.put(col, partEarned);
                    earned += partEarned;
                    possible += partPossible;
                } else {
                    row.put(col, null);
                }
            }

            double pct = possible > 0 ? earned / possible * 100 : 0;
            if (possible > 0) row.putPercentage(o.name, pct);
            row.put(OutcomeReport.totalColumn(o), roundHalfEven(pct));
            row.put(OutcomeReport.statusColumn(o), pct >= o.threshold ? OutcomeReport.MET : OutcomeReport.NOT_MET);
        }
        return row;
    }

    /** First section of the student's with answers for the group: correct x points over answered x points. */
    private static double[] scoreQuizGroup(QuizGroupPart part, MergedAssignment a, Student s,
                                           Map<List<Long>, Map<Long, List<QuizSubmissionQuestion>>> quizData) {
        for (long cid : a.courseIds()) {
            if (!s.enrolledIn(cid)) continue;
            Long gid = part.groupIdFor(cid);
            Long qid = a.quizIdsByCourse().get(cid);
            if (gid == null || qid == null) continue;
            Map<Long, List<QuizSubmissionQuestion>> byGroup = quizData.get(List.of(cid, qid, s.id));
            if (byGroup == null || !byGroup.containsKey(gid)) continue;

            List<QuizSubmissionQuestion> questions = byGroup.get(gid);
            double pts = part.questionPointsFor(cid);
            int correct = 0;
            for (QuizSubmissionQuestion q : questions) if (q.answeredCorrectly()) correct++;
            return new double[]{correct * pts, questions.size() * pts};
        }
        return null;
    }

    private static double[] scoreRubricCriterion(RubricCriterionPart part, MergedAssignment a, Student s,
                                                 Map<List<Long>, Map<String, RubricRating>> rubricData) {
        for (long cid : a.courseIds()) {
            if (!s.enrolledIn(cid)) continue;
            String criterionId = part.criterionIdFor(cid);
            if (criterionId == null) continue;
            Map<String, RubricRating> assessment = rubricData.get(List.of(cid, a.assignmentIdFor(cid), s.id));
            if (assessment == null || !assessment.containsKey(criterionId)) continue;
            RubricRating rating = assessment.get(criterionId);
            double points = rating == null ? 0 : Numbers.nz(rating.points);
            return new double[]{points, part.points};
        }
        return null;
    }

    static long roundHalfEven(double v) {
        return new BigDecimal(v).setScale(0, RoundingMode.HALF_EVEN).longValue();
    }
}
