package assess;

import assess.AssignmentPart.AllQuestionsPart;
import assess.AssignmentPart.QuizGroupPart;
import assess.AssignmentPart.RubricCriterionPart;
import assess.CanvasModel.Submission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static assess.Fixtures.answers;
import static assess.Fixtures.graded;
import static assess.Fixtures.quizSubmission;
import static assess.Fixtures.student;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class OutcomeReportBuilderTest {

    @Mock
    private CanvasApi api;

    private MergedAssignment paper;
    private MergedAssignment quiz;
    private final List<CourseInfo> courses = List.of(
            new CourseInfo(10, "PSY1411 Section A", "PSY1411"),
            new CourseInfo(20, "PSY1411 Section B", "PSY1411"));

    /** Records every progress update. */
    private static final class Recorder implements ReportProgress {
        final List<Integer> percents = new ArrayList<>();
        boolean cancel;

        @Override
        public void update(int percent, String label) {
            percents.add(percent);
        }

        @Override
        public boolean isCancelled() {
            return cancel;
        }
    }

    @BeforeEach
    void setUp() {
        paper = new MergedAssignment(100, "Paper", 20, "PSY1411 Section A", null, false, List.of(), List.of());
        paper.addCourse(10, 100, null);
        paper.addCourse(20, 200, null);
        quiz = new MergedAssignment(300, "Quiz", 10, "PSY1411 Section A", 500L, true, List.of("online_quiz"), List.of());
        quiz.addCourse(10, 300, 500L);
    }

    private static Submission rated(long userId, Double score, String criterion, double points) {
        Submission s = graded(userId, score);
        s.rubricAssessment = Fixtures.withRubric(userId, Map.of(criterion, points)).rubricAssessment;
        return s;
    }

    private void stubStudents() {
        given(api.getEnrollments(10L)).willReturn(List.of(
                student(1, "Ann Zed", "Zed, Ann"), student(3, "Cy Mid", "Mid, Cy")));
        given(api.getEnrollments(20L)).willReturn(List.of(
                student(2, "Bob Adams", "Adams, Bob"), student(3, "Cy Mid", "Mid, Cy")));
    }

    @Test
    @DisplayName("whole-assignment, rubric and quiz-group outcomes are scored per student")
    void build_scoresAllPartKinds() throws ReportException {
        // given
        stubStudents();
        Submission notGraded = graded(3, 5.0);
        notGraded.workflowState = "submitted";
        given(api.getSubmissions(10L, 100L)).willReturn(List.of(
                rated(1, 15.0, "c1", 8), rated(3, 18.0, "c1", 4), graded(2, 99.0)));
        given(api.getSubmissions(20L, 200L)).willReturn(List.of(graded(2, 10.0), notGraded));
        given(api.getQuizSubmissions(10L, 500L)).willReturn(List.of(quizSubmission(900, 1), quizSubmission(901, 3)));
        given(api.getQuizSubmissionQuestions(900L)).willReturn(answers(11, true, false));
        given(api.getQuizSubmissionQuestions(901L)).willReturn(answers(11, true, true));

        OutcomeDefinition writing = new OutcomeDefinition("Writing", "", 70, List.of(paper), Map.of());
        OutcomeDefinition thesis = new OutcomeDefinition("Thesis", "", 70, List.of(paper), Map.of(paper.id,
                List.of(new RubricCriterionPart("Thesis", 10, Map.of(10L, "c1", 20L, "c9")))));
        OutcomeDefinition recall = new OutcomeDefinition("Recall", "", 60, List.of(quiz), Map.of(quiz.id,
                List.of(new QuizGroupPart("Recall", Map.of(10L, 11L), Map.of(10L, 2), Map.of(10L, 2.5)))));
        Recorder progress = new Recorder();

        // when
        OutcomeReport report = new OutcomeReportBuilder(api)
                .build(List.of(writing, thesis, recall), courses, progress);

        // then
        assertThat(report.columns()).containsExactly(
                "Student ID", "Student Name", "Course ID",
                "Writing - Paper", "Writing Total (%)", "Writing Status",
                "Thesis - Paper", "Thesis Total (%)", "Thesis Status",
                "Recall - Quiz", "Recall Total (%)", "Recall Status");
        assertThat(report.rows()).extracting(r -> r.studentName).containsExactly("Adams, Bob", "Mid, Cy", "Zed, Ann");

        ReportRow bob = report.rows().get(0);
        ReportRow cy = report.rows().get(1);
        ReportRow ann = report.rows().get(2);

        assertThat(ann.get("Course ID")).isEqualTo(10L);
        assertThat(bob.get("Course ID")).isEqualTo(20L);

        // whole assignment: only graded submissions of enrolled sections count
        assertThat(ann.get("Writing - Paper")).isEqualTo(15.0);
        assertThat(ann.get("Writing Total (%)")).isEqualTo(75L);
        assertThat(ann.get("Writing Status")).isEqualTo("Met");
        assertThat(bob.get("Writing - Paper")).isEqualTo(10.0);
        assertThat(bob.get("Writing Status")).isEqualTo("Not Met");
        assertThat(cy.get("Writing - Paper")).isEqualTo(18.0);
        assertThat(cy.get("Writing Total (%)")).isEqualTo(90L);

        // rubric criterion
        assertThat(ann.get("Thesis - Paper")).isEqualTo(8.0);
        assertThat(ann.get("Thesis Total (%)")).isEqualTo(80L);
        assertThat(cy.get("Thesis Status")).isEqualTo("Not Met");
        assertThat(bob.get("Thesis - Paper")).isNull();
        assertThat(bob.get("Thesis Total (%)")).isEqualTo(0L);
        assertThat(bob.percentage("Thesis")).isNull();

        // quiz group: correct x points over answered x points
        assertThat(ann.get("Recall - Quiz")).isEqualTo(2.5);
        assertThat(ann.percentage("Recall")).isEqualTo(50.0);
        assertThat(ann.get("Recall Status")).isEqualTo("Not Met");
        assertThat(cy.get("Recall Total (%)")).isEqualTo(100L);
        assertThat(bob.get("Recall - Quiz")).isNull();

        // one submissions fetch per (course, assignment) even though two outcomes use the paper
        then(api).should(times(1)).getSubmissions(10L, 100L);
        assertThat(progress.percents).isSorted().startsWith(10).endsWith(90);
    }

    @Test
    @DisplayName("an all-questions part scores the whole quiz against its points possible")
    void build_allQuestionsPart() throws ReportException {
        // given
        given(api.getEnrollments(10L)).willReturn(List.of(
                student(1, "Ann Zed", "Zed, Ann"), student(3, "Cy Mid", "Mid, Cy")));
        Submission pending = graded(3, 9.0);
        pending.workflowState = "pending_review";
        given(api.getSubmissions(10L, 300L)).willReturn(List.of(graded(1, 7.0), pending));
        OutcomeDefinition recall = new OutcomeDefinition("Recall", "", 60, List.of(quiz),
                Map.of(quiz.id, List.of(AllQuestionsPart.INSTANCE)));

        // when
        OutcomeReport report = new OutcomeReportBuilder(api).build(List.of(recall), courses, ReportProgress.NONE);

        // then
        ReportRow cy = report.rows().get(0);
        ReportRow ann = report.rows().get(1);

        assertThat(ann.get("Recall - Quiz")).isEqualTo(7.0);
        assertThat(ann.percentage("Recall")).isEqualTo(70.0);
        assertThat(ann.get("Recall Total (%)")).isEqualTo(70L);
        assertThat(ann.get("Recall Status")).isEqualTo("Met");

        assertThat(cy.get("Recall - Quiz")).isNull();
        assertThat(cy.percentage("Recall")).isNull();
        assertThat(cy.get("Recall Total (%)")).isEqualTo(0L);
        assertThat(cy.get("Recall Status")).isEqualTo("Not Met");

        then(api).should(never()).getQuizSubmissions(anyLong(), anyLong());
    }

    @Test
    @DisplayName("no enrolled students is an error")
    void build_noStudents() {
        // given
        given(api.getEnrollments(10L)).willReturn(List.of());
        given(api.getEnrollments(20L)).willReturn(List.of());
        OutcomeDefinition writing = new OutcomeDefinition("Writing", "", 70, List.of(paper), Map.of());

        // when / then
        assertThatThrownBy(() -> new OutcomeReportBuilder(api).build(List.of(writing), courses, ReportProgress.NONE))
                .isInstanceOf(ReportException.class)
                .hasMessage("No students found in the selected courses");
    }

    @Test
    @DisplayName("cancelling stops the build")
    void build_cancelled() {
        // given
        stubStudents();
        Recorder progress = new Recorder();
        progress.cancel = true;
        OutcomeDefinition writing = new OutcomeDefinition("Writing", "", 70, List.of(paper), Map.of());

        // when / then
        assertThatThrownBy(() -> new OutcomeReportBuilder(api).build(List.of(writing), courses, progress))
                .isInstanceOf(ReportCancelledException.class);
    }

    @Test
    @DisplayName("totals round half to even")
    void roundHalfEven() {
        assertThat(OutcomeReportBuilder.roundHalfEven(72.5)).isEqualTo(72);
        assertThat(OutcomeReportBuilder.roundHalfEven(73.5)).isEqualTo(74);
        assertThat(OutcomeReportBuilder.roundHalfEven(66.6667)).isEqualTo(67);
        assertThat(OutcomeReportBuilder.roundHalfEven(0)).isZero();
    }
}
