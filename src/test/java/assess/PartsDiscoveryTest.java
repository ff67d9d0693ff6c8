package assess;

import assess.AssignmentPart.AllQuestionsPart;
import assess.AssignmentPart.QuizGroupPart;
import assess.AssignmentPart.RubricCriterionPart;
import assess.CanvasModel.Assignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static assess.Fixtures.assignment;
import static assess.Fixtures.criterion;
import static assess.Fixtures.group;
import static assess.Fixtures.question;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class PartsDiscoveryTest {

    @Mock
    private CanvasApi api;

    private PartsDiscovery discovery;

    @BeforeEach
    void setUp() {
        discovery = new PartsDiscovery(api);
    }

    private static MergedAssignment quiz(long... courseIdsAndQuizIds) {
        MergedAssignment a = new MergedAssignment(1, "Midterm", 50, "PSY1411 A", courseIdsAndQuizIds[1], true,
                List.of("online_quiz"), List.of());
        for (int i = 0; i < courseIdsAndQuizIds.length; i += 2) {
            a.addCourse(courseIdsAndQuizIds[i], 100 + i, courseIdsAndQuizIds[i + 1]);
        }
        return a;
    }

    private static MergedAssignment paper() {
        MergedAssignment a = new MergedAssignment(7, "Paper", 20, "PSY1411 A", null, false,
                List.of("online_upload"), List.of(criterion("fallback", "Thesis", 10)));
        a.addCourse(1, 70, null);
        a.addCourse(2, 80, null);
        return a;
    }

    @Test
    @DisplayName("hasQuiz and hasRubric look at quiz ids and rubric")
    void detection() {
        assertThat(discovery.hasQuiz(quiz(1, 500))).isTrue();
        assertThat(discovery.hasQuiz(paper())).isFalse();
        assertThat(discovery.hasRubric(paper())).isTrue();
        assertThat(discovery.hasRubric(quiz(1, 500))).isFalse();
    }

    @Test
    @DisplayName("question groups are merged by name across sections")
    void discoverQuizGroups_mergesByName() {
        // given
        MergedAssignment a = quiz(1, 500, 2, 600);
        given(api.getQuizQuestions(1L, 500L)).willReturn(List.of(question(1, 11L), question(2, 11L), question(3, 12L)));
        given(api.getQuizQuestions(2L, 600L)).willReturn(List.of(question(4, 21L), question(5, null)));
        given(api.getQuizGroup(1L, 500L, 11L)).willReturn(group(11, "Memory", 2, 2.5));
        given(api.getQuizGroup(1L, 500L, 12L)).willReturn(group(12, null, 1, 1));
        given(api.getQuizGroup(2L, 600L, 21L)).willReturn(group(21, "Memory", 3, 2));

        // when
        List<AssignmentPart> parts = discovery.discoverQuizGroups(a);

        // then
        assertThat(parts).hasSize(2);
        QuizGroupPart memory = (QuizGroupPart) parts.get(0);
        assertThat(memory.groupName).isEqualTo("Memory");
        assertThat(memory.groupIdFor(1L)).isEqualTo(11L);
        assertThat(memory.groupIdFor(2L)).isEqualTo(21L);
        assertThat(memory.pickCountFor(2L)).isEqualTo(3);
        assertThat(memory.displayText()).isEqualTo("Memory (2 questions, 2.5 pts each) - 2 course(s)");
        assertThat(((QuizGroupPart) parts.get(1)).groupName).isEqualTo("Group 12");
    }

    @Test
    @DisplayName("a quiz without groups offers All Questions, and a failing group is skipped")
    void discoverQuizGroups_fallbacks() {
        // given
        MergedAssignment plain = quiz(1, 500);
        given(api.getQuizQuestions(1L, 500L)).willReturn(List.of(question(1, null)));
        MergedAssignment broken = quiz(2, 600);
        given(api.getQuizQuestions(2L, 600L)).willReturn(List.of(question(2, 30L)));
        given(api.getQuizGroup(2L, 600L, 30L)).willThrow(new CanvasApiException(404, "Resource not found"));

        // when / then
        assertThat(discovery.discoverQuizGroups(plain)).containsExactly(AllQuestionsPart.INSTANCE);
        assertThat(discovery.discoverQuizGroups(broken)).containsExactly(AllQuestionsPart.INSTANCE);
    }

    @Test
    @DisplayName("rubric criteria group by description; a failed fetch falls back to the merged rubric")
    void discoverRubricCriteria() {
        // given
        Assignment first = assignment(70, "Paper", 20);
        first.rubric = List.of(criterion("c1", " Thesis ", 10), criterion("c2", "Evidence", 5));
        given(api.getAssignment(1L, 70L)).willReturn(first);
        given(api.getAssignment(2L, 80L)).willThrow(new CanvasApiException(403, "denied"));

        // when
        List<RubricCriterionPart> parts = discovery.discoverRubricCriteria(paper());

        // then
        assertThat(parts).extracting(p -> p.description).containsExactly("Thesis", "Evidence");
        assertThat(parts.get(0).criterionIdFor(1L)).isEqualTo("c1");
        assertThat(parts.get(0).criterionIdFor(2L)).isEqualTo("fallback");
        assertThat(parts.get(0).displayText()).isEqualTo("Thesis (10 pts) - 2 course(s)");
        assertThat(parts.get(1).criterionIdsByCourse()).containsOnlyKeys(1L);
    }

    @Test
    @DisplayName("rediscover keeps only the named groups and criteria, groups first")
    void rediscover_filtersByName() {
        // given
        MergedAssignment a = new MergedAssignment(1, "Unit Test", 30, "PSY1411 A", 500L, true,
                List.of("online_quiz"), List.of());
        a.addCourse(1, 100, 500L);
        Assignment withRubric = assignment(100, "Unit Test", 30);
        withRubric.rubric = List.of(criterion("r1", "Clarity", 4), criterion("r2", "Depth", 6));
        given(api.getQuizQuestions(1L, 500L)).willReturn(List.of(question(1, 11L), question(2, 12L)));
        given(api.getQuizGroup(1L, 500L, 11L)).willReturn(group(11, "Recall", 2, 1));
        given(api.getQuizGroup(1L, 500L, 12L)).willReturn(group(12, "Application", 2, 2));
        given(api.getAssignment(1L, 100L)).willReturn(withRubric);

        // when
        List<AssignmentPart> parts = discovery.rediscover(a, List.of("Application"), List.of("  clarity "));

        // then
        assertThat(parts).hasSize(2);
        assertThat(((QuizGroupPart) parts.get(0)).groupName).isEqualTo("Application");
        assertThat(((RubricCriterionPart) parts.get(1)).description).isEqualTo("Clarity");
    }

    @Test
    @DisplayName("rediscover skips a section whose quiz cannot be read")
    void rediscover_skipsUnreadableQuiz() {
        // given
        MergedAssignment a = quiz(1, 500, 2, 600);
        given(api.getQuizQuestions(1L, 500L)).willThrow(new CanvasApiException(0, "Request timed out"));
        given(api.getQuizQuestions(2L, 600L)).willReturn(List.of(question(1, 21L)));
        given(api.getQuizGroup(2L, 600L, 21L)).willReturn(group(21, "Recall", 2, 1));

        // when
        List<AssignmentPart> parts = discovery.rediscover(a, List.of("Recall"), List.of());

        // then
        assertThat(parts).hasSize(1);
        assertThat(((QuizGroupPart) parts.get(0)).groupIdsByCourse()).containsOnlyKeys(2L);
    }
}
