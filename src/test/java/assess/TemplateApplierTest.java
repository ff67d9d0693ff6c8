package assess;

import assess.AssignmentPart.QuizGroupPart;
import assess.AssignmentPart.RubricCriterionPart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static assess.Fixtures.merged;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class TemplateApplierTest {

    @Mock
    private PartsDiscovery discovery;

    private MergedAssignment paper;
    private MergedAssignment exam;
    private AssignmentCatalog catalog;

    @BeforeEach
    void setUp() {
        paper = merged(1, "Paper", 20, 10, 11);
        exam = new MergedAssignment(2, "Exam", 50, "PSY3421 Section 1", 40L, true, List.of("online_quiz"), List.of());
        exam.addCourse(10, 2, 40L);
        catalog = new AssignmentCatalog(List.of(paper, exam), List.of(new CourseInfo(10, "PSY3421 Section 1", "PSY3421")));
    }

    @Test
    @DisplayName("outcomes saved from the board carry part names, not ids")
    void fromOutcomes() {
        // given
        RubricCriterionPart org = new RubricCriterionPart("Organization", 5, Map.of(10L, "_a", 11L, "_b"));
        QuizGroupPart core = new QuizGroupPart("Core", Map.of(10L, 7L), Map.of(10L, 2), Map.of(10L, 5.0));
        OutcomeDefinition o = new OutcomeDefinition("Writing", "prose", 80, List.of(paper, exam),
                Map.of(paper.id, List.of(org), exam.id, List.of(core)));
        LocalDateTime now = LocalDateTime.of(2025, 1, 2, 3, 4);

        // when
        CourseTemplate t = TemplateMapper.fromOutcomes("Core Set", "PSY3421", null, " ", List.of(o), now);

        // then
        assertThat(t.createdBy).isEqualTo("User");
        assertThat(t.createdDate).isEqualTo(now);
        assertThat(t.notes).isEmpty();
        CourseTemplate.Outcome to = t.outcomes.get(0);
        assertThat(to.title).isEqualTo("Writing");
        assertThat(to.threshold).isEqualTo(80);
        assertThat(to.assignments).extracting(a -> a.assignmentType).containsExactly("assignment", "quiz");
        assertThat(to.assignments.get(0).rubricCriteria).extracting(c -> c.description).containsExactly("Organization");
        assertThat(to.assignments.get(1).questionGroups).extracting(g -> g.name).containsExactly("Core");
        assertThat(TemplateMapper.defaultCourseCode(catalog)).isEqualTo("PSY1411");
        assertThat(TemplateMapper.defaultCourseCode(new AssignmentCatalog(List.of(), List.of()))).isEqualTo("UNKNOWN");
    }

    @Test
    @DisplayName("applying matches assignments by name and rediscovers selected parts")
    void apply() {
        // given
        CourseTemplate t = new CourseTemplate();
        t.templateName = "Core Set";
        t.outcomes.add(outcome("Writing", assignment("Paper", "Organization", null), assignment("Missing", null, null)));
        t.outcomes.add(outcome("Knowledge", assignment("Exam", null, "Core")));
        t.outcomes.add(outcome("Gone", assignment("Old Quiz", null, "Core")));
        CourseTemplate.Outcome excluded = outcome("Excluded", assignment("Paper", null, null));
        excluded.included = false;
        t.outcomes.add(excluded);

        RubricCriterionPart org = new RubricCriterionPart("Organization", 5, Map.of(10L, "_a"));
        QuizGroupPart core = new QuizGroupPart("Core", Map.of(10L, 7L), Map.of(10L, 2), Map.of(10L, 5.0));
        given(discovery.rediscover(paper, List.of(), List.of("Organization"))).willReturn(List.of(org));
        given(discovery.rediscover(exam, List.of("Core"), List.of())).willReturn(List.of(core));

        // when
        List<OutcomeDefinition> result = new TemplateApplier(discovery).apply(t, catalog);

        // then
        assertThat(result).extracting(o -> o.name).containsExactly("Writing", "Knowledge");
        assertThat(result.get(0).assignments()).containsExactly(paper);
        assertThat(result.get(0).partsFor(paper)).containsExactly(org);
        assertThat(result.get(1).partsFor(exam)).containsExactly(core);
    }

    @Test
    @DisplayName("an assignment without selected parts counts whole and skips discovery")
    void apply_wholeAssignment() {
        // given
        CourseTemplate t = new CourseTemplate();
        t.templateName = "Whole";
        CourseTemplate.Assignment a = assignment("Paper", "Organization", null);
        a.rubricCriteria.get(0).selected = false;
        t.outcomes.add(outcome("Writing", a));

        // when
        List<OutcomeDefinition> result = new TemplateApplier(discovery).apply(t, catalog);

        // then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).partsConfig()).isEmpty();
        then(discovery).should(never()).rediscover(any(), any(), any());
    }

    private static CourseTemplate.Outcome outcome(String title, CourseTemplate.Assignment... assignments) {
        CourseTemplate.Outcome o = new CourseTemplate.Outcome();
        o.title = title;
        o.description = "";
        o.assignments.addAll(List.of(assignments));
        return o;
    }

    private static CourseTemplate.Assignment assignment(String name, String criterion, String group) {
        CourseTemplate.Assignment a = new CourseTemplate.Assignment();
        a.name = name;
        a.assignmentType = group == null ? "assignment" : "quiz";
        if (criterion != null) a.rubricCriteria.add(new CourseTemplate.RubricCriterion(criterion));
        if (group != null) a.questionGroups.add(new CourseTemplate.QuestionGroup(group));
        return a;
    }
}
