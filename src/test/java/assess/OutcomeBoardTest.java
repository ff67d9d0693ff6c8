package assess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static assess.Fixtures.merged;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeBoardTest {

    private OutcomeBoard board;
    private MergedAssignment paper;
    private MergedAssignment quiz;

    @BeforeEach
    void setUp() {
        board = new OutcomeBoard();
        paper = merged(1, "Paper", 20, 10);
        quiz = merged(2, "Quiz", 10, 10);
    }

    private OutcomeDefinition outcome(String name, double threshold, MergedAssignment... as) {
        return new OutcomeDefinition(name, "desc", threshold, List.of(as), Map.of());
    }

    @Test
    @DisplayName("outcomes keep insertion order and display their summary")
    void add_keepsOrder() {
        // when
        board.add(outcome("Writing", 70, paper));
        board.add(outcome("Knowledge", 75.5, paper, quiz));

        // then
        assertThat(board.outcomes()).extracting(o -> o.name).containsExactly("Writing", "Knowledge");
        assertThat(board.find("Knowledge").displayText()).isEqualTo("Knowledge (75.5%) - 2 assignment(s)");
        assertThat(board.find("Nope")).isNull();
    }

    @Test
    @DisplayName("validation rejects blank names, no assignments, bad thresholds and duplicates")
    void add_validates() {
        board.add(outcome("Writing", 70, paper));

        assertThatThrownBy(() -> board.add(outcome(" ", 70, paper)))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("Please enter an outcome name.");
        assertThatThrownBy(() -> board.add(outcome("Empty", 70)))
                .hasMessage("Please select at least one assignment.");
        assertThatThrownBy(() -> board.add(outcome("High", 101, paper)))
                .hasMessage("Threshold must be between 0 and 100.");
        assertThatThrownBy(() -> board.add(outcome("Writing", 60, quiz)))
                .hasMessage("An outcome named 'Writing' already exists.");
        assertThat(board.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("replace keeps the position and allows keeping the same name")
    void replace_inPlace() {
        // given
        board.add(outcome("A", 70, paper));
        board.add(outcome("B", 70, paper));
        board.add(outcome("C", 70, paper));

        // when
        board.replace("B", outcome("B", 80, quiz));
        board.replace("A", outcome("A2", 70, paper));

        // then
        assertThat(board.outcomes()).extracting(o -> o.name).containsExactly("A2", "B", "C");
        assertThat(board.find("B").threshold).isEqualTo(80.0);
        assertThatThrownBy(() -> board.replace("C", outcome("B", 70, paper)))
                .hasMessage("An outcome named 'B' already exists.");
        assertThatThrownBy(() -> board.replace("Gone", outcome("X", 70, paper)))
                .hasMessage("Outcome 'Gone' no longer exists.");
    }

    @Test
    @DisplayName("renaming an outcome keeps parts of the assignments it still uses")
    void renamed_keepsParts() {
        // given
        AssignmentPart part = new AssignmentPart.RubricCriterionPart("Thesis", 5, Map.of(10L, "c1"));
        OutcomeDefinition original = new OutcomeDefinition("Writing", "", 70, List.of(paper, quiz),
                Map.of(paper.id, List.of(part), quiz.id, List.of(AssignmentPart.AllQuestionsPart.INSTANCE)));

        // when
        OutcomeDefinition renamed = original.renamed("Written Communication", "d", 65, List.of(paper));

        // then
        assertThat(renamed.partsFor(paper)).containsExactly(part);
        assertThat(renamed.partsConfig()).containsOnlyKeys(paper.id);
        assertThat(renamed.usesRubric(paper)).isTrue();
        assertThat(renamed.usesQuizGroups(paper)).isFalse();
    }

    @Test
    @DisplayName("remove, clear and replaceAll")
    void removeAndReplaceAll() {
        // given
        board.add(outcome("A", 70, paper));
        board.add(outcome("B", 70, paper));

        // when / then
        assertThat(board.remove("A")).isTrue();
        assertThat(board.remove("A")).isFalse();
        board.replaceAll(List.of(outcome("X", 50, quiz), outcome("Y", 50, quiz)));
        assertThat(board.outcomes()).extracting(o -> o.name).containsExactly("X", "Y");
        assertThatThrownBy(() -> board.replaceAll(List.of(outcome("Z", 50, quiz), outcome("Z", 50, quiz))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(board.outcomes()).extracting(o -> o.name).containsExactly("X", "Y");
        board.clear();
        assertThat(board.isEmpty()).isTrue();
    }
}
