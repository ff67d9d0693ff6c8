package assess;

import assess.CanvasModel.Assignment;
import assess.CanvasModel.Course;
import assess.CanvasModel.Enrollment;
import assess.CanvasModel.QuizGroup;
import assess.CanvasModel.QuizQuestion;
import assess.CanvasModel.QuizSubmission;
import assess.CanvasModel.QuizSubmissionQuestion;
import assess.CanvasModel.RubricCriterion;
import assess.CanvasModel.RubricRating;
import assess.CanvasModel.Submission;
import assess.CanvasModel.Term;
import assess.CanvasModel.User;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for Canvas payloads used across tests. */
final class Fixtures {

    private Fixtures() {}

    static Course course(long id, String name, String code, String term) {
        Course c = new Course();
        c.id = id;
        c.name = name;
        c.courseCode = code;
        if (term != null) {
            c.term = new Term();
            c.term.name = term;
        }
        return c;
    }

    static Assignment assignment(long id, String name, double points) {
        Assignment a = new Assignment();
        a.id = id;
        a.name = name;
        a.pointsPossible = points;
        a.submissionTypes = List.of("online_upload");
        return a;
    }

    static Assignment quizAssignment(long id, String name, double points, long quizId) {
        Assignment a = assignment(id, name, points);
        a.quizId = quizId;
        a.isQuizAssignment = true;
        a.submissionTypes = List.of("online_quiz");
        return a;
    }

    static RubricCriterion criterion(String id, String description, double points) {
        RubricCriterion c = new RubricCriterion();
        c.id = id;
        c.description = description;
        c.points = points;
        return c;
    }

    static Enrollment student(long userId, String name, String sortable) {
        User u = new User();
        u.id = userId;
        u.name = name;
        u.sortableName = sortable;
        Enrollment e = new Enrollment();
        e.userId = userId;
        e.user = u;
        return e;
    }

    static Submission graded(long userId, Double score) {
        Submission s = new Submission();
        s.userId = userId;
        s.score = score;
        s.workflowState = "graded";
        return s;
    }

    static Submission withRubric(long userId, Map<String, Double> points) {
        Submission s = graded(userId, null);
        Map<String, RubricRating> ratings = new LinkedHashMap<>();
        points.forEach((k, v) -> {
            RubricRating r = new RubricRating();
            r.points = v;
            ratings.put(k, r);
        });
        s.rubricAssessment = ratings;
        return s;
    }

    static QuizQuestion question(long id, Long groupId) {
        QuizQuestion q = new QuizQuestion();
        q.id = id;
        q.quizGroupId = groupId;
        return q;
    }

    static QuizGroup group(long id, String name, int pick, double points) {
        QuizGroup g = new QuizGroup();
        g.id = id;
        g.name = name;
        g.pickCount = pick;
        g.questionPoints = points;
        return g;
    }

    static QuizSubmission quizSubmission(long id, long userId) {
        QuizSubmission s = new QuizSubmission();
        s.id = id;
        s.userId = userId;
        return s;
    }

    /** answers: one boolean per question, all in the given group */
    static List<QuizSubmissionQuestion> answers(long groupId, boolean... correct) {
        List<QuizSubmissionQuestion> out = new ArrayList<>();
        long id = 1;
        for (boolean c : correct) {
            QuizSubmissionQuestion q = new QuizSubmissionQuestion();
            q.id = id++;
            q.quizGroupId = groupId;
            q.correct = c;
            out.add(q);
        }
        return out;
    }

    static MergedAssignment merged(long id, String name, double points, long... courseIds) {
        MergedAssignment a = new MergedAssignment(id, name, points, "PSY1411 Section", null, false,
                List.of("online_upload"), List.of());
        for (long cid : courseIds) a.addCourse(cid, id, null);
        return a;
    }
}
