package assess;

import assess.CanvasModel.Account;
import assess.CanvasModel.Assignment;
import assess.CanvasModel.Course;
import assess.CanvasModel.Enrollment;
import assess.CanvasModel.Outcome;
import assess.CanvasModel.QuizGroup;
import assess.CanvasModel.QuizQuestion;
import assess.CanvasModel.QuizSubmission;
import assess.CanvasModel.QuizSubmissionQuestion;
import assess.CanvasModel.Submission;
import assess.CanvasModel.User;

import java.util.List;

/**
 * The Canvas calls the reporter needs. Every method throws {@link CanvasApiException}
 * on failure except {@link #testConnection()}, which answers false.
 */
public interface CanvasApi {

    boolean testConnection();

    User getUserInfo();

    List<Account> getAccounts();

    /** Active courses of the current user; enrollmentType may be null for all roles. */
    List<Course> getCourses(String enrollmentType);

    List<Course> getAccountCourses(long accountId);

    Course getCourse(long courseId);

    /** Active student enrollments. */
    List<Enrollment> getEnrollments(long courseId);

    List<Assignment> getAssignments(long courseId);

    Assignment getAssignment(long courseId, long assignmentId);

    List<Submission> getSubmissions(long courseId, long assignmentId);

    List<QuizQuestion> getQuizQuestions(long courseId, long quizId);

    QuizGroup getQuizGroup(long courseId, long quizId, long groupId);

    List<QuizSubmission> getQuizSubmissions(long courseId, long quizId);

    List<QuizSubmissionQuestion> getQuizSubmissionQuestions(long quizSubmissionId);

    List<Outcome> getOutcomes(long courseId);

    @FunctionalInterface
    interface Factory {
        CanvasApi create(String baseUrl, String token);
    }
}
