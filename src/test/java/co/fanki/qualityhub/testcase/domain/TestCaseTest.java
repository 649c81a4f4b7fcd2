package co.fanki.qualityhub.testcase.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for TestCase aggregate.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TestCaseTest {

    @Test
    void whenCreating_givenTitleOnly_shouldApplyDefaultsAtVersionOne() {
        final TestCase testCase = TestCase.create("project-1",
                titled("Login works"), "user-1");

        assertEquals(1, testCase.version());
        assertEquals(TestCaseTemplate.STEPS, testCase.templateType());
        assertEquals(TestCasePriority.MEDIUM, testCase.priority());
        assertEquals("user-1", testCase.createdBy());
        assertNull(testCase.deletedAt());
    }

    @Test
    void whenCreating_givenTooShortTitle_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> TestCase.create("project-1", titled("ab"), null));
    }

    @Test
    void whenCreating_givenNegativeEstimate_shouldThrowException() {
        final TestCaseDetails details = new TestCaseDetails(null,
                "Login works", null, null, null, null, null, -1, null);

        assertThrows(IllegalArgumentException.class,
                () -> TestCase.create("project-1", details, null));
    }

    @Test
    void whenUpdating_givenPartialDetails_shouldKeepOtherFieldsAndBumpVersion() {
        final TestCase testCase = TestCase.create("project-1",
                new TestCaseDetails("section-1", "Login works",
                        TestCaseTemplate.TEXT, "User exists", null,
                        "Dashboard shown", TestCasePriority.HIGH, 5, null),
                null);

        testCase.update(new TestCaseDetails(null, null, null, null, null,
                null, TestCasePriority.CRITICAL, null, null));

        assertEquals(2, testCase.version());
        assertEquals("Login works", testCase.title());
        assertEquals("section-1", testCase.sectionId());
        assertEquals(TestCaseTemplate.TEXT, testCase.templateType());
        assertEquals(TestCasePriority.CRITICAL, testCase.priority());
        assertEquals(5, testCase.estimate());
    }

    @Test
    void whenMoving_givenNewSection_shouldBumpVersion() {
        final TestCase testCase = TestCase.create("project-1",
                titled("Login works"), null);

        testCase.moveTo("section-2");

        assertEquals("section-2", testCase.sectionId());
        assertEquals(2, testCase.version());
    }

    @Test
    void whenSnapshotting_givenSteps_shouldCaptureVersionedContent() {
        final List<TestStep> steps = List.of(
                new TestStep(1, "Open login page", "Form visible", null),
                new TestStep(2, "Submit credentials", "Dashboard shown",
                        "jane / secret"));
        final TestCase testCase = TestCase.create("project-1",
                new TestCaseDetails(null, "Login works", null, null, steps,
                        null, null, null, Map.of("component", "auth")),
                null);

        final Map<String, Object> snapshot = testCase.snapshot();

        assertEquals("Login works", snapshot.get("title"));
        assertEquals("steps", snapshot.get("templateType"));
        assertEquals("medium", snapshot.get("priority"));
        assertEquals(steps, snapshot.get("steps"));
        assertEquals(Map.of("component", "auth"), snapshot.get("customFields"));
    }

    @Test
    void whenCreatingStep_givenZeroNumber_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new TestStep(0, "Open page", null, null));
    }

    @Test
    void whenCreatingStep_givenBlankAction_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new TestStep(1, " ", null, null));
    }

    private static TestCaseDetails titled(final String title) {
        return new TestCaseDetails(null, title, null, null, null, null, null,
                null, null);
    }

}
