package co.fanki.qualityhub.testcase.domain;

import java.util.List;
import java.util.Map;

/**
 * The editable content of a test case.
 *
 * <p>On creation null fields take their defaults; on update null fields are
 * left untouched.</p>
 *
 * @param sectionId the section the case is filed under
 * @param title the title
 * @param templateType the template type
 * @param preconditions the preconditions
 * @param steps the steps
 * @param expectedResult the expected result
 * @param priority the priority
 * @param estimate the estimate in minutes
 * @param customFields free-form custom fields
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TestCaseDetails(
        String sectionId,
        String title,
        TestCaseTemplate templateType,
        String preconditions,
        List<TestStep> steps,
        String expectedResult,
        TestCasePriority priority,
        Integer estimate,
        Map<String, Object> customFields
) {
}
