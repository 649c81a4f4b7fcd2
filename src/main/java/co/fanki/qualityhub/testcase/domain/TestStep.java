package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.shared.Preconditions;

/**
 * One numbered step of a test case.
 *
 * @param stepNumber the 1-based step number
 * @param action what the tester does
 * @param expectedResult what should happen, may be null
 * @param data test data for the step, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TestStep(
        int stepNumber,
        String action,
        String expectedResult,
        String data
) {

    public TestStep {
        Preconditions.require(stepNumber >= 1,
                "Step number must be at least 1");
        Preconditions.requireLength(action, 1, 2000, "Step action");
    }

}
