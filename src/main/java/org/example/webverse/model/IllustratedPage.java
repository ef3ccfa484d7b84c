package org.example.webverse.model;

/**
 * Illustrator response body: the page it was given plus the plan it produced.
 */
public record IllustratedPage(
        Page page,
        IllustrationPlan illustration
) {
}
