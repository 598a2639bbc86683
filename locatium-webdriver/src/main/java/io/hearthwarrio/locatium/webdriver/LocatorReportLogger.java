package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.LocatorResult;
import io.hearthwarrio.locatium.core.Platform;

import java.util.List;

/**
 * Receives the locators generated for one page source capture.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface LocatorReportLogger {

    /**
     * Called after locators were generated.
     *
     * @param target   what was captured, e.g. {@code "all elements"} or {@code "element 0.1.2"}
     * @param platform platform the locators were ranked for
     * @param results  generated results in page order (may be empty)
     */
    void logLocators(String target, Platform platform, List<LocatorResult> results);

    /**
     * Declares how much locator info this logger reports.
     */
    default LocatorLogDetail detail() {
        return LocatorLogDetail.ALL;
    }
}
