package io.hearthwarrio.locatium.allure;

import io.hearthwarrio.locatium.webdriver.LocatorLogDetail;
import io.hearthwarrio.locatium.webdriver.LocatorReportLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Locatium loggers.
 */
public final class LocatiumAllureLoggers {

    private LocatiumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that reports ALL locators without screenshots.
     */
    public static LocatorReportLogger locators(WebDriver driver) {
        return new AllureLocatorReportLogger(driver, LocatorLogDetail.ALL, false);
    }

    /**
     * Creates an Allure logger with explicit locator detail and screenshot flag.
     */
    public static LocatorReportLogger locators(WebDriver driver, LocatorLogDetail detail, boolean screenshots) {
        return new AllureLocatorReportLogger(driver, detail, screenshots);
    }
}
