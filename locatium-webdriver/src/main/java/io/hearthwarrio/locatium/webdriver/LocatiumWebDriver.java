package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.FilterOptions;
import io.hearthwarrio.locatium.core.LocatorEngine;
import io.hearthwarrio.locatium.core.LocatorResult;
import io.hearthwarrio.locatium.core.Platform;
import org.openqa.selenium.Capabilities;
import org.openqa.selenium.HasCapabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * High-level Locatium entry point for a live Selenium or Appium session.
 * <p>
 * Every call captures a fresh page source from the driver and runs the {@link LocatorEngine} on it.
 * A capture that fails is treated as an empty page.
 * <p>
 * The platform is taken from the {@code appium:automationName} capability unless set explicitly with
 * {@link #withPlatform(Platform)}.
 */
public class LocatiumWebDriver {

    private static final Logger log = LoggerFactory.getLogger(LocatiumWebDriver.class);

    static final List<String> AUTOMATION_NAME_CAPABILITIES = List.of("appium:automationName", "automationName");

    private final WebDriver driver;
    private final LocatorEngine engine;

    /**
     * Explicit platform; null means detect from capabilities.
     */
    private Platform platform;
    private boolean nativeContext = true;
    private FilterOptions filterOptions = FilterOptions.defaults();
    private LocatorReportLogger reportLogger;

    public LocatiumWebDriver(WebDriver driver) {
        this(driver, new LocatorEngine(), null);
    }

    public LocatiumWebDriver(WebDriver driver, LocatorReportLogger logger) {
        this(driver, new LocatorEngine(), logger);
    }

    public LocatiumWebDriver(WebDriver driver, LocatorEngine engine, LocatorReportLogger logger) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.reportLogger = logger;
    }

    // ----------- configuration -----------

    public LocatiumWebDriver withPlatform(Platform platform) {
        this.platform = platform;
        return this;
    }

    /**
     * Native app context (default) or webview/browser context. Only native contexts get platform-specific
     * locators.
     */
    public LocatiumWebDriver withNativeContext(boolean nativeContext) {
        this.nativeContext = nativeContext;
        return this;
    }

    public LocatiumWebDriver withFilterOptions(FilterOptions filterOptions) {
        this.filterOptions = Objects.requireNonNull(filterOptions, "filterOptions must not be null");
        return this;
    }

    public LocatiumWebDriver withLogger(LocatorReportLogger logger) {
        this.reportLogger = logger;
        return this;
    }

    public LocatiumWebDriver withLoggingToStdOut(LocatorLogDetail detail) {
        this.reportLogger = new StdOutLocatorReportLogger(detail);
        return this;
    }

    public WebDriver getDriver() {
        return driver;
    }

    public boolean isNativeContext() {
        return nativeContext;
    }

    public FilterOptions getFilterOptions() {
        return filterOptions;
    }

    /**
     * Returns the explicit platform, or the one resolved from the driver capabilities.
     */
    public Platform getPlatform() {
        return platform != null ? platform : detectPlatform();
    }

    // ----------- locators -----------

    public List<LocatorResult> generateAllLocators() {
        return generateAllLocators(filterOptions);
    }

    /**
     * Generates locators for every element of the current screen accepted by the given options.
     *
     * @return results in page order; empty when the page source could not be captured
     */
    public List<LocatorResult> generateAllLocators(FilterOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        Platform p = getPlatform();
        List<LocatorResult> results = engine.generateAll(capturePageSource(), p, nativeContext, options);
        report("all elements", p, results);
        return results;
    }

    /**
     * Ranked locators for the element at the given path of the current screen.
     *
     * @param path dot-separated child positions, e.g. {@code "0.1.2"}
     * @throws io.hearthwarrio.locatium.core.LocatorGenerationException if no element has this path
     */
    public Map<String, String> suggestLocators(String path) {
        Objects.requireNonNull(path, "path must not be null");

        Platform p = getPlatform();
        LocatorResult result = engine.suggestResult(capturePageSource(), path, p, nativeContext);
        report("element " + path, p, List.of(result));
        return result.getLocators();
    }

    /**
     * Captures the current page source.
     *
     * @return page source, or an empty string when the driver cannot provide one
     */
    public String capturePageSource() {
        try {
            String source = driver.getPageSource();
            return source == null ? "" : source;
        } catch (WebDriverException e) {
            log.warn("Page source could not be captured: {}", e.getMessage());
            return "";
        }
    }

    private Platform detectPlatform() {
        if (!(driver instanceof HasCapabilities hasCapabilities)) {
            return Platform.OTHER;
        }

        Capabilities capabilities = hasCapabilities.getCapabilities();
        if (capabilities == null) {
            return Platform.OTHER;
        }
        for (String name : AUTOMATION_NAME_CAPABILITIES) {
            Object value = capabilities.getCapability(name);
            if (value != null) {
                return Platform.fromAutomationName(value.toString());
            }
        }
        return Platform.OTHER;
    }

    private void report(String target, Platform p, List<LocatorResult> results) {
        if (reportLogger != null) {
            reportLogger.logLocators(target, p, results);
        }
    }
}
