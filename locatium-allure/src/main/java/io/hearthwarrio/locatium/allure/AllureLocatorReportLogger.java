package io.hearthwarrio.locatium.allure;

import io.hearthwarrio.locatium.core.LocatorResult;
import io.hearthwarrio.locatium.core.Platform;
import io.hearthwarrio.locatium.webdriver.LocatorLogDetail;
import io.hearthwarrio.locatium.webdriver.LocatorReportLogger;
import io.hearthwarrio.locatium.webdriver.LocatorResultsJson;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Allure logger for generated locators: one step per capture with a text summary, the JSON results and,
 * optionally, a screenshot.
 * <p>
 * Lives in locatium-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureLocatorReportLogger implements LocatorReportLogger {

    static final String SUMMARY_ATTACHMENT = "Locators";
    static final String JSON_ATTACHMENT = "Locators JSON";
    static final String SCREENSHOT_ATTACHMENT = "Screenshot";

    private final WebDriver driver;
    private final LocatorLogDetail detail;
    private final boolean attachScreenshot;

    public AllureLocatorReportLogger(WebDriver driver, LocatorLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? LocatorLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public LocatorLogDetail detail() {
        return detail;
    }

    @Override
    public void logLocators(String target, Platform platform, List<LocatorResult> results) {
        List<LocatorResult> safeResults = results == null ? List.of() : results;
        String title = "Locatium: " + safe(target) + " (" + safeResults.size() + " elements)";

        Allure.step(title, () -> {
            attach(SUMMARY_ATTACHMENT, "text/plain", summary(platform, safeResults), ".txt");

            if (detail != LocatorLogDetail.NONE) {
                attach(JSON_ATTACHMENT, "application/json", LocatorResultsJson.toPrettyJson(safeResults), ".json");
            }

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(SCREENSHOT_ATTACHMENT, "image/png", new ByteArrayInputStream(png), ".png");
            }
        });
    }

    private String summary(Platform platform, List<LocatorResult> results) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("platform: ").append(platform).append('\n')
                .append("elements: ").append(results.size()).append('\n');

        if (detail == LocatorLogDetail.NONE) {
            return sb.toString();
        }

        for (LocatorResult r : results) {
            sb.append('\n').append(r.getPath().isEmpty() ? "<root>" : r.getPath())
                    .append(' ').append(r.getTagName()).append('\n');

            if (detail == LocatorLogDetail.PREFERRED_ONLY) {
                Map.Entry<String, String> preferred = r.preferredLocatorOrNull();
                if (preferred != null) {
                    sb.append("  ").append(preferred.getKey()).append(": ").append(preferred.getValue()).append('\n');
                }
                continue;
            }
            for (Map.Entry<String, String> e : r.getLocators().entrySet()) {
                sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void attach(String name, String type, String content, String extension) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(name, type, new ByteArrayInputStream(bytes), extension);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
