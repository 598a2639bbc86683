package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.LocatorResult;
import io.hearthwarrio.locatium.core.Platform;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default stdout logger for generated locators.
 * <p>
 * Prints one header line per capture and, unless the detail is {@link LocatorLogDetail#NONE}, one line per element.
 */
public final class StdOutLocatorReportLogger implements LocatorReportLogger {

    private final LocatorLogDetail detail;
    private final PrintStream out;

    public StdOutLocatorReportLogger(LocatorLogDetail detail) {
        this(detail, System.out);
    }

    StdOutLocatorReportLogger(LocatorLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public LocatorLogDetail detail() {
        return detail;
    }

    @Override
    public void logLocators(String target, Platform platform, List<LocatorResult> results) {
        int count = results == null ? 0 : results.size();
        out.println("[Locatium] target='" + safe(target) + "', platform=" + platform + ", elements=" + count);

        if (detail == LocatorLogDetail.NONE || results == null) {
            return;
        }

        for (LocatorResult r : results) {
            StringBuilder sb = new StringBuilder(256);
            sb.append("[Locatium]   ").append(r.getPath().isEmpty() ? "<root>" : r.getPath())
                    .append(' ').append(r.getTagName());

            if (detail == LocatorLogDetail.PREFERRED_ONLY) {
                Map.Entry<String, String> preferred = r.preferredLocatorOrNull();
                sb.append(", ").append(preferred == null ? "no locator" : preferred.getKey() + "=" + preferred.getValue());
            } else {
                for (Map.Entry<String, String> e : r.getLocators().entrySet()) {
                    sb.append(", ").append(e.getKey()).append('=').append(e.getValue());
                }
            }
            out.println(sb);
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
