package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.FilterOptions;
import io.hearthwarrio.locatium.core.LocatorGenerationException;
import io.hearthwarrio.locatium.core.LocatorResult;
import io.hearthwarrio.locatium.core.Platform;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.ImmutableCapabilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LocatiumWebDriverTest {
    private static final String LOGIN_SCREEN =
            "<hierarchy>" +
            "<android.widget.FrameLayout class=\"android.widget.FrameLayout\">" +
            "<android.widget.EditText class=\"android.widget.EditText\" resource-id=\"com.app:id/user\" clickable=\"true\"/>" +
            "<android.widget.Button class=\"android.widget.Button\" resource-id=\"com.app:id/login\" content-desc=\"login\" clickable=\"true\"/>" +
            "</android.widget.FrameLayout>" +
            "</hierarchy>";

    @Test
    void detectsPlatformFromAppiumCapability() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN));

        assertEquals(Platform.UIAUTOMATOR2, locatium.getPlatform());
    }

    @Test
    void detectsPlatformFromUnprefixedCapability() {
        StubWebDriver driver = new StubWebDriver(LOGIN_SCREEN, new ImmutableCapabilities("automationName", "XCUITest"));

        assertEquals(Platform.XCUITEST, new LocatiumWebDriver(driver).getPlatform());
    }

    @Test
    void explicitPlatformWins() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN))
                .withPlatform(Platform.OTHER);

        assertEquals(Platform.OTHER, locatium.getPlatform());
    }

    @Test
    void unknownCapabilitiesGiveOther() {
        StubWebDriver driver = new StubWebDriver(LOGIN_SCREEN, new ImmutableCapabilities("browserName", "chrome"));

        assertEquals(Platform.OTHER, new LocatiumWebDriver(driver).getPlatform());
    }

    @Test
    void generatesLocatorsForCurrentScreen() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN));

        List<LocatorResult> results = locatium.generateAllLocators();

        assertEquals(3, results.size());
        LocatorResult button = results.get(2);
        assertEquals("com.app:id/login", button.getLocators().get("id"));
        assertEquals("login", button.getLocators().get("accessibility id"));
        assertEquals("new UiSelector().resourceId(\"com.app:id/login\")", button.getLocators().get("-android uiautomator"));
    }

    @Test
    void filterOptionsApply() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN))
                .withFilterOptions(FilterOptions.builder().clickableOnly(true).build());

        assertEquals(2, locatium.generateAllLocators().size());
        assertEquals(4, locatium.generateAllLocators(FilterOptions.builder().excludeTagNames().build()).size());
    }

    @Test
    void webContextSkipsNativeStrategies() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN))
                .withNativeContext(false);

        Map<String, String> locators = locatium.generateAllLocators().get(2).getLocators();

        assertFalse(locators.containsKey("accessibility id"));
        assertFalse(locators.containsKey("-android uiautomator"));
        assertEquals(List.of("id", "class name", "xpath"), new ArrayList<>(locators.keySet()));
    }

    @Test
    void eachCallCapturesFreshSource() {
        StubWebDriver driver = StubWebDriver.android(LOGIN_SCREEN);
        LocatiumWebDriver locatium = new LocatiumWebDriver(driver);

        assertEquals(3, locatium.generateAllLocators().size());
        driver.setPageSource("<hierarchy><android.widget.TextView text=\"Done\"/></hierarchy>");
        assertEquals(1, locatium.generateAllLocators().size());
        assertEquals(2, driver.captures());
    }

    @Test
    void failedCaptureGivesEmptyResult() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN).failingCapture());

        assertEquals("", locatium.capturePageSource());
        assertTrue(locatium.generateAllLocators().isEmpty());
    }

    @Test
    void suggestsLocatorsByPath() {
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN));

        Map<String, String> locators = locatium.suggestLocators("0.0");

        assertEquals("com.app:id/user", locators.get("id"));
        assertThrows(LocatorGenerationException.class, () -> locatium.suggestLocators("7"));
    }

    @Test
    void reportsEveryCaptureToLogger() {
        List<String> targets = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        LocatiumWebDriver locatium = new LocatiumWebDriver(StubWebDriver.android(LOGIN_SCREEN))
                .withLogger((target, platform, results) -> {
                    targets.add(target + "@" + platform);
                    sizes.add(results.size());
                });

        locatium.generateAllLocators();
        locatium.suggestLocators("0.1");

        assertEquals(List.of("all elements@UIAUTOMATOR2", "element 0.1@UIAUTOMATOR2"), targets);
        assertEquals(List.of(3, 1), sizes);
    }

    @Test
    void rejectsNullDriver() {
        NullPointerException ex = assertThrows(NullPointerException.class, () -> new LocatiumWebDriver(null));
        assertTrue(ex.getMessage().contains("driver must not be null"));
    }
}
