package io.hearthwarrio.locatium.webdriver;

/**
 * Controls how much of the generated locator data is reported.
 */
public enum LocatorLogDetail {

    /**
     * Report only the number of elements.
     */
    NONE,

    /**
     * Report the highest-priority locator of each element.
     */
    PREFERRED_ONLY,

    /**
     * Report every locator of each element.
     */
    ALL
}
