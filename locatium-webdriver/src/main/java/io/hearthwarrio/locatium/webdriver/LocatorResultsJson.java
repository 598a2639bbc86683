package io.hearthwarrio.locatium.webdriver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.locatium.core.LocatorGenerationException;
import io.hearthwarrio.locatium.core.LocatorResult;

import java.util.List;
import java.util.Map;

/**
 * Renders locator results as a JSON array, one object per element.
 * <p>
 * Field order: {@code tagName}, {@code path}, {@code locators}, {@code text}, {@code contentDesc},
 * {@code resourceId}, {@code clickable}, {@code enabled}, {@code displayed}. Locators keep their priority order.
 */
public final class LocatorResultsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LocatorResultsJson() {
    }

    public static String toJson(List<LocatorResult> results) {
        return write(results, false);
    }

    public static String toPrettyJson(List<LocatorResult> results) {
        return write(results, true);
    }

    static ArrayNode toTree(List<LocatorResult> results) {
        ArrayNode array = MAPPER.createArrayNode();
        if (results == null) {
            return array;
        }
        for (LocatorResult r : results) {
            ObjectNode element = array.addObject();
            element.put("tagName", r.getTagName());
            element.put("path", r.getPath());

            ObjectNode locators = element.putObject("locators");
            for (Map.Entry<String, String> e : r.getLocators().entrySet()) {
                locators.put(e.getKey(), e.getValue());
            }

            element.put("text", r.getText());
            element.put("contentDesc", r.getContentDesc());
            element.put("resourceId", r.getResourceId());
            element.put("clickable", r.isClickable());
            element.put("enabled", r.isEnabled());
            element.put("displayed", r.isDisplayed());
        }
        return array;
    }

    private static String write(List<LocatorResult> results, boolean pretty) {
        try {
            if (pretty) {
                return MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(toTree(results));
            }
            return MAPPER.writeValueAsString(toTree(results));
        } catch (JsonProcessingException e) {
            throw new LocatorGenerationException("Failed to render locator results as JSON", e);
        }
    }
}
