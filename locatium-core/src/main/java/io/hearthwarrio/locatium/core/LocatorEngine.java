package io.hearthwarrio.locatium.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: walks a hierarchy snapshot and produces ranked locators for every selected element.
 * <p>
 * Each call parses its own {@link UiTree}. A failure while computing one element is logged and that element is
 * left out; its descendants are still visited.
 * <p>
 * Instances are not thread-safe. Use one engine per thread.
 */
public class LocatorEngine {

    private static final Logger log = LoggerFactory.getLogger(LocatorEngine.class);

    private final UiTreeParser parser;
    private final LocatorSuggester suggester;
    private final ElementFilter filter;

    public LocatorEngine() {
        this(new UniquenessOracle());
    }

    public LocatorEngine(UniquenessOracle oracle) {
        Objects.requireNonNull(oracle, "oracle must not be null");
        this.parser = new UiTreeParser();
        this.suggester = new LocatorSuggester(oracle, parser);
        this.filter = new ElementFilter();
    }

    public List<LocatorResult> generateAll(String source, Platform platform, boolean nativeContext) {
        return generateAll(source, platform, nativeContext, FilterOptions.defaults());
    }

    /**
     * Generates locators for every element of the snapshot accepted by the filter options.
     *
     * @param source        hierarchy XML; null, blank or malformed yields an empty list
     * @param platform      automation backend that produced the source
     * @param nativeContext false for webview/browser contexts
     * @param options       element selection criteria
     * @return results in depth-first pre-order
     */
    public List<LocatorResult> generateAll(
            String source,
            Platform platform,
            boolean nativeContext,
            FilterOptions options
    ) {
        return generateAll(parser.parse(source), platform, nativeContext, options);
    }

    public List<LocatorResult> generateAll(
            UiTree tree,
            Platform platform,
            boolean nativeContext,
            FilterOptions options
    ) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (tree.isEmpty()) {
            log.debug("Empty hierarchy, no locators generated");
            return List.of();
        }

        List<LocatorResult> results = new ArrayList<>();
        visit(tree.getRoot(), tree, platform, nativeContext, options, results);

        log.debug("Generated locators for {} of {} elements (platform={}, nativeContext={})",
                results.size(), tree.size(), platform, nativeContext);
        return results;
    }

    /**
     * Ranked locators for the single element at the given path.
     *
     * @throws LocatorGenerationException if the source has no elements or no element has this path
     */
    public Map<String, String> suggestLocators(String source, String path, Platform platform, boolean nativeContext) {
        return suggestResult(source, path, platform, nativeContext).getLocators();
    }

    /**
     * Same as {@link #suggestLocators(String, String, Platform, boolean)} with the element summary attached.
     */
    public LocatorResult suggestResult(String source, String path, Platform platform, boolean nativeContext) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(platform, "platform must not be null");

        UiTree tree = parser.parse(source);
        if (tree.isEmpty()) {
            throw new LocatorGenerationException("Hierarchy source is empty or malformed");
        }
        UiNode node = tree.findByPath(path);
        if (node == null) {
            throw new LocatorGenerationException("No element at path '" + path + "'");
        }
        return LocatorResult.from(node, suggester.suggestRanked(node, tree, platform, nativeContext));
    }

    private void visit(
            UiNode node,
            UiTree tree,
            Platform platform,
            boolean nativeContext,
            FilterOptions options,
            List<LocatorResult> out
    ) {
        if (filter.shouldInclude(node, options, platform, nativeContext)) {
            try {
                Map<String, String> locators = suggester.suggestRanked(node, tree, platform, nativeContext);
                out.add(LocatorResult.from(node, locators));
            } catch (RuntimeException e) {
                log.error("Failed to generate locators for element at path '{}' ({})", node.getPath(), node.getTagName(), e);
            }
        }
        for (UiNode child : node.getChildren()) {
            visit(child, tree, platform, nativeContext, options, out);
        }
    }
}
