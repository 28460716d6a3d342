package io.cwrelay.core;

import io.cwrelay.core.model.MetricDescriptor.Dimension;
import io.cwrelay.core.model.SourceDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the source of a series from an ordered list of directives.
 */
public class SourceResolver {

    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    private final List<SourceDirective> defaultDirectives;
    private final DimensionIndexCheck indexCheck;

    public SourceResolver(List<SourceDirective> defaultDirectives, DimensionIndexCheck indexCheck) {
        this.defaultDirectives = List.copyOf(defaultDirectives);
        this.indexCheck = indexCheck;
    }

    public SourceResolver() {
        this(SourceDirective.DEFAULTS, DimensionIndexCheck.LITERAL);
    }

    /**
     * Returns the value of the first directive that yields a non-empty value.
     *
     * @param directives rule directives, or null to use the defaults
     */
    public Optional<String> resolve(List<SourceDirective> directives, Map<String, String> pointTags,
                                    List<Dimension> dimensions) {
        List<SourceDirective> effective = directives == null || directives.isEmpty() ? defaultDirectives : directives;
        for (SourceDirective directive : effective) {
            String value = evaluate(directive, pointTags, dimensions);
            if (value != null && !value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private String evaluate(SourceDirective directive, Map<String, String> pointTags, List<Dimension> dimensions) {
        if (directive instanceof SourceDirective.Literal literal) {
            return literal.value();
        } else if (directive instanceof SourceDirective.TagName tag) {
            return pointTags.get(tag.name());
        } else if (directive instanceof SourceDirective.DimensionIndex dim) {
            return dimensionValue(dim.index(), dimensions);
        }
        throw new IllegalArgumentException("Unsupported directive: " + directive);
    }

    private String dimensionValue(int index, List<Dimension> dimensions) {
        int count = dimensions.size();
        boolean accepted = switch (indexCheck) {
            case LITERAL -> count < index;
            case IN_RANGE -> index >= 0 && index < count;
        };
        if (!accepted) {
            return null;
        }
        if (index < 0 || index >= count) {
            log.debug("Dimension index {} passed the bounds check but only {} dimensions exist", index, count);
            return null;
        }
        return dimensions.get(index).value();
    }
}
