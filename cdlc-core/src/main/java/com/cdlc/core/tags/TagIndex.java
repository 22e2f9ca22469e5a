package com.cdlc.core.tags;

import com.cdlc.core.model.TagPayload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tags extracted from one class definition.
 *
 * @param blockTags tags on the class itself
 * @param elementTags tags per declared element name (parameters, connectors, instances)
 */
public record TagIndex(
    List<TagPayload> blockTags,
    Map<String, List<TagPayload>> elementTags
) {
    public TagIndex {
        blockTags = blockTags != null ? List.copyOf(blockTags) : List.of();
        elementTags = elementTags != null ? copy(elementTags) : Map.of();
    }

    public static TagIndex empty() {
        return new TagIndex(List.of(), Map.of());
    }

    /**
     * Returns the tags of a declared element.
     *
     * @param elementName parameter, connector or instance name
     * @return tags in source order, empty if none
     */
    public List<TagPayload> forElement(String elementName) {
        return elementTags.getOrDefault(elementName, List.of());
    }

    public boolean isEmpty() {
        return blockTags.isEmpty() && elementTags.isEmpty();
    }

    private static Map<String, List<TagPayload>> copy(Map<String, List<TagPayload>> source) {
        Map<String, List<TagPayload>> result = new LinkedHashMap<>();
        source.forEach((name, tags) -> result.put(name, List.copyOf(tags)));
        return Collections.unmodifiableMap(result);
    }
}
