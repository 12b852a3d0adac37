package com.godzilla.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.godzilla.ast.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the tags registered on {@link NodeMixin}.
 */
public final class NodeTypes {

    private static final Map<String, Class<? extends Node>> BY_TAG = load();

    private NodeTypes() {
        // Utility class
    }

    /**
     * Tag to record class, in registration order.
     */
    public static Map<String, Class<? extends Node>> registered() {
        return BY_TAG;
    }

    public static boolean isRegistered(String tag) {
        return tag != null && BY_TAG.containsKey(tag);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Class<? extends Node>> load() {
        Map<String, Class<? extends Node>> byTag = new LinkedHashMap<>();
        for (JsonSubTypes.Type type : NodeMixin.class.getAnnotation(JsonSubTypes.class).value()) {
            byTag.put(type.name(), (Class<? extends Node>) type.value());
        }
        return Collections.unmodifiableMap(byTag);
    }
}
