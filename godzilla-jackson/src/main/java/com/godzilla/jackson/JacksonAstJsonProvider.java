package com.godzilla.jackson;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.godzilla.ast.File;
import com.godzilla.ast.Node;
import com.godzilla.jackson.mixins.NodeTypes;
import com.godzilla.json.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(JacksonAstJsonProvider.class);

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(GodzillaJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Error translation ====================

    /**
     * Converts a Jackson failure into an {@link AstJsonException} naming the
     * offending node's tag, its position in the JSON text and its property path.
     */
    static AstJsonException decodeFailure(JsonProcessingException e) {
        String nodeType = null;
        String problem;
        if (e instanceof InvalidTypeIdException typeIdError) {
            nodeType = typeIdError.getTypeId();
            if (nodeType == null) {
                problem = "Missing node type property 'type'";
            } else if (NodeTypes.isRegistered(nodeType)) {
                problem = "Node type '" + nodeType + "' is not allowed where "
                    + typeIdError.getBaseType().getRawClass().getSimpleName() + " is expected";
            } else {
                problem = "Unknown node type '" + nodeType + "'";
            }
        } else if (e instanceof ValueInstantiationException instantiationError) {
            nodeType = nodeTag(instantiationError.getType());
            Throwable cause = instantiationError.getCause();
            problem = "Invalid " + (nodeType == null ? "node" : nodeType) + ": "
                + (cause != null && cause.getMessage() != null ? cause.getMessage() : e.getOriginalMessage());
        } else if (e instanceof MismatchedInputException mismatch) {
            nodeType = mismatch.getTargetType() == null ? null : nodeTag(mismatch.getTargetType());
            problem = "Malformed document: " + e.getOriginalMessage();
        } else {
            problem = "Malformed document: " + e.getOriginalMessage();
        }

        String path = "";
        if (e instanceof JsonMappingException mappingError) {
            path = describePath(mappingError.getPath());
            if (nodeType == null) {
                nodeType = enclosingNodeTag(mappingError.getPath());
            }
        }

        JsonLocation location = e.getLocation();
        int line = location == null ? -1 : location.getLineNr();
        int column = location == null ? -1 : location.getColumnNr();

        StringBuilder message = new StringBuilder(problem);
        if (line > 0) {
            message.append(" at line ").append(line).append(", column ").append(column);
        }
        if (!path.isEmpty()) {
            message.append(" (path: ").append(path).append(')');
        }
        return new AstJsonException(message.toString(), nodeType, line, column, path, e);
    }

    static String describePath(List<JsonMappingException.Reference> references) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : references) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    private static String enclosingNodeTag(List<JsonMappingException.Reference> references) {
        for (int i = references.size() - 1; i >= 0; i--) {
            Object from = references.get(i).getFrom();
            Class<?> owner = from instanceof Class<?> c ? c : from == null ? null : from.getClass();
            String tag = nodeTag(owner);
            if (tag != null) {
                return tag;
            }
        }
        return null;
    }

    private static String nodeTag(JavaType type) {
        return type == null ? null : nodeTag(type.getRawClass());
    }

    private static String nodeTag(Class<?> type) {
        if (type == null || !Node.class.isAssignableFrom(type)) {
            return null;
        }
        for (var entry : NodeTypes.registered().entrySet()) {
            if (entry.getValue() == type) {
                return entry.getKey();
            }
        }
        return null;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public File deserializeFile(String json) throws AstJsonException {
            return deserialize(json, File.class);
        }

        @Override
        public File deserializeFile(InputStream json) throws AstJsonException {
            try {
                return requireDocument(mapper.readerFor(File.class)
                    .without(JsonParser.Feature.AUTO_CLOSE_SOURCE)
                    .readValue(json), File.class);
            } catch (JsonProcessingException e) {
                throw decodeFailure(e);
            } catch (IOException e) {
                throw new AstJsonException("Failed to read File", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            LOGGER.debug("Decoding {} from {} characters", type.getSimpleName(), json == null ? 0 : json.length());
            if (json == null) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName() + ": no document");
            }
            try {
                return requireDocument(mapper.readValue(json, type), type);
            } catch (JsonProcessingException e) {
                throw decodeFailure(e);
            }
        }

        private static <T> T requireDocument(T value, Class<T> type) {
            if (value == null) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName() + ": document is null");
            }
            return value;
        }
    }
}
