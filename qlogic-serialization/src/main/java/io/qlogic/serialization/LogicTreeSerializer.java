package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.question.Question;
import java.util.List;

/// Utility class for serializing and deserializing logic trees and questions to/from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = LogicTreeSerializer.toJson(tree);
/// LogicTree restored = LogicTreeSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper, as
/// {@link JacksonLogicTreeCodec} does.
///
/// @see QlogicJacksonModule for the registered type handlers
public final class LogicTreeSerializer {

    private static final TypeReference<List<Question>> QUESTION_LIST = new TypeReference<>() {};

    private LogicTreeSerializer() {}

    /// Serializes a logic tree to pretty-printed JSON.
    ///
    /// @param tree the tree to serialize, not null
    /// @return JSON array of root nodes, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(LogicTree tree) {
        try {
            return createMapper().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize logic tree: " + e.getMessage(), e);
        }
    }

    /// Deserializes a logic tree from JSON.
    ///
    /// @param json JSON array of root nodes, not null
    /// @return deserialized tree with normalized depths, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the tree is invalid
    public static LogicTree fromJson(String json) {
        try {
            return createMapper().readValue(json, LogicTree.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize logic tree: " + e.getMessage(), e);
        }
    }

    /// Serializes a list of questions to pretty-printed JSON.
    ///
    /// @param questions questions to serialize, not null
    /// @return JSON array, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String questionsToJson(List<Question> questions) {
        try {
            return createMapper().writeValueAsString(questions);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize questions: " + e.getMessage(), e);
        }
    }

    /// Deserializes a list of questions from JSON.
    ///
    /// @param json JSON array of questions, not null
    /// @return deserialized questions, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static List<Question> questionsFromJson(String json) {
        try {
            return createMapper().readValue(json, QUESTION_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize questions: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for qlogic serialization.
    ///
    /// Registers:
    /// - `QlogicJacksonModule` for the tree, question and answer types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new QlogicJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
