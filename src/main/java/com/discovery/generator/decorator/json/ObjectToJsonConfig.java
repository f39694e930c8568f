package com.discovery.generator.decorator.json;

import com.discovery.generator.codedom.TypeReference;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Names and bound types shared by the ObjectToJson builders.
 *
 * The field, accessor and method are only linked through these names, so every
 * builder of one decoration pass must be given the same instance.
 */
@Value
@Builder(toBuilder = true)
public class ObjectToJsonConfig {

    private static final String RUNTIME_JSON_PACKAGE = "com.discovery.client.json";

    /**
     * Backing field holding the serializer.
     */
    @NonNull
    @Builder.Default
    String fieldName = "jsonSerializer";

    /**
     * Lazily initializing accessor for {@link #fieldName}; rendered as {@code getJsonSerializer()}.
     */
    @NonNull
    @Builder.Default
    String propertyName = "JsonSerializer";

    @NonNull
    @Builder.Default
    String methodName = "objectToJson";

    @NonNull
    @Builder.Default
    String parameterName = "obj";

    @NonNull
    @Builder.Default
    String settingsVariableName = "settings";

    @NonNull
    @Builder.Default
    String writerVariableName = "writer";

    @NonNull
    @Builder.Default
    TypeReference serializerType = TypeReference.of(RUNTIME_JSON_PACKAGE + ".JsonSerializer");

    @NonNull
    @Builder.Default
    TypeReference settingsType = TypeReference.of(RUNTIME_JSON_PACKAGE + ".JsonSerializerSettings");

    /**
     * Settings property controlling how null values are written.
     */
    @NonNull
    @Builder.Default
    String nullValueHandlingProperty = "NullValueHandling";

    @NonNull
    @Builder.Default
    TypeReference nullValueHandlingType = TypeReference.of(RUNTIME_JSON_PACKAGE + ".NullValueHandling");

    /**
     * Constant of {@link #nullValueHandlingType} that omits null-valued members from the output.
     */
    @NonNull
    @Builder.Default
    String ignoreNullValuesConstant = "IGNORE";

    /**
     * Static factory on {@link #serializerType} taking the settings object.
     */
    @NonNull
    @Builder.Default
    String factoryMethodName = "create";

    /**
     * Serializer operation taking {@code (writer, value)}.
     */
    @NonNull
    @Builder.Default
    String serializeMethodName = "serialize";

    @NonNull
    @Builder.Default
    TypeReference writerType = TypeReference.of("java.io.Writer");

    @NonNull
    @Builder.Default
    TypeReference writerImplementationType = TypeReference.of("java.io.StringWriter");

    @NonNull
    @Builder.Default
    String toTextMethodName = "toString";

    public static ObjectToJsonConfig defaults() {
        return ObjectToJsonConfig.builder().build();
    }
}
