package com.hartwig.miniwt.ir;

import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface DataType {
    enum Kind {
        STRING,
        INT,
        FLOAT,
        BOOLEAN,
        FILE,
        DIRECTORY,
        ARRAY,
        MAP,
        ANY
    }

    Kind kind();

    /**
     * Element type, present for arrays only.
     */
    Optional<DataType> itemType();

    Optional<DataType> keyType();

    Optional<DataType> valueType();

    @Value.Default
    default boolean optional() {
        return false;
    }

    @Value.Check
    default void check() {
        if ((kind() == Kind.ARRAY) != itemType().isPresent()) {
            throw new IllegalStateException("Item type should be present exactly for array types");
        }
        if ((kind() == Kind.MAP) != (keyType().isPresent() && valueType().isPresent())) {
            throw new IllegalStateException("Key and value types should be present exactly for map types");
        }
    }

    default boolean isPrimitive() {
        return kind() != Kind.ARRAY && kind() != Kind.MAP;
    }

    default boolean isFileLike() {
        return kind() == Kind.FILE || kind() == Kind.DIRECTORY;
    }

    default DataType asOptional() {
        return ImmutableDataType.copyOf(this).withOptional(true);
    }

    default DataType asRequired() {
        return ImmutableDataType.copyOf(this).withOptional(false);
    }

    static DataType of(Kind kind) {
        if (kind == Kind.ARRAY || kind == Kind.MAP) {
            throw new IllegalArgumentException(String.format("Kind %s needs type parameters", kind));
        }
        return builder().kind(kind).build();
    }

    static DataType arrayOf(DataType itemType) {
        return builder().kind(Kind.ARRAY).itemType(itemType).build();
    }

    static DataType mapOf(DataType keyType, DataType valueType) {
        return builder().kind(Kind.MAP).keyType(keyType).valueType(valueType).build();
    }

    static ImmutableDataType.Builder builder() {
        return ImmutableDataType.builder();
    }
}
