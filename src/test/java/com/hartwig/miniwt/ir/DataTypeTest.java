package com.hartwig.miniwt.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.miniwt.expression.Literal;

import org.junit.jupiter.api.Test;

class DataTypeTest {
    @Test
    void arrayNeedsItemType() {
        assertThrows(IllegalArgumentException.class, () -> DataType.of(DataType.Kind.ARRAY));
        assertThrows(IllegalStateException.class, () -> DataType.builder().kind(DataType.Kind.ARRAY).build());
    }

    @Test
    void primitiveCannotHaveItemType() {
        assertThrows(IllegalStateException.class,
                () -> DataType.builder().kind(DataType.Kind.INT).itemType(DataType.of(DataType.Kind.INT)).build());
    }

    @Test
    void optionalityIsPartOfEquality() {
        var file = DataType.of(DataType.Kind.FILE);

        assertThat(file.asOptional()).isNotEqualTo(file);
        assertThat(file.asOptional().asRequired()).isEqualTo(file);
        assertThat(file.asOptional().isFileLike()).isTrue();
    }

    @Test
    void declarationWithoutDefaultOrOptionalIsRequired() {
        var type = DataType.of(DataType.Kind.STRING);

        assertThat(Declaration.of("name", type).isRequired()).isTrue();
        assertThat(Declaration.of("name", type.asOptional()).isRequired()).isFalse();
        assertThat(Declaration.of("name", type, Literal.ofString("x")).isRequired()).isFalse();
    }
}
