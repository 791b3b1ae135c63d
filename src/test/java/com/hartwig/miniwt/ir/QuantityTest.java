package com.hartwig.miniwt.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class QuantityTest {
    @Test
    void parsesValueAndUnit() {
        assertThat(Quantity.parse("4 GiB")).contains(Quantity.of(4, Quantity.Unit.GiB));
        assertThat(Quantity.parse("2.5GB")).contains(Quantity.of(new BigDecimal("2.5"), Quantity.Unit.GB));
        assertThat(Quantity.parse("512 mib")).contains(Quantity.of(512, Quantity.Unit.MiB));
    }

    @Test
    void singleLetterUnitsAreBinary() {
        assertThat(Quantity.parse("512M")).contains(Quantity.of(512, Quantity.Unit.MiB));
        assertThat(Quantity.parse("1 G").orElseThrow().toMebibytes()).isEqualTo(1024);
    }

    @Test
    void bareNumberIsBytes() {
        assertThat(Quantity.parse("1048576")).contains(Quantity.of(1048576, Quantity.Unit.B));
    }

    @Test
    void unknownUnitDoesNotParse() {
        assertThat(Quantity.parse("4 bananas")).isEmpty();
        assertThat(Quantity.parse("lots")).isEmpty();
    }

    @Test
    void conversionsRoundUp() {
        assertThat(Quantity.of(8, Quantity.Unit.GB).toMebibytes()).isEqualTo(7630);
        assertThat(Quantity.of(1500, Quantity.Unit.MiB).toGibibytes()).isEqualTo(2);
        assertThat(Quantity.of(8, Quantity.Unit.GiB).toMebibytes()).isEqualTo(8192);
    }

    @Test
    void negativeQuantityIsRejected() {
        assertThrows(IllegalStateException.class, () -> Quantity.of(-1, Quantity.Unit.MiB));
    }

    @Test
    void rendersWithoutTrailingZeros() {
        assertThat(Quantity.of(new BigDecimal("4.50"), Quantity.Unit.GiB).render()).isEqualTo("4.5 GiB");
    }
}
