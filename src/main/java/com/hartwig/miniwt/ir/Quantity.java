package com.hartwig.miniwt.ir;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.immutables.value.Value;

/**
 * An amount of memory or disk space.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Quantity {
    Pattern PATTERN = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*([A-Za-z]*)\\s*$");

    enum Unit {
        B(BigDecimal.ONE),
        KB(BigDecimal.valueOf(1000)),
        MB(BigDecimal.valueOf(1000L * 1000)),
        GB(BigDecimal.valueOf(1000L * 1000 * 1000)),
        TB(BigDecimal.valueOf(1000L * 1000 * 1000 * 1000)),
        KiB(BigDecimal.valueOf(1024)),
        MiB(BigDecimal.valueOf(1024L * 1024)),
        GiB(BigDecimal.valueOf(1024L * 1024 * 1024)),
        TiB(BigDecimal.valueOf(1024L * 1024 * 1024 * 1024));

        private final BigDecimal bytes;

        Unit(final BigDecimal bytes) {
            this.bytes = bytes;
        }

        public BigDecimal bytes() {
            return bytes;
        }

        /**
         * Accepts unit names case-insensitively. The single letter forms K, M, G and T are binary units.
         */
        public static Optional<Unit> parse(String text) {
            var normalized = text.trim();
            switch (normalized.toUpperCase(Locale.ROOT)) {
                case "":
                case "B":
                    return Optional.of(B);
                case "K":
                    return Optional.of(KiB);
                case "M":
                    return Optional.of(MiB);
                case "G":
                    return Optional.of(GiB);
                case "T":
                    return Optional.of(TiB);
                default:
                    return Arrays.stream(values()).filter(unit -> unit.name().equalsIgnoreCase(normalized)).findFirst();
            }
        }
    }

    @Value.Parameter
    BigDecimal value();

    @Value.Parameter
    Unit unit();

    @Value.Check
    default void check() {
        if (value().signum() < 0) {
            throw new IllegalStateException(String.format("Quantity should not be negative, was %s", value()));
        }
    }

    default BigDecimal bytes() {
        return value().multiply(unit().bytes());
    }

    /**
     * Size in MiB, rounded up to a whole number.
     */
    default long toMebibytes() {
        return bytes().divide(Unit.MiB.bytes(), 0, RoundingMode.CEILING).longValueExact();
    }

    /**
     * Size in GiB, rounded up to a whole number.
     */
    default long toGibibytes() {
        return bytes().divide(Unit.GiB.bytes(), 0, RoundingMode.CEILING).longValueExact();
    }

    default String render() {
        return value().stripTrailingZeros().toPlainString() + " " + unit().name();
    }

    static Quantity of(long value, Unit unit) {
        return ImmutableQuantity.of(BigDecimal.valueOf(value), unit);
    }

    static Quantity of(BigDecimal value, Unit unit) {
        return ImmutableQuantity.of(value, unit);
    }

    static Quantity mebibytes(long value) {
        return of(value, Unit.MiB);
    }

    /**
     * Parses strings like {@code "4 GiB"}, {@code "512M"} or {@code "2.5 GB"}. A bare number is a number of bytes.
     */
    static Optional<Quantity> parse(String text) {
        var matcher = PATTERN.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Unit.parse(matcher.group(2)).map(unit -> of(new BigDecimal(matcher.group(1)), unit));
    }
}
