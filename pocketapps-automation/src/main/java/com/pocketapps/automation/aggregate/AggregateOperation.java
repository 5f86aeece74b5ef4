package com.pocketapps.automation.aggregate;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Reductions available to {@code aggregate_data} jobs.
 */
public enum AggregateOperation {
    AVG {
        @Override
        OptionalDouble apply(double[] samples) {
            return DoubleStream.of(samples).average();
        }
    },
    SUM {
        @Override
        OptionalDouble apply(double[] samples) {
            return OptionalDouble.of(DoubleStream.of(samples).sum());
        }
    },
    COUNT {
        @Override
        OptionalDouble apply(double[] samples) {
            return OptionalDouble.of(samples.length);
        }
    },
    MAX {
        @Override
        OptionalDouble apply(double[] samples) {
            return DoubleStream.of(samples).max();
        }
    },
    MIN {
        @Override
        OptionalDouble apply(double[] samples) {
            return DoubleStream.of(samples).min();
        }
    };

    /**
     * Reduce a non-empty sample array.
     */
    abstract OptionalDouble apply(double[] samples);

    /**
     * Look up by lower-case name, e.g. {@code "avg"}.
     */
    public static Optional<AggregateOperation> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
