package com.phonepe.tutorai.core.utils;

import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads a mandatory environment variable
     * @param variable the name of the variable
     * @return the value of the variable
     */
    public static String readEnv(final String variable) {
        return Objects.requireNonNull(System.getenv(variable), "Please set environment variable: %s".formatted(variable));
    }

    /**
     * Reads an optional variable from the given source. Blank values are treated as absent.
     */
    public static Optional<String> readOptional(final String variable, final UnaryOperator<String> source) {
        return Optional.ofNullable(source.apply(variable))
                .map(String::strip)
                .filter(Predicate.not(String::isEmpty));
    }
}
