package com.cppmodel.generator.model;

import java.util.Optional;

import lombok.Value;

/**
 * A template parameter of a templated entity. {@code spelling} is the
 * declaration without its default, e.g. {@code typename... Ts} or {@code int N}.
 */
@Value
public class TemplateParameter {
    TemplateParameterKind kind;
    String name;
    String spelling;
    String defaultValue;
    boolean variadic;

    public Optional<String> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }
}
