package com.cppmodel.generator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Specifiers that can decorate a function declaration, either before the
 * declarator ({@link #isPrefix()}) or after the parameter list.
 */
public enum FunctionSpecifier {
    STATIC(true),
    VIRTUAL(true),
    INLINE(true),
    CONSTEXPR(true),
    EXPLICIT(true),
    CONST(false),
    NOEXCEPT(false),
    OVERRIDE(false),
    FINAL(false);

    private final boolean prefix;

    FunctionSpecifier(boolean prefix) {
        this.prefix = prefix;
    }

    public boolean isPrefix() {
        return prefix;
    }

    public String getSpelling() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FunctionSpecifier> fromSpelling(String spelling) {
        for (FunctionSpecifier specifier : values()) {
            if (specifier.getSpelling().equals(spelling)) {
                return Optional.of(specifier);
            }
        }
        return Optional.empty();
    }
}
