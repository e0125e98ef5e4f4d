package com.cppmodel.generator.parser;

/**
 * The traversal provider reported something its contract rules out, e.g. an
 * access-specifier cursor without an access value. Construction cannot
 * continue without corrupting the entity tree.
 */
public class ProviderContractException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ProviderContractException(String message) {
        super(message);
    }
}
