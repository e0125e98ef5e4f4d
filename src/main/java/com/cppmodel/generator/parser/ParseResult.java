package com.cppmodel.generator.parser;

import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.FileEntity;

import lombok.Value;

/**
 * A finished translation unit together with the symbol table it was registered in.
 */
@Value
public class ParseResult {
    FileEntity file;
    EntityIndex index;
}
