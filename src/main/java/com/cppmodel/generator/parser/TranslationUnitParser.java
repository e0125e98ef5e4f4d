package com.cppmodel.generator.parser;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.FileEntity;

/**
 * Runs the build pass over a translation unit cursor.
 *
 * The top-level declarations become children of a {@link FileEntity} named
 * after the unit. Several units may share one {@link EntityIndex}; the
 * caller seals it once every unit is parsed.
 */
public class TranslationUnitParser {
    private static final Logger log = LoggerFactory.getLogger(TranslationUnitParser.class);

    private final EntityIndex index;
    private final TypeParser typeParser;

    public TranslationUnitParser(EntityIndex index, TypeParser typeParser) {
        this.index = Objects.requireNonNull(index, "index");
        this.typeParser = Objects.requireNonNull(typeParser, "typeParser");
    }

    public TranslationUnitParser(EntityIndex index) {
        this(index, new SpellingTypeParser());
    }

    /**
     * Parses one unit into the shared index.
     *
     * @param unitName name of the resulting file entity
     * @param root     the translation unit cursor
     * @throws ProviderContractException if the provider's contract is violated
     */
    public ParseResult parse(String unitName, Cursor root) {
        if (root.getKind() != CursorKind.TRANSLATION_UNIT) {
            throw new ProviderContractException("Expected a translation unit cursor but got " + root.getKind());
        }
        log.info("Building entities of {}", unitName);

        ParseContext context = new ParseContext(index, typeParser);
        FileEntity.Builder builder = FileEntity.builder(unitName);
        root.visitChildren(child -> {
            if (child.getKind().isDeclaration()) {
                context.parseEntity(child, root).ifPresent(builder::addChild);
            }
        });

        FileEntity file = builder.finish(index);
        log.info("Built {} with {} entities", unitName, file.treeSize());
        return new ParseResult(file, index);
    }

    /**
     * Parses a single unit into a fresh index and seals it.
     */
    public static ParseResult parseStandalone(String unitName, Cursor root) {
        EntityIndex index = new EntityIndex();
        ParseResult result = new TranslationUnitParser(index).parse(unitName, root);
        index.seal();
        return result;
    }
}
