package com.cppmodel.generator.codegen;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.EntityKind;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.FileEntity;

/**
 * Backend producing highlighted, cross-linked HTML source.
 *
 * Token classes are wrapped in {@code <span>} elements carrying a CSS class,
 * and every rendered entity with an identity gets an anchor. References are
 * resolved against the sealed {@link EntityIndex}: a target rendered in the
 * same page is linked as {@code #anchor}, one rendered in another unit as
 * {@code <unit>.html#anchor}. A reference without a rendered target is
 * written as a plain identifier. The result is the content of a
 * {@code <pre>} element, see {@link HtmlPageRenderer}.
 */
public class HtmlCodeGenerator extends IndentingCodeGenerator {
    private final Set<String> anchors = new HashSet<>();
    private final EntityIndex index;

    private FileEntity page;

    public HtmlCodeGenerator(int indentWidth, SynopsisPolicy policy, EntityIndex index) {
        super(indentWidth, policy);
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public SynopsisOption onContainerBegin(Entity entity) {
        enterPage(entity);
        SynopsisOption option = super.onContainerBegin(entity);
        anchor(entity, option);
        return option;
    }

    @Override
    public SynopsisOption onLeaf(Entity entity) {
        enterPage(entity);
        SynopsisOption option = super.onLeaf(entity);
        anchor(entity, option);
        return option;
    }

    @Override
    public void doWriteKeyword(String keyword) {
        span("kw", keyword);
    }

    @Override
    public void doWriteIdentifier(String identifier) {
        span("id", identifier);
    }

    @Override
    public void doWriteReference(List<EntityId> ids, String name) {
        Optional<String> href = new EntityRef(ids, name).resolve(index).flatMap(this::linkTo);
        if (href.isPresent()) {
            emit("<a class=\"ref\" href=\"" + href.get() + "\">" + escape(name) + "</a>");
        } else {
            span("id", name);
        }
    }

    @Override
    public void doWritePunctuation(String punctuation) {
        span("pn", punctuation);
    }

    @Override
    public void doWriteStrLiteral(String literal) {
        span("str", literal);
    }

    @Override
    public void doWriteIntLiteral(String literal) {
        span("num", literal);
    }

    @Override
    public void doWriteFloatLiteral(String literal) {
        span("num", literal);
    }

    @Override
    public void doWritePreprocessor(String token) {
        span("pp", token);
    }

    /**
     * Anchor name for an identity; only letters, digits and {@code - . :}
     * survive, everything else is written as {@code _<hex>_}.
     */
    public static String anchorName(EntityId id) {
        String value = id.getValue();
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c) && c < 128 || c == '-' || c == '.' || c == ':') {
                sb.append(c);
            } else {
                sb.append('_').append(Integer.toHexString(c)).append('_');
            }
        }
        return sb.toString();
    }

    public static String escapeHtml(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    protected String escape(String text) {
        return escapeHtml(text);
    }

    private void span(String cssClass, String text) {
        emit("<span class=\"" + cssClass + "\">" + escape(text) + "</span>");
    }

    /**
     * Link to the anchor of a target, if the target is rendered at all.
     * Anything on the way to its file that is excluded, or reduced to a
     * declaration, keeps the target out of the output. Parameters and base
     * specifiers are written inline by their owner and have no anchor.
     */
    private Optional<String> linkTo(Entity target) {
        if (target.getId() == null || target.getKind() == EntityKind.FUNCTION_PARAMETER
                || target.getKind() == EntityKind.BASE_CLASS) {
            return Optional.empty();
        }
        Entity current = target;
        while (!(current instanceof FileEntity)) {
            SynopsisOption option = getPolicy().choose(current);
            if (option == SynopsisOption.EXCLUDE || current != target && option == SynopsisOption.DECLARATION) {
                return Optional.empty();
            }
            Optional<Entity> parent = current.getParent();
            if (parent.isEmpty()) {
                // dropped from its tree, e.g. a member of a declaration
                return Optional.empty();
            }
            current = parent.get();
        }

        String anchor = "#" + anchorName(target.getId());
        return Optional.of(current == page ? anchor : pageName((FileEntity) current) + anchor);
    }

    /**
     * File name of the page rendered for a translation unit.
     */
    public static String pageName(FileEntity file) {
        return file.getName() + OutputFormat.HTML.getExtension();
    }

    private void enterPage(Entity entity) {
        if (page != null) {
            return;
        }
        Entity current = entity;
        while (current.getParent().isPresent()) {
            current = current.getParent().get();
        }
        if (current instanceof FileEntity file) {
            page = file;
        }
    }

    private void anchor(Entity entity, SynopsisOption option) {
        if (option == SynopsisOption.EXCLUDE || entity.getId() == null) {
            return;
        }
        String name = anchorName(entity.getId());
        if (anchors.add(name)) {
            emitInvisible("<a id=\"" + name + "\"></a>");
        }
    }
}
