package com.cdlc.core.tags;

import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.Expression;
import com.cdlc.core.model.InterfaceConnector;
import com.cdlc.core.model.TagKind;
import com.cdlc.core.model.TagPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts Brick and Haystack tags from CDL annotations.
 *
 * <p>Tags are written as vendor annotations:
 * <pre>{@code
 * annotation(__cdl(brick(:ahu a brick:AHU .)));
 * annotation(__cdl(haystack({"id": "@ahu", "ahu": "m:"})));
 * annotation(__cdl(brick="ahu a brick:AHU"));
 * }</pre>
 *
 * <p>Payloads are kept verbatim and never interpreted. Placement rules:
 * <ul>
 *   <li>{@code brick} only on the class itself or on block instances</li>
 *   <li>{@code haystack} on the class, instances, parameters and connectors</li>
 *   <li>no tags on {@code connect} statements</li>
 *   <li>tags must be wrapped in {@code __cdl(...)} inside an {@code annotation(...)}</li>
 * </ul>
 * Every violation is reported as {@code TAG_PLACEMENT}; all violations of a class are
 * collected before throwing.
 */
public final class AnnotationTagExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnnotationTagExtractor.class);

    private enum Level {
        BLOCK("block"),
        INSTANCE("instance"),
        PARAMETER("parameter"),
        CONNECTOR("connector"),
        CONNECTION("connect statement");

        private final String label;

        Level(String label) {
            this.label = label;
        }
    }

    private AnnotationTagExtractor() {
        // Utility class
    }

    /**
     * Extracts all tags of a class definition.
     *
     * @param definition parsed class
     * @return tags of the class and its elements
     * @throws CdlException with kind {@code TAG_PLACEMENT} if any tag is misplaced
     */
    public static TagIndex extract(CdlAst.ClassDefinition definition) {
        List<Diagnostic> errors = new ArrayList<>();

        List<TagPayload> blockTags = fromAnnotation(definition.annotation(), Level.BLOCK, definition.name(), errors);

        Map<String, List<TagPayload>> elementTags = new LinkedHashMap<>();
        for (CdlAst.ComponentClause component : definition.components()) {
            for (CdlAst.VendorTag tag : component.vendorTags()) {
                errors.add(outsideAnnotation(tag, component.name()));
            }
            collectStray(component.modifications(), component.name(), errors);

            List<TagPayload> tags = fromAnnotation(component.annotation(), levelOf(component), component.name(), errors);
            if (!tags.isEmpty()) {
                elementTags.put(component.name(), tags);
            }
        }

        for (CdlAst.ConnectClause connect : definition.connections()) {
            String subject = "connect(" + connect.left() + ", " + connect.right() + ")";
            fromAnnotation(connect.annotation(), Level.CONNECTION, subject, errors);
        }

        if (!errors.isEmpty()) {
            throw new CdlException(errors);
        }
        log.debug("Extracted {} block tag(s) and tags for {} element(s) from {}",
            blockTags.size(), elementTags.size(), definition.name());
        return new TagIndex(blockTags, elementTags);
    }

    private static Level levelOf(CdlAst.ComponentClause component) {
        if (component.parameter()) {
            return Level.PARAMETER;
        }
        if (InterfaceConnector.fromTypeName(component.typeName()).isPresent()) {
            return Level.CONNECTOR;
        }
        return Level.INSTANCE;
    }

    private static List<TagPayload> fromAnnotation(CdlAst.Annotation annotation, Level level, String subject,
                                                   List<Diagnostic> errors) {
        List<TagPayload> tags = new ArrayList<>();
        if (annotation == null) {
            return tags;
        }
        for (CdlAst.VendorTag tag : annotation.vendorTags()) {
            errors.add(outsideCdl(tag, subject));
        }
        for (CdlAst.Modification entry : annotation.entries()) {
            if (!entry.name().equals("__cdl")) {
                collectStray(List.of(entry), subject, errors);
                continue;
            }
            for (CdlAst.VendorTag tag : entry.vendorTags()) {
                accept(TagKind.fromKeyword(tag.keyword()), tag.payload(), tag.location(), level, subject, tags, errors);
            }
            for (CdlAst.Modification argument : entry.arguments()) {
                if (isStringTag(argument)) {
                    String raw = ((Expression.StringLiteral) argument.value()).value();
                    accept(TagKind.fromKeyword(argument.name()), raw, argument.location(), level, subject, tags, errors);
                } else {
                    collectStray(List.of(argument), subject, errors);
                }
            }
        }
        return tags;
    }

    private static void accept(TagKind kind, String raw, SourceLocation location, Level level, String subject,
                               List<TagPayload> tags, List<Diagnostic> errors) {
        boolean allowed = switch (level) {
            case BLOCK, INSTANCE -> true;
            case PARAMETER, CONNECTOR -> kind == TagKind.HAYSTACK;
            case CONNECTION -> false;
        };
        if (allowed) {
            tags.add(new TagPayload(kind, raw));
            return;
        }
        errors.add(new Diagnostic(
            ErrorKind.TAG_PLACEMENT,
            null,
            location,
            "A " + kind.getKeyword() + " tag cannot be attached to " + level.label + " '" + subject + "'",
            List.of(subject)
        ));
    }

    private static boolean isStringTag(CdlAst.Modification argument) {
        return (argument.name().equals(TagKind.BRICK.getKeyword()) || argument.name().equals(TagKind.HAYSTACK.getKeyword()))
            && argument.value() instanceof Expression.StringLiteral;
    }

    /**
     * Reports vendor tags nested anywhere in {@code modifications}, where they are never valid.
     */
    private static void collectStray(List<CdlAst.Modification> modifications, String subject, List<Diagnostic> errors) {
        for (CdlAst.Modification modification : modifications) {
            for (CdlAst.VendorTag tag : modification.vendorTags()) {
                errors.add(outsideCdl(tag, subject));
            }
            collectStray(modification.arguments(), subject, errors);
        }
    }

    private static Diagnostic outsideCdl(CdlAst.VendorTag tag, String subject) {
        return new Diagnostic(ErrorKind.TAG_PLACEMENT, null, tag.location(),
            "The " + tag.keyword() + " tag on '" + subject + "' must be wrapped in __cdl(...)",
            List.of(subject));
    }

    private static Diagnostic outsideAnnotation(CdlAst.VendorTag tag, String subject) {
        return new Diagnostic(ErrorKind.TAG_PLACEMENT, null, tag.location(),
            "The " + tag.keyword() + " tag on '" + subject + "' must be placed in annotation(__cdl(...))",
            List.of(subject));
    }
}
