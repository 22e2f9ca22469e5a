package com.cdlc.core.ast;

import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Syntax tree node types for CDL source code.
 *
 * <p>This class contains record types representing the parsed subset of Modelica that CDL
 * admits: one class definition with parameter, connector and instance declarations,
 * connect statements and annotations. The records are immutable and carry source
 * locations for diagnostics.
 *
 * <p><b>Parser Implementation:</b></p>
 * <p>Built from the ANTLR parse tree by {@link com.cdlc.core.parser.CdlSourceParser}.</p>
 */
public final class CdlAst {

    private CdlAst() {
        // Utility class - no instantiation
    }

    /**
     * Contents of one {@code .mo} file.
     *
     * <p>Example:
     * <pre>{@code
     * within Buildings.Controls.OBC.ASHRAE;
     * block Controller "Supply air temperature controller"
     *   ...
     * end Controller;
     * }</pre>
     *
     * @param within package from the {@code within} clause, or {@code null}
     * @param classDefinition the single class definition
     * @param fileName file name given to the parser
     */
    public record StoredDefinition(
        String within,
        ClassDefinition classDefinition,
        String fileName
    ) {
        /**
         * Returns the qualified name declared by this file.
         *
         * @return {@code within + "." + name}, or just the class name at top level
         */
        public String qualifiedName() {
            if (within == null || within.isEmpty()) {
                return classDefinition.name();
            }
            return within + "." + classDefinition.name();
        }
    }

    /**
     * A {@code block} (or {@code model}) definition.
     *
     * @param restriction {@code block} or {@code model}
     * @param name class name
     * @param description description string
     * @param components declarations in source order
     * @param connections connect statements in source order
     * @param annotation class annotation, or {@code null}
     * @param location position of the class name
     */
    public record ClassDefinition(
        String restriction,
        String name,
        String description,
        List<ComponentClause> components,
        List<ConnectClause> connections,
        Annotation annotation,
        SourceLocation location
    ) {
        public ClassDefinition {
            components = components != null ? List.copyOf(components) : List.of();
            connections = connections != null ? List.copyOf(connections) : List.of();
        }
    }

    /**
     * One declaration: a parameter, a connector or a block instance.
     *
     * <p>Example:
     * <pre>{@code
     * Buildings.Controls.OBC.CDL.Reals.MultiplyByParameter gain(final k=2) "Gain";
     * }</pre>
     *
     * @param parameter whether declared with the {@code parameter} prefix
     * @param isFinal whether declared with the {@code final} prefix
     * @param typeName type name as written (dotted)
     * @param name declared name
     * @param dimensions array subscripts on the type or the name
     * @param modifications class modification arguments
     * @param vendorTags vendor tags written directly in the declaration's modification
     * @param binding {@code = expression} binding, or {@code null}
     * @param condition conditional-declaration expression, or {@code null}
     * @param description description string
     * @param annotation element annotation, or {@code null}
     * @param protectedElement whether declared in a {@code protected} section
     * @param location position of the declared name
     */
    public record ComponentClause(
        boolean parameter,
        boolean isFinal,
        String typeName,
        String name,
        List<Expression> dimensions,
        List<Modification> modifications,
        List<VendorTag> vendorTags,
        Expression binding,
        Expression condition,
        String description,
        Annotation annotation,
        boolean protectedElement,
        SourceLocation location
    ) {
        public ComponentClause {
            dimensions = dimensions != null ? List.copyOf(dimensions) : List.of();
            modifications = modifications != null ? List.copyOf(modifications) : List.of();
            vendorTags = vendorTags != null ? List.copyOf(vendorTags) : List.of();
        }

        public Optional<Modification> modification(String modificationName) {
            return modifications.stream().filter(m -> m.name().equals(modificationName)).findFirst();
        }
    }

    /**
     * Element modification, e.g. {@code final k=2} or {@code Placement(transformation(...))}.
     *
     * @param name modified element name (dotted)
     * @param isFinal whether prefixed with {@code final}
     * @param each whether prefixed with {@code each}
     * @param arguments nested modification arguments
     * @param vendorTags {@code brick(...)} / {@code haystack(...)} arguments found directly in this modification
     * @param value {@code = expression} value, or {@code null}
     * @param location position of the modified name
     */
    public record Modification(
        String name,
        boolean isFinal,
        boolean each,
        List<Modification> arguments,
        List<VendorTag> vendorTags,
        Expression value,
        SourceLocation location
    ) {
        public Modification {
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
            vendorTags = vendorTags != null ? List.copyOf(vendorTags) : List.of();
        }

        public Optional<Modification> argument(String argumentName) {
            return arguments.stream().filter(m -> m.name().equals(argumentName)).findFirst();
        }
    }

    /**
     * Raw vendor tag, e.g. {@code brick(:ahu a brick:AHU .)}.
     *
     * @param keyword {@code brick} or {@code haystack}
     * @param payload text between the outer parentheses, verbatim
     * @param location position of the keyword
     */
    public record VendorTag(
        String keyword,
        String payload,
        SourceLocation location
    ) {
    }

    /**
     * An {@code annotation(...)} clause.
     *
     * @param entries annotation arguments
     * @param vendorTags vendor tags written directly in the annotation (outside {@code __cdl})
     * @param location position of the {@code annotation} keyword
     */
    public record Annotation(
        List<Modification> entries,
        List<VendorTag> vendorTags,
        SourceLocation location
    ) {
        public Annotation {
            entries = entries != null ? List.copyOf(entries) : List.of();
            vendorTags = vendorTags != null ? List.copyOf(vendorTags) : List.of();
        }

        public Optional<Modification> entry(String entryName) {
            return entries.stream().filter(m -> m.name().equals(entryName)).findFirst();
        }

        /**
         * Returns all {@code __cdl(...)} entries, which hold vendor annotations.
         *
         * @return vendor entries in source order
         */
        public List<Modification> cdlEntries() {
            List<Modification> result = new ArrayList<>();
            for (Modification entry : entries) {
                if (entry.name().equals("__cdl")) {
                    result.add(entry);
                }
            }
            return result;
        }
    }

    /**
     * {@code connect(a, b)} statement.
     *
     * @param left first argument as written
     * @param right second argument as written
     * @param description description string
     * @param annotation annotation, or {@code null}
     * @param location position of the {@code connect} keyword
     */
    public record ConnectClause(
        ComponentRef left,
        ComponentRef right,
        String description,
        Annotation annotation,
        SourceLocation location
    ) {
    }

    /**
     * Component reference such as {@code gain.y} or {@code maxValue.u[2]}.
     *
     * @param parts reference parts
     * @param location position of the first part
     */
    public record ComponentRef(
        List<RefPart> parts,
        SourceLocation location
    ) {
        public ComponentRef {
            parts = List.copyOf(parts);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (RefPart part : parts) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(part);
            }
            return sb.toString();
        }
    }

    /**
     * One part of a component reference.
     *
     * @param name identifier
     * @param subscripts subscripts, empty if none
     */
    public record RefPart(
        String name,
        List<Expression> subscripts
    ) {
        public RefPart {
            subscripts = subscripts != null ? List.copyOf(subscripts) : List.of();
        }

        @Override
        public String toString() {
            if (subscripts.isEmpty()) {
                return name;
            }
            StringBuilder sb = new StringBuilder(name).append('[');
            for (int i = 0; i < subscripts.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(subscripts.get(i).toSource());
            }
            return sb.append(']').toString();
        }
    }
}
