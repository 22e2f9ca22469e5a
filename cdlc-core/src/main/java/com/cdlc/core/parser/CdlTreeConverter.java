package com.cdlc.core.parser;

import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.Expression;
import com.cdlc.parser.CdlParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a {@code storedDefinition} parse tree into {@link CdlAst} records.
 */
final class CdlTreeConverter {

    private static final String VENDOR_TAG_OPEN = "(";
    private static final String VENDOR_TAG_CLOSE = ")";

    private final String fileName;
    private final ExpressionConverter expressions;

    CdlTreeConverter(String fileName) {
        this.fileName = fileName;
        this.expressions = new ExpressionConverter(fileName);
    }

    CdlAst.StoredDefinition convert(CdlParser.StoredDefinitionContext ctx) {
        String within = null;
        if (ctx.withinClause() != null && ctx.withinClause().name() != null) {
            within = ExpressionConverter.dottedName(ctx.withinClause().name());
        }
        return new CdlAst.StoredDefinition(within, classDefinition(ctx.classDefinition()), fileName);
    }

    Expression expression(CdlParser.ExpressionContext ctx) {
        return expressions.visit(ctx);
    }

    private CdlAst.ClassDefinition classDefinition(CdlParser.ClassDefinitionContext ctx) {
        TerminalNode name = ctx.IDENT(0);
        TerminalNode endName = ctx.IDENT(1);
        if (!name.getText().equals(endName.getText())) {
            throw CdlException.of(ErrorKind.SYNTAX_ERROR, null, location(endName.getSymbol()),
                "End name '" + endName.getText() + "' does not match class name '" + name.getText() + "'",
                endName.getText());
        }

        List<CdlAst.ComponentClause> components = new ArrayList<>();
        List<CdlAst.ConnectClause> connections = new ArrayList<>();
        CdlParser.CompositionContext composition = ctx.composition();
        addComponents(composition.elementList(), false, components);
        for (CdlParser.SectionPartContext section : composition.sectionPart()) {
            if (section instanceof CdlParser.PublicSectionContext publicSection) {
                addComponents(publicSection.elementList(), false, components);
            } else if (section instanceof CdlParser.ProtectedSectionContext protectedSection) {
                addComponents(protectedSection.elementList(), true, components);
            } else if (section instanceof CdlParser.EquationPartContext equationPart) {
                for (CdlParser.ConnectClauseContext connect : equationPart.equationSection().connectClause()) {
                    connections.add(connectClause(connect));
                }
            }
        }

        CdlAst.Annotation annotation = null;
        if (composition.classAnnotation() != null) {
            annotation = annotation(composition.classAnnotation().annotationClause());
        }

        return new CdlAst.ClassDefinition(
            ctx.classPrefix().getText(),
            name.getText(),
            description(ctx.description()),
            components,
            connections,
            annotation,
            location(name.getSymbol())
        );
    }

    private void addComponents(CdlParser.ElementListContext list, boolean protectedSection,
                               List<CdlAst.ComponentClause> target) {
        for (CdlParser.ComponentClauseContext clause : list.componentClause()) {
            target.add(componentClause(clause, protectedSection));
        }
    }

    private CdlAst.ComponentClause componentClause(CdlParser.ComponentClauseContext ctx, boolean protectedSection) {
        CdlParser.DeclarationContext declaration = ctx.declaration();
        String typeName = ExpressionConverter.dottedName(ctx.typeSpecifier().name());
        if (ExcludedConstructCheck.isClockType(typeName)) {
            throw CdlException.of(ErrorKind.SYNTAX_ERROR, null, location(ctx.typeSpecifier()),
                "Clocked constructs are not permitted in CDL", typeName);
        }

        List<Expression> dimensions = new ArrayList<>();
        if (ctx.arraySubscripts() != null) {
            dimensions.addAll(subscripts(ctx.arraySubscripts()));
        }
        if (declaration.arraySubscripts() != null) {
            dimensions.addAll(subscripts(declaration.arraySubscripts()));
        }

        List<CdlAst.Modification> modifications = List.of();
        List<CdlAst.VendorTag> vendorTags = List.of();
        Expression binding = null;
        CdlParser.ModificationContext modification = declaration.modification();
        if (modification != null) {
            if (modification.classModification() != null) {
                modifications = arguments(modification.classModification());
                vendorTags = vendorTags(modification.classModification());
            }
            if (modification.expression() != null) {
                binding = expression(modification.expression());
            }
        }

        Expression condition = ctx.conditionAttribute() != null
            ? expression(ctx.conditionAttribute().expression())
            : null;

        return new CdlAst.ComponentClause(
            ctx.PARAMETER() != null,
            ctx.FINAL() != null,
            typeName,
            declaration.IDENT().getText(),
            dimensions,
            modifications,
            vendorTags,
            binding,
            condition,
            description(ctx.description()),
            ctx.annotationClause() != null ? annotation(ctx.annotationClause()) : null,
            protectedSection,
            location(declaration.IDENT().getSymbol())
        );
    }

    private CdlAst.ConnectClause connectClause(CdlParser.ConnectClauseContext ctx) {
        return new CdlAst.ConnectClause(
            componentRef(ctx.componentReference(0)),
            componentRef(ctx.componentReference(1)),
            description(ctx.description()),
            ctx.annotationClause() != null ? annotation(ctx.annotationClause()) : null,
            location(ctx.CONNECT().getSymbol())
        );
    }

    private CdlAst.ComponentRef componentRef(CdlParser.ComponentReferenceContext ctx) {
        List<CdlAst.RefPart> parts = new ArrayList<>();
        for (CdlParser.ReferencePartContext part : ctx.referencePart()) {
            List<Expression> subscripts = part.arraySubscripts() != null
                ? subscripts(part.arraySubscripts())
                : List.of();
            parts.add(new CdlAst.RefPart(part.IDENT().getText(), subscripts));
        }
        return new CdlAst.ComponentRef(parts, location(ctx));
    }

    private CdlAst.Annotation annotation(CdlParser.AnnotationClauseContext ctx) {
        return new CdlAst.Annotation(
            arguments(ctx.classModification()),
            vendorTags(ctx.classModification()),
            location(ctx.ANNOTATION().getSymbol())
        );
    }

    private List<CdlAst.Modification> arguments(CdlParser.ClassModificationContext ctx) {
        List<CdlAst.Modification> result = new ArrayList<>();
        if (ctx.argumentList() == null) {
            return result;
        }
        for (CdlParser.ArgumentContext argument : ctx.argumentList().argument()) {
            if (argument instanceof CdlParser.ElementModificationContext element) {
                result.add(elementModification(element));
            }
        }
        return result;
    }

    private List<CdlAst.VendorTag> vendorTags(CdlParser.ClassModificationContext ctx) {
        List<CdlAst.VendorTag> result = new ArrayList<>();
        if (ctx.argumentList() == null) {
            return result;
        }
        for (CdlParser.ArgumentContext argument : ctx.argumentList().argument()) {
            if (argument instanceof CdlParser.VendorTagArgumentContext tag) {
                result.add(vendorTag(tag.VENDOR_TAG().getSymbol()));
            }
        }
        return result;
    }

    private CdlAst.Modification elementModification(CdlParser.ElementModificationContext ctx) {
        List<CdlAst.Modification> arguments = List.of();
        List<CdlAst.VendorTag> vendorTags = List.of();
        Expression value = null;
        CdlParser.ModificationContext modification = ctx.modification();
        if (modification != null) {
            if (modification.classModification() != null) {
                arguments = arguments(modification.classModification());
                vendorTags = vendorTags(modification.classModification());
            }
            if (modification.expression() != null) {
                value = expression(modification.expression());
            }
        }
        return new CdlAst.Modification(
            ExpressionConverter.dottedName(ctx.name()),
            ctx.FINAL() != null,
            ctx.EACH() != null,
            arguments,
            vendorTags,
            value,
            location(ctx.name())
        );
    }

    /**
     * Splits a {@code VENDOR_TAG} token into keyword and verbatim payload.
     */
    private CdlAst.VendorTag vendorTag(Token token) {
        String text = token.getText();
        int open = text.indexOf(VENDOR_TAG_OPEN);
        int close = text.lastIndexOf(VENDOR_TAG_CLOSE);
        String keyword = text.substring(0, open).trim();
        String payload = text.substring(open + 1, close);
        return new CdlAst.VendorTag(keyword, payload, location(token));
    }

    private List<Expression> subscripts(CdlParser.ArraySubscriptsContext ctx) {
        List<Expression> result = new ArrayList<>();
        for (CdlParser.ExpressionContext expression : ctx.expression()) {
            result.add(expression(expression));
        }
        return result;
    }

    private static String description(CdlParser.DescriptionContext ctx) {
        if (ctx == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (TerminalNode string : ctx.STRING()) {
            sb.append(ExpressionConverter.unquote(string.getText()));
        }
        return sb.toString();
    }

    private SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getCharPositionInLine());
    }

    private SourceLocation location(ParserRuleContext ctx) {
        return location(ctx.getStart());
    }
}
