package com.cstruct.extractor.parser;

import java.util.Optional;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Helpers for reading the generated C parse tree.
 */
public final class CTrees {

    private CTrees() {
    }

    /**
     * Name of a declarator whose innermost direct declarator is an identifier, as in
     * {@code x}, {@code *p} or {@code buf[8]}. Parenthesized declarators such as
     * {@code (*fp)(void)} have no simple name.
     */
    public static Optional<String> simpleIdentifier(CParser.DeclaratorContext declarator) {
        CParser.DirectDeclaratorContext direct = declarator.directDeclarator();
        while (direct.directDeclarator() != null) {
            direct = direct.directDeclarator();
        }
        TerminalNode identifier = direct.Identifier();
        return identifier != null ? Optional.of(identifier.getText()) : Optional.empty();
    }

    public static boolean isTypedef(CParser.DeclarationSpecifiersContext specifiers) {
        for (CParser.DeclarationSpecifierContext specifier : specifiers.declarationSpecifier()) {
            CParser.StorageClassSpecifierContext storage = specifier.storageClassSpecifier();
            if (storage != null && "typedef".equals(storage.getText())) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for {@code struct s { ... }}, false for a reference like {@code struct s}.
     */
    public static boolean isDefinition(CParser.StructOrUnionSpecifierContext struct) {
        for (ParseTree child : struct.children) {
            if (child instanceof TerminalNode && "{".equals(child.getText())) {
                return true;
            }
        }
        return false;
    }

    public static Optional<String> tagOf(CParser.StructOrUnionSpecifierContext struct) {
        return Optional.ofNullable(struct.Identifier()).map(TerminalNode::getText);
    }

    public static int line(ParserRuleContext context) {
        return context.getStart().getLine();
    }

    /**
     * Text between the quotes of a string literal or character constant token, with
     * any encoding prefix dropped. Escapes stay as written.
     */
    public static String literalPayload(String token) {
        char quote = token.charAt(token.length() - 1);
        return token.substring(token.indexOf(quote) + 1, token.length() - 1);
    }

    /**
     * Skips the chain of single-child rules every C expression is wrapped in, and
     * parentheses around a single expression, down to the node that carries content.
     */
    public static ParseTree unwrap(ParseTree tree) {
        ParseTree node = collapse(tree);
        while (node instanceof CParser.PrimaryExpressionContext primary
                && primary.expression() != null
                && primary.expression().assignmentExpression().size() == 1) {
            node = collapse(primary.expression().assignmentExpression(0));
        }
        return node;
    }

    /**
     * Structural dump of a subtree: {@code (ruleName child ...)}, tokens as their text,
     * single-child rule chains collapsed to their innermost rule.
     */
    public static String dump(ParseTree tree) {
        ParseTree node = collapse(tree);
        if (!(node instanceof ParserRuleContext context)) {
            return node.getText();
        }
        StringBuilder sb = new StringBuilder("(").append(CParser.ruleNames[context.getRuleIndex()]);
        for (int i = 0; i < context.getChildCount(); i++) {
            sb.append(' ').append(dump(context.getChild(i)));
        }
        return sb.append(')').toString();
    }

    private static ParseTree collapse(ParseTree tree) {
        ParseTree node = tree;
        while (node instanceof ParserRuleContext && node.getChildCount() == 1
                && node.getChild(0) instanceof ParserRuleContext) {
            node = node.getChild(0);
        }
        return node;
    }
}
