package com.cstruct.extractor.extract;

import java.util.List;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.cstruct.extractor.extract.model.CharacterText;
import com.cstruct.extractor.extract.model.FloatConstant;
import com.cstruct.extractor.extract.model.IntegerConstant;
import com.cstruct.extractor.extract.model.SimpleExpression;
import com.cstruct.extractor.extract.model.StringLiteralParts;
import com.cstruct.extractor.extract.model.Unrecognized;
import com.cstruct.extractor.parser.CParser;
import com.cstruct.extractor.parser.CTrees;

/**
 * Maps parsed expressions to {@link SimpleExpression}. Total: never throws for a
 * non-null expression and never evaluates anything.
 */
public class ExpressionSimplifier {

    public SimpleExpression simplify(CParser.AssignmentExpressionContext expression) {
        ParseTree core = CTrees.unwrap(expression);

        if (core instanceof CParser.ConstantContext constant) {
            Token token = constant.getStart();
            return switch (token.getType()) {
                case CParser.IntegerConstant -> new IntegerConstant(token.getText());
                case CParser.FloatingConstant -> new FloatConstant(token.getText());
                default -> new CharacterText(CTrees.literalPayload(token.getText()));
            };
        }
        if (core instanceof CParser.PrimaryExpressionContext primary && !primary.StringLiteral().isEmpty()) {
            List<String> parts = primary.StringLiteral().stream()
                    .map(TerminalNode::getText)
                    .map(CTrees::literalPayload)
                    .toList();
            return new StringLiteralParts(parts);
        }
        return new Unrecognized(CTrees.dump(expression));
    }
}
