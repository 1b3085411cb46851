package me.christianrobert.policyguard.expression.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.policyguard.antlr.PolicyExpressionLexer;
import me.christianrobert.policyguard.antlr.PolicyExpressionParser;
import me.christianrobert.policyguard.expression.Expression;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper around the generated ANTLR PolicyExpressionParser.
 * Handles parser instantiation, error collection, and conversion of the parse tree into
 * the {@link Expression} model.
 *
 * Uses two-stage parsing:
 * 1. Try SLL(*) mode first with a bail-out error strategy (fast)
 * 2. Fall back to LL(*) mode with full error reporting if SLL fails
 *
 * Note: Uses @Dependent scope because it is stateless and also instantiated with new
 * (SchemaBuilder, tests).
 */
@Dependent
public class AntlrPolicyParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrPolicyParser.class);

    /**
     * Parses policy text into an expression tree.
     *
     * @param source policy condition, e.g. {@code auth() != null && published}
     * @return the expression tree
     * @throws InvalidPolicyExpressionException if the text is empty or has syntax errors
     */
    public Expression parse(String source) {
        ParseResult result = parseTree(source);
        if (result.hasErrors()) {
            throw new InvalidPolicyExpressionException(null,
                    "Failed to parse policy expression: " + result.getErrorMessage(), source, null);
        }
        return new ExpressionTreeBuilder().build((PolicyExpressionParser.PolicyExpressionContext) result.getTree());
    }

    /**
     * Parses policy text into an ANTLR parse tree without building the expression model.
     */
    public ParseResult parseTree(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new InvalidPolicyExpressionException("Policy expression cannot be null or empty");
        }

        log.trace("Parsing policy expression: {}", source);

        PolicyExpressionLexer lexer = new PolicyExpressionLexer(CharStreams.fromString(source));
        List<String> errors = new ArrayList<>();
        lexer.removeErrorListeners();
        lexer.addErrorListener(collectingListener(errors));
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        // Stage 1: SLL(*) (fast path)
        PolicyExpressionParser parser = new PolicyExpressionParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        PolicyExpressionParser.PolicyExpressionContext tree;
        try {
            tree = parser.policyExpression();
        } catch (ParseCancellationException sllFailure) {
            log.trace("SLL(*) parse failed for '{}', falling back to LL(*)", source);

            // Stage 2: LL(*) with error collection
            tokens.seek(0);
            parser.reset();
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(collectingListener(errors));
            tree = parser.policyExpression();
        }

        return new ParseResult(tree, errors, source);
    }

    private BaseErrorListener collectingListener(List<String> errors) {
        return new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                errors.add(error);
                log.debug("Policy parse error: {}", error);
            }
        };
    }
}
