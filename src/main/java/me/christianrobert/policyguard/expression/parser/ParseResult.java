package me.christianrobert.policyguard.expression.parser;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing policy expression text.
 * Contains the parse tree and any syntax errors encountered.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final List<String> errors;
    private final String source;

    public ParseResult(ParserRuleContext tree, List<String> errors, String source) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.source = source;
    }

    public ParserRuleContext getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getSource() {
        return source;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors, or {@code null} if there are none.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + !hasErrors() + ", errors=" + errors.size() + "}";
    }
}
