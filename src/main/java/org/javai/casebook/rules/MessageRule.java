package org.javai.casebook.rules;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A test against a fault's message text.
 */
public sealed interface MessageRule permits MessageRule.Prefix, MessageRule.Regex {

    /**
     * Matches messages that start with a literal prefix.
     */
    record Prefix(String prefix) implements MessageRule {

        public Prefix {
            Objects.requireNonNull(prefix, "prefix must not be null");
        }

        @Override
        public boolean matches(String message) {
            return message.startsWith(prefix);
        }

        @Override
        public String text() {
            return prefix;
        }
    }

    /**
     * Matches messages containing a match for a regular expression.
     */
    record Regex(Pattern pattern) implements MessageRule {

        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public boolean matches(String message) {
            return pattern.matcher(message).find();
        }

        @Override
        public String text() {
            return pattern.pattern();
        }
    }

    boolean matches(String message);

    /**
     * The source text of the rule. Rules with the same text replace each other.
     */
    String text();

    static MessageRule prefix(String prefix) {
        return new Prefix(prefix);
    }

    /**
     * @throws IllegalArgumentException if the expression does not compile
     */
    static MessageRule regex(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        try {
            return new Regex(Pattern.compile(expression));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid message pattern '" + expression + "'", e);
        }
    }
}
