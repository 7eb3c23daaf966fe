package org.javai.casebook.rules;

/**
 * How {@link RuleRegistry#registerPattern(String, org.javai.casebook.Fault)} reads its pattern text.
 */
public enum PatternSyntax {
    /**
     * The text is a literal prefix of the message.
     */
    PREFIX {
        @Override
        MessageRule compile(String text) {
            return MessageRule.prefix(text);
        }
    },

    /**
     * The text is a regular expression searched for anywhere in the message.
     */
    REGEX {
        @Override
        MessageRule compile(String text) {
            return MessageRule.regex(text);
        }
    };

    abstract MessageRule compile(String text);
}
