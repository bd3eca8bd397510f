package io.keyexpr.core.config;

import io.keyexpr.core.model.Delimiters;
import java.util.Objects;

/**
 * Key generator settings: the expression and the delimiters it is written with.
 *
 * @param expression the key expression, e.g. {@code key::%name%::#MONO_INCR#}
 * @param delimiters field and generator delimiters
 */
public record KeyGenConfig(String expression, Delimiters delimiters) {

    public KeyGenConfig {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(delimiters, "delimiters must not be null");
    }

    /** Returns a new builder with the default delimiters. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link KeyGenConfig}; delimiters default to {@code %} and {@code #}. */
    public static final class Builder {

        private String expression;
        private char fieldDelimiter = Delimiters.DEFAULT_FIELD;
        private char generatorDelimiter = Delimiters.DEFAULT_GENERATOR;

        private Builder() {}

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder fieldDelimiter(char fieldDelimiter) {
            this.fieldDelimiter = fieldDelimiter;
            return this;
        }

        public Builder generatorDelimiter(char generatorDelimiter) {
            this.generatorDelimiter = generatorDelimiter;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws io.keyexpr.core.error.InvalidDelimiterException if the delimiters are unusable
         */
        public KeyGenConfig build() {
            return new KeyGenConfig(expression, new Delimiters(fieldDelimiter, generatorDelimiter));
        }
    }
}
