package de.bsommerfeld.addons.options;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled form of one entry of an addon's option-type description. A
 * description is a JSON object whose values are either a type name
 * ({@code "str"}), a one-element array ({@code ["int"]}) or a nested object.
 *
 * @see OptionsValidator#compile(Map)
 */
public interface OptionType {

    /** Human-readable type, used in diagnostics. */
    String describe();

    /** Scalar types. Values are coerced into their canonical Java form. */
    enum Kind {
        STR("str"),
        INT("int"),
        FLOAT("float"),
        BOOL("bool"),
        EMAIL("email"),
        URL("url"),
        PORT("port");

        private final String token;

        Kind(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        static Kind fromToken(String token) {
            for (Kind kind : values()) {
                if (kind.token.equals(token)) {
                    return kind;
                }
            }
            return null;
        }
    }

    record Primitive(Kind kind) implements OptionType {
        @Override
        public String describe() {
            return kind.token();
        }
    }

    record ListOf(OptionType element) implements OptionType {
        @Override
        public String describe() {
            return "list of " + element.describe();
        }
    }

    record Nested(Map<String, OptionType> fields) implements OptionType {

        public Nested {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String describe() {
            return "mapping";
        }
    }

    /**
     * Accepted as-is. Used for secrets and values the addon interprets itself.
     */
    record FreeForm(String name) implements OptionType {

        static final String PASSWORD = "password";
        static final String ANY = "any";

        @Override
        public String describe() {
            return name;
        }
    }
}
