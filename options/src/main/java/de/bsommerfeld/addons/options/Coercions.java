package de.bsommerfeld.addons.options;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scalar coercion rules for {@link OptionType.Primitive}. Every method either
 * returns the canonical value or throws with the path it was given.
 */
final class Coercions {

    private static final Set<String> TRUE_WORDS = Set.of("1", "true", "yes", "on", "enable");
    private static final Set<String> FALSE_WORDS = Set.of("0", "false", "no", "off", "disable");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;

    private Coercions() {
    }

    static Object coerce(OptionType.Kind kind, Object value, String path) throws OptionsValidationException {
        if (value == null) {
            throw new OptionsValidationException(path, kind.token(), "missing value");
        }
        return switch (kind) {
            case STR -> toStr(value, path);
            case INT -> toInteger(value, path, kind);
            case FLOAT -> toFloat(value, path);
            case BOOL -> toBool(value, path);
            case EMAIL -> toEmail(value, path);
            case URL -> toUrl(value, path);
            case PORT -> toPort(value, path);
        };
    }

    private static String toStr(Object value, String path) throws OptionsValidationException {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new OptionsValidationException(path, OptionType.Kind.STR.token(), "not a scalar: " + value);
    }

    private static Number toInteger(Object value, String path, OptionType.Kind kind)
            throws OptionsValidationException {
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            throw new OptionsValidationException(path, kind.token(), "not a number: " + value);
        }
        BigInteger integral;
        try {
            integral = decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new OptionsValidationException(path, kind.token(), "not a whole number: " + value);
        }
        if (integral.bitLength() < Integer.SIZE) {
            return integral.intValue();
        }
        if (integral.bitLength() < Long.SIZE) {
            return integral.longValue();
        }
        throw new OptionsValidationException(path, kind.token(), "out of range: " + value);
    }

    private static Double toFloat(Object value, String path) throws OptionsValidationException {
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            throw new OptionsValidationException(path, OptionType.Kind.FLOAT.token(), "not a number: " + value);
        }
        return decimal.doubleValue();
    }

    private static Boolean toBool(Object value, String path) throws OptionsValidationException {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String word = String.valueOf(value).trim().toLowerCase(Locale.ENGLISH);
        if (TRUE_WORDS.contains(word)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(word)) {
            return Boolean.FALSE;
        }
        throw new OptionsValidationException(path, OptionType.Kind.BOOL.token(), "not a boolean: " + value);
    }

    private static String toEmail(Object value, String path) throws OptionsValidationException {
        if (value instanceof String text && EMAIL.matcher(text).matches()) {
            return text;
        }
        throw new OptionsValidationException(path, OptionType.Kind.EMAIL.token(), "not an e-mail address: " + value);
    }

    private static String toUrl(Object value, String path) throws OptionsValidationException {
        if (value instanceof String text) {
            try {
                URI uri = new URI(text);
                if (uri.getScheme() != null && uri.getHost() != null) {
                    return text;
                }
            } catch (URISyntaxException e) {
                throw new OptionsValidationException(path, OptionType.Kind.URL.token(),
                        "not a URL: " + e.getMessage());
            }
        }
        throw new OptionsValidationException(path, OptionType.Kind.URL.token(), "not an absolute URL: " + value);
    }

    private static Integer toPort(Object value, String path) throws OptionsValidationException {
        Number number = toInteger(value, path, OptionType.Kind.PORT);
        long port = number.longValue();
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new OptionsValidationException(path, OptionType.Kind.PORT.token(),
                    "port " + port + " outside " + MIN_PORT + ".." + MAX_PORT);
        }
        return (int) port;
    }

    // Booleans are rejected. NaN and infinities do not parse and are rejected too.
    private static BigDecimal toDecimal(Object value) {
        String text;
        if (value instanceof Number number) {
            text = number.toString();
        } else if (value instanceof String string) {
            text = string.trim();
        } else {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
