package de.bsommerfeld.addons.options;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates and normalizes user options against an addon's option-type
 * description.
 *
 * <p>
 * {@link #compile(Map)} turns the raw description into an {@link OptionType}
 * tree once; {@link #validate(Map)} then walks options and tree side by side.
 * Keys that the description does not know are rejected. Keys it knows but the
 * options omit are allowed, so a partial override validates on its own.
 *
 * <p>
 * Instances are immutable and can be reused for any number of validations.
 */
public final class OptionsValidator {

    private final OptionType.Nested root;

    private OptionsValidator(OptionType.Nested root) {
        this.root = root;
    }

    /**
     * Compiles a raw option-type description.
     *
     * @throws OptionsValidationException if an entry is not a known type name,
     *                                    a one-element list or a nested object
     */
    public static OptionsValidator compile(Map<String, Object> description) throws OptionsValidationException {
        return new OptionsValidator(compileNested(description, ""));
    }

    /** The compiled top-level type. */
    public OptionType.Nested root() {
        return root;
    }

    /**
     * Validates {@code options} and returns a normalized copy: numbers parsed
     * from strings, booleans from their textual forms, scalars stringified for
     * {@code str}. The input is not modified.
     *
     * @throws OptionsValidationException on the first offending value, with
     *                                    its path and expected type
     */
    public Map<String, Object> validate(Map<String, Object> options) throws OptionsValidationException {
        return validateNested(root, options, "");
    }

    // -- Compilation --

    private static OptionType.Nested compileNested(Map<?, ?> description, String path)
            throws OptionsValidationException {
        Map<String, OptionType> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : description.entrySet()) {
            String key = String.valueOf(entry.getKey());
            fields.put(key, compileEntry(entry.getValue(), child(path, key)));
        }
        return new OptionType.Nested(fields);
    }

    private static OptionType compileEntry(Object raw, String path) throws OptionsValidationException {
        if (raw instanceof String name) {
            OptionType.Kind kind = OptionType.Kind.fromToken(name);
            if (kind != null) {
                return new OptionType.Primitive(kind);
            }
            if (OptionType.FreeForm.PASSWORD.equals(name) || OptionType.FreeForm.ANY.equals(name)) {
                return new OptionType.FreeForm(name);
            }
            throw new OptionsValidationException(path, null, "unknown option type '" + name + "'");
        }
        if (raw instanceof List<?> list) {
            if (list.size() != 1) {
                throw new OptionsValidationException(path, null,
                        "list type must declare exactly one element type, got " + list.size());
            }
            Object element = list.get(0);
            if (element instanceof List<?>) {
                throw new OptionsValidationException(path, null, "nested lists are not supported");
            }
            return new OptionType.ListOf(compileEntry(element, path + "[]"));
        }
        if (raw instanceof Map<?, ?> map) {
            return compileNested(map, path);
        }
        throw new OptionsValidationException(path, null, "unsupported type descriptor " + raw);
    }

    // -- Validation --

    private static Object validateValue(OptionType type, Object value, String path)
            throws OptionsValidationException {
        if (type instanceof OptionType.Primitive primitive) {
            return Coercions.coerce(primitive.kind(), value, path);
        }
        if (type instanceof OptionType.ListOf listOf) {
            return validateList(listOf, value, path);
        }
        if (type instanceof OptionType.Nested nested) {
            return validateNested(nested, value, path);
        }
        return value;
    }

    private static List<Object> validateList(OptionType.ListOf type, Object value, String path)
            throws OptionsValidationException {
        if (!(value instanceof List<?> list)) {
            throw new OptionsValidationException(path, type.describe(), "not a list");
        }
        List<Object> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            result.add(validateValue(type.element(), list.get(i), path + "[" + i + "]"));
        }
        return result;
    }

    private static Map<String, Object> validateNested(OptionType.Nested type, Object value, String path)
            throws OptionsValidationException {
        if (!(value instanceof Map<?, ?> map)) {
            throw new OptionsValidationException(path.isEmpty() ? "<root>" : path, type.describe(),
                    "not a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String childPath = child(path, key);
            OptionType fieldType = type.fields().get(key);
            if (fieldType == null) {
                throw new OptionsValidationException(childPath, null, "unknown option");
            }
            result.put(key, validateValue(fieldType, entry.getValue(), childPath));
        }
        return result;
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
