package work.lcod.register.cli;

import java.util.List;
import java.util.Locale;
import work.lcod.register.runtime.Signature;

/**
 * Converts command-line strings to the parameter types of a signature.
 */
final class Arguments {
    private Arguments() {}

    static Object[] convert(Signature signature, List<String> raw) {
        List<String> values = raw == null ? List.of() : raw;
        if (values.size() != signature.arity()) {
            throw new IllegalArgumentException(
                "Expected " + signature.arity() + " argument(s) " + signature + ", got " + values.size()
            );
        }
        Object[] args = new Object[values.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = convert(signature.parameterTypes().get(i), values.get(i));
        }
        return args;
    }

    static Object convert(Class<?> type, String value) {
        String trimmed = value.trim();
        try {
            if (type == String.class || type == CharSequence.class || type == Object.class) {
                return value;
            }
            if (type == int.class || type == Integer.class) {
                return Integer.parseInt(trimmed);
            }
            if (type == long.class || type == Long.class) {
                return Long.parseLong(trimmed);
            }
            if (type == double.class || type == Double.class) {
                return Double.parseDouble(trimmed);
            }
            if (type == float.class || type == Float.class) {
                return Float.parseFloat(trimmed);
            }
            if (type == short.class || type == Short.class) {
                return Short.parseShort(trimmed);
            }
            if (type == byte.class || type == Byte.class) {
                return Byte.parseByte(trimmed);
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("'" + value + "' is not a valid " + type.getSimpleName(), ex);
        }
        if (type == boolean.class || type == Boolean.class) {
            String lowered = trimmed.toLowerCase(Locale.ROOT);
            if (!"true".equals(lowered) && !"false".equals(lowered)) {
                throw new IllegalArgumentException("'" + value + "' is not a valid boolean");
            }
            return Boolean.parseBoolean(lowered);
        }
        if ((type == char.class || type == Character.class) && value.length() == 1) {
            return value.charAt(0);
        }
        throw new IllegalArgumentException("Cannot convert '" + value + "' to " + type.getSimpleName());
    }
}
