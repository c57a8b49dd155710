/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.assay.core.display;

import dev.mars.assay.core.config.AssayConfiguration.DisplayConfig;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Renders test method arguments as short, bounded strings for display names.
 *
 * <p>Strings are quoted, escaped and truncated, and so is the {@code toString()} of other
 * objects. Arrays and iterables show a limited number of elements and nesting levels.
 * Formatting never throws: a value whose {@code toString()} fails renders as a placeholder
 * naming the exception and the value's type.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ArgumentFormatter {

    static final String ELLIPSIS = "...";
    static final String DEPTH_LIMIT = "[···]";
    private static final MathContext FLOATING_PRECISION = new MathContext(15);

    private final int maxStringLength;
    private final int maxEnumerableLength;
    private final int maxDepth;

    public ArgumentFormatter() {
        this(DisplayConfig.defaults());
    }

    public ArgumentFormatter(DisplayConfig config) {
        Objects.requireNonNull(config, "Display config cannot be null");
        this.maxStringLength = config.getMaxStringLength();
        this.maxEnumerableLength = config.getMaxEnumerableLength();
        this.maxDepth = config.getMaxDepth();
    }

    public String format(Object value) {
        return format(value, 1);
    }

    private String format(Object value, int depth) {
        if (value == null) {
            return "null";
        }
        try {
            if (value instanceof Character) {
                return "'" + escape(value.toString(), '\'') + "'";
            }
            if (value instanceof String) {
                return formatString((String) value);
            }
            if (value instanceof Double || value instanceof Float) {
                return formatFloating((Number) value);
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toPlainString();
            }
            if (value instanceof Number || value instanceof Boolean) {
                return value.toString();
            }
            if (value instanceof Enum) {
                return ((Enum<?>) value).name();
            }
            if (value instanceof Class) {
                return "typeof(" + ((Class<?>) value).getName() + ")";
            }
            if (value.getClass().isArray()) {
                return formatArray(value, depth);
            }
            if (value instanceof Iterable) {
                return formatIterable((Iterable<?>) value, depth);
            }
            return formatComplex(value);
        } catch (RuntimeException e) {
            return "{" + e.getClass().getSimpleName() + " was thrown formatting an object of type \""
                + value.getClass().getName() + "\"}";
        }
    }

    private String formatString(String value) {
        if (value.length() > maxStringLength) {
            return "\"" + escape(truncate(value), '"') + "\"" + ELLIPSIS;
        }
        return "\"" + escape(value, '"') + "\"";
    }

    // never ends on the high half of a surrogate pair
    private String truncate(String value) {
        int end = maxStringLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static String formatFloating(Number value) {
        double d = value.doubleValue();
        if (!Double.isFinite(d)) {
            return value.toString();
        }
        BigDecimal decimal = value instanceof Float ? new BigDecimal(value.toString()) : new BigDecimal(d);
        BigDecimal rounded = decimal.round(FLOATING_PRECISION).stripTrailingZeros();
        return rounded.signum() == 0 ? "0" : rounded.toPlainString();
    }

    private String formatArray(Object array, int depth) {
        if (depth > maxDepth) {
            return DEPTH_LIMIT;
        }
        int length = Array.getLength(array);
        List<String> items = new ArrayList<>();
        for (int i = 0; i < length && i < maxEnumerableLength; i++) {
            items.add(format(Array.get(array, i), depth + 1));
        }
        return join(items, length > maxEnumerableLength);
    }

    private String formatIterable(Iterable<?> iterable, int depth) {
        if (depth > maxDepth) {
            return DEPTH_LIMIT;
        }
        List<String> items = new ArrayList<>();
        Iterator<?> iterator = iterable.iterator();
        while (iterator.hasNext() && items.size() < maxEnumerableLength) {
            items.add(format(iterator.next(), depth + 1));
        }
        return join(items, iterator.hasNext());
    }

    private static String join(List<String> items, boolean truncated) {
        StringBuilder sb = new StringBuilder("[");
        sb.append(String.join(", ", items));
        if (truncated) {
            sb.append(", ").append(ELLIPSIS);
        }
        return sb.append(']').toString();
    }

    private String formatComplex(Object value) {
        Class<?> type = value.getClass();
        boolean hasOwnToString;
        try {
            hasOwnToString = type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            hasOwnToString = false;
        }
        if (!hasOwnToString) {
            return type.getSimpleName();
        }
        String text = value.toString();
        if (text == null) {
            return type.getSimpleName();
        }
        return text.length() > maxStringLength ? truncate(text) + ELLIPSIS : text;
    }

    private static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
