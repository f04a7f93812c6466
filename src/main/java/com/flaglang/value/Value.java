package com.flaglang.value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runtime value produced by evaluation and supplied through the evaluation context.
 * Closed set of variants; see {@link Values} for equality, ordering and truthiness.
 */
public sealed interface Value {

    /**
     * Type name used in error messages.
     */
    String typeName();

    /**
     * Convert to a plain Java value: Boolean, Double, String, Instant (null if invalid),
     * List or Map.
     */
    Object toJava();

    record BooleanValue(boolean value) implements Value {

        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Finite or infinite number, never NaN.
     */
    record NumberValue(double value) implements Value {

        public NumberValue {
            if (Double.isNaN(value)) {
                throw new IllegalArgumentException("NaN is not a supported number value");
            }
        }

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record TextValue(String value) implements Value {

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * A point in time. A null instant marks a date that does not exist on the calendar,
     * such as a literal {@code 2024-02-30}.
     */
    record DateValue(Instant instant) implements Value {

        private static final DateValue INVALID = new DateValue(null);

        private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
                text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
                text -> OffsetDateTime.parse(text).toInstant(),
                text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC)
        );

        /**
         * Parse a YYYY-MM-DD date as midnight UTC.
         */
        public static DateValue ofIsoDate(String text) {
            try {
                return new DateValue(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException e) {
                return INVALID;
            }
        }

        /**
         * Parse a date or date-time string. Accepts YYYY-MM-DD, ISO instants,
         * offset date-times and local date-times (read as UTC).
         */
        public static Optional<DateValue> parse(String text) {
            String trimmed = text.trim();
            for (Function<String, Instant> parser : DATE_PARSERS) {
                try {
                    return Optional.of(new DateValue(parser.apply(trimmed)));
                } catch (DateTimeParseException e) {
                    continue;
                }
            }
            return Optional.empty();
        }

        public boolean isValid() {
            return instant != null;
        }

        /**
         * Calendar day in UTC, formatted as YYYY-MM-DD.
         */
        public String calendarDay() {
            if (instant == null) {
                throw new IllegalStateException("Invalid date has no calendar day");
            }
            return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
        }

        @Override
        public String typeName() {
            return "date";
        }

        @Override
        public Object toJava() {
            return instant;
        }

        @Override
        public String toString() {
            return instant == null ? "Invalid Date" : instant.toString();
        }
    }

    record ListValue(List<Value> elements) implements Value {

        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String typeName() {
            return "list";
        }

        @Override
        public Object toJava() {
            List<Object> result = new ArrayList<>(elements.size());
            for (Value element : elements) {
                result.add(element.toJava());
            }
            return result;
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /**
     * String-keyed object. Keys keep their insertion order.
     */
    record ObjectValue(Map<String, Value> entries) implements Value {

        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public String typeName() {
            return "object";
        }

        @Override
        public Object toJava() {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Value> entry : entries.entrySet()) {
                result.put(entry.getKey(), entry.getValue().toJava());
            }
            return result;
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    static Value of(boolean value) {
        return BooleanValue.of(value);
    }

    static Value of(double value) {
        return new NumberValue(value);
    }

    static Value of(String value) {
        return new TextValue(value);
    }

    /**
     * Convert a plain Java value into a {@link Value}.
     *
     * @param value Boolean, Number, CharSequence, Character, LocalDate, Instant, Date,
     *              Iterable, Map, or an existing Value
     * @return Converted value
     * @throws IllegalArgumentException for null or unsupported types
     */
    static Value of(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null values are not supported");
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return BooleanValue.of(b);
        }
        if (value instanceof Number n) {
            return new NumberValue(n.doubleValue());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new TextValue(value.toString());
        }
        if (value instanceof LocalDate date) {
            return new DateValue(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof Instant instant) {
            return new DateValue(instant);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return new DateValue(dateTime.toInstant());
        }
        if (value instanceof Date date) {
            return new DateValue(date.toInstant());
        }
        if (value instanceof Iterable<?> iterable) {
            List<Value> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(of(element));
            }
            return new ListValue(elements);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new ObjectValue(entries);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
}
