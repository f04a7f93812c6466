package com.flaglang.value;

import com.flaglang.exception.InterpreterException;
import com.flaglang.value.Value.BooleanValue;
import com.flaglang.value.Value.DateValue;
import com.flaglang.value.Value.ListValue;
import com.flaglang.value.Value.NumberValue;
import com.flaglang.value.Value.ObjectValue;
import com.flaglang.value.Value.TextValue;

import java.text.Collator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Equality, ordering, membership and truthiness rules shared by the interpreter
 * and the evaluator.
 */
public final class Values {

    private Values() {
    }

    /**
     * Structural equality used by {@code ==}, {@code =}, {@code !=} and {@code in}.
     * <ul>
     *   <li>Dates compare by instant; a date against a string compares its UTC calendar day</li>
     *   <li>Lists compare element-wise, objects by key set and per-key values</li>
     *   <li>Values of different types are never equal</li>
     * </ul>
     */
    public static boolean areEqual(Value left, Value right) {
        if (left instanceof DateValue leftDate && right instanceof DateValue rightDate) {
            return leftDate.isValid() && rightDate.isValid()
                    && leftDate.instant().equals(rightDate.instant());
        }
        if (left instanceof DateValue date && right instanceof TextValue text) {
            return date.isValid() && date.calendarDay().equals(text.value());
        }
        if (left instanceof TextValue text && right instanceof DateValue date) {
            return date.isValid() && text.value().equals(date.calendarDay());
        }
        if (left instanceof ListValue leftList && right instanceof ListValue rightList) {
            return listsEqual(leftList.elements(), rightList.elements());
        }
        if (left instanceof ObjectValue leftObject && right instanceof ObjectValue rightObject) {
            return objectsEqual(leftObject.entries(), rightObject.entries());
        }
        if (left instanceof NumberValue leftNumber && right instanceof NumberValue rightNumber) {
            return leftNumber.value() == rightNumber.value();
        }
        if (left instanceof TextValue leftText && right instanceof TextValue rightText) {
            return leftText.value().equals(rightText.value());
        }
        if (left instanceof BooleanValue leftBool && right instanceof BooleanValue rightBool) {
            return leftBool.value() == rightBool.value();
        }
        return false;
    }

    /**
     * Ordering used by {@code >}, {@code <}, {@code >=} and {@code <=}.
     * A string compared with a date is read as a date first.
     *
     * @return negative, zero or positive
     * @throws InterpreterException for any other pairing of types or an invalid date
     */
    public static int compare(Value left, Value right) {
        if (left instanceof DateValue leftDate && right instanceof DateValue rightDate) {
            return compareDates(leftDate, rightDate);
        }
        if (left instanceof DateValue leftDate && right instanceof TextValue text) {
            return compareDates(leftDate, toDate(text));
        }
        if (left instanceof TextValue text && right instanceof DateValue rightDate) {
            return compareDates(toDate(text), rightDate);
        }
        if (left instanceof NumberValue leftNumber && right instanceof NumberValue rightNumber) {
            return compareNumbers(leftNumber.value(), rightNumber.value());
        }
        if (left instanceof TextValue leftText && right instanceof TextValue rightText) {
            return Collator.getInstance(Locale.ROOT).compare(leftText.value(), rightText.value());
        }
        throw new InterpreterException("Cannot compare values of types "
                + left.typeName() + " and " + right.typeName());
    }

    /**
     * Membership used by {@code in}: list element equality, or substring for two strings.
     *
     * @throws InterpreterException when the right side is neither a list nor a string
     *                              paired with a string
     */
    public static boolean contains(Value needle, Value haystack) {
        if (haystack instanceof ListValue list) {
            for (Value element : list.elements()) {
                if (areEqual(needle, element)) {
                    return true;
                }
            }
            return false;
        }
        if (needle instanceof TextValue text && haystack instanceof TextValue container) {
            return container.value().contains(text.value());
        }
        throw new InterpreterException("'in' operator requires a list or string on the right side, got "
                + needle.typeName() + " in " + haystack.typeName());
    }

    /**
     * Truthiness used by {@code and}, {@code or}, {@code not} and "is enabled" checks.
     */
    public static boolean isTruthy(Value value) {
        if (value instanceof BooleanValue bool) {
            return bool.value();
        }
        if (value instanceof NumberValue number) {
            return number.value() != 0;
        }
        if (value instanceof TextValue text) {
            return !text.value().isEmpty();
        }
        if (value instanceof ListValue list) {
            return !list.elements().isEmpty();
        }
        if (value instanceof DateValue date) {
            return date.isValid();
        }
        if (value instanceof ObjectValue object) {
            return !object.entries().isEmpty();
        }
        return value != null;
    }

    private static boolean listsEqual(List<Value> left, List<Value> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!areEqual(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean objectsEqual(Map<String, Value> left, Map<String, Value> right) {
        if (!left.keySet().equals(right.keySet())) {
            return false;
        }
        for (Map.Entry<String, Value> entry : left.entrySet()) {
            if (!areEqual(entry.getValue(), right.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    // -0.0 and 0.0 order as equal
    private static int compareNumbers(double left, double right) {
        if (left < right) {
            return -1;
        }
        return left > right ? 1 : 0;
    }

    private static int compareDates(DateValue left, DateValue right) {
        if (!left.isValid() || !right.isValid()) {
            throw new InterpreterException("Cannot compare invalid date");
        }
        return left.instant().compareTo(right.instant());
    }

    private static DateValue toDate(TextValue text) {
        return DateValue.parse(text.value())
                .orElseThrow(() -> new InterpreterException("Cannot compare date with non-date string "
                        + text));
    }
}
