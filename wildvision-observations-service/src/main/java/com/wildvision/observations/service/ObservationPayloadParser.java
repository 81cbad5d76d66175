package com.wildvision.observations.service;

import com.wildvision.observations.exception.ObservationValidationException;
import com.wildvision.observations.model.Gender;
import com.wildvision.observations.model.ObservationFields;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks an add-observation payload for the required keys and coerces each value
 * to its field type. Text is trimmed, numeric strings are accepted for the numeric fields.
 */
@Component
public class ObservationPayloadParser {

    private static final List<String> REQUIRED_FIELDS =
            List.of("species", "gender", "quantity", "latitude", "longitude", "userId");

    static final String NO_DATA = "No data provided";
    static final String INVALID_TYPES = "Invalid data types provided";
    static final String EMPTY_SPECIES = "Species must not be empty";
    static final String INVALID_GENDER = "Invalid gender value";
    static final String QUANTITY_TOO_LOW = "Quantity must be at least 1";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public ObservationFields parse(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new ObservationValidationException(NO_DATA);
        }

        List<String> missing = REQUIRED_FIELDS.stream()
                .filter(field -> !payload.containsKey(field))
                .toList();
        if (!missing.isEmpty()) {
            throw new ObservationValidationException("Missing fields: " + String.join(", ", missing));
        }

        String species = toText(payload.get("species"));
        String gender = toText(payload.get("gender"));
        int quantity = toInt(payload.get("quantity"));
        double latitude = toDouble(payload.get("latitude"));
        double longitude = toDouble(payload.get("longitude"));
        String userId = toText(payload.get("userId"));

        if (species.isEmpty()) {
            throw new ObservationValidationException(EMPTY_SPECIES);
        }
        Gender parsedGender = Gender.fromLabel(gender)
                .orElseThrow(() -> new ObservationValidationException(INVALID_GENDER));
        if (quantity < 1) {
            throw new ObservationValidationException(QUANTITY_TOO_LOW);
        }

        return new ObservationFields(species, parsedGender, quantity, latitude, longitude, userId);
    }

    private static String toText(Object value) {
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw invalidTypes();
    }

    private static int toInt(Object value) {
        try {
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).intValue();
            }
            if (value instanceof Long l) {
                return Math.toIntExact(l);
            }
            if (value instanceof BigInteger big) {
                return big.intValueExact();
            }
            if (value instanceof BigDecimal decimal) {
                // truncates toward zero
                return decimal.toBigInteger().intValueExact();
            }
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (!Double.isFinite(d) || d <= Integer.MIN_VALUE - 1.0 || d >= Integer.MAX_VALUE + 1.0) {
                    throw invalidTypes();
                }
                return (int) d;
            }
            if (value instanceof String s) {
                return Integer.parseInt(s.trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw invalidTypes();
        }
        throw invalidTypes();
    }

    private static double toDouble(Object value) {
        double result;
        if (value instanceof Number n) {
            result = n.doubleValue();
        } else if (value instanceof String s && DECIMAL.matcher(s.trim()).matches()) {
            result = Double.parseDouble(s.trim());
        } else {
            throw invalidTypes();
        }
        if (!Double.isFinite(result)) {
            throw invalidTypes();
        }
        return result;
    }

    private static ObservationValidationException invalidTypes() {
        return new ObservationValidationException(INVALID_TYPES);
    }
}
