package com.example.demo.pdfform.fill;

import java.util.Locale;
import java.util.Set;

final class FieldValues {
    private static final Set<String> CHECKED = Set.of("true", "yes", "on", "1", "x", "checked");

    private FieldValues() {
    }

    /**
     * Whether a template value should tick a check box whose on-state is {@code onValue}.
     */
    static boolean isChecked(String value, String onValue) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return value.equals(onValue) || CHECKED.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
