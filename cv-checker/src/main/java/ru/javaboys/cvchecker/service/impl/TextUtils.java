package ru.javaboys.cvchecker.service.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

final class TextUtils {

    private TextUtils() {
    }

    static String safeTrim(String text, int maxChars) {
        if (text == null) return "";
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars);
    }

    static String nullIfBlank(String s, String def) {
        if (s == null) return def;
        String t = s.trim();
        return t.isEmpty() ? def : t;
    }

    static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    /**
     * Trimmed non-blank entries as an unmodifiable list, never {@code null}.
     */
    static List<String> cleanList(Collection<String> items) {
        if (items == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String it : items) {
            if (notBlank(it)) out.add(it.trim());
        }
        return List.copyOf(out);
    }

    static String joinOrNone(Collection<String> items) {
        return items == null || items.isEmpty() ? "None" : String.join(", ", items);
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
