package com.homepage.api.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A byte prefix; dump lines whose stripped content starts with it are dropped before restore.
 */
public class SanitizationRule {

    public enum Category {
        /** Directives only understood by some server versions. */
        VERSION_SPECIFIC,
        /** Meta-commands injected by hosting providers. */
        PROPRIETARY_META_COMMAND
    }

    @Getter
    private final Category category;
    private final byte[] prefix;

    public SanitizationRule(Category category, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Sanitization prefix must not be empty");
        }
        this.category = category;
        this.prefix = prefix.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * True if {@code line[from, to)} starts with this rule's prefix.
     */
    public boolean matches(byte[] line, int from, int to) {
        if (to - from < prefix.length) {
            return false;
        }
        return Arrays.equals(line, from, from + prefix.length, prefix, 0, prefix.length);
    }

    public String describe() {
        return category + ":" + new String(prefix, StandardCharsets.UTF_8);
    }

    /**
     * Built-in rules in evaluation order, followed by extra version-specific prefixes.
     */
    public static List<SanitizationRule> defaults(Collection<String> extraVersionSpecificPrefixes) {
        List<SanitizationRule> rules = new ArrayList<>();
        rules.add(new SanitizationRule(Category.PROPRIETARY_META_COMMAND, "\\restrict"));
        rules.add(new SanitizationRule(Category.PROPRIETARY_META_COMMAND, "\\unrestrict"));
        // transaction_timeout only exists from PostgreSQL 17
        rules.add(new SanitizationRule(Category.VERSION_SPECIFIC, "SET transaction_timeout"));
        rules.add(new SanitizationRule(Category.VERSION_SPECIFIC, "SET idle_in_transaction_session_timeout"));
        for (String extra : extraVersionSpecificPrefixes) {
            if (extra != null && !extra.isBlank()) {
                rules.add(new SanitizationRule(Category.VERSION_SPECIFIC, extra.strip()));
            }
        }
        return List.copyOf(rules);
    }

    public static List<SanitizationRule> defaults() {
        return defaults(List.of());
    }
}
