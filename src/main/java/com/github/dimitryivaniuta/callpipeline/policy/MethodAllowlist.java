package com.github.dimitryivaniuta.callpipeline.policy;

import org.springframework.util.PatternMatchUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Effective allowlist: base glob patterns plus those of the selected capability packs.
 * Matching is case-insensitive; {@code *} matches any run of characters, dots included.
 */
public final class MethodAllowlist {

    public static final List<String> DEFAULT_BASE_PATTERNS = List.of("batch");

    private final List<String> packs;
    private final List<String> patterns;

    private MethodAllowlist(List<String> packs, List<String> patterns) {
        this.packs = packs;
        this.patterns = patterns;
    }

    public static MethodAllowlist of(Collection<String> basePatterns, Collection<String> packNames) {
        List<String> base = new ArrayList<>();
        if (basePatterns != null) {
            for (String p : basePatterns) {
                if (p != null && !p.isBlank()) base.add(p.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (base.isEmpty()) base = DEFAULT_BASE_PATTERNS;

        List<String> packs = CapabilityPacks.resolve(packNames);
        return new MethodAllowlist(packs, CapabilityPacks.expand(base, packs));
    }

    public boolean isAllowed(String method) {
        return isAllowed(method, patterns);
    }

    public static boolean isAllowed(String method, Collection<String> patterns) {
        String m = method.toLowerCase(Locale.ROOT);
        for (String p : patterns) {
            if (PatternMatchUtils.simpleMatch(p.toLowerCase(Locale.ROOT), m)) return true;
        }
        return false;
    }

    public List<String> packs() {
        return packs;
    }

    public List<String> patterns() {
        return patterns;
    }
}
