package com.github.dimitryivaniuta.callpipeline.policy;

import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Named bundles of method patterns. Packs widen the base allowlist per product area.
 */
public final class CapabilityPacks {

    public static final String NONE = "none";
    public static final List<String> DEFAULT_PACKS = List.of("core");

    public static final Map<String, List<String>> PACKS;

    static {
        Map<String, List<String>> packs = new LinkedHashMap<>();
        packs.put("core", List.of("batch", "user.*", "department.*", "crm.*", "tasks.task.*", "task.*", "event.*"));
        packs.put("comms", List.of("im.*", "imbot.*", "imopenlines.*", "imconnector.*", "messageservice.*",
                "mailservice.*", "telephony.*"));
        packs.put("automation", List.of("bizproc.*", "crm.automation.*", "lists.*"));
        packs.put("collab", List.of("sonet_group.*", "socialnetwork.*", "log.*", "calendar.*", "vote.*"));
        packs.put("content", List.of("disk.*", "file.*", "files.*", "documentgenerator.*"));
        packs.put("boards", List.of("tasks.api.scrum.*", "tasks.scrum.*"));
        packs.put("commerce", List.of("sale.*", "catalog.*"));
        packs.put("services", List.of("booking.*", "calendar.*", "timeman.*"));
        packs.put("platform", List.of("entity.*", "biconnector.*", "ai.*"));
        packs.put("sites", List.of("landing.*"));
        packs.put("compliance", List.of("userconsent.*", "sign.*"));
        packs.put("diagnostics", List.of("method.get", "methods", "events", "feature.get", "scope", "server.time"));
        PACKS = Map.copyOf(packs);
    }

    private CapabilityPacks() {}

    /**
     * Normalizes a pack selection. Empty selects the defaults, {@code none} alone selects
     * nothing, duplicates keep their first position.
     *
     * @throws com.github.dimitryivaniuta.callpipeline.error.ApiCallException {@code UNKNOWN_PACK}
     */
    public static List<String> resolve(Collection<String> names) {
        List<String> cleaned = new ArrayList<>();
        if (names != null) {
            for (String n : names) {
                if (n != null && !n.isBlank()) cleaned.add(n.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (cleaned.isEmpty()) return DEFAULT_PACKS;
        if (cleaned.equals(List.of(NONE))) return List.of();

        Set<String> out = new LinkedHashSet<>();
        for (String name : cleaned) {
            if (!PACKS.containsKey(name)) {
                throw ApiError.workflow(ErrorCodes.UNKNOWN_PACK,
                        "unknown pack '" + name + "', available packs: " + String.join(", ", available())).toException();
            }
            out.add(name);
        }
        return List.copyOf(out);
    }

    /** Base patterns followed by every pattern of the given packs, lowercased and de-duplicated. */
    public static List<String> expand(Collection<String> basePatterns, Collection<String> packs) {
        Set<String> merged = new LinkedHashSet<>();
        for (String p : basePatterns) merged.add(p.toLowerCase(Locale.ROOT));
        for (String pack : packs) {
            for (String p : PACKS.get(pack)) merged.add(p.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(merged);
    }

    public static List<String> available() {
        return PACKS.keySet().stream().sorted().toList();
    }
}
