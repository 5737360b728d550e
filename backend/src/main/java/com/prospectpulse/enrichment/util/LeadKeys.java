package com.prospectpulse.enrichment.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class LeadKeys {
    private LeadKeys() {
    }

    public static String leadId(String workspaceId, Map<String, String> rawInput) {
        String company = normalizeCompany(firstNonBlank(rawInput, "company", "name"));
        String contact = normalizeContact(firstNonBlank(rawInput, "contact", "email"));
        return HashUtils.sha256Hex(workspaceId + "|" + company + "|" + contact);
    }

    public static Map<String, String> cleanInput(Map<String, String> rawInput) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (rawInput == null) {
            return cleaned;
        }
        rawInput.forEach((key, value) -> {
            if (key == null || key.isBlank() || value == null || value.isBlank()) {
                return;
            }
            cleaned.put(key.trim().toLowerCase(Locale.ROOT), value.trim());
        });
        return cleaned;
    }

    public static boolean hasIdentity(Map<String, String> rawInput) {
        return firstNonBlank(rawInput, "company", "name", "contact", "email") != null;
    }

    static String normalizeCompany(String company) {
        if (company == null) {
            return "";
        }
        String lower = company.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
        return lower.replaceAll("\\s+(inc|corp|corporation|llc|ltd|co|gmbh)$", "");
    }

    static String normalizeContact(String contact) {
        return contact == null ? "" : contact.trim().toLowerCase(Locale.ROOT);
    }

    private static String firstNonBlank(Map<String, String> input, String... keys) {
        if (input == null) {
            return null;
        }
        for (String key : keys) {
            String value = input.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
