package com.prospectpulse.enrichment.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeadKeysTest {

    @Test
    void leadIdIgnoresCaseWhitespaceAndCorporateSuffix() {
        String first = LeadKeys.leadId("default", Map.of("company", "Acme Inc.", "contact", "JDoe@Acme.com"));
        String second = LeadKeys.leadId("default", Map.of("company", "  acme ", "contact", "jdoe@acme.com"));
        assertEquals(first, second);
        assertEquals(64, first.length());
    }

    @Test
    void leadIdIsScopedToWorkspace() {
        Map<String, String> input = Map.of("company", "Acme", "contact", "jdoe@acme.com");
        assertNotEquals(LeadKeys.leadId("north", input), LeadKeys.leadId("south", input));
    }

    @Test
    void cleanInputDropsBlankEntriesAndLowercasesKeys() {
        Map<String, String> raw = new HashMap<>();
        raw.put("Company", " Acme ");
        raw.put("notes", "   ");
        raw.put("title", null);
        Map<String, String> cleaned = LeadKeys.cleanInput(raw);
        assertEquals(Map.of("company", "Acme"), cleaned);
        assertTrue(LeadKeys.hasIdentity(cleaned));
        assertFalse(LeadKeys.hasIdentity(Map.of("title", "CTO")));
    }
}
