package com.regwatch.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regwatch.core.model.CheckStatus;
import com.regwatch.core.model.HistoryEntry;
import com.regwatch.core.model.Priority;
import com.regwatch.core.model.Severity;
import com.regwatch.core.model.Source;
import com.regwatch.core.model.SourceCategory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void instantsAreWrittenAsIsoStringsAndNullsAreOmitted() throws Exception {
        Source source = new Source("https://example.com/eudr", "EUDR page", SourceCategory.EUDR, Priority.HIGH);
        HistoryEntry entry = HistoryEntry.checked(source, "abc", Instant.parse("2026-02-01T00:00:00Z"));

        JsonNode tree = JsonUtils.objectMapper().valueToTree(entry);

        assertEquals("2026-02-01T00:00:00Z", tree.get("lastCheckedAt").asText());
        assertEquals("checked", tree.get("lastStatus").asText());
        assertFalse(tree.has("lastError"));
    }

    @Test
    void enumsUseLowercaseWireNamesAndAcceptAnyCase() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertEquals("\"critical\"", mapper.writeValueAsString(Priority.CRITICAL));
        assertEquals("\"warning\"", mapper.writeValueAsString(Severity.WARNING));
        assertEquals(Priority.HIGH, mapper.readValue("\"HIGH\"", Priority.class));
        assertEquals(CheckStatus.ERROR, mapper.readValue("\"error\"", CheckStatus.class));
    }

    @Test
    void sourceWithoutPriorityDefaultsToLowestTier() throws Exception {
        Source parsed = JsonUtils.objectMapper().readValue(
                "{\"url\":\"https://fsc.org/en/newscentre\",\"displayName\":\"FSC\",\"category\":\"FSC\",\"extra\":1}",
                Source.class
        );

        assertEquals(Priority.MEDIUM, parsed.priority());
        assertTrue(parsed.id().startsWith("https://fsc.org"));
    }
}
