package ru.aritmos.crmconnector.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterSupportTableTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldLoadBundledTable() {
        FilterSupportTable table = FilterSupportTable.fromClasspath(mapper, "crm-filter-support.json");

        assertEquals(FilterSupport.KNOWN_BROKEN, table.status("/people", "pond"));
        assertEquals(FilterSupport.SUPPORTED, table.status("people", "stage"));
        assertEquals(FilterSupport.SUPPORTED, table.status("/deals", "personId"));
        assertEquals(FilterSupport.UNKNOWN, table.status("/people", "somethingElse"));
        assertEquals("ponds", table.itemPath("/people", "pond"));
    }

    @Test
    void shouldReturnEmptyTableForMissingResource() {
        FilterSupportTable table = FilterSupportTable.fromClasspath(mapper, "no-such-table.json");

        assertEquals(FilterSupport.UNKNOWN, table.status("/people", "pond"));
    }

    @Test
    void shouldLetDiscoveriesOverrideDeclarations() {
        FilterSupportTable table = FilterSupportTable.empty();
        table.declare("/ponds", "name", FilterSupport.SUPPORTED);

        table.record("/ponds", "name", FilterSupport.REJECTED);
        assertEquals(FilterSupport.REJECTED, table.status("/ponds", "name"));

        table.clearDiscoveries();
        assertEquals(FilterSupport.SUPPORTED, table.status("/ponds", "name"));
    }

    @Test
    void brokenDeclarationShouldWinOverSupported() {
        FilterSupportTable table = FilterSupportTable.empty();
        table.declareAll("/people", List.of("pond", "stage"), FilterSupport.KNOWN_BROKEN);
        table.declareAll("/people", List.of("pond"), FilterSupport.SUPPORTED);

        assertEquals(FilterSupport.KNOWN_BROKEN, table.status("/people", "pond"));
        assertTrue(table.status("/people", "stage").requiresLocalFiltering());
    }

    @Test
    void shouldShareEntriesAcrossNumericPathSegments() {
        FilterSupportTable table = FilterSupportTable.empty();
        table.declare("/people/1/notes", "type", FilterSupport.KNOWN_BROKEN);

        assertEquals(FilterSupport.KNOWN_BROKEN, table.status("/people/99/notes", "type"));
    }
}
