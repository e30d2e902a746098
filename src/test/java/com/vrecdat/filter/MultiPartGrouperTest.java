package com.vrecdat.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiPartGrouperTest {

    @ParameterizedTest
    @DisplayName("Part markers are recognized case-insensitively")
    @CsvSource(delimiter = '|', value = {
        "Game (Disc 1)|true|true",
        "Game (disk 1) (USA)|true|true",
        "Game (Side 1)|true|true",
        "Game (Tape 1)|true|true",
        "Game (Disc 2)|false|true",
        "Game (Disc 10)|false|true",
        "Game (USA)|false|false",
        "Disc 1 Game|false|false"
    })
    void testMarkers(String name, boolean first, boolean any) {
        assertEquals(first, MultiPartGrouper.isFirstPart(name));
        assertEquals(any, MultiPartGrouper.isAnyPart(name));
    }

    @Test
    @DisplayName("Base name strips only a trailing marker")
    void testBaseName() {
        assertEquals("Game (USA)", MultiPartGrouper.baseName("Game (USA) (Disc 2)"));
        assertEquals("Game (USA)", MultiPartGrouper.baseName("Game (USA) (SIDE 1) "));
        assertEquals("Game (Disc 1) (USA)", MultiPartGrouper.baseName("Game (Disc 1) (USA)"));
        assertEquals("", MultiPartGrouper.baseName(null));
    }

    @Test
    @DisplayName("Siblings share the base name of the first part")
    void testSiblings() {
        CatalogEntry disc1 = entry("Super Game (USA) (Disc 1)");
        CatalogEntry disc2 = entry("Super Game (USA) (Disc 2)");
        CatalogEntry disc3 = entry("Super Game (USA) (Disc 3)");
        CatalogEntry europe = entry("Super Game (Europe) (Disc 2)");
        CatalogEntry single = entry("Super Game (USA)");
        List<CatalogEntry> siblings = MultiPartGrouper.siblingsOf(disc1, List.of(disc1, europe, disc3, single, disc2));
        assertEquals(List.of(disc3, disc2), siblings);
    }

    @Test
    @DisplayName("Only a first part pulls in siblings")
    void testNoSiblingsForLaterPart() {
        CatalogEntry disc1 = entry("Super Game (USA) (Disc 1)");
        CatalogEntry disc2 = entry("Super Game (USA) (Disc 2)");
        assertTrue(MultiPartGrouper.siblingsOf(disc2, List.of(disc1)).isEmpty());
    }

    private static CatalogEntry entry(String name) {
        return new CatalogEntry(name, null);
    }
}
