package com.vrecdat.filter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatFileServiceTest {

    static final String SAMPLE_DAT = """
        <?xml version="1.0"?>
        <!DOCTYPE datafile PUBLIC "-//Logiqx//DTD ROM Management Datafile//EN" "http://www.logiqx.com/Dats/datafile.dtd">
        <datafile>
        \t<header>
        \t\t<name>Sega - Mega Drive - Genesis (Parent-Clone)</name>
        \t\t<description>Sega - Mega Drive - Genesis (Parent-Clone) (20240101)</description>
        \t\t<version>20240101</version>
        \t\t<homepage>No-Intro</homepage>
        \t\t<url>https://www.no-intro.org</url>
        \t\t<clrmamepro forcenodump="required"/>
        \t</header>
        \t<game name="Super Game (USA)">
        \t\t<description>Super Game (USA)</description>
        \t\t<rom name="Super Game (USA).md" size="524288" crc="12345678"/>
        \t</game>
        \t<game name="Super Game (Japan)">
        \t\t<description>Super Game (Japan)</description>
        \t\t<rom name="Super Game (Japan).md" size="524288" crc="87654321"/>
        \t</game>
        \t<game name="Other Title">
        \t\t<description>Other Title</description>
        \t</game>
        </datafile>
        """;

    @TempDir
    Path tempDir;

    private DatFileService datFileService;

    @BeforeEach
    void setUp() {
        datFileService = new DatFileService();
    }

    @Test
    @DisplayName("Parses header and every game entry")
    void testParse() throws IOException {
        Path dat = write("input.dat", SAMPLE_DAT);
        DatCatalog catalog = datFileService.parse(dat);

        assertNotNull(catalog.header());
        assertEquals(3, catalog.entries().size());
        assertEquals("Super Game (USA)", catalog.entries().get(0).displayName());
        assertEquals("Other Title", catalog.entries().get(2).displayName());
        assertEquals("game", catalog.entries().get(1).element().getTagName());
    }

    @Test
    @DisplayName("A root other than datafile is rejected")
    void testWrongRoot() throws IOException {
        Path dat = write("wrong.dat", "<?xml version=\"1.0\"?><catalog><game name=\"A\"/></catalog>");
        DatFileException e = assertThrows(DatFileException.class, () -> datFileService.parse(dat));
        assertTrue(e.getMessage().contains("<catalog>"));
    }

    @Test
    @DisplayName("Malformed XML is rejected")
    void testMalformed() throws IOException {
        Path dat = write("broken.dat", "<datafile><game name=\"A\"></datafile>");
        assertThrows(DatFileException.class, () -> datFileService.parse(dat));
    }

    @Test
    @DisplayName("Written catalog keeps the entries verbatim under the new header")
    void testWriteAndCount() throws IOException {
        DatCatalog catalog = datFileService.parse(write("input.dat", SAMPLE_DAT));
        DatHeader header = DatHeader.rewrite(catalog.header(), LocalDate.of(2024, 5, 1));
        Path output = tempDir.resolve("out").resolve("filtered.dat");

        datFileService.write(output, header, List.of(catalog.entries().get(0), catalog.entries().get(2)));

        assertEquals(2, datFileService.countEntries(output));
        String xml = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(xml.startsWith("<?xml"));
        assertTrue(xml.contains("crc=\"12345678\""));
        assertFalse(xml.contains("Super Game (Japan)"));

        DatCatalog reread = datFileService.parse(output);
        Element newHeader = reread.header();
        assertEquals("Sega - Mega Drive - Genesis (VREC DAT Filter)", text(newHeader, "name"));
        assertEquals("2024-05-01", text(newHeader, "date"));
        assertEquals("https://www.no-intro.org", text(newHeader, "url"));
        assertEquals("required", ((Element) newHeader.getElementsByTagName("clrmamepro").item(0)).getAttribute("forcenodump"));
        assertEquals("Other Title", reread.entries().get(1).displayName());
    }

    @Test
    @DisplayName("Missing file surfaces as IOException")
    void testMissingFile() {
        assertThrows(IOException.class, () -> datFileService.parse(tempDir.resolve("missing.dat")));
    }

    private Path write(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private static String text(Element parent, String tag) {
        return parent.getElementsByTagName(tag).item(0).getTextContent();
    }
}
