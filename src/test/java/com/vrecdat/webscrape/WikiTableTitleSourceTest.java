package com.vrecdat.webscrape;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WikiTableTitleSourceTest {

    private final WikiTableTitleSource source = new WikiTableTitleSource("test-agent", 1000);

    @Test
    @DisplayName("Second column of every wikitable row is extracted and normalized")
    void testExtractTitles() {
        Document doc = Jsoup.parse("""
            <html><body>
            <table class="wikitable sortable">
              <tr><th>#</th><th>Title</th><th>Genre</th></tr>
              <tr><td>1</td><td>Sonic the Hedgehog[1]</td><td>Platformer</td></tr>
              <tr><td>2</td><td>Streets of Rage 2<br>Streets of Rage (Europe)</td><td>Beat 'em up</td></tr>
              <tr><td>only one cell</td></tr>
              <tr><td>3</td><td>[note]</td></tr>
            </table>
            <table class="wikitable">
              <tr><th>#</th><th>Title</th></tr>
              <tr><th>4</th><th>Gunstar Heroes: Treasure Box</th></tr>
            </table>
            <table class="other">
              <tr><th>#</th><th>Title</th></tr>
              <tr><td>5</td><td>Ignored Game</td></tr>
            </table>
            </body></html>""");

        Set<String> titles = source.extractTitles(doc, "https://example.com/wiki/Genesis");

        assertEquals(Set.of("sonic the hedgehog", "streets of rage 2", "streets of rage", "gunstar heroes treasure box"), titles);
    }

    @Test
    @DisplayName("Header rows are skipped")
    void testHeaderRowSkipped() {
        Document doc = Jsoup.parse("<table class=\"wikitable\"><tr><td>1</td><td>Header Like Title</td></tr></table>");
        assertTrue(source.extractTitles(doc, "https://example.com").isEmpty());
    }

    @Test
    @DisplayName("A page without wikitables yields no titles")
    void testNoWikitable() {
        Document doc = Jsoup.parse("<html><body><p>Nothing here</p></body></html>");
        assertTrue(source.extractTitles(doc, "https://example.com").isEmpty());
    }

    @Test
    @DisplayName("A URL jsoup cannot fetch gives an empty result")
    void testUnsupportedUrl() {
        assertTrue(source.fetchTitles("ftp://example.com/list").isEmpty());
    }
}
