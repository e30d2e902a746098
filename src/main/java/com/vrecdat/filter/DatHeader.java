package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Header of a filtered DAT file.
 * <p>
 * {@link #rewrite(Element, LocalDate)} derives it from the input header:
 * <ul>
 *   <li>name: original name with one trailing parenthetical removed, plus the tool suffix;</li>
 *   <li>description: original description plus the tool suffix;</li>
 *   <li>version, date, author and homepage: this tool's values;</li>
 *   <li>{@code url}, {@code retool}, {@code clrmamepro} and {@code comment} elements are copied over as they are.</li>
 * </ul>
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public record DatHeader(String name, String description, String version, String date, String author, String homepage,
                        List<Element> copiedElements) {
    private static final Logger logger = LoggerFactory.getLogger(DatHeader.class);

    static final String DEFAULT_NAME = "Unknown System";
    static final String DEFAULT_DESCRIPTION = "Unknown DAT";
    static final Set<String> COPIED_TAGS = Set.of("url", "retool", "clrmamepro", "comment");

    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)$");

    public DatHeader {
        copiedElements = List.copyOf(copiedElements);
    }

    /**
     * Builds the header for the filtered output.
     * @param original Input {@code <header>} element (may be null)
     * @param today Date written into the header
     * @return Rewritten header
     */
    public static DatHeader rewrite(Element original, LocalDate today) {
        String name = DEFAULT_NAME;
        String description = DEFAULT_DESCRIPTION;
        List<Element> copied = new ArrayList<>();
        if (original != null) {
            NodeList children = original.getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                Node node = children.item(i);
                if (node.getNodeType() != Node.ELEMENT_NODE) continue;
                Element child = (Element) node;
                String tag = child.getTagName();
                String text = child.getTextContent() == null ? "" : child.getTextContent().trim();
                if (tag.equals("name") && !text.isEmpty() && name.equals(DEFAULT_NAME)) {
                    name = text;
                } else if (tag.equals("description") && !text.isEmpty() && description.equals(DEFAULT_DESCRIPTION)) {
                    description = text;
                } else if (COPIED_TAGS.contains(tag)) {
                    logger.debug(" Copying header tag: <{}>", tag);
                    copied.add(child);
                }
            }
            logger.debug(" Original Name: '{}', Original Description: '{}'", name, description);
        } else {
            logger.warn("No <header> element found in input DAT.");
        }
        String processedName = TRAILING_PARENTHETICAL.matcher(name).replaceAll("").trim();
        return new DatHeader(
            processedName + ToolInfo.HEADER_SUFFIX,
            description + ToolInfo.HEADER_SUFFIX,
            ToolInfo.VERSION,
            today.toString(),
            ToolInfo.AUTHOR,
            ToolInfo.HOMEPAGE,
            copied
        );
    }
}
