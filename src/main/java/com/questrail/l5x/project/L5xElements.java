package com.questrail.l5x.project;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * L5xElements
 * -----------------------------------------------------------------------------
 * Small DOM navigation helpers for the L5X schema.
 *
 * <p>L5X nests everything as direct children ({@code Controller/Tags/Tag},
 * {@code Routine/RLLContent/Rung}), so only direct-child navigation is
 * offered. Descendant searches would pick up program-scope tags when looking
 * for controller-scope ones.</p>
 *
 * <p>Text payloads come in two shapes:</p>
 * <ul>
 *   <li>single-language: {@code <Comment><![CDATA[...]]></Comment>}</li>
 *   <li>multi-language: {@code <Comment><LocalizedComment Lang="en-US">...}</li>
 * </ul>
 * {@link #text(Element, String)} handles both.
 */
final class L5xElements
{
    static final String LOCALIZED_COMMENT = "LocalizedComment";

    private L5xElements() {}

    static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Optional<Element> child(Element parent, String name) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                return Optional.of((Element) node);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns an attribute value, or {@code null} when the attribute is absent.
     */
    static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    /**
     * Extracts the text payload of a comment-like element.
     *
     * <p>When localized children exist, the one whose {@code Lang} matches
     * {@code preferredLanguage} wins, otherwise the first one. The result is
     * trimmed; blank text is reported as {@code null}.</p>
     */
    static String text(Element element, String preferredLanguage) {
        List<Element> localized = children(element, LOCALIZED_COMMENT);
        String raw;
        if (localized.isEmpty()) {
            raw = element.getTextContent();
        } else {
            Element chosen = localized.get(0);
            for (Element candidate : localized) {
                if (candidate.getAttribute("Lang").equalsIgnoreCase(preferredLanguage)) {
                    chosen = candidate;
                    break;
                }
            }
            raw = chosen.getTextContent();
        }
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
