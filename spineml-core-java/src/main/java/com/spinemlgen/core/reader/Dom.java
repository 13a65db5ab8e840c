package com.spinemlgen.core.reader;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking helpers over W3C DOM elements. Tags are matched on their local name so that
 * prefixed ({@code LL:Population}) and default-namespace documents read the same way.
 */
public final class Dom {

    private Dom() {}

    public static String tagOf(Element e) {
        String local = e.getLocalName();
        if (local != null) return local;
        String tag = e.getTagName();
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    /** First direct child with the given tag, or null. */
    public static Element child(Element parent, String tag) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n instanceof Element && tag.equals(tagOf((Element) n))) {
                return (Element) n;
            }
        }
        return null;
    }

    /** All direct children with the given tag, in document order. */
    public static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n instanceof Element && tag.equals(tagOf((Element) n))) {
                result.add((Element) n);
            }
        }
        return result;
    }

    /** Trimmed attribute value, or null when absent or blank. */
    public static String attr(Element e, String name) {
        if (!e.hasAttribute(name)) return null;
        String v = e.getAttribute(name).trim();
        return v.isEmpty() ? null : v;
    }

    /** Trimmed text of the first {@code tag} child, or null when the child is missing. */
    public static String childText(Element parent, String tag) {
        Element c = child(parent, tag);
        if (c == null) return null;
        String t = c.getTextContent();
        return t == null ? "" : t.trim();
    }

    /** Names ({@code name} attribute) of all direct children with the given tag. */
    public static List<String> names(Element parent, String tag) {
        List<String> result = new ArrayList<>();
        for (Element e : children(parent, tag)) {
            String name = attr(e, "name");
            if (name != null) result.add(name);
        }
        return result;
    }
}
