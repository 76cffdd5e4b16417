package de.seuhd.balizas.data.datex2;

import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Namespace-qualified lookups on a DOM tree. Descendant searches walk the subtree in document order
 * (pre-order) and never match the scope element itself.
 */
@Slf4j
public final class Datex2Elements {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Datex2Elements() {
    }

    /**
     * Finds the first element with the given namespace and local name anywhere beneath the scope.
     *
     * @param scope the element to search beneath
     * @param namespace the namespace URI of the wanted element
     * @param localName the local name of the wanted element
     * @return the first match in document order, or null if there is none
     */
    public static @Nullable Element findFirst(@NonNull Element scope, @NonNull String namespace, @NonNull String localName) {
        for (Node child = scope.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element) {
                if (matches(element, namespace, localName)) {
                    return element;
                }
                Element nested = findFirst(element, namespace, localName);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Finds all elements with the given namespace and local name anywhere beneath the scope, in document order.
     * Matches nested inside other matches are included.
     */
    public static @NonNull List<Element> findAll(@NonNull Element scope, @NonNull String namespace, @NonNull String localName) {
        List<Element> result = new ArrayList<>();
        collect(scope, namespace, localName, result);
        return result;
    }

    /**
     * Finds the first direct child element with the given namespace and local name.
     */
    public static @Nullable Element findChild(@NonNull Element parent, @NonNull String namespace, @NonNull String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && matches(element, namespace, localName)) {
                return element;
            }
        }
        return null;
    }

    /**
     * Returns the text directly contained in the element (text and CDATA children, not nested elements), trimmed.
     *
     * @return the text, or null if the element is null or contains no text
     */
    public static @Nullable String text(@Nullable Element element) {
        if (element == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            short type = child.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        String trimmed = text.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Parses a plain decimal number, optionally with an exponent. Anything else, including Java-only forms
     * such as type suffixes ({@code 40.5f}) or hexadecimal floats, is treated as absent.
     *
     * @return the parsed value, or null if the input is null, empty or not a number
     */
    public static @Nullable Double parseDouble(@Nullable String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (!DECIMAL.matcher(value).matches()) {
            log.debug("Not a decimal number: {}", value);
            return null;
        }
        return Double.parseDouble(value);
    }

    private static void collect(@NonNull Element scope, @NonNull String namespace, @NonNull String localName,
                                @NonNull List<Element> result) {
        for (Node child = scope.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element) {
                if (matches(element, namespace, localName)) {
                    result.add(element);
                }
                collect(element, namespace, localName, result);
            }
        }
    }

    private static boolean matches(@NonNull Element element, @NonNull String namespace, @NonNull String localName) {
        return localName.equals(element.getLocalName()) && Objects.equals(namespace, element.getNamespaceURI());
    }
}
