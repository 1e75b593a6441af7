package io.github.yok.roomlink.writer;

import lombok.Generated;

/**
 * Converts column labels into valid XML element names.
 *
 * <p>
 * Characters allowed in an XML name are kept; every other character becomes {@code _}. A label
 * whose first character cannot start an XML name (for example a digit, {@code -} or {@code .}) gets
 * a leading {@code _}. An empty label becomes {@code _}. Colons are replaced as well because the
 * output does not use namespaces.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class XmlNames {

    @Generated
    private XmlNames() {}

    /**
     * Returns an element name derived from the given label.
     *
     * @param label column label
     * @return the label itself when it is already a valid name, an escaped form otherwise
     */
    public static String toElementName(String label) {
        if (label == null || label.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(label.length() + 1);
        int first = label.codePointAt(0);
        if (!isNameStartChar(first) && isNameChar(first)) {
            sb.append('_');
        }
        label.codePoints().forEach(cp -> {
            if (isNameChar(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });
        return sb.toString();
    }

    /**
     * Tells whether the label can be used as an element name unchanged.
     *
     * @param label column label
     * @return {@code true} if no escaping is needed
     */
    public static boolean isValidElementName(String label) {
        return label != null && !label.isEmpty() && label.equals(toElementName(label));
    }

    // NameStartChar production of XML 1.0 (5th edition), without ':'
    static boolean isNameStartChar(int cp) {
        return (cp >= 'A' && cp <= 'Z') || cp == '_' || (cp >= 'a' && cp <= 'z')
                || (cp >= 0xC0 && cp <= 0xD6) || (cp >= 0xD8 && cp <= 0xF6)
                || (cp >= 0xF8 && cp <= 0x2FF) || (cp >= 0x370 && cp <= 0x37D)
                || (cp >= 0x37F && cp <= 0x1FFF) || (cp >= 0x200C && cp <= 0x200D)
                || (cp >= 0x2070 && cp <= 0x218F) || (cp >= 0x2C00 && cp <= 0x2FEF)
                || (cp >= 0x3001 && cp <= 0xD7FF) || (cp >= 0xF900 && cp <= 0xFDCF)
                || (cp >= 0xFDF0 && cp <= 0xFFFD) || (cp >= 0x10000 && cp <= 0xEFFFF);
    }

    // NameChar production of XML 1.0 (5th edition), without ':'
    static boolean isNameChar(int cp) {
        return isNameStartChar(cp) || cp == '-' || cp == '.' || (cp >= '0' && cp <= '9')
                || cp == 0xB7 || (cp >= 0x300 && cp <= 0x36F) || (cp >= 0x203F && cp <= 0x2040);
    }
}
