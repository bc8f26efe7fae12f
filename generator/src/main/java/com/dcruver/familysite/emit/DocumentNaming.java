package com.dcruver.familysite.emit;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps record ids to file names and wiki-links.
 * <p>
 * The mapping depends on the id alone and is injective: upper-case ASCII
 * letters, digits and {@code -} are kept, every other byte of the UTF-8 form
 * (lower-case letters and {@code _} included) becomes {@code _XX}. So
 * {@code @I1@} is {@code I1.md}, {@code @i1@} is {@code _691.md} and
 * {@code @I_1@} is {@code I_5F1.md}. Stems never contain lower-case letters,
 * so they stay distinct on case-insensitive filesystems.
 */
public final class DocumentNaming {

    private DocumentNaming() {
    }

    public static String fileStem(String id) {
        String bare = id.replace("@", "");
        StringBuilder sb = new StringBuilder(bare.length());
        for (byte b : bare.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-') {
                sb.append(c);
            } else {
                sb.append('_').append(String.format(Locale.ROOT, "%02X", b & 0xFF));
            }
        }
        return sb.toString();
    }

    public static String fileName(String id) {
        return fileStem(id) + ".md";
    }

    /**
     * Wiki-link in the form the site tool resolves by file name
     */
    public static String wikiLink(String id, String label) {
        return "[[" + fileStem(id) + "|" + linkLabel(label) + "]]";
    }

    static String linkLabel(String label) {
        return label.replace('|', '/')
            .replace('[', '(')
            .replace(']', ')')
            .replaceAll("\\s+", " ")
            .trim();
    }

    /**
     * Reject documents whose file names would be confused by the site tool, which
     * resolves wiki-links by file name across folders. Only the fixed page names
     * ({@code index}, {@code bios}) can clash with an id stem.
     */
    public static void checkCollisions(Collection<String> relativePaths) {
        Map<String, String> seen = new HashMap<>();
        for (String path : relativePaths) {
            String previous = seen.putIfAbsent(linkKey(path), path);
            if (previous != null) {
                throw new WriteException(path, "Document name collides with " + previous);
            }
        }
    }

    private static String linkKey(String relativePath) {
        String name = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        if (name.endsWith(".md")) {
            name = name.substring(0, name.length() - 3);
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
