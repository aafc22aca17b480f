package de.htwsaar.urlmap.common.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Normalisiert Request-Pfade zu einem stabilen, kanonischen Schlüssel.
 *
 * <p>Reihenfolge: Kleinschreibung, Entfernen unsicherer Zeichen, Zusammenfassen von Slashes,
 * Auflösen von Punkt-Segmenten. Das Ergebnis beginnt immer mit {@code /}.</p>
 */
public final class PathCanonicalizer {

    public static final char SEPARATOR = '/';

    private static final String SAFE_PUNCTUATION = "-._~!$&'()*+,;=:@/";

    private PathCanonicalizer() {}

    /**
     * Liefert die kanonische Form eines Pfades. Totale Funktion, wirft nie.
     *
     * @param rawPath roher Pfad, darf {@code null} sein
     * @return kanonischer, absoluter Pfad
     */
    public static String canonicalize(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) return String.valueOf(SEPARATOR);

        String lower = rawPath.toLowerCase(Locale.ROOT);
        StringBuilder safe = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (isSafe(c)) safe.append(c);
        }
        return resolveSegments(safe);
    }

    private static boolean isSafe(char c) {
        if (c >= 'a' && c <= 'z') return true;
        if (c >= '0' && c <= '9') return true;
        return SAFE_PUNCTUATION.indexOf(c) >= 0;
    }

    // leere Segmente entsprechen mehrfachen Slashes; ".." ohne Elternsegment fällt weg
    private static String resolveSegments(CharSequence path) {
        Deque<String> segments = new ArrayDeque<>();
        int start = 0;
        for (int i = 0; i <= path.length(); i++) {
            if (i < path.length() && path.charAt(i) != SEPARATOR) continue;
            String segment = path.subSequence(start, i).toString();
            start = i + 1;
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }

        if (segments.isEmpty()) return String.valueOf(SEPARATOR);
        StringBuilder out = new StringBuilder(path.length() + 1);
        for (String segment : segments) {
            out.append(SEPARATOR).append(segment);
        }
        return out.toString();
    }
}
