package com.questrail.l5x.render;

import java.util.Objects;

/**
 * Makes state names safe to embed in a node label.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>line breaks (LF, CRLF, CR) become {@value #LINE_JOINER}</li>
 *   <li>the result is cut to {@value #MAX_LABEL_LENGTH} code points</li>
 *   <li>flowchart only: the node-shape delimiters {@code ( ) [ ]} become
 *       {@value #PAREN_SUBSTITUTE} and {@code "} becomes {@code '}</li>
 * </ol>
 */
public final class LabelSanitizer
{
    public static final int MAX_LABEL_LENGTH = 60;

    public static final String LINE_JOINER = " - ";

    public static final char PAREN_SUBSTITUTE = '~';

    public static final char QUOTE_SUBSTITUTE = '\'';

    private LabelSanitizer() {}

    public static String sanitize(String name, DiagramGrammar grammar) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(grammar, "grammar");

        String label = name.replace("\r\n", "\n").replace('\r', '\n').replace("\n", LINE_JOINER);
        label = truncate(label, MAX_LABEL_LENGTH);
        if (grammar == DiagramGrammar.FLOWCHART) {
            label = label.replace('(', PAREN_SUBSTITUTE).replace(')', PAREN_SUBSTITUTE)
                    .replace('[', PAREN_SUBSTITUTE).replace(']', PAREN_SUBSTITUTE)
                    .replace('"', QUOTE_SUBSTITUTE);
        }
        return label;
    }

    private static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }
}
