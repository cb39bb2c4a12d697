package com.questrail.l5x;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Locates the sample exports under {@code src/test/resources/fixtures}.
 */
public final class Fixtures
{
    public static final String INSTRUCTION_MARKER = "instruction_marker.L5X";
    public static final String COMMENT_MARKER = "comment_marker.L5X";
    public static final String WRONG_ROOT = "wrong_root.L5X";
    public static final String TRUNCATED = "truncated.L5X";
    public static final String DOCTYPE = "doctype.L5X";
    public static final String NO_CONTROLLER = "no_controller.L5X";

    private Fixtures() {}

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
