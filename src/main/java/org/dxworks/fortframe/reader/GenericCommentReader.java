package org.dxworks.fortframe.reader;

import org.dxworks.fortframe.FortframeConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the documentation comments of a non-Fortran file whose comments start with
 * {@code commentMarker}, e.g. {@code #} or {@code //}. The documentation marks are the Fortran ones,
 * written after the marker: {@code #!}, {@code #>}, {@code #*}, {@code #|}.
 * <p>
 * Code is not analysed, so all documentation belongs to the file. A plain comment line or a code line
 * after documentation adds a blank fragment; a plain comment directly below an alternate mark
 * continues the alternate block.
 */
public class GenericCommentReader {
    private final String commentMarker;
    private final String docmark;
    private final String docmarkAlt;
    private final String predocmark;
    private final String predocmarkAlt;

    public GenericCommentReader(String commentMarker, FortframeConfig config) {
        this.commentMarker = commentMarker;
        this.docmark = config.getDocmark();
        this.docmarkAlt = config.getDocmarkAlt();
        this.predocmark = config.getPredocmark();
        this.predocmarkAlt = config.getPredocmarkAlt();
    }

    public List<String> read(String text) {
        List<String> fragments = new ArrayList<>();
        boolean afterDoc = false;
        boolean alternate = false;
        for (String raw : text.lines().toList()) {
            String line = raw.strip();
            int start = FortranTextUtils.findCommentStart(line, commentMarker);
            if (start < 0) {
                if (afterDoc) {
                    fragments.add("");
                    afterDoc = false;
                }
                alternate = false;
                continue;
            }
            String comment = line.substring(start + commentMarker.length());
            String alternateMark = markOf(comment, docmarkAlt, predocmarkAlt);
            if (alternateMark != null) {
                fragments.add(comment.substring(alternateMark.length()).strip());
                afterDoc = true;
                alternate = true;
                continue;
            }
            String mark = markOf(comment, docmark, predocmark);
            if (mark != null) {
                fragments.add(comment.substring(mark.length()).strip());
                afterDoc = true;
                alternate = false;
                continue;
            }
            if (alternate) {
                if (start == 0) {
                    fragments.add(comment.strip());
                } else {
                    alternate = false;
                }
            } else if (afterDoc) {
                fragments.add("");
                afterDoc = false;
            }
        }
        return fragments;
    }

    private static String markOf(String comment, String first, String second) {
        if (!first.isEmpty() && comment.startsWith(first)) {
            return first;
        }
        if (!second.isEmpty() && comment.startsWith(second)) {
            return second;
        }
        return null;
    }
}
