package org.dxworks.fortframe.reader;

/**
 * Single forward pass over logical lines. There is no rewinding; callers that need to look
 * again must keep what they consumed.
 */
public interface LineCursor {

    /** Next line without consuming it, or {@code null} at the end. */
    LogicalLine peek();

    /** Consumes the next line. */
    LogicalLine advance();

    boolean atEnd();

}
