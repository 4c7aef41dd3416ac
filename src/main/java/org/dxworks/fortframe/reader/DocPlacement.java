package org.dxworks.fortframe.reader;

public enum DocPlacement {
    /** Documentation written before the statement it describes ({@code !>}). */
    PRECEDING,
    /** Documentation written on or after the statement it describes ({@code !!}). */
    FOLLOWING
}
