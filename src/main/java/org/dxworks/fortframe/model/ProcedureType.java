package org.dxworks.fortframe.model;

public enum ProcedureType {
    SUBROUTINE,
    FUNCTION,
    MODULE_PROCEDURE
}
