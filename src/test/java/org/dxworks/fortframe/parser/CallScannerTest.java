package org.dxworks.fortframe.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallScannerTest {

    @Test
    void subroutineCallWithComponentChain() {
        assertEquals(List.of(List.of("solver", "step")), CallScanner.scan("call Solver % step(dt)"));
    }

    @Test
    void indexedComponentsAreStripped() {
        assertEquals(List.of(List.of("grid", "cells", "update")), CallScanner.scan("call grid%cells(i, j)%update()"));
    }

    @Test
    void functionReferencesInExpressions() {
        assertEquals(List.of(List.of("f"), List.of("g"), List.of("obj", "h")),
                CallScanner.scan("x = f(a) + g(b) * obj%h(2)"));
    }

    @Test
    void keywordsAreNotCalls() {
        assertEquals(List.of(List.of("check")), CallScanner.scan("if (check(x)) then"));
        assertEquals(List.of(), CallScanner.scan("write (*, *) x"));
        assertEquals(List.of(), CallScanner.scan("deallocate (buffer)"));
    }

    @Test
    void callInsideLogicalIf() {
        assertEquals(List.of(List.of("finish"), List.of("done")), CallScanner.scan("if (done()) call finish"));
    }

    @Test
    void duplicatesAreCollapsed() {
        assertEquals(List.of(List.of("run")), CallScanner.scan("call run(run(1))"));
    }
}
