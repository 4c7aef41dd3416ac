package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.diagnostics.DiagnosticKind;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.VariableEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentationFinisherTest {
    private Diagnostics diagnostics;
    private DocumentationFinisher finisher;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        finisher = new DocumentationFinisher("doc.f90", diagnostics);
    }

    private VariableEntity finish(String... fragments) {
        VariableEntity entity = new VariableEntity("v");
        entity.docFragments.addAll(List.of(fragments));
        finisher.finish(entity);
        return entity;
    }

    @Test
    void fragmentsAreDedentedAndTrimmed() {
        VariableEntity entity = finish(" first line", "   indented", "", " last", "");

        assertEquals("first line\n  indented\n\nlast", entity.documentation);
        assertTrue(entity.docFragments.isEmpty());
    }

    @Test
    void noFragmentsLeaveDocumentationUntouched() {
        VariableEntity entity = finish();

        assertEquals("", entity.documentation);
        assertNull(entity.metadata.summary);
    }

    @Test
    void leadingMetadataIsExtracted() {
        VariableEntity entity = finish(" Author: Ada", " deprecated: true", " display: public, PRIVATE",
                " graph: false", "", " The body.");

        assertEquals("Ada", entity.metadata.author);
        assertEquals(Boolean.TRUE, entity.metadata.deprecated);
        assertEquals(List.of("public", "private"), entity.metadata.display);
        assertEquals(Boolean.FALSE, entity.metadata.graph);
        assertEquals("The body.", entity.documentation);
    }

    @Test
    void metadataValuesContinueOnDeeperIndentedLines() {
        VariableEntity entity = finish(" license: MIT", "     or Apache-2.0", " Text");

        assertEquals("MIT\nor Apache-2.0", entity.metadata.license);
        assertEquals("Text", entity.documentation);
    }

    @Test
    void unknownKeyEndsTheMetadataRun() {
        VariableEntity entity = finish(" Note: not metadata", " author: nobody");

        assertNull(entity.metadata.author);
        assertEquals("Note: not metadata\nauthor: nobody", entity.documentation);
    }

    @Test
    void invalidBooleanIsReportedAndIgnored() {
        VariableEntity entity = finish(" deprecated: maybe");

        assertNull(entity.metadata.deprecated);
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.METADATA).size());
        assertEquals("doc.f90", diagnostics.all().get(0).file);
    }

    @Test
    void summaryIsFirstParagraphUnlessGiven() {
        VariableEntity derived = finish(" First paragraph", " continues here.", "", " Second paragraph.");
        VariableEntity given = finish(" summary: Explicit.", " Body text.");

        assertEquals("First paragraph\ncontinues here.", derived.metadata.summary);
        assertEquals("Explicit.", given.metadata.summary);
        assertEquals("Body text.", given.documentation);
    }

    @Test
    void firstParagraphSkipsHeadingsAndCode() {
        assertEquals("Para text", DocumentationFinisher.firstParagraph("# Title\n\n    code\n\nPara text\n\nmore"));
        assertNull(DocumentationFinisher.firstParagraph("# Only a heading"));
    }
}
