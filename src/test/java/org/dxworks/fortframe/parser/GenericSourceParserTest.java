package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.Diagnostics;
import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.GenericSourceEntity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenericSourceParserTest {

    @Test
    void documentationAndMetadataOfAScript() {
        Diagnostics diagnostics = new Diagnostics();
        GenericSourceEntity script = new GenericSourceParser(FortframeConfig.defaults()).parse("scripts/build.sh",
                "# build script\n#! author: Jane Doe\n#!\n#! Builds the library.\nmake all\n", "#", diagnostics);

        assertEquals(EntityKind.GENERIC_SOURCE, script.kind);
        assertEquals("build.sh", script.name);
        assertEquals("scripts/build.sh", script.path);
        assertEquals("scripts/build.sh", script.sourceFile);
        assertEquals("#", script.commentMarker);
        assertEquals("Jane Doe", script.metadata.author);
        assertEquals("Builds the library.", script.documentation);
        assertEquals("Builds the library.", script.metadata.summary);
        assertEquals(1, script.lineStart);
        assertEquals(5, script.lineEnd);
        assertTrue(script.children.isEmpty());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void fileWithoutDocumentationStaysUndocumented() {
        GenericSourceEntity header = new GenericSourceParser(FortframeConfig.defaults())
                .parse("api.h", "// plain\nint f(void);\n", "//", new Diagnostics());

        assertEquals("", header.documentation);
        assertTrue(header.metadata.isEmpty());
        assertFalse(header.isDocumented());
    }
}
