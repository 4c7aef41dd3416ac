package org.dxworks.fortframe.parser;

import org.approvaltests.Approvals;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.TestUtils;
import org.dxworks.fortframe.model.SourceFileEntity;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;

public class FortranAnalyzeApprovalTest {
    private static final String SAMPLES_BASE_PATH = TestUtils.SAMPLES_BASE_PATH;

    @Test
    void analyze_Fortran_Legacy() throws Exception {
        verify("legacy.f", SourceForm.FIXED);
    }

    @Test
    void analyze_Fortran_Utils() throws Exception {
        verify("lib/utils.f90", SourceForm.FREE);
    }

    @Test
    void analyze_Fortran_Shapes() throws Exception {
        verify("shapes.f90", SourceForm.FREE);
    }

    @Test
    void analyze_Fortran_Main() throws Exception {
        verify("main.f90", SourceForm.FREE);
    }

    private static void verify(String filePath, SourceForm form) throws Exception {
        String source = Files.readString(Paths.get(SAMPLES_BASE_PATH + filePath));
        SourceFileEntity sourceFile = new FortranParser(FortframeConfig.defaults())
                .parse(filePath, source, form)
                .getSourceFile();
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(sourceFile));
    }
}
