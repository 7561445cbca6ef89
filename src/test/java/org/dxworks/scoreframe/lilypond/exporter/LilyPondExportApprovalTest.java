package org.dxworks.scoreframe.lilypond.exporter;

import org.approvaltests.Approvals;
import org.dxworks.scoreframe.ScoreConverter;
import org.dxworks.scoreframe.TestUtils;
import org.junit.jupiter.api.Test;

public class LilyPondExportApprovalTest {

    @Test
    void export_Piano() throws Exception {
        verify("piano.ly");
    }

    @Test
    void export_Ornaments() throws Exception {
        verify("ornaments.ly");
    }

    @Test
    void export_Repeats() throws Exception {
        verify("repeats.ly");
    }

    @Test
    void export_Choir() throws Exception {
        verify("choir.ly");
    }

    private static void verify(String fileName) throws Exception {
        String source = TestUtils.readSample(fileName);
        String exported = new ScoreConverter().roundTrip(source).value;
        Approvals.verify(exported + "\n");
    }
}
