package com.conveyal.volumes.processing;

import com.conveyal.volumes.TestUtils;
import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.MovementCode;
import com.conveyal.volumes.models.ProcessingStatus;
import com.google.common.io.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyArray;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

public class TrafficVolumeProcessorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final TrafficVolumeProcessor processor = new TrafficVolumeProcessor();

    private File output;

    @Before
    public void setUp () throws Exception {
        output = folder.newFolder("output");
    }

    private static File sample (String name) {
        return new File(TestUtils.getResourceFileName("sample/" + name));
    }

    private ProcessingRun sampleRun (String runName) {
        return new ProcessingRun(sample("am.csv"), sample("pm.csv"), sample("attout.txt"), output, runName);
    }

    @Test
    public void singleIntersectionEndToEnd () throws Exception {
        File am = TestUtils.writeFile(folder.getRoot(), "am.csv", TestUtils.volumeCsv("101", MovementCode.EBL, "10"));
        File pm = TestUtils.writeFile(folder.getRoot(), "pm.csv", TestUtils.volumeCsv("101", MovementCode.EBL, "4"));
        File attout = TestUtils.writeFile(folder.getRoot(), "attout.txt",
                "HANDLE\tBLOCKNAME\tNODE_ID\tEBL\nH1\tMain St\t101\t");

        ProcessingResult result = processor.process(new ProcessingRun(am, pm, attout, output, "Scenario A"));

        assertThat(TestUtils.readFile(result.attinTxt), equalTo("HANDLE\tBLOCKNAME\tNODE_ID\tEBL\nH1\tMain St\t101\t(4)10"));
        assertThat(result.attinTxt.getName(), equalTo("Scenario_A_ATTIN.txt"));
        assertThat(result.mergedCsv.getName(), equalTo("Scenario_A_Merged.csv"));
        assertThat(result.mergedCsv.isAbsolute(), is(true));
        // Only one movement column in the geometry header.
        assertThat(result.warnings.notes, hasSize(1));
        assertThat(result.warnings.handlesNotGenerated.isEmpty(), is(true));
    }

    @Test
    public void sampleRunMatchesExpectedOutputs () throws Exception {
        ProcessingResult result = processor.process(sampleRun("Sample Run"));

        assertThat(TestUtils.readFile(result.mergedCsv), equalTo(TestUtils.readFile(sample("expected_Merged.csv"))));
        assertThat(TestUtils.readFile(result.attinTxt), equalTo(TestUtils.readFile(sample("expected_ATTIN.txt"))));
        assertThat(result.mergedRows, equalTo(4));
        assertThat(result.attinRows, equalTo(3));

        RunWarnings warnings = result.warnings;
        assertThat(warnings.unmatchedNodeIds, contains("102"));
        assertThat(warnings.duplicateHandles, contains("1A2"));
        assertThat(warnings.droppedGeometryLines, hasSize(1));
        assertThat(warnings.handlesNotGenerated, contains("1A4"));
    }

    @Test
    public void attinHeaderIsTheOriginalLine () throws Exception {
        ProcessingResult result = processor.process(sampleRun("header"));
        String originalHeader = Files.asCharSource(sample("attout.txt"), StandardCharsets.UTF_8)
                .readFirstLine();
        String writtenHeader = Files.asCharSource(result.attinTxt, StandardCharsets.UTF_8)
                .readFirstLine();
        assertThat(writtenHeader, equalTo(originalHeader));
    }

    @Test
    public void rerunningProducesIdenticalFiles () throws Exception {
        ProcessingResult first = processor.process(sampleRun("repeat"));
        byte[] merged = Files.toByteArray(first.mergedCsv);
        byte[] attin = Files.toByteArray(first.attinTxt);
        assertThat(first.mergedCsv.delete() && first.attinTxt.delete(), is(true));

        ProcessingResult second = processor.process(sampleRun("repeat"));

        assertThat(Files.toByteArray(second.mergedCsv), equalTo(merged));
        assertThat(Files.toByteArray(second.attinTxt), equalTo(attin));
    }

    @Test
    public void missingInputIsReported () {
        ProcessingRun run = new ProcessingRun(sample("am.csv"), new File(folder.getRoot(), "absent.csv"),
                sample("attout.txt"), output, "missing");
        try {
            processor.process(run);
            fail("Expected an input error");
        } catch (VolumeProcessingException e) {
            assertThat(e.type, equalTo(VolumeProcessingException.TYPE.INPUT_NOT_FOUND));
            assertThat(e.getMessage(), containsString("PM file not found"));
        }
        assertThat(output.list(), emptyArray());
    }

    @Test
    public void formatErrorLeavesNoOutputs () throws Exception {
        File attout = TestUtils.writeFile(folder.getRoot(), "attout.txt", "HANDLE BLOCKNAME NODE_ID\n");
        ProcessingRun run = new ProcessingRun(sample("am.csv"), sample("pm.csv"), attout, output, "bad");
        ProcessingStatus status = new ProcessingStatus("bad");
        try {
            processor.process(run, status);
            fail("Expected a format error");
        } catch (VolumeProcessingException e) {
            assertThat(e.type, equalTo(VolumeProcessingException.TYPE.FORMAT));
        }
        assertThat(output.list(), emptyArray());
        assertThat(status.status, equalTo(ProcessingStatus.Status.ERROR));
        assertThat(status.message, containsString("tab-delimited"));
        assertThat(status.mergedCsv, nullValue());
    }

    @Test
    public void statusRecordsCompletedRun () {
        ProcessingStatus status = new ProcessingStatus("status");
        ProcessingResult result = processor.process(sampleRun("status"), status);
        assertThat(status.status, equalTo(ProcessingStatus.Status.COMPLETE));
        assertThat(status.mergedCsv, equalTo(result.mergedCsv));
        assertThat(status.message, containsString("with warnings"));
    }
}
