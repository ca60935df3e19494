package com.conveyal.volumes.processing;

import com.conveyal.volumes.TestUtils;
import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.MovementCode;
import com.conveyal.volumes.models.Period;
import com.conveyal.volumes.models.VolumeRecord;
import com.conveyal.volumes.models.VolumeTable;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.OptionalDouble;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class VolumeTableLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final VolumeTableLoader loader = new VolumeTableLoader();

    @Test
    public void loadsOnlyVolumeRows () throws Exception {
        RunWarnings warnings = new RunWarnings();
        VolumeTable am = loader.load(new File(TestUtils.getResourceFileName("sample/am.csv")), Period.AM, warnings);

        assertThat(am.period, equalTo(Period.AM));
        assertThat(am.intersectionIds(), contains("101", "0102", "103"));
        // Lanes row for 101 is ignored, so the counts are the Volume row's.
        assertThat(am.get("101").getVolume(MovementCode.EBL), equalTo(OptionalDouble.of(12)));
        assertThat(am.get("101").getVolume(MovementCode.NBU), equalTo(OptionalDouble.empty()));
        assertThat(am.get("0102").getVolume(MovementCode.EBR), equalTo(OptionalDouble.of(14.7)));
        for (MovementCode movement : MovementCode.CANONICAL_ORDER) {
            assertThat(am.get("103").getVolume(movement).isPresent(), is(false));
        }
        assertThat(warnings.isEmpty(), is(true));
    }

    @Test
    public void nonNumericCountIsNoValue () throws Exception {
        VolumeTable pm = loader.load(new File(TestUtils.getResourceFileName("sample/pm.csv")), Period.PM,
                new RunWarnings());
        VolumeRecord record = pm.get("101");
        assertThat(record.getVolume(MovementCode.NBR).isPresent(), is(false));
        assertThat(record.getVolume(MovementCode.NBT), equalTo(OptionalDouble.of(170)));
    }

    @Test
    public void laterDuplicateRowReplacesEarlier () throws Exception {
        String csv = TestUtils.volumeCsv("7", MovementCode.WBT, "10") + "Volume,7,,,,,,,99,,,,,,,,,\n";
        File file = TestUtils.writeFile(folder.getRoot(), "am.csv", csv);
        RunWarnings warnings = new RunWarnings();

        VolumeTable am = loader.load(file, Period.AM, warnings);

        assertThat(am.size(), equalTo(1));
        assertThat(am.get("7").getVolume(MovementCode.WBT), equalTo(OptionalDouble.of(99)));
        assertThat(warnings.replacedVolumeRows, contains("AM:7"));
    }

    @Test
    public void rowWithoutIntersectionIsSkipped () throws Exception {
        String csv = TestUtils.volumeCsv("7", MovementCode.WBT, "10") + "Volume,,1,2,3,,,,,,,,,,,,,\n";
        File file = TestUtils.writeFile(folder.getRoot(), "am.csv", csv);
        RunWarnings warnings = new RunWarnings();

        VolumeTable am = loader.load(file, Period.AM, warnings);

        assertThat(am.intersectionIds(), contains("7"));
        assertThat(warnings.notes, hasSize(1));
    }

    @Test
    public void missingColumnsAreReported () throws Exception {
        String csv = "metadata\nRECORDNAME,INTID,EBU,EBL\nVolume,1,2,3\n";
        File file = TestUtils.writeFile(folder.getRoot(), "pm.csv", csv);
        try {
            loader.load(file, Period.PM, new RunWarnings());
            fail("Expected a format error");
        } catch (VolumeProcessingException e) {
            assertThat(e.type, equalTo(VolumeProcessingException.TYPE.FORMAT));
            assertThat(e.getMessage(), containsString("PM CSV is missing required columns: EBT, EBR, WBU"));
            assertThat(e.file, equalTo(file));
        }
    }

    @Test
    public void emptyFileIsAFormatError () throws Exception {
        File file = TestUtils.writeFile(folder.getRoot(), "am.csv", "");
        try {
            loader.load(file, Period.AM, new RunWarnings());
            fail("Expected a format error");
        } catch (VolumeProcessingException e) {
            assertThat(e.type, equalTo(VolumeProcessingException.TYPE.FORMAT));
            assertThat(e.getMessage(), equalTo("AM CSV is empty."));
        }
    }

    @Test
    public void intersectionIdsAreNotTrimmed () throws Exception {
        File file = TestUtils.writeFile(folder.getRoot(), "am.csv", TestUtils.volumeCsv(" 101 ", MovementCode.EBL, " 12 "));

        VolumeTable am = loader.load(file, Period.AM, new RunWarnings());

        assertThat(am.intersectionIds(), contains(" 101 "));
        assertThat(am.get(" 101 ").getVolume(MovementCode.EBL), equalTo(OptionalDouble.of(12)));
    }

    @Test
    public void malformedUtf8IsAFormatError () throws Exception {
        byte[] head = ("metadata\n" + TestUtils.VOLUME_HEADER + "\nVolume,10").getBytes(StandardCharsets.UTF_8);
        byte[] badBytes = { (byte) 0xC3, (byte) 0x28 };
        byte[] tail = ",1,,,,,,,,,,,,,,,\n".getBytes(StandardCharsets.UTF_8);
        File file = TestUtils.writeBytes(folder.getRoot(), "pm.csv", head, badBytes, tail);
        try {
            loader.load(file, Period.PM, new RunWarnings());
            fail("Expected a format error");
        } catch (VolumeProcessingException e) {
            assertThat(e.type, equalTo(VolumeProcessingException.TYPE.FORMAT));
            assertThat(e.getMessage(), equalTo("PM CSV is not valid UTF-8 text."));
            assertThat(e.file, equalTo(file));
        }
    }

    @Test
    public void parsesVolumes () {
        assertThat(VolumeTableLoader.parseVolume(" 12 "), equalTo(OptionalDouble.of(12)));
        assertThat(VolumeTableLoader.parseVolume("3.5"), equalTo(OptionalDouble.of(3.5)));
        assertThat(VolumeTableLoader.parseVolume(""), equalTo(OptionalDouble.empty()));
        assertThat(VolumeTableLoader.parseVolume("n/a"), equalTo(OptionalDouble.empty()));
        assertThat(VolumeTableLoader.parseVolume("NaN"), equalTo(OptionalDouble.empty()));
        assertThat(VolumeTableLoader.parseVolume(null), equalTo(OptionalDouble.empty()));
    }
}
