package usx2usfx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversionRunTest
{
    @TempDir
    Path tmp;

    private static UsxEventReader reader(String xml) throws Exception
    {
        return new UsxEventReader(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void sameBookIsConvertedOnce() throws Exception
    {
        RecordingSink sink = new RecordingSink();
        ConversionReport report = new ConversionReport();
        String gen = "<usx><book code=\"GEN\" style=\"id\">Genesis</book><chapter number=\"1\" style=\"c\"/>"
            + "<para style=\"p\"><verse number=\"1\" style=\"v\"/>x</para></usx>";

        try (ConversionRun run = new ConversionRun(sink, report))
        {
            assertThat(run.transcode(reader(gen), "GEN.usx")).isTrue();
            int afterFirst = sink.ops.size();
            assertThat(run.transcode(reader(gen), "bundle/GEN.usx")).isTrue();

            assertThat(sink.ops).hasSize(afterFirst);
            assertThat(run.getBooks().codes()).containsExactly("GEN");
        }

        assertThat(sink.closed).isTrue();
        assertThat(sink.count("start book")).isEqualTo(1);
        assertThat(report.getBooksConverted()).containsExactly("GEN");
        assertThat(report.getDuplicatesSkipped()).containsExactly("GEN");
        assertThat(report.getErrorCount()).isZero();
    }

    @Test
    void failedFileIsUnwoundAndTheRunContinues() throws Exception
    {
        RecordingSink sink = new RecordingSink();
        ConversionReport report = new ConversionReport();

        try (ConversionRun run = new ConversionRun(sink, report))
        {
            boolean bad = run.transcode(reader("<usx><book code=\"LEV\" style=\"id\">Leviticus</book>"
                + "<para style=\"p\">unclosed<char style=\"w\">x</char></usx>"), "LEV.usx");

            assertThat(bad).isFalse();
            assertThat(sink.depth()).isZero();

            boolean good = run.transcode(reader("<usx><book code=\"NUM\" style=\"id\"/></usx>"), "NUM.usx");
            assertThat(good).isTrue();
        }

        assertThat(sink.ops).containsExactly(
            "start book", "attr id=LEV", "start id", "attr id=LEV", "text Leviticus", "end",
            "start p", "text unclosed", "start w", "text x", "end",
            "end", "end",
            "start book", "attr id=NUM", "start id", "attr id=NUM", "end", "end");
        assertThat(report.getFilesFailed()).containsExactly("LEV.usx");
        assertThat(report.getBooksConverted()).containsExactly("NUM");
        assertThat(report.getErrors()).hasSize(1);
        assertThat(report.getErrors().get(0).file).isEqualTo("LEV.usx");
        assertThat(report.getErrors().get(0).message).startsWith("Error reading file: ").doesNotContain("LEV.usx");
    }

    @Test
    void elementsLeftOpenAtEndOfFileAreClosed() throws Exception
    {
        RecordingSink sink = new RecordingSink();
        ConversionReport report = new ConversionReport();

        try (ConversionRun run = new ConversionRun(sink, report))
        {
            // A milestone char outside any note is never closed by the source.
            assertThat(run.transcode(reader("<usx><book code=\"RUT\" style=\"id\"/>"
                + "<para style=\"p\"><char style=\"nd\" closed=\"false\"/>LORD</para></usx>"), "RUT.usx")).isTrue();
            assertThat(sink.depth()).isZero();
        }

        assertThat(report.getErrorCount()).isEqualTo(1);
        assertThat(report.getWarningCount()).isEqualTo(1);
    }

    @Test
    void missingFileIsAFileLevelFailure() throws Exception
    {
        ConversionReport report = new ConversionReport();

        try (ConversionRun run = new ConversionRun(new RecordingSink(), report))
        {
            assertThat(run.transcode(this.tmp.resolve("missing.usx"))).isFalse();
        }

        assertThat(report.getFilesFailed()).containsExactly("missing.usx");
    }

    @Test
    void convertsFileIntoUsfxDocument() throws Exception
    {
        Path usx = this.tmp.resolve("RUT.usx");
        Files.writeString(usx, "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
            + "<usx version=\"2.0\">\n"
            + "  <book code=\"RUT\" style=\"id\">Ruth</book>\n"
            + "  <chapter number=\"1\" style=\"c\" />\n"
            + "  <para style=\"p\"><verse number=\"1\" style=\"v\" />In the days</para>\n"
            + "</usx>\n", StandardCharsets.UTF_8);
        Path usfx = this.tmp.resolve("out/usfx.xml");

        ConversionReport report = new ConversionReport();
        try (ConversionRun run = ConversionRun.open(usfx, report))
        {
            assertThat(run.transcode(usx)).isTrue();
        }

        assertThat(Files.readString(usfx, StandardCharsets.UTF_8)).endsWith(
            "<book id=\"RUT\"><id id=\"RUT\">Ruth</id><c id=\"1\"></c>"
                + "<p><v id=\"1\"></v>In the days</p></book></usfx>");
    }

    @Test
    void closedRunRejectsFurtherFiles() throws Exception
    {
        ConversionRun run = new ConversionRun(new RecordingSink(), new ConversionReport());
        run.close();

        assertThatThrownBy(() -> run.transcode(reader("<usx/>"), "x.usx")).isInstanceOf(IllegalStateException.class);
    }
}
