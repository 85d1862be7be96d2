package usx2usfx;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import javax.xml.stream.XMLStreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One USX to USFX conversion: a single open USFX sink that every converted file is
 * appended to, and the set of books already converted.
 * <p>
 * A file that fails part way is reported and the run moves on. Whatever the file already
 * wrote stays in the output, but elements it left open are closed so that the next book
 * starts at document level.
 */
public final class ConversionRun implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(ConversionRun.class);

    private final UsfxSink sink;
    private final BookRegistry books = new BookRegistry();
    private final ConversionReport report;
    private boolean closed;

    public ConversionRun(UsfxSink sink, ConversionReport report)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.report = Objects.requireNonNull(report, "report");
    }

    public static ConversionRun open(Path usfxFile, ConversionReport report) throws IOException, XMLStreamException
    {
        return new ConversionRun(StaxUsfxWriter.open(usfxFile), report);
    }

    /**
     * Read a USX file, convert it to USFX and append it to the run's output.
     *
     * @return false if the file could not be read or parsed; a skipped duplicate book counts as success
     */
    public boolean transcode(Path usxFile)
    {
        String name = usxFile.getFileName() == null ? usxFile.toString() : usxFile.getFileName().toString();

        try (UsxEventReader usx = UsxEventReader.open(usxFile))
        {
            return transcode(usx, name);
        }
        catch (IOException | XMLStreamException ex)
        {
            return failed(name, ex);
        }
    }

    /**
     * Convert one USX document that the caller has already opened.
     */
    public boolean transcode(UsxEventReader usx, String name)
    {
        ensureOpen();
        LOG.debug("Reading {}", name);

        int baseDepth = this.sink.depth();
        BookTranscoder transcoder = new BookTranscoder(usx, this.sink, this.books, this.report, name);
        try
        {
            BookTranscoder.Outcome outcome = transcoder.transcode();
            if (outcome == BookTranscoder.Outcome.DUPLICATE)
            {
                this.report.duplicateSkipped(transcoder.getBook());
            }
            else
            {
                this.report.bookConverted(transcoder.getBook());
            }

            int left = this.sink.depth() - baseDepth;
            if (left > 0)
            {
                this.report.warning(name, transcoder.getBook(), left + " element(s) left open at end of file");
                unwind(baseDepth);
            }
            return true;
        }
        catch (XMLStreamException | RuntimeException ex)
        {
            unwindQuietly(baseDepth, name);
            return failed(name, ex);
        }
    }

    private boolean failed(String name, Exception ex)
    {
        this.report.error(name, "", "Error reading file: " + ex.getMessage());
        this.report.fileFailed(name);
        LOG.debug("Failure detail for {}", name, ex);
        return false;
    }

    private void unwind(int baseDepth) throws XMLStreamException
    {
        while (this.sink.depth() > baseDepth)
        {
            this.sink.endElement();
        }
    }

    private void unwindQuietly(int baseDepth, String name)
    {
        try
        {
            unwind(baseDepth);
        }
        catch (XMLStreamException ex)
        {
            this.report.error(name, "", "Could not close elements left open: " + ex.getMessage());
        }
    }

    public BookRegistry getBooks()
    {
        return this.books;
    }

    public ConversionReport getReport()
    {
        return this.report;
    }

    private void ensureOpen()
    {
        if (this.closed)
        {
            throw new IllegalStateException("Conversion run is closed");
        }
    }

    @Override
    public void close() throws XMLStreamException
    {
        if (this.closed)
        {
            return;
        }
        this.closed = true;
        this.sink.close();
    }
}
