package usx2usfx;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.XMLConstants;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Writes the USFX document as UTF-8 through a StAX stream writer.
 * The {@code usfx} root is opened on construction and closed by {@link #close()}.
 */
public final class StaxUsfxWriter implements UsfxSink
{
    public static final String ROOT_ELEMENT = "usfx";
    public static final String SCHEMA_LOCATION = "usfx.xsd";

    private final XMLStreamWriter xw;
    private final OutputStream owned;
    private int depth;
    private boolean closed;

    public StaxUsfxWriter(OutputStream out) throws XMLStreamException
    {
        this(out, null);
    }

    private StaxUsfxWriter(OutputStream out, OutputStream owned) throws XMLStreamException
    {
        this.xw = XMLOutputFactory.newFactory().createXMLStreamWriter(out, "UTF-8");
        this.owned = owned;

        this.xw.writeStartDocument("UTF-8", "1.0");
        this.xw.writeStartElement(ROOT_ELEMENT);
        this.xw.writeNamespace("xsi", XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI);
        this.xw.writeAttribute("xsi", XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI, "noNamespaceSchemaLocation",
            SCHEMA_LOCATION);
    }

    public static StaxUsfxWriter open(Path file) throws IOException, XMLStreamException
    {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
        {
            Files.createDirectories(parent);
        }

        OutputStream out = Files.newOutputStream(file);
        try
        {
            return new StaxUsfxWriter(out, out);
        }
        catch (XMLStreamException | RuntimeException ex)
        {
            out.close();
            throw ex;
        }
    }

    @Override
    public void startElement(String name) throws XMLStreamException
    {
        ensureOpen();
        if (name == null || name.isEmpty())
        {
            throw new XMLStreamException("Empty element name");
        }
        this.xw.writeStartElement(name);
        this.depth++;
    }

    @Override
    public void attribute(String name, String value) throws XMLStreamException
    {
        ensureOpen();
        this.xw.writeAttribute(name, value == null ? "" : value);
    }

    @Override
    public void text(String value) throws XMLStreamException
    {
        ensureOpen();
        this.xw.writeCharacters(value);
    }

    @Override
    public void elementWithText(String name, String value) throws XMLStreamException
    {
        startElement(name);
        text(value == null ? "" : value);
        endElement();
    }

    @Override
    public void endElement() throws XMLStreamException
    {
        ensureOpen();
        if (this.depth == 0)
        {
            throw new XMLStreamException("No open element to close");
        }
        this.xw.writeEndElement();
        this.depth--;
    }

    @Override
    public int depth()
    {
        return this.depth;
    }

    @Override
    public void close() throws XMLStreamException
    {
        if (this.closed)
        {
            return;
        }
        this.closed = true;

        try
        {
            while (this.depth > 0)
            {
                this.xw.writeEndElement();
                this.depth--;
            }
            this.xw.writeEndElement(); // usfx
            this.xw.writeEndDocument();
            this.xw.flush();
            this.xw.close();
        }
        finally
        {
            if (this.owned != null)
            {
                try
                {
                    this.owned.close();
                }
                catch (IOException ex)
                {
                    throw new XMLStreamException("Failed to close USFX output", ex);
                }
            }
        }
    }

    private void ensureOpen() throws XMLStreamException
    {
        if (this.closed)
        {
            throw new XMLStreamException("USFX writer is closed");
        }
    }
}
