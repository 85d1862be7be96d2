package usx2usfx;

import javax.xml.stream.XMLStreamException;

/**
 * Destination of the USFX document.
 * <p>
 * {@link #attribute(String, String)} is only valid directly after
 * {@link #startElement(String)}, before any child, text or end.
 */
public interface UsfxSink extends AutoCloseable
{
    void startElement(String name) throws XMLStreamException;

    void attribute(String name, String value) throws XMLStreamException;

    void text(String value) throws XMLStreamException;

    /** Start, text and end in one call. */
    void elementWithText(String name, String value) throws XMLStreamException;

    void endElement() throws XMLStreamException;

    /** Number of elements opened through this sink and not yet closed. */
    int depth();

    /** Finish the document, closing anything still open. */
    @Override
    void close() throws XMLStreamException;
}
