package usx2usfx;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import javax.xml.XMLConstants;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import com.ctc.wstx.stax.WstxInputFactory;

/**
 * Pull reader over one USX document.
 * <p>
 * Wraps a Woodstox stream reader and reduces its events to element starts, element ends and
 * text. An element whose start is directly followed by its end comes back as a single
 * empty start; whether the source wrote it as {@code <name/>} is kept separately. Whitespace-only text is only delivered where
 * {@code xml:space="preserve"} applies.
 */
public final class UsxEventReader implements AutoCloseable
{
    private final XMLStreamReader2 xr;
    private final InputStream owned;

    /** xml:space="preserve" in effect, one entry per open element. */
    private final Deque<Boolean> preserveSpace = new ArrayDeque<>();

    /** Raw event read ahead while checking for an empty element. */
    private UsxEvent readAhead;
    private UsxEvent peeked;
    private boolean exhausted;

    public UsxEventReader(InputStream in) throws XMLStreamException
    {
        this(in, null);
    }

    private UsxEventReader(InputStream in, InputStream owned) throws XMLStreamException
    {
        this.xr = (XMLStreamReader2) newInputFactory().createXMLStreamReader(in);
        this.owned = owned;
    }

    public static UsxEventReader open(Path file) throws IOException, XMLStreamException
    {
        InputStream in = Files.newInputStream(file);
        try
        {
            return new UsxEventReader(in, in);
        }
        catch (XMLStreamException | RuntimeException ex)
        {
            in.close();
            throw ex;
        }
    }

    private static XMLInputFactory2 newInputFactory()
    {
        XMLInputFactory2 f = new WstxInputFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        f.setProperty(XMLInputFactory.IS_COALESCING, true);
        return f;
    }

    public boolean hasNext() throws XMLStreamException
    {
        return peek() != null;
    }

    /**
     * Look at the next event without consuming it.
     *
     * @return the next event, or null at the end of the document
     */
    public UsxEvent peek() throws XMLStreamException
    {
        if (this.peeked == null)
        {
            this.peeked = cook();
        }
        return this.peeked;
    }

    public UsxEvent next() throws XMLStreamException
    {
        UsxEvent ev = peek();
        if (ev == null)
        {
            throw new NoSuchElementException("No more events");
        }
        this.peeked = null;
        return ev;
    }

    /**
     * Consume everything up to and including the end that matches {@code start}, which must
     * be the start event most recently returned by {@link #next()}.
     */
    public void skipElement(UsxEvent start) throws XMLStreamException
    {
        if (!start.isStartElement())
        {
            throw new IllegalArgumentException("Not a start element: " + start);
        }
        if (start.isEmpty())
        {
            return;
        }

        int depth = 1;
        while (depth > 0)
        {
            if (!hasNext())
            {
                throw new XMLStreamException("Document ended inside <" + start.getName() + ">");
            }
            UsxEvent ev = next();
            if (ev.isStartElement() && !ev.isEmpty())
            {
                depth++;
            }
            else if (ev.isEndElement())
            {
                depth--;
            }
        }
    }

    // ---------------------------------------------------------------------

    private UsxEvent cook() throws XMLStreamException
    {
        UsxEvent ev;
        if (this.readAhead != null)
        {
            ev = this.readAhead;
            this.readAhead = null;
        }
        else
        {
            ev = readRaw();
        }

        if (ev != null && ev.isStartElement())
        {
            UsxEvent following = readRaw();
            if (following != null && following.isEndElement())
            {
                return ev.asEmpty();
            }
            this.readAhead = following;
        }
        return ev;
    }

    private UsxEvent readRaw() throws XMLStreamException
    {
        while (!this.exhausted && this.xr.hasNext())
        {
            int type = this.xr.next();
            switch (type)
            {
                case XMLStreamConstants.START_ELEMENT:
                    Map<String, String> attrs = readAttributes();
                    this.preserveSpace.push(isPreserving(attrs));
                    return UsxEvent.startElement(this.xr.getLocalName(), attrs, this.xr.isEmptyElement(), line());

                case XMLStreamConstants.END_ELEMENT:
                    this.preserveSpace.poll();
                    return UsxEvent.endElement(this.xr.getLocalName(), line());

                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                case XMLStreamConstants.SPACE:
                    String text = this.xr.getText();
                    if (text.isEmpty() || (isWhitespace(text) && !isPreserving()))
                    {
                        continue;
                    }
                    return UsxEvent.text(text, line());

                case XMLStreamConstants.END_DOCUMENT:
                    this.exhausted = true;
                    return null;

                default:
                    // comments, processing instructions, DTD
                    break;
            }
        }
        this.exhausted = true;
        return null;
    }

    private Map<String, String> readAttributes()
    {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (int i = 0; i < this.xr.getAttributeCount(); i++)
        {
            String prefix = this.xr.getAttributePrefix(i);
            String local = this.xr.getAttributeLocalName(i);
            String name = prefix == null || prefix.isEmpty() ? local : prefix + ":" + local;
            attrs.put(name, this.xr.getAttributeValue(i));
        }
        return attrs;
    }

    private boolean isPreserving(Map<String, String> attrs)
    {
        String space = attrs.get(XMLConstants.XML_NS_PREFIX + ":space");
        if ("preserve".equals(space))
        {
            return true;
        }
        if ("default".equals(space))
        {
            return false;
        }
        return isPreserving();
    }

    private boolean isPreserving()
    {
        Boolean top = this.preserveSpace.peek();
        return top != null && top;
    }

    private static boolean isWhitespace(String text)
    {
        for (int i = 0; i < text.length(); i++)
        {
            if (!Character.isWhitespace(text.charAt(i)))
            {
                return false;
            }
        }
        return true;
    }

    private int line()
    {
        Location loc = this.xr.getLocation();
        return loc == null ? -1 : loc.getLineNumber();
    }

    @Override
    public void close() throws XMLStreamException
    {
        try
        {
            this.xr.close();
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
                    throw new XMLStreamException("Failed to close USX input", ex);
                }
            }
        }
    }
}
