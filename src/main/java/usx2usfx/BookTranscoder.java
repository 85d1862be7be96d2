package usx2usfx;

import javax.xml.stream.XMLStreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transduces one USX file into USFX operations on a {@link UsfxSink}.
 * <p>
 * USX nests verse text inside paragraphs and character styles; USFX is written with the
 * same element nesting but with chapter and verse markers standing alone as milestones.
 * An instance holds the state of a single file (current book, chapter and verse, character
 * style depth, pending reference target) and is discarded once the file is done.
 */
public final class BookTranscoder
{
    private static final Logger LOG = LoggerFactory.getLogger(BookTranscoder.class);

    public enum Outcome
    {
        CONVERTED,
        /** The book was already converted from another file in this run; the rest of the file was skipped. */
        DUPLICATE
    }

    private final UsxEventReader usx;
    private final UsfxSink sink;
    private final BookRegistry books;
    private final ConversionReport report;
    private final String fileName;

    private final NestingTracker nesting = new NestingTracker();
    private String thisBook = "0";
    private String thisChapter = "0";
    private String thisVerse = "0";
    private boolean bookOpen;
    /** A char milestone inside a note was left open and must be closed with the note. */
    private boolean badNoteCharSyntaxUsed;
    private String refTarget = "";

    public BookTranscoder(UsxEventReader usx, UsfxSink sink, BookRegistry books, ConversionReport report,
        String fileName)
    {
        this.usx = usx;
        this.sink = sink;
        this.books = books;
        this.report = report;
        this.fileName = fileName;
    }

    public Outcome transcode() throws XMLStreamException
    {
        while (this.usx.hasNext())
        {
            UsxEvent ev = this.usx.next();
            switch (ev.getKind())
            {
                case START_ELEMENT:
                    if (!startElement(ev))
                    {
                        return Outcome.DUPLICATE;
                    }
                    break;
                case END_ELEMENT:
                    endElement(ev);
                    break;
                case TEXT:
                    this.sink.text(ev.getText());
                    break;
                default:
                    throw new IllegalStateException("Unhandled event kind " + ev.getKind());
            }
        }
        return Outcome.CONVERTED;
    }

    /** Book code of the file, "0" until its book element has been read. */
    public String getBook()
    {
        return this.thisBook;
    }

    public String getChapter()
    {
        return this.thisChapter;
    }

    public String getVerse()
    {
        return this.thisVerse;
    }

    NestingTracker getNesting()
    {
        return this.nesting;
    }

    // ---------------------------------------------------------------------
    // Element starts
    // ---------------------------------------------------------------------

    /**
     * @return false if the file holds a book that was already converted
     */
    private boolean startElement(UsxEvent ev) throws XMLStreamException
    {
        UsxElement element = UsxElement.forName(ev.getName());
        switch (element)
        {
            case USX:
                // </usx> closes the USFX book container.
                break;
            case BOOK:
                return startBook(ev);
            case CHAPTER:
                startChapter(ev);
                break;
            case VERSE:
                startVerse(ev);
                break;
            case NOTE:
                startNote(ev);
                break;
            case CHAR:
                startChar(ev);
                break;
            case TABLE:
                this.sink.startElement("table");
                closeEmptyElement(ev);
                break;
            case ROW:
            case CELL:
                this.sink.startElement(ev.attribute("style"));
                closeEmptyElement(ev);
                break;
            case PARA:
                startPara(ev);
                break;
            case FIGURE:
                startFigure(ev);
                break;
            case OPTBREAK:
                this.sink.startElement("optionalLineBreak");
                closeEmptyElement(ev);
                break;
            case REF:
                startRef(ev);
                break;
            case UNKNOWN:
                this.report.error(this.fileName, location(ev), "Unrecognized USX element name: " + ev.getName());
                break;
            default:
                throw new IllegalStateException("Unhandled USX element " + element);
        }
        return true;
    }

    private boolean startBook(UsxEvent ev) throws XMLStreamException
    {
        // In USFX <book> contains the whole book; in USX it only holds the \id line.
        String code = ev.attribute("code");
        if (this.books.seen(code))
        {
            this.report.info(this.fileName, code, "Duplicate book skipped");
            return false;
        }
        this.books.mark(code);

        LOG.debug("Converting book {} from {}", code, this.fileName);

        this.sink.startElement("book");
        this.sink.attribute("id", code);
        this.bookOpen = true;
        this.sink.startElement("id");
        this.sink.attribute("id", code);
        this.thisBook = code;
        this.thisChapter = "0";
        this.thisVerse = "0";
        closeEmptyElement(ev);
        return true;
    }

    private void startChapter(UsxEvent ev) throws XMLStreamException
    {
        if (ev.hasAttribute("eid"))
        {
            this.usx.skipElement(ev);
            return;
        }
        String number = ev.attribute("number");
        this.sink.startElement(ev.attribute("style"));
        this.sink.attribute("id", number);
        this.thisChapter = number;
        this.thisVerse = "0";
        closeEmptyElement(ev);
    }

    private void startVerse(UsxEvent ev) throws XMLStreamException
    {
        if (ev.hasAttribute("eid"))
        {
            this.usx.skipElement(ev);
            return;
        }
        // Paratext accepts a comma or a hyphen between the ends of a verse range.
        String number = ev.attribute("number").replace(',', '-');
        this.sink.startElement(ev.attribute("style"));
        this.sink.attribute("id", number);
        this.thisVerse = number;
        closeEmptyElement(ev);
    }

    private void startNote(UsxEvent ev) throws XMLStreamException
    {
        String style = ev.attribute("style");
        this.sink.startElement(style);
        this.sink.attribute("caller", ev.attribute("caller"));
        this.sink.attribute("sfm", style);
        this.badNoteCharSyntaxUsed = false;
        this.nesting.enterNote();
        if (ev.isEmpty())
        {
            endNote();
        }
    }

    private void startChar(UsxEvent ev) throws XMLStreamException
    {
        this.sink.startElement(ev.attribute("style"));
        if (!ev.isEmpty())
        {
            this.nesting.openCharStyle();
        }

        if ("false".equals(ev.attribute("closed")) && ev.isSelfClosing())
        {
            // Milestone-style char: stays open until the enclosing note ends.
            this.badNoteCharSyntaxUsed = true;
            this.report.error(this.fileName, location(ev), "Empty unclosed char element at " + position());
        }
        else
        {
            closeEmptyElement(ev);
        }
    }

    private void startPara(UsxEvent ev) throws XMLStreamException
    {
        ParaStyle style = ParaStyle.parse(ev.attribute("style"));
        switch (style.getKind())
        {
            case HEADING:
                this.sink.startElement("h");
                break;
            case TOC:
                this.sink.startElement("toc");
                this.sink.attribute("level", style.hasLevel() ? style.getLevel() : "1");
                break;
            case BODY:
                this.sink.startElement(style.getBase());
                if (style.hasLevel())
                {
                    this.sink.attribute("level", style.getLevel());
                }
                break;
            case RESTORE:
                LOG.debug("Dropping restore paragraph in {} at {}", this.fileName, position());
                this.usx.skipElement(ev);
                return;
            case OTHER:
                this.sink.startElement("p");
                this.sink.attribute("sfm", style.getBase());
                if (style.hasLevel())
                {
                    this.sink.attribute("level", style.getLevel());
                }
                break;
            default:
                throw new IllegalStateException("Unhandled paragraph kind " + style.getKind());
        }
        closeEmptyElement(ev);
    }

    private void startFigure(UsxEvent ev) throws XMLStreamException
    {
        this.sink.startElement(ev.attribute("style"));
        this.sink.elementWithText("description", ev.attribute("desc"));
        this.sink.elementWithText("catalog", ev.attribute("file"));
        this.sink.elementWithText("size", ev.attribute("size"));
        this.sink.elementWithText("location", ev.attribute("loc"));
        this.sink.elementWithText("copyright", ev.attribute("copy"));
        this.sink.elementWithText("reference", ev.attribute("ref"));

        if (ev.isEmpty())
        {
            this.sink.endElement();
            return;
        }

        UsxEvent caption = this.usx.peek();
        if (caption == null)
        {
            throw new XMLStreamException("Document ended inside <figure>");
        }
        if (caption.isText())
        {
            this.usx.next();
            this.sink.elementWithText("caption", caption.getText());
        }
        else if (caption.isEndElement())
        {
            this.usx.next();
            this.sink.endElement();
            if (!UsxElement.FIGURE.getTagName().equals(caption.getName()))
            {
                this.report.error(this.fileName, location(caption), "Unexpected tag after figure: " + caption.getName());
            }
        }
        else
        {
            this.report.error(this.fileName, location(caption),
                "Unexpected node reading caption of figure: <" + caption.getName() + ">");
        }
    }

    private void startRef(UsxEvent ev) throws XMLStreamException
    {
        this.refTarget = ReferenceResolver.toTarget(ev.attribute("loc"));
        if (!ReferenceResolver.isEmittable(this.refTarget))
        {
            LOG.debug("Suppressing reference '{}' in {} at {}", ev.attribute("loc"), this.fileName, position());
            return;
        }
        this.sink.startElement("ref");
        this.sink.attribute("tgt", this.refTarget);
        if (ev.isEmpty())
        {
            this.sink.endElement();
        }
    }

    private void closeEmptyElement(UsxEvent ev) throws XMLStreamException
    {
        if (ev.isEmpty())
        {
            this.sink.endElement();
        }
    }

    // ---------------------------------------------------------------------
    // Element ends
    // ---------------------------------------------------------------------

    private void endElement(UsxEvent ev) throws XMLStreamException
    {
        UsxElement element = UsxElement.forName(ev.getName());
        switch (element)
        {
            case REF:
                if (ReferenceResolver.isEmittable(this.refTarget))
                {
                    this.sink.endElement();
                }
                break;
            case CHAR:
                if (!this.nesting.closeCharStyle())
                {
                    this.report.error(this.fileName, location(ev), String.format(
                        "Unexpected char nesting value: %d normal %d in notes",
                        this.nesting.getBodyDepth(), this.nesting.getNoteDepth()));
                }
                this.sink.endElement();
                break;
            case NOTE:
                endNote();
                break;
            case USX:
                if (this.bookOpen)
                {
                    this.sink.endElement();
                    this.bookOpen = false;
                }
                break;
            case UNKNOWN:
                // nothing was written for the start
                break;
            default:
                this.sink.endElement();
                break;
        }
    }

    private void endNote() throws XMLStreamException
    {
        if (this.badNoteCharSyntaxUsed)
        {
            // Close the character style that was started with a milestone.
            this.sink.endElement();
            this.badNoteCharSyntaxUsed = false;
        }
        this.nesting.leaveNote();
        this.sink.endElement();
    }

    // ---------------------------------------------------------------------

    private String position()
    {
        return this.thisBook + " " + this.thisChapter + ":" + this.thisVerse;
    }

    private String location(UsxEvent ev)
    {
        if (ev.getLine() < 0)
        {
            return position();
        }
        return position() + ", line " + ev.getLine();
    }
}
