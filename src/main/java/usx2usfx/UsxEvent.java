package usx2usfx;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parse event delivered by {@link UsxEventReader}.
 */
public final class UsxEvent
{
    public enum Kind
    {
        START_ELEMENT,
        END_ELEMENT,
        TEXT
    }

    private final Kind kind;
    private final String name;
    private final Map<String, String> attributes;
    private final boolean selfClosing;
    private final boolean empty;
    private final String text;
    private final int line;

    private UsxEvent(Kind kind, String name, Map<String, String> attributes, boolean selfClosing, boolean empty,
        String text, int line)
    {
        this.kind = kind;
        this.name = name;
        this.attributes = attributes;
        this.selfClosing = selfClosing;
        this.empty = empty;
        this.text = text;
        this.line = line;
    }

    /**
     * @param selfClosing the tag was written as {@code <name/>} in the source
     */
    public static UsxEvent startElement(String name, Map<String, String> attributes, boolean selfClosing, int line)
    {
        Objects.requireNonNull(name, "name");
        return new UsxEvent(Kind.START_ELEMENT, name,
            Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), selfClosing, selfClosing, "", line);
    }

    public static UsxEvent endElement(String name, int line)
    {
        Objects.requireNonNull(name, "name");
        return new UsxEvent(Kind.END_ELEMENT, name, Collections.emptyMap(), false, false, "", line);
    }

    public static UsxEvent text(String text, int line)
    {
        Objects.requireNonNull(text, "text");
        return new UsxEvent(Kind.TEXT, "", Collections.emptyMap(), false, false, text, line);
    }

    /** The same start event, marked as having no content; its end event is not delivered. */
    UsxEvent asEmpty()
    {
        return new UsxEvent(this.kind, this.name, this.attributes, this.selfClosing, true, this.text, this.line);
    }

    public Kind getKind()
    {
        return this.kind;
    }

    public boolean isStartElement()
    {
        return this.kind == Kind.START_ELEMENT;
    }

    public boolean isEndElement()
    {
        return this.kind == Kind.END_ELEMENT;
    }

    public boolean isText()
    {
        return this.kind == Kind.TEXT;
    }

    /** Element name, empty for text events. */
    public String getName()
    {
        return this.name;
    }

    /**
     * Attribute value, or an empty string if the attribute is not present.
     */
    public String attribute(String attributeName)
    {
        String value = this.attributes.get(attributeName);
        return value == null ? "" : value;
    }

    public boolean hasAttribute(String attributeName)
    {
        return this.attributes.containsKey(attributeName);
    }

    public Map<String, String> getAttributes()
    {
        return this.attributes;
    }

    /**
     * True only for a tag written as {@code <name/>}; {@code <name></name>} is empty but not
     * self-closing.
     */
    public boolean isSelfClosing()
    {
        return this.selfClosing;
    }

    /**
     * True when the element has no content, in either form. No end event follows an empty start.
     */
    public boolean isEmpty()
    {
        return this.empty;
    }

    public String getText()
    {
        return this.text;
    }

    /** Source line of the event, or -1 when the parser does not know it. */
    public int getLine()
    {
        return this.line;
    }

    @Override
    public String toString()
    {
        switch (this.kind)
        {
            case START_ELEMENT:
                return "<" + this.name + this.attributes + (this.selfClosing ? "/>" : this.empty ? "></" + this.name + ">" : ">");
            case END_ELEMENT:
                return "</" + this.name + ">";
            default:
                return "text[" + this.text + "]";
        }
    }
}
