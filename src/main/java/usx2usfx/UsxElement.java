package usx2usfx;

import java.util.HashMap;
import java.util.Map;

/**
 * USX element vocabulary understood by {@link BookTranscoder}.
 */
public enum UsxElement
{
    USX("usx"),
    BOOK("book"),
    CHAPTER("chapter"),
    VERSE("verse"),
    NOTE("note"),
    CHAR("char"),
    TABLE("table"),
    ROW("row"),
    CELL("cell"),
    PARA("para"),
    FIGURE("figure"),
    OPTBREAK("optbreak"),
    REF("ref"),
    UNKNOWN("");

    private static final Map<String, UsxElement> BY_NAME = new HashMap<>();

    static
    {
        for (UsxElement e : values())
        {
            if (e != UNKNOWN)
            {
                BY_NAME.put(e.tagName, e);
            }
        }
    }

    private final String tagName;

    UsxElement(String tagName)
    {
        this.tagName = tagName;
    }

    public String getTagName()
    {
        return this.tagName;
    }

    public static UsxElement forName(String name)
    {
        UsxElement e = BY_NAME.get(name);
        return e == null ? UNKNOWN : e;
    }
}
