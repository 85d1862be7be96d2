package usx2usfx;

/**
 * The style attribute of a USX para element, split into a base marker and an optional
 * one-digit level ("mt2" is base "mt", level "2").
 */
public final class ParaStyle
{
    public enum Kind
    {
        /** Running header, written as {@code <h>}. */
        HEADING,
        /** Table of contents entry, always carries a level. */
        TOC,
        /** p, q, d, s and mt keep their own element name. */
        BODY,
        /** Editorial comment with no publishing value; dropped with its content. */
        RESTORE,
        /** Any other marker, written as {@code <p sfm="...">}. */
        OTHER
    }

    private final String base;
    private final String level;
    private final Kind kind;

    private ParaStyle(String base, String level, Kind kind)
    {
        this.base = base;
        this.level = level;
        this.kind = kind;
    }

    public static ParaStyle parse(String style)
    {
        String base = style == null ? "" : style;
        String level = "";

        if (!base.isEmpty())
        {
            int last = base.length() - 1;
            if (Character.isDigit(base.charAt(last)))
            {
                level = base.substring(last);
                base = base.substring(0, last);
            }
        }

        return new ParaStyle(base, level, kindOf(base));
    }

    private static Kind kindOf(String base)
    {
        switch (base)
        {
            case "h":
                return Kind.HEADING;
            case "toc":
                return Kind.TOC;
            case "p":
            case "q":
            case "d":
            case "s":
            case "mt":
                return Kind.BODY;
            case "restore":
                return Kind.RESTORE;
            default:
                return Kind.OTHER;
        }
    }

    public String getBase()
    {
        return this.base;
    }

    /** Level digit, empty when the style had none. */
    public String getLevel()
    {
        return this.level;
    }

    public boolean hasLevel()
    {
        return !this.level.isEmpty();
    }

    public Kind getKind()
    {
        return this.kind;
    }
}
