package usx2usfx;

/**
 * Rewrites USX cross-reference locations ("PSA 2:7") into USFX reference
 * targets ("PSA.2.7").
 */
public final class ReferenceResolver
{
    /** Targets of this length or shorter are incomplete and never written. */
    public static final int MIN_TARGET_LENGTH = 7;

    private ReferenceResolver()
    {
    }

    /**
     * Convert the loc attribute of a USX ref element to the tgt attribute of a USFX ref element.
     *
     * @param loc USX reference location, may be null
     * @return dotted target, or an empty string if the location holds an unresolved range
     */
    public static String toTarget(String loc)
    {
        if (loc == null)
        {
            return "";
        }

        // Verse part letters (7a, 7b) have no USFX equivalent.
        String result = loc.replace(' ', '.').replace(':', '.').replace("a", "").replace("b", "");

        if (result.contains(".-") || result.endsWith("-"))
        {
            return "";
        }
        return result;
    }

    public static boolean isEmittable(String target)
    {
        return target != null && target.length() >= MIN_TARGET_LENGTH;
    }
}
