package usx2usfx;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Book codes already transduced during one conversion run.
 * Overlapping canon sets (for example a bundle unpacked next to loose files)
 * supply the same book more than once; only the first copy is converted.
 */
public final class BookRegistry
{
    private final Set<String> codes = new LinkedHashSet<>();

    public boolean seen(String code)
    {
        return this.codes.contains(code);
    }

    public void mark(String code)
    {
        this.codes.add(code);
    }

    /** Codes in the order they were first marked. */
    public Set<String> codes()
    {
        return Collections.unmodifiableSet(this.codes);
    }
}
