package usx2usfx;

/**
 * Character style depth, counted separately in body text and inside notes.
 * <p>
 * The counter touched by a close is picked by whether a note is open at the time of
 * the close, not by which counter the matching open incremented.
 */
public final class NestingTracker
{
    private int bodyDepth;
    private int noteDepth;
    private boolean inNote;

    public void enterNote()
    {
        this.inNote = true;
    }

    public void leaveNote()
    {
        this.inNote = false;
    }

    public boolean isInNote()
    {
        return this.inNote;
    }

    public void openCharStyle()
    {
        if (this.inNote)
        {
            this.noteDepth++;
        }
        else
        {
            this.bodyDepth++;
        }
    }

    /**
     * @return false if either counter is now negative
     */
    public boolean closeCharStyle()
    {
        if (this.inNote)
        {
            this.noteDepth--;
        }
        else
        {
            this.bodyDepth--;
        }
        return isConsistent();
    }

    public boolean isConsistent()
    {
        return this.bodyDepth >= 0 && this.noteDepth >= 0;
    }

    public int getBodyDepth()
    {
        return this.bodyDepth;
    }

    public int getNoteDepth()
    {
        return this.noteDepth;
    }
}
