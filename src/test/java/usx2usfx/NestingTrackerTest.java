package usx2usfx;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NestingTrackerTest
{
    @Test
    void bodyAndNoteAreCountedSeparately()
    {
        NestingTracker t = new NestingTracker();

        t.openCharStyle();
        t.enterNote();
        t.openCharStyle();
        t.openCharStyle();

        assertThat(t.getBodyDepth()).isEqualTo(1);
        assertThat(t.getNoteDepth()).isEqualTo(2);

        assertThat(t.closeCharStyle()).isTrue();
        assertThat(t.closeCharStyle()).isTrue();
        t.leaveNote();
        assertThat(t.closeCharStyle()).isTrue();

        assertThat(t.getBodyDepth()).isZero();
        assertThat(t.getNoteDepth()).isZero();
    }

    @Test
    void closeUsesTheCurrentContextNotTheOpeningOne()
    {
        NestingTracker t = new NestingTracker();

        t.enterNote();
        t.openCharStyle();
        t.leaveNote();

        assertThat(t.closeCharStyle()).isFalse();
        assertThat(t.getBodyDepth()).isEqualTo(-1);
        assertThat(t.getNoteDepth()).isEqualTo(1);
        assertThat(t.isConsistent()).isFalse();
    }
}
