package usx2usfx;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReferenceResolverTest
{
    @Test
    void spaceAndColonBecomeDots()
    {
        String tgt = ReferenceResolver.toTarget("PSA 2:7");

        assertThat(tgt).isEqualTo("PSA.2.7");
        assertThat(ReferenceResolver.isEmittable(tgt)).isTrue();
    }

    @Test
    void verseLettersAreStripped()
    {
        assertThat(ReferenceResolver.toTarget("GEN 1:1a")).isEqualTo("GEN.1.1");
        assertThat(ReferenceResolver.toTarget("GEN 1:2b-3a")).isEqualTo("GEN.1.2-3");
    }

    @Test
    void closedRangeIsKept()
    {
        assertThat(ReferenceResolver.toTarget("MAT 5:3-12")).isEqualTo("MAT.5.3-12");
    }

    @Test
    void openRangeIsInvalid()
    {
        assertThat(ReferenceResolver.toTarget("PSA 2:7-")).isEmpty();
        assertThat(ReferenceResolver.toTarget("PSA 2:-7")).isEmpty();
        assertThat(ReferenceResolver.toTarget("PSA 2 -7")).isEmpty();
    }

    @Test
    void shortTargetsAreNotEmitted()
    {
        assertThat(ReferenceResolver.isEmittable(ReferenceResolver.toTarget("GEN 1"))).isFalse();
        assertThat(ReferenceResolver.isEmittable("GEN.1.")).isFalse();
        assertThat(ReferenceResolver.isEmittable("GEN.1.1")).isTrue();
        assertThat(ReferenceResolver.isEmittable("")).isFalse();
    }

    @Test
    void missingLocationIsInvalid()
    {
        assertThat(ReferenceResolver.toTarget(null)).isEmpty();
        assertThat(ReferenceResolver.toTarget("")).isEmpty();
    }
}
