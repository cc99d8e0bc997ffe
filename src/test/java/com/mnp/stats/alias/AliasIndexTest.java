package com.mnp.stats.alias;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AliasIndex.
 */
class AliasIndexTest {

    @Test
    void testCanonicalKeysMapToThemselves() {
        AliasIndex index = AliasIndex.build(List.of(
                MachineEntry.builder().key("MM").name("Medieval Madness").variation("Medieval").build()));

        assertThat(index.lookupExact("MM")).contains("MM");
        assertThat(index.lookupNormalized("mm")).contains("MM");
        assertThat(index.lookupNormalized("  MEDIEVAL ")).contains("MM");
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void testExactLookupIsCaseSensitive() {
        AliasIndex index = AliasIndex.build(List.of(
                MachineEntry.builder().key("TZ").variation("Twilight Zone").build()));

        assertThat(index.lookupExact("Twilight Zone")).contains("TZ");
        assertThat(index.lookupExact("twilight zone")).isEmpty();
        assertThat(index.lookupNormalized("twilight zone")).contains("TZ");
    }

    @Test
    void testFirstEntryKeepsCollidingVariation() {
        AliasIndex index = AliasIndex.build(List.of(
                MachineEntry.builder().key("AFM").variation("Mars").build(),
                MachineEntry.builder().key("AFMR").variation("mars").build()));

        assertThat(index.lookupNormalized("MARS")).contains("AFM");
        assertThat(index.getConflicts())
                .extracting(AliasConflict::getExistingKey, AliasConflict::getRejectedKey)
                .containsExactly(tuple("AFM", "AFMR"));
    }

    @Test
    void testDuplicateCanonicalKeyIgnored() {
        AliasIndex index = AliasIndex.build(List.of(
                MachineEntry.builder().key("GZ").name("Godzilla").build(),
                MachineEntry.builder().key("GZ").name("Other").build()));

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.entry("GZ")).map(MachineEntry::getDisplayName).contains("Godzilla");
    }

    @Test
    void testNullAndBlankLabels() {
        AliasIndex index = AliasIndex.empty();

        assertThat(index.lookupExact(null)).isEmpty();
        assertThat(index.lookupNormalized(null)).isEmpty();
        assertThat(AliasIndex.normalize(null)).isEmpty();
        assertThat(AliasIndex.normalize("  Attack From MARS ")).isEqualTo("attack from mars");
    }
}
