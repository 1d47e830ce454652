package com.catalogimport.catalogimport.importer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LabelNormalizerTest {

    @Test
    void shouldTrimCollapseAndFoldCase() {
        assertEquals("dark green", LabelNormalizer.normalize("  Dark \t  GREEN "));
        assertEquals("", LabelNormalizer.normalize(null));
        assertEquals("größe", LabelNormalizer.normalize("GRÖßE"));
    }

    @Test
    void shouldGiveEquivalentLabelsTheSameKey() {
        assertEquals(LabelNormalizer.normalize("GREEN"), LabelNormalizer.normalize("Green "));
        assertEquals(LabelNormalizer.normalize("light blue"), LabelNormalizer.normalize("Light  Blue"));
    }
}
