package com.phillippitts.aerodefect.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefectClassTest {

    @Test
    void hasTwelveClasses() {
        assertThat(DefectClass.values()).hasSize(12);
    }

    @Test
    void resolvesWireNames() {
        for (DefectClass c : DefectClass.values()) {
            assertThat(DefectClass.fromLabel(c.wireName())).contains(c);
        }
    }

    @Test
    void labelMatchingIgnoresCaseSpacesAndHyphens() {
        assertThat(DefectClass.fromLabel("Burn Mark")).contains(DefectClass.BURN_MARK);
        assertThat(DefectClass.fromLabel("paint-detachment")).contains(DefectClass.PAINT_DETACHMENT);
        assertThat(DefectClass.fromLabel("  CRACK ")).contains(DefectClass.CRACK);
    }

    @Test
    void unknownLabelsAreRejected() {
        assertThat(DefectClass.fromLabel("dent")).isEmpty();
        assertThat(DefectClass.fromLabel("")).isEmpty();
        assertThat(DefectClass.fromLabel(null)).isEmpty();
    }

    @Test
    void indexFollowsModelOrder() {
        assertThat(DefectClass.fromIndex(0)).contains(DefectClass.DAMAGED_RIVET);
        assertThat(DefectClass.fromIndex(11)).contains(DefectClass.CRACK);
        assertThat(DefectClass.fromIndex(12)).isEmpty();
        assertThat(DefectClass.fromIndex(-1)).isEmpty();
    }
}
