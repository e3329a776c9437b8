package com.phillippitts.aerodefect.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed allowlist of twelve aircraft surface defect classes.
 *
 * <p>Declaration order matches the class index order of the trained local model.
 */
public enum DefectClass {
    DAMAGED_RIVET,
    MISSING_RIVET,
    FILIFORM_CORROSION,
    MISSING_PANEL,
    PAINT_DETACHMENT,
    SCRATCH,
    COMPOSITE_DAMAGE,
    RANDOM_DAMAGE,
    BURN_MARK,
    SCORCH_MARK,
    METAL_FATIGUE,
    CRACK;

    /**
     * Lower snake-case name used on the wire, e.g. {@code damaged_rivet}.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a class label coming from a detector.
     *
     * <p>Matching ignores case and treats spaces and hyphens as underscores, so
     * {@code "Burn Mark"} and {@code "burn-mark"} both resolve to {@link #BURN_MARK}.
     *
     * @param label raw label (may be null)
     * @return the class, or empty when the label is not on the allowlist
     */
    public static Optional<DefectClass> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim()
                .toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
        for (DefectClass c : values()) {
            if (c.name().equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a model output index.
     *
     * @return the class, or empty when the index is out of range
     */
    public static Optional<DefectClass> fromIndex(int index) {
        DefectClass[] all = values();
        return index >= 0 && index < all.length ? Optional.of(all[index]) : Optional.empty();
    }
}
