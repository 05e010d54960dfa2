package com.farmvoice.ingest.mapping;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * bioTrack+ "Add Animal" requirements.
 *
 * Six fields are always required. Two more become required depending on
 * the rest of the record: the birth season for newborns, and the unit of
 * measure whenever a birth weight was given.
 */
@Component
public class AnimalRequiredFields implements RequiredFieldChecklist {

    public static final String CATEGORY_NEWBORN = "Newborn Animal";

    private static final List<RequiredField> FIELDS = List.of(
            RequiredField.always("category",          "Animal category"),
            RequiredField.always("species",           "Animal species"),
            RequiredField.always("birth_date",        "Animal's birth date (required, use best guess if unknown)"),
            RequiredField.always("sex",               "Animal's sex"),
            RequiredField.always("breed_composition", "Breed composition (must sum to 100%)"),
            RequiredField.when("birth_season",        "Birth season (e.g., 2022 or January 2022)",
                    AnimalRequiredFields::isNewborn),
            RequiredField.always("location",          "Current location of the animal"),
            RequiredField.when("birth_weight_uom",    "Unit of measure for birth weight",
                    fields -> fields.containsKey("birth_weight"))
    );

    @Override
    public List<RequiredField> fields() {
        return FIELDS;
    }

    private static boolean isNewborn(Map<String, Object> fields) {
        return CATEGORY_NEWBORN.equals(fields.get("category"));
    }
}
