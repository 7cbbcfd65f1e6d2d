package nl.bytesoflife.lefqa.model;

/**
 * Closed set of diagnostic categories. Declaration order is the report order.
 */
public enum DiagnosticCategory {
    LINE_ENDING_SEMICOLONS("line_ending_semicolons", Severity.WARNING,
            "The following lines have improper lack of space before the ending semicolon."),
    MISSING_PROPERTY_DEFINITIONS("missing_property_definitions", Severity.WARNING,
            "The LEF file does not have any PROPERTYDEFINITIONS listed at the start of the file."),
    MISSING_END_LIBRARY_TOKEN("missing_end_library_token", Severity.ERROR,
            "The LEF file does not contain an 'END LIBRARY' delimiter."),
    MANGLED_CELL_END("mangled_cell_end", Severity.ERROR,
            "The following cells have non-matching end delimiters."),
    MISSING_CELL_END("missing_cell_end", Severity.ERROR,
            "The following cells are missing end delimiters."),
    UNKNOWN_PIN_PROPERTY("unknown_pin_property", Severity.WARNING,
            "The following lines specify an unrecognized pin property."),
    UNKNOWN_CELL_PROPERTY("unknown_cell_property", Severity.WARNING,
            "The following lines specify an unrecognized cell property."),
    UNKNOWN_LAYER("unknown_layer", Severity.WARNING,
            "The following lines defined unrecognized layers."),
    MISSING_ORIGIN("missing_origin", Severity.ERROR,
            "The following cells do not have an ORIGIN defined."),
    STRANGE_ORIGIN("strange_origin", Severity.WARNING,
            "The following cells have an ORIGIN other than 0 0."),
    STRANGE_FOREIGN("strange_foreign", Severity.WARNING,
            "The following cells have a FOREIGN offset other than 0 0."),
    MISSING_CLASS("missing_class", Severity.ERROR,
            "The following cells do not have a CLASS defined."),
    STRANGE_CLASS("strange_class", Severity.WARNING,
            "The following cells have an uncommon CLASS."),
    MISSING_SYMMETRY("missing_symmetry", Severity.ERROR,
            "The following cells do not have a SYMMETRY defined."),
    STRANGE_SYMMETRY("strange_symmetry", Severity.WARNING,
            "The following cells have an uncommon SYMMETRY."),
    MISSING_SIZE("missing_size", Severity.ERROR,
            "The following cells do not have a SIZE defined."),
    MISSING_SITE("missing_site", Severity.ERROR,
            "The following cells do not have a SITE defined."),
    STRANGE_SITE("strange_site", Severity.WARNING,
            "The following cells have an uncommon SITE."),
    MISSING_DIRECTION("missing_direction", Severity.ERROR,
            "The following pins do not have a DIRECTION defined."),
    STRANGE_DIRECTION("strange_direction", Severity.WARNING,
            "The following pins have an uncommon DIRECTION."),
    MISSING_USE("missing_use", Severity.ERROR,
            "The following pins do not have a USE defined."),
    STRANGE_USE("strange_use", Severity.WARNING,
            "The following pins have an uncommon USE."),
    MISSING_VIA_OBS("missing_via_obs", Severity.ERROR,
            "The following cells have VIA/cut layers in pins without corresponding OBS layers."),
    LIBERTY_MISSING_CELL("liberty_missing_cell", Severity.ERROR,
            "The following cells were found in the LEF file, but not in the following Liberty files."),
    LIBERTY_MISSING_PIN("liberty_missing_pin", Severity.ERROR,
            "The following cells had the following pins defined in the LEF file, but not in the following Liberty files."),
    LEF_MISSING_CELL("lef_missing_cell", Severity.ERROR,
            "The following cells were found in Liberty files, but not in the LEF file."),
    LEF_MISSING_PIN("lef_missing_pin", Severity.ERROR,
            "The following cells had the following pins defined in Liberty files, but not in the LEF file."),
    AREA_MISMATCH("area_mismatch", Severity.ERROR,
            "The following cells had a SIZE property that was inconsistent with the AREA stated in the following Liberty files."),
    LIBERTY_INCORRECT_PIN_PROPERTY("liberty_incorrect_pin_property", Severity.ERROR,
            "The following cells have mismatched values between LIB and LEF.");

    private final String key;
    private final Severity severity;
    private final String description;

    DiagnosticCategory(String key, Severity severity, String description) {
        this.key = key;
        this.severity = severity;
        this.description = description;
    }

    /** Snake-case name used in reports. */
    public String getKey() {
        return key;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }
}
