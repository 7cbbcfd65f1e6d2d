package nl.bytesoflife.lefqa.model;

import java.util.Locale;

public enum LayerType {
    CUT,
    ROUTING,
    MASTERSLICE,
    OVERLAP,
    IMPLANT,
    OTHER;

    public static LayerType fromName(String name) {
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "CUT" -> CUT;
            case "ROUTING" -> ROUTING;
            case "MASTERSLICE" -> MASTERSLICE;
            case "OVERLAP" -> OVERLAP;
            case "IMPLANT" -> IMPLANT;
            default -> OTHER;
        };
    }
}
