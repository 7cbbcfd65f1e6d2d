package nl.bytesoflife.lefqa.model;

public enum Severity {
    ERROR,
    WARNING;

    public String label() {
        return switch (this) {
            case ERROR -> "Error";
            case WARNING -> "Warning";
        };
    }
}
