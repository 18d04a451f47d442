package nl.bytesoflife.natalchart.model;

public enum Dignity {
    DOMICILE,
    EXALTATION,
    DETRIMENT,
    FALL
}
