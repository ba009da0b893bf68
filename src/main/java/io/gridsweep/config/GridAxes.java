package io.gridsweep.config;

public record GridAxes(String rows, String cols) {
    public static final GridAxes NONE = new GridAxes("", "");

    public GridAxes {
        rows = rows == null ? "" : rows;
        cols = cols == null ? "" : cols;
    }
}
