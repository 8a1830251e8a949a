package com.meetadrive.app.models;

/**
 * A cell as the grid and formula bar see it:
 * the text to edit ("=SUM(A1:A3)") and the text to show ("6.0").
 */
public class CellView {
    private String reference;
    private String input;
    private String display;

    public CellView() {
    }

    public CellView(String reference, Cell cell) {
        this.reference = reference;
        this.input = cell.getInput();
        this.display = cell.getDisplayValue();
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getDisplay() {
        return display;
    }

    public void setDisplay(String display) {
        this.display = display;
    }
}
