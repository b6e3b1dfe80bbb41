package com.debtchecker.model;

public record Progress(int completed, int total) {

    public double percent() {
        return total == 0 ? 100.0 : completed * 100.0 / total;
    }
}
