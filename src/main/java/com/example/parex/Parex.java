package com.example.parex;

public final class Parex {
    private Parex() {
    }

    public static SearchBuilder search() {
        return new SearchBuilder();
    }
}
