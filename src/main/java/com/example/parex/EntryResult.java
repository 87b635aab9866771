package com.example.parex;

import java.util.Objects;

public final class EntryResult {
    private final Entry entry;
    private final ParexException error;

    private EntryResult(Entry entry, ParexException error) {
        this.entry = entry;
        this.error = error;
    }

    public static EntryResult success(Entry entry) {
        return new EntryResult(Objects.requireNonNull(entry, "entry"), null);
    }

    public static EntryResult failure(ParexException error) {
        return new EntryResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return entry != null;
    }

    public Entry getEntry() {
        return entry;
    }

    public ParexException getError() {
        return error;
    }
}
