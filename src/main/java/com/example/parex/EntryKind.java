package com.example.parex;

public enum EntryKind {
    FILE,
    DIRECTORY,
    SYMLINK,
    OTHER
}
