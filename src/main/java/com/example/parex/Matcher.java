package com.example.parex;

@FunctionalInterface
public interface Matcher {
    boolean isMatch(Entry entry);
}
