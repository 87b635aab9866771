package com.example.parex;

public enum WalkState {
    CONTINUE,
    QUIT
}
