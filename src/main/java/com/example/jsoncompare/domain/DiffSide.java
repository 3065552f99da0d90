package com.example.jsoncompare.domain;

public enum DiffSide {
    LEFT,
    RIGHT
}
