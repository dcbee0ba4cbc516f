package com.e2eq.argumentation.dung;

public enum Label {
    IN,
    OUT,
    UNDEC
}
