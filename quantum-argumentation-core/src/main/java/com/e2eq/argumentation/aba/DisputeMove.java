package com.e2eq.argumentation.aba;

public enum DisputeMove {
    PROPONENT,
    OPPONENT
}
