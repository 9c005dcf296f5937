package com.peirce.eg.engine;

/** The pair of cuts created by a double cut insertion. */
public record DoubleCut(int outer, int inner) {
}
