package com.vita.causality.engine;

/**
 * Per-category debt scores (0-100) over a trailing window.
 */
public record DebtScores(int windowHours, double digestive, double digital, double somatic) {
}
