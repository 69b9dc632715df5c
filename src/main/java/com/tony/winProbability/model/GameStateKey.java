package com.tony.winProbability.model;

public record GameStateKey(int scoreDifferential, int timeLeft) {
}
