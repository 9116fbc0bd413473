package net.littleredcomputer.prover.rule;

public enum Phase {
    NORM,    // applied during normalization: negative penalty before the simplifier, the rest after
    SAFE,    // applied eagerly, never backtracked
    UNSAFE,  // alternatives, tried in order of success probability
}
