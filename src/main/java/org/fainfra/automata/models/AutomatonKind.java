package org.fainfra.automata.models;

public enum AutomatonKind {

    DFA,
    NFA
}
