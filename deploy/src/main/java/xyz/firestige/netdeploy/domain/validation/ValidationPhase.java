package xyz.firestige.netdeploy.domain.validation;

public enum ValidationPhase {
    PRE,
    POST
}
