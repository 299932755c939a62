package qg.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
