package work.lcod.yamlfmt.model;

public enum NodeKind {
    SCALAR,
    MAPPING,
    SEQUENCE,
    ALIAS
}
