package tb.core.model;

public enum Decision {
    GRANTED,
    DENIED
}
