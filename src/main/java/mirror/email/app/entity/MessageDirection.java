package mirror.email.app.entity;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
