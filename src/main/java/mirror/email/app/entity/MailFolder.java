package mirror.email.app.entity;

public enum MailFolder {
    INBOX,
    ARCHIVE,
    SENT,
    DRAFTS,
    SPAM,
    TRASH,
    SNOOZED
}
