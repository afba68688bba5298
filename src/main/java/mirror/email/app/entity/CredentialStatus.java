package mirror.email.app.entity;

/**
 * Lifecycle of a stored OAuth credential.
 * Only ACTIVE and REFRESHING move back and forth; NEEDS_REAUTH is left only through a new authorization grant.
 */
public enum CredentialStatus {
    ACTIVE,
    REFRESHING,
    NEEDS_REAUTH
}
