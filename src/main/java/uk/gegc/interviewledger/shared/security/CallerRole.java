package uk.gegc.interviewledger.shared.security;

public enum CallerRole {
    STUDENT,
    ORG_ADMIN,
    SYSTEM
}
