package com.len.directory.domain.credential;

public enum CredentialKind {
    ADMIN,
    REGULAR,
    EDIT_TOKEN
}
