package io.github.flameyossnowy.asyncodm.mongodb.models;

public enum Status {
    ACTIVE,
    BANNED
}
