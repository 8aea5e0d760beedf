package dao.fhe.mystery.model;

public enum Role {
    OWNER,
    PROVIDER
}
