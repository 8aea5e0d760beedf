package dao.fhe.mystery.model;

public enum CipherType {
    UINT,
    BOOL
}
