package dao.fhe.mystery.model;

public enum DisclosureKind {
    ACCUSATION,
    SOLUTION
}
