package se.chronotrust_be.pojo.enums;

public enum TokenKind {
    MINT,
    TRANSFER
}
