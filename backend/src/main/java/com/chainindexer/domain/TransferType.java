package com.chainindexer.domain;

public enum TransferType {
    TRANSFER,
    MINT,
    BURN
}
