package com.txlens.domain;

public enum TransferType {
    ERC20,
    ERC721,
    ERC1155
}
