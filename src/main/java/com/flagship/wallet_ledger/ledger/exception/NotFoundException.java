package com.flagship.wallet_ledger.ledger.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
