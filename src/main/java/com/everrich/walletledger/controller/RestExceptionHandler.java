package com.everrich.walletledger.controller;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import com.everrich.walletledger.exception.InvalidTransferException;
import com.everrich.walletledger.exception.LedgerInvariantException;
import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.exception.TransactionNotFoundException;
import com.everrich.walletledger.exception.WalletNotFoundException;

@RestControllerAdvice
public class RestExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(WalletNotFoundException.class)
    protected ResponseEntity<Object> handleWalletNotFound(WalletNotFoundException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    protected ResponseEntity<Object> handleTransactionNotFound(TransactionNotFoundException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(LedgerValidationException.class)
    protected ResponseEntity<Object> handleValidation(LedgerValidationException ex, WebRequest request) {
        log.debug("Rejected request: {}", ex.getMessage());
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    protected ResponseEntity<Object> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidTransferException.class)
    protected ResponseEntity<Object> handleInvalidTransfer(InvalidTransferException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(LedgerInvariantException.class)
    protected ResponseEntity<Object> handleInvariant(LedgerInvariantException ex, WebRequest request) {
        log.error("Ledger invariant violated: {}", ex.getMessage(), ex);
        return error(ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<Object> error(String message, HttpStatus status) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return new ResponseEntity<>(body, status);
    }
}
