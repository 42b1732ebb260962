package com.tradepilot.trade.controller;

import com.tradepilot.common.exception.TradeRejectedException;
import com.tradepilot.trade.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice
public class EngineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineExceptionHandler.class);

    @ExceptionHandler(TradeRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(TradeRejectedException e) {
        log.warn("[EngineController] Command rejected. component={} reason={}", e.getComponent(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("TRADE_REJECTED", e.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException e) {
        log.warn("[EngineController] Malformed request. reason={}", e.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("BAD_REQUEST", e.getReason()));
    }
}
