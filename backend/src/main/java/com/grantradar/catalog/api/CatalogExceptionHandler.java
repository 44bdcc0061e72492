package com.grantradar.catalog.api;

import com.grantradar.catalog.store.CatalogLoadException;
import com.grantradar.catalog.store.CatalogWriteException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CatalogExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CatalogExceptionHandler.class);

  @ExceptionHandler(CatalogLoadException.class)
  public ResponseEntity<Map<String, String>> handleLoadFailure(CatalogLoadException ex) {
    log.warn("Catalog load failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "catalog_load_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(CatalogWriteException.class)
  public ResponseEntity<Map<String, String>> handleWriteFailure(CatalogWriteException ex) {
    log.warn("Catalog write failed: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "catalog_write_failed", "message", ex.getMessage()));
  }
}
