package com.chapterharvest.crawl.api;

import com.chapterharvest.crawl.extract.NovelMetadataException;
import com.chapterharvest.crawl.http.FetchException;
import com.chapterharvest.crawl.job.ActiveCrawlJobException;
import com.chapterharvest.crawl.job.CrawlCancelledException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {
  private static final int CLIENT_CLOSED_REQUEST = 499;

  @ExceptionHandler(ActiveCrawlJobException.class)
  public ResponseEntity<Map<String, String>> handleActiveJob(ActiveCrawlJobException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_job", "message", ex.getMessage()));
  }

  @ExceptionHandler(CrawlCancelledException.class)
  public ResponseEntity<Map<String, String>> handleCancelled(CrawlCancelledException ex) {
    return ResponseEntity.status(CLIENT_CLOSED_REQUEST)
        .body(Map.of("error", "cancelled", "message", ex.getMessage()));
  }

  @ExceptionHandler(FetchException.class)
  public ResponseEntity<Map<String, String>> handleFetchFailure(FetchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "chapter_fetch_failed", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler({NoChaptersException.class, NovelMetadataException.class})
  public ResponseEntity<Map<String, String>> handleNoContent(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "no_chapters", "message", ex.getMessage()));
  }
}
