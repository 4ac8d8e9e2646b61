package com.chapterharvest.crawl.job;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCrawlJobException extends RuntimeException {
    public ActiveCrawlJobException(String message) {
        super(message);
    }
}
