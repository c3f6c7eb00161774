package com.openforge.memoria.worker;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** Ingestion attempted while the worker is stopped or stopping. */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class WorkerNotAcceptingException extends RuntimeException {

    public WorkerNotAcceptingException() {
        super("Worker is not accepting new work");
    }
}
