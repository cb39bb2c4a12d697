package com.questrail.l5x.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProgressSink} that emits progress at INFO and warnings at WARN via SLF4J.
 */
public final class Slf4jProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jProgressSink.class);

    @Override
    public void onProgress(String message) {
        log.info("{}", message);
    }

    @Override
    public void onWarning(String message) {
        log.warn("{}", message);
    }
}
