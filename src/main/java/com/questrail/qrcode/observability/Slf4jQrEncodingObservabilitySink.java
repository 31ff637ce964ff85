package com.questrail.qrcode.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of QrEncodingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jQrEncodingObservabilitySink implements QrEncodingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jQrEncodingObservabilitySink.class);

    @Override
    public void onBracketRejected(BracketRejectedEvent event) {
        log.debug("QR bracket {}-{} rejected for {} bytes at level {}: {}",
            event.minVersion(),
            event.maxVersion(),
            event.contentLength(),
            event.level(),
            event.reason());
    }

    @Override
    public void onVersionSelected(VersionSelectedEvent event) {
        log.info("QR version {}-{} selected: {} of {} data bits used",
            event.version(),
            event.level(),
            event.encodedBits(),
            event.capacityBits());
    }

    @Override
    public void onMaskEvaluated(MaskEvaluatedEvent event) {
        log.debug("QR version {} mask {}: penalty {}", event.version(), event.maskPattern(), event.penalty());
    }

    @Override
    public void onMaskSelected(MaskSelectedEvent event) {
        log.info("QR version {}-{}: mask {} kept with penalty {}",
            event.version(),
            event.level(),
            event.maskPattern(),
            event.penalty());
    }

    @Override
    public void onError(EncodingFailedEvent event) {
        log.warn("QR encoding failed: {}", event.message(), event.cause());
    }
}
