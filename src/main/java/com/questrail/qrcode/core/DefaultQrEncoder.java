package com.questrail.qrcode.core;

import com.questrail.qrcode.api.ContentTooLongException;
import com.questrail.qrcode.api.QrEncoder;
import com.questrail.qrcode.api.QrMatrix;
import com.questrail.qrcode.api.RecoveryLevel;
import com.questrail.qrcode.config.QrEncoderConfig;
import com.questrail.qrcode.observability.EncodingFailedEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultQrEncoder
 * -----------------------------------------------------------------------------
 * {@link QrEncoder} backed by {@link QrCode}.
 *
 * <p>Holds nothing but its configuration, so one instance can serve any
 * number of threads.</p>
 */
public final class DefaultQrEncoder implements QrEncoder
{
    private final QrEncoderConfig config;

    public DefaultQrEncoder()
    {
        this(QrEncoderConfig.defaults());
    }

    public DefaultQrEncoder(QrEncoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public QrMatrix encode(byte[] content, RecoveryLevel level) throws ContentTooLongException
    {
        final QrCode code;
        try {
            code = QrCode.create(content, level, config);
        }
        catch (ContentTooLongException e) {
            config.observabilitySink().onError(new EncodingFailedEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
        return code.matrix();
    }
}
