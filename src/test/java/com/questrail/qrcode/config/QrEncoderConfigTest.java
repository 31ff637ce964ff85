package com.questrail.qrcode.config;

import com.questrail.qrcode.observability.NullObservabilitySink;
import com.questrail.qrcode.observability.Slf4jQrEncodingObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QrEncoderConfigTest
{
    @Test
    void defaults()
    {
        QrEncoderConfig config = QrEncoderConfig.defaults();

        assertTrue(config.includeQuietZone());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void builderOverridesDefaults()
    {
        Slf4jQrEncodingObservabilitySink sink = new Slf4jQrEncodingObservabilitySink();

        QrEncoderConfig config = QrEncoderConfig.builder()
                .withQuietZone(false)
                .withObservabilitySink(sink)
                .build();

        assertFalse(config.includeQuietZone());
        assertSame(sink, config.observabilitySink());
    }

    @Test
    void sinkIsRequired()
    {
        assertThrows(NullPointerException.class, () -> new QrEncoderConfig(true, null));
        assertThrows(NullPointerException.class,
                () -> QrEncoderConfig.builder().withObservabilitySink(null).build());
    }
}
