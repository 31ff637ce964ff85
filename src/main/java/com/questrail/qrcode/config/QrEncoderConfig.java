package com.questrail.qrcode.config;

import com.questrail.qrcode.observability.NullObservabilitySink;
import com.questrail.qrcode.observability.QrEncodingObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the QR Code encoder.
 *
 * @param includeQuietZone  surround the symbol with the 4-module light border
 * @param observabilitySink receiver of encoding events
 */
public record QrEncoderConfig(
    boolean includeQuietZone,
    QrEncodingObservabilitySink observabilitySink
) {
    public QrEncoderConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Returns a configuration with a quiet zone and no observability.
     */
    public static QrEncoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean includeQuietZone = true;
        private QrEncodingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withQuietZone(boolean includeQuietZone) {
            this.includeQuietZone = includeQuietZone;
            return this;
        }

        public Builder withObservabilitySink(QrEncodingObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public QrEncoderConfig build() {
            return new QrEncoderConfig(includeQuietZone, observabilitySink);
        }
    }
}
