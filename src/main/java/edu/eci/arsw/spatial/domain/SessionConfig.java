package edu.eci.arsw.spatial.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuración inmutable de una sesión. Solo lectura después de construida.
 */
public final class SessionConfig {

    private final String serverUrl;
    private final int videoFrameRate;
    private final int videoWidth;
    private final int videoHeight;
    private final double videoQuality;
    private final double audioVolume;
    private final double maxHearingRange;
    private final List<IceServer> iceServers;
    private final long staleFrameThresholdMs;
    private final long evictionSweepIntervalMs;
    private final long evictionAgeMs;
    private final long dataChannelOpenTimeoutMs;
    private final long readinessPollIntervalMs;

    private SessionConfig(Builder b) {
        this.serverUrl = b.serverUrl;
        this.videoFrameRate = b.videoFrameRate;
        this.videoWidth = b.videoWidth;
        this.videoHeight = b.videoHeight;
        this.videoQuality = b.videoQuality;
        this.audioVolume = b.audioVolume;
        this.maxHearingRange = b.maxHearingRange;
        this.iceServers = List.copyOf(b.iceServers);
        this.staleFrameThresholdMs = b.staleFrameThresholdMs;
        this.evictionSweepIntervalMs = b.evictionSweepIntervalMs;
        this.evictionAgeMs = b.evictionAgeMs;
        this.dataChannelOpenTimeoutMs = b.dataChannelOpenTimeoutMs;
        this.readinessPollIntervalMs = b.readinessPollIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuración con todos los valores por defecto.
     */
    public static SessionConfig defaults() {
        return builder().build();
    }

    public String getServerUrl() { return serverUrl; }
    public int getVideoFrameRate() { return videoFrameRate; }
    public int getVideoWidth() { return videoWidth; }
    public int getVideoHeight() { return videoHeight; }
    public double getVideoQuality() { return videoQuality; }
    public double getAudioVolume() { return audioVolume; }
    public double getMaxHearingRange() { return maxHearingRange; }
    public List<IceServer> getIceServers() { return iceServers; }
    public long getStaleFrameThresholdMs() { return staleFrameThresholdMs; }
    public long getEvictionSweepIntervalMs() { return evictionSweepIntervalMs; }
    public long getEvictionAgeMs() { return evictionAgeMs; }
    public long getDataChannelOpenTimeoutMs() { return dataChannelOpenTimeoutMs; }
    public long getReadinessPollIntervalMs() { return readinessPollIntervalMs; }

    /**
     * Periodo del bucle de captura, derivado de la tasa de cuadros.
     *
     * @return Periodo en milisegundos, nunca menor a 1.
     */
    public long getFramePeriodMs() {
        return Math.max(1L, 1000L / videoFrameRate);
    }

    @Override
    public String toString() {
        return "SessionConfig{serverUrl=" + serverUrl
                + ", video=" + videoWidth + "x" + videoHeight + "@" + videoFrameRate
                + ", quality=" + videoQuality
                + ", iceServers=" + iceServers.size() + "}";
    }

    public static final class Builder {
        private String serverUrl = "ws://localhost:9090";
        private int videoFrameRate = 30;
        private int videoWidth = 64;
        private int videoHeight = 64;
        private double videoQuality = 0.8;
        private double audioVolume = 1.0;
        private double maxHearingRange = 50.0;
        private List<IceServer> iceServers = new ArrayList<>(List.of(IceServer.stun("stun:stun.l.google.com:19302")));
        private long staleFrameThresholdMs = 1000;
        private long evictionSweepIntervalMs = 1000;
        private long evictionAgeMs = 2000;
        private long dataChannelOpenTimeoutMs = 5000;
        private long readinessPollIntervalMs = 100;

        private Builder() {
        }

        public Builder serverUrl(String serverUrl) { this.serverUrl = serverUrl; return this; }
        public Builder videoFrameRate(int videoFrameRate) { this.videoFrameRate = videoFrameRate; return this; }
        public Builder videoWidth(int videoWidth) { this.videoWidth = videoWidth; return this; }
        public Builder videoHeight(int videoHeight) { this.videoHeight = videoHeight; return this; }
        public Builder videoQuality(double videoQuality) { this.videoQuality = videoQuality; return this; }
        public Builder audioVolume(double audioVolume) { this.audioVolume = audioVolume; return this; }
        public Builder maxHearingRange(double maxHearingRange) { this.maxHearingRange = maxHearingRange; return this; }
        public Builder iceServers(List<IceServer> iceServers) { this.iceServers = new ArrayList<>(iceServers); return this; }
        public Builder staleFrameThresholdMs(long ms) { this.staleFrameThresholdMs = ms; return this; }
        public Builder evictionSweepIntervalMs(long ms) { this.evictionSweepIntervalMs = ms; return this; }
        public Builder evictionAgeMs(long ms) { this.evictionAgeMs = ms; return this; }
        public Builder dataChannelOpenTimeoutMs(long ms) { this.dataChannelOpenTimeoutMs = ms; return this; }
        public Builder readinessPollIntervalMs(long ms) { this.readinessPollIntervalMs = ms; return this; }

        /**
         * Valida los rangos y construye la configuración.
         *
         * @return Configuración inmutable.
         * @throws IllegalArgumentException Si algún valor está fuera de rango.
         */
        public SessionConfig build() {
            if (serverUrl == null || serverUrl.isBlank()) {
                throw new IllegalArgumentException("serverUrl is required");
            }
            if (videoFrameRate <= 0 || videoWidth <= 0 || videoHeight <= 0) {
                throw new IllegalArgumentException("Video frame rate and dimensions must be positive");
            }
            if (videoWidth > 0xFFFF || videoHeight > 0xFFFF) {
                throw new IllegalArgumentException("Video dimensions exceed JPEG limits");
            }
            if (videoQuality <= 0.0 || videoQuality > 1.0) {
                throw new IllegalArgumentException("videoQuality must be in (0, 1]: " + videoQuality);
            }
            if (audioVolume < 0.0 || audioVolume > 1.0) {
                throw new IllegalArgumentException("audioVolume must be in [0, 1]: " + audioVolume);
            }
            if (staleFrameThresholdMs <= 0 || evictionSweepIntervalMs <= 0 || evictionAgeMs <= 0
                    || dataChannelOpenTimeoutMs <= 0 || readinessPollIntervalMs <= 0) {
                throw new IllegalArgumentException("Timing values must be positive");
            }
            return new SessionConfig(this);
        }
    }
}
