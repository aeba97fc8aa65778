package edu.eci.arsw.spatial.domain;

/**
 * Par enlace-WebRTC + socket de señalización compartido por dos patas.
 */
public enum ChannelFamily {
    AUDIO("/webrtc-audio"),
    VIDEO("/webrtc-video");

    private final String path;

    ChannelFamily(String path) {
        this.path = path;
    }

    /**
     * Ruta del endpoint de señalización relativa a la URL del servidor.
     */
    public String path() {
        return path;
    }
}
