package edu.eci.arsw.spatial.domain;

import java.util.List;

/**
 * Servidor STUN/TURN entregado al enlace WebRTC.
 *
 * @param urls       URLs del servidor.
 * @param username   Usuario TURN, o null para STUN.
 * @param credential Credencial TURN, o null para STUN.
 */
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        urls = List.copyOf(urls);
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }

    public boolean hasCredentials() {
        return username != null && credential != null;
    }
}
