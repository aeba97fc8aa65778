package edu.eci.arsw.spatial.capability;

import java.util.concurrent.CompletableFuture;

/**
 * Acceso a micrófono y cámara, provisto por la plataforma que embebe el cliente.
 */
public interface MediaCapability {

    CompletableFuture<LocalMedia> acquireMicrophone();

    CompletableFuture<CaptureSurface> acquireCamera(int width, int height, int frameRate);
}
