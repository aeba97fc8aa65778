package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.cache.FrameHandleFactory;
import edu.eci.arsw.spatial.capability.ImageEncoder;
import edu.eci.arsw.spatial.capability.MediaCapability;
import edu.eci.arsw.spatial.capability.PeerLinkCapability;
import edu.eci.arsw.spatial.signaling.SignalingTransport;

import java.util.Objects;

/**
 * Capacidades externas de las que depende el controlador de sesión.
 */
public record SessionCapabilities(MediaCapability media,
                                  PeerLinkCapability peerLinks,
                                  SignalingTransport signaling,
                                  ImageEncoder imageEncoder,
                                  FrameHandleFactory frameHandles) {

    public SessionCapabilities {
        Objects.requireNonNull(media, "media");
        Objects.requireNonNull(peerLinks, "peerLinks");
        Objects.requireNonNull(signaling, "signaling");
        Objects.requireNonNull(imageEncoder, "imageEncoder");
        Objects.requireNonNull(frameHandles, "frameHandles");
    }
}
