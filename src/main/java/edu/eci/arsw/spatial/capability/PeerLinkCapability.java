package edu.eci.arsw.spatial.capability;

import edu.eci.arsw.spatial.domain.ChannelFamily;
import edu.eci.arsw.spatial.domain.IceServer;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fábrica de enlaces WebRTC.
 */
public interface PeerLinkCapability {

    CompletableFuture<PeerLink> create(ChannelFamily family, List<IceServer> iceServers, PeerLinkListener listener);
}
