package edu.eci.arsw.spatial.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import edu.eci.arsw.spatial.cache.CachedFrame;
import edu.eci.arsw.spatial.cache.FrameHandle;
import edu.eci.arsw.spatial.cache.ParticipantFrameCache;
import edu.eci.arsw.spatial.cache.UpsertResult;
import edu.eci.arsw.spatial.capability.AudioOutput;
import edu.eci.arsw.spatial.capability.CapabilityAcquisitionException;
import edu.eci.arsw.spatial.capability.CaptureSurface;
import edu.eci.arsw.spatial.capability.DataChannel;
import edu.eci.arsw.spatial.capability.DataChannelListener;
import edu.eci.arsw.spatial.capability.LocalMedia;
import edu.eci.arsw.spatial.capability.PeerLink;
import edu.eci.arsw.spatial.capability.PeerLinkListener;
import edu.eci.arsw.spatial.capability.RemoteAudioTrack;
import edu.eci.arsw.spatial.codec.FrameCodec;
import edu.eci.arsw.spatial.codec.FrameDecodeException;
import edu.eci.arsw.spatial.codec.VideoFrameEnvelope;
import edu.eci.arsw.spatial.domain.ChannelFamily;
import edu.eci.arsw.spatial.domain.ConnectionState;
import edu.eci.arsw.spatial.domain.LegKind;
import edu.eci.arsw.spatial.domain.LegState;
import edu.eci.arsw.spatial.domain.SessionConfig;
import edu.eci.arsw.spatial.signaling.SignalingCodec;
import edu.eci.arsw.spatial.signaling.SignalingConnection;
import edu.eci.arsw.spatial.signaling.SignalingListener;
import edu.eci.arsw.spatial.signaling.SignalingMessage;
import edu.eci.arsw.spatial.validation.FrameValidator;
import edu.eci.arsw.spatial.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

/**
 * Controlador de la sesión: máquina de estados de las cuatro patas (enviar/escuchar
 * audio, enviar/ver video), dueño exclusivo de los enlaces, sockets y la caché de cuadros.
 *
 * <p>Todo cambio de estado ocurre en el {@code executor} de la sesión, que debe ser de un
 * solo hilo. Los métodos públicos pueden llamarse desde cualquier hilo.
 */
public class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    static final String VIDEO_CHANNEL_LABEL = "video";

    private final String clientId;
    private final SessionConfig config;
    private final SessionCapabilities caps;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final Clock clock;
    private final FrameStatsService stats;
    private final SignalingCodec codec;
    private final SessionEvents events = new SessionEvents();
    private final ParticipantFrameCache cache;
    private final ChannelReadinessAwaiter readiness;

    private final Map<LegKind, LegState> states = new ConcurrentHashMap<>();
    private final Map<LegKind, Long> epochs = new EnumMap<>(LegKind.class);
    private final Map<LegKind, CompletableFuture<Void>> pendingStarts = new EnumMap<>(LegKind.class);
    private final Map<LegKind, CompletableFuture<Void>> readinessWaits = new EnumMap<>(LegKind.class);
    private final Map<ChannelFamily, ChannelSlot> slots = new EnumMap<>(ChannelFamily.class);

    private LocalMedia microphone;
    private CaptureSurface camera;
    private ScheduledFuture<?> sendTask;
    private ScheduledFuture<?> sweepTask;
    private long nextSequence;
    private volatile AudioOutput audioOutput;
    private volatile boolean connected;

    public SessionController(String clientId,
                             SessionConfig config,
                             SessionCapabilities caps,
                             SignalingCodec codec,
                             TaskScheduler scheduler,
                             Executor executor,
                             Clock clock,
                             FrameStatsService stats) {
        FrameCodec.requireEncodableIdentity(clientId);
        this.clientId = clientId;
        this.config = config;
        this.caps = caps;
        this.codec = codec;
        this.scheduler = scheduler;
        this.executor = executor;
        this.clock = clock;
        this.stats = stats;
        this.cache = new ParticipantFrameCache(config.getEvictionAgeMs());
        this.readiness = new ChannelReadinessAwaiter(scheduler, clock,
                config.getReadinessPollIntervalMs(), config.getDataChannelOpenTimeoutMs());
        for (LegKind leg : LegKind.values()) {
            states.put(leg, LegState.IDLE);
            epochs.put(leg, 0L);
        }
        for (ChannelFamily family : ChannelFamily.values()) {
            slots.put(family, new ChannelSlot(family));
        }
        log.info("Session controller created clientId={} config={}", clientId, config);
    }

    // ---------------------------------------------------------------------
    // API pública
    // ---------------------------------------------------------------------

    public void subscribe(SessionEventListener listener) {
        events.subscribe(listener);
    }

    public void unsubscribe(SessionEventListener listener) {
        events.unsubscribe(listener);
    }

    public String getClientId() {
        return clientId;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public LegState legState(LegKind leg) {
        return states.get(leg);
    }

    /**
     * Enlaza la salida donde se reproduce el audio mezclado recibido.
     *
     * @param output Salida de audio, o null para desenlazar.
     */
    public void bindAudioOutput(AudioOutput output) {
        this.audioOutput = output;
    }

    /**
     * Último cuadro aceptado de un participante, para la capa de presentación.
     *
     * @param participantId Participante remoto.
     * @return El recurso del cuadro, si existe.
     */
    public Optional<FrameHandle> currentFrame(String participantId) {
        return cache.get(participantId).map(CachedFrame::handle);
    }

    public ConnectionState getConnectionState() {
        return new ConnectionState(connected,
                states.get(LegKind.SEND_AUDIO) == LegState.ACTIVE,
                states.get(LegKind.LISTEN_AUDIO) == LegState.ACTIVE,
                states.get(LegKind.SEND_VIDEO) == LegState.ACTIVE,
                states.get(LegKind.VIEW_VIDEO) == LegState.ACTIVE,
                clientId);
    }

    /**
     * Marca la sesión como conectada. Los sockets se abren recién al arrancar cada pata.
     */
    public void connect() {
        executor.execute(() -> {
            if (connected) {
                return;
            }
            connected = true;
            log.info("Session connected clientId={}", clientId);
            events.connected();
        });
    }

    /**
     * Arranca una pata. Si ya está arrancando devuelve el mismo futuro; si ya está
     * activa no hace nada.
     *
     * @param leg Pata a arrancar.
     * @return Futuro que completa cuando la pata queda activa, o falla con la causa.
     */
    public CompletableFuture<Void> start(LegKind leg) {
        return CompletableFuture.supplyAsync(() -> doStart(leg), executor)
                .thenCompose(Function.identity());
    }

    /**
     * Detiene una pata. No hace nada si ya está detenida.
     *
     * @param leg Pata a detener.
     */
    public void stop(LegKind leg) {
        executor.execute(() -> doStop(leg));
    }

    /**
     * Detiene las cuatro patas y cierra la sesión. Idempotente.
     */
    public void disconnect() {
        executor.execute(this::doDisconnect);
    }

    public CompletableFuture<Void> startSendingAudio() {
        return start(LegKind.SEND_AUDIO);
    }

    public CompletableFuture<Void> startListeningAudio() {
        return start(LegKind.LISTEN_AUDIO);
    }

    public CompletableFuture<Void> startSendingVideo() {
        return start(LegKind.SEND_VIDEO);
    }

    public CompletableFuture<Void> startViewingVideo() {
        return start(LegKind.VIEW_VIDEO);
    }

    // ---------------------------------------------------------------------
    // Arranque
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> doStart(LegKind leg) {
        LegState state = states.get(leg);
        if (state == LegState.STARTING) {
            log.debug("{} already starting", leg);
            return pendingStarts.get(leg);
        }
        if (state == LegState.ACTIVE) {
            log.debug("{} already active", leg);
            return CompletableFuture.completedFuture(null);
        }
        long epoch = epochs.merge(leg, 1L, Long::sum);
        states.put(leg, LegState.STARTING);
        long startedAt = clock.millis();
        log.info("Starting {}", leg);

        CompletableFuture<Void> result = new CompletableFuture<>();
        pendingStarts.put(leg, result);

        CompletableFuture<Void> steps;
        try {
            steps = switch (leg) {
                case SEND_AUDIO -> startSendingAudio(epoch);
                case LISTEN_AUDIO -> rebuildFamily(ChannelFamily.AUDIO);
                case SEND_VIDEO -> startSendingVideo(epoch);
                case VIEW_VIDEO -> rebuildFamily(ChannelFamily.VIDEO)
                        .thenComposeAsync(ignored -> awaitVideoChannel(LegKind.VIEW_VIDEO, epoch), executor);
            };
        } catch (RuntimeException e) {
            steps = CompletableFuture.failedFuture(e);
        }
        steps.whenCompleteAsync((ignored, error) -> finishStart(leg, epoch, startedAt, error, result), executor);
        return result;
    }

    private CompletableFuture<Void> startSendingAudio(long epoch) {
        return caps.media().acquireMicrophone()
                .thenComposeAsync(mic -> {
                    if (!isCurrent(LegKind.SEND_AUDIO, epoch)) {
                        mic.release();
                        throw staleStart(LegKind.SEND_AUDIO);
                    }
                    microphone = mic;
                    return rebuildFamily(ChannelFamily.AUDIO);
                }, executor);
    }

    private CompletableFuture<Void> startSendingVideo(long epoch) {
        return caps.media().acquireCamera(config.getVideoWidth(), config.getVideoHeight(), config.getVideoFrameRate())
                .thenComposeAsync(surface -> {
                    if (!isCurrent(LegKind.SEND_VIDEO, epoch)) {
                        surface.release();
                        throw staleStart(LegKind.SEND_VIDEO);
                    }
                    camera = surface;
                    return rebuildFamily(ChannelFamily.VIDEO);
                }, executor)
                .thenComposeAsync(ignored -> awaitVideoChannel(LegKind.SEND_VIDEO, epoch), executor);
    }

    private CompletableFuture<Void> awaitVideoChannel(LegKind leg, long epoch) {
        if (!isCurrent(leg, epoch)) {
            throw staleStart(leg);
        }
        ChannelSlot slot = slots.get(ChannelFamily.VIDEO);
        CompletableFuture<Void> wait = readiness.await(leg, slot::isDataChannelOpen);
        if (!wait.isDone()) {
            log.info("Waiting for video data channel to open ({})", leg);
            readinessWaits.put(leg, wait);
        }
        return wait;
    }

    private void finishStart(LegKind leg, long epoch, long startedAt, Throwable error, CompletableFuture<Void> result) {
        pendingStarts.remove(leg, result);
        readinessWaits.remove(leg);
        Throwable cause = unwrap(error);
        if (!isCurrent(leg, epoch)) {
            log.info("{} start discarded, leg was stopped meanwhile", leg);
            result.completeExceptionally(cause instanceof CancellationException ? cause : staleStart(leg));
            return;
        }
        if (cause != null) {
            failStart(leg, cause, result);
            return;
        }
        if (leg == LegKind.SEND_VIDEO) {
            sendTask = scheduler.scheduleAtFixedRate(() -> executor.execute(this::sendVideoFrame),
                    Duration.ofMillis(config.getFramePeriodMs()));
        } else if (leg == LegKind.VIEW_VIDEO) {
            sweepTask = scheduler.scheduleAtFixedRate(() -> executor.execute(this::sweepFrames),
                    Duration.ofMillis(config.getEvictionSweepIntervalMs()));
        }
        states.put(leg, LegState.ACTIVE);
        stats.recordLegStarted(leg, clock.millis() - startedAt);
        log.info("{} active", leg);
        events.legStateChanged(leg, true);
        result.complete(null);
    }

    private void failStart(LegKind leg, Throwable cause, CompletableFuture<Void> result) {
        Throwable reported = cause instanceof ChannelOpenTimeoutException
                || cause instanceof CapabilityAcquisitionException
                ? cause
                : new CapabilityAcquisitionException(leg, cause);
        LegKind sibling = leg.sibling();
        boolean stranded = states.get(sibling) == LegState.ACTIVE && !isFamilyUsable(leg.family());
        abandonStart(leg, reported, result);
        if (stranded) {
            // la reconstrucción fallida ya cerró el enlace que usaba la pata hermana
            log.warn("{} lost its {} channel after a failed rebuild", sibling, leg.family());
            doStop(sibling);
        }
        events.error("Failed to start " + describe(leg), reported);
    }

    /**
     * Devuelve la pata a inactiva y completa su arranque con el fallo, sin emitir eventos.
     */
    private void abandonStart(LegKind leg, Throwable reported, CompletableFuture<Void> result) {
        states.put(leg, LegState.STOPPING);
        releaseLeg(leg);
        states.put(leg, LegState.IDLE);
        closeFamilyIfIdle(leg);
        stats.recordLegFailed(leg);
        if (result != null) {
            result.completeExceptionally(reported);
        }
    }

    // ---------------------------------------------------------------------
    // Reconstrucción de familias de canal
    // ---------------------------------------------------------------------

    /**
     * Reconstruye el socket y el enlace de la familia aunque ya existan. Las
     * reconstrucciones de una misma familia se encadenan.
     */
    private CompletableFuture<Void> rebuildFamily(ChannelFamily family) {
        ChannelSlot slot = slots.get(family);
        CompletableFuture<Void> next = slot.rebuild()
                .handle((ignored, error) -> (Void) null)
                .thenComposeAsync(ignored -> connectFamily(slot), executor);
        slot.rebuild(next);
        return next;
    }

    private CompletableFuture<Void> connectFamily(ChannelSlot slot) {
        ChannelFamily family = slot.family();
        if (!isFamilyRequested(family)) {
            return CompletableFuture.failedFuture(new CancellationException(family + " channel no longer requested"));
        }
        slot.close();
        long generation = slot.generation();
        log.info("Rebuilding {} channel generation={}", family, generation);
        return caps.signaling().connect(family, new FamilySignalingListener(family, generation))
                .thenComposeAsync(connection -> {
                    if (!slot.isGeneration(generation)) {
                        connection.close();
                        throw superseded(family);
                    }
                    slot.signaling(connection);
                    return caps.peerLinks().create(family, config.getIceServers(),
                            new FamilyPeerListener(family, generation));
                }, executor)
                .thenComposeAsync(link -> {
                    if (!slot.isGeneration(generation)) {
                        link.close();
                        throw superseded(family);
                    }
                    slot.peerLink(link);
                    return createOffer(slot, link, generation);
                }, executor)
                .thenAcceptAsync(sdp -> {
                    if (!slot.isGeneration(generation)) {
                        throw superseded(family);
                    }
                    try {
                        sendSignal(slot, SignalingMessage.offer(clientId, sdp));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    log.info("Sent {} offer", family);
                }, executor);
    }

    private CompletableFuture<String> createOffer(ChannelSlot slot, PeerLink link, long generation) {
        if (slot.family() == ChannelFamily.VIDEO) {
            // el canal debe existir antes de la oferta para quedar negociado
            slot.dataChannel(link.createDataChannel(VIDEO_CHANNEL_LABEL, false, 0, new VideoChannelListener(generation)));
            return link.createOffer(false);
        }
        if (microphone != null && states.get(LegKind.SEND_AUDIO).isRequested()) {
            link.addLocalMedia(microphone);
        }
        return link.createOffer(states.get(LegKind.LISTEN_AUDIO).isRequested());
    }

    // ---------------------------------------------------------------------
    // Detención
    // ---------------------------------------------------------------------

    private void doStop(LegKind leg) {
        LegState state = states.get(leg);
        if (state == LegState.IDLE || state == LegState.STOPPING) {
            log.debug("{} already stopped", leg);
            return;
        }
        states.put(leg, LegState.STOPPING);
        epochs.merge(leg, 1L, Long::sum);

        CompletableFuture<Void> wait = readinessWaits.remove(leg);
        if (wait != null) {
            wait.cancel(false);
        }
        CompletableFuture<Void> pending = pendingStarts.remove(leg);
        if (pending != null) {
            pending.completeExceptionally(staleStart(leg));
        }

        sendStopNotice(leg);
        releaseLeg(leg);
        states.put(leg, LegState.IDLE);
        closeFamilyIfIdle(leg);
        log.info("{} stopped", leg);
        events.legStateChanged(leg, false);
    }

    private void doDisconnect() {
        log.info("Disconnecting clientId={}", clientId);
        for (LegKind leg : LegKind.values()) {
            doStop(leg);
        }
        for (ChannelSlot slot : slots.values()) {
            slot.close();
        }
        if (connected) {
            connected = false;
            events.disconnected();
        }
    }

    private void sendStopNotice(LegKind leg) {
        try {
            if (leg == LegKind.SEND_AUDIO) {
                ChannelSlot audio = slots.get(ChannelFamily.AUDIO);
                if (audio.isSignalingOpen()) {
                    audio.signaling().send(SignalingMessage.stopSending(clientId));
                }
            } else if (leg == LegKind.SEND_VIDEO) {
                ChannelSlot video = slots.get(ChannelFamily.VIDEO);
                if (video.isDataChannelOpen()) {
                    video.dataChannel().send(codec.write(SignalingMessage.stopVideo()));
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Stop notice for {} not sent: {}", leg, e.toString());
        }
    }

    /**
     * Libera los medios y temporizadores propios de la pata.
     */
    private void releaseLeg(LegKind leg) {
        try {
            switch (leg) {
                case SEND_AUDIO -> releaseMicrophone();
                case LISTEN_AUDIO -> {
                    AudioOutput output = audioOutput;
                    if (output != null) {
                        output.stop();
                    }
                }
                case SEND_VIDEO -> releaseCamera();
                case VIEW_VIDEO -> clearFrames();
            }
        } catch (RuntimeException e) {
            log.warn("Releasing {} resources failed: {}", leg, e.toString());
        }
    }

    private void releaseMicrophone() {
        if (microphone == null) {
            return;
        }
        PeerLink link = slots.get(ChannelFamily.AUDIO).peerLink();
        try {
            if (link != null) {
                link.removeLocalMedia(microphone);
            }
        } finally {
            microphone.release();
            microphone = null;
        }
    }

    private void releaseCamera() {
        if (sendTask != null) {
            sendTask.cancel(false);
            sendTask = null;
        }
        if (camera != null) {
            camera.release();
            camera = null;
        }
    }

    private void clearFrames() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        List<String> removed = cache.clear();
        removed.forEach(events::sourceRemoved);
        if (!removed.isEmpty()) {
            log.info("Cleared {} video sources", removed.size());
        }
    }

    private void closeFamilyIfIdle(LegKind leg) {
        if (states.get(leg) != LegState.IDLE || states.get(leg.sibling()) != LegState.IDLE) {
            return;
        }
        ChannelSlot slot = slots.get(leg.family());
        if (!slot.isEmpty()) {
            log.info("Both {} legs idle, closing channel", leg.family());
        }
        slot.close();
    }

    // ---------------------------------------------------------------------
    // Temporizadores
    // ---------------------------------------------------------------------

    /**
     * Captura, comprime y envía un cuadro. Se omite en silencio si el canal no está abierto.
     */
    void sendVideoFrame() {
        CaptureSurface surface = camera;
        DataChannel channel = slots.get(ChannelFamily.VIDEO).dataChannel();
        if (surface == null || channel == null || !channel.isOpen()) {
            return;
        }
        try {
            Optional<BufferedImage> image = surface.capture();
            if (image.isEmpty()) {
                return;
            }
            Optional<byte[]> jpeg = caps.imageEncoder().encode(image.get(),
                    config.getVideoWidth(), config.getVideoHeight(), config.getVideoQuality());
            if (jpeg.isEmpty()) {
                log.debug("Image encoder produced no output");
                return;
            }
            long sequence = nextSequence;
            nextSequence = (nextSequence + 1) & 0xFFFFFFFFL;
            channel.send(FrameCodec.encode(clientId, nowNanos(), sequence, jpeg.get()));
            stats.recordFrameSent();
        } catch (IOException | RuntimeException e) {
            log.warn("Video frame not sent: {}", e.toString());
        }
    }

    void sweepFrames() {
        if (states.get(LegKind.VIEW_VIDEO) != LegState.ACTIVE) {
            return;
        }
        List<String> evicted = cache.sweep(nowNanos());
        stats.recordEvicted(evicted.size());
        evicted.forEach(events::sourceRemoved);
    }

    // ---------------------------------------------------------------------
    // Entrada
    // ---------------------------------------------------------------------

    private void handleVideoFrame(long generation, byte[] data) {
        if (!slots.get(ChannelFamily.VIDEO).isGeneration(generation)
                || states.get(LegKind.VIEW_VIDEO) != LegState.ACTIVE) {
            return;
        }
        VideoFrameEnvelope frame;
        try {
            frame = FrameCodec.decode(data);
        } catch (FrameDecodeException e) {
            stats.recordFrameDropped(e.getError().name());
            log.debug("Dropped undecodable frame: {}", e.getMessage());
            return;
        }
        long now = nowNanos();
        ValidationResult verdict = FrameValidator.validate(frame, config, now);
        if (!verdict.accepted()) {
            stats.recordFrameDropped(verdict.reason().name());
            log.debug("Dropped frame from {} seq={}: {}", frame.participantId(), frame.sequenceNumber(),
                    verdict.reason());
            return;
        }
        try {
            String id = frame.participantId();
            FrameHandle handle = caps.frameHandles().create(id, frame.payload());
            UpsertResult upsert = cache.upsert(id, handle, frame.sequenceNumber(), now);
            stats.recordFrameAccepted();
            if (upsert.newParticipant()) {
                log.info("New video source {}", id);
                events.sourceAdded(id, handle);
            } else {
                events.frameUpdated(id, handle);
            }
        } catch (RuntimeException e) {
            log.warn("Frame from {} not cached: {}", frame.participantId(), e.toString());
        }
    }

    private void handleSignal(ChannelFamily family, long generation, SignalingMessage msg) {
        ChannelSlot slot = slots.get(family);
        if (!slot.isGeneration(generation)) {
            log.debug("Ignoring {} from superseded {} channel", msg, family);
            return;
        }
        MDC.put("family", family.name());
        MDC.put("clientId", clientId);
        try {
            switch (msg.getType()) {
                case SignalingMessage.ANSWER -> applyAnswer(slot, msg.getSdp());
                case SignalingMessage.ICE_CANDIDATE -> addRemoteCandidate(slot, msg.getCandidate());
                case SignalingMessage.VIDEO_ADD -> {
                    if (family == ChannelFamily.VIDEO) {
                        log.info("Video source entered range {}", msg.getClientId());
                    }
                }
                case SignalingMessage.VIDEO_REMOVE -> {
                    if (family == ChannelFamily.VIDEO) {
                        removeSource(msg.getClientId());
                    }
                }
                case SignalingMessage.ERROR -> log.warn("{} signaling error: {}", family, msg.getMessage());
                default -> log.debug("Ignoring {} message type {}", family, msg.getType());
            }
        } catch (RuntimeException e) {
            log.warn("Handling {} on {} failed: {}", msg, family, e.toString());
        } finally {
            MDC.clear();
        }
    }

    private void applyAnswer(ChannelSlot slot, String sdp) {
        PeerLink link = slot.peerLink();
        if (link == null || sdp == null) {
            log.debug("No {} link for answer", slot.family());
            return;
        }
        link.applyAnswer(sdp).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Setting {} answer failed: {}", slot.family(), unwrap(error).toString());
            } else {
                log.info("{} answer applied", slot.family());
            }
        });
    }

    private void addRemoteCandidate(ChannelSlot slot, String candidate) {
        PeerLink link = slot.peerLink();
        if (link == null || candidate == null) {
            return;
        }
        if (slot.family() == ChannelFamily.VIDEO && !link.hasRemoteDescription()) {
            log.debug("Dropping video ICE candidate received before the answer");
            return;
        }
        link.addRemoteCandidate(candidate).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Adding {} ICE candidate failed: {}", slot.family(), unwrap(error).toString());
            }
        });
    }

    private void removeSource(String participantId) {
        if (participantId == null) {
            return;
        }
        if (cache.remove(participantId)) {
            log.info("Video source left range {}", participantId);
            events.sourceRemoved(participantId);
        }
    }

    private void handleLinkFailure(ChannelFamily family, long generation, Throwable cause) {
        if (!slots.get(family).isGeneration(generation)) {
            return;
        }
        boolean affected = false;
        for (LegKind leg : LegKind.values()) {
            if (leg.family() != family) {
                continue;
            }
            LegState state = states.get(leg);
            if (state == LegState.STARTING) {
                affected = true;
                epochs.merge(leg, 1L, Long::sum);
                CompletableFuture<Void> wait = readinessWaits.remove(leg);
                if (wait != null) {
                    wait.cancel(false);
                }
                log.warn("{} start failed, {} peer link failed", leg, family);
                abandonStart(leg, new CapabilityAcquisitionException(leg, cause), pendingStarts.remove(leg));
            } else if (state == LegState.ACTIVE) {
                affected = true;
                doStop(leg);
            }
        }
        if (affected) {
            events.error(family.name().toLowerCase() + " peer link failed", cause);
        }
    }

    // ---------------------------------------------------------------------
    // Utilidades
    // ---------------------------------------------------------------------

    private void sendSignal(ChannelSlot slot, SignalingMessage message) throws IOException {
        SignalingConnection connection = slot.signaling();
        if (connection == null || !connection.isOpen()) {
            throw new IOException(slot.family() + " signaling socket is not open");
        }
        connection.send(message);
    }

    private boolean isCurrent(LegKind leg, long epoch) {
        return epochs.get(leg) == epoch && states.get(leg) == LegState.STARTING;
    }

    private boolean isFamilyUsable(ChannelFamily family) {
        ChannelSlot slot = slots.get(family);
        if (!slot.isSignalingOpen() || slot.peerLink() == null) {
            return false;
        }
        return family != ChannelFamily.VIDEO || slot.isDataChannelOpen();
    }

    private boolean isFamilyRequested(ChannelFamily family) {
        for (LegKind leg : LegKind.values()) {
            if (leg.family() == family && states.get(leg).isRequested()) {
                return true;
            }
        }
        return false;
    }

    private long nowNanos() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    private static CancellationException staleStart(LegKind leg) {
        return new CancellationException(leg + " stopped while starting");
    }

    private static CancellationException superseded(ChannelFamily family) {
        return new CancellationException(family + " channel was closed while connecting");
    }

    private static String describe(LegKind leg) {
        return leg.label() + (leg.family() == ChannelFamily.AUDIO ? " audio" : " video");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ---------------------------------------------------------------------
    // Receptores de capacidades: todos saltan al executor de la sesión
    // ---------------------------------------------------------------------

    private class FamilySignalingListener implements SignalingListener {
        private final ChannelFamily family;
        private final long generation;

        FamilySignalingListener(ChannelFamily family, long generation) {
            this.family = family;
            this.generation = generation;
        }

        @Override
        public void onMessage(SignalingMessage message) {
            executor.execute(() -> handleSignal(family, generation, message));
        }

        @Override
        public void onClosed() {
            executor.execute(() -> {
                if (slots.get(family).isGeneration(generation)) {
                    log.info("{} signaling socket closed by server", family);
                }
            });
        }
    }

    private class FamilyPeerListener implements PeerLinkListener {
        private final ChannelFamily family;
        private final long generation;

        FamilyPeerListener(ChannelFamily family, long generation) {
            this.family = family;
            this.generation = generation;
        }

        @Override
        public void onLocalCandidate(String candidateJson) {
            executor.execute(() -> {
                ChannelSlot slot = slots.get(family);
                if (!slot.isGeneration(generation) || !slot.isSignalingOpen()) {
                    return;
                }
                try {
                    sendSignal(slot, SignalingMessage.iceCandidate(clientId, candidateJson));
                } catch (IOException | RuntimeException e) {
                    log.warn("{} ICE candidate not sent: {}", family, e.toString());
                }
            });
        }

        @Override
        public void onRemoteAudioTrack(RemoteAudioTrack track) {
            executor.execute(() -> {
                AudioOutput output = audioOutput;
                if (family != ChannelFamily.AUDIO || !slots.get(family).isGeneration(generation)
                        || !states.get(LegKind.LISTEN_AUDIO).isRequested()) {
                    return;
                }
                if (output == null) {
                    log.warn("Received mixed audio track {} but no audio output is bound", track.id());
                    return;
                }
                log.info("Playing mixed audio track {}", track.id());
                output.play(track, config.getAudioVolume());
            });
        }

        @Override
        public void onConnectionFailed(Throwable cause) {
            executor.execute(() -> handleLinkFailure(family, generation, cause));
        }
    }

    private class VideoChannelListener implements DataChannelListener {
        private final long generation;

        VideoChannelListener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onOpen() {
            log.info("Video data channel open generation={}", generation);
        }

        @Override
        public void onClose() {
            log.info("Video data channel closed generation={}", generation);
        }

        @Override
        public void onBinary(byte[] data) {
            executor.execute(() -> handleVideoFrame(generation, data));
        }

        @Override
        public void onText(String text) {
            executor.execute(() -> {
                try {
                    handleSignal(ChannelFamily.VIDEO, generation, codec.read(text));
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable video channel message: {}", e.getOriginalMessage());
                }
            });
        }
    }
}
