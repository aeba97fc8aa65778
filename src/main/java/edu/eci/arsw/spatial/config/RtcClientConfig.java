package edu.eci.arsw.spatial.config;

import de.huxhorn.sulky.ulid.ULID;
import edu.eci.arsw.spatial.cache.ByteArrayFrameHandle;
import edu.eci.arsw.spatial.cache.FrameHandleFactory;
import edu.eci.arsw.spatial.capability.ImageEncoder;
import edu.eci.arsw.spatial.capability.JpegImageEncoder;
import edu.eci.arsw.spatial.capability.MediaCapability;
import edu.eci.arsw.spatial.capability.PeerLinkCapability;
import edu.eci.arsw.spatial.domain.IceServer;
import edu.eci.arsw.spatial.domain.SessionConfig;
import edu.eci.arsw.spatial.service.FrameStatsService;
import edu.eci.arsw.spatial.service.SessionCapabilities;
import edu.eci.arsw.spatial.service.SessionController;
import edu.eci.arsw.spatial.signaling.SignalingCodec;
import edu.eci.arsw.spatial.signaling.SignalingTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuración de la sesión: valores de {@code spatial.rtc.*}, servidores ICE,
 * contexto de ejecución y el controlador, que solo se crea cuando la aplicación
 * aporta las capacidades de medios y de enlace.
 */
@AutoConfiguration(after = WebSocketClientConfig.class)
public class RtcClientConfig {

    @Value("${spatial.rtc.server-url:ws://localhost:9090}")
    private String serverUrl;
    @Value("${spatial.rtc.client-id:}")
    private String clientId;

    @Value("${spatial.rtc.video.frame-rate:30}")
    private int videoFrameRate;
    @Value("${spatial.rtc.video.width:64}")
    private int videoWidth;
    @Value("${spatial.rtc.video.height:64}")
    private int videoHeight;
    @Value("${spatial.rtc.video.quality:0.8}")
    private double videoQuality;
    @Value("${spatial.rtc.audio.volume:1.0}")
    private double audioVolume;
    @Value("${spatial.rtc.max-hearing-range:50.0}")
    private double maxHearingRange;

    @Value("${spatial.rtc.stun.urls:stun:stun.l.google.com:19302}")
    private String stunUrlsCsv;
    @Value("${spatial.rtc.turn.urls:}")
    private String turnUrlsCsv;
    @Value("${spatial.rtc.turn.username:}")
    private String turnUser;
    @Value("${spatial.rtc.turn.password:}")
    private String turnPass;

    @Value("${spatial.rtc.stale-frame-threshold-ms:1000}")
    private long staleFrameThresholdMs;
    @Value("${spatial.rtc.eviction-sweep-interval-ms:1000}")
    private long evictionSweepIntervalMs;
    @Value("${spatial.rtc.eviction-age-ms:2000}")
    private long evictionAgeMs;
    @Value("${spatial.rtc.data-channel-open-timeout-ms:5000}")
    private long dataChannelOpenTimeoutMs;
    @Value("${spatial.rtc.readiness-poll-interval-ms:100}")
    private long readinessPollIntervalMs;

    private final ULID ulid = new ULID();

    /**
     * Construye la configuración de sesión validada a partir de las propiedades.
     *
     * @return Configuración inmutable.
     */
    @Bean
    @ConditionalOnMissingBean
    public SessionConfig sessionConfig() {
        return SessionConfig.builder()
                .serverUrl(serverUrl)
                .videoFrameRate(videoFrameRate)
                .videoWidth(videoWidth)
                .videoHeight(videoHeight)
                .videoQuality(videoQuality)
                .audioVolume(audioVolume)
                .maxHearingRange(maxHearingRange)
                .iceServers(iceServers())
                .staleFrameThresholdMs(staleFrameThresholdMs)
                .evictionSweepIntervalMs(evictionSweepIntervalMs)
                .evictionAgeMs(evictionAgeMs)
                .dataChannelOpenTimeoutMs(dataChannelOpenTimeoutMs)
                .readinessPollIntervalMs(readinessPollIntervalMs)
                .build();
    }

    /**
     * Servidores ICE a partir de las listas CSV de STUN y TURN. TURN solo se
     * incluye si tiene URLs, usuario y contraseña.
     *
     * @return Lista de servidores ICE.
     */
    List<IceServer> iceServers() {
        List<IceServer> list = new ArrayList<>();

        // STUN
        for (String u : stunUrlsCsv.split("\\s*,\\s*")) {
            if (!u.isBlank())
                list.add(IceServer.stun(u));
        }
        // TURN
        if (!turnUrlsCsv.isBlank() && !turnUser.isBlank() && !turnPass.isBlank()) {
            List<String> urls = Arrays.stream(turnUrlsCsv.split("\\s*,\\s*"))
                    .filter(s -> !s.isBlank()).toList();
            if (!urls.isEmpty()) {
                list.add(new IceServer(urls, turnUser, turnPass));
            }
        }
        return list;
    }

    /**
     * Identidad del cliente: la configurada, o un ULID nuevo si está vacía.
     */
    String resolveClientId() {
        return clientId == null || clientId.isBlank() ? ulid.nextULID() : clientId.trim();
    }

    /**
     * Contexto de ejecución de la sesión: un solo hilo para los cambios de estado
     * y los temporizadores.
     *
     * @return Planificador de un hilo.
     */
    @Bean
    @ConditionalOnMissingBean(name = "rtcTaskScheduler")
    public ThreadPoolTaskScheduler rtcTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("spatial-rtc-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public FrameStatsService frameStatsService(ObjectProvider<MeterRegistry> registry) {
        return new FrameStatsService(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ImageEncoder imageEncoder() {
        return new JpegImageEncoder();
    }

    @Bean
    @ConditionalOnMissingBean
    public FrameHandleFactory frameHandleFactory() {
        return ByteArrayFrameHandle::new;
    }

    /**
     * Controlador de la sesión. Al cerrar el contexto se desconecta.
     */
    @Bean(destroyMethod = "disconnect")
    @ConditionalOnBean({MediaCapability.class, PeerLinkCapability.class, SignalingTransport.class})
    @ConditionalOnMissingBean
    public SessionController sessionController(SessionConfig sessionConfig,
                                               MediaCapability media,
                                               PeerLinkCapability peerLinks,
                                               SignalingTransport signaling,
                                               SignalingCodec signalingCodec,
                                               ImageEncoder imageEncoder,
                                               FrameHandleFactory frameHandles,
                                               @Qualifier("rtcTaskScheduler") ThreadPoolTaskScheduler scheduler,
                                               FrameStatsService stats) {
        SessionCapabilities caps = new SessionCapabilities(media, peerLinks, signaling, imageEncoder, frameHandles);
        return new SessionController(resolveClientId(), sessionConfig, caps, signalingCodec, scheduler,
                scheduler, Clock.systemUTC(), stats);
    }
}
