package edu.eci.arsw.spatial.signaling;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Mensaje de señalización JSON, usado tanto en los sockets de audio/video como
 * en los mensajes de texto del canal de datos de video.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalingMessage {
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";
    public static final String ICE_CANDIDATE = "ice-candidate";
    public static final String STOP_SENDING = "stop-sending";
    public static final String STOP_VIDEO = "stop-video";
    public static final String VIDEO_ADD = "video-add";
    public static final String VIDEO_REMOVE = "video-remove";
    public static final String ERROR = "error";

    private String type;
    private String clientId;
    private String sdp;
    private String candidate;
    private String message;

    public SignalingMessage() {
        // Constructor vacío necesario para Jackson
    }

    private SignalingMessage(String type, String clientId) {
        this.type = type;
        this.clientId = clientId;
    }

    public static SignalingMessage offer(String clientId, String sdp) {
        SignalingMessage m = new SignalingMessage(OFFER, clientId);
        m.sdp = sdp;
        return m;
    }

    public static SignalingMessage iceCandidate(String clientId, String candidate) {
        SignalingMessage m = new SignalingMessage(ICE_CANDIDATE, clientId);
        m.candidate = candidate;
        return m;
    }

    public static SignalingMessage stopSending(String clientId) {
        return new SignalingMessage(STOP_SENDING, clientId);
    }

    public static SignalingMessage stopVideo() {
        return new SignalingMessage(STOP_VIDEO, null);
    }

    public String getType() {
        return type;
    }

    public String getClientId() {
        return clientId;
    }

    public String getSdp() {
        return sdp;
    }

    public String getCandidate() {
        return candidate;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "SignalingMessage{type=" + type + ", clientId=" + clientId + "}";
    }
}
