package edu.eci.arsw.spatial.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Conversión JSON de los mensajes de señalización.
 */
public class SignalingCodec {

    private final ObjectMapper om;

    public SignalingCodec() {
        this(new ObjectMapper());
    }

    public SignalingCodec(ObjectMapper om) {
        this.om = om;
    }

    public String write(SignalingMessage message) throws JsonProcessingException {
        return om.writeValueAsString(message);
    }

    /**
     * @param json Texto recibido.
     * @return El mensaje leído.
     * @throws JsonProcessingException Si el texto no es JSON válido o no tiene {@code type}.
     */
    public SignalingMessage read(String json) throws JsonProcessingException {
        SignalingMessage message = om.readValue(json, SignalingMessage.class);
        if (message == null || message.getType() == null) {
            throw new MissingTypeException(json);
        }
        return message;
    }

    static class MissingTypeException extends JsonProcessingException {
        MissingTypeException(String json) {
            super("Signaling message without type: " + (json.length() > 200 ? json.substring(0, 200) + "…" : json));
        }
    }
}
