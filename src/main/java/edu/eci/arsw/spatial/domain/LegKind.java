package edu.eci.arsw.spatial.domain;

/**
 * Las cuatro capacidades independientes que puede activar un participante.
 */
public enum LegKind {
    SEND_AUDIO(ChannelFamily.AUDIO, "sending"),
    LISTEN_AUDIO(ChannelFamily.AUDIO, "listening"),
    SEND_VIDEO(ChannelFamily.VIDEO, "sending"),
    VIEW_VIDEO(ChannelFamily.VIDEO, "viewing");

    private final ChannelFamily family;
    private final String label;

    LegKind(ChannelFamily family, String label) {
        this.family = family;
        this.label = label;
    }

    public ChannelFamily family() {
        return family;
    }

    /**
     * Nombre corto usado en los eventos de estado ("sending", "listening", "viewing").
     */
    public String label() {
        return label;
    }

    /**
     * Devuelve la otra pata que comparte la misma familia de canal.
     *
     * @return La pata hermana.
     */
    public LegKind sibling() {
        return switch (this) {
            case SEND_AUDIO -> LISTEN_AUDIO;
            case LISTEN_AUDIO -> SEND_AUDIO;
            case SEND_VIDEO -> VIEW_VIDEO;
            case VIEW_VIDEO -> SEND_VIDEO;
        };
    }
}
