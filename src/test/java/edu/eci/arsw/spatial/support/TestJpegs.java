package edu.eci.arsw.spatial.support;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JPEG reales generados con ImageIO para las pruebas.
 */
public final class TestJpegs {

    private TestJpegs() {
    }

    public static BufferedImage image(int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(Color.ORANGE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLUE);
            g.fillOval(0, 0, Math.max(1, width / 2), Math.max(1, height / 2));
        } finally {
            g.dispose();
        }
        return img;
    }

    public static byte[] jpeg(int width, int height) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image(width, height), "jpg", out)) {
                throw new IllegalStateException("No JPEG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
