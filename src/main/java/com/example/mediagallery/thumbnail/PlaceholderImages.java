package com.example.mediagallery.thumbnail;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * The fixed images shown instead of a decoded thumbnail. Drawn once per cache.
 */
final class PlaceholderImages {
    private static final Color BACKGROUND = new Color(0xE0, 0xE0, 0xE0);
    private static final Color INK = new Color(0x60, 0x60, 0x60);
    private static final Color ERROR = new Color(0xC0, 0x39, 0x2B);

    private final BufferedImage pending;
    private final BufferedImage failed;
    private final BufferedImage video;
    private final BufferedImage file;

    PlaceholderImages(int size) {
        this.pending = draw(size, PlaceholderImages::drawHourglass);
        this.failed = draw(size, PlaceholderImages::drawCross);
        this.video = draw(size, PlaceholderImages::drawPlayButton);
        this.file = draw(size, PlaceholderImages::drawPage);
    }

    BufferedImage pending() {
        return pending;
    }

    BufferedImage failed() {
        return failed;
    }

    BufferedImage video() {
        return video;
    }

    BufferedImage file() {
        return file;
    }

    private interface Painter {
        void paint(Graphics2D g, int size);
    }

    private static BufferedImage draw(int size, Painter painter) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, size, size);
            g.setStroke(new BasicStroke(Math.max(1f, size / 25f)));
            painter.paint(g, size);
        } finally {
            g.dispose();
        }
        return image;
    }

    private static void drawHourglass(Graphics2D g, int size) {
        int m = size / 4;
        g.setColor(INK);
        g.drawPolygon(new Polygon(new int[]{m, size - m, m, size - m}, new int[]{m, m, size - m, size - m}, 4));
    }

    private static void drawCross(Graphics2D g, int size) {
        int m = size / 4;
        g.setColor(ERROR);
        g.drawLine(m, m, size - m, size - m);
        g.drawLine(size - m, m, m, size - m);
    }

    private static void drawPlayButton(Graphics2D g, int size) {
        int m = size / 4;
        g.setColor(INK);
        g.fillPolygon(new Polygon(new int[]{m + m / 2, size - m, m + m / 2}, new int[]{m, size / 2, size - m}, 3));
    }

    private static void drawPage(Graphics2D g, int size) {
        int m = size / 5;
        g.setColor(INK);
        g.drawRect(m + m / 2, m, size - 3 * m, size - 2 * m);
    }
}
