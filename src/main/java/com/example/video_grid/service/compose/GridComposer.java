package com.example.video_grid.service.compose;

import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.exception.CompositionException;
import com.example.video_grid.model.DisplaySize;
import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.GridConfig;
import com.example.video_grid.util.AspectMode;
import com.example.video_grid.util.BackgroundTheme;
import com.example.video_grid.util.TimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Lays selected frames out into one contact-sheet image and writes it as JPEG.
 */
@Service
public class GridComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GridComposer.class);

    static final int BORDER_WIDTH = 2;
    static final int FRAME_PADDING = 8;
    static final int TITLE_HEIGHT = 90;
    static final int TITLE_MARGIN = 20;
    static final int BOTTOM_PADDING = 20;
    static final int CORNER_RADIUS = 3;
    static final int TIMESTAMP_INSET = 10;
    static final float JPEG_QUALITY = 0.92f;
    static final double DEFAULT_ASPECT = 16.0 / 9.0;
    private static final int MAX_WRITE_ATTEMPTS = 100;

    private static final Font TITLE_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 20);
    private static final Font TIMESTAMP_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 18);

    private final VideoAssetAdapter adapter;
    private final OutputPathResolver pathResolver;

    public GridComposer(VideoAssetAdapter adapter, OutputPathResolver pathResolver) {
        this.adapter = adapter;
        this.pathResolver = pathResolver;
    }

    /**
     * Renders and writes the grid.
     *
     * @return path of the written JPEG.
     * @throws CompositionException when there is nothing to draw or the encoder yields no bytes.
     * @throws IOException          when the file cannot be written.
     */
    public Path compose(List<ExtractedFrame> frames, Path source, GridConfig config, @Nullable Path outputFolder)
            throws IOException {
        if (frames == null || frames.isEmpty()) {
            throw new CompositionException("No frames to compose for " + source.getFileName());
        }
        long t0 = System.nanoTime();
        double aspect = determineAspectRatio(source, frames, config);
        BufferedImage grid = render(frames, source, config, aspect, durationLabel(source));
        byte[] jpeg = encodeJpeg(grid);
        if (jpeg.length == 0) {
            throw new CompositionException("JPEG encoder produced no data for " + source.getFileName());
        }
        Path output = write(jpeg, source, config, outputFolder);
        LOGGER.info("GRID WRITTEN path={} dims={}x{} size={}B in={}ms",
                output, grid.getWidth(), grid.getHeight(), jpeg.length, (System.nanoTime() - t0) / 1_000_000);
        return output;
    }

    /**
     * Native display size first, then the first frame, then 16:9. Only Source mode asks.
     */
    double determineAspectRatio(Path source, List<ExtractedFrame> frames, GridConfig config) {
        if (config.aspectMode() != AspectMode.SOURCE) {
            return DEFAULT_ASPECT;
        }
        Optional<DisplaySize> display = adapter.getNativeDisplaySize(source);
        if (display.isPresent() && display.get().width() > 0 && display.get().height() > 0) {
            return display.get().aspectRatio();
        }
        if (!frames.isEmpty()) {
            BufferedImage first = frames.get(0).image();
            if (first.getWidth() > 0 && first.getHeight() > 0) {
                LOGGER.debug("Display size unknown for {}, using first frame {}x{}", source.getFileName(), first.getWidth(), first.getHeight());
                return (double) first.getWidth() / first.getHeight();
            }
        }
        return DEFAULT_ASPECT;
    }

    static Layout layout(GridConfig config, double aspectRatio) {
        int columns = config.columns();
        int rows = config.rows();
        int totalPadding = FRAME_PADDING * (columns + 1) + BORDER_WIDTH * 2 * columns;
        int thumbWidth = (config.targetWidthPx() - totalPadding) / columns;
        int thumbHeight = config.aspectMode() == AspectMode.SOURCE
                ? (int) (thumbWidth / aspectRatio)
                : (int) (thumbWidth * 9.0 / 16.0);
        if (thumbWidth <= 0 || thumbHeight <= 0) {
            throw new CompositionException("Target width " + config.targetWidthPx() + "px is too small for "
                    + columns + " columns");
        }
        int width = (thumbWidth + BORDER_WIDTH * 2) * columns + FRAME_PADDING * (columns + 1);
        int height = (thumbHeight + BORDER_WIDTH * 2) * rows + FRAME_PADDING * (rows + 1) + TITLE_HEIGHT + BOTTOM_PADDING;
        return new Layout(thumbWidth, thumbHeight, width, height);
    }

    BufferedImage render(List<ExtractedFrame> frames, Path source, GridConfig config, double aspectRatio, String duration) {
        Layout layout = layout(config, aspectRatio);
        BackgroundTheme theme = config.backgroundTheme();
        int capacity = config.frameCount();
        if (frames.size() > capacity) {
            LOGGER.warn("GRID overflow frames={} cells={}; extra frames dropped", frames.size(), capacity);
        }

        BufferedImage canvas = new BufferedImage(layout.width(), layout.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            g.setColor(theme.background());
            g.fillRect(0, 0, layout.width(), layout.height());

            drawTitle(g, layout, theme, source.getFileName() + "  •  " + config.rows() + "×" + config.columns() + "  •  " + duration);

            int cellWidth = layout.thumbWidth() + BORDER_WIDTH * 2;
            int cellHeight = layout.thumbHeight() + BORDER_WIDTH * 2;
            for (int i = 0; i < Math.min(frames.size(), capacity); i++) {
                int col = i % config.columns();
                int row = i / config.columns();
                int x = FRAME_PADDING + col * (cellWidth + FRAME_PADDING);
                int y = TITLE_HEIGHT + FRAME_PADDING + row * (cellHeight + FRAME_PADDING);
                drawCell(g, frames.get(i), config, layout, x, y);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    private void drawTitle(Graphics2D g, Layout layout, BackgroundTheme theme, String title) {
        Color bg = theme.background();
        g.setComposite(AlphaComposite.SrcOver);
        g.setColor(new Color(bg.getRed(), bg.getGreen(), bg.getBlue(), Math.round(0.3f * 255)));
        g.fillRect(0, 0, layout.width(), TITLE_HEIGHT);

        g.setFont(TITLE_FONT);
        g.setColor(theme.foreground());
        FontMetrics fm = g.getFontMetrics();
        Shape oldClip = g.getClip();
        g.clipRect(TITLE_MARGIN, 0, Math.max(0, layout.width() - TITLE_MARGIN * 2), TITLE_HEIGHT);
        int baseline = (TITLE_HEIGHT - fm.getHeight()) / 2 + fm.getAscent();
        g.drawString(title, TITLE_MARGIN, baseline);
        g.setClip(oldClip);
    }

    private void drawCell(Graphics2D g, ExtractedFrame frame, GridConfig config, Layout layout, int x, int y) {
        BackgroundTheme theme = config.backgroundTheme();
        int tw = layout.thumbWidth();
        int th = layout.thumbHeight();

        g.setColor(theme.foreground());
        g.fill(new RoundRectangle2D.Double(x, y, tw + BORDER_WIDTH * 2, th + BORDER_WIDTH * 2,
                CORNER_RADIUS * 2, CORNER_RADIUS * 2));

        int ix = x + BORDER_WIDTH;
        int iy = y + BORDER_WIDTH;
        Shape oldClip = g.getClip();
        g.clip(new RoundRectangle2D.Double(ix, iy, tw, th, (CORNER_RADIUS - 1) * 2, (CORNER_RADIUS - 1) * 2));
        BufferedImage image = frame.image();
        if (config.aspectMode() == AspectMode.FILL) {
            double scale = Math.max((double) tw / image.getWidth(), (double) th / image.getHeight());
            int dw = (int) Math.ceil(image.getWidth() * scale);
            int dh = (int) Math.ceil(image.getHeight() * scale);
            g.drawImage(image, ix + (tw - dw) / 2, iy + (th - dh) / 2, dw, dh, null);
        } else {
            g.setColor(theme.background());
            g.fillRect(ix, iy, tw, th);
            double scale = Math.min((double) tw / image.getWidth(), (double) th / image.getHeight());
            int dw = Math.max(1, (int) Math.round(image.getWidth() * scale));
            int dh = Math.max(1, (int) Math.round(image.getHeight() * scale));
            g.drawImage(image, ix + (tw - dw) / 2, iy + (th - dh) / 2, dw, dh, null);
        }
        g.setClip(oldClip);

        if (config.showTimestamps()) {
            drawTimestamp(g, TimeFormat.timestamp(frame.timestampSeconds()), theme, ix, iy + th);
        }
    }

    private void drawTimestamp(Graphics2D g, String text, BackgroundTheme theme, int left, int bottom) {
        g.setFont(TIMESTAMP_FONT);
        FontMetrics fm = g.getFontMetrics();
        int tx = left + TIMESTAMP_INSET;
        int ty = bottom - TIMESTAMP_INSET - fm.getDescent();
        Color bg = theme.background();
        g.setColor(new Color(bg.getRed(), bg.getGreen(), bg.getBlue(), Math.round(0.9f * 255)));
        g.drawString(text, tx + 1, ty + 1);
        g.setColor(theme.foreground());
        g.drawString(text, tx, ty);
    }

    private String durationLabel(Path source) {
        try {
            return TimeFormat.duration(adapter.getDuration(source));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("No duration for title source={} err={}", source.getFileName(), e.toString());
            return "";
        }
    }

    static byte[] encodeJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new CompositionException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    private Path write(byte[] jpeg, Path source, GridConfig config, @Nullable Path outputFolder) throws IOException {
        for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
            Path target = pathResolver.resolve(source, config, outputFolder);
            try {
                Files.write(target, jpeg, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return target;
            } catch (FileAlreadyExistsException e) {
                LOGGER.debug("Output taken meanwhile path={}, retrying", target);
            }
        }
        throw new CompositionException("No free output name for " + source.getFileName() + " after "
                + MAX_WRITE_ATTEMPTS + " attempts");
    }

    record Layout(int thumbWidth, int thumbHeight, int width, int height) { }
}
