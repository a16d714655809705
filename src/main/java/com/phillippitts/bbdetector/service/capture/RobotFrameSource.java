package com.phillippitts.bbdetector.service.capture;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * {@link FrameSource} over {@code java.awt.Robot} for the configured monitor.
 * Requires Screen Recording permission on macOS; reports unavailable when headless.
 *
 * For hermetic tests, ScreenFacade can be replaced.
 */
@Component
public class RobotFrameSource implements FrameSource {

    private static final Logger LOG = LogManager.getLogger(RobotFrameSource.class);

    interface ScreenFacade {
        /** Monitor bounds in virtual-screen coordinates. */
        Rectangle bounds();

        BufferedImage capture(Rectangle area);
    }

    static final class AwtScreenFacade implements ScreenFacade {
        private final Robot robot;
        private final Rectangle bounds;

        AwtScreenFacade(int monitor) throws Exception {
            GraphicsDevice[] screens = GraphicsEnvironment.getLocalGraphicsEnvironment().getScreenDevices();
            if (monitor >= screens.length) {
                throw new IllegalArgumentException("monitor " + monitor + " not present (" + screens.length + " found)");
            }
            this.bounds = screens[monitor].getDefaultConfiguration().getBounds();
            this.robot = new Robot();
        }

        @Override
        public Rectangle bounds() {
            return new Rectangle(bounds);
        }

        @Override
        public BufferedImage capture(Rectangle area) {
            return robot.createScreenCapture(area);
        }
    }

    private final ScreenFacade screen;

    @Autowired
    public RobotFrameSource(DetectionProperties props) {
        this(createScreenFacade(props.getMonitor()));
    }

    // Package-private for tests
    RobotFrameSource(ScreenFacade screen) {
        this.screen = screen; // null when capture is unavailable
    }

    private static ScreenFacade createScreenFacade(int monitor) {
        if (GraphicsEnvironment.isHeadless()) {
            LOG.warn("Headless environment; screen capture unavailable");
            return null;
        }
        try {
            return new AwtScreenFacade(monitor);
        } catch (Exception | LinkageError e) {
            LOG.warn("Screen capture unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public boolean isAvailable() {
        return screen != null;
    }

    @Override
    public Optional<Frame> grab() {
        if (screen == null) {
            return Optional.empty();
        }
        return capture(screen.bounds());
    }

    @Override
    public Optional<Frame> grabRegion(int x, int y, int width, int height) {
        if (screen == null) {
            return Optional.empty();
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("region must have a positive size, got " + width + "x" + height);
        }
        Rectangle monitor = screen.bounds();
        Rectangle area = new Rectangle(monitor.x + x, monitor.y + y, width, height).intersection(monitor);
        if (area.isEmpty()) {
            LOG.debug("Region {}x{}@{},{} lies outside the monitor", width, height, x, y);
            return Optional.empty();
        }
        return capture(area);
    }

    private Optional<Frame> capture(Rectangle area) {
        BufferedImage image;
        try {
            image = screen.capture(area);
        } catch (RuntimeException e) {
            LOG.debug("Screen capture failed: {}", e.toString());
            return Optional.empty();
        }
        return image == null ? Optional.empty() : Optional.of(Frame.of(image));
    }
}
