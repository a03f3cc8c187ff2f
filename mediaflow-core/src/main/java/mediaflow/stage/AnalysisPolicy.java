package mediaflow.stage;

import mediaflow.MediaKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout ceilings for calls into the inference backend.
 *
 * @param uploadTimeout ceiling for one upload
 * @param videoTimeout  ceiling for analysing a video
 * @param imageTimeout  ceiling for analysing an image
 */
public record AnalysisPolicy(Duration uploadTimeout, Duration videoTimeout, Duration imageTimeout) {
    public AnalysisPolicy {
        requirePositive(uploadTimeout, "uploadTimeout");
        requirePositive(videoTimeout, "videoTimeout");
        requirePositive(imageTimeout, "imageTimeout");
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * 120 seconds for uploads and videos, 45 seconds for images.
     */
    public static AnalysisPolicy defaults() {
        return new AnalysisPolicy(Duration.ofSeconds(120), Duration.ofSeconds(120), Duration.ofSeconds(45));
    }

    public Duration timeoutFor(MediaKind kind) {
        return kind == MediaKind.VIDEO ? videoTimeout : imageTimeout;
    }
}
