package com.starscape.mediavault.features.rendering.infra;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.process.ExternalCommand;
import com.starscape.mediavault.features.metadata.infra.FfprobeVideoProbe;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Grabs a single poster frame from a video with ffmpeg. The frame is taken at
 * 10% of the duration, capped at five seconds, so it skips black lead-in
 * frames on long clips.
 */
@Component
public class FfmpegFrameGrabber {
    
    private static final Logger log = LoggerFactory.getLogger(FfmpegFrameGrabber.class);
    private static final double MAX_SEEK_SECONDS = 5.0;
    
    private final ExternalCommand externalCommand;
    private final FfprobeVideoProbe videoProbe;
    private final ProcessingProperties properties;
    
    public FfmpegFrameGrabber(ExternalCommand externalCommand, FfprobeVideoProbe videoProbe,
                              ProcessingProperties properties) {
        this.externalCommand = externalCommand;
        this.videoProbe = videoProbe;
        this.properties = properties;
    }
    
    /**
     * Write a JPEG frame of the video to a new temporary file. The caller deletes it.
     */
    public Path grabFrame(Path video) throws RenderException {
        double seek = seekPosition(probeDuration(video));
        Path frame;
        try {
            frame = Files.createTempFile("media-vault-frame-", ".jpg");
        } catch (IOException e) {
            throw new RenderException(RenderException.Reason.ENCODE_FAILED, "Cannot create temporary frame file", e);
        }
        
        List<String> command = List.of(
            properties.getFfmpegPath(),
            "-y",
            "-ss", String.format(Locale.ROOT, "%.3f", seek),
            "-i", video.toAbsolutePath().toString(),
            "-frames:v", "1",
            "-q:v", String.valueOf(properties.getVideoFrameQuality()),
            frame.toString()
        );
        
        try {
            ExternalCommand.Result result = externalCommand.run(command, properties.getToolTimeout());
            if (!result.succeeded() || Files.size(frame) == 0) {
                throw new RenderException(RenderException.Reason.DECODE_FAILED,
                    "ffmpeg could not extract a frame from " + video.getFileName() + " (exit " + result.exitCode() + ")");
            }
            return frame;
        } catch (ExternalCommand.ToolUnavailableException e) {
            deleteQuietly(frame);
            throw new RenderException(RenderException.Reason.TOOL_UNAVAILABLE, e.getMessage(), e);
        } catch (IOException e) {
            deleteQuietly(frame);
            throw new RenderException(RenderException.Reason.TOOL_FAILED,
                "ffmpeg failed on " + video.getFileName() + ": " + e.getMessage(), e);
        } catch (RenderException e) {
            deleteQuietly(frame);
            throw e;
        }
    }
    
    static double seekPosition(Double durationSeconds) {
        if (durationSeconds == null || durationSeconds <= 0) {
            return 0.0;
        }
        return Math.min(durationSeconds * 0.1, MAX_SEEK_SECONDS);
    }
    
    private Double probeDuration(Path video) throws RenderException {
        try {
            return videoProbe.durationOf(video);
        } catch (ExternalCommand.ToolUnavailableException e) {
            throw new RenderException(RenderException.Reason.TOOL_UNAVAILABLE, e.getMessage(), e);
        } catch (IOException e) {
            log.debug("Could not probe duration of {}, grabbing the first frame: {}", video.getFileName(), e.getMessage());
            return null;
        }
    }
    
    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary frame {}: {}", file, e.getMessage());
        }
    }
}
