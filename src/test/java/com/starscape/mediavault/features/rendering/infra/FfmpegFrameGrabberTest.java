package com.starscape.mediavault.features.rendering.infra;

import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.process.ExternalCommand;
import com.starscape.mediavault.features.metadata.infra.FfprobeVideoProbe;
import com.starscape.mediavault.features.rendering.domain.RenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FfmpegFrameGrabberTest {
    
    @TempDir
    Path tempDir;
    
    private ExternalCommand externalCommand;
    private FfprobeVideoProbe videoProbe;
    private FfmpegFrameGrabber grabber;
    private Path video;
    
    @BeforeEach
    void setUp() throws IOException {
        externalCommand = mock(ExternalCommand.class);
        videoProbe = mock(FfprobeVideoProbe.class);
        grabber = new FfmpegFrameGrabber(externalCommand, videoProbe, new ProcessingProperties());
        video = Files.writeString(tempDir.resolve("clip.mp4"), "video");
    }
    
    @Test
    void seeksTenPercentInCappedAtFiveSeconds() {
        assertEquals(0.0, FfmpegFrameGrabber.seekPosition(null));
        assertEquals(0.0, FfmpegFrameGrabber.seekPosition(0.0));
        assertEquals(1.2, FfmpegFrameGrabber.seekPosition(12.0), 1e-9);
        assertEquals(5.0, FfmpegFrameGrabber.seekPosition(600.0));
    }
    
    @Test
    void writesTheFrameToATemporaryFile() throws Exception {
        when(videoProbe.durationOf(video)).thenReturn(20.0);
        AtomicReference<List<String>> ran = new AtomicReference<>();
        when(externalCommand.run(anyList(), any(Duration.class))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            ran.set(command);
            Files.writeString(Path.of(command.get(command.size() - 1)), "jpeg");
            return new ExternalCommand.Result(0, "");
        });
        
        Path frame = grabber.grabFrame(video);
        try {
            assertEquals("jpeg", Files.readString(frame));
            assertEquals("ffmpeg", ran.get().get(0));
            assertEquals("2.000", ran.get().get(ran.get().indexOf("-ss") + 1));
        } finally {
            Files.deleteIfExists(frame);
        }
    }
    
    @Test
    void emptyOutputIsADecodeFailure() throws Exception {
        when(videoProbe.durationOf(video)).thenReturn(null);
        when(externalCommand.run(anyList(), any(Duration.class))).thenReturn(new ExternalCommand.Result(1, "error"));
        
        RenderException e = assertThrows(RenderException.class, () -> grabber.grabFrame(video));
        
        assertEquals(RenderException.Reason.DECODE_FAILED, e.getReason());
    }
    
    @Test
    void missingFfmpegIsReportedAsUnavailable() throws Exception {
        when(videoProbe.durationOf(video)).thenReturn(10.0);
        when(externalCommand.run(anyList(), any(Duration.class)))
            .thenThrow(new ExternalCommand.ToolUnavailableException("ffmpeg", new IOException("No such file")));
        
        RenderException e = assertThrows(RenderException.class, () -> grabber.grabFrame(video));
        
        assertEquals(RenderException.Reason.TOOL_UNAVAILABLE, e.getReason());
    }
    
    @Test
    void unreadableDurationStillGrabsFirstFrame() throws Exception {
        when(videoProbe.durationOf(video)).thenThrow(new IOException("bad output"));
        AtomicReference<List<String>> ran = new AtomicReference<>();
        when(externalCommand.run(anyList(), any(Duration.class))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            ran.set(command);
            Files.writeString(Path.of(command.get(command.size() - 1)), "jpeg");
            return new ExternalCommand.Result(0, "");
        });
        
        Path frame = grabber.grabFrame(video);
        Files.deleteIfExists(frame);
        
        assertEquals("0.000", ran.get().get(ran.get().indexOf("-ss") + 1));
    }
}
