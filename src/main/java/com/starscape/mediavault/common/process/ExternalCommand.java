package com.starscape.mediavault.common.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (ffprobe, ffmpeg) with a timeout and captures their standard output.
 */
@Component
public class ExternalCommand {
    
    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);
    
    public record Result(int exitCode, String output) {
        
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
    
    /**
     * @throws ToolUnavailableException if the executable cannot be started
     * @throws IOException if the process times out or its output cannot be read
     */
    public Result run(List<String> command, Duration timeout) throws IOException {
        Path stdout = Files.createTempFile("media-vault-cmd-", ".out");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD);
            
            Process process;
            try {
                process = processBuilder.start();
            } catch (IOException e) {
                throw new ToolUnavailableException(command.get(0), e);
            }
            
            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new IOException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException(command.get(0) + " was interrupted", e);
            }
            
            String output = Files.readString(stdout, StandardCharsets.UTF_8);
            log.debug("{} exited with {}", command.get(0), process.exitValue());
            return new Result(process.exitValue(), output);
        } finally {
            Files.deleteIfExists(stdout);
        }
    }
    
    /**
     * The executable is not installed or not on the PATH.
     */
    public static class ToolUnavailableException extends IOException {
        
        public ToolUnavailableException(String tool, Throwable cause) {
            super(tool + " is not available. Install it and make sure it's on the PATH.", cause);
        }
    }
}
